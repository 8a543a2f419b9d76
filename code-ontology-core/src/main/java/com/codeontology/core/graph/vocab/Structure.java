package com.codeontology.core.graph.vocab;

import com.codeontology.core.graph.Iri;

/**
 * Terms of the structure vocabulary: modules, functions, types, behaviours, protocols and metaprogramming.
 */
public final class Structure {

    public static final String NS = "https://w3id.org/elixir-code/structure#";

    // Module classes
    public static final Iri MODULE = term("Module");
    public static final Iri NESTED_MODULE = term("NestedModule");
    public static final Iri MODULE_ALIAS = term("ModuleAlias");
    public static final Iri MODULE_IMPORT = term("ModuleImport");
    public static final Iri MODULE_REQUIRE = term("ModuleRequire");
    public static final Iri MODULE_USE = term("ModuleUse");

    // Function classes
    public static final Iri FUNCTION = term("Function");
    public static final Iri PUBLIC_FUNCTION = term("PublicFunction");
    public static final Iri PRIVATE_FUNCTION = term("PrivateFunction");
    public static final Iri GUARD_FUNCTION = term("GuardFunction");
    public static final Iri DELEGATED_FUNCTION = term("DelegatedFunction");
    public static final Iri PUBLIC_MACRO = term("PublicMacro");
    public static final Iri PRIVATE_MACRO = term("PrivateMacro");
    public static final Iri FUNCTION_CLAUSE = term("FunctionClause");
    public static final Iri FUNCTION_HEAD = term("FunctionHead");
    public static final Iri FUNCTION_BODY = term("FunctionBody");
    public static final Iri PARAMETER = term("Parameter");
    public static final Iri DEFAULT_PARAMETER = term("DefaultParameter");
    public static final Iri PATTERN_PARAMETER = term("PatternParameter");
    public static final Iri ANONYMOUS_FUNCTION = term("AnonymousFunction");
    public static final Iri CAPTURED_FUNCTION = term("CapturedFunction");
    public static final Iri PARTIAL_APPLICATION = term("PartialApplication");

    // Attribute classes
    public static final Iri MODULE_ATTRIBUTE = term("ModuleAttribute");
    public static final Iri FUNCTION_DOC_ATTRIBUTE = term("FunctionDocAttribute");
    public static final Iri MODULEDOC_ATTRIBUTE = term("ModuledocAttribute");
    public static final Iri TYPEDOC_ATTRIBUTE = term("TypedocAttribute");
    public static final Iri DEPRECATED_ATTRIBUTE = term("DeprecatedAttribute");
    public static final Iri SINCE_ATTRIBUTE = term("SinceAttribute");
    public static final Iri EXTERNAL_RESOURCE_ATTRIBUTE = term("ExternalResourceAttribute");
    public static final Iri COMPILE_ATTRIBUTE = term("CompileAttribute");
    public static final Iri ON_DEFINITION_ATTRIBUTE = term("OnDefinitionAttribute");
    public static final Iri BEFORE_COMPILE_ATTRIBUTE = term("BeforeCompileAttribute");
    public static final Iri AFTER_COMPILE_ATTRIBUTE = term("AfterCompileAttribute");
    public static final Iri DERIVE_ATTRIBUTE = term("DeriveAttribute");
    public static final Iri BEHAVIOUR_DECLARATION = term("BehaviourDeclaration");

    // Type classes
    public static final Iri PUBLIC_TYPE = term("PublicType");
    public static final Iri PRIVATE_TYPE = term("PrivateType");
    public static final Iri OPAQUE_TYPE = term("OpaqueType");
    public static final Iri FUNCTION_SPEC = term("FunctionSpec");
    public static final Iri CALLBACK_SPEC = term("CallbackSpec");
    public static final Iri MACRO_CALLBACK_SPEC = term("MacroCallbackSpec");
    public static final Iri OPTIONAL_CALLBACK_SPEC = term("OptionalCallbackSpec");
    public static final Iri BASIC_TYPE = term("BasicType");
    public static final Iri UNION_TYPE = term("UnionType");
    public static final Iri TUPLE_TYPE = term("TupleType");
    public static final Iri LIST_TYPE = term("ListType");
    public static final Iri MAP_TYPE = term("MapType");
    public static final Iri FUNCTION_TYPE = term("FunctionType");
    public static final Iri TYPE_VARIABLE = term("TypeVariable");
    public static final Iri PARAMETERIZED_TYPE = term("ParameterizedType");
    public static final Iri REMOTE_TYPE = term("RemoteType");
    public static final Iri LITERAL_TYPE = term("LiteralType");

    // Struct, behaviour and protocol classes
    public static final Iri STRUCT = term("Struct");
    public static final Iri EXCEPTION = term("Exception");
    public static final Iri STRUCT_FIELD = term("StructField");
    public static final Iri ENFORCED_KEY = term("EnforcedKey");
    public static final Iri BEHAVIOUR = term("Behaviour");
    public static final Iri CALLBACK = term("Callback");
    public static final Iri OPTIONAL_CALLBACK = term("OptionalCallback");
    public static final Iri MACRO_CALLBACK = term("MacroCallback");
    public static final Iri PROTOCOL = term("Protocol");
    public static final Iri PROTOCOL_FUNCTION = term("ProtocolFunction");
    public static final Iri PROTOCOL_IMPLEMENTATION = term("ProtocolImplementation");

    // Metaprogramming classes
    public static final Iri QUOTED_EXPRESSION = term("QuotedExpression");
    public static final Iri UNQUOTE_EXPRESSION = term("UnquoteExpression");
    public static final Iri UNQUOTE_SPLICING_EXPRESSION = term("UnquoteSplicingExpression");
    public static final Iri HYGIENE = term("Hygiene");
    public static final Iri MACRO_INVOCATION = term("MacroInvocation");

    // Module properties
    public static final Iri MODULE_NAME = term("moduleName");
    public static final Iri DOCSTRING = term("docstring");
    public static final Iri PARENT_MODULE = term("parentModule");
    public static final Iri HAS_NESTED_MODULE = term("hasNestedModule");
    public static final Iri ALIASES_MODULE = term("aliasesModule");
    public static final Iri IMPORTS_FROM = term("importsFrom");
    public static final Iri REQUIRES_MODULE = term("requiresModule");
    public static final Iri USES_MODULE = term("usesModule");
    public static final Iri CONTAINS_FUNCTION = term("containsFunction");
    public static final Iri CONTAINS_MACRO = term("containsMacro");
    public static final Iri CONTAINS_TYPE = term("containsType");
    public static final Iri CONTAINS_STRUCT = term("containsStruct");
    public static final Iri HAS_ATTRIBUTE = term("hasAttribute");

    // Directive properties
    public static final Iri HAS_ALIAS = term("hasAlias");
    public static final Iri ALIAS_NAME = term("aliasName");
    public static final Iri ALIASED_MODULE = term("aliasedModule");
    public static final Iri HAS_IMPORT = term("hasImport");
    public static final Iri IMPORTED_MODULE = term("importedModule");
    public static final Iri IMPORT_ONLY = term("importOnly");
    public static final Iri IMPORT_EXCEPT = term("importExcept");
    public static final Iri HAS_REQUIRE = term("hasRequire");
    public static final Iri REQUIRED_MODULE = term("requiredModule");
    public static final Iri HAS_USE = term("hasUse");
    public static final Iri USED_MODULE = term("usedModule");
    public static final Iri USE_OPTION = term("useOption");
    public static final Iri DIRECTIVE_SCOPE = term("directiveScope");
    public static final Iri IS_EXTERNAL_MODULE = term("isExternalModule");

    // Function properties
    public static final Iri FUNCTION_NAME = term("functionName");
    public static final Iri ARITY = term("arity");
    public static final Iri MIN_ARITY = term("minArity");
    public static final Iri BELONGS_TO = term("belongsTo");
    public static final Iri DELEGATES_TO = term("delegatesTo");
    public static final Iri IS_DOC_FALSE = term("isDocFalse");
    public static final Iri HAS_CLAUSE = term("hasClause");
    public static final Iri HAS_CLAUSES = term("hasClauses");
    public static final Iri CLAUSE_ORDER = term("clauseOrder");
    public static final Iri HAS_HEAD = term("hasHead");
    public static final Iri HAS_BODY = term("hasBody");
    public static final Iri HAS_PARAMETERS = term("hasParameters");
    public static final Iri PARAMETER_NAME = term("parameterName");
    public static final Iri PARAMETER_POSITION = term("parameterPosition");
    public static final Iri HAS_DEFAULT_VALUE = term("hasDefaultValue");
    public static final Iri CALLS_FUNCTION = term("callsFunction");
    public static final Iri CONTAINS_CALL = term("containsCall");
    public static final Iri CONTAINS_CONTROL_FLOW = term("containsControlFlow");
    public static final Iri CONTAINS_ANONYMOUS_FUNCTION = term("containsAnonymousFunction");

    // Attribute properties
    public static final Iri ATTRIBUTE_NAME = term("attributeName");
    public static final Iri ATTRIBUTE_VALUE = term("attributeValue");
    public static final Iri IS_ACCUMULATING = term("isAccumulating");
    public static final Iri DEPRECATION_MESSAGE = term("deprecationMessage");
    public static final Iri SINCE_VERSION = term("sinceVersion");

    // Type properties
    public static final Iri TYPE_NAME = term("typeName");
    public static final Iri TYPE_ARITY = term("typeArity");
    public static final Iri HAS_TYPE_VARIABLE = term("hasTypeVariable");
    public static final Iri HAS_SPEC = term("hasSpec");
    public static final Iri HAS_PARAMETER_TYPE = term("hasParameterType");
    public static final Iri HAS_RETURN_TYPE = term("hasReturnType");
    public static final Iri UNION_OF = term("unionOf");
    public static final Iri ELEMENT_TYPE = term("elementType");
    public static final Iri KEY_TYPE = term("keyType");
    public static final Iri VALUE_TYPE = term("valueType");
    public static final Iri REFERENCES_TYPE = term("referencesType");
    public static final Iri TYPE_EXPRESSION_TEXT = term("typeExpressionText");

    // Struct properties
    public static final Iri HAS_FIELD = term("hasField");
    public static final Iri FIELD_NAME = term("fieldName");
    public static final Iri HAS_DEFAULT_FIELD_VALUE = term("hasDefaultFieldValue");
    public static final Iri HAS_ENFORCED_KEY = term("hasEnforcedKey");
    public static final Iri DERIVES_PROTOCOL = term("derivesProtocol");
    public static final Iri EXCEPTION_MESSAGE = term("exceptionMessage");

    // Behaviour and protocol properties
    public static final Iri DEFINES_BEHAVIOUR = term("definesBehaviour");
    public static final Iri DEFINES_CALLBACK = term("definesCallback");
    public static final Iri IMPLEMENTS_BEHAVIOUR = term("implementsBehaviour");
    public static final Iri IMPLEMENTS_CALLBACK = term("implementsCallback");
    public static final Iri PROTOCOL_NAME = term("protocolName");
    public static final Iri FALLBACK_TO_ANY = term("fallbackToAny");
    public static final Iri DEFINES_PROTOCOL_FUNCTION = term("definesProtocolFunction");
    public static final Iri IMPLEMENTS_PROTOCOL = term("implementsProtocol");
    public static final Iri FOR_DATA_TYPE = term("forDataType");

    // Metaprogramming properties
    public static final Iri QUOTE_CONTEXT = term("quoteContext");
    public static final Iri HAS_BIND_QUOTED = term("hasBindQuoted");
    public static final Iri LOCATION_KEEP = term("locationKeep");
    public static final Iri UNQUOTE_ENABLED = term("unquoteEnabled");
    public static final Iri IS_GENERATED = term("isGenerated");
    public static final Iri CONTAINS_UNQUOTE = term("containsUnquote");
    public static final Iri UNQUOTE_DEPTH = term("unquoteDepth");
    public static final Iri HAS_HYGIENE_VIOLATION = term("hasHygieneViolation");
    public static final Iri VIOLATION_TYPE = term("violationType");
    public static final Iri UNHYGIENIC_VARIABLE = term("unhygienicVariable");
    public static final Iri HYGIENE_CONTEXT = term("hygieneContext");
    public static final Iri MACRO_NAME = term("macroName");
    public static final Iri MACRO_MODULE = term("macroModule");
    public static final Iri MACRO_ARITY = term("macroArity");
    public static final Iri MACRO_CATEGORY = term("macroCategory");
    public static final Iri RESOLUTION_STATUS = term("resolutionStatus");
    public static final Iri INVOKED_AT = term("invokedAt");
    public static final Iri INVOKES_MACRO = term("invokesMacro");

    private Structure() {
        // Utility class - no instantiation
    }

    private static Iri term(String localName) {
        return new Iri(NS + localName);
    }
}
