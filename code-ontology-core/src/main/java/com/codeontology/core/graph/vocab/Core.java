package com.codeontology.core.graph.vocab;

import com.codeontology.core.graph.Iri;

/**
 * Terms of the core code vocabulary: locations, expressions, literals and control flow.
 */
public final class Core {

    public static final String NS = "https://w3id.org/elixir-code/core#";

    // Classes
    public static final Iri SOURCE_FILE = term("SourceFile");
    public static final Iri SOURCE_LOCATION = term("SourceLocation");
    public static final Iri EXPRESSION = term("Expression");
    public static final Iri VARIABLE = term("Variable");
    public static final Iri WILDCARD_PATTERN = term("WildcardPattern");
    public static final Iri LOCAL_CALL = term("LocalCall");
    public static final Iri REMOTE_CALL = term("RemoteCall");
    public static final Iri DYNAMIC_CALL = term("DynamicCall");
    public static final Iri GUARD_CLAUSE = term("GuardClause");
    public static final Iri IF_EXPRESSION = term("IfExpression");
    public static final Iri UNLESS_EXPRESSION = term("UnlessExpression");
    public static final Iri COND_EXPRESSION = term("CondExpression");
    public static final Iri CASE_EXPRESSION = term("CaseExpression");
    public static final Iri WITH_EXPRESSION = term("WithExpression");
    public static final Iri RECEIVE_EXPRESSION = term("ReceiveExpression");
    public static final Iri FOR_COMPREHENSION = term("ForComprehension");
    public static final Iri TRY_EXPRESSION = term("TryExpression");
    public static final Iri RAISE_EXPRESSION = term("RaiseExpression");
    public static final Iri THROW_EXPRESSION = term("ThrowExpression");
    public static final Iri EXIT_EXPRESSION = term("ExitExpression");
    public static final Iri ATOM_LITERAL = term("AtomLiteral");
    public static final Iri INTEGER_LITERAL = term("IntegerLiteral");
    public static final Iri FLOAT_LITERAL = term("FloatLiteral");
    public static final Iri STRING_LITERAL = term("StringLiteral");
    public static final Iri BOOLEAN_LITERAL = term("BooleanLiteral");
    public static final Iri NIL_LITERAL = term("NilLiteral");
    public static final Iri CHARLIST_LITERAL = term("CharlistLiteral");
    public static final Iri LIST_LITERAL = term("ListLiteral");
    public static final Iri TUPLE_LITERAL = term("TupleLiteral");
    public static final Iri MAP_LITERAL = term("MapLiteral");
    public static final Iri ARITHMETIC_OPERATOR = term("ArithmeticOperator");
    public static final Iri COMPARISON_OPERATOR = term("ComparisonOperator");
    public static final Iri LOGICAL_OPERATOR = term("LogicalOperator");
    public static final Iri MATCH_OPERATOR = term("MatchOperator");
    public static final Iri PIPE_OPERATOR = term("PipeOperator");
    public static final Iri STRING_CONCAT_OPERATOR = term("StringConcatOperator");
    public static final Iri LIST_OPERATOR = term("ListOperator");

    // Properties
    public static final Iri HAS_SOURCE_LOCATION = term("hasSourceLocation");
    public static final Iri IN_SOURCE_FILE = term("inSourceFile");
    public static final Iri FILE_PATH = term("filePath");
    public static final Iri START_LINE = term("startLine");
    public static final Iri END_LINE = term("endLine");
    public static final Iri NAME = term("name");
    public static final Iri ATOM_VALUE = term("atomValue");
    public static final Iri INTEGER_VALUE = term("integerValue");
    public static final Iri FLOAT_VALUE = term("floatValue");
    public static final Iri STRING_VALUE = term("stringValue");
    public static final Iri BOOLEAN_VALUE = term("booleanValue");
    public static final Iri CHARLIST_VALUE = term("charlistValue");
    public static final Iri OPERATOR_SYMBOL = term("operatorSymbol");
    public static final Iri HAS_OPERAND = term("hasOperand");
    public static final Iri HAS_LEFT_OPERAND = term("hasLeftOperand");
    public static final Iri HAS_RIGHT_OPERAND = term("hasRightOperand");
    public static final Iri HAS_ARGUMENT = term("hasArgument");
    public static final Iri HAS_CONDITION = term("hasCondition");
    public static final Iri HAS_THEN_BRANCH = term("hasThenBranch");
    public static final Iri HAS_ELSE_BRANCH = term("hasElseBranch");
    public static final Iri HAS_CLAUSE = term("hasClause");
    public static final Iri HAS_ELSE_CLAUSE = term("hasElseClause");
    public static final Iri HAS_AFTER_TIMEOUT = term("hasAfterTimeout");
    public static final Iri HAS_GENERATOR = term("hasGenerator");
    public static final Iri HAS_FILTER = term("hasFilter");
    public static final Iri HAS_INTO_OPTION = term("hasIntoOption");
    public static final Iri HAS_REDUCE_OPTION = term("hasReduceOption");
    public static final Iri HAS_UNIQ_OPTION = term("hasUniqOption");
    public static final Iri HAS_RESCUE_CLAUSE = term("hasRescueClause");
    public static final Iri HAS_CATCH_CLAUSE = term("hasCatchClause");
    public static final Iri HAS_AFTER_CLAUSE = term("hasAfterClause");
    public static final Iri HAS_GUARD = term("hasGuard");
    public static final Iri CAPTURES_VARIABLE = term("capturesVariable");
    public static final Iri REFERS_TO_FUNCTION = term("refersToFunction");
    public static final Iri REFERS_TO_MODULE = term("refersToModule");
    public static final Iri CLAUSE_COUNT = term("clauseCount");
    public static final Iri GENERATOR_COUNT = term("generatorCount");

    private Core() {
        // Utility class - no instantiation
    }

    private static Iri term(String localName) {
        return new Iri(NS + localName);
    }
}
