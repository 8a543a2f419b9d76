package com.codeontology.core.builder;

import com.codeontology.core.context.BuildContext;
import com.codeontology.core.directive.Directive;
import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.IriGenerator;
import com.codeontology.core.graph.TripleBuilder;
import com.codeontology.core.graph.vocab.Structure;
import com.codeontology.core.model.FunctionSignature;
import com.codeontology.core.model.ModuleInfo;

import java.util.Objects;

/**
 * Builds the module entity: name, documentation, nesting, module-level dependency links and
 * containment of functions, macros and types.
 */
public class ModuleBuilder extends AbstractEntityBuilder<ModuleInfo> {

    @Override
    public BuildResult build(ModuleInfo module, BuildContext context) {
        Objects.requireNonNull(module, "module must not be null");
        String base = context.baseIri();
        Iri moduleIri = context.moduleIri(module.name());
        TripleBuilder triples = new TripleBuilder()
            .type(moduleIri, module.isNested() ? Structure.NESTED_MODULE : Structure.MODULE)
            .string(moduleIri, Structure.MODULE_NAME, module.name())
            .string(moduleIri, Structure.DOCSTRING, module.docstring())
            .flag(moduleIri, Structure.IS_DOC_FALSE, module.docFalse());

        if (module.isNested()) {
            triples.bidirectional(moduleIri, Structure.PARENT_MODULE,
                context.moduleIri(module.parentModule()), Structure.HAS_NESTED_MODULE);
        }
        for (String nested : module.nestedModules()) {
            triples.bidirectional(context.moduleIri(nested), Structure.PARENT_MODULE,
                moduleIri, Structure.HAS_NESTED_MODULE);
        }

        for (Directive directive : module.directives()) {
            Iri target = context.moduleIri(directive.sourceName());
            Iri predicate = switch (directive.kind()) {
                case ALIAS -> Structure.ALIASES_MODULE;
                case IMPORT -> Structure.IMPORTS_FROM;
                case REQUIRE -> Structure.REQUIRES_MODULE;
                case USE -> Structure.USES_MODULE;
            };
            triples.link(moduleIri, predicate, target);
        }

        for (FunctionSignature function : module.functions()) {
            triples.link(moduleIri, Structure.CONTAINS_FUNCTION,
                IriGenerator.forFunction(base, module.name(), function.name(), function.arity()));
        }
        for (FunctionSignature macro : module.macros()) {
            triples.link(moduleIri, Structure.CONTAINS_MACRO,
                IriGenerator.forFunction(base, module.name(), macro.name(), macro.arity()));
        }
        for (FunctionSignature type : module.types()) {
            triples.link(moduleIri, Structure.CONTAINS_TYPE,
                IriGenerator.forType(base, module.name(), type.name(), type.arity()));
        }

        addLocation(triples, moduleIri, module.location(), context);
        log.debug("Built module {} ({} triples)", module.name(), triples.size());
        return result(moduleIri, triples, context);
    }
}
