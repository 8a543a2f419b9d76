package com.codeontology.core.builder;

import com.codeontology.core.context.BuildContext;
import com.codeontology.core.directive.AliasDirective;
import com.codeontology.core.directive.Directive;
import com.codeontology.core.directive.DirectiveKind;
import com.codeontology.core.directive.ImportDirective;
import com.codeontology.core.directive.RequireDirective;
import com.codeontology.core.directive.UseDirective;
import com.codeontology.core.directive.UseOption;
import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.IriGenerator;
import com.codeontology.core.graph.TripleBuilder;
import com.codeontology.core.graph.vocab.Structure;
import com.codeontology.core.model.ModuleInfo;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builds one entity per {@code alias}, {@code import}, {@code require} and {@code use} of a
 * module.
 *
 * <p>Directives are numbered per kind in traversal order: the second {@code import} of a module
 * is {@code {module}/import/1}. When the context carries a known-module set, every directive is
 * flagged with whether its target lies outside the project.
 */
public class DependencyBuilder extends AbstractEntityBuilder<ModuleInfo> {

    @Override
    public BuildResult build(ModuleInfo module, BuildContext context) {
        Objects.requireNonNull(module, "module must not be null");
        Iri moduleIri = context.moduleIri(module.name());
        TripleBuilder triples = new TripleBuilder();
        Map<DirectiveKind, Integer> counters = new EnumMap<>(DirectiveKind.class);

        for (Directive directive : module.directives()) {
            int index = counters.merge(directive.kind(), 1, Integer::sum) - 1;
            Iri target = context.moduleIri(directive.sourceName());
            Iri directiveIri;
            if (directive instanceof AliasDirective alias) {
                directiveIri = IriGenerator.forAlias(moduleIri, index);
                triples.type(directiveIri, Structure.MODULE_ALIAS)
                    .string(directiveIri, Structure.ALIAS_NAME, alias.as())
                    .link(directiveIri, Structure.ALIASED_MODULE, target)
                    .link(moduleIri, Structure.HAS_ALIAS, directiveIri);
            } else if (directive instanceof ImportDirective imported) {
                directiveIri = IriGenerator.forImport(moduleIri, index);
                triples.type(directiveIri, Structure.MODULE_IMPORT)
                    .link(directiveIri, Structure.IMPORTED_MODULE, target)
                    .link(moduleIri, Structure.HAS_IMPORT, directiveIri);
                if (imported.only() != null) {
                    triples.string(directiveIri, Structure.IMPORT_ONLY, imported.only().render());
                }
                if (imported.except() != null) {
                    triples.string(directiveIri, Structure.IMPORT_EXCEPT, imported.except().render());
                }
            } else if (directive instanceof RequireDirective required) {
                directiveIri = IriGenerator.forRequire(moduleIri, index);
                triples.type(directiveIri, Structure.MODULE_REQUIRE)
                    .link(directiveIri, Structure.REQUIRED_MODULE, target)
                    .string(directiveIri, Structure.ALIAS_NAME, required.as())
                    .link(moduleIri, Structure.HAS_REQUIRE, directiveIri);
            } else if (directive instanceof UseDirective used) {
                directiveIri = IriGenerator.forUse(moduleIri, index);
                triples.type(directiveIri, Structure.MODULE_USE)
                    .link(directiveIri, Structure.USED_MODULE, target)
                    .link(moduleIri, Structure.HAS_USE, directiveIri);
                for (UseOption option : used.options()) {
                    triples.string(directiveIri, Structure.USE_OPTION, option.render());
                }
            } else {
                log.warn("Unsupported directive type {}", directive.getClass().getName());
                continue;
            }
            triples.string(directiveIri, Structure.DIRECTIVE_SCOPE, directive.scope().label());
            if (context.hasKnownModules()) {
                triples.bool(directiveIri, Structure.IS_EXTERNAL_MODULE, !context.isModuleKnown(directive.sourceName()));
            }
            addLocation(triples, directiveIri, directive.location(), context);
        }
        return result(moduleIri, triples, context);
    }
}
