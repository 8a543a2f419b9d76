package com.codeontology.core.extractor;

import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.model.ModuleAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Extracts every module of a source unit (a parsed file).
 *
 * <p>Modules are returned in pre-order: a module precedes the modules nested in it, and nested
 * modules carry their parent's name.
 */
public class SourceUnitExtractor {

    private static final Logger log = LoggerFactory.getLogger(SourceUnitExtractor.class);

    private final ModuleExtractor moduleExtractor;

    public SourceUnitExtractor() {
        this(new ModuleExtractor());
    }

    public SourceUnitExtractor(ModuleExtractor moduleExtractor) {
        this.moduleExtractor = Objects.requireNonNull(moduleExtractor, "moduleExtractor must not be null");
    }

    /**
     * Extracts all modules below {@code root}.
     *
     * @param root source unit root; a module definition, a block or any other node
     * @return module analyses in pre-order
     */
    public List<ModuleAnalysis> extract(SyntaxNode root) {
        Objects.requireNonNull(root, "root must not be null");
        List<ModuleAnalysis> modules = new ArrayList<>();
        collect(root, null, modules);
        log.debug("Source unit contains {} module(s)", modules.size());
        return modules;
    }

    private void collect(SyntaxNode node, String parent, List<ModuleAnalysis> modules) {
        if (!node.tag().isModuleLike()) {
            node.children().forEach(child -> collect(child, parent, modules));
            return;
        }
        if (ModuleExtractor.qualifiedName(node, parent) == null) {
            log.debug("Skipping unnamed {} at {}", node.tag(), node.location());
            return;
        }
        ModuleAnalysis analysis = moduleExtractor.extract(node, parent);
        modules.add(analysis);
        for (SyntaxNode nested : ModuleExtractor.nestedUnits(node)) {
            collect(nested, analysis.moduleName(), modules);
        }
    }
}
