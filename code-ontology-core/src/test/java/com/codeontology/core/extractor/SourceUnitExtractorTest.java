package com.codeontology.core.extractor;

import com.codeontology.core.ast.NodeTag;
import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.model.ModuleAnalysis;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.codeontology.core.ast.SyntaxNodes.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link SourceUnitExtractor}.
 */
class SourceUnitExtractorTest {

    private final SourceUnitExtractor extractor = new SourceUnitExtractor();

    @Test
    void extract_fileWithSiblingModules_returnsEachInOrder() {
        SyntaxNode file = block(module("A"), module("B"));

        assertThat(extractor.extract(file)).extracting(ModuleAnalysis::moduleName).containsExactly("A", "B");
    }

    @Test
    void extract_nestedModules_areQualifiedAndFollowTheirParent() {
        SyntaxNode file = module("MyApp",
            module("Accounts", module("User")),
            def("version", List.of(), string("1.0")));

        List<ModuleAnalysis> modules = extractor.extract(file);

        assertThat(modules).extracting(ModuleAnalysis::moduleName)
            .containsExactly("MyApp", "MyApp.Accounts", "MyApp.Accounts.User");
        assertThat(modules.get(2).module().parentModule()).isEqualTo("MyApp.Accounts");
        assertThat(modules.get(0).functions()).hasSize(1);
        assertThat(modules.get(1).functions()).isEmpty();
    }

    @Test
    void extract_unnamedModule_isSkipped() {
        SyntaxNode file = block(node(NodeTag.MODULE_DEF, kw("do", block())), module("Named"));

        assertThat(extractor.extract(file)).extracting(ModuleAnalysis::moduleName).containsExactly("Named");
    }

    @Test
    void extract_noModules_returnsEmpty() {
        assertThat(extractor.extract(block(def("orphan", List.of(), atom("ok"))))).isEmpty();
    }
}
