package com.codeontology.core.context;

import com.codeontology.core.graph.Iri;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link BuildContext}.
 */
class BuildContextTest {

    private static final String BASE = "https://example.org/code#";

    @Test
    void of_blankBaseIri_throwsException() {
        assertThatThrownBy(() -> BuildContext.of(" "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("baseIri must not be null or blank");
    }

    // ==================== Copy-on-write ====================

    @Test
    void withMethods_leaveOriginalUnchanged() {
        BuildContext original = BuildContext.of(BASE);

        BuildContext changed = original.withFilePath("lib/app.ex")
            .withModule("MyApp")
            .withConfig(Map.of(BuildContext.INCLUDE_EXPRESSIONS, true));

        assertThat(original.filePath()).isNull();
        assertThat(original.currentModule()).isEmpty();
        assertThat(original.includeExpressions()).isFalse();
        assertThat(changed.filePath()).isEqualTo("lib/app.ex");
        assertThat(changed.currentModule()).contains("MyApp");
        assertThat(changed.includeExpressions()).isTrue();
    }

    @Test
    void withConfig_mergesOverExistingEntries() {
        BuildContext context = BuildContext.of(BASE)
            .withConfig(Map.of("a", 1, "b", 2))
            .withConfig(Map.of("b", 3));

        assertThat(context.config()).containsEntry("a", 1).containsEntry("b", 3);
        assertThat(context.configOrDefault("b", 0)).isEqualTo(3);
        assertThat(context.configOrDefault("missing", 7)).isEqualTo(7);
        assertThat(context.configOrDefault("a", "text")).isEqualTo("text");
    }

    // ==================== Counter ====================

    @Test
    void nextCounter_returnsValueAndAdvancedContext() {
        BuildContext context = BuildContext.of(BASE);

        BuildContext.Counted first = context.nextCounter();
        BuildContext.Counted second = first.context().nextCounter();

        assertThat(first.value()).isZero();
        assertThat(second.value()).isEqualTo(1);
        assertThat(second.context().counter()).isEqualTo(2);
        assertThat(context.counter()).isZero();
    }

    @Test
    void withCounterReset_startsFromZero() {
        BuildContext advanced = BuildContext.of(BASE).nextCounter().context().nextCounter().context();

        assertThat(advanced.withCounterReset().counter()).isZero();
    }

    // ==================== Module context ====================

    @Test
    void currentModule_fallsBackToParentModule() {
        BuildContext context = BuildContext.of(BASE).withParentModule("Outer");

        assertThat(context.currentModule()).contains("Outer");
        assertThat(context.withModule("Outer.Inner").currentModule()).contains("Outer.Inner");
    }

    @Test
    void requireModule_withoutModule_throwsException() {
        assertThatThrownBy(() -> BuildContext.of(BASE).requireModule("function building"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageStartingWith("function building requires module context");
    }

    @Test
    void knownModules_notConfigured_nothingIsKnown() {
        BuildContext context = BuildContext.of(BASE);

        assertThat(context.hasKnownModules()).isFalse();
        assertThat(context.isModuleKnown("MyApp")).isFalse();
        assertThat(context.withKnownModules(List.of("MyApp")).isModuleKnown("MyApp")).isTrue();
        assertThat(context.withKnownModules(List.of()).hasKnownModules()).isTrue();
    }

    // ==================== IRIs ====================

    @Test
    void contextIri_prefersModuleThenFileThenFallback() {
        BuildContext context = BuildContext.of(BASE);

        assertThat(context.contextIri("anon")).isEqualTo(new Iri(BASE + "anon"));
        assertThat(context.withFilePath("lib/app.ex").contextIri("anon"))
            .isEqualTo(new Iri(BASE + "file/lib/app.ex"));
        assertThat(context.withFilePath("lib/app.ex").withModule("App").contextIri("anon"))
            .isEqualTo(new Iri(BASE + "App"));
    }

    @Test
    void fileIri_withoutFilePath_isEmpty() {
        assertThat(BuildContext.of(BASE).fileIri()).isEmpty();
    }
}
