package com.codeontology.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests for the layering of the graph pipeline.
 *
 * <p>Extraction (ast, directive, closure, extractor, model) sits below graph construction
 * (graph, builder), which sits below orchestration and configuration.
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.codeontology.core");
    }

    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void otpBuilders_shouldExtendAbstractEntityBuilder() {
        ArchRule rule = classes()
            .that().resideInAPackage("..builder.otp..")
            .and().areTopLevelClasses()
            .should().beAssignableTo("com.codeontology.core.builder.AbstractEntityBuilder");

        rule.check(classes);
    }

    @Test
    void entityBuilders_shouldBeNamedBuilderAndLiveInBuilderPackage() {
        ArchRule rule = classes()
            .that().implement("com.codeontology.core.builder.EntityBuilder")
            .and().areNotInterfaces()
            .and().areTopLevelClasses()
            .should().haveSimpleNameEndingWith("Builder")
            .andShould().resideInAPackage("..builder..");

        rule.check(classes);
    }

    /**
     * The syntax tree is the input format; it knows nothing of what is built from it.
     */
    @Test
    void ast_shouldNotDependOnOtherLayers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.ast..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.directive..", "..core.closure..", "..core.extractor..", "..core.model..",
                "..core.graph..", "..core.builder..", "..core.orchestrator..", "..core.config..");

        rule.check(classes);
    }

    @Test
    void extraction_shouldNotDependOnGraphConstruction() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..core.directive..", "..core.closure..", "..core.extractor..",
                "..core.model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.graph..", "..core.builder..", "..core.orchestrator..", "..core.config..");

        rule.check(classes);
    }

    @Test
    void graph_shouldNotDependOnBuildersOrOrchestration() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.graph..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.builder..", "..core.orchestrator..", "..core.extractor..", "..core.config..");

        rule.check(classes);
    }

    @Test
    void builders_shouldNotDependOnOrchestration() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.builder..")
            .should().dependOnClassesThat().resideInAnyPackage("..core.orchestrator..", "..core.config..");

        rule.check(classes);
    }

    @Test
    void utilClasses_shouldNotDependOnDomainPackages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.util..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.ast..", "..core.model..", "..core.graph..", "..core.builder..");

        rule.check(classes);
    }
}
