package com.distindex.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate architectural rules and design patterns.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Stages extend the abstract stage base class</li>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>Base classes don't depend on implementations</li>
 *   <li>Lower layers (util, model, graph, store) don't reach up into the pipeline</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.distindex.core");
    }

    /**
     * Verifies all stage implementations extend AbstractStage.
     */
    @Test
    void stages_shouldExtendAbstractStage() {
        ArchRule rule = classes()
            .that().resideInAPackage("..stage.impl..")
            .and().areTopLevelClasses()
            .should().beAssignableTo("com.distindex.core.stage.base.AbstractStage");

        rule.check(classes);
    }

    /**
     * Verifies all domain models in the model package are implemented as Java records.
     */
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
    void baseStages_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..stage.base..")
            .should().dependOnClassesThat().resideInAPackage("..stage.impl..");

        rule.check(classes);
    }

    /**
     * Utilities are low-level and reusable, with no pipeline dependencies.
     */
    @Test
    void utilClasses_shouldNotDependOnPipeline() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAnyPackage("..stage..", "..store..", "..extract..", "..graph..");

        rule.check(classes);
    }

    @Test
    void models_shouldNotDependOnPipeline() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage("..stage..", "..store..", "..extract..");

        rule.check(classes);
    }

    /**
     * The graph algorithms work on in-memory graphs only.
     */
    @Test
    void graph_shouldNotDependOnStoreOrStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..graph..")
            .should().dependOnClassesThat().resideInAnyPackage("..store..", "..stage..");

        rule.check(classes);
    }

    @Test
    void store_shouldNotDependOnStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..store..")
            .should().dependOnClassesThat().resideInAnyPackage("..stage..", "..extract..");

        rule.check(classes);
    }
}
