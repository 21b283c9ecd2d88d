package com.symmetryvaults.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit rules for the engine's package structure.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Level document models are immutable records</li>
 *   <li>Graph, group and check plugins implement their SPI</li>
 *   <li>The permutation algebra stays free of higher layers</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.symmetryvaults.core");
    }

    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void models_shouldNotDependOnEngine() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..symmetry..", "..subgroup..", "..quotient..", "..level..", "..validation..", "..renderer..");

        rule.check(classes);
    }

    @Test
    void graphFamilies_shouldImplementGraphFamily() {
        ArchRule rule = classes()
            .that().resideInAPackage("..graph.family..")
            .and().haveSimpleNameEndingWith("GraphFamily")
            .should().beAssignableTo("com.symmetryvaults.core.graph.GraphFamily");

        rule.check(classes);
    }

    @Test
    void groupFamilies_shouldExtendAbstractGroupFamily() {
        ArchRule rule = classes()
            .that().resideInAPackage("..group.family..")
            .and().haveSimpleNameEndingWith("GroupFamily")
            .should().beAssignableTo("com.symmetryvaults.core.group.family.AbstractGroupFamily");

        rule.check(classes);
    }

    @Test
    void levelChecks_shouldImplementLevelCheck() {
        ArchRule rule = classes()
            .that().resideInAPackage("..validation.check..")
            .and().haveSimpleNameEndingWith("Check")
            .should().implement("com.symmetryvaults.core.validation.LevelCheck");

        rule.check(classes);
    }

    @Test
    void algebra_shouldNotDependOnHigherLayers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..algebra..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..graph..", "..group..", "..symmetry..", "..subgroup..", "..level..", "..validation..");

        rule.check(classes);
    }

    @Test
    void exceptions_shouldBeUnchecked() {
        ArchRule rule = classes()
            .that().resideInAPackage("..exception..")
            .and().haveSimpleNameEndingWith("Exception")
            .should().beAssignableTo(RuntimeException.class);

        rule.check(classes);
    }

    @Test
    void engine_shouldNotDependOnRenderers() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..symmetry..", "..subgroup..", "..quotient..", "..validation..")
            .should().dependOnClassesThat().resideInAPackage("..renderer..");

        rule.check(classes);
    }
}
