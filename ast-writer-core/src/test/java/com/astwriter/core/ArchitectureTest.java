package com.astwriter.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * ArchUnit tests to validate architectural rules.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Nodes are immutable records</li>
 *   <li>The engine does not depend on any writer catalog</li>
 *   <li>Writers are organized by language</li>
 *   <li>Low-level packages stay independent of the engine</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.astwriter.core");
    }

    /**
     * Nodes are read-only for the engine; records make that structural.
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
    void models_shouldNotDependOnWriters() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage("..writer..", "..json..", "..config..");

        rule.check(classes);
    }

    /**
     * The engine dispatches through mappings only and never names a concrete writer.
     */
    @Test
    void engine_shouldNotDependOnWriterImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("com.astwriter.core.writer")
            .should().dependOnClassesThat().resideInAPackage("..writer.impl..");

        rule.check(classes);
    }

    @Test
    void engine_shouldNotDependOnReferenceModel() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("com.astwriter.core.writer")
            .should().dependOnClassesThat().resideInAPackage("..model..");

        rule.check(classes);
    }

    @Test
    void nodeWriters_shouldBeInLanguagePackages() {
        ArchRule rule = classes()
            .that().resideInAPackage("..writer.impl..")
            .and().haveSimpleNameEndingWith("Writer")
            .should().resideInAnyPackage("..impl.solidity..", "..impl.yul..");

        rule.check(classes);
    }

    @Test
    void utilClasses_shouldNotDependOnEngine() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..util..", "..format..")
            .should().dependOnClassesThat().resideInAnyPackage("..writer..", "..model..", "..json..", "..config..");

        rule.check(classes);
    }
}
