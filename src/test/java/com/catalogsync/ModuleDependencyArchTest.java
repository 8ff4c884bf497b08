package com.catalogsync;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: domain and common at the bottom, file I/O below the WorldCat layer and the holdings comparison, CLI on top.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.catalogsync");
    }

    @Test
    void domain_must_only_depend_on_common() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.catalogsync.domain..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.catalogsync.worldcat..", "com.catalogsync.file..", "com.catalogsync.cli..", "com.catalogsync.config..",
                        "com.catalogsync.compare..");
        rule.check(classes);
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.catalogsync.common..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.catalogsync.domain..", "com.catalogsync.worldcat..", "com.catalogsync.file..",
                        "com.catalogsync.cli..", "com.catalogsync.config..", "com.catalogsync.compare..");
        rule.check(classes);
    }

    @Test
    void file_must_not_depend_on_worldcat_or_cli() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.catalogsync.file..")
                .should().dependOnClassesThat().resideInAnyPackage("com.catalogsync.worldcat..", "com.catalogsync.cli..");
        rule.check(classes);
    }

    @Test
    void worldcat_must_not_depend_on_cli() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.catalogsync.worldcat..")
                .should().dependOnClassesThat().resideInAPackage("com.catalogsync.cli..");
        rule.check(classes);
    }

    @Test
    void compare_must_not_depend_on_worldcat_or_cli() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.catalogsync.compare..")
                .should().dependOnClassesThat().resideInAnyPackage("com.catalogsync.worldcat..", "com.catalogsync.cli..");
        rule.check(classes);
    }

    @Test
    void auth_must_not_depend_on_request_adapter() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..worldcat.auth..")
                .should().dependOnClassesThat().resideInAnyPackage("..worldcat.adapter..", "..worldcat.job..");
        rule.check(classes);
    }

    @Test
    void classifiers_must_not_depend_on_job_drivers() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..worldcat.classifier..")
                .should().dependOnClassesThat().resideInAPackage("..worldcat.job..");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.catalogsync.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
