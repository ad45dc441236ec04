package io.pooldata.arch;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

class ArchitectureTest {

    @Test
    void coreShouldNotDependOnOtherPackages() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.pooldata.core..")
                .should().dependOnClassesThat()
                .resideInAnyPackage("io.pooldata.kernel..", "io.pooldata.storage..");
        rule.check(importedMainClasses());
    }

    @Test
    void kernelShouldNotDependOnStorage() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.pooldata.kernel..")
                .should().dependOnClassesThat().resideInAPackage("io.pooldata.storage..");
        rule.check(importedMainClasses());
    }

    @Test
    void coreAndKernelShouldNotLog() {
        ArchRule rule = noClasses()
                .that().resideInAnyPackage("io.pooldata.kernel..", "io.pooldata.core..")
                .should().dependOnClassesThat().resideInAPackage("org.slf4j..");
        rule.check(importedMainClasses());
    }

    @Test
    void mainCodeShouldNotDependOnTestPackages() {
        ArchRule rule = noClasses()
                .should().dependOnClassesThat().resideInAPackage("..test..");
        rule.check(importedMainClasses());
    }

    private static JavaClasses importedMainClasses() {
        return new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("io.pooldata..");
    }
}
