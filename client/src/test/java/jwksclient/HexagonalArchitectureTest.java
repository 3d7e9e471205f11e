package jwksclient;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

@DisplayName("Hexagonal Architecture Rules")
class HexagonalArchitectureTest {

    private static JavaClasses importedClasses;

    @BeforeAll
    static void setUp() {
        importedClasses = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("jwksclient");
    }

    @Nested
    @DisplayName("Core Layer Rules")
    class CoreLayerRules {

        @Test
        @DisplayName("Core should not depend on adapter")
        void coreShouldNotDependOnAdapter() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("jwksclient.core..")
                    .should().dependOnClassesThat().resideInAPackage("jwksclient.adapter..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Core should not depend on HTTP or metrics libraries")
        void coreShouldNotDependOnInfrastructure() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("jwksclient.core..")
                    .should().dependOnClassesThat().resideInAnyPackage("io.vertx..", "io.micrometer..", "jakarta..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Model should not depend on ports, cache or services")
        void modelShouldStayInnermost() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("jwksclient.core.model..")
                    .should().dependOnClassesThat()
                    .resideInAnyPackage(
                            "jwksclient.core.port..", "jwksclient.core.cache..", "jwksclient.core.service..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Ports should not depend on cache or services")
        void portsShouldNotDependOnImplementations() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("jwksclient.core.port..")
                    .should().dependOnClassesThat()
                    .resideInAnyPackage("jwksclient.core.cache..", "jwksclient.core.service..");

            rule.check(importedClasses);
        }
    }
}
