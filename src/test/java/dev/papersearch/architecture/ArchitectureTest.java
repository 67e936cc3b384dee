package dev.papersearch.architecture;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

@AnalyzeClasses(packages = "dev.papersearch", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

    // Core packages should not depend on the REST adapter or web configuration.
    @ArchTest
    static final ArchRule core_should_not_depend_on_adapters =
        noClasses().that().resideInAnyPackage(
                "..query..", "..compile..", "..document..", "..error..", "..index.."
            )
            .should().dependOnClassesThat().resideInAnyPackage(
                "..api..", "..config.."
            );

    // The query model is plain data: no compiler or backend knowledge.
    @ArchTest
    static final ArchRule query_model_should_stay_backend_agnostic =
        noClasses().that().resideInAPackage("..query..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..compile..", "..index..", "..document.."
            );

    // The compiler is pure: it never talks to the transport.
    @ArchTest
    static final ArchRule compiler_should_not_depend_on_index =
        noClasses().that().resideInAPackage("..compile..")
            .should().dependOnClassesThat().resideInAPackage("..index..");

    // Config package should not depend on the REST adapter
    @ArchTest
    static final ArchRule config_should_not_depend_on_api =
        noClasses().that().resideInAPackage("..config..")
            .should().dependOnClassesThat().resideInAPackage("..api..");

    // No cyclic dependencies between top-level packages
    @ArchTest
    static final ArchRule no_package_cycles =
        slices().matching("dev.papersearch.(*)..").should().beFreeOfCycles();
}
