package com.archlint.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * ArchUnit tests for package layering and extension points.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Extractors, evaluators and detectors plug into their base types</li>
 *   <li>Domain models are immutable records</li>
 *   <li>Lower layers never reach into scanning, graph or inference code</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.archlint.core");
    }

    @Test
    void extractors_shouldExtendAbstractImportExtractor() {
        ArchRule rule = classes()
            .that().resideInAPackage("..extractor.impl..")
            .and().haveSimpleNameEndingWith("ImportExtractor")
            .should().beAssignableTo("com.archlint.core.extractor.base.AbstractImportExtractor");

        rule.check(classes);
    }

    /**
     * Extractors are grouped by language, with lexer helpers in a {@code util} sub-package.
     */
    @Test
    void extractorHelpers_shouldResideInUtilPackages() {
        ArchRule rule = classes()
            .that().resideInAPackage("..extractor.impl..")
            .and().haveSimpleNameEndingWith("CommentStripper")
            .should().resideInAPackage("..extractor.impl.*.util..")
            .andShould().beAssignableTo("com.archlint.core.extractor.base.AbstractCommentStripper");

        rule.check(classes);
    }

    @Test
    void evaluators_shouldImplementRuleEvaluator() {
        ArchRule rule = classes()
            .that().resideInAPackage("..rules.impl..")
            .and().haveSimpleNameEndingWith("RuleEvaluator")
            .should().implement("com.archlint.core.rules.RuleEvaluator");

        rule.check(classes);
    }

    @Test
    void detectors_shouldExtendAbstractRuleDetector() {
        ArchRule rule = classes()
            .that().resideInAPackage("..inference.impl..")
            .and().haveSimpleNameEndingWith("Detector")
            .and().doNotHaveSimpleName("AbstractRuleDetector")
            .should().beAssignableTo("com.archlint.core.inference.impl.AbstractRuleDetector");

        rule.check(classes);
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
    void models_shouldNotDependOnOtherPackages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "com.archlint.core.config..", "com.archlint.core.extractor..", "com.archlint.core.rules..",
                "com.archlint.core.scan..", "com.archlint.core.graph..", "com.archlint.core.inference..",
                "com.archlint.core.structure..", "com.archlint.core.util..");

        rule.check(classes);
    }

    @Test
    void extractorBase_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..extractor.base..")
            .should().dependOnClassesThat().resideInAPackage("..extractor.impl..");

        rule.check(classes);
    }

    @Test
    void utilClasses_shouldNotDependOnDomainPackages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("com.archlint.core.util..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..extractor..", "..rules..", "..scan..", "..graph..", "..inference..", "..structure..");

        rule.check(classes);
    }

    /**
     * Rule evaluation works on single files and must stay usable without the batch scanner.
     */
    @Test
    void rules_shouldNotDependOnScanGraphOrInference() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..rules..")
            .should().dependOnClassesThat().resideInAnyPackage("..scan..", "..graph..", "..inference..", "..structure..");

        rule.check(classes);
    }

    @Test
    void inference_shouldNotDependOnScanning() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..inference..")
            .should().dependOnClassesThat().resideInAnyPackage("..scan..", "..rules..", "..extractor..");

        rule.check(classes);
    }

    /**
     * The generated Python grammar is an implementation detail of the Python extractor.
     */
    @Test
    void pythonParser_shouldOnlyBeUsedByPythonExtractor() {
        ArchRule rule = noClasses()
            .that().resideOutsideOfPackage("..extractor.impl.python..")
            .should().dependOnClassesThat().resideInAPackage("com.archlint.parser..");

        rule.check(classes);
    }
}
