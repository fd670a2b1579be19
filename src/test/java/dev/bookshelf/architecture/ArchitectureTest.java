package dev.bookshelf.architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import dev.bookshelf.architecture.record.LeakyRecord;
import dev.bookshelf.storage.StorageLocations;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class ArchitectureTest {

  // The record model is the leaf everything else builds on.
  static final ArchRule RECORD_DEPENDS_ON_NO_OTHER_FEATURE =
      noClasses()
          .that()
          .resideInAPackage("..record..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage(
              "..storage..", "..index..", "..search..", "..bookmark..", "..embedding..",
              "..config..");

  // Only the config package knows which embedding backend is wired in.
  static final ArchRule ONLY_CONFIG_TOUCHES_EMBEDDING_BACKENDS =
      noClasses()
          .that()
          .resideOutsideOfPackages("..config..", "..embedding..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("dev.langchain4j..");

  // Feature packages must not depend on wiring.
  static final ArchRule FEATURES_SHOULD_NOT_DEPEND_ON_CONFIG =
      noClasses()
          .that()
          .resideInAnyPackage(
              "..record..", "..storage..", "..index..", "..search..", "..bookmark..",
              "..embedding..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("..config..");

  // Recall reads the index; it never writes records.
  static final ArchRule SEARCH_DOES_NOT_DEPEND_ON_BOOKMARK_WRITES =
      noClasses()
          .that()
          .resideInAPackage("..search..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("..bookmark..");

  // No cyclic dependencies between top-level packages
  static final ArchRule NO_PACKAGE_CYCLES =
      slices().matching("dev.bookshelf.(*)..").should().beFreeOfCycles();

  static JavaClasses mainClasses;

  @BeforeAll
  static void importMainClasses() {
    mainClasses =
        new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("dev.bookshelf");
  }

  @Test
  void main_classes_are_imported() {
    assertThat(mainClasses.contain(StorageLocations.class)).isTrue();
    assertThat(mainClasses.contain(LeakyRecord.class)).isFalse();
  }

  @Test
  void record_depends_on_no_other_feature() {
    RECORD_DEPENDS_ON_NO_OTHER_FEATURE.check(mainClasses);
  }

  @Test
  void only_config_touches_embedding_backends() {
    ONLY_CONFIG_TOUCHES_EMBEDDING_BACKENDS.check(mainClasses);
  }

  @Test
  void features_should_not_depend_on_config() {
    FEATURES_SHOULD_NOT_DEPEND_ON_CONFIG.check(mainClasses);
  }

  @Test
  void search_does_not_depend_on_bookmark_writes() {
    SEARCH_DOES_NOT_DEPEND_ON_BOOKMARK_WRITES.check(mainClasses);
  }

  @Test
  void no_package_cycles() {
    NO_PACKAGE_CYCLES.check(mainClasses);
  }

  @Test
  void record_rule_rejects_a_record_class_depending_on_storage() {
    JavaClasses leaky = new ClassFileImporter().importClasses(LeakyRecord.class);

    assertThatThrownBy(() -> RECORD_DEPENDS_ON_NO_OTHER_FEATURE.check(leaky))
        .isInstanceOf(AssertionError.class)
        .hasMessageContaining("LeakyRecord");
  }
}
