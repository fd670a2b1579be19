package dev.bookshelf.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StorageLocationsTest {

  @TempDir Path root;

  @Test
  void creates_directory_layout_for_each_location() {
    StorageLocations locations =
        StorageLocations.of(new StorageLocation("work", root.resolve("w"), false));

    StorageLocation work = locations.require("work");
    assertThat(work.bookmarksDir()).isDirectory();
    assertThat(work.faviconsDir()).isDirectory();
    assertThat(work.screenshotsDir()).isDirectory();
  }

  @Test
  void current_prefers_the_flagged_location() {
    StorageLocations locations =
        StorageLocations.of(
            new StorageLocation("work", root.resolve("w"), false),
            new StorageLocation("home", root.resolve("h"), true));

    assertThat(locations.current()).get().extracting(StorageLocation::name).isEqualTo("home");
    assertThat(locations.names()).containsExactly("work", "home");
  }

  @Test
  void current_falls_back_to_the_first_location() {
    StorageLocations locations =
        StorageLocations.of(
            new StorageLocation("work", root.resolve("w"), false),
            new StorageLocation("home", root.resolve("h"), false));

    assertThat(locations.current()).get().extracting(StorageLocation::name).isEqualTo("work");
  }

  @Test
  void rejects_two_current_locations() {
    assertThatThrownBy(
            () ->
                StorageLocations.of(
                    new StorageLocation("a", root.resolve("a"), true),
                    new StorageLocation("b", root.resolve("b"), true)))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void rejects_duplicate_names() {
    assertThatThrownBy(
            () ->
                StorageLocations.of(
                    new StorageLocation("a", root.resolve("a"), false),
                    new StorageLocation("a", root.resolve("b"), false)))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Duplicate");
  }

  @Test
  void rejects_invalid_names_and_record_ids() {
    assertThatThrownBy(() -> new StorageLocation("bad name", root, false))
        .isInstanceOf(IllegalArgumentException.class);
    StorageLocation location = new StorageLocation("ok", root, false);
    assertThatThrownBy(() -> location.recordFile("../escape"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void binds_locations_from_properties() {
    StorageProperties properties =
        new StorageProperties(
            null,
            List.of(new StorageProperties.Location("main", root.resolve("m").toString(), true)));

    StorageLocations locations = new StorageLocations(properties);

    assertThat(locations.contains("main")).isTrue();
    assertThat(properties.lockTimeout()).isEqualTo(StorageProperties.DEFAULT_LOCK_TIMEOUT);
  }

  @Test
  void unknown_location_lookup_fails() {
    StorageLocations locations = StorageLocations.of();

    assertThat(locations.find("x")).isEmpty();
    assertThatThrownBy(() -> locations.require("x")).isInstanceOf(StorageException.class);
  }
}
