package dev.bookshelf.index;

import java.util.List;

/**
 * Outcome of rebuilding one storage location.
 *
 * @param location the rebuilt location
 * @param loaded number of records now indexed
 * @param corruptFiles one message per file skipped because it did not parse
 * @param conflicts one message per duplicate id resolved by last-writer-wins
 */
public record RebuildReport(
    String location, int loaded, List<String> corruptFiles, List<String> conflicts) {

  public RebuildReport {
    corruptFiles = List.copyOf(corruptFiles);
    conflicts = List.copyOf(conflicts);
  }
}
