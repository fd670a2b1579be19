package dev.bookshelf.index;

import dev.bookshelf.storage.StorageLocations;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Populates the {@link BookmarkIndex} for every configured storage location once the application
 * context is ready. Corrupt files are reported in the logs and do not stop startup; a location
 * whose directory cannot be listed does.
 */
@Component
public class IndexInitializer implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(IndexInitializer.class);

  private final StorageLocations locations;
  private final BookmarkIndex index;

  public IndexInitializer(StorageLocations locations, BookmarkIndex index) {
    this.locations = locations;
    this.index = index;
  }

  @Override
  public void run(ApplicationArguments args) {
    rebuildAll();
  }

  /**
   * Rebuilds every configured location in configuration order.
   *
   * @return one report per location
   */
  public List<RebuildReport> rebuildAll() {
    List<RebuildReport> reports = new ArrayList<>();
    for (String name : locations.names()) {
      reports.add(index.rebuild(name));
    }
    int loaded = reports.stream().mapToInt(RebuildReport::loaded).sum();
    int corrupt = reports.stream().mapToInt(r -> r.corruptFiles().size()).sum();
    log.info(
        "Index ready: {} bookmarks across {} location(s), {} corrupt file(s) skipped",
        loaded,
        reports.size(),
        corrupt);
    return reports;
  }
}
