package dev.bookshelf;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the Bookshelf recall engine.
 *
 * <p>Starts without a web server: on startup every configured storage location is loaded into the
 * index, after which {@link dev.bookshelf.search.RecallService} and {@link
 * dev.bookshelf.bookmark.BookmarkService} are ready for embedding callers.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class BookshelfApplication {
  public static void main(String[] args) {
    SpringApplication.run(BookshelfApplication.class, args);
  }
}
