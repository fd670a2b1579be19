package dev.bookshelf.storage;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.bookshelf.record.Bookmark;
import java.io.IOException;
import java.nio.file.Path;

/**
 * YAML (de)serialization of {@link Bookmark} record files.
 *
 * <p>Decoding never throws: unparsable content, an empty document or a record failing validation
 * yields {@link RecordReadResult.Corrupt}.
 */
final class RecordCodec {

  private final YAMLMapper mapper;

  RecordCodec() {
    this.mapper =
        YAMLMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE)
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .build();
    this.mapper.setDefaultPropertyInclusion(JsonInclude.Include.NON_NULL);
  }

  byte[] encode(Bookmark bookmark) {
    try {
      return mapper.writeValueAsBytes(bookmark);
    } catch (JsonProcessingException e) {
      throw new StorageException("Failed to serialize bookmark " + bookmark.id(), e);
    }
  }

  RecordReadResult decode(Path path, byte[] content) {
    try {
      Bookmark bookmark = mapper.readValue(content, Bookmark.class);
      if (bookmark == null) {
        return new RecordReadResult.Corrupt(path, "YAML content is empty");
      }
      return new RecordReadResult.Parsed(path, bookmark);
    } catch (ValueInstantiationException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      return new RecordReadResult.Corrupt(path, "Invalid record: " + cause.getMessage());
    } catch (JsonProcessingException e) {
      return new RecordReadResult.Corrupt(path, "Invalid YAML format: " + e.getOriginalMessage());
    } catch (IOException e) {
      return new RecordReadResult.Corrupt(path, "Unreadable record: " + e.getMessage());
    }
  }
}
