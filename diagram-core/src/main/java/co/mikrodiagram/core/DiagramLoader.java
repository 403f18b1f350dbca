package co.mikrodiagram.core;

import co.mikrodiagram.core.model.DiagramFile;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@code .mikro-diagram.json} documents.
 *
 * <p>Every document read through this class is checked with {@link DiagramValidator}.
 */
public final class DiagramLoader {
  private static final Logger log = LoggerFactory.getLogger(DiagramLoader.class);

  private static final ObjectMapper JSON = JsonMapper.builder()
      .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
      .serializationInclusion(JsonInclude.Include.NON_NULL)
      .build();

  private DiagramLoader() {
  }

  public static DiagramFile load(Path path) throws IOException {
    log.debug("Loading diagram from {}", path);
    return read(Files.readAllBytes(path));
  }

  public static DiagramFile parse(String json) throws IOException {
    return read(json.getBytes(StandardCharsets.UTF_8));
  }

  /** Serialize a document as pretty-printed JSON. */
  public static String stringify(DiagramFile file) throws IOException {
    return JSON.writerWithDefaultPrettyPrinter().writeValueAsString(file);
  }

  private static DiagramFile read(byte[] bytes) throws IOException {
    DiagramFile file = JSON.readValue(bytes, DiagramFile.class);
    DiagramValidator.validate(file);
    log.debug("Loaded diagram with {} nodes and {} edges", file.nodes().size(), file.edges().size());
    return file;
  }
}
