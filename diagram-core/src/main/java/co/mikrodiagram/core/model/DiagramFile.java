package co.mikrodiagram.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Saved diagram document: the node and edge snapshot plus file metadata.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DiagramFile(
    String version,
    Metadata metadata,
    List<DiagramNode> nodes,
    List<RelationshipEdge> edges
) {
  public static final String VERSION = "1.0";
  public static final String FILE_EXTENSION = ".mikro-diagram.json";

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Metadata(String createdAt, String updatedAt, String name) {
  }

  /**
   * Wrap a snapshot into a new document stamped with the current time.
   *
   * @param nodes diagram nodes
   * @param edges relationship edges
   * @param name optional diagram name
   * @param clock source of the creation timestamp
   */
  public static DiagramFile create(List<DiagramNode> nodes, List<RelationshipEdge> edges, String name, Clock clock) {
    String now = Instant.now(clock).toString();
    return new DiagramFile(VERSION, new Metadata(now, now, name), List.copyOf(nodes), List.copyOf(edges));
  }
}
