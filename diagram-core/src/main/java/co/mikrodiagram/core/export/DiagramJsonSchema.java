package co.mikrodiagram.core.export;

import co.mikrodiagram.core.model.EnumDefinition;
import co.mikrodiagram.core.model.RelationType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Portable JSON description of a diagram: entities, embeddables and the relationships
 * between them, with node ids replaced by node names.
 *
 * <p>Optional flags are {@code null} rather than {@code false} so that they drop out of the
 * serialized form.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiagramJsonSchema(
    @JsonProperty("version") String version,
    @JsonProperty("metadata") Metadata metadata,
    @JsonProperty("entities") List<EntitySchema> entities,
    @JsonProperty("embeddables") List<EmbeddableSchema> embeddables,
    @JsonProperty("relationships") List<RelationshipSchema> relationships
) {

  public record Metadata(
      @JsonProperty("exportedAt") String exportedAt,
      @JsonProperty("nodeCount") int nodeCount,
      @JsonProperty("relationshipCount") int relationshipCount
  ) {
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record PropertySchema(
      @JsonProperty("name") String name,
      @JsonProperty("type") String type,
      @JsonProperty("isPrimaryKey") Boolean isPrimaryKey,
      @JsonProperty("isUnique") Boolean isUnique,
      @JsonProperty("isNullable") Boolean isNullable,
      @JsonProperty("defaultValue") String defaultValue,
      @JsonProperty("enumDef") EnumDefinition enumDef
  ) {
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record IndexSchema(
      @JsonProperty("name") String name,
      @JsonProperty("properties") List<String> properties,
      @JsonProperty("isUnique") boolean isUnique
  ) {
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record EntitySchema(
      @JsonProperty("kind") String kind,
      @JsonProperty("name") String name,
      @JsonProperty("tableName") String tableName,
      @JsonProperty("isAggregateRoot") Boolean isAggregateRoot,
      @JsonProperty("properties") List<PropertySchema> properties,
      @JsonProperty("indexes") List<IndexSchema> indexes
  ) {
  }

  public record EmbeddableSchema(
      @JsonProperty("kind") String kind,
      @JsonProperty("name") String name,
      @JsonProperty("properties") List<PropertySchema> properties
  ) {
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record RelationshipSchema(
      @JsonProperty("type") RelationType type,
      @JsonProperty("source") String source,
      @JsonProperty("target") String target,
      @JsonProperty("sourceProperty") String sourceProperty,
      @JsonProperty("targetProperty") String targetProperty,
      @JsonProperty("isNullable") Boolean isNullable,
      @JsonProperty("cascade") Boolean cascade,
      @JsonProperty("orphanRemoval") Boolean orphanRemoval
  ) {
  }
}
