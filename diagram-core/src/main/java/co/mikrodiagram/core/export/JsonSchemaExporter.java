package co.mikrodiagram.core.export;

import co.mikrodiagram.core.model.DiagramNode;
import co.mikrodiagram.core.model.EmbeddableData;
import co.mikrodiagram.core.model.EmbeddableNode;
import co.mikrodiagram.core.model.EntityData;
import co.mikrodiagram.core.model.EntityIndex;
import co.mikrodiagram.core.model.EntityNode;
import co.mikrodiagram.core.model.EntityProperty;
import co.mikrodiagram.core.model.EnumNode;
import co.mikrodiagram.core.model.InterfaceNode;
import co.mikrodiagram.core.model.NodeKind;
import co.mikrodiagram.core.model.RelationshipData;
import co.mikrodiagram.core.model.RelationshipEdge;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts a diagram snapshot into a {@link DiagramJsonSchema}.
 *
 * <p>Relationships whose source or target cannot be resolved are left out.
 */
public class JsonSchemaExporter {
  public static final String SCHEMA_VERSION = "1.0";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final Clock clock;

  public JsonSchemaExporter() {
    this(Clock.systemUTC());
  }

  public JsonSchemaExporter(Clock clock) {
    this.clock = clock;
  }

  public DiagramJsonSchema toSchema(List<DiagramNode> nodes, List<RelationshipEdge> edges) {
    Map<String, DiagramNode> nodesById = new HashMap<>();
    for (DiagramNode node : nodes) {
      nodesById.putIfAbsent(node.id(), node);
    }

    SchemaNodes byKind = new SchemaNodes();
    for (DiagramNode node : nodes) {
      node.accept(byKind);
    }

    List<DiagramJsonSchema.RelationshipSchema> relationships = new ArrayList<>();
    for (RelationshipEdge edge : edges) {
      DiagramJsonSchema.RelationshipSchema converted = convertRelationship(edge, nodesById);
      if (converted != null) {
        relationships.add(converted);
      }
    }

    DiagramJsonSchema.Metadata metadata = new DiagramJsonSchema.Metadata(
        Instant.now(clock).toString(), nodes.size(), edges.size());
    return new DiagramJsonSchema(SCHEMA_VERSION, metadata, byKind.entities, byKind.embeddables, relationships);
  }

  /** Pretty-print with {@code indent} spaces per level. */
  public static String stringify(DiagramJsonSchema schema, int indent) throws JsonProcessingException {
    DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
        .withObjectIndenter(new DefaultIndenter(" ".repeat(indent), "\n"))
        .withArrayIndenter(new DefaultIndenter(" ".repeat(indent), "\n"));
    return MAPPER.writer(printer).writeValueAsString(schema);
  }

  public String export(List<DiagramNode> nodes, List<RelationshipEdge> edges, int indent) throws JsonProcessingException {
    return stringify(toSchema(nodes, edges), indent);
  }

  public String export(List<DiagramNode> nodes, List<RelationshipEdge> edges) throws JsonProcessingException {
    return export(nodes, edges, 2);
  }

  static DiagramJsonSchema.PropertySchema convertProperty(EntityProperty p) {
    String defaultValue = p.defaultValue != null && !p.defaultValue.isEmpty() ? p.defaultValue : null;
    return new DiagramJsonSchema.PropertySchema(
        p.name,
        p.type,
        trueOrNull(p.isPrimaryKey),
        trueOrNull(p.isUnique),
        trueOrNull(p.isNullable),
        defaultValue,
        p.hasInlineEnum() ? p.enumDef : null);
  }

  private static DiagramJsonSchema.EntitySchema convertEntity(EntityData data) {
    List<DiagramJsonSchema.IndexSchema> indexes = null;
    if (data.indexes != null && !data.indexes.isEmpty()) {
      indexes = new ArrayList<>();
      for (EntityIndex index : data.indexes) {
        String name = index.name != null && !index.name.isEmpty() ? index.name : null;
        indexes.add(new DiagramJsonSchema.IndexSchema(name, index.properties, index.isUnique));
      }
    }
    String tableName = data.tableName != null && !data.tableName.isEmpty() ? data.tableName : null;
    return new DiagramJsonSchema.EntitySchema(
        NodeKind.ENTITY.wireName(),
        data.name,
        tableName,
        trueOrNull(data.isAggregateRoot),
        convertProperties(data.properties),
        indexes);
  }

  private static DiagramJsonSchema.EmbeddableSchema convertEmbeddable(EmbeddableData data) {
    return new DiagramJsonSchema.EmbeddableSchema(
        NodeKind.EMBEDDABLE.wireName(), data.name, convertProperties(data.properties));
  }

  private static List<DiagramJsonSchema.PropertySchema> convertProperties(List<EntityProperty> properties) {
    List<DiagramJsonSchema.PropertySchema> result = new ArrayList<>();
    if (properties == null) return result;
    for (EntityProperty p : properties) {
      result.add(convertProperty(p));
    }
    return result;
  }

  private static DiagramJsonSchema.RelationshipSchema convertRelationship(
      RelationshipEdge edge, Map<String, DiagramNode> nodesById) {
    RelationshipData data = edge.data();
    if (data == null) return null;

    DiagramNode source = nodesById.get(edge.source());
    DiagramNode target = nodesById.get(edge.target());
    if (source == null || target == null) return null;

    return new DiagramJsonSchema.RelationshipSchema(
        data.relationType,
        source.name(),
        target.name(),
        data.sourceProperty,
        data.hasInverseSide() ? data.targetProperty : null,
        trueOrNull(data.isNullable),
        trueOrNull(data.cascade),
        trueOrNull(data.orphanRemoval));
  }

  private static Boolean trueOrNull(boolean flag) {
    return flag ? Boolean.TRUE : null;
  }

  /** Collects entity and embeddable schemas; enums, interfaces and nodes without data are left out. */
  private static final class SchemaNodes implements DiagramNode.Visitor<Void> {
    final List<DiagramJsonSchema.EntitySchema> entities = new ArrayList<>();
    final List<DiagramJsonSchema.EmbeddableSchema> embeddables = new ArrayList<>();

    @Override
    public Void visitEntity(EntityNode node) {
      if (node.data() != null) {
        entities.add(convertEntity(node.data()));
      }
      return null;
    }

    @Override
    public Void visitEmbeddable(EmbeddableNode node) {
      if (node.data() != null) {
        embeddables.add(convertEmbeddable(node.data()));
      }
      return null;
    }

    @Override
    public Void visitEnum(EnumNode node) {
      return null;
    }

    @Override
    public Void visitInterface(InterfaceNode node) {
      return null;
    }
  }
}
