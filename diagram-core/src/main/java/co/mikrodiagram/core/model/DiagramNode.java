package co.mikrodiagram.core.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A node on the diagram canvas: an entity, an embeddable, an enum or an interface.
 *
 * <p>The JSON {@code type} property selects the concrete record. Code that needs to treat
 * each kind differently goes through {@link #accept(Visitor)} so that every kind is handled
 * explicitly; {@link #kind()} is meant for filtering.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = EntityNode.class, name = "entity"),
    @JsonSubTypes.Type(value = EmbeddableNode.class, name = "embeddable"),
    @JsonSubTypes.Type(value = EnumNode.class, name = "enum"),
    @JsonSubTypes.Type(value = InterfaceNode.class, name = "interface")
})
public sealed interface DiagramNode permits EntityNode, EmbeddableNode, EnumNode, InterfaceNode {

  String id();

  Position position();

  NodeKind kind();

  /** The user-entered name, or {@code null} when the node carries no data. */
  String name();

  <R> R accept(Visitor<R> visitor);

  /** One callback per node kind. */
  interface Visitor<R> {
    R visitEntity(EntityNode node);

    R visitEmbeddable(EmbeddableNode node);

    R visitEnum(EnumNode node);

    R visitInterface(InterfaceNode node);
  }
}
