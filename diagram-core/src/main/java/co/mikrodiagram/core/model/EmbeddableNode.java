package co.mikrodiagram.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EmbeddableNode(String id, Position position, EmbeddableData data) implements DiagramNode {

  @Override
  public NodeKind kind() {
    return NodeKind.EMBEDDABLE;
  }

  @Override
  public String name() {
    return data == null ? null : data.name;
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitEmbeddable(this);
  }
}
