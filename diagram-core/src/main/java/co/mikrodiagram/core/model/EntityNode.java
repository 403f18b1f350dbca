package co.mikrodiagram.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EntityNode(String id, Position position, EntityData data) implements DiagramNode {

  @Override
  public NodeKind kind() {
    return NodeKind.ENTITY;
  }

  @Override
  public String name() {
    return data == null ? null : data.name;
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitEntity(this);
  }
}
