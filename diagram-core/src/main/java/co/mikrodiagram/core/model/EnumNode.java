package co.mikrodiagram.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EnumNode(String id, Position position, EnumData data) implements DiagramNode {

  @Override
  public NodeKind kind() {
    return NodeKind.ENUM;
  }

  @Override
  public String name() {
    return data == null ? null : data.name;
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitEnum(this);
  }
}
