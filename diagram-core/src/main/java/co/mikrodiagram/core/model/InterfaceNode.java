package co.mikrodiagram.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record InterfaceNode(String id, Position position, InterfaceData data) implements DiagramNode {

  @Override
  public NodeKind kind() {
    return NodeKind.INTERFACE;
  }

  @Override
  public String name() {
    return data == null ? null : data.name;
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitInterface(this);
  }
}
