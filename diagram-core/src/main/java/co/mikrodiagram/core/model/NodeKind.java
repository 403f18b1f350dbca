package co.mikrodiagram.core.model;

/**
 * Closed set of diagram node kinds.
 *
 * <p>The wire name is the value of a node's JSON {@code type} property.
 */
public enum NodeKind {
  ENTITY("entity"),
  EMBEDDABLE("embeddable"),
  ENUM("enum"),
  INTERFACE("interface");

  private final String wireName;

  NodeKind(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  /**
   * Resolve a wire name to its kind.
   *
   * @param s the JSON {@code type} value
   * @return the matching kind, or {@code null} when {@code s} is not a node kind
   */
  public static NodeKind fromWireName(String s) {
    for (NodeKind kind : values()) {
      if (kind.wireName.equals(s)) return kind;
    }
    return null;
  }
}
