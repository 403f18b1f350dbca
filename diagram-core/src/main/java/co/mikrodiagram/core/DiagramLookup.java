package co.mikrodiagram.core;

import co.mikrodiagram.core.model.DiagramNode;
import co.mikrodiagram.core.model.EntityNode;
import co.mikrodiagram.core.model.EnumNode;
import co.mikrodiagram.core.model.NodeKind;
import co.mikrodiagram.core.model.RelationshipEdge;

import java.util.List;
import java.util.Objects;

/**
 * Name-based queries over a node/edge snapshot, used by editing layers to check a change
 * before it is applied. Names are compared exactly as entered.
 *
 * <p>All methods return {@code null} when nothing matches.
 */
public final class DiagramLookup {

  private DiagramLookup() {
  }

  public static DiagramNode findNodeByName(List<DiagramNode> nodes, String name) {
    return findNodeByName(nodes, name, null);
  }

  /**
   * @param kind restricts the search to one kind; {@code null} searches all kinds
   */
  public static DiagramNode findNodeByName(List<DiagramNode> nodes, String name, NodeKind kind) {
    for (DiagramNode node : nodes) {
      if (kind != null && node.kind() != kind) continue;
      if (Objects.equals(node.name(), name)) return node;
    }
    return null;
  }

  public static EntityNode findEntityByName(List<DiagramNode> nodes, String name) {
    return (EntityNode) findNodeByName(nodes, name, NodeKind.ENTITY);
  }

  public static EnumNode findEnumByName(List<DiagramNode> nodes, String name) {
    return (EnumNode) findNodeByName(nodes, name, NodeKind.ENUM);
  }

  /**
   * First edge running from the entity named {@code sourceName} to the entity named
   * {@code targetName}. Direction matters.
   */
  public static RelationshipEdge findRelationship(
      List<RelationshipEdge> edges, List<DiagramNode> nodes, String sourceName, String targetName) {
    EntityNode source = findEntityByName(nodes, sourceName);
    EntityNode target = findEntityByName(nodes, targetName);
    if (source == null || target == null) return null;

    for (RelationshipEdge edge : edges) {
      if (source.id().equals(edge.source()) && target.id().equals(edge.target())) {
        return edge;
      }
    }
    return null;
  }
}
