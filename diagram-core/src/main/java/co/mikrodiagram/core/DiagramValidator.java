package co.mikrodiagram.core;

import co.mikrodiagram.core.model.DiagramFile;
import co.mikrodiagram.core.model.DiagramNode;
import co.mikrodiagram.core.model.EmbeddableNode;
import co.mikrodiagram.core.model.EntityIndex;
import co.mikrodiagram.core.model.EntityNode;
import co.mikrodiagram.core.model.EntityProperty;
import co.mikrodiagram.core.model.EnumNode;
import co.mikrodiagram.core.model.EnumValue;
import co.mikrodiagram.core.model.InterfaceMethod;
import co.mikrodiagram.core.model.InterfaceNode;
import co.mikrodiagram.core.model.RelationshipEdge;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks for a loaded diagram document.
 *
 * <p>Only shape is checked here. Referential problems such as an edge pointing at a deleted
 * node or two nodes sharing a name are left to the generators, which tolerate them.
 */
public final class DiagramValidator {

  private DiagramValidator() {
  }

  public static void validate(DiagramFile f) {
    if (f == null) fail("diagram document required");
    if (isBlank(f.version())) fail("version required");
    if (f.nodes() == null) fail("nodes required");
    if (f.edges() == null) fail("edges required");

    Set<String> nodeIds = new HashSet<>();
    for (DiagramNode node : f.nodes()) {
      if (node == null) fail("nodes must not contain null entries");
      if (isBlank(node.id())) fail("node.id required");
      if (!nodeIds.add(node.id())) fail("duplicate node id " + node.id());
      node.accept(NodeChecker.INSTANCE);
    }

    Set<String> edgeIds = new HashSet<>();
    for (RelationshipEdge edge : f.edges()) {
      if (edge == null) fail("edges must not contain null entries");
      if (isBlank(edge.id())) fail("edge.id required");
      if (!edgeIds.add(edge.id())) fail("duplicate edge id " + edge.id());
      if (isBlank(edge.source())) fail(edge.id() + ": source required");
      if (isBlank(edge.target())) fail(edge.id() + ": target required");
      if (edge.data() == null) fail(edge.id() + ": data required");
      if (edge.data().relationType == null) fail(edge.id() + ": relationType required");
      if (isBlank(edge.data().sourceProperty)) fail(edge.id() + ": sourceProperty required");
    }
  }

  private enum NodeChecker implements DiagramNode.Visitor<Void> {
    INSTANCE;

    @Override
    public Void visitEntity(EntityNode node) {
      if (node.data() == null) fail(node.id() + ": data required");
      requireName(node);
      checkProperties(node.name(), node.data().properties);
      if (node.data().indexes != null) {
        for (EntityIndex index : node.data().indexes) {
          if (index == null || index.properties == null || index.properties.isEmpty()) {
            fail(node.name() + ": index must cover at least one property");
          }
        }
      }
      return null;
    }

    @Override
    public Void visitEmbeddable(EmbeddableNode node) {
      if (node.data() == null) fail(node.id() + ": data required");
      requireName(node);
      checkProperties(node.name(), node.data().properties);
      return null;
    }

    @Override
    public Void visitEnum(EnumNode node) {
      if (node.data() == null) fail(node.id() + ": data required");
      requireName(node);
      if (node.data().values == null) fail(node.name() + ": values required");
      for (EnumValue value : node.data().values) {
        if (value == null || isBlank(value.key)) fail(node.name() + ": enum key required");
      }
      return null;
    }

    @Override
    public Void visitInterface(InterfaceNode node) {
      if (node.data() == null) fail(node.id() + ": data required");
      requireName(node);
      checkProperties(node.name(), node.data().properties);
      if (node.data().methods != null) {
        for (InterfaceMethod method : node.data().methods) {
          if (method == null || isBlank(method.name)) fail(node.name() + ": method.name required");
        }
      }
      return null;
    }
  }

  private static void requireName(DiagramNode node) {
    if (isBlank(node.name())) fail(node.id() + ": name required");
  }

  private static void checkProperties(String owner, List<EntityProperty> properties) {
    if (properties == null) return;
    for (EntityProperty p : properties) {
      if (p == null) fail(owner + ": properties must not contain null entries");
      if (isBlank(p.name)) fail(owner + ": property.name required");
      if (isBlank(p.type)) fail(owner + "." + p.name + ": type required");
    }
  }

  private static boolean isBlank(String s) { return s == null || s.isEmpty(); }
  private static void fail(String msg) { throw new IllegalArgumentException(msg); }
}
