package co.mikrodiagram.generators.mikroorm;

import co.mikrodiagram.core.model.EmbeddableData;
import co.mikrodiagram.core.model.EmbeddableNode;
import co.mikrodiagram.core.model.EntityData;
import co.mikrodiagram.core.model.EntityNode;
import co.mikrodiagram.core.model.EntityProperty;
import co.mikrodiagram.core.model.EnumData;
import co.mikrodiagram.core.model.EnumDefinition;
import co.mikrodiagram.core.model.EnumNode;
import co.mikrodiagram.core.model.EnumValue;
import co.mikrodiagram.core.model.InterfaceData;
import co.mikrodiagram.core.model.InterfaceNode;
import co.mikrodiagram.core.model.Position;
import co.mikrodiagram.core.model.RelationType;
import co.mikrodiagram.core.model.RelationshipData;
import co.mikrodiagram.core.model.RelationshipEdge;

import java.util.ArrayList;
import java.util.List;

/** Builders for diagram nodes and edges used across the generator tests. */
final class Fixtures {

  private Fixtures() {
  }

  static EntityProperty property(String name, String type) {
    EntityProperty p = new EntityProperty();
    p.id = "prop-" + name;
    p.name = name;
    p.type = type;
    return p;
  }

  static EntityProperty primaryKey(String name, String type) {
    EntityProperty p = property(name, type);
    p.isPrimaryKey = true;
    return p;
  }

  static EntityProperty inlineEnum(String name, String enumName, EnumValue... values) {
    EntityProperty p = property(name, EntityProperty.ENUM_TYPE);
    p.enumDef = new EnumDefinition(enumName, List.of(values));
    return p;
  }

  static EntityNode entity(String id, String name, EntityProperty... properties) {
    EntityData data = new EntityData();
    data.name = name;
    data.properties = new ArrayList<>(List.of(properties));
    return new EntityNode(id, Position.ORIGIN, data);
  }

  static EmbeddableNode embeddable(String id, String name, EntityProperty... properties) {
    EmbeddableData data = new EmbeddableData();
    data.name = name;
    data.properties = new ArrayList<>(List.of(properties));
    return new EmbeddableNode(id, Position.ORIGIN, data);
  }

  static EnumNode enumNode(String id, String name, EnumValue... values) {
    EnumData data = new EnumData();
    data.name = name;
    data.values = new ArrayList<>(List.of(values));
    return new EnumNode(id, Position.ORIGIN, data);
  }

  static InterfaceNode interfaceNode(String id, String name) {
    InterfaceData data = new InterfaceData();
    data.name = name;
    return new InterfaceNode(id, Position.ORIGIN, data);
  }

  static RelationshipData relation(RelationType type, String sourceProperty) {
    RelationshipData data = new RelationshipData();
    data.relationType = type;
    data.sourceProperty = sourceProperty;
    return data;
  }

  static RelationshipEdge edge(String id, String source, String target, RelationshipData data) {
    return new RelationshipEdge(id, source, target, data);
  }

  static RelationshipEdge edge(String id, String source, String target, RelationType type, String sourceProperty) {
    return edge(id, source, target, relation(type, sourceProperty));
  }
}
