package co.mikrodiagram.generators.mikroorm;

import co.mikrodiagram.core.model.DiagramNode;
import co.mikrodiagram.core.model.EntityNode;
import co.mikrodiagram.core.model.EntityProperty;
import co.mikrodiagram.core.model.EnumValue;
import co.mikrodiagram.core.model.RelationType;
import co.mikrodiagram.core.model.RelationshipData;
import co.mikrodiagram.core.model.RelationshipEdge;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static co.mikrodiagram.generators.mikroorm.Fixtures.*;
import static org.assertj.core.api.Assertions.*;

public class MikroOrmGeneratorTest {

  private MikroOrmGenerator generator;
  private List<DiagramNode> nodes;
  private List<RelationshipEdge> edges;

  @BeforeEach
  void setUp() {
    generator = new MikroOrmGenerator();

    EntityProperty status = property("status", "OrderStatus");
    EntityProperty total = property("total", "number");
    total.defaultValue = "0";
    EntityNode order = entity("o", "Order", primaryKey("id", "uuid"), status, total);
    EntityNode line = entity("l", "Order Line", primaryKey("id", "uuid"), property("quantity", "number"));
    EntityNode customer = entity("c", "Customer", primaryKey("id", "uuid"), property("email", "string"));

    nodes = new ArrayList<>(List.of(
        order,
        line,
        customer,
        embeddable("a", "Address", property("street", "string")),
        enumNode("s", "OrderStatus", new EnumValue("Open", "open"), new EnumValue("Closed", "closed")),
        interfaceNode("i", "Auditable")));

    RelationshipData lines = relation(RelationType.Composition, "lines");
    lines.targetProperty = "order";
    RelationshipData buyer = relation(RelationType.ManyToOne, "customer");
    buyer.cascade = true;
    edges = new ArrayList<>(List.of(
        edge("e1", "o", "l", lines),
        edge("e2", "o", "c", buyer),
        edge("e3", "o", "i", RelationType.Implementation, "auditable"),
        edge("e4", "o", "gone", RelationType.OneToOne, "ghost")));
  }

  @Test
  void shouldGenerateEveryNodeKeyedBySanitizedName() {
    Map<String, String> code = generator.generateAll(nodes, edges);

    assertThat(code.keySet()).containsExactly("Order", "Order_Line", "Customer", "Address", "OrderStatus", "Auditable");
  }

  @Test
  void shouldWireOrderAcrossTheDiagram() {
    String order = generator.generateAll(nodes, edges).get("Order");

    assertThat(order).startsWith(
        "import { Cascade, Collection, Entity, Enum, ManyToOne, OneToMany, PrimaryKey, Property } from \"@mikro-orm/core\"\n"
            + "import type { Auditable } from \"./Auditable\"\n"
            + "import { OrderStatus } from \"./OrderStatus\"\n"
            + "import { Customer } from \"./Customer\"\n"
            + "import { Order_Line } from \"./Order_Line\"\n\n"
            + "@Entity()\n");
    assertThat(order).contains("  @Enum(() => OrderStatus)\n  status!: OrderStatus");
    assertThat(order).contains("  @Property({ default: 0 })\n  total!: number");
    assertThat(order).contains("  @OneToMany(() => Order_Line, lines => lines.order, {\n    orphanRemoval: true\n  })\n"
        + "  lines: Collection<Order_Line> = new Collection<Order_Line>(this)");
    assertThat(order).contains("  @ManyToOne(() => Customer, {\n    cascade: [Cascade.ALL]\n  })\n  customer!: Customer");
    assertThat(order).doesNotContain("ghost").doesNotContain("auditable");
  }

  @Test
  void generationIsDeterministic() {
    Map<String, String> first = generator.generateAll(nodes, edges);
    Map<String, String> second = generator.generateAll(nodes, edges);

    assertThat(second).isEqualTo(first);
    assertThat(new ArrayList<>(second.keySet())).isEqualTo(new ArrayList<>(first.keySet()));
  }

  @Test
  void outputDoesNotDependOnNodeOrder() {
    Map<String, String> forward = generator.generateAll(nodes, edges);
    List<DiagramNode> reversed = new ArrayList<>(nodes);
    Collections.reverse(reversed);

    Map<String, String> backward = generator.generateAll(reversed, edges);

    assertThat(backward).isEqualTo(forward);
  }

  @Test
  void categorizedSplitsByKind() {
    CategorizedCode code = generator.generateCategorized(nodes, edges);

    assertThat(code.entities()).containsOnlyKeys("Order", "Order_Line", "Customer");
    assertThat(code.embeddables()).containsOnlyKeys("Address");
    assertThat(code.enums()).containsOnlyKeys("OrderStatus");
    assertThat(code.interfaces()).containsOnlyKeys("Auditable");
    assertThat(code.size()).isEqualTo(6);
    assertThat(code.merged()).isEqualTo(generator.generateAll(nodes, edges));
  }

  @Test
  void laterKindWinsOnNameCollision() {
    nodes.add(enumNode("s2", "Customer", new EnumValue("Vip", "vip")));

    Map<String, String> code = generator.generateAll(nodes, edges);

    assertThat(code.get("Customer")).startsWith("export enum Customer {");
    assertThat(generator.generateCategorized(nodes, edges).entities().get("Customer")).contains("export class Customer {");
  }

  @Test
  void laterNodeWinsWithinKind() {
    nodes.add(entity("c2", "Customer!", primaryKey("key", "string")));

    String customer = generator.generateAll(nodes, edges).get("Customer");

    assertThat(customer).contains("key!: string").doesNotContain("email");
  }

  @Test
  void mergeLastWinsKeepsFirstPosition() {
    Map<String, String> merged = CodeMaps.mergeLastWins(List.of(
        Map.of("A", "a1"),
        Map.of("B", "b1"),
        Map.of("A", "a2")));

    assertThat(merged).containsExactly(entry("A", "a2"), entry("B", "b1"));
  }

  @Test
  void generateNodeMatchesGenerateAll() {
    Map<String, String> all = generator.generateAll(nodes, edges);

    for (DiagramNode node : nodes) {
      String single = generator.generateNode(node, nodes, edges, GeneratorOptions.defaults());
      assertThat(single).isEqualTo(all.get(Identifiers.sanitize(node.name())));
    }
  }

  @Test
  void emptyDiagramProducesNothing() {
    assertThat(generator.generateAll(List.of(), List.of())).isEmpty();
  }

  @Test
  void shouldApplyOptionsEverywhere() {
    GeneratorOptions options = new GeneratorOptions(4, "@mikro-orm/sqlite");

    Map<String, String> code = generator.generateAll(nodes, edges, options);

    assertThat(code.get("Customer")).startsWith("import { Entity, PrimaryKey, Property } from \"@mikro-orm/sqlite\"");
    assertThat(code.get("Customer")).contains("\n    @PrimaryKey()\n    id!: uuid");
  }
}
