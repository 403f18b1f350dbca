package co.mikrodiagram.core;

import co.mikrodiagram.core.model.DiagramFile;
import co.mikrodiagram.core.model.EntityNode;
import co.mikrodiagram.core.model.EnumNode;
import co.mikrodiagram.core.model.FetchType;
import co.mikrodiagram.core.model.NodeKind;
import co.mikrodiagram.core.model.RelationType;
import co.mikrodiagram.core.model.RelationshipEdge;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

public class DiagramLoaderTest {

  @TempDir
  Path tempDir;

  private String validDiagram;

  @BeforeEach
  void setUp() {
    validDiagram = """
      {
        "version": "1.0",
        "metadata": { "createdAt": "2026-01-05T10:00:00Z", "name": "Shop" },
        "nodes": [
          {
            "id": "n1",
            "type": "entity",
            "position": { "x": 10, "y": 20 },
            "data": {
              "name": "Order",
              "tableName": "orders",
              "properties": [
                { "id": "p1", "name": "id", "type": "uuid", "isPrimaryKey": true },
                {
                  "id": "p2", "name": "state", "type": "enum",
                  "enumDef": { "name": "OrderState", "values": [ { "key": "Open", "value": "open" } ] }
                }
              ],
              "indexes": [ { "id": "i1", "properties": ["state"], "isUnique": false } ],
              "color": "#ff0000"
            }
          },
          {
            "id": "n2",
            "type": "enum",
            "position": { "x": 0, "y": 0 },
            "data": { "name": "Currency", "values": [ { "key": "EUR", "value": "EUR" } ] }
          }
        ],
        "edges": [
          {
            "id": "e1",
            "source": "n1",
            "target": "n1",
            "type": "relationship",
            "data": {
              "relationType": "ManyToOne",
              "sourceProperty": "parent",
              "isNullable": true,
              "fetchType": "eager",
              "deleteRule": "set null"
            }
          }
        ]
      }
      """;
  }

  @Test
  void shouldLoadValidDiagram() throws IOException {
    Path file = tempDir.resolve("shop" + DiagramFile.FILE_EXTENSION);
    Files.writeString(file, validDiagram);

    DiagramFile diagram = DiagramLoader.load(file);

    assertThat(diagram.version()).isEqualTo("1.0");
    assertThat(diagram.metadata().name()).isEqualTo("Shop");
    assertThat(diagram.nodes()).hasSize(2);
    assertThat(diagram.nodes().get(0)).isInstanceOf(EntityNode.class);
    assertThat(diagram.nodes().get(1)).isInstanceOf(EnumNode.class);

    EntityNode order = (EntityNode) diagram.nodes().get(0);
    assertThat(order.kind()).isEqualTo(NodeKind.ENTITY);
    assertThat(order.name()).isEqualTo("Order");
    assertThat(order.position().x()).isEqualTo(10.0);
    assertThat(order.data().tableName).isEqualTo("orders");
    assertThat(order.data().properties).hasSize(2);
    assertThat(order.data().properties.get(0).isPrimaryKey).isTrue();
    assertThat(order.data().properties.get(1).hasInlineEnum()).isTrue();
    assertThat(order.data().properties.get(1).enumDef.values.get(0).value).isEqualTo("open");
    assertThat(order.data().indexes.get(0).properties).containsExactly("state");
  }

  @Test
  void shouldReadRelationshipData() throws IOException {
    DiagramFile diagram = DiagramLoader.parse(validDiagram);

    RelationshipEdge edge = diagram.edges().get(0);
    assertThat(edge.data().relationType).isEqualTo(RelationType.ManyToOne);
    assertThat(edge.data().fetchType).isEqualTo(FetchType.Eager);
    assertThat(edge.data().isNullable).isTrue();
    assertThat(edge.data().cascade).isFalse();
    assertThat(edge.data().deleteRule).isEqualTo("set null");
    assertThat(edge.data().hasInverseSide()).isFalse();
  }

  @Test
  void shouldRoundTripThroughStringify() throws IOException {
    DiagramFile original = DiagramLoader.parse(validDiagram);

    String json = DiagramLoader.stringify(original);
    DiagramFile reread = DiagramLoader.parse(json);

    assertThat(json).contains("\"type\" : \"entity\"").contains("\"fetchType\" : \"eager\"");
    assertThat(reread.nodes()).extracting(n -> n.name()).containsExactly("Order", "Currency");
    assertThat(reread.edges().get(0).data().deleteRule).isEqualTo("set null");
  }

  @Test
  void shouldRejectInvalidJson() {
    assertThatThrownBy(() -> DiagramLoader.parse("{ \"version\": \"1.0\", \"nodes\": [ }"))
      .isInstanceOf(IOException.class);
  }

  @Test
  void shouldRejectUnknownNodeType() {
    String json = """
      { "version": "1.0", "nodes": [ { "id": "x", "type": "note", "data": {} } ], "edges": [] }
      """;

    assertThatThrownBy(() -> DiagramLoader.parse(json))
      .isInstanceOf(IOException.class);
  }

  @Test
  void shouldValidateAfterReading() {
    String json = """
      { "version": "1.0", "nodes": [ { "id": "x", "type": "entity", "data": { "properties": [] } } ], "edges": [] }
      """;

    assertThatThrownBy(() -> DiagramLoader.parse(json))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("x: name required");
  }

  @Test
  void unknownRelationTypeIsReportedByValue() {
    String json = """
      {
        "version": "1.0",
        "nodes": [],
        "edges": [ { "id": "e1", "source": "a", "target": "b", "data": { "relationType": "Friendship", "sourceProperty": "f" } } ]
      }
      """;

    assertThatThrownBy(() -> DiagramLoader.parse(json))
      .isInstanceOf(IOException.class)
      .hasMessageContaining("Friendship");
  }

  @Test
  void misspelledFetchTypeIsRejected() {
    String json = """
      {
        "version": "1.0",
        "nodes": [],
        "edges": [ { "id": "e1", "source": "a", "target": "b",
                     "data": { "relationType": "ManyToOne", "sourceProperty": "f", "fetchType": "eagre" } } ]
      }
      """;

    assertThatThrownBy(() -> DiagramLoader.parse(json))
      .isInstanceOf(IOException.class)
      .hasMessageContaining("eagre");
  }

  @Test
  void shouldFailOnMissingFile() {
    assertThatThrownBy(() -> DiagramLoader.load(tempDir.resolve("absent.json")))
      .isInstanceOf(IOException.class);
  }
}
