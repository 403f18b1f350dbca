package co.mikrodiagram.generators.mikroorm;

import co.mikrodiagram.core.model.EntityProperty;
import co.mikrodiagram.core.model.InterfaceMethod;
import co.mikrodiagram.core.model.InterfaceNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static co.mikrodiagram.generators.mikroorm.Fixtures.*;
import static org.assertj.core.api.Assertions.*;

public class InterfaceGeneratorTest {

  private static InterfaceMethod method(String name, String parameters, String returnType) {
    InterfaceMethod m = new InterfaceMethod();
    m.name = name;
    m.parameters = parameters;
    m.returnType = returnType;
    return m;
  }

  @Test
  void shouldRenderPropertiesThenMethods() {
    InterfaceNode auditable = interfaceNode("i", "Auditable");
    EntityProperty updatedBy = property("updatedBy", "string");
    updatedBy.isNullable = true;
    auditable.data().properties = List.of(property("createdAt", "Date"), updatedBy);
    auditable.data().methods = List.of(
        method("touch", "by: string", "void"),
        method("history", "", "Date[]"));

    assertThat(InterfaceGenerator.generate(auditable, 2)).isEqualTo("""
        export interface Auditable {
          createdAt: Date;
          updatedBy?: string;

          touch(by: string): void;
          history(): Date[];
        }""");
  }

  @Test
  void missingReturnTypeDefaultsToVoid() {
    InterfaceNode node = interfaceNode("i", "Closeable");
    node.data().methods = List.of(method("close", null, null));

    assertThat(InterfaceGenerator.generate(node, 4)).isEqualTo("export interface Closeable {\n    close(): void;\n}");
  }

  @Test
  void noBlankLineWithoutMethods() {
    InterfaceNode node = interfaceNode("i", "Named");
    node.data().properties = List.of(property("name", "string"));

    assertThat(InterfaceGenerator.generate(node, 2)).isEqualTo("export interface Named {\n  name: string;\n}");
  }

  @Test
  void emptyInterface() {
    assertThat(InterfaceGenerator.generate(interfaceNode("i", "Marker Type"), 2))
        .isEqualTo("export interface Marker_Type {\n}");
  }
}
