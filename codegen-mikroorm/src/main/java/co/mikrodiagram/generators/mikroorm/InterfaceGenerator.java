package co.mikrodiagram.generators.mikroorm;

import co.mikrodiagram.core.model.EntityProperty;
import co.mikrodiagram.core.model.InterfaceMethod;
import co.mikrodiagram.core.model.InterfaceNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generates a plain TypeScript interface: property signatures, a blank line, then method
 * signatures. Interfaces carry no decorators and import nothing.
 */
public final class InterfaceGenerator {

    private InterfaceGenerator() {
    }

    public static String generate(InterfaceNode node, int indentSize) {
        List<EntityProperty> properties = node.data().properties != null ? node.data().properties : List.of();
        List<InterfaceMethod> methods = node.data().methods != null ? node.data().methods : List.of();
        String ind = Identifiers.indent(1, indentSize);

        List<String> lines = new ArrayList<>();
        lines.add("export interface " + Identifiers.sanitize(node.name()) + " {");

        for (EntityProperty property : properties) {
            String optional = property.isNullable ? "?" : "";
            lines.add(ind + property.name + optional + ": " + property.type + ";");
        }

        if (!properties.isEmpty() && !methods.isEmpty()) {
            lines.add("");
        }

        for (InterfaceMethod method : methods) {
            String params = method.parameters != null ? method.parameters : "";
            String returnType = method.returnType != null && !method.returnType.isEmpty() ? method.returnType : "void";
            lines.add(ind + method.name + "(" + params + "): " + returnType + ";");
        }

        lines.add("}");
        return String.join("\n", lines);
    }

    public static Map<String, String> generateAll(List<InterfaceNode> nodes, int indentSize) {
        Map<String, String> result = new LinkedHashMap<>();
        for (InterfaceNode node : nodes) {
            result.put(Identifiers.sanitize(node.name()), generate(node, indentSize));
        }
        return result;
    }
}
