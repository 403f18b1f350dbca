package co.mikrodiagram.generators.mikroorm;

import co.mikrodiagram.core.model.EntityProperty;
import co.mikrodiagram.core.model.EnumDefinition;
import co.mikrodiagram.core.model.EnumNode;
import co.mikrodiagram.core.model.EnumValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders TypeScript {@code export enum} declarations, both for enums declared inline on a
 * property and for standalone enum nodes.
 */
public final class EnumGenerator {

    private EnumGenerator() {
    }

    /**
     * Collect the inline enums declared by {@code properties}, one per enum name.
     *
     * <p>Names are compared after sanitizing. Merge policy: the last definition seen for a name wins, while the name keeps the
     * position of its first appearance. Two properties declaring {@code UserRole} therefore
     * yield a single {@code UserRole}, carrying the values of the later property.
     */
    public static List<EnumDefinition> collectEnumDefinitions(List<EntityProperty> properties) {
        Map<String, EnumDefinition> byName = new LinkedHashMap<>();
        if (properties == null) return new ArrayList<>();
        for (EntityProperty property : properties) {
            if (property.hasInlineEnum()) {
                byName.put(Identifiers.sanitize(property.enumDef.name), property.enumDef);
            }
        }
        return new ArrayList<>(byName.values());
    }

    /**
     * Render one enum under its sanitized name. Values that parse as numbers are emitted bare,
     * all others as escaped double-quoted strings.
     */
    public static String generateEnumCode(EnumDefinition enumDef) {
        List<String> lines = new ArrayList<>();
        lines.add("export enum " + Identifiers.sanitize(enumDef.name) + " {");
        if (enumDef.values != null) {
            for (EnumValue member : enumDef.values) {
                String value = member.value == null ? "" : member.value;
                String formatted = Literals.isNumeric(value) ? value : Literals.quote(value);
                lines.add("  " + member.key + " = " + formatted + ",");
            }
        }
        lines.add("}");
        return String.join("\n", lines);
    }

    /**
     * Render several enums separated by one blank line. An empty list renders as the empty
     * string.
     */
    public static String generateAllEnumsCode(List<EnumDefinition> enumDefs) {
        List<String> blocks = new ArrayList<>();
        for (EnumDefinition def : enumDefs) {
            blocks.add(generateEnumCode(def));
        }
        return String.join("\n\n", blocks);
    }

    public static String generate(EnumNode node) {
        return generateEnumCode(new EnumDefinition(node.data().name, node.data().values));
    }

    /** Source for each enum node, keyed by sanitized name. Later duplicates overwrite earlier ones. */
    public static Map<String, String> generateAll(List<EnumNode> nodes) {
        Map<String, String> result = new LinkedHashMap<>();
        for (EnumNode node : nodes) {
            result.put(Identifiers.sanitize(node.name()), generate(node));
        }
        return result;
    }
}
