package co.mikrodiagram.generators.mikroorm;

import co.mikrodiagram.core.model.EntityProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Renders one property as a decorator line followed by its field declaration.
 */
public final class PropertyGenerator {

    private PropertyGenerator() {
    }

    /**
     * Entries of the decorator options object, in fixed order: {@code unique},
     * {@code nullable}, {@code default}. Absent or false settings are left out.
     */
    static List<String> propertyOptions(EntityProperty property) {
        List<String> options = new ArrayList<>();
        if (property.isUnique) {
            options.add("unique: true");
        }
        if (property.isNullable) {
            options.add("nullable: true");
        }
        if (property.defaultValue != null && !property.defaultValue.isEmpty()) {
            options.add("default: " + Literals.defaultValue(property.defaultValue));
        }
        return options;
    }

    /**
     * The options object literal, e.g. {@code { unique: true, default: "x" }}, or the empty
     * string when no option applies.
     */
    public static String generatePropertyOptions(EntityProperty property) {
        List<String> options = propertyOptions(property);
        return options.isEmpty() ? "" : "{ " + String.join(", ", options) + " }";
    }

    /**
     * Render {@code property} at one indentation level.
     *
     * @param enumNames names of the standalone enum nodes; a property whose type is one of them
     *                  is rendered as an enum reference
     */
    public static String generateProperty(EntityProperty property, int indentSize, Set<String> enumNames) {
        String ind = Identifiers.indent(1, indentSize);
        PropertyDecorator kind = PropertyDecorator.of(property, enumNames);
        String enumName = null;
        if (kind == PropertyDecorator.ENUM) {
            enumName = Identifiers.sanitize(property.hasInlineEnum() ? property.enumDef.name : property.type);
        }

        String decorator = switch (kind) {
            case PRIMARY_KEY -> "@PrimaryKey()";
            case ENUM -> enumDecorator(enumName, propertyOptions(property));
            case PROPERTY -> "@Property(" + generatePropertyOptions(property) + ")";
        };
        String declaredType = enumName != null ? enumName : property.type;

        String nullable = property.isNullable ? "?" : "!";
        return ind + decorator + "\n" + ind + property.name + nullable + ": " + declaredType;
    }

    private static String enumDecorator(String enumName, List<String> options) {
        if (options.isEmpty()) {
            return "@Enum(() => " + enumName + ")";
        }
        return "@Enum({ items: () => " + enumName + ", " + String.join(", ", options) + " })";
    }
}
