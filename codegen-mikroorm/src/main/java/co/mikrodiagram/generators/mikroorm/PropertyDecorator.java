package co.mikrodiagram.generators.mikroorm;

import co.mikrodiagram.core.model.EntityProperty;

import java.util.Set;

/**
 * The decorator a scalar property is rendered with.
 */
public enum PropertyDecorator {
    PRIMARY_KEY("PrimaryKey"),
    ENUM("Enum"),
    PROPERTY("Property");

    private final String decoratorName;

    PropertyDecorator(String decoratorName) {
        this.decoratorName = decoratorName;
    }

    public String decoratorName() {
        return decoratorName;
    }

    /**
     * Choose the decorator for {@code property}. A primary key always wins; then an inline
     * enum; then a type naming one of {@code enumNames}; everything else is a plain property.
     */
    public static PropertyDecorator of(EntityProperty property, Set<String> enumNames) {
        if (property.isPrimaryKey) return PRIMARY_KEY;
        if (property.hasInlineEnum()) return ENUM;
        if (property.type != null && enumNames.contains(property.type)) return ENUM;
        return PROPERTY;
    }
}
