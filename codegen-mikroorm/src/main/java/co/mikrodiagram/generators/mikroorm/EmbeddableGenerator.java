package co.mikrodiagram.generators.mikroorm;

import co.mikrodiagram.core.model.EmbeddableNode;
import co.mikrodiagram.core.model.EntityProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generates the TypeScript source of one MikroORM embeddable (value object) class.
 *
 * <p>Embeddables own no relationships and no primary key; a property marked as primary key
 * is dropped.
 */
public final class EmbeddableGenerator {

    private EmbeddableGenerator() {
    }

    public static String generate(EmbeddableNode embeddable, GenerationContext context) {
        List<EntityProperty> properties = renderedProperties(embeddable);
        List<String> lines = new ArrayList<>();

        CollectedImports imports = ImportCollector.collect(embeddable, context.enumNames());
        lines.add(ImportRenderer.render(imports, context.options().collectionImportPath()));
        lines.add("");

        String enumsCode = EnumGenerator.generateAllEnumsCode(EnumGenerator.collectEnumDefinitions(properties));
        if (!enumsCode.isEmpty()) {
            lines.add(enumsCode);
            lines.add("");
        }

        lines.add("@Embeddable()");
        lines.add("export class " + Identifiers.sanitize(embeddable.name()) + " {");

        List<String> propertyBlocks = new ArrayList<>();
        for (EntityProperty property : properties) {
            propertyBlocks.add(PropertyGenerator.generateProperty(property, context.indentSize(), context.enumNames()));
        }
        if (!propertyBlocks.isEmpty()) {
            lines.add(String.join("\n\n", propertyBlocks));
        }

        lines.add("}");
        return String.join("\n", lines);
    }

    public static Map<String, String> generateAll(List<EmbeddableNode> embeddables, GenerationContext context) {
        Map<String, String> result = new LinkedHashMap<>();
        for (EmbeddableNode embeddable : embeddables) {
            result.put(Identifiers.sanitize(embeddable.name()), generate(embeddable, context));
        }
        return result;
    }

    static List<EntityProperty> renderedProperties(EmbeddableNode embeddable) {
        List<EntityProperty> rendered = new ArrayList<>();
        if (embeddable.data().properties == null) return rendered;
        for (EntityProperty property : embeddable.data().properties) {
            if (!property.isPrimaryKey) {
                rendered.add(property);
            }
        }
        return rendered;
    }
}
