package co.mikrodiagram.generators.mikroorm;

import co.mikrodiagram.core.model.DiagramNode;
import co.mikrodiagram.core.model.EntityIndex;
import co.mikrodiagram.core.model.EntityNode;
import co.mikrodiagram.core.model.EntityProperty;
import co.mikrodiagram.core.model.RelationshipEdge;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Generates the TypeScript source of one MikroORM entity class.
 *
 * <p>Layout: imports, inline enums, {@code @Index}/{@code @Unique} decorators, {@code @Entity},
 * the class with its properties followed by its outgoing relationships. Empty sections are
 * dropped without leaving blank lines behind.
 */
public final class EntityGenerator {

    private EntityGenerator() {
    }

    public static String generate(EntityNode entity, GenerationContext context) {
        List<EntityProperty> properties = entity.data().properties != null ? entity.data().properties : List.of();
        List<String> lines = new ArrayList<>();

        CollectedImports imports = ImportCollector.collect(
            entity, context.edges(), context.nodesById(), context.enumNames());
        lines.add(ImportRenderer.render(imports, context.options().collectionImportPath()));
        lines.add("");

        String enumsCode = EnumGenerator.generateAllEnumsCode(EnumGenerator.collectEnumDefinitions(properties));
        if (!enumsCode.isEmpty()) {
            lines.add(enumsCode);
            lines.add("");
        }

        lines.addAll(indexDecorators(entity));

        String tableName = entity.data().tableName;
        if (tableName != null && !tableName.isEmpty()) {
            lines.add("@Entity({ tableName: " + Literals.quote(tableName) + " })");
        } else {
            lines.add("@Entity()");
        }
        lines.add("export class " + Identifiers.sanitize(entity.name()) + " {");

        List<String> propertyBlocks = new ArrayList<>();
        for (EntityProperty property : properties) {
            propertyBlocks.add(PropertyGenerator.generateProperty(property, context.indentSize(), context.enumNames()));
        }
        if (!propertyBlocks.isEmpty()) {
            lines.add(String.join("\n\n", propertyBlocks));
        }

        List<String> relationshipBlocks = relationships(entity, context);
        if (!relationshipBlocks.isEmpty()) {
            if (!propertyBlocks.isEmpty()) {
                lines.add("");
            }
            lines.add(String.join("\n\n", relationshipBlocks));
        }

        lines.add("}");
        return String.join("\n", lines);
    }

    /** Source for each entity, keyed by sanitized name. Later duplicates overwrite earlier ones. */
    public static Map<String, String> generateAll(List<EntityNode> entities, GenerationContext context) {
        Map<String, String> result = new LinkedHashMap<>();
        for (EntityNode entity : entities) {
            result.put(Identifiers.sanitize(entity.name()), generate(entity, context));
        }
        return result;
    }

    /**
     * One {@code @Index} or {@code @Unique} line per index that covers at least one property.
     */
    static List<String> indexDecorators(EntityNode entity) {
        List<String> decorators = new ArrayList<>();
        List<EntityIndex> indexes = entity.data().indexes;
        if (indexes == null) return decorators;

        for (EntityIndex index : indexes) {
            if (index.properties == null || index.properties.isEmpty()) continue;

            List<String> quoted = new ArrayList<>();
            for (String property : index.properties) {
                quoted.add(Literals.quote(property));
            }
            String decorator = index.isUnique ? "Unique" : "Index";
            String properties = "properties: [" + String.join(", ", quoted) + "]";
            if (index.name != null && !index.name.isEmpty()) {
                decorators.add("@" + decorator + "({ " + properties + ", name: " + Literals.quote(index.name) + " })");
            } else {
                decorators.add("@" + decorator + "({ " + properties + " })");
            }
        }
        return decorators;
    }

    private static List<String> relationships(EntityNode entity, GenerationContext context) {
        List<String> blocks = new ArrayList<>();
        for (RelationshipEdge edge : context.edges()) {
            if (!entity.id().equals(edge.source())) continue;
            DiagramNode target = context.nodesById().get(edge.target());
            if (target == null) continue;
            Optional<String> code = RelationshipGenerator.generateRelationship(edge, entity, target, context.indentSize());
            code.ifPresent(blocks::add);
        }
        return blocks;
    }
}
