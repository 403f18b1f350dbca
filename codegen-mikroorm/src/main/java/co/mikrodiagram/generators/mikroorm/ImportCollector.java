package co.mikrodiagram.generators.mikroorm;

import co.mikrodiagram.core.model.DiagramNode;
import co.mikrodiagram.core.model.EmbeddableNode;
import co.mikrodiagram.core.model.EntityIndex;
import co.mikrodiagram.core.model.EntityNode;
import co.mikrodiagram.core.model.EntityProperty;
import co.mikrodiagram.core.model.NodeKind;
import co.mikrodiagram.core.model.RelationshipData;
import co.mikrodiagram.core.model.RelationshipEdge;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Works out the imports of an entity or embeddable.
 *
 * <p>Each property, index and outgoing edge contributes its own {@link CollectedImports};
 * the contributions are folded together starting from the node's class decorator.
 */
public final class ImportCollector {

    private ImportCollector() {
    }

    /**
     * Imports for an entity.
     *
     * @param edges     every edge of the diagram; only those leaving {@code entity} count
     * @param nodesById all nodes of the diagram, used to resolve edge targets
     * @param enumNames names of the standalone enum nodes
     */
    public static CollectedImports collect(
            EntityNode entity, List<RelationshipEdge> edges, Map<String, DiagramNode> nodesById, Set<String> enumNames) {
        CollectedImports imports = CollectedImports.decorator("Entity")
            .plus(fromProperties(entity.data().properties, enumNames));

        List<EntityIndex> indexes = entity.data().indexes;
        if (indexes != null) {
            for (EntityIndex index : indexes) {
                imports = imports.plus(fromIndex(index));
            }
        }

        String ownName = Identifiers.sanitize(entity.name());
        for (RelationshipEdge edge : edges) {
            imports = imports.plus(fromEdge(edge, entity.id(), ownName, nodesById));
        }
        return imports;
    }

    /** Imports for an embeddable. Primary-key properties are ignored since they are never rendered. */
    public static CollectedImports collect(EmbeddableNode embeddable, Set<String> enumNames) {
        return CollectedImports.decorator("Embeddable")
            .plus(fromProperties(EmbeddableGenerator.renderedProperties(embeddable), enumNames));
    }

    static CollectedImports fromProperties(List<EntityProperty> properties, Set<String> enumNames) {
        CollectedImports imports = CollectedImports.EMPTY;
        if (properties == null) return imports;
        for (EntityProperty property : properties) {
            imports = imports.plus(fromProperty(property, enumNames));
        }
        return imports;
    }

    static CollectedImports fromProperty(EntityProperty property, Set<String> enumNames) {
        PropertyDecorator decorator = PropertyDecorator.of(property, enumNames);
        CollectedImports imports = CollectedImports.decorator(decorator.decoratorName());
        if (decorator == PropertyDecorator.ENUM && !property.hasInlineEnum()) {
            imports = imports.plus(CollectedImports.referencedEnum(Identifiers.sanitize(property.type)));
        }
        return imports;
    }

    static CollectedImports fromIndex(EntityIndex index) {
        if (index.properties == null || index.properties.isEmpty()) {
            return CollectedImports.EMPTY;
        }
        return CollectedImports.decorator(index.isUnique ? "Unique" : "Index");
    }

    /**
     * Contribution of a single edge to the node {@code nodeId}.
     *
     * <p>Edges that do not leave the node, or whose target is unknown, contribute nothing.
     * A target that is an interface is imported as a type and an enum target joins the enum
     * imports; any other target is imported as a related type unless it carries the node's own
     * name. Relation kinds without a decorator
     * still import their target.
     */
    static CollectedImports fromEdge(
            RelationshipEdge edge, String nodeId, String ownName, Map<String, DiagramNode> nodesById) {
        RelationshipData data = edge.data();
        if (data == null || data.relationType == null || !nodeId.equals(edge.source())) {
            return CollectedImports.EMPTY;
        }
        DiagramNode target = nodesById.get(edge.target());
        if (target == null) {
            return CollectedImports.EMPTY;
        }

        CollectedImports imports = CollectedImports.EMPTY;
        Optional<RelationDecorator> decorator = RelationDecorator.of(data.relationType);
        if (decorator.isPresent()) {
            imports = imports.plus(CollectedImports.decorator(decorator.get().decoratorName()));
            if (decorator.get().isCollection()) {
                imports = imports.withCollection();
            }
            if (data.cascade) {
                imports = imports.withCascade();
            }
        }

        String targetName = Identifiers.sanitize(target.name());
        if (target.kind() == NodeKind.INTERFACE) {
            imports = imports.plus(CollectedImports.referencedInterface(targetName));
        } else if (target.kind() == NodeKind.ENUM) {
            imports = imports.plus(CollectedImports.referencedEnum(targetName));
        } else if (!targetName.equals(ownName)) {
            imports = imports.plus(CollectedImports.relatedType(targetName));
        }
        return imports;
    }
}
