package co.mikrodiagram.generators.mikroorm;

import co.mikrodiagram.core.model.DiagramNode;
import co.mikrodiagram.core.model.FetchType;
import co.mikrodiagram.core.model.RelationType;
import co.mikrodiagram.core.model.RelationshipData;
import co.mikrodiagram.core.model.RelationshipEdge;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Renders a relationship edge as a decorator line and a field declaration on the source node.
 *
 * <p>An edge is only ever rendered from its source side, so each relationship appears once.
 */
public final class RelationshipGenerator {

    private RelationshipGenerator() {
    }

    /**
     * Option entries in fixed order: cascade, nullable, orphanRemoval, eager, deleteRule.
     * Composition always removes orphans. Lazy fetching is the default and is never written.
     */
    static List<String> relationshipOptions(RelationshipData data) {
        List<String> options = new ArrayList<>();
        if (data.cascade) {
            options.add("cascade: [Cascade.ALL]");
        }
        if (data.isNullable) {
            options.add("nullable: true");
        }
        if (data.orphanRemoval || data.relationType == RelationType.Composition) {
            options.add("orphanRemoval: true");
        }
        if (data.fetchType == FetchType.Eager) {
            options.add("eager: true");
        }
        if (data.deleteRule != null && !data.deleteRule.isEmpty()) {
            options.add("deleteRule: '" + data.deleteRule + "'");
        }
        return options;
    }

    /**
     * The options argument as a multi-line object literal prefixed with {@code ", "}, or the
     * empty string when no option applies.
     */
    public static String generateRelationshipOptions(RelationshipData data, int indentSize) {
        List<String> options = relationshipOptions(data);
        if (options.isEmpty()) {
            return "";
        }
        String ind = Identifiers.indent(2, indentSize);
        String closeInd = Identifiers.indent(1, indentSize);
        List<String> indented = new ArrayList<>();
        for (String option : options) {
            indented.add(ind + option);
        }
        return ", {\n" + String.join(",\n", indented) + "\n" + closeInd + "}";
    }

    /**
     * Render {@code edge} as seen from {@code source}.
     *
     * @return the decorator and declaration lines, or empty when {@code source} is not the
     *         edge's source, the edge has no data, or the relation type has no decorator
     */
    public static Optional<String> generateRelationship(
            RelationshipEdge edge, DiagramNode source, DiagramNode target, int indentSize) {
        RelationshipData data = edge.data();
        if (data == null || data.relationType == null) return Optional.empty();
        if (!source.id().equals(edge.source())) return Optional.empty();

        Optional<RelationDecorator> decorator = RelationDecorator.of(data.relationType);
        if (decorator.isEmpty()) return Optional.empty();

        String ind = Identifiers.indent(1, indentSize);
        String targetName = Identifiers.sanitize(target.name());
        String mappedBy = data.hasInverseSide()
            ? ", " + data.sourceProperty + " => " + data.sourceProperty + "." + data.targetProperty
            : "";
        String options = generateRelationshipOptions(data, indentSize);

        String decoratorLine = ind + "@" + decorator.get().decoratorName()
            + "(() => " + targetName + mappedBy + options + ")";

        String declaration;
        if (decorator.get().isCollection()) {
            declaration = ind + data.sourceProperty + ": Collection<" + targetName + "> = new Collection<"
                + targetName + ">(this)";
        } else {
            String nullable = data.isNullable ? "?" : "!";
            declaration = ind + data.sourceProperty + nullable + ": " + targetName;
        }
        return Optional.of(decoratorLine + "\n" + declaration);
    }
}
