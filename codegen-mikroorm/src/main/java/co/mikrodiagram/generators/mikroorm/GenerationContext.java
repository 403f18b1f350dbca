package co.mikrodiagram.generators.mikroorm;

import co.mikrodiagram.core.model.DiagramNode;
import co.mikrodiagram.core.model.NodeKind;
import co.mikrodiagram.core.model.RelationshipEdge;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only view of the whole diagram shared by the per-node generators.
 *
 * @param nodesById every node by id; with duplicate ids the first node wins
 * @param edges     every relationship edge, in diagram order
 * @param enumNames names of the standalone enum nodes, as entered
 * @param options   generation settings
 */
public record GenerationContext(
    Map<String, DiagramNode> nodesById,
    List<RelationshipEdge> edges,
    Set<String> enumNames,
    GeneratorOptions options
) {

    public static GenerationContext of(List<DiagramNode> nodes, List<RelationshipEdge> edges, GeneratorOptions options) {
        Map<String, DiagramNode> nodesById = new LinkedHashMap<>();
        Set<String> enumNames = new LinkedHashSet<>();
        for (DiagramNode node : nodes) {
            nodesById.putIfAbsent(node.id(), node);
            if (node.kind() == NodeKind.ENUM && node.name() != null) {
                enumNames.add(node.name());
            }
        }
        return new GenerationContext(
            Collections.unmodifiableMap(nodesById),
            List.copyOf(edges),
            Collections.unmodifiableSet(enumNames),
            options != null ? options : GeneratorOptions.defaults());
    }

    public int indentSize() {
        return options.indentSize();
    }
}
