package co.mikrodiagram.generators.mikroorm;

import co.mikrodiagram.core.model.DiagramNode;
import co.mikrodiagram.core.model.EmbeddableNode;
import co.mikrodiagram.core.model.EntityNode;
import co.mikrodiagram.core.model.EnumNode;
import co.mikrodiagram.core.model.InterfaceNode;
import co.mikrodiagram.core.model.RelationshipEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * MikroORM TypeScript code generator for a whole diagram.
 *
 * <p>Entities, embeddables, enums and interfaces are each generated into their own
 * {@code <Name>.ts} source. Cross-node references are resolved by looking names up in the
 * diagram, so the output does not depend on the order nodes are processed in, and
 * generating twice from the same input yields identical text.
 *
 * <p>Generation never fails on a well-formed diagram. Edges pointing at unknown nodes are
 * skipped; relation kinds without an ORM decorator (Inheritance, Implementation, Dependency)
 * contribute imports only.
 *
 * <p>Entry points:
 * <ul>
 *   <li>{@link #generateAll} - one map, name to source</li>
 *   <li>{@link #generateCategorized} - one map per node kind</li>
 * </ul>
 *
 * <p>Instances hold no state and may be shared between threads.
 */
public class MikroOrmGenerator {

    private static final Logger log = LoggerFactory.getLogger(MikroOrmGenerator.class);

    /**
     * Generate every node of the diagram into one map keyed by sanitized name.
     * Insertion order is entities, embeddables, enums, interfaces; a name produced twice
     * keeps the later source.
     */
    public Map<String, String> generateAll(List<DiagramNode> nodes, List<RelationshipEdge> edges, GeneratorOptions options) {
        return generateCategorized(nodes, edges, options).merged();
    }

    public Map<String, String> generateAll(List<DiagramNode> nodes, List<RelationshipEdge> edges) {
        return generateAll(nodes, edges, GeneratorOptions.defaults());
    }

    public CategorizedCode generateCategorized(List<DiagramNode> nodes, List<RelationshipEdge> edges, GeneratorOptions options) {
        GenerationContext context = GenerationContext.of(nodes, edges, options);
        NodesByKind byKind = NodesByKind.partition(nodes);
        log.debug("Generating {} entities, {} embeddables, {} enums, {} interfaces from {} edges",
            byKind.entities.size(), byKind.embeddables.size(), byKind.enums.size(),
            byKind.interfaces.size(), context.edges().size());

        CategorizedCode code = new CategorizedCode(
            EntityGenerator.generateAll(byKind.entities, context),
            EmbeddableGenerator.generateAll(byKind.embeddables, context),
            EnumGenerator.generateAll(byKind.enums),
            InterfaceGenerator.generateAll(byKind.interfaces, context.indentSize()));

        log.debug("Generated {} sources", code.size());
        return code;
    }

    public CategorizedCode generateCategorized(List<DiagramNode> nodes, List<RelationshipEdge> edges) {
        return generateCategorized(nodes, edges, GeneratorOptions.defaults());
    }

    /**
     * Generate a single node against the rest of the diagram. Returns the same text the node
     * gets from {@link #generateAll}.
     */
    public String generateNode(DiagramNode node, List<DiagramNode> nodes, List<RelationshipEdge> edges, GeneratorOptions options) {
        GenerationContext context = GenerationContext.of(nodes, edges, options);
        log.debug("Generating {} '{}'", node.kind().wireName(), node.name());
        return node.accept(new DiagramNode.Visitor<String>() {
            @Override
            public String visitEntity(EntityNode entity) {
                return EntityGenerator.generate(entity, context);
            }

            @Override
            public String visitEmbeddable(EmbeddableNode embeddable) {
                return EmbeddableGenerator.generate(embeddable, context);
            }

            @Override
            public String visitEnum(EnumNode enumNode) {
                return EnumGenerator.generate(enumNode);
            }

            @Override
            public String visitInterface(InterfaceNode interfaceNode) {
                return InterfaceGenerator.generate(interfaceNode, context.indentSize());
            }
        });
    }

    /** Diagram nodes split by kind, each list in diagram order. */
    private static final class NodesByKind implements DiagramNode.Visitor<Void> {
        final List<EntityNode> entities = new ArrayList<>();
        final List<EmbeddableNode> embeddables = new ArrayList<>();
        final List<EnumNode> enums = new ArrayList<>();
        final List<InterfaceNode> interfaces = new ArrayList<>();

        static NodesByKind partition(List<DiagramNode> nodes) {
            NodesByKind byKind = new NodesByKind();
            for (DiagramNode node : nodes) {
                if (node.name() == null) {
                    log.debug("Skipping node {} without a name", node.id());
                    continue;
                }
                node.accept(byKind);
            }
            return byKind;
        }

        @Override
        public Void visitEntity(EntityNode node) {
            entities.add(node);
            return null;
        }

        @Override
        public Void visitEmbeddable(EmbeddableNode node) {
            embeddables.add(node);
            return null;
        }

        @Override
        public Void visitEnum(EnumNode node) {
            enums.add(node);
            return null;
        }

        @Override
        public Void visitInterface(InterfaceNode node) {
            interfaces.add(node);
            return null;
        }
    }
}
