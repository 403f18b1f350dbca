package co.mikrodiagram.generators.mikroorm;

import co.mikrodiagram.core.model.RelationType;

import java.util.Optional;

/**
 * MikroORM relation decorators and the relation types rendered with each.
 */
public enum RelationDecorator {
    ONE_TO_ONE("OneToOne", false),
    ONE_TO_MANY("OneToMany", true),
    MANY_TO_ONE("ManyToOne", false),
    MANY_TO_MANY("ManyToMany", true);

    private final String decoratorName;
    private final boolean collection;

    RelationDecorator(String decoratorName, boolean collection) {
        this.decoratorName = decoratorName;
        this.collection = collection;
    }

    public String decoratorName() {
        return decoratorName;
    }

    /** True when the source side holds a {@code Collection} of targets. */
    public boolean isCollection() {
        return collection;
    }

    /**
     * Decorator for {@code relationType}. Composition and Aggregation reuse OneToMany.
     * Inheritance, Implementation and Dependency have no decorator.
     */
    public static Optional<RelationDecorator> of(RelationType relationType) {
        return switch (relationType) {
            case OneToOne -> Optional.of(ONE_TO_ONE);
            case OneToMany, Composition, Aggregation -> Optional.of(ONE_TO_MANY);
            case ManyToOne -> Optional.of(MANY_TO_ONE);
            case ManyToMany -> Optional.of(MANY_TO_MANY);
            case Inheritance, Implementation, Dependency -> Optional.empty();
        };
    }

    public static boolean isCollectionRelation(RelationType relationType) {
        return of(relationType).map(RelationDecorator::isCollection).orElse(false);
    }
}
