package co.mikrodiagram.core.model;

/**
 * Relationship kinds that can connect two diagram nodes.
 *
 * <p>Constant names are the JSON wire values. The four cardinality kinds map onto ORM
 * relation decorators; {@code Composition} and {@code Aggregation} are UML refinements of
 * one-to-many; {@code Inheritance}, {@code Implementation} and {@code Dependency} exist for
 * the diagram only.
 */
public enum RelationType {
  OneToOne,
  OneToMany,
  ManyToOne,
  ManyToMany,
  Composition,
  Aggregation,
  Inheritance,
  Implementation,
  Dependency;

  /**
   * The relation type seen from the target side.
   * OneToMany and ManyToOne swap; every other kind is its own inverse.
   */
  public RelationType inverse() {
    return switch (this) {
      case OneToMany -> ManyToOne;
      case ManyToOne -> OneToMany;
      case OneToOne, ManyToMany, Composition, Aggregation,
          Inheritance, Implementation, Dependency -> this;
    };
  }
}
