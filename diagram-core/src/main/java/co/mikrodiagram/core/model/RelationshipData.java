package co.mikrodiagram.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Payload of a relationship edge.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RelationshipData {
  public RelationType relationType;
  /** Field name on the source node, e.g. {@code posts}. */
  public String sourceProperty;
  /** Inverse field name on the target node. Present only for bidirectional relations. */
  public String targetProperty;
  public boolean isNullable;
  public boolean cascade;
  public boolean orphanRemoval;
  public FetchType fetchType;
  /** Raw delete rule, e.g. {@code cascade} or {@code set null}. */
  public String deleteRule;

  public boolean hasInverseSide() {
    return targetProperty != null && !targetProperty.isEmpty();
  }
}
