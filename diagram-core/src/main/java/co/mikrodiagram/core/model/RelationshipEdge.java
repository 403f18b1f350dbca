package co.mikrodiagram.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Directed relationship between two nodes, referenced by node id.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RelationshipEdge(String id, String source, String target, RelationshipData data) {
}
