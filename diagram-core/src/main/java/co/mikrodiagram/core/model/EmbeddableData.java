package co.mikrodiagram.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Value object payload. Embeddables have no primary key and own no relationships.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EmbeddableData {
  public String name;
  public List<EntityProperty> properties = new ArrayList<>();
}
