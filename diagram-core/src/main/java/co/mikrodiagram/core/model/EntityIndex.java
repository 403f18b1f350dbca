package co.mikrodiagram.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Entity-level index or composite unique constraint.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EntityIndex {
  public String id;
  /** Optional explicit index name. */
  public String name;
  /** Property names covered by the index. */
  public List<String> properties = new ArrayList<>();
  public boolean isUnique;
}
