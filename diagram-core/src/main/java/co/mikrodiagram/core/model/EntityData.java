package co.mikrodiagram.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class EntityData {
  public String name;
  /** Custom table name; the class name is used when absent. */
  public String tableName;
  public List<EntityProperty> properties = new ArrayList<>();
  public List<EntityIndex> indexes;
  /** Marker carried for export; has no effect on generated code. */
  public boolean isAggregateRoot;
}
