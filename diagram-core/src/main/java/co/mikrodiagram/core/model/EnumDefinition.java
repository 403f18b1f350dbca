package co.mikrodiagram.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Named, ordered list of enum members. Used both inline on a property and as the payload
 * of a standalone enum node.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EnumDefinition {
  public String name;
  public List<EnumValue> values = new ArrayList<>();

  public EnumDefinition() {
  }

  public EnumDefinition(String name, List<EnumValue> values) {
    this.name = name;
    this.values = values;
  }
}
