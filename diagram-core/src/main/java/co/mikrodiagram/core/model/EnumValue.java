package co.mikrodiagram.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class EnumValue {
  public String key;
  public String value;

  public EnumValue() {
  }

  public EnumValue(String key, String value) {
    this.key = key;
    this.value = value;
  }
}
