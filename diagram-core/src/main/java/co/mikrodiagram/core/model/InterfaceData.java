package co.mikrodiagram.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class InterfaceData {
  public String name;
  public List<EntityProperty> properties = new ArrayList<>();
  public List<InterfaceMethod> methods = new ArrayList<>();
}
