package co.mikrodiagram.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Method signature on an interface node. {@code parameters} is the raw parameter list text,
 * e.g. {@code "id: string, force?: boolean"}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class InterfaceMethod {
  public String id;
  public String name;
  public String parameters;
  public String returnType;
}
