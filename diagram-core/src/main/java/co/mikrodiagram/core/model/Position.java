package co.mikrodiagram.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Canvas coordinates of a node. Carried through loading and saving, never used by generators. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Position(double x, double y) {

  public static final Position ORIGIN = new Position(0, 0);
}
