package co.mikrodiagram.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Loading strategy of a relationship. Lazy is the ORM default. */
public enum FetchType {
  @JsonProperty("lazy") Lazy,
  @JsonProperty("eager") Eager
}
