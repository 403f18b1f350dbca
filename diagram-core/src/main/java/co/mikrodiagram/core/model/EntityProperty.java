package co.mikrodiagram.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A single property of an entity, embeddable or interface.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EntityProperty {
  /** Sentinel {@link #type} for a property backed by an inline {@link #enumDef}. */
  public static final String ENUM_TYPE = "enum";

  public String id;
  public String name;
  /**
   * Declared type.
   *
   * <p>One of the primitive tokens ({@code string}, {@code number}, {@code boolean},
   * {@code Date}, {@code bigint}, {@code Buffer}, {@code uuid}), the sentinel
   * {@code "enum"}, or the name of an enum node declared elsewhere in the diagram.
   */
  public String type;
  public boolean isPrimaryKey;
  public boolean isUnique;
  public boolean isNullable;
  /** Raw literal text, e.g. {@code 0}, {@code true}, {@code new Date()} or {@code draft}. */
  public String defaultValue;
  /** Inline enum; only meaningful when {@link #type} is {@code "enum"}. */
  public EnumDefinition enumDef;

  /** True when this property declares its own enum inline. */
  public boolean hasInlineEnum() {
    return ENUM_TYPE.equals(type) && enumDef != null;
  }
}
