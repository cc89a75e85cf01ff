package com.ibprovider.provider.schema;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Declaration of one attribute of a data source.
 *
 * <p>{@code elem} describes the objects held by a {@link ValueType#LIST} attribute; it is
 * {@code null} for scalar and map attributes.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Attribute(
    ValueType type,
    boolean required,
    boolean optional,
    boolean computed,
    Object defaultValue,
    String description,
    ResourceSchema elem) {

  public static Builder builder(ValueType type) {
    return new Builder(type);
  }

  /** Whether a caller may supply this attribute in configuration. */
  public boolean configurable() {
    return required || optional;
  }

  public static final class Builder {
    private final ValueType type;
    private boolean required;
    private boolean optional;
    private boolean computed;
    private Object defaultValue;
    private String description;
    private ResourceSchema elem;

    private Builder(ValueType type) {
      this.type = type;
    }

    public Builder required() {
      this.required = true;
      return this;
    }

    public Builder optional() {
      this.optional = true;
      return this;
    }

    public Builder computed() {
      this.computed = true;
      return this;
    }

    public Builder defaultValue(Object defaultValue) {
      this.defaultValue = defaultValue;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder elem(ResourceSchema elem) {
      this.elem = elem;
      return this;
    }

    public Attribute build() {
      if (required && (optional || defaultValue != null)) {
        throw new IllegalStateException("required attribute cannot be optional or carry a default");
      }
      if (elem != null && type != ValueType.LIST) {
        throw new IllegalStateException("only list attributes can declare an element schema");
      }
      return new Attribute(type, required, optional, computed, defaultValue, description, elem);
    }
  }
}
