package com.ibprovider.provider.schema;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Ordered set of named attributes. */
public record ResourceSchema(Map<String, Attribute> attributes) {
  public ResourceSchema {
    attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  public Attribute attribute(String name) {
    return attributes.get(name);
  }

  @JsonValue
  public Map<String, Attribute> attributes() {
    return attributes;
  }
}
