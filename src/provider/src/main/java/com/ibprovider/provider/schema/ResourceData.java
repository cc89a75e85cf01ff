package com.ibprovider.provider.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration and computed state of a single data source read.
 *
 * <p>Values written through {@link #set(String, Object)} are checked against the schema and
 * normalized: integers become {@code Long}, map values become strings, and absent optional
 * attributes of list elements receive their declared default.
 */
public final class ResourceData {
  private final ResourceSchema schema;
  private final Map<String, Object> config;
  private final Map<String, Object> state = new LinkedHashMap<>();
  private String id = "";

  private ResourceData(ResourceSchema schema, Map<String, Object> config) {
    this.schema = schema;
    this.config = config;
  }

  /**
   * Validates caller configuration and prepares an empty state for a read.
   *
   * @throws SchemaValidationException when a required attribute is missing, an attribute is
   *     unknown or computed-only, or a value has the wrong type
   */
  public static ResourceData forRead(ResourceSchema schema, Map<String, Object> config) {
    Map<String, Object> supplied = config == null ? Map.of() : config;
    Map<String, Object> normalized = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : supplied.entrySet()) {
      Attribute attribute = schema.attribute(entry.getKey());
      if (attribute == null) {
        throw new SchemaValidationException("unsupported attribute '" + entry.getKey() + "'");
      }
      if (!attribute.configurable()) {
        throw new SchemaValidationException("attribute '" + entry.getKey() + "' is computed and cannot be set");
      }
      if (entry.getValue() != null) {
        normalized.put(entry.getKey(), normalize(entry.getKey(), attribute, entry.getValue()));
      }
    }
    for (Map.Entry<String, Attribute> entry : schema.attributes().entrySet()) {
      if (entry.getValue().required() && !normalized.containsKey(entry.getKey())) {
        throw new SchemaValidationException("missing required attribute '" + entry.getKey() + "'");
      }
    }
    return new ResourceData(schema, Collections.unmodifiableMap(normalized));
  }

  /** Returns state if set, else configuration, else the declared default or the type's zero value. */
  public Object get(String key) {
    Attribute attribute = requireAttribute(key);
    if (state.containsKey(key)) {
      return state.get(key);
    }
    if (config.containsKey(key)) {
      return config.get(key);
    }
    if (attribute.defaultValue() != null) {
      return attribute.defaultValue();
    }
    return zeroValue(attribute.type());
  }

  public Map<String, Object> getMap(String key) {
    Object value = get(key);
    if (!(value instanceof Map)) {
      throw new SchemaValidationException("attribute '" + key + "' is not a map");
    }
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
      copy.put(String.valueOf(entry.getKey()), entry.getValue());
    }
    return Collections.unmodifiableMap(copy);
  }

  public void set(String key, Object value) {
    Attribute attribute = requireAttribute(key);
    state.put(key, value == null ? null : normalize(key, attribute, value));
  }

  public void setId(String id) {
    this.id = id == null ? "" : id;
  }

  public String getId() {
    return id;
  }

  /** Configuration merged with computed state, in schema order. */
  public Map<String, Object> state() {
    Map<String, Object> merged = new LinkedHashMap<>();
    for (String key : schema.attributes().keySet()) {
      if (state.containsKey(key)) {
        merged.put(key, state.get(key));
      } else if (config.containsKey(key)) {
        merged.put(key, config.get(key));
      }
    }
    return Collections.unmodifiableMap(merged);
  }

  private Attribute requireAttribute(String key) {
    Attribute attribute = schema.attribute(key);
    if (attribute == null) {
      throw new SchemaValidationException("unsupported attribute '" + key + "'");
    }
    return attribute;
  }

  private static Object normalize(String path, Attribute attribute, Object value) {
    return switch (attribute.type()) {
      case STRING -> requireType(path, "string", value, String.class);
      case INT -> normalizeInt(path, value);
      case BOOL -> requireType(path, "bool", value, Boolean.class);
      case MAP -> normalizeMap(path, value);
      case LIST -> normalizeList(path, attribute, value);
    };
  }

  private static Object requireType(String path, String expected, Object value, Class<?> type) {
    if (!type.isInstance(value)) {
      throw typeMismatch(path, expected, value);
    }
    return value;
  }

  private static Long normalizeInt(String path, Object value) {
    if (!(value instanceof Integer || value instanceof Long || value instanceof Short)) {
      throw typeMismatch(path, "integer", value);
    }
    return ((Number) value).longValue();
  }

  private static Map<String, Object> normalizeMap(String path, Object value) {
    if (!(value instanceof Map)) {
      throw typeMismatch(path, "map", value);
    }
    Map<?, ?> raw = (Map<?, ?>) value;
    Map<String, Object> result = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      Object element = entry.getValue();
      if (element instanceof String || element instanceof Number || element instanceof Boolean) {
        result.put(String.valueOf(entry.getKey()), String.valueOf(element));
      } else {
        throw typeMismatch(path + "." + entry.getKey(), "string", element);
      }
    }
    return Collections.unmodifiableMap(result);
  }

  private static List<Object> normalizeList(String path, Attribute attribute, Object value) {
    if (!(value instanceof List)) {
      throw typeMismatch(path, "list", value);
    }
    List<?> raw = (List<?>) value;
    List<Object> result = new ArrayList<>(raw.size());
    for (int i = 0; i < raw.size(); i++) {
      Object element = raw.get(i);
      String elementPath = path + "." + i;
      if (attribute.elem() == null) {
        result.add(element);
      } else if (element instanceof Map) {
        result.add(normalizeObject(elementPath, attribute.elem(), (Map<?, ?>) element));
      } else {
        throw typeMismatch(elementPath, "object", element);
      }
    }
    return Collections.unmodifiableList(result);
  }

  private static Map<String, Object> normalizeObject(String path, ResourceSchema elem, Map<?, ?> object) {
    Map<String, Object> result = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : object.entrySet()) {
      String key = String.valueOf(entry.getKey());
      if (elem.attribute(key) == null) {
        throw new SchemaValidationException("unsupported attribute '" + path + "." + key + "'");
      }
    }
    for (Map.Entry<String, Attribute> entry : elem.attributes().entrySet()) {
      Object element = object.get(entry.getKey());
      if (element == null) {
        element = entry.getValue().defaultValue();
      }
      if (element != null) {
        result.put(entry.getKey(), normalize(path + "." + entry.getKey(), entry.getValue(), element));
      }
    }
    return Collections.unmodifiableMap(result);
  }

  private static Object zeroValue(ValueType type) {
    return switch (type) {
      case STRING -> "";
      case INT -> 0L;
      case BOOL -> false;
      case LIST -> List.of();
      case MAP -> Map.of();
    };
  }

  private static SchemaValidationException typeMismatch(String path, String expected, Object value) {
    String actual = value == null ? "null" : value.getClass().getSimpleName();
    return new SchemaValidationException(
        "attribute '" + path + "' expects " + expected + " but got " + actual);
  }
}
