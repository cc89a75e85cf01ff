package com.ibprovider.connector;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads WAPI {@code extattrs}, dropping the {@code {"value": ...}} wrapper around each attribute.
 *
 * <p>{@code {"Site": {"value": "HQ"}, "Owners": {"value": ["a", "b"]}}} becomes
 * {@code {Site=HQ, Owners=[a, b]}}. Entries without a {@code value} member are kept as-is.
 */
public class ExtensibleAttributesDeserializer extends JsonDeserializer<Map<String, Object>> {

  @Override
  public Map<String, Object> deserialize(JsonParser parser, DeserializationContext ctxt)
      throws IOException {
    JsonNode root = parser.readValueAsTree();
    Map<String, Object> attributes = new LinkedHashMap<>();
    if (root == null || !root.isObject()) {
      return attributes;
    }
    Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      JsonNode wrapped = field.getValue();
      JsonNode value = wrapped.isObject() && wrapped.has("value") ? wrapped.get("value") : wrapped;
      attributes.put(field.getKey(), ctxt.readTreeAsValue(value, Object.class));
    }
    return attributes;
  }

  @Override
  public Map<String, Object> getNullValue(DeserializationContext ctxt) {
    return new LinkedHashMap<>();
  }
}
