package com.ibprovider.connector;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Search parameters of a WAPI GET request.
 *
 * <p>Search fields are kept sorted by name so identical filters always produce the same URL.
 */
public record QueryParams(boolean forceProxy, Map<String, String> searchFields) {
  public QueryParams {
    searchFields = searchFields == null
        ? Map.of()
        : Collections.unmodifiableMap(new TreeMap<>(searchFields));
  }

  public static QueryParams of(boolean forceProxy, Map<String, String> searchFields) {
    return new QueryParams(forceProxy, searchFields);
  }
}
