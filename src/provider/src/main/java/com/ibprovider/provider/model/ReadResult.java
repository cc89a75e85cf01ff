package com.ibprovider.provider.model;

import com.ibprovider.provider.schema.Diagnostics;
import java.util.Map;

/**
 * Outcome of one data source read.
 *
 * @param dataSource data source name
 * @param id synthetic identifier assigned by the read, empty when the read failed
 * @param state configuration merged with computed attributes
 * @param diagnostics errors and warnings raised during the read
 */
public record ReadResult(String dataSource, String id, Map<String, Object> state, Diagnostics diagnostics) {}
