package com.ibprovider.provider.network;

import com.ibprovider.connector.IbConnector;
import com.ibprovider.connector.IbObject;
import com.ibprovider.connector.Ipv4Network;
import com.ibprovider.connector.Ipv6Network;
import com.ibprovider.connector.QueryParams;
import com.ibprovider.provider.schema.Diagnostics;
import com.ibprovider.provider.schema.ResourceData;
import com.ibprovider.provider.schema.SchemaValidationException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Read functions of the IPv4 and IPv6 network data sources. */
@Component
public class NetworkReader {
  private static final Logger log = LoggerFactory.getLogger(NetworkReader.class);

  private final NetworkFlattener flattener;
  private final Clock clock;

  public NetworkReader(NetworkFlattener flattener, Clock clock) {
    this.flattener = flattener;
    this.clock = clock;
  }

  public Diagnostics readIpv4(ResourceData data, IbConnector connector) {
    return read(data, connector, IbObject.ipv4Network(), flattener::flattenIpv4);
  }

  public Diagnostics readIpv6(ResourceData data, IbConnector connector) {
    return read(data, connector, IbObject.ipv6Network(), flattener::flattenIpv6);
  }

  private <T> Diagnostics read(
      ResourceData data, IbConnector connector, IbObject<T> object, Flattener<T> flatten) {
    List<String> returnFields = new ArrayList<>(object.returnFields());
    returnFields.add("extattrs");
    object.setReturnFields(returnFields);

    Map<String, String> filters = filterFromMap(data.getMap("filters"));
    QueryParams queryParams = QueryParams.of(false, filters);

    List<T> networks;
    try {
      networks = connector.getObject(object, "", queryParams);
    } catch (RuntimeException ex) {
      log.error("Reading '{}' objects failed", object.objectType(), ex);
      return Diagnostics.error("getting network failed: " + ex.getMessage());
    }
    if (networks == null) {
      return Diagnostics.error("API returns a nil/empty ID for the network");
    }

    List<Object> results = new ArrayList<>(networks.size());
    for (T network : networks) {
      try {
        results.add(flatten.flatten(network));
      } catch (Exception ex) {
        log.error("Flattening '{}' object failed", object.objectType(), ex);
        return Diagnostics.error("failed to flatten network: " + ex.getMessage());
      }
    }

    try {
      data.set("results", results);
    } catch (SchemaValidationException ex) {
      return Diagnostics.fromException(ex);
    }

    // No natural key: every read gets a fresh id.
    data.setId(String.valueOf(clock.instant().getEpochSecond()));
    log.debug("Read {} '{}' objects", results.size(), object.objectType());
    return Diagnostics.empty();
  }

  static Map<String, String> filterFromMap(Map<String, Object> raw) {
    Map<String, String> filters = new LinkedHashMap<>();
    if (raw == null) {
      return filters;
    }
    for (Map.Entry<String, Object> entry : raw.entrySet()) {
      filters.put(entry.getKey(), entry.getValue() == null ? "" : entry.getValue().toString());
    }
    return filters;
  }

  @FunctionalInterface
  private interface Flattener<T> {
    Map<String, Object> flatten(T network) throws Exception;
  }
}
