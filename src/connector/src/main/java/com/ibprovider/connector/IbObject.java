package com.ibprovider.connector;

import java.util.ArrayList;
import java.util.List;

/**
 * WAPI object type together with the fields a request asks the appliance to return.
 *
 * <p>Instances are mutable: callers usually start from the default return fields and append
 * extra ones (for example {@code extattrs}) before issuing a request.
 */
public final class IbObject<T> {
  static final String NETWORK = "network";
  static final String IPV6_NETWORK = "ipv6network";

  private final String objectType;
  private final Class<T> resultType;
  private List<String> returnFields;

  private IbObject(String objectType, Class<T> resultType, List<String> defaultReturnFields) {
    this.objectType = objectType;
    this.resultType = resultType;
    this.returnFields = new ArrayList<>(defaultReturnFields);
  }

  public static IbObject<Ipv4Network> ipv4Network() {
    return new IbObject<>(
        NETWORK, Ipv4Network.class, List.of("network", "network_view", "comment", "utilization"));
  }

  public static IbObject<Ipv6Network> ipv6Network() {
    return new IbObject<>(IPV6_NETWORK, Ipv6Network.class, List.of("network", "network_view", "comment"));
  }

  public String objectType() {
    return objectType;
  }

  public Class<T> resultType() {
    return resultType;
  }

  public List<String> returnFields() {
    return List.copyOf(returnFields);
  }

  public void setReturnFields(List<String> returnFields) {
    this.returnFields = returnFields == null ? new ArrayList<>() : new ArrayList<>(returnFields);
  }
}
