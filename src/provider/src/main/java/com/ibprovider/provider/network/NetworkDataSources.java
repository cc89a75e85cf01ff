package com.ibprovider.provider.network;

import com.ibprovider.provider.schema.Attribute;
import com.ibprovider.provider.schema.DataSource;
import com.ibprovider.provider.schema.ResourceSchema;
import com.ibprovider.provider.schema.ValueType;
import java.util.LinkedHashMap;
import java.util.Map;

public final class NetworkDataSources {
  public static final String DEFAULT_NETWORK_VIEW = "default";

  private NetworkDataSources() {}

  public static DataSource ipv4Network(NetworkReader reader) {
    return dataSourceNetwork().withRead(reader::readIpv4);
  }

  public static DataSource ipv6Network(NetworkReader reader) {
    return dataSourceNetwork().withRead(reader::readIpv6);
  }

  static DataSource dataSourceNetwork() {
    Map<String, Attribute> result = new LinkedHashMap<>();
    result.put("id", Attribute.builder(ValueType.STRING).computed().build());
    result.put("network_view", Attribute.builder(ValueType.STRING)
        .optional()
        .defaultValue(DEFAULT_NETWORK_VIEW)
        .build());
    result.put("cidr", Attribute.builder(ValueType.STRING).computed().build());
    result.put("comment", Attribute.builder(ValueType.STRING)
        .computed()
        .description("A string describing the network")
        .build());
    result.put("ext_attrs", Attribute.builder(ValueType.STRING)
        .computed()
        .description("The Extensible attributes for network datasource, as a map in JSON format")
        .build());
    result.put("utilization", Attribute.builder(ValueType.INT)
        .computed()
        .description("The percentage based on the IP addresses in use divided by the total addresses in the network")
        .build());
    result.put("est_available_ip", Attribute.builder(ValueType.INT)
        .computed()
        .description("Total unused IP addresses in the network.")
        .build());

    Map<String, Attribute> attributes = new LinkedHashMap<>();
    attributes.put("filters", Attribute.builder(ValueType.MAP).required().build());
    attributes.put("results", Attribute.builder(ValueType.LIST)
        .computed()
        .description("List of networks matching filters.")
        .elem(new ResourceSchema(result))
        .build());
    return new DataSource(new ResourceSchema(attributes), null);
  }
}
