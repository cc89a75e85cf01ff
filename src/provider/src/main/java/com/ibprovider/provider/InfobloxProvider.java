package com.ibprovider.provider;

import com.ibprovider.provider.api.NotFoundException;
import com.ibprovider.provider.network.NetworkDataSources;
import com.ibprovider.provider.network.NetworkReader;
import com.ibprovider.provider.schema.DataSource;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Registry of the data sources this provider serves, keyed by their public name. */
@Component
public class InfobloxProvider {
  public static final String IPV4_NETWORK = "infoblox_ipv4_network";
  public static final String IPV6_NETWORK = "infoblox_ipv6_network";

  private final Map<String, DataSource> dataSources;

  public InfobloxProvider(NetworkReader networkReader) {
    Map<String, DataSource> registered = new LinkedHashMap<>();
    registered.put(IPV4_NETWORK, NetworkDataSources.ipv4Network(networkReader));
    registered.put(IPV6_NETWORK, NetworkDataSources.ipv6Network(networkReader));
    this.dataSources = Collections.unmodifiableMap(registered);
  }

  public Map<String, DataSource> dataSources() {
    return dataSources;
  }

  public DataSource dataSource(String name) {
    DataSource dataSource = dataSources.get(name);
    if (dataSource == null) {
      throw new NotFoundException("unknown data source '" + name + "'");
    }
    return dataSource;
  }
}
