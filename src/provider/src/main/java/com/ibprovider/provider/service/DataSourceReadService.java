package com.ibprovider.provider.service;

import com.ibprovider.connector.IbConnector;
import com.ibprovider.provider.InfobloxProvider;
import com.ibprovider.provider.model.DataSourceDescriptor;
import com.ibprovider.provider.model.ReadResult;
import com.ibprovider.provider.schema.DataSource;
import com.ibprovider.provider.schema.Diagnostics;
import com.ibprovider.provider.schema.ResourceData;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs data source reads against the configured appliance.
 *
 * <p>Every read starts from fresh state; nothing is cached between calls.
 */
@Service
public class DataSourceReadService {
  private static final Logger log = LoggerFactory.getLogger(DataSourceReadService.class);

  private final InfobloxProvider provider;
  private final IbConnector connector;
  private final Counter readCounter;
  private final Counter failedReadCounter;

  public DataSourceReadService(InfobloxProvider provider, IbConnector connector, MeterRegistry meterRegistry) {
    this.provider = provider;
    this.connector = connector;
    this.readCounter = meterRegistry.counter("provider.datasource.reads.total");
    this.failedReadCounter = meterRegistry.counter("provider.datasource.reads.failed.total");
  }

  /**
   * Lists the registered data sources with their schemas.
   *
   * @return descriptors in registration order
   */
  public List<DataSourceDescriptor> describe() {
    return provider.dataSources().entrySet().stream()
        .map(entry -> new DataSourceDescriptor(entry.getKey(), entry.getValue().schema()))
        .collect(Collectors.toList());
  }

  /**
   * Reads a data source.
   *
   * @param name registered data source name
   * @param config caller configuration, for example {@code {"filters": {"network_view": "default"}}}
   * @return state, id and diagnostics of the read
   */
  public ReadResult read(String name, Map<String, Object> config) {
    DataSource dataSource = provider.dataSource(name);
    ResourceData data = ResourceData.forRead(dataSource.schema(), config);

    readCounter.increment();
    Diagnostics diagnostics = dataSource.readFunction().read(data, connector);
    if (diagnostics.hasErrors()) {
      failedReadCounter.increment();
      log.warn("Data source {} read failed: {}", name, diagnostics);
    } else {
      Object results = data.state().get("results");
      int count = results instanceof List ? ((List<?>) results).size() : 0;
      log.info("Data source {} read {} results, id={}", name, count, data.getId());
    }
    return new ReadResult(name, data.getId(), data.state(), diagnostics);
  }
}
