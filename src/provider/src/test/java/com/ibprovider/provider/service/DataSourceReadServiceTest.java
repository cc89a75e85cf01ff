package com.ibprovider.provider.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ibprovider.connector.IbConnector;
import com.ibprovider.connector.IbObject;
import com.ibprovider.connector.Ipv4Network;
import com.ibprovider.connector.QueryParams;
import com.ibprovider.connector.WapiException;
import com.ibprovider.provider.InfobloxProvider;
import com.ibprovider.provider.api.NotFoundException;
import com.ibprovider.provider.model.DataSourceDescriptor;
import com.ibprovider.provider.model.ReadResult;
import com.ibprovider.provider.network.NetworkDataSources;
import com.ibprovider.provider.network.NetworkFlattener;
import com.ibprovider.provider.network.NetworkReader;
import com.ibprovider.provider.schema.Attribute;
import com.ibprovider.provider.schema.ResourceSchema;
import com.ibprovider.provider.schema.SchemaValidationException;
import com.ibprovider.provider.schema.ValueType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DataSourceReadServiceTest {
  private IbConnector connector;
  private SimpleMeterRegistry meterRegistry;
  private DataSourceReadService service;

  @BeforeEach
  void setUp() {
    connector = mock(IbConnector.class);
    meterRegistry = new SimpleMeterRegistry();
    NetworkReader reader = new NetworkReader(
        new NetworkFlattener(new ObjectMapper()),
        Clock.fixed(Instant.ofEpochSecond(1_760_000_000L), ZoneOffset.UTC));
    service = new DataSourceReadService(new InfobloxProvider(reader), connector, meterRegistry);
  }

  @Test
  void describeListsBothNetworkDataSources() {
    List<DataSourceDescriptor> descriptors = service.describe();

    assertThat(descriptors).extracting(DataSourceDescriptor::name)
        .containsExactly(InfobloxProvider.IPV4_NETWORK, InfobloxProvider.IPV6_NETWORK);
    assertThat(descriptors.get(0).schema().attributes()).containsOnlyKeys("filters", "results");
  }

  @Test
  void networkSchemaDeclaresFiltersAndComputedResults() {
    for (DataSourceDescriptor descriptor : service.describe()) {
      ResourceSchema schema = descriptor.schema();

      Attribute filters = schema.attribute("filters");
      assertThat(filters.type()).isEqualTo(ValueType.MAP);
      assertThat(filters.required()).isTrue();
      assertThat(filters.computed()).isFalse();

      Attribute results = schema.attribute("results");
      assertThat(results.type()).isEqualTo(ValueType.LIST);
      assertThat(results.computed()).isTrue();
      assertThat(results.configurable()).isFalse();
      assertThat(results.description()).isEqualTo("List of networks matching filters.");

      ResourceSchema network = results.elem();
      assertThat(network.attributes().keySet()).containsExactly(
          "id", "network_view", "cidr", "comment", "ext_attrs", "utilization", "est_available_ip");
      assertThat(network.attribute("network_view").optional()).isTrue();
      assertThat(network.attribute("network_view").defaultValue())
          .isEqualTo(NetworkDataSources.DEFAULT_NETWORK_VIEW)
          .isEqualTo("default");
      assertThat(network.attribute("utilization").type()).isEqualTo(ValueType.INT);
      assertThat(network.attribute("est_available_ip").type()).isEqualTo(ValueType.INT);
      assertThat(network.attribute("est_available_ip").description())
          .isEqualTo("Total unused IP addresses in the network.");
      assertThat(network.attribute("ext_attrs").computed()).isTrue();
    }
  }

  @Test
  @SuppressWarnings("unchecked")
  void readReturnsStateAndSyntheticId() {
    when(connector.getObject(any(IbObject.class), eq(""), any(QueryParams.class)))
        .thenReturn(List.of(new Ipv4Network("network/a", "default", "192.0.2.0/24", null, null, 500)));

    ReadResult result = service.read(
        InfobloxProvider.IPV4_NETWORK, Map.of("filters", Map.of("network", "192.0.2.0/24")));

    assertThat(result.id()).isEqualTo("1760000000");
    assertThat(result.diagnostics().hasErrors()).isFalse();
    assertThat(result.state()).containsKeys("filters", "results");
    assertThat((List<Map<String, Object>>) result.state().get("results"))
        .singleElement()
        .satisfies(network -> assertThat(network).containsEntry("est_available_ip", 127L));
    assertThat(meterRegistry.counter("provider.datasource.reads.total").count()).isEqualTo(1.0);
  }

  @Test
  @SuppressWarnings("unchecked")
  void failedReadIsCountedAndReported() {
    when(connector.getObject(any(IbObject.class), eq(""), any(QueryParams.class)))
        .thenThrow(new WapiException("WAPI request failed: connection refused"));

    ReadResult result = service.read(InfobloxProvider.IPV6_NETWORK, Map.of("filters", Map.of()));

    assertThat(result.diagnostics().hasErrors()).isTrue();
    assertThat(result.id()).isEmpty();
    assertThat(meterRegistry.counter("provider.datasource.reads.failed.total").count()).isEqualTo(1.0);
  }

  @Test
  void unknownDataSourceIsNotFound() {
    assertThatThrownBy(() -> service.read("infoblox_zone_auth", Map.of("filters", Map.of())))
        .isInstanceOf(NotFoundException.class);
    verifyNoInteractions(connector);
  }

  @Test
  void invalidConfigurationIsRejectedBeforeQuerying() {
    assertThatThrownBy(() -> service.read(InfobloxProvider.IPV4_NETWORK, Map.of()))
        .isInstanceOf(SchemaValidationException.class);
    verifyNoInteractions(connector);
  }
}
