package com.ibprovider.provider.network;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ibprovider.connector.Ipv4Network;
import com.ibprovider.connector.Ipv6Network;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class NetworkFlattenerTest {
  private final NetworkFlattener flattener = new NetworkFlattener(new ObjectMapper());

  @ParameterizedTest
  @CsvSource({
    "10.0.0.0/24, 0, 0",
    "10.0.0.0/24, 500, 127",
    "10.0.0.0/24, 1000, 254",
    "10.0.0.0/16, 333, 21822",
    "10.0.0.0/30, 500, 1",
    "10.0.0.0/30, 1000, 2",
    "0.0.0.0/0, 1000, 4294967294",
    "0.0.0.0/0, 500, 2147483647",
    "10.0.0.0/8, 1000, 16777214",
    "10.0.0.0/31, 1000, 0",
    "10.0.0.1/32, 1000, 0"
  })
  void estimatesAvailableAddresses(String cidr, long utilization, long expected) {
    assertThat(NetworkFlattener.calculateAvailableIpv4s(cidr, utilization)).isEqualTo(expected);
  }

  @ParameterizedTest
  @ValueSource(strings = {
    "not-a-cidr", "10.0.0.0", "10.0.0.0/33", "300.0.0.0/8", "10.0.0/8", "2001:db8::/64", "",
    "010.0.0.0/8", "10.00.0.0/16", "192.168.001.0/24"
  })
  void invalidCidrYieldsZero(String cidr) {
    assertThat(NetworkFlattener.calculateAvailableIpv4s(cidr, 1000)).isZero();
  }

  @Test
  void utilizationIsClampedToPerMilleRange() {
    assertThat(NetworkFlattener.calculateAvailableIpv4s("10.0.0.0/24", 1500)).isEqualTo(254);
    assertThat(NetworkFlattener.calculateAvailableIpv4s("10.0.0.0/24", -5)).isZero();
  }

  @Test
  void flattensIpv4NetworkWithAttributes() throws Exception {
    Map<String, Object> ea = new LinkedHashMap<>();
    ea.put("Site", "HQ");
    ea.put("VLAN", 12);
    Ipv4Network network = new Ipv4Network(
        "network/abc:10.0.0.0/24/default", "default", "10.0.0.0/24", "office lan", ea, 500);

    Map<String, Object> flat = flattener.flattenIpv4(network);

    assertThat(flat)
        .containsEntry("id", "network/abc:10.0.0.0/24/default")
        .containsEntry("network_view", "default")
        .containsEntry("cidr", "10.0.0.0/24")
        .containsEntry("comment", "office lan")
        .containsEntry("ext_attrs", "{\"Site\":\"HQ\",\"VLAN\":12}")
        .containsEntry("utilization", 500L)
        .containsEntry("est_available_ip", 127L);
  }

  @Test
  void ipv4WithoutCidrOrCommentOmitsThem() throws Exception {
    Ipv4Network network = new Ipv4Network("network/abc", "lab", null, null, null, 100);

    Map<String, Object> flat = flattener.flattenIpv4(network);

    assertThat(flat).doesNotContainKeys("cidr", "est_available_ip", "comment");
    assertThat(flat).containsEntry("ext_attrs", "{}").containsEntry("utilization", 100L);
  }

  @Test
  void ipv6UsesPlaceholderStatistics() throws Exception {
    Ipv6Network network = new Ipv6Network(
        "ipv6network/xyz:2001%3Adb8%3A%3A/64/default", "default", "2001:db8::/64", null, Map.of());

    Map<String, Object> flat = flattener.flattenIpv6(network);

    assertThat(flat)
        .containsEntry("cidr", "2001:db8::/64")
        .containsEntry("utilization", -1L)
        .containsEntry("est_available_ip", -1L)
        .containsEntry("ext_attrs", "{}")
        .doesNotContainKey("comment");
  }
}
