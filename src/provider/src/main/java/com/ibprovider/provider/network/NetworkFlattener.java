package com.ibprovider.provider.network;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ibprovider.connector.Ipv4Network;
import com.ibprovider.connector.Ipv6Network;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Converts WAPI network objects into flat {@code results} entries. */
@Component
public class NetworkFlattener {
  // WAPI reports no utilization for IPv6; both families expose the same attributes.
  static final long UNSUPPORTED = -1L;
  private static final long MAX_UTILIZATION = 1000L;

  private final ObjectMapper objectMapper;

  public NetworkFlattener(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public Map<String, Object> flattenIpv4(Ipv4Network network) throws JsonProcessingException {
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("id", network.ref());
    result.put("network_view", network.networkView());
    result.put("ext_attrs", extAttrsJson(network.ea()));
    result.put("utilization", network.utilization());

    if (network.network() != null) {
      result.put("cidr", network.network());
      result.put("est_available_ip", calculateAvailableIpv4s(network.network(), network.utilization()));
    }
    if (network.comment() != null) {
      result.put("comment", network.comment());
    }
    return result;
  }

  public Map<String, Object> flattenIpv6(Ipv6Network network) throws JsonProcessingException {
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("id", network.ref());
    result.put("network_view", network.networkView());
    result.put("ext_attrs", extAttrsJson(network.ea()));
    result.put("utilization", UNSUPPORTED);
    result.put("est_available_ip", UNSUPPORTED);

    if (network.network() != null) {
      result.put("cidr", network.network());
    }
    if (network.comment() != null) {
      result.put("comment", network.comment());
    }
    return result;
  }

  /**
   * Estimates available addresses as {@code floor(utilization / 1000 * (2^(32 - prefix) - 2))}.
   *
   * <p>/31 and /32 networks have no usable host range and yield 0, as does a CIDR that is not
   * a valid IPv4 network. Utilization is clamped to 0-1000.
   *
   * @param cidr IPv4 network in {@code a.b.c.d/n} notation
   * @param utilization per-mille utilization reported by WAPI
   * @return estimated address count
   */
  public static long calculateAvailableIpv4s(String cidr, long utilization) {
    int prefixLength = ipv4PrefixLength(cidr);
    if (prefixLength < 0) {
      return 0L;
    }

    long totalIps = (1L << (32 - prefixLength)) - 2;
    if (totalIps < 0) {
      totalIps = 0;
    }

    long perMille = Math.max(0L, Math.min(MAX_UTILIZATION, utilization));
    return perMille * totalIps / MAX_UTILIZATION;
  }

  private String extAttrsJson(Map<String, Object> ea) throws JsonProcessingException {
    return objectMapper.writeValueAsString(ea == null ? Map.of() : ea);
  }

  private static int ipv4PrefixLength(String cidr) {
    if (cidr == null) {
      return -1;
    }
    String[] parts = cidr.trim().split("/", -1);
    if (parts.length != 2 || !isDigits(parts[1], 2)) {
      return -1;
    }
    int prefixLength = Integer.parseInt(parts[1]);
    if (prefixLength > 32) {
      return -1;
    }

    String[] octets = parts[0].split("\\.", -1);
    if (octets.length != 4) {
      return -1;
    }
    for (String octet : octets) {
      // Octets carry no leading zeros.
      if (!isDigits(octet, 3) || (octet.length() > 1 && octet.charAt(0) == '0')
          || Integer.parseInt(octet) > 255) {
        return -1;
      }
    }
    return prefixLength;
  }

  private static boolean isDigits(String value, int maxLength) {
    return !value.isEmpty()
        && value.length() <= maxLength
        && value.chars().allMatch(c -> c >= '0' && c <= '9');
  }
}
