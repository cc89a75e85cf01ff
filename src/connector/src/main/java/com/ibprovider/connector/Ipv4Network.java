package com.ibprovider.connector;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.util.Map;

/**
 * IPv4 {@code network} object.
 *
 * @param utilization addresses in use as a per-mille fraction of the network (0-1000)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Ipv4Network(
    @JsonProperty("_ref") String ref,
    @JsonProperty("network_view") String networkView,
    @JsonProperty("network") String network,
    @JsonProperty("comment") String comment,
    @JsonProperty("extattrs") @JsonDeserialize(using = ExtensibleAttributesDeserializer.class)
        Map<String, Object> ea,
    @JsonProperty("utilization") long utilization) {}
