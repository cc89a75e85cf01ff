package com.ibprovider.connector;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.util.Map;

/** IPv6 {@code ipv6network} object. WAPI reports no utilization for this family. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Ipv6Network(
    @JsonProperty("_ref") String ref,
    @JsonProperty("network_view") String networkView,
    @JsonProperty("network") String network,
    @JsonProperty("comment") String comment,
    @JsonProperty("extattrs") @JsonDeserialize(using = ExtensibleAttributesDeserializer.class)
        Map<String, Object> ea) {}
