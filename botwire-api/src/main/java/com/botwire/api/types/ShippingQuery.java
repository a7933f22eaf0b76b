package com.botwire.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ShippingQuery {
    private String id;
    private User from;
    @JsonProperty("invoice_payload")
    private String invoicePayload;
    /** Kept as raw JSON. */
    @JsonProperty("shipping_address")
    private JsonNode shippingAddress;
}
