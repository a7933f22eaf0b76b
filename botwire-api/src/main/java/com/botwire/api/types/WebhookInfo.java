package com.botwire.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Current webhook status; an empty {@code url} means the bot is in polling mode.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class WebhookInfo {
    private String url;
    @JsonProperty("has_custom_certificate")
    private Boolean hasCustomCertificate;
    @JsonProperty("pending_update_count")
    private int pendingUpdateCount;
    @JsonProperty("ip_address")
    private String ipAddress;
    @JsonProperty("last_error_date")
    private Long lastErrorDate;
    @JsonProperty("last_error_message")
    private String lastErrorMessage;
    @JsonProperty("max_connections")
    private Integer maxConnections;
    @JsonProperty("allowed_updates")
    private List<String> allowedUpdates;
}
