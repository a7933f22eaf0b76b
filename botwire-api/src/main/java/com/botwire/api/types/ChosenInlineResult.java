package com.botwire.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChosenInlineResult {
    @JsonProperty("result_id")
    private String resultId;
    private User from;
    private Location location;
    @JsonProperty("inline_message_id")
    private String inlineMessageId;
    private String query;
}
