package com.botwire.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A user's vote in a non-anonymous poll. An empty {@code optionIds} means the vote was retracted.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class PollAnswer {
    @JsonProperty("poll_id")
    private String pollId;
    private User user;
    @JsonProperty("voter_chat")
    private Chat voterChat;
    @JsonProperty("option_ids")
    private List<Integer> optionIds;
}
