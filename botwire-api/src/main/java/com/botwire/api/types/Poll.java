package com.botwire.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A native poll; delivered both inside messages and as a standalone poll-state update.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Poll {
    private String id;
    private String question;
    private List<PollOption> options;
    @JsonProperty("total_voter_count")
    private int totalVoterCount;
    @JsonProperty("is_closed")
    private Boolean isClosed;
    @JsonProperty("is_anonymous")
    private Boolean isAnonymous;
    /** "regular" or "quiz". */
    private String type;
    @JsonProperty("allows_multiple_answers")
    private Boolean allowsMultipleAnswers;
}
