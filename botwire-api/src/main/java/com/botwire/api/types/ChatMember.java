package com.botwire.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Membership of a user in a chat. {@code status} is one of creator, administrator, member,
 * restricted, left, kicked.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatMember {
    private String status;
    private User user;
    @JsonProperty("custom_title")
    private String customTitle;
    @JsonProperty("until_date")
    private Long untilDate;
}
