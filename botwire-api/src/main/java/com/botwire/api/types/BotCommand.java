package com.botwire.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Entry of the bot's command menu.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BotCommand {
    /** 1-32 chars, lower-case letters, digits and underscores, without the slash. */
    private String command;
    private String description;
}
