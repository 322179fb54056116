package com.chatflow.presence.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload of message_edited and message_deleted. {@code newText} is only set for edits.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessageChangeNotice {

    @JsonProperty("roomId")
    private String roomId;

    @JsonProperty("messageId")
    private String messageId;

    @JsonProperty("newText")
    private String newText;

    @JsonProperty("changedBy")
    private String changedBy;

    @JsonProperty("changedByName")
    private String changedByName;

    @JsonProperty("changedAt")
    private String changedAt;
}
