package com.chatflow.presence.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Sent to the original sender of a message as message_read or message_delivery_confirmed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReceiptNotice {

    @JsonProperty("messageId")
    private String messageId;

    @JsonProperty("confirmedBy")
    private String confirmedBy;

    @JsonProperty("confirmedByName")
    private String confirmedByName;

    @JsonProperty("timestamp")
    private String timestamp;
}
