package com.chatflow.presence.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a send, returned to the sender as the acknowledgment of {@code send_message}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeliveryReceipt {

    @JsonProperty("success")
    private boolean success;

    @JsonProperty("messageId")
    private String messageId;

    @JsonProperty("deliveredTo")
    private int deliveredTo;

    @JsonProperty("queuedFor")
    private int queuedFor;

    @JsonProperty("error")
    private String error;

    public static DeliveryReceipt failed(String error) {
        return DeliveryReceipt.builder()
                .success(false)
                .error(error)
                .build();
    }
}
