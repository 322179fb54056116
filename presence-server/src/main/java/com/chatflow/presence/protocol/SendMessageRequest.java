package com.chatflow.presence.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload of {@code send_message}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SendMessageRequest {

    @JsonProperty("roomId")
    private String roomId;

    @JsonProperty("message")
    private MessageContent message;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MessageContent {

        @JsonProperty("id")
        private String id;  // client-generated id, optional

        @JsonProperty("content")
        private String content;

        @JsonProperty("type")
        private String type;  // text, emoji, image, voice, love-note
    }
}
