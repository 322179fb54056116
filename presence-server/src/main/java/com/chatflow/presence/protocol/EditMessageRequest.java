package com.chatflow.presence.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EditMessageRequest {

    @JsonProperty("roomId")
    private String roomId;

    @JsonProperty("messageId")
    private String messageId;

    @JsonProperty("newText")
    private String newText;
}
