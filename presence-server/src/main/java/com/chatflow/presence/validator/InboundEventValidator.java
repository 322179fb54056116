package com.chatflow.presence.validator;

import com.chatflow.presence.protocol.EditMessageRequest;
import com.chatflow.presence.protocol.MessageRefRequest;
import com.chatflow.presence.protocol.ReactionRequest;
import com.chatflow.presence.protocol.ReceiptRequest;
import com.chatflow.presence.protocol.SendMessageRequest;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Field checks for inbound payloads. Each method returns an error message, or null when valid.
 */
@Component
public class InboundEventValidator {

    private static final int MAX_ID_LENGTH = 128;
    private static final int MIN_MESSAGE_LENGTH = 1;
    private static final int MAX_MESSAGE_LENGTH = 5000;
    private static final int MAX_EMOJI_LENGTH = 32;
    private static final int MAX_STATUS_LENGTH = 64;

    private static final Set<String> MESSAGE_TYPES = Set.of("text", "emoji", "image", "voice", "love-note");

    public String validateRoomId(String roomId) {
        return validateId("roomId", roomId);
    }

    public String validate(SendMessageRequest request) {
        if (request == null) {
            return "Message payload is required";
        }

        String error = validateRoomId(request.getRoomId());
        if (error != null) {
            return error;
        }

        SendMessageRequest.MessageContent message = request.getMessage();
        if (message == null) {
            return "message is required";
        }

        if (message.getId() != null && message.getId().length() > MAX_ID_LENGTH) {
            return "message.id must be at most " + MAX_ID_LENGTH + " characters";
        }

        if (message.getContent() == null) {
            return "message.content is required";
        }

        int length = message.getContent().length();
        if (length < MIN_MESSAGE_LENGTH || length > MAX_MESSAGE_LENGTH) {
            return "message.content must be " + MIN_MESSAGE_LENGTH + "-" + MAX_MESSAGE_LENGTH + " characters";
        }

        if (message.getType() != null && !MESSAGE_TYPES.contains(message.getType())) {
            return "message.type must be one of " + MESSAGE_TYPES;
        }

        return null; // Valid
    }

    public String validate(ReactionRequest request) {
        if (request == null) {
            return "Reaction payload is required";
        }
        String error = firstError(validateRoomId(request.getRoomId()), validateId("messageId", request.getMessageId()));
        if (error != null) {
            return error;
        }
        if (request.getEmoji() == null || request.getEmoji().isBlank()) {
            return "emoji is required";
        }
        if (request.getEmoji().length() > MAX_EMOJI_LENGTH) {
            return "emoji must be at most " + MAX_EMOJI_LENGTH + " characters";
        }
        return null;
    }

    public String validate(EditMessageRequest request) {
        if (request == null) {
            return "Edit payload is required";
        }
        String error = firstError(validateRoomId(request.getRoomId()), validateId("messageId", request.getMessageId()));
        if (error != null) {
            return error;
        }
        if (request.getNewText() == null || request.getNewText().isEmpty()) {
            return "newText is required";
        }
        if (request.getNewText().length() > MAX_MESSAGE_LENGTH) {
            return "newText must be at most " + MAX_MESSAGE_LENGTH + " characters";
        }
        return null;
    }

    public String validate(MessageRefRequest request) {
        if (request == null) {
            return "Payload is required";
        }
        return firstError(validateRoomId(request.getRoomId()), validateId("messageId", request.getMessageId()));
    }

    // senderId is optional: without it nobody is notified
    public String validate(ReceiptRequest request) {
        if (request == null) {
            return "Receipt payload is required";
        }
        String error = validateId("messageId", request.getMessageId());
        if (error != null) {
            return error;
        }
        if (request.getSenderId() != null && request.getSenderId().length() > MAX_ID_LENGTH) {
            return "senderId must be at most " + MAX_ID_LENGTH + " characters";
        }
        return null;
    }

    public String validateStatus(String status) {
        if (status == null || status.isBlank()) {
            return "status is required";
        }
        if (status.length() > MAX_STATUS_LENGTH) {
            return "status must be at most " + MAX_STATUS_LENGTH + " characters";
        }
        return null;
    }

    private String validateId(String field, String value) {
        if (value == null || value.trim().isEmpty()) {
            return field + " is required";
        }
        if (value.length() > MAX_ID_LENGTH) {
            return field + " must be at most " + MAX_ID_LENGTH + " characters";
        }
        return null;
    }

    private static String firstError(String... errors) {
        for (String error : errors) {
            if (error != null) {
                return error;
            }
        }
        return null;
    }
}
