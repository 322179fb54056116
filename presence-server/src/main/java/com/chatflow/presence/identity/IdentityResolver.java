package com.chatflow.presence.identity;

import com.chatflow.presence.exception.HandshakeRejectedException;
import com.chatflow.presence.model.UserIdentity;

/**
 * Turns the credential presented on the WebSocket handshake into a stable user identity.
 * Credential validation itself belongs to an external identity service.
 */
public interface IdentityResolver {

    /**
     * @throws HandshakeRejectedException if the credential is missing, invalid or cannot be checked
     */
    UserIdentity resolve(String credential);
}
