package com.chatflow.presence.handler;

import com.chatflow.presence.exception.HandshakeRejectedException;
import com.chatflow.presence.identity.IdentityResolver;
import com.chatflow.presence.model.UserIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Resolves the caller's identity before the WebSocket upgrade. A rejected credential
 * answers 401 and the connection never reaches the presence registry.
 */
@Component
@Slf4j
public class IdentityHandshakeInterceptor implements HandshakeInterceptor {

    public static final String IDENTITY_ATTRIBUTE = "identity";

    private static final String TOKEN_PARAM = "token";
    private static final String BEARER_PREFIX = "Bearer ";

    private final IdentityResolver identityResolver;

    public IdentityHandshakeInterceptor(IdentityResolver identityResolver) {
        this.identityResolver = identityResolver;
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
            WebSocketHandler wsHandler, Map<String, Object> attributes) {
        try {
            UserIdentity identity = identityResolver.resolve(extractCredential(request));
            attributes.put(IDENTITY_ATTRIBUTE, identity);
            log.debug("Handshake accepted for user {} from {}", identity.getUserId(), request.getRemoteAddress());
            return true;
        } catch (HandshakeRejectedException e) {
            log.warn("Handshake rejected from {}: {}", request.getRemoteAddress(), e.getMessage());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
            WebSocketHandler wsHandler, Exception exception) {
        if (exception != null) {
            log.warn("Handshake from {} failed after identity resolution: {}",
                    request.getRemoteAddress(), exception.getMessage());
        }
    }

    /**
     * Reads the credential from the {@code token} query parameter, falling back to an
     * {@code Authorization: Bearer} header.
     */
    String extractCredential(ServerHttpRequest request) {
        String token = UriComponentsBuilder.fromUri(request.getURI()).build()
                .getQueryParams().getFirst(TOKEN_PARAM);
        if (token != null && !token.isBlank()) {
            return UriUtils.decode(token, StandardCharsets.UTF_8);
        }

        String authorization = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            return authorization.substring(BEARER_PREFIX.length()).trim();
        }
        return null;
    }
}
