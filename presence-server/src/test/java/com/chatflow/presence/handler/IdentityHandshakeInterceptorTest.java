package com.chatflow.presence.handler;

import com.chatflow.presence.exception.HandshakeRejectedException;
import com.chatflow.presence.identity.IdentityResolver;
import com.chatflow.presence.model.UserIdentity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.socket.WebSocketHandler;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class IdentityHandshakeInterceptorTest {

    private IdentityResolver resolver;
    private IdentityHandshakeInterceptor interceptor;
    private MockHttpServletResponse servletResponse;
    private Map<String, Object> attributes;

    @BeforeEach
    void setUp() {
        resolver = mock(IdentityResolver.class);
        interceptor = new IdentityHandshakeInterceptor(resolver);
        servletResponse = new MockHttpServletResponse();
        attributes = new HashMap<>();
    }

    @Test
    void acceptedCredentialStoresIdentity() {
        UserIdentity alice = new UserIdentity("alice", "Alice");
        when(resolver.resolve("abc")).thenReturn(alice);

        boolean proceed = interceptor.beforeHandshake(request("token=abc", null),
                new ServletServerHttpResponse(servletResponse), mock(WebSocketHandler.class), attributes);

        assertThat(proceed).isTrue();
        assertThat(attributes).containsEntry(IdentityHandshakeInterceptor.IDENTITY_ATTRIBUTE, alice);
    }

    @Test
    void rejectedCredentialAnswers401() {
        when(resolver.resolve(any())).thenThrow(new HandshakeRejectedException("bad token"));

        boolean proceed = interceptor.beforeHandshake(request("token=nope", null),
                new ServletServerHttpResponse(servletResponse), mock(WebSocketHandler.class), attributes);

        assertThat(proceed).isFalse();
        assertThat(servletResponse.getStatus()).isEqualTo(401);
        assertThat(attributes).isEmpty();
    }

    @Test
    void credentialIsReadFromQueryThenBearerHeader() {
        assertThat(interceptor.extractCredential(request("token=abc", "Bearer xyz"))).isEqualTo("abc");
        assertThat(interceptor.extractCredential(request(null, "Bearer xyz"))).isEqualTo("xyz");
        assertThat(interceptor.extractCredential(request(null, "Basic xyz"))).isNull();
        assertThat(interceptor.extractCredential(request(null, null))).isNull();
    }

    @Test
    void percentEncodedTokenIsDecoded() {
        assertThat(interceptor.extractCredential(request("token=a%2Bb%2Fc%3D", null))).isEqualTo("a+b/c=");
    }

    private static ServletServerHttpRequest request(String query, String authorization) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/ws");
        if (query != null) {
            request.setQueryString(query);
        }
        if (authorization != null) {
            request.addHeader("Authorization", authorization);
        }
        return new ServletServerHttpRequest(request);
    }
}
