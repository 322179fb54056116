package com.chatflow.presence.identity;

import com.chatflow.presence.exception.HandshakeRejectedException;
import com.chatflow.presence.model.UserIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;

/**
 * Resolves credentials against the external identity service: the credential is sent as a
 * bearer token and the service answers with {@code {"userId": ..., "displayName": ...}}.
 */
@Component
@Slf4j
public class RemoteIdentityResolver implements IdentityResolver {

    private final RestTemplate restTemplate;
    private final String identityUrl;

    public RemoteIdentityResolver(RestTemplateBuilder restTemplateBuilder,
                                  @Value("${presence.identity.url:http://localhost:5000/api/auth/me}") String identityUrl,
                                  @Value("${presence.identity.timeout-ms:3000}") long timeoutMs) {
        this.restTemplate = restTemplateBuilder
                .setConnectTimeout(Duration.ofMillis(timeoutMs))
                .setReadTimeout(Duration.ofMillis(timeoutMs))
                .build();
        this.identityUrl = identityUrl;
    }

    @Override
    public UserIdentity resolve(String credential) {
        if (credential == null || credential.isBlank()) {
            throw new HandshakeRejectedException("No credential provided");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(credential);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        UserIdentity identity;
        try {
            identity = restTemplate.exchange(identityUrl, HttpMethod.GET,
                    new HttpEntity<>(headers), UserIdentity.class).getBody();
        } catch (HttpClientErrorException e) {
            throw new HandshakeRejectedException("Credential rejected: " + e.getStatusCode(), e);
        } catch (RestClientException e) {
            log.error("Identity service call to {} failed: {}", identityUrl, e.getMessage());
            throw new HandshakeRejectedException("Identity service unavailable", e);
        }

        if (identity == null || identity.getUserId() == null || identity.getUserId().isBlank()) {
            throw new HandshakeRejectedException("Identity service returned no user");
        }
        if (identity.getDisplayName() == null) {
            identity.setDisplayName(identity.getUserId());
        }
        return identity;
    }
}
