package tech.yump.vaultsecrets.auth;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import tech.yump.vaultsecrets.client.StoreConnection;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Holds the store token and drives its lifecycle: AppRole login, expiry checks and
 * best-effort renewal.
 */
@Slf4j
public class AuthSession {

    public static final String VAULT_TOKEN_HEADER = "X-Vault-Token";
    public static final Duration RENEW_BUFFER = Duration.ofMinutes(5);

    private static final String LOGIN_PATH = "auth/approle/login";
    private static final String RENEW_SELF_PATH = "auth/token/renew-self";

    private final RestClient restClient;
    private final StoreConnection connection;
    private final Clock clock;

    // Replaced as a whole; never mutated in place.
    private volatile Credential credential;

    public AuthSession(RestClient restClient, StoreConnection connection, Clock clock) {
        this.restClient = restClient;
        this.connection = connection;
        this.clock = clock;
    }

    /**
     * Exchanges the role credentials for a token. On failure the previous credential, if
     * any, is left in place.
     *
     * @throws VaultAuthenticationException if the store rejects the login, cannot be reached,
     *                                      or answers with an unusable body.
     */
    public void authenticate(String roleId, String roleSecret) {
        log.debug("Authenticating against {} using AppRole.", connection.address());
        JsonNode body;
        try {
            body = restClient.post()
                    .uri(connection.apiUri(LOGIN_PATH))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("role_id", roleId, "secret_id", roleSecret))
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            log.warn("Vault authentication rejected with status {}.", status);
            throw new VaultAuthenticationException("Vault authentication failed: " + status, status, e);
        } catch (RestClientException e) {
            log.warn("Vault authentication request failed: {}", e.getMessage());
            throw new VaultAuthenticationException("Vault authentication request failed: " + e.getMessage(), e);
        }

        Instant now = clock.instant();
        Credential issued = parseAuth(body)
                .filter(auth -> StringUtils.hasText(auth.path("client_token").asText(null)))
                .map(auth -> Credential.issued(
                        auth.path("client_token").asText(),
                        now,
                        auth.path("lease_duration").asLong(0),
                        auth.path("renewable").asBoolean(false)))
                .orElseThrow(() -> new VaultAuthenticationException("Vault authentication response did not contain a client token."));

        this.credential = issued;
        log.info("Authenticated against Vault. Token expires at {} (renewable: {}).", issued.expiresAt(), issued.renewable());
    }

    public boolean isAuthenticated() {
        Credential current = credential;
        return current != null && current.isValidAt(clock.instant());
    }

    /**
     * True when authenticated and at most {@link #RENEW_BUFFER} of the lease remains.
     */
    public boolean isExpiringSoon() {
        Credential current = credential;
        Instant now = clock.instant();
        if (current == null || !current.isValidAt(now)) {
            return false;
        }
        return current.remainingAt(now).compareTo(RENEW_BUFFER) <= 0;
    }

    public TokenState getState() {
        Credential current = credential;
        if (current == null) {
            return TokenState.UNAUTHENTICATED;
        }
        if (!current.isValidAt(clock.instant())) {
            return TokenState.EXPIRED;
        }
        return isExpiringSoon() ? TokenState.EXPIRING_SOON : TokenState.AUTHENTICATED;
    }

    /**
     * Renews the current token. Best effort: any failure is logged and the existing
     * credential is kept, so that a later full login takes over once it actually expires.
     */
    public void renew() {
        Credential current = credential;
        if (current == null || !current.isValidAt(clock.instant())) {
            log.debug("Skipping token renewal: not authenticated.");
            return;
        }

        try {
            JsonNode body = restClient.post()
                    .uri(connection.apiUri(RENEW_SELF_PATH))
                    .header(VAULT_TOKEN_HEADER, current.token())
                    .retrieve()
                    .body(JsonNode.class);

            Optional<JsonNode> auth = parseAuth(body).filter(node -> node.has("lease_duration"));
            if (auth.isEmpty()) {
                log.warn("Vault token renewal returned no lease information. Keeping current token.");
                return;
            }
            Credential renewed = current.renewed(
                    auth.get().path("client_token").asText(null),
                    clock.instant(),
                    auth.get().path("lease_duration").asLong(),
                    auth.get().path("renewable").asBoolean(current.renewable()));
            this.credential = renewed;
            log.info("Vault token renewed. New expiry {}.", renewed.expiresAt());
        } catch (RestClientResponseException e) {
            log.warn("Vault token renewal rejected with status {}. Keeping current token.", e.getStatusCode().value());
        } catch (RestClientException e) {
            log.warn("Vault token renewal failed: {}. Keeping current token.", e.getMessage());
        }
    }

    /**
     * The token to send with authenticated requests, or empty when not authenticated.
     */
    public Optional<String> currentToken() {
        Credential current = credential;
        if (current == null || !current.isValidAt(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(current.token());
    }

    public Optional<Credential> getCredential() {
        return Optional.ofNullable(credential);
    }

    private static Optional<JsonNode> parseAuth(@Nullable JsonNode body) {
        if (body == null) {
            return Optional.empty();
        }
        JsonNode auth = body.path("auth");
        return auth.isObject() ? Optional.of(auth) : Optional.empty();
    }
}
