package tech.yump.vaultsecrets.client;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import tech.yump.vaultsecrets.auth.AuthSession;
import tech.yump.vaultsecrets.auth.TokenState;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link SecretStoreClient} for the Vault HTTP API (AppRole auth, KV v2 engine).
 */
@Slf4j
public class VaultSecretStoreClient implements SecretStoreClient {

    private final RestClient restClient;
    private final StoreConnection connection;
    private final AuthSession session;

    public VaultSecretStoreClient(RestClient restClient, StoreConnection connection, AuthSession session) {
        this.restClient = restClient;
        this.connection = connection;
        this.session = session;
    }

    @Override
    public void authenticate(String roleId, String roleSecret) {
        session.authenticate(roleId, roleSecret);
    }

    @Override
    public boolean isAuthenticated() {
        return session.isAuthenticated();
    }

    @Override
    public boolean isTokenExpiringSoon() {
        return session.isExpiringSoon();
    }

    @Override
    public void renewToken() {
        session.renew();
    }

    @Override
    public TokenState getTokenState() {
        return session.getState();
    }

    @Override
    public StoreConnection getConnection() {
        return connection;
    }

    @Override
    public Map<String, String> readSecret(String path) {
        String token = session.currentToken()
                .orElseThrow(() -> new NotAuthenticatedException("Not authenticated"));
        log.debug("Reading secret at path: {}", path);

        JsonNode body;
        try {
            body = restClient.get()
                    .uri(connection.dataUri(path))
                    .header(AuthSession.VAULT_TOKEN_HEADER, token)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (HttpClientErrorException.NotFound e) {
            log.warn("Secret not found at path: {}", path);
            throw new SecretNotFoundException(path, e);
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            log.error("Vault read of path {} failed with status {}.", path, status);
            throw new SecretReadException("Vault read failed: " + status, status, e);
        } catch (RestClientException e) {
            log.error("Vault read request for path {} failed: {}", path, e.getMessage());
            throw new SecretReadException("Vault read request failed: " + e.getMessage(), e);
        }

        JsonNode payload = body == null ? null : body.path("data").path("data");
        if (payload == null || !payload.isObject()) {
            throw new SecretReadException("Vault read of path " + path + " returned no secret data.");
        }
        Map<String, String> secrets = new LinkedHashMap<>();
        payload.fields().forEachRemaining(field -> secrets.put(field.getKey(), asText(field.getValue())));
        log.debug("Read {} keys from path: {}", secrets.size(), path);
        return Collections.unmodifiableMap(secrets);
    }

    @Override
    public long getLastChangedDate(String path) {
        String token = session.currentToken().orElse(null);
        if (token == null) {
            log.debug("Skipping metadata probe for {}: not authenticated.", path);
            return 0L;
        }
        try {
            JsonNode body = restClient.get()
                    .uri(connection.metadataUri(path))
                    .header(AuthSession.VAULT_TOKEN_HEADER, token)
                    .retrieve()
                    .body(JsonNode.class);
            JsonNode data = body == null ? null : body.path("data");
            String updatedTime = data == null ? null : data.path("updated_time").asText(null);
            if (updatedTime == null) {
                log.debug("Metadata for {} carried no updated_time.", path);
                return 0L;
            }
            long changedAt = OffsetDateTime.parse(updatedTime).toInstant().toEpochMilli();
            log.debug("Metadata for {}: updated_time={}, current_version={}",
                    path, updatedTime, data.path("current_version").asText("?"));
            return changedAt;
        } catch (RestClientException | DateTimeParseException e) {
            log.debug("Metadata probe for {} failed, treating as unchanged: {}", path, e.getMessage());
            return 0L;
        }
    }

    private static String asText(JsonNode value) {
        return value.isValueNode() ? value.asText() : value.toString();
    }
}
