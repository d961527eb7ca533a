package tech.yump.vaultsecrets.client;

import tech.yump.vaultsecrets.auth.TokenState;

import java.util.Map;

/**
 * Authenticated access to a KV v2 secret store.
 * Implementations own their token and are safe to share between request threads.
 */
public interface SecretStoreClient {

    /**
     * Logs in with AppRole credentials, replacing any current token.
     *
     * @throws tech.yump.vaultsecrets.auth.VaultAuthenticationException on any login failure.
     */
    void authenticate(String roleId, String roleSecret);

    boolean isAuthenticated();

    boolean isTokenExpiringSoon();

    /**
     * Best-effort token renewal. Never throws.
     */
    void renewToken();

    TokenState getTokenState();

    /**
     * Reads the latest version of the secret at {@code path}.
     *
     * @return the secret's key/value payload, without the version envelope.
     * @throws NotAuthenticatedException if there is no valid token; nothing is sent.
     * @throws SecretNotFoundException   if the store has no secret at the path.
     * @throws SecretReadException       on any other failure.
     */
    Map<String, String> readSecret(String path);

    /**
     * Last modification time of the secret at {@code path}, in epoch milliseconds.
     * Returns {@code 0} when no answer is available (not authenticated, request failed,
     * unusable body). Never throws.
     */
    long getLastChangedDate(String path);

    StoreConnection getConnection();
}
