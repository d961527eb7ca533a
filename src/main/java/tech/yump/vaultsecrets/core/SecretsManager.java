package tech.yump.vaultsecrets.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import tech.yump.vaultsecrets.auth.TokenState;
import tech.yump.vaultsecrets.bootstrap.BootstrapConfig;
import tech.yump.vaultsecrets.client.SecretStoreClient;

import java.util.Map;

/**
 * Entry point for callers that need their secrets. One instance per process; it owns the
 * store client and the secrets cache.
 */
@Slf4j
public class SecretsManager {

    private final ClientManager clientManager;
    private final SecretsCache secretsCache;

    public SecretsManager(ClientManager clientManager, SecretsCache secretsCache) {
        this.clientManager = clientManager;
        this.secretsCache = secretsCache;
    }

    /**
     * Returns the secrets of the calling service, from cache when fresh enough.
     * Simulated callers and callers without a service name get an empty map and cause no
     * store traffic.
     *
     * @throws VaultSecretsException on bootstrap, authentication or read failures.
     */
    public Map<String, String> loadSecrets(CallerContext context, SecretsOptions options) {
        if (context.isSimulated()) {
            log.debug("Simulated runtime, skipping Vault.");
            return Map.of();
        }
        if (!StringUtils.hasText(context.serviceName())) {
            log.debug("No service name in caller context, skipping Vault.");
            return Map.of();
        }

        SecretStoreClient client = clientManager.ensureClient(context, options);
        String path = resolvePath(context, options);
        return secretsCache.get(client, path, options.expiration(), options.checkDelay());
    }

    String resolvePath(CallerContext context, SecretsOptions options) {
        SecretPathResolver resolver = options.name();
        if (resolver != null) {
            try {
                String path = resolver.resolve(context);
                if (StringUtils.hasText(path)) {
                    return path;
                }
                log.warn("Custom secret path resolver returned no path, using convention.");
            } catch (RuntimeException e) {
                log.warn("Custom secret path resolver failed, using convention: {}", e.getMessage());
            }
        }
        return defaultPath(context);
    }

    private String defaultPath(CallerContext context) {
        String environment = clientManager.getBootstrapConfig()
                .map(BootstrapConfig::environment)
                .orElseThrow(() -> new ConfigurationException("No bootstrap environment available to build the secret path."));
        return environment + "/" + context.serviceName();
    }

    /**
     * Read-only view of the current state. Contains no secret values.
     */
    public SecretsStatus getStatus() {
        TokenState tokenState = clientManager.getClient()
                .map(SecretStoreClient::getTokenState)
                .orElse(TokenState.UNAUTHENTICATED);
        String environment = clientManager.getBootstrapConfig().map(BootstrapConfig::environment).orElse(null);
        return secretsCache.getEntry()
                .map(entry -> new SecretsStatus(tokenState, environment, entry.path(), entry.payload().size(),
                        entry.loadedAt(), entry.checkedAt(), entry.lastChangedAt()))
                .orElseGet(() -> new SecretsStatus(tokenState, environment, null, 0, 0L, 0L, 0L));
    }

    /**
     * Drops the client, bootstrap config and cached secrets.
     */
    public void reset() {
        clientManager.reset();
        secretsCache.clear();
    }
}
