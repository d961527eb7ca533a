package tech.yump.vaultsecrets.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import tech.yump.vaultsecrets.audit.AuditHelper;
import tech.yump.vaultsecrets.bootstrap.BootstrapConfig;
import tech.yump.vaultsecrets.bootstrap.BootstrapLoader;
import tech.yump.vaultsecrets.client.SecretStoreClient;
import tech.yump.vaultsecrets.client.SecretStoreClientFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Owns the process-wide store client and bootstrap config, and makes sure concurrent
 * callers never bootstrap or log in more than once at a time.
 *
 * <p>Every {@link #ensureClient} call either becomes the single in-flight initialization or
 * waits for the one already running and shares its outcome.
 */
@Slf4j
public class ClientManager {

    public static final String DEFAULT_BOOTSTRAP_PATH = "/mysticat/vault-bootstrap";

    private final BootstrapLoader bootstrapLoader;
    private final SecretStoreClientFactory clientFactory;
    private final AuditHelper auditHelper;

    private final Object lock = new Object();

    private volatile SecretStoreClient client;
    private volatile BootstrapConfig bootstrapConfig;

    // Guarded by lock. Non-null only while an initialization is running.
    private CompletableFuture<Void> initialization;

    public ClientManager(BootstrapLoader bootstrapLoader, SecretStoreClientFactory clientFactory, AuditHelper auditHelper) {
        this.bootstrapLoader = bootstrapLoader;
        this.clientFactory = clientFactory;
        this.auditHelper = auditHelper;
    }

    /**
     * Returns an authenticated client, bootstrapping, logging in, or renewing as needed.
     *
     * @throws VaultSecretsException if this call ran the initialization and it failed.
     * @throws InitializationFailedException if this call waited on another caller's
     *                                       initialization and no authenticated client resulted.
     */
    public SecretStoreClient ensureClient(CallerContext context, SecretsOptions options) {
        CompletableFuture<Void> inFlight;
        boolean owner = false;
        synchronized (lock) {
            inFlight = initialization;
            if (inFlight == null) {
                inFlight = new CompletableFuture<>();
                initialization = inFlight;
                owner = true;
            }
        }

        if (!owner) {
            return awaitInitialization(inFlight);
        }

        try {
            SecretStoreClient ready = initialize(context, options);
            inFlight.complete(null);
            return ready;
        } catch (RuntimeException | Error e) {
            inFlight.completeExceptionally(e);
            throw e;
        } finally {
            if (!inFlight.isDone()) {
                inFlight.completeExceptionally(new InitializationFailedException("Vault client initialization did not complete"));
            }
            synchronized (lock) {
                if (initialization == inFlight) {
                    initialization = null;
                }
            }
        }
    }

    private SecretStoreClient awaitInitialization(CompletableFuture<Void> inFlight) {
        log.debug("Vault client initialization already in progress, waiting for it.");
        Throwable failure = null;
        try {
            inFlight.join();
        } catch (CompletionException e) {
            failure = e.getCause() != null ? e.getCause() : e;
        }

        SecretStoreClient current = client;
        if (current == null || !current.isAuthenticated()) {
            throw failure != null
                    ? new InitializationFailedException("Vault client initialization failed: " + failure.getMessage(), failure)
                    : new InitializationFailedException("Vault client initialization failed");
        }
        return current;
    }

    private SecretStoreClient initialize(CallerContext context, SecretsOptions options) {
        SecretStoreClient current = client;

        if (current == null) {
            String bootstrapPath = resolveBootstrapPath(options);
            BootstrapConfig config = loadBootstrap(bootstrapPath);
            current = clientFactory.create(config);
            // Published before login so a failed login is retried with the cached config.
            bootstrapConfig = config;
            client = current;
            login(current, config, "login");
        } else if (!current.isAuthenticated()) {
            BootstrapConfig config = bootstrapConfig;
            if (config == null) {
                throw new ConfigurationException("Vault client exists but no bootstrap config is cached.");
            }
            log.info("Vault token expired or missing, re-authenticating with cached bootstrap config.");
            login(current, config, "reauthenticate");
        } else if (current.isTokenExpiringSoon()) {
            log.debug("Vault token expiring soon, attempting renewal.");
            current.renewToken();
            auditHelper.logVaultEvent("auth", "renew",
                    current.isTokenExpiringSoon() ? AuditHelper.OUTCOME_FAILURE : AuditHelper.OUTCOME_SUCCESS,
                    null);
        }

        log.debug("Vault client ready for service '{}'.", context.serviceName());
        return current;
    }

    private BootstrapConfig loadBootstrap(String bootstrapPath) {
        try {
            BootstrapConfig config = bootstrapLoader.load(bootstrapPath);
            auditHelper.logVaultEvent("bootstrap", "load", AuditHelper.OUTCOME_SUCCESS,
                    Map.of("bootstrapPath", bootstrapPath, "environment", config.environment()));
            return config;
        } catch (RuntimeException e) {
            auditHelper.logVaultEvent("bootstrap", "load", AuditHelper.OUTCOME_FAILURE,
                    Map.of("bootstrapPath", bootstrapPath, "error", e.getClass().getSimpleName()));
            throw e;
        }
    }

    private void login(SecretStoreClient target, BootstrapConfig config, String action) {
        try {
            target.authenticate(config.roleId(), config.roleSecret());
            auditHelper.logVaultEvent("auth", action, AuditHelper.OUTCOME_SUCCESS,
                    Map.of("storeAddress", config.storeAddress()));
        } catch (RuntimeException e) {
            auditHelper.logVaultEvent("auth", action, AuditHelper.OUTCOME_FAILURE,
                    Map.of("storeAddress", config.storeAddress(), "error", e.getClass().getSimpleName()));
            throw e;
        }
    }

    private static String resolveBootstrapPath(SecretsOptions options) {
        return StringUtils.hasText(options.bootstrapPath()) ? options.bootstrapPath() : DEFAULT_BOOTSTRAP_PATH;
    }

    public Optional<SecretStoreClient> getClient() {
        return Optional.ofNullable(client);
    }

    public Optional<BootstrapConfig> getBootstrapConfig() {
        return Optional.ofNullable(bootstrapConfig);
    }

    /**
     * Forgets the client, the bootstrap config and any in-flight marker. The next call
     * bootstraps from scratch.
     */
    public void reset() {
        synchronized (lock) {
            client = null;
            bootstrapConfig = null;
            initialization = null;
        }
        log.info("Vault client state reset.");
    }
}
