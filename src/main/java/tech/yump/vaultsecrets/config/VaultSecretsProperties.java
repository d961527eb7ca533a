package tech.yump.vaultsecrets.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import tech.yump.vaultsecrets.core.ClientManager;
import tech.yump.vaultsecrets.core.SecretsOptions;

import java.time.Duration;

/**
 * Configuration properties for the secrets client under the 'vault-secrets' prefix.
 */
@ConfigurationProperties(prefix = "vault-secrets")
@Validated
public record VaultSecretsProperties(

        @NotBlank(message = "Service name (vault-secrets.service-name) must be provided.")
        String serviceName,

        String runtime,

        Duration expiration,

        Duration checkDelay,

        // Fixed secret path; the {environment}/{serviceName} convention applies when unset
        String secretPath,

        Boolean exportSystemProperties,

        @Valid
        BootstrapProperties bootstrap,

        @Valid
        HttpProperties http
) {

    public static final String DEFAULT_RUNTIME = "server";

    public VaultSecretsProperties {
        if (runtime == null || runtime.isBlank()) {
            runtime = DEFAULT_RUNTIME;
        }
        if (expiration == null) {
            expiration = SecretsOptions.DEFAULT_EXPIRATION;
        }
        if (checkDelay == null) {
            checkDelay = SecretsOptions.DEFAULT_CHECK_DELAY;
        }
        if (exportSystemProperties == null) {
            exportSystemProperties = Boolean.TRUE;
        }
        if (bootstrap == null) {
            bootstrap = new BootstrapProperties(null, null, null);
        }
        if (http == null) {
            http = new HttpProperties(null, null);
        }
    }

    @AssertTrue(message = "Cache expiration (vault-secrets.expiration) must be positive.")
    public boolean isExpirationValid() {
        return !expiration.isNegative() && !expiration.isZero();
    }

    @AssertTrue(message = "Metadata check delay (vault-secrets.check-delay) must not be negative.")
    public boolean isCheckDelayValid() {
        return !checkDelay.isNegative();
    }

    /**
     * Where the Vault bootstrap credentials live in AWS Secrets Manager.
     */
    @Validated
    public record BootstrapProperties(
            String path,
            String region,
            // Endpoint override, e.g. for Localstack
            String endpoint
    ) {
        public static final String DEFAULT_REGION = "us-east-1";

        public BootstrapProperties {
            if (path == null || path.isBlank()) {
                path = ClientManager.DEFAULT_BOOTSTRAP_PATH;
            }
            if (region == null || region.isBlank()) {
                region = DEFAULT_REGION;
            }
        }
    }

    /**
     * Transport timeouts for calls to the store. There is no other cancellation.
     */
    @Validated
    public record HttpProperties(
            Duration connectTimeout,
            Duration readTimeout
    ) {
        public HttpProperties {
            if (connectTimeout == null) {
                connectTimeout = Duration.ofSeconds(5);
            }
            if (readTimeout == null) {
                readTimeout = Duration.ofSeconds(10);
            }
        }

        @AssertTrue(message = "HTTP timeouts (vault-secrets.http.*) must be positive.")
        public boolean isTimeoutsValid() {
            return !connectTimeout.isNegative() && !connectTimeout.isZero()
                    && !readTimeout.isNegative() && !readTimeout.isZero();
        }
    }
}
