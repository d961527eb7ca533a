package tech.yump.vaultsecrets.core;

import lombok.Builder;

import java.time.Duration;

/**
 * Per-call tuning of {@link SecretsManager#loadSecrets}.
 *
 * @param expiration    Maximum age of cached secrets before a full re-read.
 * @param checkDelay    Minimum interval between metadata freshness probes.
 * @param bootstrapPath Override of the bootstrap secret location; {@code null} for the default.
 * @param name          Override of the secret path; {@code null} for {@code {environment}/{serviceName}}.
 */
@Builder
public record SecretsOptions(
        Duration expiration,
        Duration checkDelay,
        String bootstrapPath,
        SecretPathResolver name
) {

    public static final Duration DEFAULT_EXPIRATION = Duration.ofHours(1);
    public static final Duration DEFAULT_CHECK_DELAY = Duration.ofMinutes(1);

    public SecretsOptions {
        if (expiration == null) {
            expiration = DEFAULT_EXPIRATION;
        }
        if (checkDelay == null) {
            checkDelay = DEFAULT_CHECK_DELAY;
        }
        if (expiration.isNegative() || checkDelay.isNegative()) {
            throw new IllegalArgumentException("expiration and checkDelay must not be negative.");
        }
    }

    public static SecretsOptions defaults() {
        return SecretsOptions.builder().build();
    }
}
