package tech.yump.vaultsecrets.auth;

import org.springframework.util.StringUtils;

import java.time.Duration;
import java.time.Instant;

/**
 * A token issued by the store.
 *
 * @param token     The opaque client token, sent as {@code X-Vault-Token}.
 * @param expiresAt The instant the lease runs out (issue time plus lease duration).
 * @param renewable Whether the store allows the token to be renewed.
 */
public record Credential(String token, Instant expiresAt, boolean renewable) {

    public static Credential issued(String token, Instant issuedAt, long leaseDurationSeconds, boolean renewable) {
        return new Credential(token, issuedAt.plusSeconds(leaseDurationSeconds), renewable);
    }

    public boolean isValidAt(Instant now) {
        return StringUtils.hasText(token) && expiresAt != null && now.isBefore(expiresAt);
    }

    public Duration remainingAt(Instant now) {
        return Duration.between(now, expiresAt);
    }

    /**
     * Applies a renewal. The store may or may not rotate the token value.
     */
    public Credential renewed(String newToken, Instant renewedAt, long leaseDurationSeconds, boolean newRenewable) {
        String effectiveToken = StringUtils.hasText(newToken) ? newToken : token;
        return new Credential(effectiveToken, renewedAt.plusSeconds(leaseDurationSeconds), newRenewable);
    }

    @Override
    public String toString() {
        return "Credential[token=******, expiresAt=" + expiresAt + ", renewable=" + renewable + ']';
    }
}
