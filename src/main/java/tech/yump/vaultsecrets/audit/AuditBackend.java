package tech.yump.vaultsecrets.audit;

/**
 * Destination for secret-store audit events, selected with {@code vault-secrets.audit.backend}.
 */
@FunctionalInterface
public interface AuditBackend {

    /**
     * Records one event. Called on request threads while secrets are being loaded, so
     * implementations must be cheap and must not throw.
     */
    void logEvent(AuditEvent event);
}
