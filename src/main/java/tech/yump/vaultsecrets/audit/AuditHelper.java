package tech.yump.vaultsecrets.audit;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import tech.yump.vaultsecrets.web.VaultSecretsFilter;

import java.time.Clock;
import java.util.Map;

/**
 * Builds and dispatches {@link AuditEvent}s. Audit failures are logged and never reach
 * the caller.
 */
@Slf4j
public class AuditHelper {

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_FAILURE = "failure";

    private final AuditBackend auditBackend;
    private final String serviceName;
    private final Clock clock;

    public AuditHelper(AuditBackend auditBackend, String serviceName, Clock clock) {
        this.auditBackend = auditBackend;
        this.serviceName = serviceName;
        this.clock = clock;
    }

    /**
     * Logs an event for an interaction with the store or the bootstrap provider. The
     * current request id is picked up from the MDC when the call happens on a request thread.
     *
     * @param type    The type of event (e.g., "auth", "bootstrap", "secrets_cache").
     * @param action  The specific action performed (e.g., "login", "full_read").
     * @param outcome The result ("success" or "failure").
     * @param data    Optional context; must not contain secret values.
     */
    public void logVaultEvent(String type, String action, String outcome, @Nullable Map<String, Object> data) {
        try {
            AuditEvent event = AuditEvent.builder()
                    .timestamp(clock.instant())
                    .type(type)
                    .action(action)
                    .outcome(outcome)
                    .requestId(MDC.get(VaultSecretsFilter.MDC_REQUEST_ID_KEY))
                    .serviceName(serviceName)
                    .data(data != null && !data.isEmpty() ? data : null)
                    .build();

            auditBackend.logEvent(event);
        } catch (Exception e) {
            log.error("Failed to log audit event: Type={}, Action={}, Outcome={}, Error={}",
                    type, action, outcome, e.getMessage(), e);
        }
    }
}
