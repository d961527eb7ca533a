package tech.yump.vaultsecrets.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes each event as one JSON line through SLF4J. Failed outcomes go out at WARN so they
 * surface with the default log level filters; everything else at INFO.
 */
@Slf4j
@RequiredArgsConstructor
public class LogAuditBackend implements AuditBackend {

    private final ObjectMapper objectMapper;

    @Override
    public void logEvent(AuditEvent event) {
        if (event == null) {
            log.warn("Attempted to log a null audit event.");
            return;
        }

        String line;
        try {
            line = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize audit event {}/{}.", event.type(), event.action(), e);
            line = event.type() + "/" + event.action() + " outcome=" + event.outcome() + " requestId=" + event.requestId();
        }

        if (AuditHelper.OUTCOME_FAILURE.equals(event.outcome())) {
            log.warn("AUDIT_EVENT: {}", line);
        } else {
            log.info("AUDIT_EVENT: {}", line);
        }
    }
}
