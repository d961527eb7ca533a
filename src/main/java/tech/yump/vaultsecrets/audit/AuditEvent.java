package tech.yump.vaultsecrets.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * A single audit log entry for an interaction with the secret store or the bootstrap
 * provider. Never carries secret values or tokens.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEvent(
        Instant timestamp,
        String type,            // e.g. "auth", "bootstrap", "secrets_cache"
        String action,          // e.g. "login", "renew", "full_read"
        String outcome,         // "success" or "failure"
        String requestId,       // From MDC when triggered by an HTTP request
        String serviceName,
        Map<String, Object> data
) {
}
