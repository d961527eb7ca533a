package tech.yump.vaultsecrets.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

@ExtendWith(OutputCaptureExtension.class)
class LogAuditBackendTest {

    private final LogAuditBackend backend = new LogAuditBackend(new ObjectMapper().findAndRegisterModules());

    @Test
    void logEvent_writesJsonLineWithoutNullFields(CapturedOutput output) {
        AuditEvent event = AuditEvent.builder()
                .timestamp(Instant.parse("2026-01-01T12:00:00Z"))
                .type("auth")
                .action("login")
                .outcome("success")
                .serviceName("api-service")
                .data(Map.of("storeAddress", "https://vault-test.example.com"))
                .build();

        backend.logEvent(event);

        assertThat(output.getOut())
                .contains("AUDIT_EVENT:")
                .contains("\"type\":\"auth\"")
                .contains("\"action\":\"login\"")
                .contains("\"storeAddress\":\"https://vault-test.example.com\"")
                .doesNotContain("\"requestId\"");
    }

    @Test
    void logEvent_failureOutcome_loggedAtWarn(CapturedOutput output) {
        backend.logEvent(AuditEvent.builder()
                .timestamp(Instant.parse("2026-01-01T12:00:00Z"))
                .type("bootstrap")
                .action("load")
                .outcome(AuditHelper.OUTCOME_FAILURE)
                .build());

        assertThat(output.getOut())
                .contains("WARN")
                .contains("\"outcome\":\"failure\"");
    }

    @Test
    void logEvent_nullEvent_ignored() {
        assertThatCode(() -> backend.logEvent(null)).doesNotThrowAnyException();
    }
}
