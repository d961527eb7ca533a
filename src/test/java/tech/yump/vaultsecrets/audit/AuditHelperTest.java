package tech.yump.vaultsecrets.audit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import tech.yump.vaultsecrets.support.MutableClock;
import tech.yump.vaultsecrets.web.VaultSecretsFilter;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class AuditHelperTest {

    private static final String TEST_SERVICE = "api-service";

    @Mock
    private AuditBackend mockAuditBackend;

    @Captor
    private ArgumentCaptor<AuditEvent> auditEventCaptor;

    private final MutableClock clock = MutableClock.startingAt("2026-01-01T12:00:00Z");
    private AuditHelper auditHelper;

    @BeforeEach
    void setUp() {
        auditHelper = new AuditHelper(mockAuditBackend, TEST_SERVICE, clock);
    }

    @AfterEach
    void tearDown() {
        MDC.remove(VaultSecretsFilter.MDC_REQUEST_ID_KEY);
    }

    @Test
    @DisplayName("logVaultEvent: Should log event with request id from MDC")
    void logVaultEvent_WithRequestId() {
        // Arrange
        String requestId = UUID.randomUUID().toString();
        MDC.put(VaultSecretsFilter.MDC_REQUEST_ID_KEY, requestId);
        Map<String, Object> data = Map.of("path", "prod/api-service", "keys", 3);

        // Act
        auditHelper.logVaultEvent("secrets_cache", "full_read", AuditHelper.OUTCOME_SUCCESS, data);

        // Assert
        verify(mockAuditBackend).logEvent(auditEventCaptor.capture());
        AuditEvent event = auditEventCaptor.getValue();

        assertThat(event.timestamp()).isEqualTo(Instant.parse("2026-01-01T12:00:00Z"));
        assertThat(event.type()).isEqualTo("secrets_cache");
        assertThat(event.action()).isEqualTo("full_read");
        assertThat(event.outcome()).isEqualTo("success");
        assertThat(event.requestId()).isEqualTo(requestId);
        assertThat(event.serviceName()).isEqualTo(TEST_SERVICE);
        assertThat(event.data()).isEqualTo(data);
    }

    @Test
    @DisplayName("logVaultEvent: Should handle calls outside a request")
    void logVaultEvent_NoRequestContext() {
        // Act
        auditHelper.logVaultEvent("auth", "renew", AuditHelper.OUTCOME_FAILURE, null);

        // Assert
        verify(mockAuditBackend).logEvent(auditEventCaptor.capture());
        AuditEvent event = auditEventCaptor.getValue();

        assertThat(event.requestId()).isNull();
        assertThat(event.outcome()).isEqualTo("failure");
        assertThat(event.data()).isNull();
    }

    @Test
    @DisplayName("logVaultEvent: Should drop empty data maps")
    void logVaultEvent_EmptyData() {
        auditHelper.logVaultEvent("auth", "login", AuditHelper.OUTCOME_SUCCESS, Map.of());

        verify(mockAuditBackend).logEvent(auditEventCaptor.capture());
        assertThat(auditEventCaptor.getValue().data()).isNull();
    }

    @Test
    @DisplayName("logVaultEvent: Should not throw when the backend fails")
    void logVaultEvent_BackendThrows() {
        // Arrange
        doThrow(new RuntimeException("Backend failed")).when(mockAuditBackend).logEvent(any(AuditEvent.class));

        // Act & Assert
        assertThatCode(() -> auditHelper.logVaultEvent("bootstrap", "load", AuditHelper.OUTCOME_SUCCESS, null))
                .doesNotThrowAnyException();
    }
}
