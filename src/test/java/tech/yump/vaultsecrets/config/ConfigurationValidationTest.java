package tech.yump.vaultsecrets.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import tech.yump.vaultsecrets.core.ClientManager;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

public class ConfigurationValidationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(TestConfig.class));

    @EnableConfigurationProperties(VaultSecretsProperties.class)
    static class TestConfig {}

    @Test
    @DisplayName("Config Validation: Should PASS with only a service name and apply defaults")
    void validate_minimalConfig_appliesDefaults() {
        contextRunner
                .withPropertyValues("vault-secrets.service-name=api-service")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    VaultSecretsProperties properties = context.getBean(VaultSecretsProperties.class);
                    assertThat(properties.runtime()).isEqualTo("server");
                    assertThat(properties.expiration()).isEqualTo(Duration.ofHours(1));
                    assertThat(properties.checkDelay()).isEqualTo(Duration.ofMinutes(1));
                    assertThat(properties.secretPath()).isNull();
                    assertThat(properties.exportSystemProperties()).isTrue();
                    assertThat(properties.bootstrap().path()).isEqualTo(ClientManager.DEFAULT_BOOTSTRAP_PATH);
                    assertThat(properties.bootstrap().region()).isEqualTo("us-east-1");
                    assertThat(properties.http().connectTimeout()).isEqualTo(Duration.ofSeconds(5));
                    assertThat(properties.http().readTimeout()).isEqualTo(Duration.ofSeconds(10));
                });
    }

    @Test
    @DisplayName("Config Validation: Should bind every explicit value")
    void validate_fullConfig_binds() {
        contextRunner
                .withPropertyValues(
                        "vault-secrets.service-name=api-service",
                        "vault-secrets.runtime=lambda",
                        "vault-secrets.expiration=30m",
                        "vault-secrets.check-delay=0s",
                        "vault-secrets.secret-path=shared/api",
                        "vault-secrets.export-system-properties=false",
                        "vault-secrets.bootstrap.path=/custom/bootstrap",
                        "vault-secrets.bootstrap.region=eu-west-1",
                        "vault-secrets.bootstrap.endpoint=http://localhost:4566",
                        "vault-secrets.http.read-timeout=2s"
                )
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    VaultSecretsProperties properties = context.getBean(VaultSecretsProperties.class);
                    assertThat(properties.runtime()).isEqualTo("lambda");
                    assertThat(properties.expiration()).isEqualTo(Duration.ofMinutes(30));
                    assertThat(properties.checkDelay()).isZero();
                    assertThat(properties.secretPath()).isEqualTo("shared/api");
                    assertThat(properties.exportSystemProperties()).isFalse();
                    assertThat(properties.bootstrap().path()).isEqualTo("/custom/bootstrap");
                    assertThat(properties.bootstrap().region()).isEqualTo("eu-west-1");
                    assertThat(properties.bootstrap().endpoint()).isEqualTo("http://localhost:4566");
                    assertThat(properties.http().readTimeout()).isEqualTo(Duration.ofSeconds(2));
                    assertThat(properties.http().connectTimeout()).isEqualTo(Duration.ofSeconds(5));
                });
    }

    @Test
    @DisplayName("Config Validation: Should FAIL when service name is missing")
    void validate_missingServiceName_shouldFail() {
        contextRunner
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(BindValidationException.class)
                            .rootCause()
                            .hasMessageContaining("Service name (vault-secrets.service-name) must be provided.");
                });
    }

    @Test
    @DisplayName("Config Validation: Should FAIL when expiration is zero")
    void validate_zeroExpiration_shouldFail() {
        contextRunner
                .withPropertyValues("vault-secrets.service-name=api-service", "vault-secrets.expiration=0s")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(BindValidationException.class)
                            .rootCause()
                            .hasMessageContaining("Cache expiration (vault-secrets.expiration) must be positive.");
                });
    }

    @Test
    @DisplayName("Config Validation: Should FAIL when check delay is negative")
    void validate_negativeCheckDelay_shouldFail() {
        contextRunner
                .withPropertyValues("vault-secrets.service-name=api-service", "vault-secrets.check-delay=-1s")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(BindValidationException.class)
                            .rootCause()
                            .hasMessageContaining("Metadata check delay (vault-secrets.check-delay) must not be negative.");
                });
    }

    @Test
    @DisplayName("Config Validation: Should FAIL when an HTTP timeout is zero")
    void validate_zeroTimeout_shouldFail() {
        contextRunner
                .withPropertyValues("vault-secrets.service-name=api-service", "vault-secrets.http.connect-timeout=0s")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(BindValidationException.class)
                            .rootCause()
                            .hasMessageContaining("HTTP timeouts (vault-secrets.http.*) must be positive.");
                });
    }
}
