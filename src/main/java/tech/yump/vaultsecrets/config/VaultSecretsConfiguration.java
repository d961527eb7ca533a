package tech.yump.vaultsecrets.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClientBuilder;
import tech.yump.vaultsecrets.audit.AuditBackend;
import tech.yump.vaultsecrets.audit.AuditHelper;
import tech.yump.vaultsecrets.bootstrap.AwsSecretsManagerBootstrapLoader;
import tech.yump.vaultsecrets.bootstrap.BootstrapLoader;
import tech.yump.vaultsecrets.client.RestSecretStoreClientFactory;
import tech.yump.vaultsecrets.client.SecretStoreClientFactory;
import tech.yump.vaultsecrets.core.CallerContext;
import tech.yump.vaultsecrets.core.ClientManager;
import tech.yump.vaultsecrets.core.SecretPathResolver;
import tech.yump.vaultsecrets.core.SecretsCache;
import tech.yump.vaultsecrets.core.SecretsManager;
import tech.yump.vaultsecrets.core.SecretsOptions;
import tech.yump.vaultsecrets.web.VaultSecretsFilter;

import java.net.URI;
import java.time.Clock;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class VaultSecretsConfiguration {

    private final VaultSecretsProperties properties;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SecretStoreClientFactory secretStoreClientFactory(RestClient.Builder restClientBuilder, Clock clock) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.http().connectTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.http().readTimeout().toMillis());
        RestClient restClient = restClientBuilder.requestFactory(requestFactory).build();
        return new RestSecretStoreClientFactory(restClient, clock);
    }

    @Bean(destroyMethod = "close")
    public SecretsManagerClient secretsManagerClient() {
        VaultSecretsProperties.BootstrapProperties bootstrap = properties.bootstrap();
        SecretsManagerClientBuilder builder = SecretsManagerClient.builder()
                .region(Region.of(bootstrap.region()))
                .credentialsProvider(DefaultCredentialsProvider.create());
        if (StringUtils.hasText(bootstrap.endpoint())) {
            log.info("Using AWS Secrets Manager endpoint override: {}", bootstrap.endpoint());
            builder.endpointOverride(URI.create(bootstrap.endpoint()));
        }
        return builder.build();
    }

    @Bean
    public BootstrapLoader bootstrapLoader(SecretsManagerClient secretsManagerClient, ObjectMapper objectMapper) {
        return new AwsSecretsManagerBootstrapLoader(secretsManagerClient, objectMapper);
    }

    @Bean
    public AuditHelper auditHelper(AuditBackend auditBackend, Clock clock) {
        return new AuditHelper(auditBackend, properties.serviceName(), clock);
    }

    @Bean
    public ClientManager clientManager(BootstrapLoader bootstrapLoader, SecretStoreClientFactory clientFactory, AuditHelper auditHelper) {
        return new ClientManager(bootstrapLoader, clientFactory, auditHelper);
    }

    @Bean
    public SecretsCache secretsCache(Clock clock, AuditHelper auditHelper) {
        return new SecretsCache(clock, auditHelper);
    }

    @Bean
    public SecretsManager secretsManager(ClientManager clientManager, SecretsCache secretsCache) {
        return new SecretsManager(clientManager, secretsCache);
    }

    @Bean
    public CallerContext callerContext() {
        return new CallerContext(properties.serviceName(), properties.runtime());
    }

    @Bean
    public SecretsOptions secretsOptions() {
        return SecretsOptions.builder()
                .expiration(properties.expiration())
                .checkDelay(properties.checkDelay())
                .bootstrapPath(properties.bootstrap().path())
                .name(StringUtils.hasText(properties.secretPath()) ? SecretPathResolver.fixed(properties.secretPath()) : null)
                .build();
    }

    @Bean
    @ConditionalOnProperty(name = "vault-secrets.filter.enabled", havingValue = "true", matchIfMissing = true)
    public FilterRegistrationBean<VaultSecretsFilter> vaultSecretsFilter(
            SecretsManager secretsManager, CallerContext callerContext, SecretsOptions secretsOptions) {
        log.info("Registering VaultSecretsFilter for service '{}' (expiration {}, check delay {}).",
                callerContext.serviceName(), secretsOptions.expiration(), secretsOptions.checkDelay());
        FilterRegistrationBean<VaultSecretsFilter> registration = new FilterRegistrationBean<>(
                new VaultSecretsFilter(secretsManager, callerContext, secretsOptions, properties.exportSystemProperties()));
        registration.addUrlPatterns("/*");
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
        return registration;
    }
}
