package tech.yump.vaultsecrets.bootstrap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;

/**
 * Reads the bootstrap config from AWS Secrets Manager. The SDK signs the request with the
 * ambient AWS credentials of the process.
 */
@Slf4j
@RequiredArgsConstructor
public class AwsSecretsManagerBootstrapLoader implements BootstrapLoader {

    private final SecretsManagerClient secretsManagerClient;
    private final ObjectMapper objectMapper;

    @Override
    public BootstrapConfig load(String bootstrapPath) {
        log.info("Loading Vault bootstrap config from AWS Secrets Manager: {}", bootstrapPath);

        GetSecretValueResponse response;
        try {
            response = secretsManagerClient.getSecretValue(
                    GetSecretValueRequest.builder().secretId(bootstrapPath).build());
        } catch (ResourceNotFoundException e) {
            log.error("Bootstrap secret {} does not exist.", bootstrapPath);
            throw new BootstrapException("Bootstrap secret not found: " + bootstrapPath, e);
        } catch (SdkException e) {
            log.error("Failed to retrieve bootstrap secret {}: {}", bootstrapPath, e.getMessage());
            throw new BootstrapException("Failed to retrieve bootstrap secret " + bootstrapPath + ": " + e.getMessage(), e);
        }

        String secretString = response.secretString();
        if (!StringUtils.hasText(secretString)) {
            throw new BootstrapException("Bootstrap secret " + bootstrapPath + " has no SecretString.");
        }

        BootstrapConfig config;
        try {
            config = objectMapper.readValue(secretString, BootstrapConfig.class);
        } catch (JsonProcessingException e) {
            // Do not attach the parser message, it can quote secret content.
            throw new BootstrapException("Bootstrap secret " + bootstrapPath + " is not a valid JSON object.");
        }
        if (config == null) {
            throw new BootstrapException("Bootstrap secret " + bootstrapPath + " is empty.");
        }
        return config.validate();
    }
}
