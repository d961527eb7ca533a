package tech.yump.vaultsecrets;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import tech.yump.vaultsecrets.config.VaultSecretsProperties;

@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(VaultSecretsProperties.class)
public class VaultSecretsApplication {

  public static void main(String[] args) {
    SpringApplication.run(VaultSecretsApplication.class, args);
    log.info(">>> vault-secrets Application Started <<<");
  }
}
