package tech.yump.vaultsecrets.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.vaultsecrets.api.dto.SecretsStatusResponse;
import tech.yump.vaultsecrets.core.SecretsManager;
import tech.yump.vaultsecrets.web.VaultSecretsFilter;

import java.util.Map;
import java.util.TreeSet;

@RestController
@Tag(name = "System", description = "System information and status endpoints")
public class RootController {

  private final SecretsManager secretsManager;

  public RootController(SecretsManager secretsManager) {
    this.secretsManager = secretsManager;
  }

  @GetMapping("/")
  @Operation(
          summary = "Root Endpoint",
          description = "Welcome message. Runs behind the secrets filter, so it only answers once secrets are loaded."
  )
  @ApiResponse(responseCode = "200", description = "Welcome message and status.",
          content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                  schema = @Schema(type = "object", example = "{\"message\": \"Welcome to vault-secrets\", \"status\": \"OK\"}")))
  @ApiResponse(responseCode = "502", description = "Secrets could not be loaded. Carries the x-error header and no body.")
  public Map<String, String> getRoot() {
    return Map.of("message", "Welcome to vault-secrets", "status", "OK");
  }

  @GetMapping("/v1/secrets/keys")
  @Operation(
          summary = "List loaded secret keys",
          description = "Returns the names (never the values) of the secrets made available to this request."
  )
  @ApiResponse(responseCode = "200", description = "Key names.",
          content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                  schema = @Schema(type = "object", example = "{\"keys\": [\"IMS_CLIENT_ID\", \"SLACK_BOT_TOKEN\"]}")))
  public Map<String, Object> getSecretKeys(HttpServletRequest request) {
    Object secrets = request.getAttribute(VaultSecretsFilter.SECRETS_ATTR);
    if (secrets instanceof Map<?, ?> map) {
      TreeSet<String> keys = new TreeSet<>();
      map.keySet().forEach(key -> keys.add(String.valueOf(key)));
      return Map.of("keys", keys);
    }
    return Map.of("keys", new TreeSet<String>());
  }

  @GetMapping("/sys/secrets-status")
  @Operation(
          summary = "Get Secrets Status",
          description = "Returns the Vault token state and cache timestamps. Bypasses the secrets filter."
  )
  @ApiResponse(responseCode = "200", description = "Status retrieved.",
          content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                  schema = @Schema(implementation = SecretsStatusResponse.class)))
  public SecretsStatusResponse getSecretsStatus() {
    return SecretsStatusResponse.from(secretsManager.getStatus());
  }
}
