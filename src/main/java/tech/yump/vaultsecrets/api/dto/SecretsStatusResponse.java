package tech.yump.vaultsecrets.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import tech.yump.vaultsecrets.auth.TokenState;
import tech.yump.vaultsecrets.core.SecretsStatus;

import java.time.Instant;

@Schema(description = "State of the Vault client and the secrets cache. Never contains secret values.")
public record SecretsStatusResponse(
        @Schema(description = "Lifecycle state of the Vault token.", example = "AUTHENTICATED", requiredMode = Schema.RequiredMode.REQUIRED)
        TokenState tokenState,

        @Schema(description = "Environment from the bootstrap config, if loaded.", example = "prod")
        String environment,

        @Schema(description = "Store path of the cached secrets.", example = "prod/api-service")
        String secretPath,

        @Schema(description = "Number of keys in the cached payload.", example = "3", requiredMode = Schema.RequiredMode.REQUIRED)
        int keyCount,

        @Schema(description = "When the cached payload was read from the store.")
        Instant loadedAt,

        @Schema(description = "When freshness was last checked against the store.")
        Instant checkedAt,

        @Schema(description = "Store-side change time used as the staleness baseline.")
        Instant lastChangedAt
) {

    public static SecretsStatusResponse from(SecretsStatus status) {
        return new SecretsStatusResponse(
                status.tokenState(),
                status.environment(),
                status.secretPath(),
                status.keyCount(),
                toInstant(status.loadedAt()),
                toInstant(status.checkedAt()),
                toInstant(status.lastChangedAt()));
    }

    private static Instant toInstant(long epochMillis) {
        return epochMillis == 0L ? null : Instant.ofEpochMilli(epochMillis);
    }
}
