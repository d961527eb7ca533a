package tech.yump.vaultsecrets.core;

import tech.yump.vaultsecrets.auth.TokenState;

/**
 * Snapshot of the client and cache state. Timestamps are epoch milliseconds, 0 when unset.
 */
public record SecretsStatus(
        TokenState tokenState,
        String environment,
        String secretPath,
        int keyCount,
        long loadedAt,
        long checkedAt,
        long lastChangedAt
) {
}
