package tech.yump.vaultsecrets.core;

import java.util.Map;

/**
 * Immutable snapshot of the cached secrets. Timestamps are epoch milliseconds.
 *
 * @param path          Store path the payload was read from.
 * @param payload       Complete result of one successful read.
 * @param loadedAt      When the payload was read.
 * @param checkedAt     When freshness was last established (read or metadata probe).
 * @param lastChangedAt Store-side change time of the baseline; 0 while not established.
 */
public record SecretsCacheEntry(
        String path,
        Map<String, String> payload,
        long loadedAt,
        long checkedAt,
        long lastChangedAt
) {

    public boolean isFor(String secretPath) {
        return payload != null && path.equals(secretPath);
    }

    public boolean hasBaseline() {
        return lastChangedAt != 0L;
    }

    SecretsCacheEntry checked(long now, long changedAt) {
        return new SecretsCacheEntry(path, payload, loadedAt, now, changedAt);
    }
}
