package tech.yump.vaultsecrets.core;

import lombok.extern.slf4j.Slf4j;
import tech.yump.vaultsecrets.audit.AuditHelper;
import tech.yump.vaultsecrets.client.SecretStoreClient;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide cache of the service secrets.
 *
 * <p>A payload is served until it is {@code expiration} old. In between, at most once per
 * {@code checkDelay}, the store metadata is probed and a strictly newer change time than the
 * established baseline forces an early re-read. The first probe only establishes the baseline.
 *
 * <p>Refreshes are not single-flighted: concurrent callers that all see a stale entry each
 * read, and the last write wins. A freshness check only updates the entry it started from,
 * so it never overwrites a newer read.
 */
@Slf4j
public class SecretsCache {

    private final Clock clock;
    private final AuditHelper auditHelper;
    private final AtomicReference<SecretsCacheEntry> entry = new AtomicReference<>();

    public SecretsCache(Clock clock, AuditHelper auditHelper) {
        this.clock = clock;
        this.auditHelper = auditHelper;
    }

    public Map<String, String> get(SecretStoreClient client, String path, Duration expiration, Duration checkDelay) {
        long now = clock.millis();
        SecretsCacheEntry current = entry.get();

        if (current == null || !current.isFor(path)) {
            return refresh(client, path, now, 0L, "initial");
        }
        if (now - current.loadedAt() >= expiration.toMillis()) {
            return refresh(client, path, now, current.lastChangedAt(), "expired");
        }
        if (now - current.checkedAt() < checkDelay.toMillis()) {
            return current.payload();
        }

        long changedAt = client.getLastChangedDate(path);
        // 0 means the probe produced no signal; it is never greater than a baseline.
        auditHelper.logVaultEvent("secrets_cache", "metadata_probe",
                changedAt == 0L ? AuditHelper.OUTCOME_FAILURE : AuditHelper.OUTCOME_SUCCESS,
                Map.of("path", path, "lastChangedAt", changedAt));

        if (!current.hasBaseline()) {
            log.debug("Established change baseline {} for {}.", changedAt, path);
            return publishCheck(current, current.checked(now, changedAt));
        }
        if (changedAt > current.lastChangedAt()) {
            log.info("Secret at {} changed in the store ({} > {}), re-reading.", path, changedAt, current.lastChangedAt());
            return refresh(client, path, now, changedAt, "changed");
        }
        return publishCheck(current, current.checked(now, current.lastChangedAt()));
    }

    private Map<String, String> publishCheck(SecretsCacheEntry checkedFrom, SecretsCacheEntry checked) {
        if (entry.compareAndSet(checkedFrom, checked)) {
            return checked.payload();
        }
        // A full read or clear landed while the metadata call was in flight; keep it.
        SecretsCacheEntry latest = entry.get();
        log.debug("Cache entry for {} replaced during freshness check, keeping the newer entry.", checkedFrom.path());
        return latest != null && latest.isFor(checkedFrom.path()) ? latest.payload() : checkedFrom.payload();
    }

    private Map<String, String> refresh(SecretStoreClient client, String path, long now, long lastChangedAt, String reason) {
        Map<String, String> payload;
        try {
            payload = Collections.unmodifiableMap(new LinkedHashMap<>(client.readSecret(path)));
        } catch (RuntimeException e) {
            auditHelper.logVaultEvent("secrets_cache", "full_read", AuditHelper.OUTCOME_FAILURE,
                    Map.of("path", path, "reason", reason, "error", e.getClass().getSimpleName()));
            throw e;
        }
        entry.set(new SecretsCacheEntry(path, payload, now, now, lastChangedAt));
        auditHelper.logVaultEvent("secrets_cache", "full_read", AuditHelper.OUTCOME_SUCCESS,
                Map.of("path", path, "reason", reason, "keys", payload.size()));
        log.debug("Cached {} keys for {} ({}).", payload.size(), path, reason);
        return payload;
    }

    public Optional<SecretsCacheEntry> getEntry() {
        return Optional.ofNullable(entry.get());
    }

    public void clear() {
        entry.set(null);
    }
}
