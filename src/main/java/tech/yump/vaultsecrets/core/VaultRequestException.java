package tech.yump.vaultsecrets.core;

import java.util.OptionalInt;

/**
 * A failed HTTP exchange with the secret store. Carries the response status when the
 * store answered at all; network failures have no status.
 */
public class VaultRequestException extends VaultSecretsException {

    private final Integer statusCode;

    public VaultRequestException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public VaultRequestException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = null;
    }

    public VaultRequestException(String message) {
        super(message);
        this.statusCode = null;
    }

    public OptionalInt getStatusCode() {
        return statusCode == null ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }
}
