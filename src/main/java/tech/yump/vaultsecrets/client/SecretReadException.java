package tech.yump.vaultsecrets.client;

import tech.yump.vaultsecrets.core.VaultRequestException;

/**
 * Generic secret read failure (non-2xx other than 404, network error, or unusable body).
 */
public class SecretReadException extends VaultRequestException {

    public SecretReadException(String message, int statusCode, Throwable cause) {
        super(message, statusCode, cause);
    }

    public SecretReadException(String message, Throwable cause) {
        super(message, cause);
    }

    public SecretReadException(String message) {
        super(message);
    }
}
