package tech.yump.vaultsecrets.core;

/**
 * Raised to callers that waited on another caller's client initialization when that
 * initialization did not leave an authenticated client behind.
 */
public class InitializationFailedException extends VaultSecretsException {

    public InitializationFailedException(String message) {
        super(message);
    }

    public InitializationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
