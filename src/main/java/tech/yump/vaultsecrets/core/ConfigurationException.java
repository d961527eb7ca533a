package tech.yump.vaultsecrets.core;

/**
 * Missing or invalid configuration. Never retried.
 */
public class ConfigurationException extends VaultSecretsException {

    public ConfigurationException(String message) {
        super(message);
    }
}
