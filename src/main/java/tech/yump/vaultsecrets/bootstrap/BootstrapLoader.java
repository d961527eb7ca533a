package tech.yump.vaultsecrets.bootstrap;

/**
 * Source of the bootstrap credentials for the secret store.
 */
public interface BootstrapLoader {

    /**
     * Loads the bootstrap config stored under the given path.
     *
     * @param bootstrapPath Identifier of the bootstrap secret in the external provider.
     * @return A validated config with every field present.
     * @throws BootstrapException if the secret cannot be retrieved or parsed.
     * @throws tech.yump.vaultsecrets.core.ConfigurationException if required fields are missing.
     */
    BootstrapConfig load(String bootstrapPath);
}
