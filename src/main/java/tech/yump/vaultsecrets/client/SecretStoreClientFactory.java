package tech.yump.vaultsecrets.client;

import tech.yump.vaultsecrets.bootstrap.BootstrapConfig;

/**
 * Creates an unauthenticated client for the store described by a bootstrap config.
 */
@FunctionalInterface
public interface SecretStoreClientFactory {

    SecretStoreClient create(BootstrapConfig config);
}
