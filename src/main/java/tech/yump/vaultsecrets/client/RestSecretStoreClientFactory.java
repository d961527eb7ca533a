package tech.yump.vaultsecrets.client;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClient;
import tech.yump.vaultsecrets.auth.AuthSession;
import tech.yump.vaultsecrets.bootstrap.BootstrapConfig;

import java.time.Clock;

@Slf4j
@RequiredArgsConstructor
public class RestSecretStoreClientFactory implements SecretStoreClientFactory {

    private final RestClient restClient;
    private final Clock clock;

    @Override
    public SecretStoreClient create(BootstrapConfig config) {
        StoreConnection connection = new StoreConnection(config.storeAddress(), config.mountPoint());
        log.debug("Creating Vault client for {} (mount '{}').", connection.address(), connection.mountPoint());
        AuthSession session = new AuthSession(restClient, connection, clock);
        return new VaultSecretStoreClient(restClient, connection, session);
    }
}
