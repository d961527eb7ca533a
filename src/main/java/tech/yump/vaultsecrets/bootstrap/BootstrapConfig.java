package tech.yump.vaultsecrets.bootstrap;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.util.StringUtils;
import tech.yump.vaultsecrets.core.ConfigurationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything needed to reach and log in to the secret store. Loaded once per process.
 *
 * @param roleId       AppRole role id.
 * @param roleSecret   AppRole secret id.
 * @param storeAddress Base address of the store.
 * @param mountPoint   KV v2 mount holding the service secrets.
 * @param environment  Logical environment name, first segment of the default secret path (e.g. "prod").
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BootstrapConfig(
        @JsonProperty("role_id") String roleId,
        @JsonProperty("secret_id") String roleSecret,
        @JsonProperty("vault_addr") String storeAddress,
        @JsonProperty("mount_point") String mountPoint,
        @JsonProperty("environment") String environment
) {

    /**
     * @throws ConfigurationException naming every required field that is blank.
     */
    public BootstrapConfig validate() {
        List<String> missing = new ArrayList<>();
        if (!StringUtils.hasText(roleId)) missing.add("role_id");
        if (!StringUtils.hasText(roleSecret)) missing.add("secret_id");
        if (!StringUtils.hasText(storeAddress)) missing.add("vault_addr");
        if (!StringUtils.hasText(mountPoint)) missing.add("mount_point");
        if (!StringUtils.hasText(environment)) missing.add("environment");
        if (!missing.isEmpty()) {
            throw new ConfigurationException("Bootstrap config is missing required fields: " + String.join(", ", missing));
        }
        return this;
    }

    @Override
    public String toString() {
        // Never print the role secret
        return "BootstrapConfig[" +
                "roleId='" + roleId + '\'' +
                ", roleSecret=******" +
                ", storeAddress='" + storeAddress + '\'' +
                ", mountPoint='" + mountPoint + '\'' +
                ", environment='" + environment + '\'' +
                ']';
    }
}
