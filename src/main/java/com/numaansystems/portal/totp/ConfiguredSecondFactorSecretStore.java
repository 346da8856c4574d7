package com.numaansystems.portal.totp;

import com.numaansystems.portal.config.PortalProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Secret store backed by the {@code portal.totp.secrets} map.
 *
 * <p>Suitable for small deployments and demos. Larger installations should provide another
 * {@link SecondFactorSecretStore} bean, e.g. reading the directory's OTP tokens or a vault.
 * Setting {@code portal.totp.enabled=false} removes this bean, after which every
 * second-factor attempt fails as a configuration error.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Component
@ConditionalOnProperty(prefix = "portal.totp", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ConfiguredSecondFactorSecretStore implements SecondFactorSecretStore {

    private static final Logger logger = LoggerFactory.getLogger(ConfiguredSecondFactorSecretStore.class);

    private final Map<String, String> secrets;

    public ConfiguredSecondFactorSecretStore(PortalProperties properties) {
        this.secrets = Collections.unmodifiableMap(new LinkedHashMap<>(properties.getTotp().getSecrets()));
        logger.info("TOTP secret store loaded with {} enrolled users", secrets.size());
    }

    @Override
    public Optional<String> lookup(String username) {
        return Optional.ofNullable(secrets.get(username)).filter(secret -> !secret.isBlank());
    }
}
