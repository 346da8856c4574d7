package com.numaansystems.portal.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.ldap.core.LdapTemplate;
import org.springframework.ldap.core.support.LdapContextSource;
import org.springframework.util.StringUtils;

import java.util.HashMap;
import java.util.Map;

/**
 * Connection to the LDAP directory used for the password step.
 *
 * <p>Searches run with the manager credentials when configured, anonymously otherwise. The
 * user's own password is only used for the bind check.</p>
 *
 * <h2>Configuration</h2>
 * <pre>
 * portal:
 *   directory:
 *     url: ldap://ipa.example.internal:389
 *     manager-dn: uid=portal,cn=sysaccounts,cn=etc,dc=example,dc=internal
 *     manager-password: ${LDAP_MANAGER_PASSWORD}
 *     connect-timeout-ms: 5000
 *     read-timeout-ms: 10000
 * </pre>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Configuration
public class DirectoryConfig {

    private static final Logger logger = LoggerFactory.getLogger(DirectoryConfig.class);

    @Value("${portal.directory.url:ldap://localhost:389}")
    private String url;

    @Value("${portal.directory.manager-dn:}")
    private String managerDn;

    @Value("${portal.directory.manager-password:}")
    private String managerPassword;

    @Value("${portal.directory.connect-timeout-ms:5000}")
    private int connectTimeoutMs;

    @Value("${portal.directory.read-timeout-ms:10000}")
    private int readTimeoutMs;

    @Bean
    public LdapContextSource ldapContextSource() {
        LdapContextSource contextSource = new LdapContextSource();
        contextSource.setUrl(url);
        contextSource.setBase("");

        if (StringUtils.hasText(managerDn)) {
            contextSource.setUserDn(managerDn);
            contextSource.setPassword(managerPassword);
        } else {
            contextSource.setAnonymousReadOnly(true);
        }

        Map<String, Object> environment = new HashMap<>();
        environment.put("com.sun.jndi.ldap.connect.timeout", String.valueOf(connectTimeoutMs));
        environment.put("com.sun.jndi.ldap.read.timeout", String.valueOf(readTimeoutMs));
        contextSource.setBaseEnvironmentProperties(environment);

        logger.info("Directory configured at {} ({})", url, StringUtils.hasText(managerDn) ? "manager bind" : "anonymous search");
        return contextSource;
    }

    @Bean
    public LdapTemplate ldapTemplate(LdapContextSource ldapContextSource) {
        LdapTemplate template = new LdapTemplate(ldapContextSource);
        template.setIgnorePartialResultException(true);
        return template;
    }
}
