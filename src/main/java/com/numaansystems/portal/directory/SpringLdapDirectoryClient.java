package com.numaansystems.portal.directory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ldap.AuthenticationException;
import org.springframework.ldap.NamingException;
import org.springframework.ldap.OperationNotSupportedException;
import org.springframework.ldap.core.AttributesMapper;
import org.springframework.ldap.core.LdapTemplate;
import org.springframework.ldap.support.LdapUtils;
import org.springframework.stereotype.Component;

import javax.naming.NamingEnumeration;
import javax.naming.directory.Attribute;
import javax.naming.directory.Attributes;
import javax.naming.directory.DirContext;
import javax.naming.directory.SearchControls;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link DirectoryClient} on top of Spring LDAP.
 *
 * <p>Binds open a dedicated context with the user's own credentials. Searches run through the
 * shared {@link LdapTemplate}, i.e. with the configured service account or anonymously.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Component
public class SpringLdapDirectoryClient implements DirectoryClient {

    private static final Logger logger = LoggerFactory.getLogger(SpringLdapDirectoryClient.class);

    private final LdapTemplate ldapTemplate;

    public SpringLdapDirectoryClient(LdapTemplate ldapTemplate) {
        this.ldapTemplate = ldapTemplate;
    }

    @Override
    public void bind(String userDn, String password) {
        if (password == null || password.isEmpty()) {
            // an empty password is an anonymous bind, which most directories accept
            throw new DirectoryAuthenticationException("Empty password", null);
        }

        DirContext context = null;
        try {
            context = ldapTemplate.getContextSource().getContext(userDn, password);
            logger.debug("Bind successful for {}", userDn);
        } catch (AuthenticationException | OperationNotSupportedException e) {
            throw new DirectoryAuthenticationException("Bind rejected for " + userDn, e);
        } catch (NamingException e) {
            throw new DirectoryUnavailableException("Directory bind failed: " + e.getMessage(), e);
        } finally {
            LdapUtils.closeContext(context);
        }
    }

    @Override
    public List<DirectoryEntry> search(String base, String filter, String... attributes) {
        SearchControls controls = new SearchControls();
        controls.setSearchScope(SearchControls.SUBTREE_SCOPE);
        controls.setReturningAttributes(attributes);

        try {
            return ldapTemplate.search(base, filter, controls, (AttributesMapper<DirectoryEntry>) this::toEntry);
        } catch (NamingException e) {
            throw new DirectoryUnavailableException("Directory search failed: " + e.getMessage(), e);
        }
    }

    private DirectoryEntry toEntry(Attributes attributes) throws javax.naming.NamingException {
        String displayName = stringValue(attributes.get("cn"));
        String email = stringValue(attributes.get("mail"));

        List<String> groups = new ArrayList<>();
        Attribute memberOf = attributes.get("memberOf");
        if (memberOf != null) {
            NamingEnumeration<?> values = memberOf.getAll();
            while (values.hasMore()) {
                String groupDn = String.valueOf(values.next());
                try {
                    groups.add(DirectoryEntry.leafGroupName(groupDn));
                } catch (NamingException | IllegalArgumentException e) {
                    logger.warn("Ignoring malformed memberOf value: {}", groupDn);
                }
            }
        }
        return new DirectoryEntry(displayName, email, groups);
    }

    private static String stringValue(Attribute attribute) throws javax.naming.NamingException {
        if (attribute == null || attribute.size() == 0) {
            return null;
        }
        Object value = attribute.get();
        return value != null ? value.toString() : null;
    }
}
