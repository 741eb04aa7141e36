package com.keg.directory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.naming.NamingEnumeration;
import javax.naming.NamingException;
import javax.naming.directory.Attribute;
import javax.naming.directory.SearchControls;
import javax.naming.directory.SearchResult;
import javax.naming.ldap.LdapContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DirectorySession} over a JNDI {@link LdapContext}.
 */
class JndiDirectorySession implements DirectorySession {

    private static final Logger log = LoggerFactory.getLogger(JndiDirectorySession.class);

    private final LdapContext context;

    JndiDirectorySession(LdapContext context) {
        this.context = context;
    }

    @Override
    public List<RawEntry> search(String baseDn, String filter) throws DirectoryException {
        SearchControls controls = new SearchControls();
        controls.setSearchScope(SearchControls.SUBTREE_SCOPE);
        controls.setReturningAttributes(null);
        List<RawEntry> entries = new ArrayList<>();
        NamingEnumeration<SearchResult> results = null;
        try {
            results = context.search(baseDn, filter, controls);
            while (results.hasMore()) {
                entries.add(toRawEntry(results.next()));
            }
            results.close();
            results = null;
            return entries;
        } catch (NamingException e) {
            throw new DirectoryException(
                    "Search below '" + baseDn + "' with filter '" + filter + "' failed", e);
        } finally {
            if (results != null) {
                release(results);
            }
        }
    }

    @Override
    public void close() throws DirectoryException {
        try {
            context.close();
        } catch (NamingException e) {
            throw new DirectoryException("Could not unbind from directory server", e);
        }
    }

    private static RawEntry toRawEntry(SearchResult result) throws NamingException {
        Map<String, List<String>> text = new HashMap<>();
        Map<String, List<byte[]>> binary = new HashMap<>();
        NamingEnumeration<? extends Attribute> attributes = result.getAttributes().getAll();
        try {
            while (attributes.hasMore()) {
                Attribute attribute = attributes.next();
                String id = attribute.getID();
                NamingEnumeration<?> values = attribute.getAll();
                while (values.hasMore()) {
                    Object value = values.next();
                    if (value instanceof byte[]) {
                        binary.computeIfAbsent(id, k -> new ArrayList<>()).add((byte[]) value);
                    } else if (value != null) {
                        text.computeIfAbsent(id, k -> new ArrayList<>()).add(value.toString());
                    }
                }
            }
        } finally {
            attributes.close();
        }
        return new RawEntry(result.getNameInNamespace(), text, binary);
    }

    // only reached when the search already failed; that failure is the one reported
    private static void release(NamingEnumeration<?> enumeration) {
        try {
            enumeration.close();
        } catch (NamingException e) {
            log.debug("Could not release search results", e);
        }
    }
}
