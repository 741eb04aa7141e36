package com.keg.directory;

import java.util.Hashtable;
import javax.naming.AuthenticationException;
import javax.naming.Context;
import javax.naming.NamingException;
import javax.naming.ldap.InitialLdapContext;
import javax.naming.ldap.LdapContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DirectoryConnector} backed by the JDK's JNDI LDAP provider.
 */
public class JndiDirectoryConnector implements DirectoryConnector {

    private static final Logger log = LoggerFactory.getLogger(JndiDirectoryConnector.class);

    static final String CONTEXT_FACTORY = "com.sun.jndi.ldap.LdapCtxFactory";
    static final String CONNECT_TIMEOUT = "com.sun.jndi.ldap.connect.timeout";
    static final String READ_TIMEOUT = "com.sun.jndi.ldap.read.timeout";
    static final String BINARY_ATTRIBUTES = "java.naming.ldap.attributes.binary";

    private final DirectorySettings settings;

    public JndiDirectoryConnector(DirectorySettings settings) {
        this.settings = settings;
    }

    @Override
    public DirectorySession connect(String bindDn, String password) throws SessionException {
        Hashtable<String, String> env = environment(bindDn, password);
        try {
            LdapContext context = new InitialLdapContext(env, null);
            return new JndiDirectorySession(context);
        } catch (AuthenticationException e) {
            throw new BindRejectedException(bindDn, e);
        } catch (NamingException e) {
            log.debug("Could not connect to {}", settings.serverUrl(), e);
            throw new SessionException("Could not open session to " + settings.serverUrl(), e);
        }
    }

    Hashtable<String, String> environment(String bindDn, String password) {
        Hashtable<String, String> env = new Hashtable<>();
        env.put(Context.INITIAL_CONTEXT_FACTORY, CONTEXT_FACTORY);
        env.put(Context.PROVIDER_URL, settings.serverUrl());
        env.put(Context.REFERRAL, "ignore");
        env.put(CONNECT_TIMEOUT, String.valueOf(settings.connectTimeout().toMillis()));
        env.put(READ_TIMEOUT, String.valueOf(settings.readTimeout().toMillis()));
        if (!settings.binaryAttributes().isEmpty()) {
            env.put(BINARY_ATTRIBUTES, String.join(" ", settings.binaryAttributes()));
        }
        if (bindDn != null) {
            env.put(Context.SECURITY_AUTHENTICATION, "simple");
            env.put(Context.SECURITY_PRINCIPAL, bindDn);
            env.put(Context.SECURITY_CREDENTIALS, password == null ? "" : password);
        } else {
            env.put(Context.SECURITY_AUTHENTICATION, "none");
        }
        return env;
    }
}
