package com.keg.roster;

import com.unboundid.ldap.listener.InMemoryDirectoryServer;
import com.unboundid.ldap.listener.InMemoryDirectoryServerConfig;
import com.unboundid.ldap.sdk.Attribute;
import com.unboundid.ldap.sdk.Entry;
import com.unboundid.ldap.sdk.LDAPException;
import com.unboundid.ldif.LDIFException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.springframework.test.context.DynamicPropertyRegistry;

/**
 * An in-memory directory with two members, one register and one executive group, plus a
 * freshly generated key pair on disk.
 */
final class TestDirectory {

    static final String BASE = "dc=mvl,dc=at";
    static final String SERVICE_DN = "cn=keg,dc=mvl,dc=at";
    static final String SERVICE_PASSWORD = "service-secret";
    static final byte[] PHOTO = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xE0, 0x00, 0x10};

    private static InMemoryDirectoryServer server;
    private static Path keyDirectory;

    private TestDirectory() {
    }

    static synchronized void start() {
        if (server != null) {
            return;
        }
        try {
            InMemoryDirectoryServerConfig config = new InMemoryDirectoryServerConfig(BASE);
            config.addAdditionalBindCredentials(SERVICE_DN, SERVICE_PASSWORD);
            config.setSchema(null);
            server = new InMemoryDirectoryServer(config);
            server.add("dn: " + BASE, "objectClass: domain", "dc: mvl");
            for (String ou : new String[] {"Mitglieder", "Marketender", "Ehrenmitglieder", "Register", "Vorstand"}) {
                server.add("dn: ou=" + ou + "," + BASE, "objectClass: organizationalUnit", "ou: " + ou);
            }
            server.add(new Entry("uid=karli,ou=Mitglieder," + BASE,
                    new Attribute("objectClass", "mvlMember"),
                    new Attribute("uid", "karli"),
                    new Attribute("givenName", "Karl"),
                    new Attribute("sn", "Steinscheisser"),
                    new Attribute("cn", "Karl Steinscheisser"),
                    new Attribute("mvlJoining", "1998"),
                    new Attribute("mvlGender", "m"),
                    new Attribute("mvlActive", "TRUE"),
                    new Attribute("title", "Archivar", "Obmann"),
                    new Attribute("mail", "karli@mvl.at"),
                    new Attribute("mobile", "+43 660 1234567"),
                    new Attribute("userPassword", "secret"),
                    new Attribute("jpegPhoto", PHOTO)));
            server.add("dn: uid=anna,ou=Mitglieder," + BASE,
                    "objectClass: mvlMember",
                    "uid: anna",
                    "givenName: Anna",
                    "sn: Abel",
                    "cn: Anna Abel",
                    "mvlJoining: 2005",
                    "mail: anna@mvl.at",
                    "userPassword: other");
            server.add("dn: cn=Trompete,ou=Register," + BASE,
                    "objectClass: mvlGroup",
                    "cn: Trompete",
                    "mvlNamePlural: Trompeten",
                    "member: uid=anna,ou=Mitglieder," + BASE);
            server.add("dn: cn=Schriftfuehrer,ou=Vorstand," + BASE,
                    "objectClass: mvlGroup",
                    "cn: Schriftfuehrer",
                    "mvlNamePlural: Schriftfuehrer",
                    "member: uid=karli,ou=Mitglieder," + BASE);
            server.startListening();
            keyDirectory = writeKeys();
        } catch (LDAPException | LDIFException e) {
            throw new IllegalStateException("Cannot start in-memory directory", e);
        }
    }

    static synchronized void stop() {
        if (server != null) {
            server.shutDown(true);
            server = null;
        }
    }

    static void register(DynamicPropertyRegistry registry) {
        start();
        int port = server.getListenPort();
        registry.add("keg.ldap.server", () -> "ldap://localhost:" + port);
        registry.add("keg.ldap.dn", () -> SERVICE_DN);
        registry.add("keg.ldap.password", () -> SERVICE_PASSWORD);
        registry.add("keg.ldap.member.base", () -> "ou=Mitglieder," + BASE);
        registry.add("keg.ldap.member.filter", () -> "(objectClass=mvlMember)");
        registry.add("keg.ldap.sutler.base", () -> "ou=Marketender," + BASE);
        registry.add("keg.ldap.sutler.filter", () -> "(objectClass=mvlMember)");
        registry.add("keg.ldap.honorary.base", () -> "ou=Ehrenmitglieder," + BASE);
        registry.add("keg.ldap.honorary.filter", () -> "(objectClass=mvlMember)");
        registry.add("keg.ldap.register.base", () -> "ou=Register," + BASE);
        registry.add("keg.ldap.register.filter", () -> "(objectClass=mvlGroup)");
        registry.add("keg.ldap.executives.base", () -> "ou=Vorstand," + BASE);
        registry.add("keg.ldap.executives.filter", () -> "(objectClass=mvlGroup)");
        registry.add("keg.ldap.title-ordering[0]", () -> "Obmann");
        registry.add("keg.ldap.title-ordering[1]", () -> "Archivar");
        registry.add("keg.ldap.executive-mapping.roster", () -> "Schriftfuehrer");
        registry.add("keg.cert.private-key-path", () -> keyDirectory.resolve("private.pem").toString());
        registry.add("keg.cert.public-key-path", () -> keyDirectory.resolve("public.pem").toString());
    }

    private static Path writeKeys() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(2048);
            KeyPair keys = generator.generateKeyPair();
            Path directory = Files.createTempDirectory("keg-keys");
            writePem(directory.resolve("private.pem"), keys.getPrivate());
            writePem(directory.resolve("public.pem"), keys.getPublic());
            return directory;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void writePem(Path file, Object key) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.US_ASCII);
             JcaPEMWriter pem = new JcaPEMWriter(writer)) {
            pem.writeObject(key);
        }
    }
}
