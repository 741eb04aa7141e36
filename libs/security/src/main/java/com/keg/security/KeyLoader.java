package com.keg.security;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.RSAPublicKeySpec;
import java.security.spec.X509EncodedKeySpec;
import org.bouncycastle.asn1.DERNull;
import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.pkcs.RSAPrivateKey;
import org.bouncycastle.asn1.pkcs.RSAPublicKey;
import org.bouncycastle.asn1.x509.AlgorithmIdentifier;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;

/**
 * Reads RSA keys from files.
 * <p>
 * Accepted formats:
 * <ul>
 *   <li>private key: PEM {@code RSA PRIVATE KEY} (PKCS#1) or {@code PRIVATE KEY} (PKCS#8),
 *       DER PKCS#8 or PKCS#1</li>
 *   <li>public key: PEM {@code PUBLIC KEY}, {@code RSA PUBLIC KEY} or {@code CERTIFICATE},
 *       DER SubjectPublicKeyInfo or PKCS#1</li>
 * </ul>
 */
public final class KeyLoader {

    private static final String PEM_MARKER = "-----BEGIN ";
    private static final String RSA = "RSA";

    private KeyLoader() {
        // utility class
    }

    public static PrivateKey loadPrivateKey(Path path) {
        byte[] content = read(path);
        try {
            if (isPem(content)) {
                Object parsed = readPem(content, path);
                JcaPEMKeyConverter converter = new JcaPEMKeyConverter();
                if (parsed instanceof PEMKeyPair) {
                    return converter.getKeyPair((PEMKeyPair) parsed).getPrivate();
                }
                if (parsed instanceof PrivateKeyInfo) {
                    return converter.getPrivateKey((PrivateKeyInfo) parsed);
                }
                throw new KeyLoadingException("No private key found in " + path);
            }
            return derPrivateKey(content);
        } catch (IOException | GeneralSecurityException | IllegalArgumentException e) {
            throw new KeyLoadingException("Cannot parse private key " + path, e);
        }
    }

    public static PublicKey loadPublicKey(Path path) {
        byte[] content = read(path);
        try {
            if (isPem(content)) {
                Object parsed = readPem(content, path);
                SubjectPublicKeyInfo keyInfo;
                if (parsed instanceof SubjectPublicKeyInfo) {
                    keyInfo = (SubjectPublicKeyInfo) parsed;
                } else if (parsed instanceof X509CertificateHolder) {
                    keyInfo = ((X509CertificateHolder) parsed).getSubjectPublicKeyInfo();
                } else {
                    throw new KeyLoadingException("No public key found in " + path);
                }
                return new JcaPEMKeyConverter().getPublicKey(keyInfo);
            }
            return derPublicKey(content);
        } catch (IOException | GeneralSecurityException | IllegalArgumentException e) {
            throw new KeyLoadingException("Cannot parse public key " + path, e);
        }
    }

    private static byte[] read(Path path) {
        if (path == null) {
            throw new KeyLoadingException("No key path configured");
        }
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new KeyLoadingException("Cannot read key file " + path, e);
        }
    }

    private static boolean isPem(byte[] content) {
        return new String(content, StandardCharsets.US_ASCII).contains(PEM_MARKER);
    }

    private static Object readPem(byte[] content, Path path) throws IOException {
        try (PEMParser parser = new PEMParser(new StringReader(new String(content, StandardCharsets.US_ASCII)))) {
            Object parsed = parser.readObject();
            if (parsed == null) {
                throw new KeyLoadingException("Empty PEM file " + path);
            }
            return parsed;
        }
    }

    private static PrivateKey derPrivateKey(byte[] der) throws GeneralSecurityException {
        KeyFactory factory = KeyFactory.getInstance(RSA);
        try {
            return factory.generatePrivate(new PKCS8EncodedKeySpec(der));
        } catch (GeneralSecurityException notPkcs8) {
            // PKCS#1 RSAPrivateKey, wrap it into a PKCS#8 structure
            try {
                PrivateKeyInfo info = new PrivateKeyInfo(
                        new AlgorithmIdentifier(PKCSObjectIdentifiers.rsaEncryption, DERNull.INSTANCE),
                        RSAPrivateKey.getInstance(der));
                return factory.generatePrivate(new PKCS8EncodedKeySpec(info.getEncoded()));
            } catch (IOException e) {
                notPkcs8.addSuppressed(e);
                throw notPkcs8;
            }
        }
    }

    private static PublicKey derPublicKey(byte[] der) throws GeneralSecurityException {
        KeyFactory factory = KeyFactory.getInstance(RSA);
        try {
            return factory.generatePublic(new X509EncodedKeySpec(der));
        } catch (GeneralSecurityException notSpki) {
            RSAPublicKey rsa = RSAPublicKey.getInstance(der);
            return factory.generatePublic(new RSAPublicKeySpec(rsa.getModulus(), rsa.getPublicExponent()));
        }
    }
}
