package pl.marcinmilkowski.line_search.server;

import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.PKCS8EncodedKeySpec;
import java.util.Base64;
import java.util.Collection;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds TLS contexts from PEM files.
 *
 * Supported key encodings:
 * - PKCS#8 "PRIVATE KEY" (RSA or EC)
 * - PKCS#1 "RSA PRIVATE KEY" (re-wrapped as PKCS#8)
 *
 * Encrypted keys are not supported.
 */
public final class TlsContextFactory {

    private static final String PROTOCOL = "TLS";
    private static final String KEY_ALIAS = "server";
    private static final char[] IN_MEMORY_PASSWORD = "line-search".toCharArray();

    private static final Pattern PEM_BLOCK = Pattern.compile(
        "-----BEGIN ([A-Z0-9 ]+)-----\\s*([A-Za-z0-9+/=\\s]+?)\\s*-----END \\1-----");

    // AlgorithmIdentifier for rsaEncryption (1.2.840.113549.1.1.1) with NULL parameters
    private static final byte[] RSA_ALGORITHM_ID = {
        0x30, 0x0D, 0x06, 0x09, 0x2A, (byte) 0x86, 0x48, (byte) 0x86,
        (byte) 0xF7, 0x0D, 0x01, 0x01, 0x01, 0x05, 0x00
    };

    private TlsContextFactory() {
    }

    /**
     * Server-side context presenting the given certificate chain and key.
     * No client certificates are requested.
     *
     * @throws IOException              if a file cannot be read or holds no PEM block of the right kind
     * @throws GeneralSecurityException if the certificate or key cannot be parsed or do not fit together
     */
    public static SSLContext createServerContext(Path certPath, Path keyPath)
            throws IOException, GeneralSecurityException {
        Certificate[] chain = readCertificates(certPath);
        PrivateKey key = readPrivateKey(keyPath);

        KeyStore keyStore = KeyStore.getInstance("PKCS12");
        keyStore.load(null, null);
        keyStore.setKeyEntry(KEY_ALIAS, key, IN_MEMORY_PASSWORD, chain);

        KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
        kmf.init(keyStore, IN_MEMORY_PASSWORD);

        SSLContext context = SSLContext.getInstance(PROTOCOL);
        context.init(kmf.getKeyManagers(), null, null);
        return context;
    }

    /**
     * Client-side context trusting exactly the certificates in the given PEM file.
     */
    public static SSLContext createClientContext(Path trustedCertPath) throws IOException, GeneralSecurityException {
        KeyStore trustStore = KeyStore.getInstance("PKCS12");
        trustStore.load(null, null);
        Certificate[] certificates = readCertificates(trustedCertPath);
        for (int i = 0; i < certificates.length; i++) {
            trustStore.setCertificateEntry("trusted-" + i, certificates[i]);
        }

        TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        tmf.init(trustStore);

        SSLContext context = SSLContext.getInstance(PROTOCOL);
        context.init(null, tmf.getTrustManagers(), null);
        return context;
    }

    static Certificate[] readCertificates(Path certPath) throws IOException, GeneralSecurityException {
        Collection<? extends Certificate> certificates;
        try (InputStream in = Files.newInputStream(certPath)) {
            certificates = CertificateFactory.getInstance("X.509").generateCertificates(in);
        }
        if (certificates.isEmpty()) {
            throw new IOException("No certificate found in " + certPath);
        }
        return certificates.toArray(new Certificate[0]);
    }

    static PrivateKey readPrivateKey(Path keyPath) throws IOException, GeneralSecurityException {
        String pem = Files.readString(keyPath, StandardCharsets.US_ASCII);
        Matcher m = PEM_BLOCK.matcher(pem);
        while (m.find()) {
            String type = m.group(1);
            byte[] der = Base64.getMimeDecoder().decode(m.group(2));
            switch (type) {
                case "PRIVATE KEY":
                    return parsePkcs8(der);
                case "RSA PRIVATE KEY":
                    return KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(wrapPkcs1(der)));
                case "ENCRYPTED PRIVATE KEY":
                    throw new GeneralSecurityException("Encrypted private keys are not supported: " + keyPath);
                default:
                    // certificates may share the file with the key
                    break;
            }
        }
        throw new IOException("No private key found in " + keyPath);
    }

    private static PrivateKey parsePkcs8(byte[] der) throws GeneralSecurityException {
        PKCS8EncodedKeySpec spec = new PKCS8EncodedKeySpec(der);
        try {
            return KeyFactory.getInstance("RSA").generatePrivate(spec);
        } catch (InvalidKeySpecException notRsa) {
            return KeyFactory.getInstance("EC").generatePrivate(spec);
        }
    }

    /**
     * PrivateKeyInfo ::= SEQUENCE { version INTEGER 0, algorithm AlgorithmIdentifier, privateKey OCTET STRING }
     */
    static byte[] wrapPkcs1(byte[] pkcs1) {
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        body.write(0x02);
        body.write(0x01);
        body.write(0x00);
        body.writeBytes(RSA_ALGORITHM_ID);
        body.write(0x04);
        writeDerLength(body, pkcs1.length);
        body.writeBytes(pkcs1);

        byte[] content = body.toByteArray();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(0x30);
        writeDerLength(out, content.length);
        out.writeBytes(content);
        return out.toByteArray();
    }

    private static void writeDerLength(ByteArrayOutputStream out, int length) {
        if (length < 0x80) {
            out.write(length);
        } else if (length < 0x100) {
            out.write(0x81);
            out.write(length);
        } else if (length < 0x10000) {
            out.write(0x82);
            out.write(length >> 8);
            out.write(length & 0xFF);
        } else {
            out.write(0x83);
            out.write(length >> 16);
            out.write((length >> 8) & 0xFF);
            out.write(length & 0xFF);
        }
    }
}
