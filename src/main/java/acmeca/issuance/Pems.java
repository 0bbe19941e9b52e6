package acmeca.issuance;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.List;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;

/**
 * PEM encoding and decoding of keys and certificates.
 */
public final class Pems {

    private Pems() {}

    public static String write(Object object) {
        final StringWriter out = new StringWriter();
        try (JcaPEMWriter pemWriter = new JcaPEMWriter(out)) {
            pemWriter.writeObject(object);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to generate PEM from " + object.getClass().getSimpleName(), e);
        }
        return out.toString();
    }

    public static List<Object> readObjects(Reader reader) throws IOException {
        final List<Object> results = new ArrayList<>();
        try (PEMParser parser = new PEMParser(reader)) {
            for (Object o = parser.readObject(); o != null; o = parser.readObject()) {
                results.add(o);
            }
        }
        return results;
    }

    public static X509Certificate readCertificate(Reader reader) throws IOException {
        final List<Object> objects = readObjects(reader);
        if (objects.size() != 1 || !(objects.get(0) instanceof X509CertificateHolder holder)) {
            throw new IllegalArgumentException("Expected exactly one certificate, got " + objects.size() + " PEM objects");
        }
        return toCertificate(holder);
    }

    public static X509Certificate readCertificate(String pem) {
        try {
            return readCertificate(new StringReader(pem));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to parse stored certificate", e);
        }
    }

    public static PrivateKey readPrivateKey(Reader reader) throws IOException {
        final List<Object> objects = readObjects(reader);
        if (objects.size() != 1) {
            throw new IllegalArgumentException("Expected exactly one private key, got " + objects.size() + " PEM objects");
        }
        final Object obj = objects.get(0);
        // some PEMs carry a key pair, others only the private key
        if (obj instanceof PrivateKeyInfo privateKeyInfo) {
            return new JcaPEMKeyConverter().getPrivateKey(privateKeyInfo);
        }
        else if (obj instanceof PEMKeyPair pemKeyPair) {
            final KeyPair keyPair = new JcaPEMKeyConverter().getKeyPair(pemKeyPair);
            return keyPair.getPrivate();
        }
        throw new IllegalArgumentException("Expected a key pair or private key, got " + obj.getClass().getSimpleName());
    }

    public static PrivateKey readPrivateKey(String pem) {
        try {
            return readPrivateKey(new StringReader(pem));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to parse stored private key", e);
        }
    }

    public static X509Certificate toCertificate(X509CertificateHolder holder) {
        try {
            return new JcaX509CertificateConverter().getCertificate(holder);
        } catch (CertificateException e) {
            throw new IllegalStateException("Unable to convert certificate", e);
        }
    }
}
