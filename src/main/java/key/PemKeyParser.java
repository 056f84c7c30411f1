package key;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;

/**
 * Turns the first PEM block of a blob into JCA keys with BouncyCastle.
 */
public final class PemKeyParser {

    private PemKeyParser() {}

    /**
     * Parses PEM key material.
     * <ul>
     *   <li>{@code PUBLIC KEY} and {@code CERTIFICATE}: public key only.</li>
     *   <li>{@code RSA PRIVATE KEY} and {@code EC PRIVATE KEY}: the pair stored in the block.</li>
     *   <li>{@code PRIVATE KEY} (PKCS#8): the private key plus its derived public key.</li>
     * </ul>
     *
     * @param pem PEM text as bytes.
     * @return a key pair; either half may be null.
     * @throws IllegalArgumentException if the blob holds no supported, well-formed key.
     */
    public static KeyPair parse(byte[] pem) {
        String text = new String(pem, StandardCharsets.UTF_8);
        try (PEMParser parser = new PEMParser(new StringReader(text))) {
            Object object = parser.readObject();
            if (object == null) {
                throw new IllegalArgumentException("No PEM object found in key material");
            }
            JcaPEMKeyConverter converter = new JcaPEMKeyConverter();

            if (object instanceof PEMKeyPair) {
                return converter.getKeyPair((PEMKeyPair) object);
            }
            if (object instanceof PrivateKeyInfo) {
                PrivateKey privateKey = converter.getPrivateKey((PrivateKeyInfo) object);
                return new KeyPair(PublicKeys.derive(privateKey), privateKey);
            }
            if (object instanceof SubjectPublicKeyInfo) {
                PublicKey publicKey = converter.getPublicKey((SubjectPublicKeyInfo) object);
                return new KeyPair(publicKey, null);
            }
            if (object instanceof X509CertificateHolder) {
                SubjectPublicKeyInfo info = ((X509CertificateHolder) object).getSubjectPublicKeyInfo();
                return new KeyPair(converter.getPublicKey(info), null);
            }
            throw new IllegalArgumentException("Unsupported PEM object: " + object.getClass().getSimpleName());
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            // BouncyCastle reports corrupt ASN.1 content with runtime exceptions
            throw new IllegalArgumentException("Malformed PEM key material", e);
        }
    }
}
