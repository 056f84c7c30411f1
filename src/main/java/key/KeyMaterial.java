package key;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.Objects;
import java.util.Optional;

/**
 * Key supplied by the caller for a single sign or verify call.
 * <p>
 * Three shapes are accepted: a shared secret for HMAC, PEM text for RSA/ECDSA,
 * and already-parsed JCA keys. Nothing is cached; PEM is parsed again on every
 * call so changed key material is always picked up.
 */
public abstract class KeyMaterial {

    private KeyMaterial() {}

    public static KeyMaterial secret(byte[] secret) {
        return new SharedSecret(secret);
    }

    public static KeyMaterial secret(String secret) {
        return secret(secret.getBytes(StandardCharsets.UTF_8));
    }

    public static KeyMaterial pem(byte[] pem) {
        return new Pem(pem);
    }

    public static KeyMaterial pem(String pem) {
        return pem(pem.getBytes(StandardCharsets.UTF_8));
    }

    public static KeyMaterial of(Key key) {
        Objects.requireNonNull(key, "key");
        if (key instanceof PrivateKey) {
            return new Parsed((PrivateKey) key, null, null);
        }
        if (key instanceof PublicKey) {
            return new Parsed(null, (PublicKey) key, null);
        }
        if (key instanceof SecretKey) {
            return new Parsed(null, null, (SecretKey) key);
        }
        throw new IllegalArgumentException("Unsupported key type: " + key.getClass().getName());
    }

    public static KeyMaterial of(KeyPair keyPair) {
        Objects.requireNonNull(keyPair, "keyPair");
        if (keyPair.getPrivate() == null && keyPair.getPublic() == null) {
            throw new IllegalArgumentException("Key pair holds neither a private nor a public key");
        }
        return new Parsed(keyPair.getPrivate(), keyPair.getPublic(), null);
    }

    /**
     * @return the bytes to use as an HMAC secret, or empty if this key has none.
     */
    public abstract Optional<byte[]> secret();

    /**
     * @return the private key used to sign.
     * @throws IllegalArgumentException if PEM key material cannot be parsed.
     */
    public abstract Optional<PrivateKey> signingKey();

    /**
     * @return the public key used to verify, derived from a private key when only that is known.
     * @throws IllegalArgumentException if PEM key material cannot be parsed.
     */
    public abstract Optional<PublicKey> verificationKey();

    static final class SharedSecret extends KeyMaterial {
        private final byte[] secret;

        SharedSecret(byte[] secret) {
            this.secret = Objects.requireNonNull(secret, "secret").clone();
        }

        @Override
        public Optional<byte[]> secret() {
            return Optional.of(secret.clone());
        }

        @Override
        public Optional<PrivateKey> signingKey() {
            return Optional.empty();
        }

        @Override
        public Optional<PublicKey> verificationKey() {
            return Optional.empty();
        }

        @Override
        public String toString() {
            return "SharedSecret[" + secret.length + " bytes]";
        }
    }

    static final class Pem extends KeyMaterial {
        private final byte[] pem;

        Pem(byte[] pem) {
            this.pem = Objects.requireNonNull(pem, "pem").clone();
        }

        /**
         * PEM bytes given for an HMAC algorithm are the secret itself.
         */
        @Override
        public Optional<byte[]> secret() {
            return Optional.of(pem.clone());
        }

        @Override
        public Optional<PrivateKey> signingKey() {
            return Optional.ofNullable(PemKeyParser.parse(pem).getPrivate());
        }

        @Override
        public Optional<PublicKey> verificationKey() {
            return Optional.ofNullable(PemKeyParser.parse(pem).getPublic());
        }

        @Override
        public String toString() {
            return "Pem[" + pem.length + " bytes]";
        }
    }

    static final class Parsed extends KeyMaterial {
        private final PrivateKey privateKey;
        private final PublicKey publicKey;
        private final SecretKey secretKey;

        Parsed(PrivateKey privateKey, PublicKey publicKey, SecretKey secretKey) {
            this.privateKey = privateKey;
            this.publicKey = publicKey;
            this.secretKey = secretKey;
        }

        @Override
        public Optional<byte[]> secret() {
            if (secretKey == null || secretKey.getEncoded() == null) {
                return Optional.empty();
            }
            return Optional.of(secretKey.getEncoded());
        }

        @Override
        public Optional<PrivateKey> signingKey() {
            return Optional.ofNullable(privateKey);
        }

        @Override
        public Optional<PublicKey> verificationKey() {
            if (publicKey != null) {
                return Optional.of(publicKey);
            }
            if (privateKey != null) {
                return Optional.ofNullable(PublicKeys.derive(privateKey));
            }
            return Optional.empty();
        }

        @Override
        public String toString() {
            Key key = privateKey != null ? privateKey : publicKey != null ? publicKey : secretKey;
            return "Parsed[" + key.getAlgorithm() + "]";
        }
    }
}
