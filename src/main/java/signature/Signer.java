package signature;

import algorithm.Algorithm;
import algorithm.HashAlgorithm;
import codec.Base64Url;
import key.KeyMaterial;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.Signature;
import java.security.interfaces.ECPrivateKey;
import java.util.Objects;

/**
 * Produces the base64url signature segment of a token.
 */
public final class Signer {

    private Signer() {}

    /**
     * Signs a signing input ({@code header.claims}) with the given algorithm.
     *
     * @param algorithm    a supported algorithm.
     * @param signingInput the exact text covered by the signature.
     * @param key          an HMAC secret for HS*, a private key (parsed or PEM) for RS256/ES256.
     * @return the base64url-encoded signature.
     * @throws IllegalArgumentException if the key cannot be used with this algorithm.
     */
    public static String sign(Algorithm algorithm, String signingInput, KeyMaterial key) {
        Objects.requireNonNull(algorithm, "algorithm");
        Objects.requireNonNull(key, "key");
        byte[] input = signingInput.getBytes(StandardCharsets.UTF_8);

        switch (algorithm.getFamily()) {
            case HMAC: {
                byte[] secret = key.secret().orElseThrow(
                        () -> new IllegalArgumentException(algorithm + " requires a shared secret, got " + key));
                return Base64Url.encode(hmac(algorithm.getHash(), secret, input));
            }
            case RSA: {
                PrivateKey privateKey = requirePrivateKey(algorithm, key);
                return Base64Url.encode(signWithPrivateKey(algorithm, privateKey, input));
            }
            case ECDSA: {
                PrivateKey privateKey = requirePrivateKey(algorithm, key);
                if (!(privateKey instanceof ECPrivateKey ecKey)) {
                    throw new IllegalArgumentException(algorithm + " requires an EC private key, got "
                            + privateKey.getAlgorithm());
                }
                byte[] der = signWithPrivateKey(algorithm, ecKey, input);
                return Base64Url.encode(EcdsaSignatures.derToConcat(der, EcdsaSignatures.componentLength(ecKey)));
            }
            default:
                throw new IllegalStateException("Unhandled algorithm family " + algorithm.getFamily());
        }
    }

    static byte[] hmac(HashAlgorithm hash, byte[] secret, byte[] input) {
        try {
            Mac mac = Mac.getInstance(hash.getMacName());
            mac.init(new SecretKeySpec(secret, hash.getMacName()));
            return mac.doFinal(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Algorithm not supported by current Java environment", e);
        } catch (InvalidKeyException e) {
            throw new IllegalArgumentException("Invalid HMAC secret", e);
        }
    }

    private static PrivateKey requirePrivateKey(Algorithm algorithm, KeyMaterial key) {
        return key.signingKey().orElseThrow(
                () -> new IllegalArgumentException(algorithm + " requires a private key, got " + key));
    }

    private static byte[] signWithPrivateKey(Algorithm algorithm, PrivateKey privateKey, byte[] input) {
        try {
            Signature signature = Signature.getInstance(algorithm.getHash().getSignatureName(algorithm.getFamily()));
            signature.initSign(privateKey);
            signature.update(input);
            return signature.sign();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Algorithm not supported by current Java environment", e);
        } catch (InvalidKeyException e) {
            throw new IllegalArgumentException("Invalid " + algorithm + " private key", e);
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException("Error occurred during signing process", e);
        }
    }
}
