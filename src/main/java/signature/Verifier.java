package signature;

import algorithm.Algorithm;
import algorithm.Family;
import codec.Base64Url;
import key.KeyMaterial;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.PublicKey;
import java.security.Signature;
import java.security.interfaces.ECPublicKey;
import java.util.Optional;

/**
 * Checks the signature segment of a token. Never throws: anything that prevents
 * verification (unsupported algorithm, wrong key type, bad PEM, undecodable
 * signature) is reported as {@code false}.
 */
public final class Verifier {
    private static final Logger logger = LoggerFactory.getLogger(Verifier.class);

    private Verifier() {}

    /**
     * @param algorithm    the resolved algorithm, or null when the header named an unsupported one.
     * @param signingInput the {@code header.claims} text exactly as it appears in the token.
     * @param signature    the signature segment exactly as it appears in the token.
     * @param key          HMAC secret, or a public/private key (parsed or PEM).
     * @return true only if the signature verifies.
     */
    public static boolean verify(Algorithm algorithm, String signingInput, String signature, KeyMaterial key) {
        if (algorithm == null || signature == null || key == null) {
            return false;
        }
        try {
            switch (algorithm.getFamily()) {
                case HMAC:
                    return verifyHmac(algorithm, signingInput, signature, key);
                case RSA:
                case ECDSA:
                    return verifyAsymmetric(algorithm, signingInput, signature, key);
                default:
                    return false;
            }
        } catch (GeneralSecurityException | IOException | RuntimeException e) {
            logger.debug("{} signature check failed: {}", algorithm, e.getMessage());
            return false;
        }
    }

    /**
     * HMAC signatures are compared in their encoded form, since both sides went
     * through the same base64url step.
     */
    private static boolean verifyHmac(Algorithm algorithm, String signingInput, String signature, KeyMaterial key) {
        Optional<byte[]> secret = key.secret();
        if (secret.isEmpty()) {
            return false;
        }
        byte[] mac = Signer.hmac(algorithm.getHash(), secret.get(), signingInput.getBytes(StandardCharsets.UTF_8));
        String expected = Base64Url.encode(mac);
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.US_ASCII),
                signature.getBytes(StandardCharsets.US_ASCII));
    }

    private static boolean verifyAsymmetric(Algorithm algorithm, String signingInput, String signature,
                                            KeyMaterial key) throws GeneralSecurityException, IOException {
        Optional<PublicKey> publicKey = key.verificationKey();
        Optional<byte[]> rawSignature = Base64Url.decode(signature);
        if (publicKey.isEmpty() || rawSignature.isEmpty()) {
            return false;
        }

        byte[] signatureBytes = rawSignature.get();
        if (algorithm.getFamily() == Family.ECDSA) {
            if (!(publicKey.get() instanceof ECPublicKey ecKey)) {
                return false;
            }
            signatureBytes = EcdsaSignatures.concatToDer(signatureBytes, EcdsaSignatures.componentLength(ecKey));
        }

        Signature verifier = Signature.getInstance(algorithm.getHash().getSignatureName(algorithm.getFamily()));
        verifier.initVerify(publicKey.get());
        verifier.update(signingInput.getBytes(StandardCharsets.UTF_8));
        return verifier.verify(signatureBytes);
    }
}
