package key;

import org.bouncycastle.jcajce.provider.asymmetric.util.EC5Util;
import org.bouncycastle.jce.spec.ECParameterSpec;
import org.bouncycastle.math.ec.ECPoint;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.spec.ECPublicKeySpec;
import java.security.spec.RSAPublicKeySpec;

final class PublicKeys {

    private PublicKeys() {}

    /**
     * Recomputes the public half of a private key.
     * RSA needs the CRT form (which carries the public exponent); for EC the
     * public point is Q = d*G on the key's curve.
     *
     * @return the public key, or null if it cannot be derived from this key type.
     */
    static PublicKey derive(PrivateKey privateKey) {
        try {
            if (privateKey instanceof RSAPrivateCrtKey rsaKey) {
                RSAPublicKeySpec spec = new RSAPublicKeySpec(rsaKey.getModulus(), rsaKey.getPublicExponent());
                return KeyFactory.getInstance("RSA").generatePublic(spec);
            }
            if (privateKey instanceof ECPrivateKey ecKey) {
                ECParameterSpec curve = EC5Util.convertSpec(ecKey.getParams());
                ECPoint q = curve.getG().multiply(ecKey.getS()).normalize();
                java.security.spec.ECPoint w = new java.security.spec.ECPoint(
                        q.getAffineXCoord().toBigInteger(), q.getAffineYCoord().toBigInteger());
                return KeyFactory.getInstance("EC").generatePublic(new ECPublicKeySpec(w, ecKey.getParams()));
            }
            return null;
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException("Failed to derive public key from " + privateKey.getAlgorithm() + " private key", e);
        }
    }
}
