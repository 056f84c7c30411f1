package algorithm;

/**
 * Signature families supported by the codec.
 */
public enum Family {
    HMAC,
    RSA,
    ECDSA
}
