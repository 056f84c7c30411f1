package algorithm;

/**
 * Digests used by the supported algorithms, with the JCA names needed to build
 * the matching {@code Mac} and {@code Signature} instances.
 */
public enum HashAlgorithm {
    SHA256("HmacSHA256", "SHA256withRSA", "SHA256withECDSA"),
    SHA384("HmacSHA384", "SHA384withRSA", "SHA384withECDSA"),
    SHA512("HmacSHA512", "SHA512withRSA", "SHA512withECDSA");

    private final String macName;
    private final String rsaSignatureName;
    private final String ecdsaSignatureName;

    HashAlgorithm(String macName, String rsaSignatureName, String ecdsaSignatureName) {
        this.macName = macName;
        this.rsaSignatureName = rsaSignatureName;
        this.ecdsaSignatureName = ecdsaSignatureName;
    }

    public String getMacName() {
        return macName;
    }

    /**
     * @param family RSA or ECDSA
     * @return the JCA signature name for this digest in the given family
     */
    public String getSignatureName(Family family) {
        switch (family) {
            case RSA:
                return rsaSignatureName;
            case ECDSA:
                return ecdsaSignatureName;
            default:
                throw new IllegalArgumentException("No signature algorithm for family " + family);
        }
    }
}
