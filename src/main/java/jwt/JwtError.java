package jwt;

/**
 * Why an encode or decode call did not produce a result.
 */
public enum JwtError {
    /** Encode was asked for an algorithm outside the supported set. */
    ALGORITHM_NOT_SUPPORTED("algorithm_not_supported"),
    /** Encode was given claims that cannot be written as JSON. */
    INVALID_CLAIMS("invalid_claims"),
    /** Wrong segment count, undecodable base64url or JSON, or a header without {@code alg}. */
    INVALID_TOKEN("invalid_token"),
    /** The signature does not verify, including tokens naming an unsupported algorithm. */
    INVALID_SIGNATURE("invalid_signature"),
    /** The signature is valid but {@code exp} is not in the future. */
    EXPIRED("expired");

    private final String code;

    JwtError(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
