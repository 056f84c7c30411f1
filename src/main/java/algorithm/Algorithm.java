package algorithm;

import java.util.Optional;

/**
 * The algorithm identifiers this codec can sign and verify.
 * This is a restricted subset of the JWA registry: RS384, RS512, ES384, ES512
 * and the PS* family are deliberately absent and resolve to empty.
 */
public enum Algorithm {
    HS256(Family.HMAC, HashAlgorithm.SHA256),
    HS384(Family.HMAC, HashAlgorithm.SHA384),
    HS512(Family.HMAC, HashAlgorithm.SHA512),
    RS256(Family.RSA, HashAlgorithm.SHA256),
    ES256(Family.ECDSA, HashAlgorithm.SHA256);

    private final Family family;
    private final HashAlgorithm hash;

    Algorithm(Family family, HashAlgorithm hash) {
        this.family = family;
        this.hash = hash;
    }

    public Family getFamily() {
        return family;
    }

    public HashAlgorithm getHash() {
        return hash;
    }

    /**
     * Looks up the algorithm for a header {@code alg} value.
     *
     * @param identifier The algorithm identifier, e.g. "HS256". Matching is case-sensitive.
     * @return the algorithm, or empty if the identifier is null or not supported.
     */
    public static Optional<Algorithm> resolve(String identifier) {
        if (identifier == null) {
            return Optional.empty();
        }
        for (Algorithm algorithm : values()) {
            if (algorithm.name().equals(identifier)) {
                return Optional.of(algorithm);
            }
        }
        return Optional.empty();
    }
}
