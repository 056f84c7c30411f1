package config;

/**
 * Centralized token format constants.
 */
public final class JwtConfig {
    private JwtConfig() {}

    // Header
    public static final String HEADER_ALGORITHM = "alg";
    public static final String HEADER_TYPE = "typ";
    public static final String TOKEN_TYPE = "JWT";

    // Registered claims the codec looks at
    public static final String CLAIM_ISSUER = "iss";
    public static final String CLAIM_EXPIRATION = "exp";

    // Compact serialization: header.claims.signature
    public static final String SEGMENT_SEPARATOR = ".";
    public static final int SEGMENT_COUNT = 3;

    // Expiration periods (seconds)
    public static final long HOUR_SECONDS = 3600;
    public static final long DAY_SECONDS = HOUR_SECONDS * 24;
}
