package jwt.encoder;

import algorithm.Algorithm;
import codec.Base64Url;
import codec.JsonCodec;
import config.JwtConfig;
import expiration.Expiration;
import expiration.ExpirationPolicy;
import jwt.JwtError;
import jwt.JwtResult;
import jwt.interfaces.TokenEncoder;
import key.KeyMaterial;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import signature.Signer;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds {@code header.claims.signature} tokens for the supported algorithms.
 * Instances hold nothing but a clock and are safe to share between threads.
 */
public class JwtEncoder implements TokenEncoder {
    private static final Logger logger = LoggerFactory.getLogger(JwtEncoder.class);

    private final Clock clock;

    public JwtEncoder() {
        this(Clock.systemUTC());
    }

    /**
     * @param clock source of "now" for {@code exp} computation.
     */
    public JwtEncoder(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public JwtResult<String> encode(String algorithm, Map<String, ?> claims, KeyMaterial key) {
        Objects.requireNonNull(claims, "claims");
        Objects.requireNonNull(key, "key");

        // 1. Base64Url-encoded claims and header
        Optional<String> claimsJson = JsonCodec.encode(claims);
        if (claimsJson.isEmpty()) {
            logger.debug("Claims for {} token are not JSON serializable", algorithm);
            return JwtResult.error(JwtError.INVALID_CLAIMS);
        }
        String base64UrlClaims = Base64Url.encode(claimsJson.get());
        String base64UrlHeader = buildHeader(algorithm);

        // 2. The content that needs to be signed
        String contentToSign = base64UrlHeader + JwtConfig.SEGMENT_SEPARATOR + base64UrlClaims;

        // 3. Sign with the algorithm named in the header
        Optional<Algorithm> resolved = Algorithm.resolve(algorithm);
        if (resolved.isEmpty()) {
            logger.debug("Refusing to encode token with unsupported algorithm {}", algorithm);
            return JwtResult.error(JwtError.ALGORITHM_NOT_SUPPORTED);
        }
        String base64UrlSignature = Signer.sign(resolved.get(), contentToSign, key);

        // 4. Assemble the final token
        return JwtResult.ok(contentToSign + JwtConfig.SEGMENT_SEPARATOR + base64UrlSignature);
    }

    @Override
    public JwtResult<String> encode(String algorithm, Map<String, ?> claims, Expiration expiration, KeyMaterial key) {
        Objects.requireNonNull(claims, "claims");
        Objects.requireNonNull(expiration, "expiration");

        long expiry = ExpirationPolicy.computeExpiry(expiration, clock.instant().getEpochSecond());
        Map<String, Object> claimsWithExpiry = new LinkedHashMap<>(claims);
        claimsWithExpiry.put(JwtConfig.CLAIM_EXPIRATION, expiry);
        return encode(algorithm, claimsWithExpiry, key);
    }

    /**
     * Builds the JWT header, {@code {"alg":...,"typ":"JWT"}} in that order.
     * @return A Base64Url-encoded string of the header JSON.
     */
    private static String buildHeader(String algorithm) {
        Map<String, Object> header = new LinkedHashMap<>();
        header.put(JwtConfig.HEADER_ALGORITHM, algorithm);
        header.put(JwtConfig.HEADER_TYPE, JwtConfig.TOKEN_TYPE);
        String headerJson = JsonCodec.encode(header)
                .orElseThrow(() -> new IllegalStateException("Header is always serializable"));
        return Base64Url.encode(headerJson);
    }
}
