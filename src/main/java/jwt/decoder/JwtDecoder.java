package jwt.decoder;

import algorithm.Algorithm;
import codec.Base64Url;
import codec.JsonCodec;
import config.JwtConfig;
import expiration.ExpirationPolicy;
import jwt.JwtError;
import jwt.JwtResult;
import jwt.interfaces.TokenDecoder;
import key.KeyMaterial;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import signature.Verifier;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Verifies compact tokens.
 * <p>
 * Checks run in a fixed order: token structure, then signature, then expiry.
 * A token that is both forged and expired is therefore reported as
 * {@link JwtError#INVALID_SIGNATURE}.
 */
public class JwtDecoder implements TokenDecoder {
    private static final Logger logger = LoggerFactory.getLogger(JwtDecoder.class);
    private static final Pattern SEPARATOR = Pattern.compile(Pattern.quote(JwtConfig.SEGMENT_SEPARATOR));

    private final Clock clock;

    public JwtDecoder() {
        this(Clock.systemUTC());
    }

    /**
     * @param clock source of "now" for the expiry check.
     */
    public JwtDecoder(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public JwtResult<Map<String, Object>> decode(String token, KeyMaterial key) {
        return decode(token, key, Collections.emptyMap());
    }

    @Override
    public JwtResult<Map<String, Object>> decode(String token, KeyMaterial defaultKey,
                                                 Map<String, KeyMaterial> issuerKeyMapping) {
        try {
            return decodeAndVerify(token, defaultKey, issuerKeyMapping);
        } catch (RuntimeException e) {
            logger.warn("Unexpected failure while decoding token, rejecting it", e);
            return reject(JwtError.INVALID_TOKEN, "unexpected failure");
        }
    }

    private JwtResult<Map<String, Object>> decodeAndVerify(String token, KeyMaterial defaultKey,
                                                           Map<String, KeyMaterial> issuerKeyMapping) {
        if (token == null) {
            return reject(JwtError.INVALID_TOKEN, "token is null");
        }

        // 1. Structure: header.claims.signature, empty segments included in the count
        String[] segments = SEPARATOR.split(token, -1);
        if (segments.length != JwtConfig.SEGMENT_COUNT) {
            return reject(JwtError.INVALID_TOKEN, segments.length + " segments");
        }
        Optional<Map<String, Object>> header = decodeSegment(segments[0]);
        Optional<Map<String, Object>> claims = decodeSegment(segments[1]);
        if (header.isEmpty() || claims.isEmpty()) {
            return reject(JwtError.INVALID_TOKEN, "undecodable header or claims");
        }
        if (!header.get().containsKey(JwtConfig.HEADER_ALGORITHM)) {
            return reject(JwtError.INVALID_TOKEN, "header has no alg");
        }

        // 2. Signature, with the key chosen by issuer
        Object alg = header.get().get(JwtConfig.HEADER_ALGORITHM);
        Algorithm algorithm = alg instanceof String ? Algorithm.resolve((String) alg).orElse(null) : null;
        KeyMaterial key = selectKey(claims.get(), defaultKey, issuerKeyMapping);
        String signingInput = segments[0] + JwtConfig.SEGMENT_SEPARATOR + segments[1];
        if (!Verifier.verify(algorithm, signingInput, segments[2], key)) {
            return reject(JwtError.INVALID_SIGNATURE, "signature does not verify with alg " + alg);
        }

        // 3. Expiry
        if (ExpirationPolicy.isExpired(claims.get(), clock.instant().getEpochSecond())) {
            return reject(JwtError.EXPIRED, "exp " + claims.get().get(JwtConfig.CLAIM_EXPIRATION));
        }
        return JwtResult.ok(claims.get());
    }

    private static Optional<Map<String, Object>> decodeSegment(String segment) {
        return Base64Url.decode(segment)
                .map(bytes -> new String(bytes, StandardCharsets.UTF_8))
                .flatMap(JsonCodec::decodeObject);
    }

    /**
     * The issuer's own key when {@code iss} is present and mapped, else the default key.
     */
    static KeyMaterial selectKey(Map<String, Object> claims, KeyMaterial defaultKey,
                                 Map<String, KeyMaterial> issuerKeyMapping) {
        Object issuer = claims.get(JwtConfig.CLAIM_ISSUER);
        if (issuer instanceof String && issuerKeyMapping != null) {
            KeyMaterial issuerKey = issuerKeyMapping.get(issuer);
            if (issuerKey != null) {
                return issuerKey;
            }
        }
        return defaultKey;
    }

    private static JwtResult<Map<String, Object>> reject(JwtError error, String reason) {
        logger.debug("Rejected token ({}): {}", error.getCode(), reason);
        return JwtResult.error(error);
    }
}
