package jwt;

import expiration.Expiration;
import jwt.decoder.JwtDecoder;
import jwt.encoder.JwtEncoder;
import jwt.interfaces.TokenDecoder;
import jwt.interfaces.TokenEncoder;
import key.KeyMaterial;

import java.util.List;
import java.util.Map;

/**
 * Static entry points on the system clock.
 *
 * <pre>
 * String token = Jwt.encode("HS256", Map.of("sub", "alice"), Expiration.seconds(600),
 *         KeyMaterial.secret(secret)).orElseThrow();
 * JwtResult&lt;Map&lt;String, Object&gt;&gt; claims = Jwt.decode(token, KeyMaterial.secret(secret));
 * </pre>
 */
public final class Jwt {
    private static final TokenEncoder ENCODER = new JwtEncoder();
    private static final TokenDecoder DECODER = new JwtDecoder();

    private Jwt() {}

    public static JwtResult<String> encode(String algorithm, Map<String, ?> claims, KeyMaterial key) {
        return ENCODER.encode(algorithm, claims, key);
    }

    public static JwtResult<String> encode(String algorithm, List<? extends Map.Entry<String, ?>> claims,
                                           KeyMaterial key) {
        return ENCODER.encode(algorithm, Claims.of(claims), key);
    }

    public static JwtResult<String> encode(String algorithm, Map<String, ?> claims, Expiration expiration,
                                           KeyMaterial key) {
        return ENCODER.encode(algorithm, claims, expiration, key);
    }

    public static JwtResult<String> encode(String algorithm, List<? extends Map.Entry<String, ?>> claims,
                                           Expiration expiration, KeyMaterial key) {
        return ENCODER.encode(algorithm, Claims.of(claims), expiration, key);
    }

    public static JwtResult<Map<String, Object>> decode(String token, KeyMaterial key) {
        return DECODER.decode(token, key);
    }

    public static JwtResult<Map<String, Object>> decode(String token, KeyMaterial defaultKey,
                                                        Map<String, KeyMaterial> issuerKeyMapping) {
        return DECODER.decode(token, defaultKey, issuerKeyMapping);
    }
}
