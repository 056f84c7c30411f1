package jwt.interfaces;

import jwt.JwtResult;
import key.KeyMaterial;

import java.util.Map;

/**
 * Verifies compact tokens and returns their claims.
 * Implementations never throw for bad input; every failure is an error result.
 */
public interface TokenDecoder {

    JwtResult<Map<String, Object>> decode(String token, KeyMaterial key);

    /**
     * @param defaultKey       key used when the token has no {@code iss} or its issuer is not mapped.
     * @param issuerKeyMapping keys by {@code iss} claim value.
     */
    JwtResult<Map<String, Object>> decode(String token, KeyMaterial defaultKey,
                                          Map<String, KeyMaterial> issuerKeyMapping);
}
