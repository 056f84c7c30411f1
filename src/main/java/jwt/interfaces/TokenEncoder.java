package jwt.interfaces;

import expiration.Expiration;
import jwt.JwtResult;
import key.KeyMaterial;

import java.util.Map;

/**
 * Produces signed compact tokens.
 */
public interface TokenEncoder {

    /**
     * Signs a claim set.
     *
     * @param algorithm The header {@code alg}, one of HS256, HS384, HS512, RS256, ES256.
     * @param claims    The token payload. It is not modified.
     * @param key       HMAC secret or private key.
     * @return the token, or ALGORITHM_NOT_SUPPORTED / INVALID_CLAIMS.
     */
    JwtResult<String> encode(String algorithm, Map<String, ?> claims, KeyMaterial key);

    /**
     * Signs a copy of the claim set with {@code exp} set from {@code expiration},
     * replacing any {@code exp} the claims already have.
     */
    JwtResult<String> encode(String algorithm, Map<String, ?> claims, Expiration expiration, KeyMaterial key);
}
