package jwt.encoder;

import codec.Base64Url;
import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.interfaces.DecodedJWT;
import expiration.Expiration;
import jwt.JwtError;
import jwt.JwtResult;
import key.KeyMaterial;
import key.TestKeys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.ECPublicKey;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JwtEncoderTest {

    private static final long NOW = 1_700_000_000L;
    private static final String SECRET = "encoder-test-secret-at-least-32-bytes-long";

    private JwtEncoder encoder;

    @BeforeEach
    void setUp() {
        encoder = new JwtEncoder(Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC));
    }

    private static String segment(String token, int index) {
        return new String(Base64Url.decode(token.split("\\.")[index]).orElseThrow(), StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("token layout")
    class LayoutTests {

        @Test
        @DisplayName("header is {alg, typ:JWT} and the token has three segments")
        void headerAndSegments() {
            String token = encoder.encode("HS256", Map.of("sub", "alice"), KeyMaterial.secret(SECRET)).orElseThrow();

            assertEquals(3, token.split("\\.", -1).length);
            assertTrue(token.startsWith("eyJhbGciOiJIUzI1NiIsInR5cCI6IkpXVCJ9."));
            assertEquals("{\"sub\":\"alice\"}", segment(token, 1));
            assertFalse(token.contains("="));
        }

        @Test
        @DisplayName("header names the requested algorithm")
        void headerAlgorithm() {
            String token = encoder.encode("ES256", Map.of(), KeyMaterial.of(TestKeys.EC.getPrivate())).orElseThrow();

            assertEquals("{\"alg\":\"ES256\",\"typ\":\"JWT\"}", segment(token, 0));
            assertEquals("{}", segment(token, 1));
        }
    }

    @Nested
    @DisplayName("errors")
    class ErrorTests {

        @Test
        @DisplayName("algorithms outside the supported set are reported, not encoded")
        void unsupportedAlgorithm() {
            KeyMaterial key = KeyMaterial.of(TestKeys.RSA.getPrivate());

            assertEquals(JwtResult.error(JwtError.ALGORITHM_NOT_SUPPORTED), encoder.encode("PS256", Map.of(), key));
            assertEquals(JwtResult.error(JwtError.ALGORITHM_NOT_SUPPORTED), encoder.encode("RS512", Map.of(), key));
            assertEquals(JwtResult.error(JwtError.ALGORITHM_NOT_SUPPORTED), encoder.encode("none", Map.of(), key));
            assertEquals(JwtResult.error(JwtError.ALGORITHM_NOT_SUPPORTED), encoder.encode(null, Map.of(), key));
        }

        @Test
        @DisplayName("claims that are not JSON serializable are reported")
        void invalidClaims() {
            Map<String, Object> claims = Map.of("session", new Object());

            assertEquals(JwtResult.error(JwtError.INVALID_CLAIMS),
                    encoder.encode("HS256", claims, KeyMaterial.secret(SECRET)));
        }

        @Test
        @DisplayName("a key that cannot sign is a caller error")
        void wrongKey() {
            assertThrows(IllegalArgumentException.class,
                    () -> encoder.encode("RS256", Map.of(), KeyMaterial.of(TestKeys.RSA.getPublic())));
        }
    }

    @Nested
    @DisplayName("expiration")
    class ExpirationTests {

        @Test
        @DisplayName("exp is added to a copy of the claims")
        void addsExp() {
            Map<String, Object> claims = new HashMap<>();
            claims.put("sub", "alice");

            String token = encoder.encode("HS256", claims, Expiration.seconds(600), KeyMaterial.secret(SECRET))
                    .orElseThrow();

            assertEquals("{\"sub\":\"alice\",\"exp\":" + (NOW + 600) + "}", segment(token, 1));
            assertFalse(claims.containsKey("exp"));
        }

        @Test
        @DisplayName("an existing exp is replaced")
        void replacesExp() {
            Map<String, Object> claims = new LinkedHashMap<>();
            claims.put("exp", 1L);
            claims.put("sub", "alice");

            String token = encoder.encode("HS256", claims, Expiration.hourly(1800), KeyMaterial.secret(SECRET))
                    .orElseThrow();

            assertEquals("{\"exp\":1700001000,\"sub\":\"alice\"}", segment(token, 1));
            assertEquals(1L, claims.get("exp"));
        }
    }

    @Nested
    @DisplayName("interoperability with java-jwt")
    class InteropTests {

        @Test
        @DisplayName("HMAC tokens verify with java-jwt")
        void hmac() {
            byte[] secret = SECRET.getBytes(StandardCharsets.UTF_8);
            Map<String, Object> claims = Map.of("iss", "idp", "sub", "alice");

            for (String alg : new String[]{"HS256", "HS384", "HS512"}) {
                String token = encoder.encode(alg, claims, KeyMaterial.secret(secret)).orElseThrow();
                Algorithm algorithm = alg.equals("HS256") ? Algorithm.HMAC256(secret)
                        : alg.equals("HS384") ? Algorithm.HMAC384(secret) : Algorithm.HMAC512(secret);

                DecodedJWT decoded = JWT.require(algorithm).build().verify(token);
                assertEquals("idp", decoded.getIssuer());
                assertEquals("alice", decoded.getSubject());
            }
        }

        @Test
        @DisplayName("RS256 tokens verify with java-jwt")
        void rsa() {
            String token = new JwtEncoder().encode("RS256", Map.of("sub", "alice"), Expiration.seconds(300),
                    KeyMaterial.pem(TestKeys.pkcs8Pem(TestKeys.RSA))).orElseThrow();

            Algorithm algorithm = Algorithm.RSA256((RSAPublicKey) TestKeys.RSA.getPublic(), (RSAPrivateKey) null);
            DecodedJWT decoded = JWT.require(algorithm).build().verify(token);
            assertEquals("alice", decoded.getSubject());
            assertNotNull(decoded.getExpiresAt());
        }

        @Test
        @DisplayName("ES256 tokens verify with java-jwt")
        void ecdsa() {
            String token = encoder.encode("ES256", Map.of("sub", "alice", "n", 5L),
                    KeyMaterial.of(TestKeys.EC.getPrivate())).orElseThrow();

            Algorithm algorithm = Algorithm.ECDSA256((ECPublicKey) TestKeys.EC.getPublic(), (ECPrivateKey) null);
            DecodedJWT decoded = JWT.require(algorithm).build().verify(token);
            assertEquals(5, decoded.getClaim("n").asInt());
        }
    }
}
