package algorithm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class AlgorithmTest {

    @Test
    @DisplayName("supported identifiers map to their family and hash")
    void resolvesSupportedIdentifiers() {
        assertEquals(Family.HMAC, Algorithm.resolve("HS256").orElseThrow().getFamily());
        assertEquals(HashAlgorithm.SHA256, Algorithm.resolve("HS256").orElseThrow().getHash());
        assertEquals(HashAlgorithm.SHA384, Algorithm.resolve("HS384").orElseThrow().getHash());
        assertEquals(HashAlgorithm.SHA512, Algorithm.resolve("HS512").orElseThrow().getHash());

        Algorithm rs256 = Algorithm.resolve("RS256").orElseThrow();
        assertEquals(Family.RSA, rs256.getFamily());
        assertEquals(HashAlgorithm.SHA256, rs256.getHash());

        Algorithm es256 = Algorithm.resolve("ES256").orElseThrow();
        assertEquals(Family.ECDSA, es256.getFamily());
        assertEquals(HashAlgorithm.SHA256, es256.getHash());
    }

    @ParameterizedTest
    @ValueSource(strings = {"RS384", "RS512", "ES384", "ES512", "PS256", "PS384", "PS512", "none", "hs256", "", " HS256"})
    @DisplayName("identifiers outside the supported set are unsupported")
    void rejectsOtherIdentifiers(String identifier) {
        assertTrue(Algorithm.resolve(identifier).isEmpty());
    }

    @Test
    void nullIsUnsupported() {
        assertTrue(Algorithm.resolve(null).isEmpty());
    }

    @Test
    void jcaNames() {
        assertEquals("HmacSHA384", HashAlgorithm.SHA384.getMacName());
        assertEquals("SHA256withRSA", HashAlgorithm.SHA256.getSignatureName(Family.RSA));
        assertEquals("SHA256withECDSA", HashAlgorithm.SHA256.getSignatureName(Family.ECDSA));
        assertThrows(IllegalArgumentException.class, () -> HashAlgorithm.SHA256.getSignatureName(Family.HMAC));
    }
}
