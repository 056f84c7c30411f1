package codec;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JsonCodecTest {

    @Nested
    @DisplayName("encode")
    class EncodeTests {

        @Test
        @DisplayName("keeps the key order of the map")
        void keepsInsertionOrder() {
            Map<String, Object> header = new LinkedHashMap<>();
            header.put("alg", "HS256");
            header.put("typ", "JWT");

            assertEquals(Optional.of("{\"alg\":\"HS256\",\"typ\":\"JWT\"}"), JsonCodec.encode(header));
        }

        @Test
        @DisplayName("accepts nested maps, lists and scalars")
        void acceptsJsonValues() {
            Map<String, Object> nested = new LinkedHashMap<>();
            nested.put("roles", List.of("admin", "user"));
            nested.put("active", true);
            Map<String, Object> claims = new LinkedHashMap<>();
            claims.put("n", 42L);
            claims.put("ratio", 0.5);
            claims.put("profile", nested);
            claims.put("nothing", null);

            assertTrue(JsonCodec.encode(claims).isPresent());
        }

        @Test
        @DisplayName("rejects values json-simple would write as broken JSON")
        void rejectsNonJsonValues() {
            assertTrue(JsonCodec.encode(Map.of("when", new Object())).isEmpty());
            assertTrue(JsonCodec.encode(Map.of("ratio", Double.NaN)).isEmpty());
            assertTrue(JsonCodec.encode(Map.of("ratio", Double.POSITIVE_INFINITY)).isEmpty());
            assertTrue(JsonCodec.encode(Map.of("list", Arrays.asList("ok", new int[]{1}))).isEmpty());
            assertTrue(JsonCodec.encode(Map.of("inner", Map.of(1, "numeric key"))).isEmpty());
        }
    }

    @Nested
    @DisplayName("decodeObject")
    class DecodeTests {

        @Test
        @DisplayName("integers decode as Long, fractions as Double")
        void numberTypes() {
            Map<String, Object> decoded = JsonCodec.decodeObject("{\"exp\":1700000000,\"ratio\":1.5}").orElseThrow();

            assertEquals(1700000000L, decoded.get("exp"));
            assertEquals(1.5, decoded.get("ratio"));
        }

        @Test
        @DisplayName("non-object documents and malformed text are rejected")
        void rejectsNonObjects() {
            assertTrue(JsonCodec.decodeObject("[1,2]").isEmpty());
            assertTrue(JsonCodec.decodeObject("\"text\"").isEmpty());
            assertTrue(JsonCodec.decodeObject("{\"a\":").isEmpty());
            assertTrue(JsonCodec.decodeObject("not json").isEmpty());
            assertTrue(JsonCodec.decodeObject("").isEmpty());
        }
    }

    @Test
    @DisplayName("base64url is unpadded and rejects characters outside the URL alphabet")
    void base64Url() {
        assertEquals("YQ", Base64Url.encode(new byte[]{'a'}));
        assertArrayEquals(new byte[]{'a'}, Base64Url.decode("YQ").orElseThrow());
        assertTrue(Base64Url.decode("a+b/").isEmpty());
        assertTrue(Base64Url.decode("!!!").isEmpty());
        assertTrue(Base64Url.decode(null).isEmpty());
    }

    @Test
    @DisplayName("base64url decoding accepts only the canonical encoding")
    void base64UrlCanonical() {
        assertTrue(Base64Url.decode("YQ==").isEmpty());
        assertTrue(Base64Url.decode("YQ=").isEmpty());
        // 'R' differs from 'Q' only in the unused low bits
        assertTrue(Base64Url.decode("YR").isEmpty());
    }
}
