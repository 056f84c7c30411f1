package codec;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

/**
 * Unpadded URL-safe Base64, the encoding of every JWT segment.
 */
public final class Base64Url {
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private Base64Url() {}

    public static String encode(byte[] data) {
        return ENCODER.encodeToString(data);
    }

    public static String encode(String text) {
        return encode(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Only the canonical form is accepted: no padding, and no set bits in the unused
     * low bits of the last character. Each byte sequence therefore has exactly one
     * accepted encoding.
     *
     * @param segment unpadded base64url text.
     * @return the decoded bytes, or empty if the text is not canonical base64url.
     */
    public static Optional<byte[]> decode(String segment) {
        if (segment == null) {
            return Optional.empty();
        }
        byte[] decoded;
        try {
            decoded = DECODER.decode(segment);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        if (!ENCODER.encodeToString(decoded).equals(segment)) {
            return Optional.empty();
        }
        return Optional.of(decoded);
    }
}
