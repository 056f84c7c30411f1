package jwt;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds claim sets from association lists such as
 * {@code Claims.of(Map.entry("iss", "idp"), Map.entry("sub", "alice"))}.
 * The result keeps insertion order; a repeated name keeps its last value.
 */
public final class Claims {

    private Claims() {}

    public static Map<String, Object> of(List<? extends Map.Entry<String, ?>> pairs) {
        Map<String, Object> claims = new LinkedHashMap<>();
        for (Map.Entry<String, ?> pair : pairs) {
            claims.put(pair.getKey(), pair.getValue());
        }
        return claims;
    }

    @SafeVarargs
    public static Map<String, Object> of(Map.Entry<String, ?>... pairs) {
        return of(List.of(pairs));
    }
}
