package jwt;

import java.util.Objects;

/**
 * Outcome of an encode or decode call: either a value or a {@link JwtError}.
 *
 * @param <T> the token string for encode, the claims map for decode
 */
public final class JwtResult<T> {
    private final T value;
    private final JwtError error;

    private JwtResult(T value, JwtError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> JwtResult<T> ok(T value) {
        return new JwtResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> JwtResult<T> error(JwtError error) {
        return new JwtResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isOk() {
        return error == null;
    }

    /**
     * @throws IllegalStateException if this result is an error.
     */
    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("No value present, error: " + error.getCode());
        }
        return value;
    }

    /**
     * @return the error, or null for a successful result.
     */
    public JwtError getError() {
        return error;
    }

    public T orElseThrow() {
        if (error != null) {
            throw new JwtException(error);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JwtResult<?> that = (JwtResult<?>) o;
        return Objects.equals(value, that.value) && error == that.error;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        return error == null ? "ok(" + value + ")" : "error(" + error.getCode() + ")";
    }
}
