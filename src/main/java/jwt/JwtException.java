package jwt;

/**
 * Thrown by {@link JwtResult#orElseThrow()} for callers that prefer exceptions.
 */
public class JwtException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final JwtError error;

    public JwtException(JwtError error) {
        super(error.getCode());
        this.error = error;
    }

    public JwtError getError() {
        return error;
    }
}
