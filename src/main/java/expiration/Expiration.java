package expiration;

/**
 * When a token should expire, relative to the moment it is encoded.
 * <ul>
 *   <li>{@link #seconds(long)}: a fixed lifetime.</li>
 *   <li>{@link #hourly(long)}: seconds after the beginning of the current hour.</li>
 *   <li>{@link #daily(long)}: seconds after the beginning of the current (UTC) day.</li>
 * </ul>
 */
public final class Expiration {

    public enum Kind {
        SECONDS,
        HOURLY,
        DAILY
    }

    private final Kind kind;
    private final long seconds;

    private Expiration(Kind kind, long seconds) {
        if (seconds < 0) {
            throw new IllegalArgumentException("Expiration seconds must not be negative: " + seconds);
        }
        this.kind = kind;
        this.seconds = seconds;
    }

    public static Expiration seconds(long lifetimeSeconds) {
        return new Expiration(Kind.SECONDS, lifetimeSeconds);
    }

    public static Expiration hourly(long offsetSeconds) {
        return new Expiration(Kind.HOURLY, offsetSeconds);
    }

    public static Expiration daily(long offsetSeconds) {
        return new Expiration(Kind.DAILY, offsetSeconds);
    }

    public Kind getKind() {
        return kind;
    }

    public long getSeconds() {
        return seconds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Expiration that = (Expiration) o;
        return kind == that.kind && seconds == that.seconds;
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + Long.hashCode(seconds);
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + "(" + seconds + ")";
    }
}
