package expiration;

import config.JwtConfig;

import java.util.Map;

public final class ExpirationPolicy {

    private ExpirationPolicy() {}

    /**
     * Computes the absolute {@code exp} value for an expiration.
     *
     * @param expiration       relative expiration.
     * @param nowEpochSeconds  current time in seconds since the epoch.
     * @return expiry in seconds since the epoch.
     * @throws IllegalArgumentException if the expiry does not fit in a {@code long}.
     */
    public static long computeExpiry(Expiration expiration, long nowEpochSeconds) {
        long base;
        switch (expiration.getKind()) {
            case SECONDS:
                base = nowEpochSeconds;
                break;
            case HOURLY:
                base = startOf(nowEpochSeconds, JwtConfig.HOUR_SECONDS);
                break;
            case DAILY:
                base = startOf(nowEpochSeconds, JwtConfig.DAY_SECONDS);
                break;
            default:
                throw new IllegalStateException("Unhandled expiration kind " + expiration.getKind());
        }
        try {
            return Math.addExact(base, expiration.getSeconds());
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Expiration " + expiration + " overflows from " + nowEpochSeconds, e);
        }
    }

    /**
     * A claim set without {@code exp} never expires. Otherwise the token is live
     * only while {@code exp} is strictly after {@code now}, so {@code exp == now} is
     * already expired. A non-numeric {@code exp} counts as expired.
     */
    public static boolean isExpired(Map<String, ?> claims, long nowEpochSeconds) {
        if (!claims.containsKey(JwtConfig.CLAIM_EXPIRATION)) {
            return false;
        }
        Object exp = claims.get(JwtConfig.CLAIM_EXPIRATION);
        if (exp instanceof Long || exp instanceof Integer || exp instanceof Short || exp instanceof Byte) {
            return ((Number) exp).longValue() <= nowEpochSeconds;
        }
        if (exp instanceof Number) {
            return !(((Number) exp).doubleValue() > nowEpochSeconds);
        }
        return true;
    }

    private static long startOf(long nowEpochSeconds, long periodSeconds) {
        return nowEpochSeconds - Math.floorMod(nowEpochSeconds, periodSeconds);
    }
}
