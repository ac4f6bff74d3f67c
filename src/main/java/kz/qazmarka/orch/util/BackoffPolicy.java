package kz.qazmarka.orch.util;

import java.security.SecureRandom;

/**
 * Простая политика задержки между попытками с криптографическим джиттером.
 * При {@code jitterPercent == 0} задержка фиксированная.
 */
final class BackoffPolicy {
    private static final SecureRandom SR = new SecureRandom();
    private final long minMillis;
    private final int jitterPercent;

    BackoffPolicy(long minMillis, int jitterPercent) {
        this.minMillis = Math.max(0L, minMillis);
        this.jitterPercent = Math.max(0, Math.min(100, jitterPercent));
    }

    long nextDelayMillis(long baseMillis) {
        if (jitterPercent == 0 || baseMillis <= 0L) {
            return Math.max(minMillis, baseMillis);
        }
        long jitter = Math.max(1L, (baseMillis * jitterPercent) / 100L);
        long delta = nextLongBetweenSecure(-jitter, jitter + 1);
        long d = baseMillis + delta;
        return (d < minMillis) ? minMillis : d;
    }

    private static long nextLongBetweenSecure(long originInclusive, long boundExclusive) {
        long n = boundExclusive - originInclusive;
        if (n <= 0) return originInclusive;
        long bits;
        long val;
        do {
            bits = SR.nextLong() >>> 1;
            val = bits % n;
        } while (bits - val + (n - 1) < 0L);
        return originInclusive + val;
    }
}
