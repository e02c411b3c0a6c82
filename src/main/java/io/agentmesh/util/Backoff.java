package io.agentmesh.util;

/**
 * Capped exponential backoff: {@code base * 2^(attempt-1)}, never above {@code max}.
 */
public final class Backoff {
    private Backoff() {
    }

    public static long delayMs(int attempt, long baseMs, long maxMs) {
        if (attempt <= 1) {
            return Math.min(Math.max(0L, baseMs), maxMs);
        }
        int shift = Math.min(30, attempt - 1);
        long factor = 1L << shift;
        long delay = baseMs > maxMs / factor ? maxMs : baseMs * factor;
        return Math.max(0L, Math.min(delay, maxMs));
    }
}
