package com.ryuqq.gateway.adapter.dispatcher;

/**
 * 단조 시계 기반 경과 시간 측정기.
 *
 * <p>{@link System#nanoTime()}을 사용하므로 벽시계 조정의 영향을 받지 않습니다.</p>
 */
final class Stopwatch {

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private final long startNanos;

    private Stopwatch(long startNanos) {
        this.startNanos = startNanos;
    }

    static Stopwatch start() {
        return new Stopwatch(System.nanoTime());
    }

    long elapsedNanos() {
        return Math.max(0L, System.nanoTime() - startNanos);
    }

    double elapsedSeconds() {
        return elapsedNanos() / NANOS_PER_SECOND;
    }
}
