package com.ryuqq.gateway.application.response;

final class Timings {

    private Timings() {
    }

    static void requireValid(double time) {
        if (Double.isNaN(time) || time < 0) {
            throw new IllegalArgumentException("time must be non-negative (current: " + time + ")");
        }
    }
}
