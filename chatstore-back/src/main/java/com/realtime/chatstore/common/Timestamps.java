package com.realtime.chatstore.common;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

public final class Timestamps {

    private Timestamps() {}

    /** DB(timestamptz)와 같은 마이크로초 정밀도로 자른 현재 시각 */
    public static Instant now(Clock clock) {
        return Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
    }
}
