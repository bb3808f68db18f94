package com.rpgtools.prereq.common;

import java.time.Instant;

/** Wall clock, replaceable in tests. */
public interface ITimeService {
    long currentTimeMillis();

    default Instant now() {
        return Instant.ofEpochMilli(currentTimeMillis());
    }

    ITimeService real = System::currentTimeMillis;

    static ITimeService fixed(long fixedTimeMillis) {
        return () -> fixedTimeMillis;
    }
}
