package com.rebenew.tandem.syncserver.support;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

public final class MutableClock extends Clock {

    private Instant instant;

    public MutableClock(long epochMillis) {
        this.instant = Instant.ofEpochMilli(epochMillis);
    }

    @Override
    public ZoneOffset getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    @Override
    public Instant instant() {
        return instant;
    }

    public void advance(long millis) {
        this.instant = this.instant.plusMillis(millis);
    }
}
