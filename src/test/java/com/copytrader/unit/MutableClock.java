package com.copytrader.unit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/** Clock whose time only moves when a test advances it. */
public class MutableClock extends Clock {

    private Instant now;
    private final ZoneId zone;

    public MutableClock(Instant start) {
        this(start, ZoneOffset.UTC);
    }

    private MutableClock(Instant start, ZoneId zone) {
        this.now = start;
        this.zone = zone;
    }

    public void advance(Duration duration) {
        now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new DelegatingZoneClock(this, zone);
    }

    @Override
    public Instant instant() {
        return now;
    }

    /** Shares the parent's instant so advancing the parent moves zoned views too. */
    private static final class DelegatingZoneClock extends Clock {

        private final MutableClock parent;
        private final ZoneId zone;

        private DelegatingZoneClock(MutableClock parent, ZoneId zone) {
            this.parent = parent;
            this.zone = zone;
        }

        @Override
        public ZoneId getZone() {
            return zone;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return new DelegatingZoneClock(parent, zone);
        }

        @Override
        public Instant instant() {
            return parent.instant();
        }
    }
}
