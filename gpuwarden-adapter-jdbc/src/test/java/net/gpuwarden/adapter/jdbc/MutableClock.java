package net.gpuwarden.adapter.jdbc;

import net.gpuwarden.core.spi.Clock;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/** 테스트용 시계. 밀리초 단위로 잘라 DB 왕복 후에도 값이 같다. */
public final class MutableClock implements Clock {
    private final AtomicReference<Instant> now;

    public MutableClock(Instant start) { this.now = new AtomicReference<>(start); }

    @Override
    public Instant now() { return now.get(); }

    public Instant advance(Duration d) { return now.updateAndGet(i -> i.plus(d)); }

    public void set(Instant i) { now.set(i); }
}
