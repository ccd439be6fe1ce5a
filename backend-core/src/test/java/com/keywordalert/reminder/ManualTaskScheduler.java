package com.keywordalert.reminder;

import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Delayed;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs scheduled tasks only when the test moves the clock, each at its own due instant.
 */
final class ManualTaskScheduler implements TaskScheduler {

    private final MutableClock clock;
    private final List<ManualFuture> tasks = new ArrayList<>();

    ManualTaskScheduler(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public Clock getClock() {
        return clock;
    }

    @Override
    public synchronized ScheduledFuture<?> schedule(Runnable task, Instant startTime) {
        ManualFuture future = new ManualFuture(task, startTime);
        tasks.add(future);
        return future;
    }

    /**
     * Moves the clock forward by {@code duration}, running every task that falls due on the way.
     */
    void advanceBy(Duration duration) {
        Instant target = clock.instant().plus(duration);
        Optional<ManualFuture> next;
        while ((next = nextDue(target)).isPresent()) {
            ManualFuture future = next.get();
            if (future.at.isAfter(clock.instant())) {
                clock.set(future.at);
            }
            future.run();
        }
        clock.set(target);
    }

    synchronized long pendingCount() {
        return tasks.stream().filter(future -> !future.isDone()).count();
    }

    private synchronized Optional<ManualFuture> nextDue(Instant target) {
        return tasks.stream()
                .filter(future -> !future.isDone() && !future.at.isAfter(target))
                .min(Comparator.comparing((ManualFuture future) -> future.at));
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable task, Trigger trigger) {
        throw new UnsupportedOperationException();
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Instant startTime, Duration period) {
        throw new UnsupportedOperationException();
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Duration period) {
        throw new UnsupportedOperationException();
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Instant startTime, Duration delay) {
        throw new UnsupportedOperationException();
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Duration delay) {
        throw new UnsupportedOperationException();
    }

    private final class ManualFuture implements ScheduledFuture<Object> {

        private final Runnable task;
        private final Instant at;
        private volatile boolean cancelled;
        private volatile boolean done;

        private ManualFuture(Runnable task, Instant at) {
            this.task = task;
            this.at = at;
        }

        private void run() {
            done = true;
            task.run();
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(Duration.between(clock.instant(), at));
        }

        @Override
        public int compareTo(Delayed other) {
            return Long.compare(getDelay(TimeUnit.NANOSECONDS), other.getDelay(TimeUnit.NANOSECONDS));
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            if (done) {
                return false;
            }
            cancelled = true;
            return true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public boolean isDone() {
            return done || cancelled;
        }

        @Override
        public Object get() {
            return null;
        }

        @Override
        public Object get(long timeout, TimeUnit unit) {
            return null;
        }
    }
}
