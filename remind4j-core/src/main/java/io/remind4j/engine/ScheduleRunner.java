package io.remind4j.engine;

import io.remind4j.core.PassSummary;
import io.remind4j.core.Schedule;
import io.remind4j.core.ScheduleIntegrityException;
import io.remind4j.core.ScheduleOutcome;
import io.remind4j.core.ScheduleStoreException;
import io.remind4j.core.ScheduleUpdate;
import io.remind4j.delivery.DeliveryClient;
import io.remind4j.delivery.DeliveryOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs passes: claim the next due schedule, deliver it, write its new state, repeat.
 *
 * <p>Two modes share {@link #runOnce()}:
 * <ul>
 *   <li>{@link #runLoop(Duration)}: blocks the caller, one pass every interval until {@link #stop()}</li>
 *   <li>{@link #start()}: the same loop on a dedicated daemon thread</li>
 * </ul>
 *
 * <p>Only one loop may run per runner. Two runners (or processes) looping over the same store is
 * not a supported deployment: claims keep them from delivering the same occurrence while a lock is
 * live, but an expired lock can be reclaimed by the other side.
 */
public class ScheduleRunner {
    private static final Logger log = LoggerFactory.getLogger(ScheduleRunner.class);

    private static final int MAX_SYSTEM_ERRORS = 30;

    private final DueScheduleSelector selector;
    private final DeliveryClient deliveryClient;
    private final ScheduleStateUpdater stateUpdater;
    private final Clock clock;
    private final Duration processEvery;
    private final Duration shutdownTimeout;

    private final AtomicBoolean looping = new AtomicBoolean(false);
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private volatile boolean stopRequested;
    private volatile CountDownLatch stopSignal = new CountDownLatch(1);
    private Thread loopThread;
    private int systemErrorCount = 0;

    public ScheduleRunner(
            DueScheduleSelector selector,
            DeliveryClient deliveryClient,
            ScheduleStateUpdater stateUpdater,
            Clock clock,
            Duration processEvery,
            Duration shutdownTimeout
    ) {
        this.selector = Objects.requireNonNull(selector, "selector must not be null");
        this.deliveryClient = Objects.requireNonNull(deliveryClient, "deliveryClient must not be null");
        this.stateUpdater = Objects.requireNonNull(stateUpdater, "stateUpdater must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.processEvery = Objects.requireNonNull(processEvery, "processEvery must not be null");
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout must not be null");
    }

    /**
     * One pass over everything due now.
     *
     * <p>A failure of one schedule is recorded as that schedule's outcome and the pass continues.
     *
     * @throws ScheduleStoreException if claiming or writing fails; the pass is abandoned
     */
    public PassSummary runOnce() {
        return runPass(false);
    }

    private PassSummary runPass(boolean stoppable) {
        Instant now = clock.instant();
        List<ScheduleOutcome> outcomes = new ArrayList<>();
        Iterator<Schedule> due = selector.selectDue(now).iterator();
        int claims = 0;
        while (!(stoppable && stopRequested) && due.hasNext()) {
            Schedule schedule = due.next();
            claims++;
            // an overlapping pass of this runner reclaimed a row it is still delivering
            if (!inFlight.add(schedule.id())) {
                log.warn("remind schedule still in flight on this runner, skipped id={} workerId={}",
                        schedule.id(), selector.workerId());
                continue;
            }
            try {
                outcomes.add(process(schedule));
            } finally {
                inFlight.remove(schedule.id());
            }
        }

        if (claims == 0) {
            log.debug("remind pass found nothing due now={}", now);
            return PassSummary.empty();
        }
        if (claims == selector.maxPerPass()) {
            log.info("remind pass limit reached, remaining due schedules wait for the next pass limit={}",
                    selector.maxPerPass());
        }

        PassSummary summary = PassSummary.of(outcomes);
        log.info("remind pass finished delivered={} failed={} rescheduled={} workerId={}",
                summary.delivered(), summary.failed(), summary.rescheduled(), selector.workerId());
        return summary;
    }

    private ScheduleOutcome process(Schedule schedule) {
        String workerId = selector.workerId();
        log.debug("remind processing schedule id={} recipient={} kind={} nextRun={} repetitions={}/{}",
                schedule.id(), schedule.recipientId(), schedule.kind(), schedule.nextRun(),
                schedule.repetitionCount(), schedule.maxRepetitions());

        DeliveryOutcome outcome;
        try {
            outcome = deliveryClient.deliver(schedule.recipientId(), schedule.message());
        } catch (RuntimeException ex) {
            log.error("remind delivery threw id={} recipient={} msg={}", schedule.id(), schedule.recipientId(), ex.getMessage(), ex);
            outcome = DeliveryOutcome.transientFailure("delivery error: " + ex, 0);
        }

        Instant attemptedAt = clock.instant();
        ScheduleUpdate update;
        try {
            update = stateUpdater.advance(schedule, outcome, attemptedAt);
        } catch (ScheduleIntegrityException ex) {
            log.error("remind schedule deactivated, stored spec unusable id={} msg={}", schedule.id(), ex.getMessage());
            update = stateUpdater.integrityFailure(schedule, ex.getMessage(), attemptedAt);
            stateUpdater.write(update, workerId);
            return new ScheduleOutcome(schedule.id(), schedule.recipientId(), ScheduleOutcome.Status.FAILED,
                    ex.getMessage(), null);
        }

        stateUpdater.write(update, workerId);

        if (outcome.isDelivered()) {
            return new ScheduleOutcome(schedule.id(), schedule.recipientId(), ScheduleOutcome.Status.DELIVERED,
                    outcome.viaFallback() ? "delivered via streaming transport" : null,
                    update.active() ? update.nextRun() : null);
        }
        if (update.active()) {
            return new ScheduleOutcome(schedule.id(), schedule.recipientId(), ScheduleOutcome.Status.RESCHEDULED,
                    outcome.reason(), update.nextRun());
        }
        log.warn("remind schedule failed and was deactivated id={} recipient={} reason={}",
                schedule.id(), schedule.recipientId(), update.lastError());
        return new ScheduleOutcome(schedule.id(), schedule.recipientId(), ScheduleOutcome.Status.FAILED,
                update.lastError(), null);
    }

    /**
     * Start the loop on a daemon thread. Does nothing while a loop, background or
     * {@link #runLoop(Duration)}, is already running on this runner.
     */
    public synchronized void start() {
        if (looping.get() || (loopThread != null && loopThread.isAlive())) {
            return;
        }
        prepareLoop();
        loopThread = new Thread(() -> {
            try {
                loop(processEvery);
            } finally {
                looping.set(false);
            }
        });
        loopThread.setName("remind.runner");
        loopThread.setDaemon(true);
        loopThread.start();
        log.info("remind runner started processEvery={} workerId={}", processEvery, selector.workerId());
    }

    /**
     * Run passes on the calling thread every {@code interval} until {@link #stop()} or interruption.
     *
     * @throws IllegalStateException if a loop is already running on this runner
     */
    public void runLoop(Duration interval) {
        Objects.requireNonNull(interval, "interval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be a positive duration");
        }
        prepareLoop();
        log.info("remind runner looping on caller thread interval={} workerId={}", interval, selector.workerId());
        try {
            loop(interval);
        } finally {
            looping.set(false);
        }
    }

    private void prepareLoop() {
        if (!looping.compareAndSet(false, true)) {
            throw new IllegalStateException("a loop is already running on this runner");
        }
        stopRequested = false;
        stopSignal = new CountDownLatch(1);
        systemErrorCount = 0;
    }

    /**
     * Stop scheduling passes. A pass in progress finishes its current schedule and claims no more. Waits for the background thread started by {@link #start()}.
     */
    public void stop() {
        Thread thread;
        synchronized (this) {
            if (!looping.get() && loopThread == null) {
                return;
            }
            log.info("remind runner stopping...");
            stopRequested = true;
            stopSignal.countDown();
            thread = loopThread;
            loopThread = null;
        }

        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(shutdownTimeout.toMillis());
                if (thread.isAlive()) {
                    log.warn("remind runner did not stop within timeout={}", shutdownTimeout);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("remind runner stopped.");
    }

    public boolean isRunning() {
        return looping.get();
    }

    private void loop(Duration interval) {
        while (!stopRequested && !Thread.currentThread().isInterrupted()) {
            Duration pause = interval;
            try {
                runPass(true);
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("remind pass failed count={} msg={}", systemErrorCount, e.getMessage(), e);
                if (systemErrorCount >= MAX_SYSTEM_ERRORS) {
                    log.error("remind runner stopped due to repeated system failures...");
                    stopRequested = true;
                    break;
                }
                pause = systemErrorCount >= 10 ? Duration.ofSeconds(60) : backoff(systemErrorCount);
            }

            try {
                if (stopSignal.await(pause.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    // Exponential backoff for repeated pass failures.
    private Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount - 1, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }
}
