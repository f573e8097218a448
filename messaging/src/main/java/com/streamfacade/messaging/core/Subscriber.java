/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.core;

import com.streamfacade.common.exception.DrainException;
import com.streamfacade.common.logging.LogFunction;
import com.streamfacade.common.logging.LogLevel;
import com.streamfacade.messaging.bridge.RawMessage;
import com.streamfacade.messaging.bridge.RawSubscription;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pulls messages of one subscription and hands them to a {@link MessageHandler}, one at a time,
 * on a dedicated thread.
 *
 * <p>Per message the outcome is:</p>
 * <ul>
 *   <li>handler returns → ack</li>
 *   <li>handler throws {@link TerminalMessageException}, or fails on the last delivery the
 *       {@link RetryPolicy} allows → terminate, logged at ERROR</li>
 *   <li>handler throws anything else → nak, redelivered after the policy's backoff</li>
 * </ul>
 *
 * <p>In {@link SubscriptionMode#SINGLE_SUBSCRIBER_STRICT_MESSAGE_ORDER} a nak'd message blocks
 * the subscriber until its redelivery has been resolved. Any other message that shows up in
 * the meantime is handed back unprocessed, delayed until the awaited redelivery is due, and the
 * hand-back does not count as an attempt of that message.</p>
 *
 * <p>Subscribers are created and drained by their {@link Connection} only.</p>
 */
public class Subscriber {

    static final Duration PULL_ERROR_BACKOFF = Duration.ofSeconds(1);
    /** Lower bound for handing back a message that arrives while strict mode waits for a redelivery. */
    static final Duration MIN_HAND_BACK_DELAY = Duration.ofMillis(50);

    private final RawSubscription subscription;
    private final SubscriptionMode mode;
    private final MessageHandler handler;
    private final RetryPolicy retryPolicy;
    private final LogFunction log;
    private final QuitSignal quitSignal = new QuitSignal();
    private final ExecutorService loopExecutor;

    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong acked = new AtomicLong();
    private final AtomicLong naked = new AtomicLong();
    private final AtomicLong terminated = new AtomicLong();
    private volatile boolean running;

    Subscriber(RawSubscription subscription, SubscriptionMode mode, MessageHandler handler,
               RetryPolicy retryPolicy, LogFunction log) {
        this.subscription = subscription;
        this.mode = mode;
        this.handler = handler;
        this.retryPolicy = retryPolicy;
        this.log = log;
        this.loopExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "sf-sub-" + subscription.consumerName());
            t.setDaemon(true);
            return t;
        });
    }

    public String subject() { return subscription.subject(); }
    public String consumerName() { return subscription.consumerName(); }
    public SubscriptionMode mode() { return mode; }
    public boolean isRunning() { return running; }

    public SubscriberStats stats() {
        return new SubscriberStats(delivered.get(), acked.get(), naked.get(), terminated.get());
    }

    void start() {
        running = true;
        loopExecutor.execute(this::deliveryLoop);
    }

    /**
     * Drains the subscription, fires the quit signal and waits until the delivery loop has
     * finished the message it is working on.
     *
     * @throws DrainException if the subscription cannot be drained or the loop does not stop in time
     */
    void drain(Duration timeout) {
        log.log(LogLevel.TRACE, "Draining subscription '%s' of consumer '%s'", subject(), consumerName());
        try {
            subscription.drain();
        } catch (RuntimeException e) {
            throw new DrainException("Subscription '" + subject() + "' of consumer '" + consumerName()
                    + "' could not be drained: " + e.getMessage(), e);
        }
        quitSignal.fire();
        loopExecutor.shutdown();
        try {
            if (!loopExecutor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new DrainException("Delivery loop of consumer '" + consumerName()
                        + "' did not stop within " + timeout.toMillis() + " ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DrainException("Interrupted while draining consumer '" + consumerName() + "'", e);
        }
        log.log(LogLevel.TRACE, "Subscription '%s' of consumer '%s' drained", subject(), consumerName());
    }

    private void deliveryLoop() {
        CompletableFuture<Void> quit = quitSignal.whenFired();
        StrictGate gate = new StrictGate();
        try {
            while (!quitSignal.isFired()) {
                CompletableFuture<RawMessage> next = subscription.nextMessage();
                awaitFirst(next, quit);
                if (quitSignal.isFired()) {
                    next.cancel(false);
                    handBack(next);
                    break;
                }
                RawMessage message;
                try {
                    message = next.join();
                } catch (CompletionException | CancellationException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.log(LogLevel.WARN, "Pull on '%s' failed, retrying in %d ms: %s",
                            subject(), PULL_ERROR_BACKOFF.toMillis(), cause.getMessage());
                    awaitQuit(quit, PULL_ERROR_BACKOFF);
                    continue;
                }

                if (gate.isBlocking(message)) {
                    Duration delay = gate.handBackDelay();
                    log.log(LogLevel.WARN, "Consumer '%s' got sequence %d while waiting for redelivery of %d, handing it back for %d ms",
                            consumerName(), message.streamSequence(), gate.awaitedSequence, delay.toMillis());
                    gate.countHandBack(message);
                    settle(() -> subscription.nak(message, delay), "nak", message);
                    continue;
                }

                Duration retryDelay = process(message, gate.attemptOf(message));
                if (mode == SubscriptionMode.SINGLE_SUBSCRIBER_STRICT_MESSAGE_ORDER) {
                    gate.settled(message, retryDelay);
                }
            }
        } finally {
            running = false;
            log.log(LogLevel.DEBUG, "Delivery loop of consumer '%s' stopped", consumerName());
        }
    }

    /**
     * Handles one message.
     *
     * @param attempt delivery number counted against the retry policy
     * @return the redelivery delay if the message was nak'd, otherwise {@code null}
     */
    private Duration process(RawMessage message, long attempt) {
        delivered.incrementAndGet();
        try {
            handler.onMessage(StreamMessage.from(message));
        } catch (TerminalMessageException e) {
            log.log(LogLevel.ERROR, "Message %d on '%s' terminated by handler: %s",
                    message.streamSequence(), message.subject(), e.getMessage());
            settle(() -> subscription.terminate(message), "terminate", message);
            terminated.incrementAndGet();
            return null;
        } catch (Exception e) {
            if (retryPolicy.isExhausted(attempt)) {
                log.log(LogLevel.ERROR, "Message %d on '%s' terminated after %d attempts: %s",
                        message.streamSequence(), message.subject(), attempt, e.getMessage());
                settle(() -> subscription.terminate(message), "terminate", message);
                terminated.incrementAndGet();
                return null;
            }
            Duration delay = retryPolicy.backoff(attempt);
            log.log(LogLevel.DEBUG, "Message %d on '%s' failed on attempt %d, nak with delay %d ms: %s",
                    message.streamSequence(), message.subject(), attempt, delay.toMillis(), e.getMessage());
            settle(() -> subscription.nak(message, delay), "nak", message);
            naked.incrementAndGet();
            return delay;
        }
        settle(() -> subscription.ack(message), "ack", message);
        acked.incrementAndGet();
        return null;
    }

    /** A message pulled while quitting is returned to the backend without being handled. */
    private void handBack(CompletableFuture<RawMessage> next) {
        if (next.isDone() && !next.isCompletedExceptionally()) {
            RawMessage message = next.join();
            settle(() -> subscription.nak(message, Duration.ZERO), "nak", message);
        }
    }

    private void settle(Runnable action, String name, RawMessage message) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.log(LogLevel.WARN, "Could not %s message %d on '%s': %s",
                    name, message.streamSequence(), message.subject(), e.getMessage());
        }
    }

    /** Blocks until either future completes, without polling. Outcomes are read from the futures. */
    private static void awaitFirst(CompletableFuture<?> a, CompletableFuture<?> b) {
        CompletableFuture.anyOf(a, b).handle((result, failure) -> null).join();
    }

    private static void awaitQuit(CompletableFuture<Void> quit, Duration timeout) {
        CompletableFuture<Void> timer = CompletableFuture.runAsync(() -> { },
                CompletableFuture.delayedExecutor(timeout.toMillis(), TimeUnit.MILLISECONDS));
        awaitFirst(quit, timer);
    }

    /**
     * Strict-order bookkeeping, confined to the delivery loop thread. While a nak'd message waits
     * for its redelivery every other message is handed back until the redelivery is due.
     * Hand-backs are subtracted from the backend's delivery count.
     */
    private static final class StrictGate {

        long awaitedSequence = -1;
        private long redeliveryDueNanos;
        private final Map<Long, Long> handBacks = new HashMap<>();

        boolean isBlocking(RawMessage message) {
            return awaitedSequence >= 0 && message.streamSequence() != awaitedSequence;
        }

        Duration handBackDelay() {
            Duration remaining = Duration.ofNanos(Math.max(0, redeliveryDueNanos - System.nanoTime()));
            return remaining.compareTo(MIN_HAND_BACK_DELAY) < 0 ? MIN_HAND_BACK_DELAY : remaining;
        }

        void countHandBack(RawMessage message) {
            handBacks.merge(message.streamSequence(), 1L, Long::sum);
        }

        long attemptOf(RawMessage message) {
            long skipped = handBacks.getOrDefault(message.streamSequence(), 0L);
            return Math.max(1, message.deliveryCount() - skipped);
        }

        void settled(RawMessage message, Duration retryDelay) {
            if (retryDelay != null) {
                awaitedSequence = message.streamSequence();
                redeliveryDueNanos = System.nanoTime() + retryDelay.toNanos();
            } else {
                awaitedSequence = -1;
                handBacks.remove(message.streamSequence());
            }
        }
    }

    public record SubscriberStats(long delivered, long acked, long naked, long terminated) {}
}
