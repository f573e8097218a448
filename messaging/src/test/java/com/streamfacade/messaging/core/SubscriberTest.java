/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.core;

import com.streamfacade.common.config.ConnectionConfig;
import com.streamfacade.common.exception.DrainException;
import com.streamfacade.messaging.Await;
import com.streamfacade.messaging.bridge.OutboundMessage;
import com.streamfacade.messaging.memory.InMemoryBackend;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubscriberTest {

    private static final SubscriptionMode STRICT = SubscriptionMode.SINGLE_SUBSCRIBER_STRICT_MESSAGE_ORDER;
    private static final SubscriptionMode SHARED = SubscriptionMode.MULTIPLE_SUBSCRIBERS_ALLOWED;

    private final InMemoryBackend backend = new InMemoryBackend();
    private final List<Connection> connections = new ArrayList<>();
    private final List<String> handled = Collections.synchronizedList(new ArrayList<>());

    private Connection connect() {
        return connect(ConnectionConfig.defaults());
    }

    private Connection connect(ConnectionConfig config) {
        Connection conn = Connection.connect(List.of("mem://subscriber-test"),
                ConnectOption.withConfig(config),
                ConnectOption.withBridgeFactory(backend.bridgeFactory()));
        connections.add(conn);
        return conn;
    }

    @AfterEach
    void closeConnections() {
        for (Connection conn : connections) {
            if (conn.state() == ConnectionState.OPEN) conn.close();
        }
    }

    private static void publish(Connection conn, String subject, String... payloads) {
        Publisher publisher = conn.newPublisher(new CreatePublisherArgs("ORDERS"));
        for (String payload : payloads) {
            publisher.publish(subject, payload.getBytes(), payload);
        }
    }

    private static String label(StreamMessage msg) {
        return msg.getPayload() + msg.getDeliveryCount();
    }

    @Test
    void successfulHandlingAcksEveryMessage() {
        Connection conn = connect();
        Subscriber sub = conn.newSubscriber(new CreateSubscriberArgs("billing", "ORDERS.new"),
                msg -> handled.add(msg.getPayload()));

        publish(conn, "ORDERS.new", "A", "B", "C");

        Await.until(() -> sub.stats().acked() == 3, "three acks");
        assertThat(handled).containsExactly("A", "B", "C");
        assertThat(sub.stats()).isEqualTo(new Subscriber.SubscriberStats(3, 3, 0, 0));
        assertThat(backend.ackedCount("ORDERS", "billing")).isEqualTo(3);
        assertThat(backend.pendingAcks("ORDERS", "billing")).isZero();
    }

    @Test
    void strictModeRedeliversAFailedMessageBeforeAnyLaterOne() {
        Connection conn = connect();
        RetryPolicy retry = RetryPolicy.exponential(0, Duration.ofMillis(50), Duration.ofMillis(50));
        Subscriber sub = conn.newSubscriber(new CreateSubscriberArgs("ledger", "ORDERS.new", STRICT, retry), msg -> {
            handled.add(label(msg));
            if (msg.getPayload().equals("A") && msg.getDeliveryCount() == 1) {
                throw new IllegalStateException("database unavailable");
            }
        });

        publish(conn, "ORDERS.new", "A", "B");

        Await.until(() -> sub.stats().acked() == 2, "both messages acked");
        assertThat(handled).containsExactly("A1", "A2", "B1");
        assertThat(sub.stats().naked()).isEqualTo(1);
    }

    @Test
    void strictModeKeepsOrderAcrossSeveralRetries() {
        Connection conn = connect();
        RetryPolicy retry = RetryPolicy.exponential(0, Duration.ofMillis(10), Duration.ofMillis(40));
        conn.newSubscriber(new CreateSubscriberArgs("ledger", "ORDERS.>", STRICT, retry), msg -> {
            handled.add(label(msg));
            if (msg.getPayload().equals("B") && msg.getDeliveryCount() < 4) {
                throw new IllegalStateException("not yet");
            }
        });

        publish(conn, "ORDERS.new", "A", "B", "C");

        Await.until(() -> handled.contains("C1"), "C handled");
        assertThat(handled).containsExactly("A1", "B1", "B2", "B3", "B4", "C1");
    }

    @Test
    void sharedModeDoesNotBlockOnAFailedMessage() {
        Connection conn = connect();
        RetryPolicy retry = RetryPolicy.exponential(0, Duration.ofMillis(300), Duration.ofMillis(300));
        Subscriber sub = conn.newSubscriber(new CreateSubscriberArgs("mailer", "ORDERS.new", SHARED, retry), msg -> {
            handled.add(label(msg));
            if (msg.getPayload().equals("A") && msg.getDeliveryCount() == 1) {
                throw new IllegalStateException("smtp down");
            }
        });

        publish(conn, "ORDERS.new", "A", "B");

        Await.until(() -> sub.stats().acked() == 2, "both messages acked");
        assertThat(handled).containsExactly("A1", "B1", "A2");
    }

    @Test
    void terminalFailureIsNotRedelivered() {
        Connection conn = connect();
        Subscriber sub = conn.newSubscriber(new CreateSubscriberArgs("parser", "ORDERS.new", STRICT), msg -> {
            handled.add(label(msg));
            if (msg.getPayload().equals("garbage")) {
                throw new TerminalMessageException("cannot parse");
            }
        });

        publish(conn, "ORDERS.new", "garbage", "ok");

        Await.until(() -> sub.stats().acked() == 1, "second message acked");
        assertThat(handled).containsExactly("garbage1", "ok1");
        assertThat(sub.stats().terminated()).isEqualTo(1);
        assertThat(backend.terminatedCount("ORDERS", "parser")).isEqualTo(1);
    }

    @Test
    void exhaustedRetriesTerminateTheMessage() {
        Connection conn = connect();
        RetryPolicy retry = RetryPolicy.exponential(3, Duration.ZERO, Duration.ZERO);
        Subscriber sub = conn.newSubscriber(new CreateSubscriberArgs("fragile", "ORDERS.new", STRICT, retry), msg -> {
            handled.add(label(msg));
            if (msg.getPayload().equals("A")) throw new IllegalStateException("always fails");
        });

        publish(conn, "ORDERS.new", "A", "B");

        Await.until(() -> sub.stats().acked() == 1, "B acked");
        assertThat(handled).containsExactly("A1", "A2", "A3", "B1");
        assertThat(sub.stats()).isEqualTo(new Subscriber.SubscriberStats(4, 1, 2, 1));
    }

    @Test
    void wildcardSubscriptionsSeeOnlyMatchingSubjects() {
        Connection conn = connect();
        List<String> direct = Collections.synchronizedList(new ArrayList<>());
        List<String> all = Collections.synchronizedList(new ArrayList<>());
        conn.newSubscriber(new CreateSubscriberArgs("direct", "ORDERS.*"), msg -> direct.add(msg.getSubject()));
        conn.newSubscriber(new CreateSubscriberArgs("all", "ORDERS.>"), msg -> all.add(msg.getSubject()));

        Publisher publisher = conn.newPublisher(new CreatePublisherArgs("ORDERS"));
        publisher.publish("ORDERS.new", new byte[0], "1");
        publisher.publish("ORDERS.new.error", new byte[0], "2");
        publisher.publish("ORDERS.old", new byte[0], "3");

        Await.until(() -> all.size() == 3, "all three on ORDERS.>");
        Await.until(() -> direct.size() == 2, "two on ORDERS.*");
        assertThat(direct).containsExactly("ORDERS.new", "ORDERS.old");
    }

    @Test
    void durableConsumerResumesWhereItStopped() {
        Connection first = connect();
        Subscriber sub = first.newSubscriber(new CreateSubscriberArgs("audit", "ORDERS.new"),
                msg -> handled.add(msg.getPayload()));
        publish(first, "ORDERS.new", "A", "B");
        Await.until(() -> sub.stats().acked() == 2, "first batch acked");
        first.close();

        Connection second = connect();
        publish(second, "ORDERS.new", "C");
        second.newSubscriber(new CreateSubscriberArgs("audit", "ORDERS.new"), msg -> handled.add(msg.getPayload()));

        Await.until(() -> handled.size() == 3, "C handled");
        assertThat(handled).containsExactly("A", "B", "C");
    }

    @Test
    void closeWaitsForTheMessageInProgress() throws Exception {
        Connection conn = connect();
        CountDownLatch started = new CountDownLatch(1);
        AtomicBoolean finished = new AtomicBoolean();
        conn.newSubscriber(new CreateSubscriberArgs("slow", "ORDERS.new"), msg -> {
            started.countDown();
            Thread.sleep(300);
            finished.set(true);
        });
        publish(conn, "ORDERS.new", "A");
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        conn.close();

        assertThat(finished).isTrue();
        assertThat(backend.ackedCount("ORDERS", "slow")).isEqualTo(1);
    }

    @Test
    void noHandlerRunsAfterClose() throws Exception {
        Connection conn = connect();
        AtomicInteger calls = new AtomicInteger();
        Subscriber sub = conn.newSubscriber(new CreateSubscriberArgs("quiet", "ORDERS.new"),
                msg -> calls.incrementAndGet());
        publish(conn, "ORDERS.new", "A");
        Await.until(() -> sub.stats().acked() == 1, "A acked");

        conn.close();
        Connection other = connect();
        publish(other, "ORDERS.new", "B", "C");
        Thread.sleep(200);

        assertThat(calls).hasValue(1);
        assertThat(sub.isRunning()).isFalse();
        assertThat(backend.messageCount("ORDERS")).isEqualTo(3);
    }

    @Test
    void closeFailsWhenAHandlerOutlivesTheDrainTimeout() throws Exception {
        ConnectionConfig config = ConnectionConfig.defaults();
        config.setDrainTimeout("100ms");
        Connection conn = connect(config);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        conn.newSubscriber(new CreateSubscriberArgs("stuck", "ORDERS.new"), msg -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
        });
        publish(conn, "ORDERS.new", "A");
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        try {
            assertThatThrownBy(conn::close)
                    .isInstanceOf(DrainException.class)
                    .hasMessageContaining("did not stop within 100 ms");
            assertThat(conn.state()).isEqualTo(ConnectionState.FAILED);
        } finally {
            release.countDown();
        }
    }

    @Test
    void handlerSeesHeadersAndMessageId() {
        Connection conn = connect();
        List<StreamMessage> seen = Collections.synchronizedList(new ArrayList<>());
        conn.newSubscriber(new CreateSubscriberArgs("inspect", "ORDERS.new"), seen::add);

        conn.newPublisher(new CreatePublisherArgs("ORDERS")).publish(
                new OutboundMessage("ORDERS.new", "{}".getBytes(),
                        Map.of("content-type", "application/json")), "order-42");

        Await.until(() -> seen.size() == 1, "message seen");
        StreamMessage msg = seen.get(0);
        assertThat(msg.getMessageId()).isEqualTo("order-42");
        assertThat(msg.getHeaders()).containsEntry("content-type", "application/json");
        assertThat(msg.getStreamSequence()).isEqualTo(1);
        assertThat(msg.isRedelivery()).isFalse();
        assertThat(msg.getTimestamp()).isNotNull();
    }
}
