/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.core;

import com.streamfacade.common.config.ConnectionConfig;
import com.streamfacade.common.exception.ConnectionException;
import com.streamfacade.common.exception.DrainException;
import com.streamfacade.common.exception.StreamProvisionException;
import com.streamfacade.common.exception.SubscriptionCreateException;
import com.streamfacade.common.logging.LogFunction;
import com.streamfacade.common.logging.LogLevel;
import com.streamfacade.messaging.bridge.BridgeException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionTest {

    private static final List<String> SERVERS = List.of("test://recording");
    private static final MessageHandler IGNORE = msg -> { };

    private final RecordingBridge bridge = new RecordingBridge();
    private final List<String> logLines = Collections.synchronizedList(new ArrayList<>());
    private final LogFunction recordingLog = (level, format, args) -> logLines.add(level + " " + String.format(format, args));

    private Connection connect() {
        return Connection.connect(SERVERS,
                ConnectOption.withBridgeFactory((servers, config, log) -> bridge),
                ConnectOption.withLogger(recordingLog));
    }

    @Test
    void connectWithoutServersFails() {
        assertThatThrownBy(() -> Connection.connect(List.of(), ConnectOption.withBridgeFactory((s, c, l) -> bridge)))
                .isInstanceOf(ConnectionException.class)
                .hasMessageContaining("no servers");
    }

    @Test
    void bridgeFactoryFailureBecomesConnectionException() {
        assertThatThrownBy(() -> Connection.connect(SERVERS,
                ConnectOption.withBridgeFactory((s, c, l) -> { throw new BridgeException("unreachable"); })))
                .isInstanceOf(ConnectionException.class)
                .hasMessageContaining("unreachable")
                .hasCauseInstanceOf(BridgeException.class);
    }

    @Test
    void optionsAreAppliedBeforeTheSessionIsOpened() {
        ConnectionConfig config = ConnectionConfig.defaults();
        config.setConnectionName("billing");
        AtomicReference<ConnectionConfig> seenConfig = new AtomicReference<>();
        AtomicReference<LogFunction> seenLog = new AtomicReference<>();

        Connection.connect(SERVERS,
                ConnectOption.withLogger(recordingLog),
                ConnectOption.withConfig(config),
                ConnectOption.withBridgeFactory((servers, c, log) -> {
                    seenConfig.set(c);
                    seenLog.set(log);
                    return bridge;
                }));

        assertThat(seenConfig.get()).isSameAs(config);
        assertThat(seenLog.get()).isSameAs(recordingLog);
        assertThat(logLines).anyMatch(line -> line.startsWith("INFO Connected to"));
    }

    @Test
    void connectWithConfigUsesItsServers() {
        ConnectionConfig config = ConnectionConfig.defaults();
        config.setServers(List.of("nats://a:4222", "nats://b:4222"));
        AtomicReference<List<String>> seenServers = new AtomicReference<>();

        Connection.connect(config, ConnectOption.withBridgeFactory((servers, c, log) -> {
            seenServers.set(servers);
            return bridge;
        }));

        assertThat(seenServers.get()).containsExactly("nats://a:4222", "nats://b:4222");
    }

    @Test
    void publisherProvisionsItsStream() {
        Connection conn = connect();

        Publisher publisher = conn.newPublisher(new CreatePublisherArgs("ORDERS"));

        assertThat(publisher.streamName()).isEqualTo("ORDERS");
        assertThat(bridge.streamSpecs).singleElement()
                .satisfies(spec -> assertThat(spec.subjects()).containsExactly("ORDERS.>"));
    }

    @Test
    void refusedStreamIsAProvisionError() {
        bridge.failEnsureStream = true;
        Connection conn = connect();

        assertThatThrownBy(() -> conn.newPublisher(new CreatePublisherArgs("ORDERS")))
                .isInstanceOf(StreamProvisionException.class)
                .hasMessageContaining("ORDERS");
    }

    @Test
    void subscriberStreamIsTheFirstSubjectToken() {
        Connection conn = connect();

        Subscriber sub = conn.newSubscriber(new CreateSubscriberArgs("billing", "ORDERS.new.*"), IGNORE);

        assertThat(bridge.events).containsSubsequence("ensureStream:ORDERS", "subscribe:billing");
        assertThat(sub.subject()).isEqualTo("ORDERS.new.*");
        assertThat(sub.isRunning()).isTrue();
        assertThat(conn.subscribers()).containsExactly(sub);
    }

    @Test
    void invalidSubjectIsRejectedBeforeTheBackendIsAsked() {
        Connection conn = connect();

        assertThatThrownBy(() -> conn.newSubscriber(new CreateSubscriberArgs("billing", "ORDERS..new"), IGNORE))
                .isInstanceOf(SubscriptionCreateException.class)
                .hasMessageContaining("empty token");
        assertThat(bridge.events).isEmpty();
    }

    @Test
    void refusedConsumerIsASubscriptionError() {
        bridge.failCreateSubscription = true;
        Connection conn = connect();

        assertThatThrownBy(() -> conn.newSubscriber(new CreateSubscriberArgs("billing", "ORDERS.new"), IGNORE))
                .isInstanceOf(SubscriptionCreateException.class)
                .hasMessageContaining("billing")
                .hasMessageContaining("ORDERS.new");
        assertThat(conn.subscribers()).isEmpty();
    }

    @Test
    void closeDrainsSubscribersInCreationOrderThenTheSession() {
        Connection conn = connect();
        Subscriber first = conn.newSubscriber(new CreateSubscriberArgs("a", "ORDERS.new"), IGNORE);
        Subscriber second = conn.newSubscriber(new CreateSubscriberArgs("b", "ORDERS.old"), IGNORE);
        Subscriber third = conn.newSubscriber(new CreateSubscriberArgs("c", "BILLING.>"), IGNORE);

        conn.close();

        assertThat(bridge.drainEvents()).containsExactly("drain:a", "drain:b", "drain:c", "drain:bridge");
        assertThat(conn.state()).isEqualTo(ConnectionState.CLOSED);
        assertThat(first.isRunning()).isFalse();
        assertThat(second.isRunning()).isFalse();
        assertThat(third.isRunning()).isFalse();
    }

    @Test
    void closeLogsTheDrainSteps() {
        Connection conn = connect();
        conn.newSubscriber(new CreateSubscriberArgs("a", "ORDERS.new"), IGNORE);
        conn.newSubscriber(new CreateSubscriberArgs("b", "ORDERS.old"), IGNORE);

        conn.close();

        assertThat(logLines).containsSubsequence(
                "TRACE Draining and closing 2 open subscriptions..",
                "TRACE Closed all open subscriptions.",
                "TRACE Closing connection...",
                "INFO Connection closed.");
    }

    @Test
    void closeWithoutSubscribersOnlyDrainsTheSession() {
        Connection conn = connect();

        conn.close();

        assertThat(bridge.drainEvents()).containsExactly("drain:bridge");
    }

    @Test
    void failingSubscriberAbortsTheClose() {
        bridge.failingDrains.add("b");
        Connection conn = connect();
        conn.newSubscriber(new CreateSubscriberArgs("a", "ORDERS.new"), IGNORE);
        conn.newSubscriber(new CreateSubscriberArgs("b", "ORDERS.old"), IGNORE);
        Subscriber third = conn.newSubscriber(new CreateSubscriberArgs("c", "ORDERS.other"), IGNORE);

        assertThatThrownBy(conn::close)
                .isInstanceOf(DrainException.class)
                .hasMessageContaining("drain refused");

        assertThat(bridge.drainEvents()).containsExactly("drain:a");
        assertThat(conn.state()).isEqualTo(ConnectionState.FAILED);
        assertThat(third.isRunning()).isTrue();
    }

    @Test
    void failingSessionDrainIsReported() {
        bridge.failBridgeDrain = true;
        Connection conn = connect();
        conn.newSubscriber(new CreateSubscriberArgs("a", "ORDERS.new"), IGNORE);

        assertThatThrownBy(conn::close)
                .isInstanceOf(DrainException.class)
                .hasMessageContaining("Connection could not be closed")
                .hasMessageContaining("flush failed");
        assertThat(bridge.drainEvents()).containsExactly("drain:a");
        assertThat(conn.state()).isEqualTo(ConnectionState.FAILED);
    }

    @Test
    void closedConnectionRejectsNewPublishersAndSubscribers() {
        Connection conn = connect();
        conn.close();

        assertThatThrownBy(() -> conn.newPublisher(new CreatePublisherArgs("ORDERS")))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> conn.newSubscriber(new CreateSubscriberArgs("a", "ORDERS.new"), IGNORE))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void serversComeFromTheSession() {
        assertThat(connect().servers()).containsExactly("test://recording");
    }

    @Test
    void nothingIsLoggedWithoutALogger() {
        Connection conn = Connection.connect(SERVERS, ConnectOption.withBridgeFactory((s, c, l) -> {
            assertThat(l).isSameAs(LogFunction.noOp());
            return bridge;
        }));
        conn.close();
        assertThat(logLines).noneMatch(line -> line.startsWith(LogLevel.INFO.name()));
    }
}
