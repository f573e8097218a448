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
import com.streamfacade.common.util.Subjects;
import com.streamfacade.messaging.bridge.RawSubscription;
import com.streamfacade.messaging.bridge.StreamDescriptor;
import com.streamfacade.messaging.bridge.StreamSpec;
import com.streamfacade.messaging.bridge.TransportBridge;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Entry point of the library: one session to the message backend, from which
 * {@link Publisher}s and {@link Subscriber}s are created.
 *
 * <pre>{@code
 *   Connection conn = Connection.connect(List.of("nats://localhost:4222"),
 *           ConnectOption.withLogger(LogFunction.slf4j(OrderService.class)));
 *   Publisher orders = conn.newPublisher(new CreatePublisherArgs("ORDERS"));
 *   orders.publish("ORDERS.new", payload, order.id());
 *
 *   conn.newSubscriber(new CreateSubscriberArgs("billing", "ORDERS.new"), msg -> bill(msg));
 *   ...
 *   conn.close();
 * }</pre>
 *
 * <p>{@link #close()} may be called once. Concurrent or repeated calls are not guarded and
 * must be serialized by the caller.</p>
 */
public class Connection implements AutoCloseable {

    private final TransportBridge bridge;
    private final LogFunction log;
    private final ConnectionConfig config;
    private final List<Subscriber> subscribers = new CopyOnWriteArrayList<>();
    private volatile ConnectionState state = ConnectionState.OPEN;

    private Connection(TransportBridge bridge, LogFunction log, ConnectionConfig config) {
        this.bridge = bridge;
        this.log = log;
        this.config = config;
    }

    /**
     * Opens a connection to the given servers.
     *
     * @throws ConnectionException if no session could be established
     */
    public static Connection connect(List<String> servers, ConnectOption... options) {
        ConnectOption.Settings settings = new ConnectOption.Settings();
        for (ConnectOption option : options) {
            option.applyTo(settings);
        }
        if (servers == null || servers.isEmpty()) {
            throw new ConnectionException("Connection could not be created: no servers given");
        }
        List<String> serverList = List.copyOf(servers);
        settings.log.log(LogLevel.DEBUG, "Connecting to %s", serverList);
        TransportBridge bridge;
        try {
            bridge = settings.bridgeFactory.create(serverList, settings.config, settings.log);
        } catch (RuntimeException e) {
            throw new ConnectionException("Connection could not be created: " + e.getMessage(), e);
        }
        if (bridge == null) {
            throw new ConnectionException("Connection could not be created: bridge factory returned no session");
        }
        settings.log.log(LogLevel.INFO, "Connected to %s", bridge.servers());
        return new Connection(bridge, settings.log, settings.config);
    }

    /** Opens a connection to the servers listed in {@code config}. */
    public static Connection connect(ConnectionConfig config, ConnectOption... options) {
        Objects.requireNonNull(config, "config must not be null");
        ConnectOption[] all = new ConnectOption[options.length + 1];
        all[0] = ConnectOption.withConfig(config);
        System.arraycopy(options, 0, all, 1, options.length);
        return connect(config.getServers(), all);
    }

    /**
     * Returns a publisher for the named stream, creating the stream if it does not exist yet.
     *
     * @throws StreamProvisionException if the backend refuses the stream
     */
    public Publisher newPublisher(CreatePublisherArgs args) {
        Objects.requireNonNull(args, "args must not be null");
        ensureOpen();
        ensureStream(args.streamName());
        return new Publisher(bridge, args.streamName());
    }

    /**
     * Subscribes {@code handler} to {@code args.subject()} and starts delivering.
     * The stream named by the first subject token is created if needed.
     *
     * @throws SubscriptionCreateException if the subject is invalid or the backend refuses the subscription
     */
    public Subscriber newSubscriber(CreateSubscriberArgs args, MessageHandler handler) {
        Objects.requireNonNull(args, "args must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        ensureOpen();
        String problem = Subjects.validateFilter(args.subject());
        if (problem != null) {
            throw new SubscriptionCreateException("Invalid subject: " + problem);
        }
        String streamName = Subjects.streamName(args.subject());
        RawSubscription subscription;
        try {
            ensureStream(streamName);
            subscription = bridge.createSubscription(args.subject(), args.consumerName(), args.mode());
        } catch (RuntimeException e) {
            throw new SubscriptionCreateException(args.subject(), args.consumerName(), e);
        }
        Subscriber subscriber = new Subscriber(subscription, args.mode(), handler, args.retryPolicy(), log);
        subscribers.add(subscriber);
        subscriber.start();
        log.log(LogLevel.DEBUG, "Subscribed consumer '%s' to '%s' (%s)", args.consumerName(), args.subject(), args.mode());
        return subscriber;
    }

    /** Server addresses known to the session, in preference order. */
    public List<String> servers() {
        return bridge.servers();
    }

    public ConnectionState state() {
        return state;
    }

    public List<Subscriber> subscribers() {
        return List.copyOf(subscribers);
    }

    /**
     * Drains every subscriber in creation order and then the session itself.
     *
     * <p>The first subscriber that fails to drain aborts the close: the remaining subscribers and
     * the session are left as they are and the failure is thrown.</p>
     *
     * @throws DrainException if a subscriber or the session could not be drained
     */
    @Override
    public void close() {
        state = ConnectionState.DRAINING;
        Duration drainTimeout = config.drainTimeout();
        log.log(LogLevel.TRACE, "Draining and closing %d open subscriptions..", subscribers.size());
        for (Subscriber subscriber : new ArrayList<>(subscribers)) {
            try {
                subscriber.drain(drainTimeout);
            } catch (RuntimeException e) {
                state = ConnectionState.FAILED;
                throw e instanceof DrainException d ? d
                        : new DrainException("Subscriber '" + subscriber.consumerName() + "' could not be drained", e);
            }
        }
        log.log(LogLevel.TRACE, "Closed all open subscriptions.");
        log.log(LogLevel.TRACE, "Closing connection...");
        try {
            bridge.drain();
        } catch (RuntimeException e) {
            state = ConnectionState.FAILED;
            throw new DrainException("Connection could not be closed: " + e.getMessage(), e);
        }
        state = ConnectionState.CLOSED;
        log.log(LogLevel.INFO, "Connection closed.");
    }

    private void ensureOpen() {
        if (state != ConnectionState.OPEN) {
            throw new IllegalStateException("Connection is " + state);
        }
    }

    private void ensureStream(String streamName) {
        try {
            StreamDescriptor stream = bridge.ensureStream(StreamSpec.of(streamName, config.getStreamDefaults()));
            log.log(LogLevel.DEBUG, "Stream '%s' %s", stream.name(), stream.created() ? "created" : "exists");
        } catch (RuntimeException e) {
            throw new StreamProvisionException(streamName, e);
        }
    }
}
