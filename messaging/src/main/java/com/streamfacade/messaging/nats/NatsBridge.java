/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.nats;

import com.streamfacade.common.config.ConnectionConfig;
import com.streamfacade.common.config.StreamDefaults;
import com.streamfacade.common.logging.LogFunction;
import com.streamfacade.common.logging.LogLevel;
import com.streamfacade.common.util.Subjects;
import com.streamfacade.messaging.bridge.BridgeException;
import com.streamfacade.messaging.bridge.OutboundMessage;
import com.streamfacade.messaging.bridge.PublishReceipt;
import com.streamfacade.messaging.bridge.RawSubscription;
import com.streamfacade.messaging.bridge.StreamDescriptor;
import com.streamfacade.messaging.bridge.StreamSpec;
import com.streamfacade.messaging.bridge.TransportBridge;
import com.streamfacade.messaging.core.SubscriptionMode;
import io.nats.client.Connection;
import io.nats.client.ConnectionListener;
import io.nats.client.Consumer;
import io.nats.client.ErrorListener;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Nats;
import io.nats.client.Options;
import io.nats.client.PublishOptions;
import io.nats.client.PullSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.DeliverPolicy;
import io.nats.client.api.PublishAck;
import io.nats.client.api.RetentionPolicy;
import io.nats.client.api.StorageType;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.api.StreamInfo;
import io.nats.client.impl.Headers;
import io.nats.client.impl.NatsMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link TransportBridge} over a NATS connection with JetStream enabled.
 */
public class NatsBridge implements TransportBridge {

    private static final Logger log = LoggerFactory.getLogger(NatsBridge.class);
    private static final int STREAM_NOT_FOUND = 404;

    private final Connection connection;
    private final JetStream jetStream;
    private final JetStreamManagement management;
    private final ConnectionConfig config;
    private final LogFunction logFunction;
    private final ExecutorService pullExecutor;

    NatsBridge(Connection connection, ConnectionConfig config, LogFunction logFunction) throws IOException {
        this.connection = connection;
        this.jetStream = connection.jetStream();
        this.management = connection.jetStreamManagement();
        this.config = config;
        this.logFunction = logFunction;
        AtomicInteger threads = new AtomicInteger();
        this.pullExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "sf-nats-pull-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Connects to the given servers; reconnects are attempted without limit.
     *
     * @throws BridgeException if the connection cannot be established
     */
    public static NatsBridge connect(List<String> servers, ConnectionConfig config, LogFunction logFunction) {
        Options.Builder builder = new Options.Builder()
                .servers(servers.toArray(new String[0]))
                .connectionTimeout(config.connectTimeout())
                .maxReconnects(-1)
                .connectionListener(connectionListener(logFunction))
                .errorListener(errorListener());
        if (config.getConnectionName() != null && !config.getConnectionName().isBlank()) {
            builder.connectionName(config.getConnectionName());
        }
        Connection connection = null;
        try {
            connection = Nats.connect(builder.build());
            return new NatsBridge(connection, config, logFunction);
        } catch (IOException e) {
            closeQuietly(connection);
            throw new BridgeException("Could not connect to " + servers + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BridgeException("Interrupted while connecting to " + servers, e);
        }
    }

    @Override
    public StreamDescriptor ensureStream(StreamSpec spec) {
        try {
            StreamInfo info = management.getStreamInfo(spec.name());
            return describe(info, false);
        } catch (JetStreamApiException e) {
            if (e.getErrorCode() != STREAM_NOT_FOUND) {
                throw new BridgeException("Stream '" + spec.name() + "' lookup failed: " + e.getMessage(), e);
            }
        } catch (IOException e) {
            throw new BridgeException("Stream '" + spec.name() + "' lookup failed: " + e.getMessage(), e);
        }
        try {
            StreamInfo info = management.addStream(toConfiguration(spec));
            log.info("Created stream {} for {}", spec.name(), spec.subjects());
            return describe(info, true);
        } catch (IOException | JetStreamApiException e) {
            throw new BridgeException("Stream '" + spec.name() + "' could not be created: " + e.getMessage(), e);
        }
    }

    @Override
    public RawSubscription createSubscription(String subject, String consumerName, SubscriptionMode mode) {
        ConsumerConfiguration.Builder consumer = ConsumerConfiguration.builder()
                .durable(consumerName)
                .ackPolicy(AckPolicy.Explicit)
                .deliverPolicy(DeliverPolicy.All)
                .filterSubject(subject);
        if (mode == SubscriptionMode.SINGLE_SUBSCRIBER_STRICT_MESSAGE_ORDER) {
            consumer.maxAckPending(1);
        }
        PullSubscribeOptions options = PullSubscribeOptions.builder()
                .stream(Subjects.streamName(subject))
                .configuration(consumer.build())
                .build();
        try {
            JetStreamSubscription subscription = jetStream.subscribe(subject, options);
            log.debug("Pull subscription on {} for durable {} ({})", subject, consumerName, mode);
            return new NatsRawSubscription(subscription, subject, consumerName, pullExecutor,
                    config.pullWait(), config.drainTimeout());
        } catch (IOException | JetStreamApiException e) {
            throw new BridgeException("Subscription on '" + subject + "' failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> servers() {
        return new ArrayList<>(connection.getServers());
    }

    @Override
    public PublishReceipt publish(OutboundMessage message, String dedupKey) {
        Headers headers = new Headers();
        for (Map.Entry<String, String> header : message.headers().entrySet()) {
            headers.add(header.getKey(), header.getValue());
        }
        NatsMessage natsMessage = NatsMessage.builder()
                .subject(message.subject())
                .data(message.data())
                .headers(headers)
                .build();
        PublishOptions.Builder options = PublishOptions.builder();
        if (dedupKey != null) {
            options.messageId(dedupKey);
        }
        try {
            PublishAck ack = jetStream.publish(natsMessage, options.build());
            return new PublishReceipt(ack.getStream(), ack.getSeqno(), ack.isDuplicate());
        } catch (IOException | JetStreamApiException | IllegalStateException e) {
            throw new BridgeException("Publish to '" + message.subject() + "' failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void drain() {
        logFunction.log(LogLevel.TRACE, "Draining NATS connection to %s", connection.getConnectedUrl());
        try {
            if (!connection.drain(config.drainTimeout()).get()) {
                throw new BridgeException("Connection did not drain within " + config.drainTimeout().toMillis() + " ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BridgeException("Interrupted while draining connection", e);
        } catch (TimeoutException e) {
            throw new BridgeException("Connection did not drain within " + config.drainTimeout().toMillis() + " ms", e);
        } catch (BridgeException e) {
            throw e;
        } catch (Exception e) {
            throw new BridgeException("Connection drain failed: " + e.getMessage(), e);
        } finally {
            pullExecutor.shutdownNow();
        }
        try {
            pullExecutor.awaitTermination(config.pullWait().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static StreamConfiguration toConfiguration(StreamSpec spec) {
        StreamConfiguration.Builder builder = StreamConfiguration.builder()
                .name(spec.name())
                .subjects(spec.subjects())
                .retentionPolicy(retention(spec.retention()))
                .storageType(spec.storage() == StreamDefaults.Storage.MEMORY ? StorageType.Memory : StorageType.File)
                .replicas(spec.replicas());
        if (spec.maxAge() != null && !spec.maxAge().isZero()) {
            builder.maxAge(spec.maxAge());
        }
        if (spec.duplicateWindow() != null && !spec.duplicateWindow().isZero()) {
            builder.duplicateWindow(spec.duplicateWindow());
        }
        return builder.build();
    }

    private static RetentionPolicy retention(StreamDefaults.Retention retention) {
        if (retention == null) return RetentionPolicy.Limits;
        return switch (retention) {
            case LIMITS -> RetentionPolicy.Limits;
            case INTEREST -> RetentionPolicy.Interest;
            case WORK_QUEUE -> RetentionPolicy.WorkQueue;
        };
    }

    private static StreamDescriptor describe(StreamInfo info, boolean created) {
        return new StreamDescriptor(info.getConfiguration().getName(), info.getConfiguration().getSubjects(),
                info.getStreamState().getMsgCount(), created);
    }

    private static ConnectionListener connectionListener(LogFunction logFunction) {
        return (conn, event) -> {
            switch (event) {
                case DISCONNECTED -> logFunction.log(LogLevel.WARN, "Disconnected from %s", conn.getServers());
                case RECONNECTED -> logFunction.log(LogLevel.INFO, "Reconnected to %s", conn.getConnectedUrl());
                case CLOSED -> log.debug("NATS connection closed");
                default -> log.debug("NATS connection event {}", event);
            }
        };
    }

    private static ErrorListener errorListener() {
        return new ErrorListener() {
            @Override
            public void errorOccurred(Connection conn, String error) {
                log.error("NATS error: {}", error);
            }

            @Override
            public void exceptionOccurred(Connection conn, Exception exp) {
                log.error("NATS exception", exp);
            }

            @Override
            public void slowConsumerDetected(Connection conn, Consumer consumer) {
                log.warn("NATS slow consumer detected");
            }
        };
    }

    private static void closeQuietly(Connection connection) {
        if (connection == null) return;
        try {
            connection.close();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
