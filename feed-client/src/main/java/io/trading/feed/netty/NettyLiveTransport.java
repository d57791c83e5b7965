package io.trading.feed.netty;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.handler.codec.string.StringEncoder;
import io.trading.feed.config.FeedClientConfig;
import io.trading.feed.live.LiveTransport;
import io.trading.feed.live.RecordCallback;
import io.trading.feed.live.Subscription;
import io.trading.marketdata.dbn.error.TransportException;
import io.trading.marketdata.dbn.metadata.Metadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@link LiveTransport} over a plain TCP connection to a DBN gateway.
 *
 * <p>Connects lazily on the first subscription. Subscriptions and {@code start_session} go out as
 * text lines; the response is one metadata header followed by length-delimited records. A live
 * session cannot be paused, so {@link #stop()} closes the connection; a later
 * {@link #start(RecordCallback, Consumer)} opens a new one and replays the subscriptions issued
 * since the last {@link #reconnect()}.
 */
public class NettyLiveTransport implements LiveTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(NettyLiveTransport.class);
    private static final int CONNECT_TIMEOUT_MS = 10_000;
    private static final long CLOSE_TIMEOUT_MS = 5_000;

    private final String name;
    private final String host;
    private final int port;
    private final List<Subscription> subscriptions = new ArrayList<>();

    private EventLoopGroup eventLoopGroup;
    private Channel channel;
    private RecordDispatchHandler dispatchHandler;
    private boolean subscriptionsSent;
    private volatile Metadata metadata;
    private volatile Consumer<Metadata> metadataListener;
    private boolean closed;

    public NettyLiveTransport(FeedClientConfig config) {
        this(config.sessionName(), config.gatewayHost(), config.gatewayPort());
    }

    public NettyLiveTransport(String name, String host, int port) {
        this.name = name;
        this.host = host;
        this.port = port;
    }

    /**
     * Registers a listener for the metadata header of each streaming session.
     */
    public void setMetadataListener(Consumer<Metadata> listener) {
        this.metadataListener = listener;
    }

    /**
     * The metadata header of the most recent streaming session, once received.
     */
    public Optional<Metadata> getMetadata() {
        return Optional.ofNullable(metadata);
    }

    @Override
    public synchronized void subscribe(Subscription subscription) {
        ensureOpen();
        ensureConnected();
        replaySubscriptions();
        send(ControlMessages.subscription(subscription));
        subscriptions.add(subscription);
        LOGGER.debug("[{}] Sent subscription for {} symbol(s)", name, subscription.symbols().size());
    }

    @Override
    public synchronized void start(RecordCallback callback, Consumer<Throwable> errorHandler) {
        ensureOpen();
        ensureConnected();
        replaySubscriptions();
        dispatchHandler.bind(callback, errorHandler);
        channel.config().setAutoRead(true);
        send(ControlMessages.START_SESSION);
        LOGGER.info("[{}] Session started", name);
    }

    @Override
    public synchronized void stop() {
        closeChannel();
    }

    @Override
    public synchronized void reconnect() {
        ensureOpen();
        closeChannel();
        subscriptions.clear();
        ensureConnected();
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        closeChannel();
        if (eventLoopGroup != null) {
            eventLoopGroup.shutdownGracefully();
            eventLoopGroup = null;
        }
        LOGGER.info("[{}] Transport closed", name);
    }

    public synchronized boolean isConnected() {
        return channel != null && channel.isActive();
    }

    // ==================== Connection ====================

    private void ensureConnected() {
        if (channel != null && channel.isActive()) {
            return;
        }
        if (eventLoopGroup == null) {
            eventLoopGroup = NettyEventLoopFactory.createEventLoopGroup(1, name + "-io");
        }

        RecordDispatchHandler handler = new RecordDispatchHandler(name, this::onMetadata);
        Bootstrap bootstrap = new Bootstrap()
            .group(eventLoopGroup)
            .channel(NettyEventLoopFactory.getClientChannelClass())
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS)
            .option(ChannelOption.TCP_NODELAY, true)
            .handler(new ChannelInitializer<>() {
                @Override
                protected void initChannel(Channel ch) {
                    ChannelPipeline pipeline = ch.pipeline();
                    pipeline.addLast(new StringEncoder(StandardCharsets.US_ASCII));
                    pipeline.addLast(new DbnFrameDecoder(name));
                    pipeline.addLast(handler);
                }
            });

        LOGGER.info("[{}] Connecting to {}:{}...", name, host, port);
        try {
            channel = bootstrap.connect(host, port).sync().channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("[" + name + "] Interrupted while connecting to " + host + ":" + port, e);
        } catch (Exception e) {
            throw new TransportException("[" + name + "] Failed to connect to " + host + ":" + port, e);
        }
        dispatchHandler = handler;
        subscriptionsSent = subscriptions.isEmpty();
        metadata = null;
        LOGGER.info("[{}] Connected to {}:{}", name, host, port);
    }

    private void replaySubscriptions() {
        if (subscriptionsSent) {
            return;
        }
        for (Subscription subscription : subscriptions) {
            send(ControlMessages.subscription(subscription));
        }
        subscriptionsSent = true;
        LOGGER.debug("[{}] Replayed {} subscription(s) on new connection", name, subscriptions.size());
    }

    private void send(String line) {
        ChannelFuture future = channel.writeAndFlush(line).awaitUninterruptibly();
        if (!future.isSuccess()) {
            throw new TransportException("[" + name + "] Failed to send control message", future.cause());
        }
    }

    private void closeChannel() {
        if (dispatchHandler != null) {
            dispatchHandler.unbind();
        }
        if (channel == null) {
            return;
        }
        if (channel.eventLoop().inEventLoop()) {
            channel.close();
        } else if (!channel.close().awaitUninterruptibly(CLOSE_TIMEOUT_MS)) {
            LOGGER.warn("[{}] Connection close did not complete within {} ms", name, CLOSE_TIMEOUT_MS);
        }
        channel = null;
        subscriptionsSent = false;
        LOGGER.info("[{}] Connection closed", name);
    }

    private void onMetadata(Metadata received) {
        metadata = received;
        Consumer<Metadata> listener = metadataListener;
        if (listener != null) {
            listener.accept(received);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new TransportException("[" + name + "] Transport is closed");
        }
    }
}
