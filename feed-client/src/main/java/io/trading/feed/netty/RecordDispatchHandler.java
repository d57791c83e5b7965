package io.trading.feed.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.DecoderException;
import io.trading.feed.api.KeepGoing;
import io.trading.feed.live.RecordCallback;
import io.trading.marketdata.dbn.codec.RawRecord;
import io.trading.marketdata.dbn.error.TransportException;
import io.trading.marketdata.dbn.metadata.Metadata;
import io.trading.marketdata.dbn.model.RType;
import org.agrona.concurrent.UnsafeBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Hands framed records to the bound {@link RecordCallback} and routes channel failures to the
 * bound error handler.
 *
 * <p>Each record is copied into one reusable scratch buffer, so the {@link RawRecord} passed to
 * the callback is only valid for the duration of the call. Once the callback returns
 * {@link KeepGoing#STOP}, or the handler is unbound, reading pauses and later records are dropped.
 */
public class RecordDispatchHandler extends ChannelInboundHandlerAdapter {

    private static final Logger LOGGER = LoggerFactory.getLogger(RecordDispatchHandler.class);

    private final String name;
    private final Consumer<Metadata> metadataHandler;
    private final byte[] scratch = new byte[RType.MAX_RECORD_SIZE];
    private final UnsafeBuffer scratchBuffer = new UnsafeBuffer(scratch);

    private volatile RecordCallback callback;
    private volatile Consumer<Throwable> errorHandler;
    private volatile boolean stopped;
    private volatile boolean errorReported;

    public RecordDispatchHandler(String name, Consumer<Metadata> metadataHandler) {
        this.name = name;
        this.metadataHandler = metadataHandler;
    }

    /**
     * Starts delivering records and failures to the given handlers.
     */
    public void bind(RecordCallback callback, Consumer<Throwable> errorHandler) {
        this.errorHandler = errorHandler;
        this.callback = callback;
        this.stopped = false;
    }

    /**
     * Stops delivery. A channel closed after this is not reported as an error.
     */
    public void unbind() {
        stopped = true;
        callback = null;
    }

    public boolean isStopped() {
        return stopped;
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (msg instanceof Metadata metadata) {
            if (metadataHandler != null) {
                metadataHandler.accept(metadata);
            }
            return;
        }
        if (!(msg instanceof ByteBuf)) {
            ctx.fireChannelRead(msg);
            return;
        }

        ByteBuf frame = (ByteBuf) msg;
        try {
            RecordCallback current = callback;
            if (stopped || current == null) {
                LOGGER.debug("[{}] Dropping record received while not streaming", name);
                return;
            }
            int length = frame.readableBytes();
            frame.getBytes(frame.readerIndex(), scratch, 0, length);
            RawRecord raw = RawRecord.wrap(scratchBuffer, 0, length);
            if (current.onRecord(raw) == KeepGoing.STOP) {
                stopped = true;
                ctx.channel().config().setAutoRead(false);
                LOGGER.info("[{}] Record callback requested stop; pausing reads", name);
            }
        } finally {
            frame.release();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        Throwable error = cause instanceof DecoderException && cause.getCause() != null
            ? cause.getCause()
            : cause;
        LOGGER.error("[{}] Channel failure", name, error);
        report(new TransportException("[" + name + "] Channel failure: " + error.getMessage(), error));
        ctx.close();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (!stopped) {
            LOGGER.warn("[{}] Connection closed by gateway", name);
            report(new TransportException("[" + name + "] Connection closed by gateway"));
        }
        super.channelInactive(ctx);
    }

    private void report(TransportException failure) {
        Consumer<Throwable> handler = errorHandler;
        if (errorReported || handler == null) {
            return;
        }
        errorReported = true;
        handler.accept(failure);
    }
}
