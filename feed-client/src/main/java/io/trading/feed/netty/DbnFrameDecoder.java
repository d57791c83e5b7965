package io.trading.feed.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.trading.marketdata.dbn.codec.MetadataDecoder;
import io.trading.marketdata.dbn.error.DecodeException;
import io.trading.marketdata.dbn.error.FormatException;
import io.trading.marketdata.dbn.metadata.Metadata;
import io.trading.marketdata.dbn.model.RType;
import org.agrona.concurrent.UnsafeBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Frames a live DBN byte stream: one metadata header, emitted as {@link Metadata}, followed by
 * records, each emitted as a retained {@link ByteBuf} slice of exactly its length.
 *
 * <p>A record's length is its first byte times four. A length below the record header size
 * cannot be resynchronized and fails the channel.
 */
public class DbnFrameDecoder extends ByteToMessageDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(DbnFrameDecoder.class);

    /** Upper bound on a metadata header received from a gateway. */
    static final int MAX_METADATA_LENGTH = 16 * 1024 * 1024;

    private final String name;
    private final byte[] prelude = new byte[MetadataDecoder.preludeSize()];
    private boolean metadataRead;

    public DbnFrameDecoder(String name) {
        this.name = name;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        if (!metadataRead) {
            decodeMetadata(in, out);
            return;
        }

        int readable = in.readableBytes();
        if (readable < 1) {
            return;
        }
        int start = in.readerIndex();
        int length = in.getUnsignedByte(start) * RType.LENGTH_MULTIPLIER;
        if (length < RType.HEADER_SIZE) {
            int rtype = readable > 1 ? in.getUnsignedByte(start + 1) : 0;
            throw new DecodeException("Record length " + length + " is below the header size", rtype, length);
        }
        if (readable < length) {
            return;
        }
        out.add(in.readRetainedSlice(length));
    }

    private void decodeMetadata(ByteBuf in, List<Object> out) {
        if (in.readableBytes() < prelude.length) {
            return;
        }
        in.getBytes(in.readerIndex(), prelude);
        int frameLength = MetadataDecoder.frameLength(new UnsafeBuffer(prelude), 0);
        if (frameLength > MAX_METADATA_LENGTH) {
            throw new FormatException("Metadata header of " + frameLength + " bytes exceeds limit");
        }
        if (in.readableBytes() < frameLength) {
            return;
        }
        byte[] header = new byte[frameLength];
        in.readBytes(header);
        Metadata metadata = MetadataDecoder.decode(header);
        metadataRead = true;
        LOGGER.info("[{}] Received metadata: dataset={} schema={} version={}",
            name, metadata.dataset(), metadata.schema(), metadata.version());
        out.add(metadata);
    }

    boolean isMetadataRead() {
        return metadataRead;
    }
}
