package io.trading.feed.netty;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.DecoderException;
import io.trading.marketdata.dbn.codec.DbnRecordEncoder;
import io.trading.marketdata.dbn.codec.MetadataEncoder;
import io.trading.marketdata.dbn.error.DecodeException;
import io.trading.marketdata.dbn.error.FormatException;
import io.trading.marketdata.dbn.metadata.Metadata;
import io.trading.marketdata.dbn.model.RType;
import io.trading.marketdata.dbn.model.RecordHeader;
import io.trading.marketdata.dbn.model.Schema;
import io.trading.marketdata.dbn.model.SystemMsg;
import io.trading.marketdata.dbn.model.TradeMsg;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for DbnFrameDecoder.
 */
class DbnFrameDecoderTest {

    static Metadata metadata() {
        return Metadata.builder()
            .dataset("XNAS.ITCH")
            .schema(Schema.TRADES)
            .start(1_704_153_600_000_000_000L)
            .symbols(List.of("NVDA"))
            .build();
    }

    static byte[] trade(long sequence) {
        return DbnRecordEncoder.encode(new TradeMsg(RecordHeader.of(RType.MBP_0, 1, 11667, 1_000L),
            490_050_000_000L, 100, 'T', 'B', 0x80, 0, 2_000L, 0, sequence));
    }

    static byte[] heartbeat() {
        return DbnRecordEncoder.encode(new SystemMsg(RecordHeader.of(RType.SYSTEM, 0, 0, 3_000L), "Heartbeat", 0));
    }

    static byte[] concat(byte[]... parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] part : parts) {
            out.writeBytes(part);
        }
        return out.toByteArray();
    }

    @Test
    void testMetadataThenRecords() {
        EmbeddedChannel channel = new EmbeddedChannel(new DbnFrameDecoder("test"));

        byte[] stream = concat(MetadataEncoder.encode(metadata()), trade(1), heartbeat());
        assertTrue(channel.writeInbound(Unpooled.wrappedBuffer(stream)));

        Metadata decoded = channel.readInbound();
        assertEquals("XNAS.ITCH", decoded.dataset());
        ByteBuf first = channel.readInbound();
        ByteBuf second = channel.readInbound();
        assertEquals(48, first.readableBytes());
        assertEquals(RType.MBP_0.code(), first.getUnsignedByte(1));
        assertEquals(RType.SYSTEM.size(), second.readableBytes());
        assertEquals(RType.SYSTEM.code(), second.getUnsignedByte(1));
        assertNull(channel.readInbound());
        first.release();
        second.release();
        assertFalse(channel.finish());
    }

    @Test
    void testReassemblesSplitFrames() {
        EmbeddedChannel channel = new EmbeddedChannel(new DbnFrameDecoder("test"));
        byte[] stream = concat(MetadataEncoder.encode(metadata()), trade(1), trade(2));

        for (byte b : stream) {
            channel.writeInbound(Unpooled.wrappedBuffer(new byte[]{b}));
        }

        assertInstanceOf(Metadata.class, channel.readInbound());
        for (int i = 0; i < 2; i++) {
            ByteBuf frame = channel.readInbound();
            assertEquals(48, frame.readableBytes());
            frame.release();
        }
        assertNull(channel.readInbound());
    }

    @Test
    void testIncompleteRecordWaitsForMoreBytes() {
        EmbeddedChannel channel = new EmbeddedChannel(new DbnFrameDecoder("test"));
        byte[] record = trade(1);

        channel.writeInbound(Unpooled.wrappedBuffer(MetadataEncoder.encode(metadata())));
        channel.writeInbound(Unpooled.wrappedBuffer(record, 0, 30));

        assertInstanceOf(Metadata.class, channel.readInbound());
        assertNull(channel.readInbound());

        channel.writeInbound(Unpooled.wrappedBuffer(record, 30, record.length - 30));
        ByteBuf frame = channel.readInbound();
        assertEquals(48, frame.readableBytes());
        frame.release();
    }

    @Test
    void testLengthBelowHeaderSizeFails() {
        EmbeddedChannel channel = new EmbeddedChannel(new DbnFrameDecoder("test"));
        channel.writeInbound(Unpooled.wrappedBuffer(MetadataEncoder.encode(metadata())));
        channel.readInbound();

        DecoderException error = assertThrows(DecoderException.class,
            () -> channel.writeInbound(Unpooled.wrappedBuffer(new byte[]{2, 0x00, 0, 0, 0, 0, 0, 0})));

        DecodeException cause = assertInstanceOf(DecodeException.class, error.getCause());
        assertEquals(8, cause.getLength());
    }

    @Test
    void testBadMagicFails() {
        EmbeddedChannel channel = new EmbeddedChannel(new DbnFrameDecoder("test"));
        byte[] notDbn = "HTTP/1.1 400 Bad Request\r\n".getBytes(StandardCharsets.US_ASCII);

        DecoderException error = assertThrows(DecoderException.class,
            () -> channel.writeInbound(Unpooled.wrappedBuffer(notDbn)));

        assertInstanceOf(FormatException.class, error.getCause());
    }
}
