package io.trading.feed.file;

import io.trading.feed.api.KeepGoing;
import io.trading.feed.api.RecordHandler;
import io.trading.marketdata.dbn.codec.DbnRecordDecoder;
import io.trading.marketdata.dbn.codec.MetadataDecoder;
import io.trading.marketdata.dbn.error.DecodeException;
import io.trading.marketdata.dbn.error.FormatException;
import io.trading.marketdata.dbn.error.NotFoundException;
import io.trading.marketdata.dbn.error.UsageException;
import io.trading.marketdata.dbn.metadata.Metadata;
import io.trading.marketdata.dbn.model.RType;
import io.trading.marketdata.dbn.model.Record;
import org.agrona.concurrent.UnsafeBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Reads an uncompressed DBN file: the metadata header once at open, then records in file order.
 *
 * <p>Not thread-safe. {@link #reset()} rewinds to the first record without re-reading the header,
 * so a replay after a reset yields the same records again.
 */
public final class DbnFileSession implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(DbnFileSession.class);

    private static final int READ_BUFFER_SIZE = 64 * 1024;

    private final Path path;
    private final FileChannel channel;
    private final Metadata metadata;
    private final long recordsOffset;
    private final byte[] scratch = new byte[RType.MAX_RECORD_SIZE];
    private final UnsafeBuffer scratchBuffer = new UnsafeBuffer(scratch);

    private InputStream input;
    private long recordCount;
    private boolean closed;

    private DbnFileSession(Path path, FileChannel channel, InputStream input, Metadata metadata, long recordsOffset) {
        this.path = path;
        this.channel = channel;
        this.input = input;
        this.metadata = metadata;
        this.recordsOffset = recordsOffset;
    }

    /**
     * Opens {@code path} and parses its metadata header.
     *
     * @throws NotFoundException if the file does not exist
     * @throws FormatException   if the metadata header cannot be parsed
     */
    public static DbnFileSession open(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (!Files.exists(path)) {
            throw new NotFoundException("DBN file not found: " + path);
        }

        FileChannel channel;
        try {
            channel = FileChannel.open(path, StandardOpenOption.READ);
        } catch (NoSuchFileException e) {
            throw new NotFoundException("DBN file not found: " + path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open " + path, e);
        }

        try {
            InputStream input = newInput(channel);
            byte[] prelude = new byte[MetadataDecoder.preludeSize()];
            if (readFully(input, prelude, 0, prelude.length) < prelude.length) {
                throw new FormatException("Truncated metadata prelude in " + path);
            }
            int frameLength = MetadataDecoder.frameLength(new UnsafeBuffer(prelude), 0);
            long fileSize = channel.size();
            if (frameLength > fileSize) {
                throw new FormatException("Truncated metadata header in " + path + ": need "
                    + frameLength + " bytes, file has " + fileSize);
            }
            byte[] header = new byte[frameLength];
            System.arraycopy(prelude, 0, header, 0, prelude.length);
            int remaining = frameLength - prelude.length;
            if (readFully(input, header, prelude.length, remaining) < remaining) {
                throw new FormatException("Truncated metadata header in " + path);
            }
            Metadata metadata = MetadataDecoder.decode(header);
            LOGGER.info("Opened {}: dataset={} schema={} version={}",
                path, metadata.dataset(), metadata.schema(), metadata.version());
            return new DbnFileSession(path, channel, input, metadata, frameLength);
        } catch (IOException e) {
            closeOnFailure(channel, e);
            throw new UncheckedIOException("Failed to read metadata from " + path, e);
        } catch (RuntimeException e) {
            closeOnFailure(channel, e);
            throw e;
        }
    }

    public Metadata getMetadata() {
        return metadata;
    }

    public Path getPath() {
        return path;
    }

    /**
     * Reads the next record.
     *
     * @return the record, or empty at end of file
     * @throws DecodeException if the trailing record is truncated or a length is below the header size
     */
    public Optional<Record> nextRecord() {
        ensureOpen();
        try {
            int first = input.read();
            if (first < 0) {
                return Optional.empty();
            }
            int length = first * RType.LENGTH_MULTIPLIER;
            scratch[0] = (byte) first;
            if (length < RType.HEADER_SIZE) {
                int rtype = input.read();
                throw new DecodeException("Record length " + length + " is below the header size in " + path,
                    Math.max(rtype, 0), length);
            }
            int body = length - 1;
            int read = readFully(input, scratch, 1, body);
            if (read < body) {
                int rtype = read > 0 ? scratch[1] & 0xFF : 0;
                throw new DecodeException("Truncated record in " + path + ": expected " + length
                    + " bytes, found " + (read + 1), rtype, read + 1);
            }
            Record record = DbnRecordDecoder.decode(scratchBuffer, 0, length, scratch[1] & 0xFF);
            recordCount++;
            return Optional.of(record);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read record from " + path, e);
        }
    }

    public long replay(RecordHandler onRecord) {
        return replay(onRecord, null);
    }

    /**
     * Passes the metadata to {@code onMetadata} when given, then every remaining record to
     * {@code onRecord} until it returns {@link KeepGoing#STOP} or the file ends.
     *
     * @return number of records delivered
     */
    public long replay(RecordHandler onRecord, Consumer<Metadata> onMetadata) {
        if (onRecord == null) {
            throw new IllegalArgumentException("onRecord cannot be null");
        }
        ensureOpen();
        if (onMetadata != null) {
            onMetadata.accept(metadata);
        }
        long delivered = 0;
        Optional<Record> next = nextRecord();
        while (next.isPresent()) {
            delivered++;
            if (onRecord.onRecord(next.get()) == KeepGoing.STOP) {
                break;
            }
            next = nextRecord();
        }
        LOGGER.debug("Replayed {} record(s) from {}", delivered, path);
        return delivered;
    }

    /**
     * Rewinds to the first record. The record count restarts at zero.
     */
    public void reset() {
        ensureOpen();
        try {
            channel.position(recordsOffset);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to rewind " + path, e);
        }
        input = newInput(channel);
        recordCount = 0;
    }

    /**
     * Records read since open or the last {@link #reset()}.
     */
    public long recordCount() {
        return recordCount;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            channel.close();
        } catch (IOException e) {
            LOGGER.warn("Failed to close {}", path, e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new UsageException("File session is closed: " + path);
        }
    }

    private static InputStream newInput(FileChannel channel) {
        return new BufferedInputStream(Channels.newInputStream(channel), READ_BUFFER_SIZE);
    }

    private static int readFully(InputStream in, byte[] dst, int offset, int length) throws IOException {
        int total = 0;
        while (total < length) {
            int n = in.read(dst, offset + total, length - total);
            if (n < 0) {
                break;
            }
            total += n;
        }
        return total;
    }

    private static void closeOnFailure(FileChannel channel, Exception failure) {
        try {
            channel.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }
}
