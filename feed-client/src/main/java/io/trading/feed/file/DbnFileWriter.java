package io.trading.feed.file;

import io.trading.marketdata.dbn.codec.DbnRecordEncoder;
import io.trading.marketdata.dbn.codec.MetadataEncoder;
import io.trading.marketdata.dbn.error.UsageException;
import io.trading.marketdata.dbn.metadata.Metadata;
import io.trading.marketdata.dbn.model.RType;
import io.trading.marketdata.dbn.model.Record;
import org.agrona.concurrent.UnsafeBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes an uncompressed DBN file: the metadata header, then encoded records.
 */
public final class DbnFileWriter implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(DbnFileWriter.class);

    private final Path path;
    private final OutputStream output;
    private final byte[] scratch = new byte[RType.MAX_RECORD_SIZE];
    private final UnsafeBuffer scratchBuffer = new UnsafeBuffer(scratch);

    private long recordCount;
    private boolean closed;

    private DbnFileWriter(Path path, OutputStream output) {
        this.path = path;
        this.output = output;
    }

    /**
     * Creates or truncates {@code path} and writes the metadata header.
     */
    public static DbnFileWriter create(Path path, Metadata metadata) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (metadata == null) {
            throw new IllegalArgumentException("metadata cannot be null");
        }
        byte[] header = MetadataEncoder.encode(metadata);
        OutputStream output = null;
        try {
            output = new BufferedOutputStream(Files.newOutputStream(path));
            output.write(header);
        } catch (IOException e) {
            if (output != null) {
                try {
                    output.close();
                } catch (IOException closeFailure) {
                    e.addSuppressed(closeFailure);
                }
            }
            throw new UncheckedIOException("Failed to create " + path, e);
        }
        LOGGER.info("Created {}: dataset={} schema={} version={}",
            path, metadata.dataset(), metadata.schema(), metadata.version());
        return new DbnFileWriter(path, output);
    }

    public void write(Record record) {
        if (closed) {
            throw new UsageException("Writer is closed: " + path);
        }
        int size = DbnRecordEncoder.encode(record, scratchBuffer, 0);
        try {
            output.write(scratch, 0, size);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write record to " + path, e);
        }
        recordCount++;
    }

    public void flush() {
        try {
            output.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to flush " + path, e);
        }
    }

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
            output.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close " + path, e);
        }
        LOGGER.debug("Closed {} after {} record(s)", path, recordCount);
    }
}
