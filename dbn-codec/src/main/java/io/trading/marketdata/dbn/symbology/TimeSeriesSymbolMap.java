package io.trading.marketdata.dbn.symbology;

import io.trading.marketdata.dbn.error.NotFoundException;
import io.trading.marketdata.dbn.metadata.MappingInterval;
import io.trading.marketdata.dbn.metadata.Metadata;
import io.trading.marketdata.dbn.metadata.SymbolMapping;
import io.trading.marketdata.dbn.model.Record;
import io.trading.marketdata.dbn.model.UnixNanos;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Instrument id to symbol lookups that vary by date, built from the symbol mappings of
 * a historical {@link Metadata}.
 *
 * <p>Not thread-safe while being populated; safe for concurrent reads once built.
 */
public final class TimeSeriesSymbolMap {

    private record Entry(LocalDate endDate, String symbol) {}

    private final Map<Long, NavigableMap<LocalDate, Entry>> byInstrument = new HashMap<>();
    private int size;

    public TimeSeriesSymbolMap() {
    }

    public static TimeSeriesSymbolMap fromMetadata(Metadata metadata) {
        TimeSeriesSymbolMap map = new TimeSeriesSymbolMap();
        for (SymbolMapping mapping : metadata.mappings()) {
            for (MappingInterval interval : mapping.intervals()) {
                MappingResolver.resolve(mapping, interval,
                    (id, symbol) -> map.insert(id, interval.startDate(), interval.endDate(), symbol));
            }
        }
        return map;
    }

    /**
     * Maps {@code instrumentId} to {@code symbol} for dates in {@code [startDate, endDate)}.
     * Empty ranges are ignored.
     */
    public void insert(long instrumentId, LocalDate startDate, LocalDate endDate, String symbol) {
        if (startDate == null || endDate == null || symbol == null) {
            throw new IllegalArgumentException("startDate, endDate and symbol are required");
        }
        if (!startDate.isBefore(endDate)) {
            return;
        }
        Entry previous = byInstrument
            .computeIfAbsent(instrumentId, id -> new TreeMap<>())
            .put(startDate, new Entry(endDate, symbol));
        if (previous == null) {
            size++;
        }
    }

    /**
     * Symbol of {@code instrumentId} on {@code date}.
     */
    public Optional<String> find(LocalDate date, long instrumentId) {
        NavigableMap<LocalDate, Entry> intervals = byInstrument.get(instrumentId);
        if (intervals == null) {
            return Optional.empty();
        }
        Map.Entry<LocalDate, Entry> floor = intervals.floorEntry(date);
        if (floor == null || !date.isBefore(floor.getValue().endDate())) {
            return Optional.empty();
        }
        return Optional.of(floor.getValue().symbol());
    }

    /**
     * Symbol of the record's instrument on the UTC date of its event timestamp.
     */
    public Optional<String> find(Record record) {
        return UnixNanos.toUtcDate(record.tsEvent())
            .flatMap(date -> find(date, record.instrumentId()));
    }

    /**
     * @throws NotFoundException if no interval covers the date
     */
    public String at(LocalDate date, long instrumentId) {
        return find(date, instrumentId).orElseThrow(() -> new NotFoundException(
            "No symbol for instrument " + instrumentId + " on " + date));
    }

    public String at(Record record) {
        return find(record).orElseThrow(() -> new NotFoundException(
            "No symbol for instrument " + record.instrumentId() + " at " + record.tsEvent()));
    }

    /**
     * Number of intervals held.
     */
    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }
}
