package io.trading.marketdata.dbn.symbology;

import io.trading.marketdata.dbn.error.NotFoundException;
import io.trading.marketdata.dbn.metadata.MappingInterval;
import io.trading.marketdata.dbn.metadata.Metadata;
import io.trading.marketdata.dbn.metadata.SymbolMapping;
import io.trading.marketdata.dbn.model.Record;
import io.trading.marketdata.dbn.model.SymbolMappingMsg;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Current instrument id to symbol mapping, typically maintained from the symbol mapping
 * records of a live session.
 *
 * <p>Safe for one writer and any number of concurrent readers.
 */
public final class PointInTimeSymbolMap {

    private final Map<Long, String> symbols = new ConcurrentHashMap<>();

    /**
     * Builds the mapping in effect on {@code date} from historical metadata.
     */
    public static PointInTimeSymbolMap fromMetadata(Metadata metadata, LocalDate date) {
        PointInTimeSymbolMap map = new PointInTimeSymbolMap();
        for (SymbolMapping mapping : metadata.mappings()) {
            for (MappingInterval interval : mapping.intervals()) {
                if (interval.contains(date)) {
                    MappingResolver.resolve(mapping, interval, map::insert);
                }
            }
        }
        return map;
    }

    /**
     * Applies a record. Only {@link SymbolMappingMsg} changes the map; other records are ignored.
     */
    public void onRecord(Record record) {
        if (record instanceof SymbolMappingMsg mapping) {
            symbols.put(mapping.instrumentId(), mapping.stypeOutSymbol());
        }
    }

    public void insert(long instrumentId, String symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("symbol cannot be null");
        }
        symbols.put(instrumentId, symbol);
    }

    public Optional<String> find(long instrumentId) {
        return Optional.ofNullable(symbols.get(instrumentId));
    }

    public Optional<String> find(Record record) {
        return find(record.instrumentId());
    }

    /**
     * @throws NotFoundException if the instrument has no mapping
     */
    public String at(long instrumentId) {
        return find(instrumentId).orElseThrow(() -> new NotFoundException(
            "No symbol for instrument " + instrumentId));
    }

    public String at(Record record) {
        return at(record.instrumentId());
    }

    public int size() {
        return symbols.size();
    }

    public boolean isEmpty() {
        return symbols.isEmpty();
    }
}
