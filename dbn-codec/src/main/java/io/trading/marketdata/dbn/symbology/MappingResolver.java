package io.trading.marketdata.dbn.symbology;

import io.trading.marketdata.dbn.metadata.MappingInterval;
import io.trading.marketdata.dbn.metadata.SymbolMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.BiConsumer;

/**
 * Turns a metadata mapping interval into an (instrument id, symbol) pair. Whichever side
 * of the mapping is a numeric instrument id becomes the key.
 */
final class MappingResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(MappingResolver.class);

    private static final long MAX_INSTRUMENT_ID = 0xFFFF_FFFFL;

    private MappingResolver() {}

    /**
     * Resolves one interval and passes the pair to {@code sink}. Empty intervals and
     * intervals with no numeric side are skipped.
     */
    static void resolve(SymbolMapping mapping, MappingInterval interval, BiConsumer<Long, String> sink) {
        if (interval.empty() || interval.symbol().isEmpty()) {
            return;
        }
        Long id = parseInstrumentId(interval.symbol());
        if (id != null) {
            sink.accept(id, mapping.rawSymbol());
            return;
        }
        id = parseInstrumentId(mapping.rawSymbol());
        if (id != null) {
            sink.accept(id, interval.symbol());
            return;
        }
        LOGGER.warn("Skipping mapping {} -> {}: neither side is an instrument id",
            mapping.rawSymbol(), interval.symbol());
    }

    static Long parseInstrumentId(String value) {
        if (value.isEmpty() || value.length() > 10) {
            return null;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return null;
            }
        }
        long id = Long.parseLong(value);
        return id <= MAX_INSTRUMENT_ID ? id : null;
    }
}
