package io.trading.marketdata.dbn.metadata;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.trading.marketdata.dbn.model.SType;
import io.trading.marketdata.dbn.model.Schema;
import io.trading.marketdata.dbn.model.UnixNanos;

import java.util.ArrayList;
import java.util.List;

/**
 * Header information describing the records that follow in a DBN stream.
 *
 * @param version       DBN encoding version, 1 to 3
 * @param dataset       dataset code
 * @param schema        record schema, or null when the stream mixes schemas
 * @param start         start of the query range, nanoseconds since the epoch
 * @param end           end of the query range, or {@link UnixNanos#UNDEF_TIMESTAMP}
 * @param limit         maximum number of records requested, 0 for none
 * @param stypeIn       input symbology, or null when mixed
 * @param stypeOut      output symbology
 * @param tsOut         whether records carry a gateway send timestamp suffix
 * @param symbolCstrLen width of fixed-length symbol strings
 * @param symbols       requested symbols
 * @param partial       symbols that did not resolve for the whole range
 * @param notFound      symbols that did not resolve at all
 * @param mappings      symbol mappings over the query range
 */
public record Metadata(
    @JsonProperty("version") int version,
    @JsonProperty("dataset") String dataset,
    @JsonProperty("schema") Schema schema,
    @JsonProperty("start") long start,
    @JsonProperty("end") long end,
    @JsonProperty("limit") long limit,
    @JsonProperty("stype_in") SType stypeIn,
    @JsonProperty("stype_out") SType stypeOut,
    @JsonProperty("ts_out") boolean tsOut,
    @JsonProperty("symbol_cstr_len") int symbolCstrLen,
    @JsonProperty("symbols") List<String> symbols,
    @JsonProperty("partial") List<String> partial,
    @JsonProperty("not_found") List<String> notFound,
    @JsonProperty("mappings") List<SymbolMapping> mappings
) {
    public static final int MIN_VERSION = 1;
    public static final int MAX_VERSION = 3;

    /** Symbol string width used by version 1. */
    public static final int V1_SYMBOL_CSTR_LEN = 22;
    /** Symbol string width used by versions 2 and 3. */
    public static final int SYMBOL_CSTR_LEN = 71;

    /** Width of the dataset field. */
    public static final int DATASET_CSTR_LEN = 16;

    public Metadata {
        if (version < MIN_VERSION || version > MAX_VERSION) {
            throw new IllegalArgumentException("Unsupported DBN version: " + version);
        }
        if (dataset == null) {
            throw new IllegalArgumentException("dataset cannot be null");
        }
        if (stypeOut == null) {
            throw new IllegalArgumentException("stypeOut cannot be null");
        }
        if (version == 1 && symbolCstrLen != V1_SYMBOL_CSTR_LEN) {
            throw new IllegalArgumentException("Version 1 requires a symbol width of " + V1_SYMBOL_CSTR_LEN);
        }
        if (symbolCstrLen <= 0) {
            throw new IllegalArgumentException("symbolCstrLen must be positive: " + symbolCstrLen);
        }
        symbols = symbols == null ? List.of() : List.copyOf(symbols);
        partial = partial == null ? List.of() : List.copyOf(partial);
        notFound = notFound == null ? List.of() : List.copyOf(notFound);
        mappings = mappings == null ? List.of() : List.copyOf(mappings);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .version(version)
            .dataset(dataset)
            .schema(schema)
            .start(start)
            .end(end)
            .limit(limit)
            .stypeIn(stypeIn)
            .stypeOut(stypeOut)
            .tsOut(tsOut)
            .symbolCstrLen(symbolCstrLen)
            .symbols(symbols)
            .partial(partial)
            .notFound(notFound)
            .mappings(mappings);
    }

    public static class Builder {
        private int version = MAX_VERSION;
        private String dataset;
        private Schema schema;
        private long start;
        private long end = UnixNanos.UNDEF_TIMESTAMP;
        private long limit;
        private SType stypeIn = SType.RAW_SYMBOL;
        private SType stypeOut = SType.INSTRUMENT_ID;
        private boolean tsOut;
        private Integer symbolCstrLen;
        private final List<String> symbols = new ArrayList<>();
        private final List<String> partial = new ArrayList<>();
        private final List<String> notFound = new ArrayList<>();
        private final List<SymbolMapping> mappings = new ArrayList<>();

        public Builder version(int version) {
            this.version = version;
            return this;
        }

        public Builder dataset(String dataset) {
            this.dataset = dataset;
            return this;
        }

        public Builder schema(Schema schema) {
            this.schema = schema;
            return this;
        }

        public Builder start(long start) {
            this.start = start;
            return this;
        }

        public Builder end(long end) {
            this.end = end;
            return this;
        }

        public Builder limit(long limit) {
            this.limit = limit;
            return this;
        }

        public Builder stypeIn(SType stypeIn) {
            this.stypeIn = stypeIn;
            return this;
        }

        public Builder stypeOut(SType stypeOut) {
            this.stypeOut = stypeOut;
            return this;
        }

        public Builder tsOut(boolean tsOut) {
            this.tsOut = tsOut;
            return this;
        }

        public Builder symbolCstrLen(int symbolCstrLen) {
            this.symbolCstrLen = symbolCstrLen;
            return this;
        }

        public Builder symbols(List<String> symbols) {
            this.symbols.clear();
            this.symbols.addAll(symbols);
            return this;
        }

        public Builder partial(List<String> partial) {
            this.partial.clear();
            this.partial.addAll(partial);
            return this;
        }

        public Builder notFound(List<String> notFound) {
            this.notFound.clear();
            this.notFound.addAll(notFound);
            return this;
        }

        public Builder mappings(List<SymbolMapping> mappings) {
            this.mappings.clear();
            this.mappings.addAll(mappings);
            return this;
        }

        public Builder addMapping(SymbolMapping mapping) {
            this.mappings.add(mapping);
            return this;
        }

        public Metadata build() {
            int width = symbolCstrLen != null
                ? symbolCstrLen
                : (version == 1 ? V1_SYMBOL_CSTR_LEN : SYMBOL_CSTR_LEN);
            return new Metadata(version, dataset, schema, start, end, limit, stypeIn, stypeOut, tsOut,
                width, symbols, partial, notFound, mappings);
        }
    }
}
