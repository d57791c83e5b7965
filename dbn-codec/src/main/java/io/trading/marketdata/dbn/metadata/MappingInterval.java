package io.trading.marketdata.dbn.metadata;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * A symbol that applies from {@code startDate} (inclusive) to {@code endDate} (exclusive).
 */
public record MappingInterval(
    @JsonProperty("start_date") LocalDate startDate,
    @JsonProperty("end_date") LocalDate endDate,
    @JsonProperty("symbol") String symbol
) {
    public MappingInterval {
        if (startDate == null || endDate == null) {
            throw new IllegalArgumentException("interval dates cannot be null");
        }
        if (symbol == null) {
            throw new IllegalArgumentException("symbol cannot be null");
        }
    }

    /**
     * True when the interval covers no dates.
     */
    public boolean empty() {
        return !startDate.isBefore(endDate);
    }

    /**
     * True when {@code date} falls within {@code [startDate, endDate)}.
     */
    public boolean contains(LocalDate date) {
        return !date.isBefore(startDate) && date.isBefore(endDate);
    }
}
