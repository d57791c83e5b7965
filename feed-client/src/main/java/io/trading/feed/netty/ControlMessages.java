package io.trading.feed.netty;

import io.trading.feed.live.Subscription;

/**
 * Plain-text control lines sent to the live gateway, one per line.
 */
public final class ControlMessages {

    public static final String START_SESSION = "start_session\n";

    private ControlMessages() {}

    /**
     * Formats {@code dataset=..|schema=..|stype_in=..|symbols=a,b|snapshot=0|1}.
     */
    public static String subscription(Subscription subscription) {
        StringBuilder sb = new StringBuilder(64);
        sb.append("dataset=").append(subscription.dataset())
            .append("|schema=").append(subscription.schema().schemaName())
            .append("|stype_in=").append(subscription.stypeIn().stypeName())
            .append("|symbols=").append(String.join(",", subscription.symbols()))
            .append("|snapshot=").append(subscription.snapshot() ? 1 : 0)
            .append('\n');
        return sb.toString();
    }
}
