package io.trading.marketdata.dbn.codec;

/**
 * Text field widths of the error and system records.
 */
final class GatewayMessageLayout {

    static final int ERR_WIDTH = 302;
    static final int MSG_WIDTH = 303;

    private GatewayMessageLayout() {}
}
