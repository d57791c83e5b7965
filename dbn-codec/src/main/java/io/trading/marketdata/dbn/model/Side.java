package io.trading.marketdata.dbn.model;

/**
 * Side of an order or trade aggressor, stored on the wire as an ASCII character.
 */
public enum Side {
    ASK('A'),
    BID('B'),
    NONE('N');

    private final char code;

    Side(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }

    /**
     * Maps a wire character to a side. Unrecognized characters map to NONE.
     */
    public static Side fromCode(char code) {
        return switch (code) {
            case 'A' -> ASK;
            case 'B' -> BID;
            default -> NONE;
        };
    }
}
