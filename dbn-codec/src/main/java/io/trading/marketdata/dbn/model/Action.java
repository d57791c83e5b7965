package io.trading.marketdata.dbn.model;

/**
 * Order book event action, stored on the wire as an ASCII character.
 */
public enum Action {
    ADD('A'),
    CANCEL('C'),
    MODIFY('M'),
    CLEAR('R'),
    TRADE('T'),
    FILL('F'),
    NONE('N');

    private final char code;

    Action(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }

    /**
     * Maps a wire character to an action, or null when the character is not a known action.
     */
    public static Action fromCode(char code) {
        for (Action action : values()) {
            if (action.code == code) {
                return action;
            }
        }
        return null;
    }
}
