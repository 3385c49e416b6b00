package com.tradingarena.common.exception;

/**
 * Every market data and news fetch for a symbol set failed, so no context could be built.
 */
public class DataUnavailableException extends RuntimeException {

    private final String symbolKey;

    public DataUnavailableException(String symbolKey, String message) {
        super("[" + symbolKey + "] " + message);
        this.symbolKey = symbolKey;
    }

    public DataUnavailableException(String symbolKey, String message, Throwable cause) {
        super("[" + symbolKey + "] " + message, cause);
        this.symbolKey = symbolKey;
    }

    public String getSymbolKey() {
        return symbolKey;
    }
}
