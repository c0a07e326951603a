package com.fastchat.memory.exception;

import java.util.Map;

public class StoreUnavailableException extends MemoryException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(MemoryErrorCode.STORE_UNAVAILABLE, message, Map.of(), cause);
    }

    private StoreUnavailableException(MemoryErrorCode code, String message) {
        super(code, message);
    }

    public static StoreUnavailableException notInitialized(String component) {
        return new StoreUnavailableException(MemoryErrorCode.NOT_INITIALIZED, component + " not initialized");
    }
}
