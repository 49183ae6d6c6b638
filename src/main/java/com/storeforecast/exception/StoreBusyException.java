package com.storeforecast.exception;

/**
 * Another training or prediction holds the store lock. Callers may retry later.
 */
public class StoreBusyException extends ForecastPipelineException {
    public StoreBusyException(String storeId, String operation) {
        super("STORE_BUSY", "Store '" + storeId + "' is busy, " + operation + " rejected. Retry later.");
    }
}
