package com.storeforecast.store;

/**
 * A held store lock. Closing releases it.
 */
public interface StoreLease extends AutoCloseable {

    String storeId();

    boolean exclusive();

    @Override
    void close();
}
