package com.marketsim.infra;

import com.marketsim.api.Fill;

/**
 * Consumer of published fills. Called only from the fill publisher's thread.
 */
@FunctionalInterface
public interface FillSink {

    void onFill(Fill fill);

    default void close() {
    }
}
