package com.steward.access.store;

import java.util.function.Supplier;

/**
 * Runs work atomically against the grant and entity stores.
 *
 * <p>If {@code work} throws, nothing it wrote is kept and the exception propagates unchanged.
 */
public interface TransactionRunner {

    <T> T inTransaction(Supplier<T> work);
}
