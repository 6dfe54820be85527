package com.ryuqq.dispatcher.core.spi;

/**
 * Work executed inside a {@link DocumentStore#runTransaction(TransactionFunction)} call.
 *
 * @param <T> result type
 * @author Dispatcher Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TransactionFunction<T> {

    T apply(DocumentTransaction transaction) throws Exception;
}
