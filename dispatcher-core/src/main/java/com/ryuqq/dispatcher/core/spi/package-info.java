/**
 * Service Provider Interfaces for the document store the publisher dispatches against.
 *
 * <p>Adapters (for example the in-memory adapter) implement these interfaces:</p>
 * <ul>
 *   <li>{@link com.ryuqq.dispatcher.core.spi.DocumentStore} - reads, batches and transactions</li>
 *   <li>{@link com.ryuqq.dispatcher.core.spi.DocumentWriteBatch} - atomic write-only batch</li>
 *   <li>{@link com.ryuqq.dispatcher.core.spi.DocumentTransaction} - snapshot reads with buffered writes</li>
 * </ul>
 *
 * <p>Handlers never see these interfaces directly. They work with
 * {@link com.ryuqq.dispatcher.core.context.ReadContext} and
 * {@link com.ryuqq.dispatcher.core.context.WriteContext}, which hide commit control.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.dispatcher.core.spi;
