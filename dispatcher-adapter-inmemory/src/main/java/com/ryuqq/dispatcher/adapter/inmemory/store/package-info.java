/**
 * In-memory document store adapter.
 *
 * <p>Reference implementation of the {@link com.ryuqq.dispatcher.core.spi.DocumentStore} SPI
 * used by tests and local runs. See {@link com.ryuqq.dispatcher.adapter.inmemory.store.InMemoryDocumentStore}.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.dispatcher.adapter.inmemory.store;
