/**
 * Handler-facing views of the document store.
 *
 * <p>{@link com.ryuqq.dispatcher.core.context.ReadContext} is given to the prepare phase,
 * {@link com.ryuqq.dispatcher.core.context.WriteContext} to the handle phase.
 * Both look the same to a handler whether the dispatch runs as a batch or as a transaction.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.dispatcher.core.context;
