/**
 * Handler variants and the subscriber that creates them.
 *
 * <p>{@link com.ryuqq.dispatcher.core.handler.DomainEventHandler} is sealed; every handler is
 * exactly one of simple, read, batch or transaction. The publisher picks the dispatch mode
 * from the set of variants present in one publish.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.dispatcher.core.handler;
