/**
 * Error types raised by stores and by the publisher.
 *
 * <ul>
 *   <li>{@link com.ryuqq.dispatcher.core.error.StoreException} with a
 *       {@link com.ryuqq.dispatcher.core.error.StoreErrorCode} for store failures</li>
 *   <li>{@link com.ryuqq.dispatcher.core.error.RetryableError} for errors that classify themselves</li>
 *   <li>{@link com.ryuqq.dispatcher.core.error.DomainEventDispatchException} for checked handler failures</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.dispatcher.core.error;
