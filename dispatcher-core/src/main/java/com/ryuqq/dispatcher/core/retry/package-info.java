/**
 * Retry policy, backoff and the retry decision.
 *
 * <p>{@link com.ryuqq.dispatcher.core.retry.RetryEvaluator} decides after each failed
 * attempt whether to sleep and run the next attempt or give up. Delays grow linearly
 * and are capped, see {@link com.ryuqq.dispatcher.core.retry.LinearBackoff}.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.dispatcher.core.retry;
