/**
 * Contract tests for {@link com.ryuqq.dispatcher.core.spi.DocumentStore} adapters.
 *
 * @since 1.0.0
 */
package com.ryuqq.dispatcher.testkit.contract;
