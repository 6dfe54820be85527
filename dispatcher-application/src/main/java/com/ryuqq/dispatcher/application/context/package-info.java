/**
 * Adapters from the store SPI to the handler-facing read and write contexts.
 *
 * @since 1.0.0
 */
package com.ryuqq.dispatcher.application.context;
