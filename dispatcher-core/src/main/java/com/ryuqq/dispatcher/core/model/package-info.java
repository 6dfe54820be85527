/**
 * Value types shared by the document store SPI and the handler contexts.
 *
 * <p>References, snapshots, queries and write preconditions. All types are immutable.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
package com.ryuqq.dispatcher.core.model;
