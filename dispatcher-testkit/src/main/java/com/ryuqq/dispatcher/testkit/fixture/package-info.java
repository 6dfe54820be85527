/**
 * Test fixtures: a sleeper that records delays and events with fixed retry behavior.
 *
 * @since 1.0.0
 */
package com.ryuqq.dispatcher.testkit.fixture;
