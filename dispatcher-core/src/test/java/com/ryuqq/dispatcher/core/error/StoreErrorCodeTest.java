package com.ryuqq.dispatcher.core.error;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * StoreErrorCode 테스트.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
class StoreErrorCodeTest {

    private static final EnumSet<StoreErrorCode> TRANSIENT = EnumSet.of(
        StoreErrorCode.UNAVAILABLE,
        StoreErrorCode.RESOURCE_EXHAUSTED,
        StoreErrorCode.INTERNAL,
        StoreErrorCode.DEADLINE_EXCEEDED,
        StoreErrorCode.DATA_LOSS,
        StoreErrorCode.ABORTED,
        StoreErrorCode.CANCELLED
    );

    @ParameterizedTest
    @EnumSource(StoreErrorCode.class)
    void isTransient_일시적_코드만_true(StoreErrorCode code) {
        assertThat(code.isTransient()).isEqualTo(TRANSIENT.contains(code));
    }

    @Test
    void storeException_메시지에_코드_포함() {
        // when
        StoreException exception = new StoreException(StoreErrorCode.NOT_FOUND, "cities/SF");

        // then
        assertThat(exception.getCode()).isEqualTo(StoreErrorCode.NOT_FOUND);
        assertThat(exception.getMessage()).isEqualTo("NOT_FOUND: cities/SF");
    }
}
