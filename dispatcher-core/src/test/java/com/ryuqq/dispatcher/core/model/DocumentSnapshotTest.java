package com.ryuqq.dispatcher.core.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DocumentSnapshot 테스트.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
class DocumentSnapshotTest {

    private final DocumentReference reference = new DocumentReference("cities", "SF");

    @Test
    void of_ExistingDocument_ExposesFields() {
        // When
        DocumentSnapshot snapshot = DocumentSnapshot.of(reference, Map.of("name", "San Francisco"), 3);

        // Then
        assertTrue(snapshot.exists());
        assertEquals("San Francisco", snapshot.get("name"));
        assertEquals(3, snapshot.getVersion());
        assertTrue(snapshot.getData().isPresent());
    }

    @Test
    void missing_AbsentDocument_HasNoData() {
        // When
        DocumentSnapshot snapshot = DocumentSnapshot.missing(reference);

        // Then
        assertFalse(snapshot.exists());
        assertTrue(snapshot.getData().isEmpty());
        assertNull(snapshot.get("name"));
        assertEquals(0, snapshot.getVersion());
    }

    @Test
    void of_SourceMapModifiedLater_SnapshotUnchanged() {
        // Given
        Map<String, Object> data = new HashMap<>();
        data.put("population", 100);
        DocumentSnapshot snapshot = DocumentSnapshot.of(reference, data, 1);

        // When
        data.put("population", 200);

        // Then
        assertEquals(100, snapshot.get("population"));
        assertThrows(UnsupportedOperationException.class, () -> snapshot.getData().orElseThrow().put("x", 1));
    }

    @Test
    void of_NullFieldValue_IsAllowed() {
        // Given
        Map<String, Object> data = new HashMap<>();
        data.put("nickname", null);

        // When
        DocumentSnapshot snapshot = DocumentSnapshot.of(reference, data, 1);

        // Then
        assertTrue(snapshot.getData().orElseThrow().containsKey("nickname"));
        assertNull(snapshot.get("nickname"));
    }
}
