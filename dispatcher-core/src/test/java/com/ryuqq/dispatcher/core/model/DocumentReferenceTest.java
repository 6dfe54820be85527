package com.ryuqq.dispatcher.core.model;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DocumentReference / CollectionReference 테스트.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
class DocumentReferenceTest {

    @Test
    void constructor_ValidValues_CreatesReference() {
        // When
        DocumentReference reference = new DocumentReference("cities", "SF");

        // Then
        assertEquals("cities", reference.collection());
        assertEquals("SF", reference.id());
        assertEquals("cities/SF", reference.path());
        assertEquals(new CollectionReference("cities"), reference.parent());
    }

    @Test
    void constructor_BlankId_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new DocumentReference("cities", " ")
        );
        assertTrue(exception.getMessage().contains("id cannot be null or blank"));
    }

    @Test
    void constructor_SlashInId_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> new DocumentReference("cities", "SF/LA"));
    }

    @Test
    void of_ValidPath_ParsesCollectionAndId() {
        // When
        DocumentReference reference = DocumentReference.of("cities/LA");

        // Then
        assertEquals(new DocumentReference("cities", "LA"), reference);
    }

    @Test
    void of_PathWithoutId_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> DocumentReference.of("cities/")
        );
        assertTrue(exception.getMessage().contains("collection/id"));
    }

    @Test
    void document_AutoId_Generates20AlphanumericCharacters() {
        // Given
        CollectionReference collection = CollectionReference.of("orders");

        // When
        DocumentReference reference = collection.document();

        // Then
        assertEquals("orders", reference.collection());
        assertEquals(20, reference.id().length());
        assertTrue(reference.id().matches("[A-Za-z0-9]{20}"));
    }

    @Test
    void document_AutoId_IsUniqueAcrossCalls() {
        // Given
        CollectionReference collection = CollectionReference.of("orders");
        Set<String> ids = new HashSet<>();

        // When
        for (int i = 0; i < 1000; i++) {
            ids.add(collection.document().id());
        }

        // Then
        assertEquals(1000, ids.size());
    }
}
