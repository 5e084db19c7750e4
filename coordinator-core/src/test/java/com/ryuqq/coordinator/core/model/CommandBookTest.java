package com.ryuqq.coordinator.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CommandBook / CommandPage 테스트.
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
class CommandBookTest {

    private static final TypedPayload COMMAND = TypedPayload.ofType("test.DoSomething", new byte[0]);

    @Test
    void commandPage_NullStrategy_DefaultsToExplicit() {
        // When
        CommandPage page = new CommandPage(COMMAND, 3L, null);

        // Then
        assertEquals(MergeStrategy.EXPLICIT, page.mergeStrategy());
        assertTrue(page.hasSequence());
    }

    @Test
    void commandPage_AutoResequenceWithoutSequence_HasNoSequence() {
        // When
        CommandPage page = CommandPage.autoResequence(COMMAND, null);

        // Then
        assertFalse(page.hasSequence());
        assertEquals(MergeStrategy.AUTO_RESEQUENCE, page.mergeStrategy());
    }

    @Test
    void commandPage_NegativeSequence_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> CommandPage.force(COMMAND, -1L));
    }

    @Test
    void commandBook_NoPages_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new CommandBook(Cover.of("d", RootId.random()), List.of(), null)
        );
        assertTrue(exception.getMessage().contains("at least one page"));
    }

    @Test
    void commandBook_WithOrigin_KeepsPages() {
        // Given
        Cover cover = Cover.of("inventory", RootId.random());
        CommandBook book = CommandBook.of(cover, CommandPage.explicit(COMMAND, 0));
        CommandOrigin origin = new CommandOrigin("order-inventory", ComponentKind.SAGA, Cover.of("order", RootId.random()));

        // When
        CommandBook stamped = book.withOrigin(origin);

        // Then
        assertEquals(origin, stamped.origin());
        assertEquals(book.primaryPage(), stamped.primaryPage());
        assertNull(book.origin());
    }

    @Test
    void typedPayload_MatchesBySuffix() {
        // Given
        TypedPayload payload = TypedPayload.ofType("examples.customer.CustomerCreated", new byte[0]);

        // Then
        assertEquals("type.coordinator/examples.customer.CustomerCreated", payload.getTypeUrl());
        assertEquals("examples.customer.CustomerCreated", payload.getTypeName());
        assertTrue(payload.matches("CustomerCreated"));
        assertFalse(payload.matches("OrderCreated"));
    }
}
