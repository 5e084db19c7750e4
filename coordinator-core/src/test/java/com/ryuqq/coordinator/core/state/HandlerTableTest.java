package com.ryuqq.coordinator.core.state;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HandlerTable suffix 매칭 테스트.
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
class HandlerTableTest {

    @Test
    void find_MatchesTypeNameSuffix() {
        // Given
        HandlerTable<String> table = new HandlerTable<>("test");
        table.register("CreateCustomer", "create");

        // When & Then
        assertEquals("create",
            table.find("type.coordinator/examples.customer.CreateCustomer").orElseThrow().handler());
        assertTrue(table.find("type.coordinator/examples.customer.DeleteCustomer").isEmpty());
    }

    @Test
    void find_OverlappingSuffixes_FirstRegisteredWins() {
        // Given
        HandlerTable<String> table = new HandlerTable<>("test");
        table.register("Created", "generic");
        table.register("OrderCreated", "specific");

        // When & Then
        assertEquals("generic", table.find("examples.order.OrderCreated").orElseThrow().handler());
    }

    @Test
    void register_DuplicateSuffix_ThrowsException() {
        // Given
        HandlerTable<String> table = new HandlerTable<>("test");
        table.register("Created", "a");

        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> table.register("Created", "b")
        );
        assertTrue(exception.getMessage().contains("Duplicate handler"));
    }

    @Test
    void suffixes_KeepRegistrationOrder() {
        // Given
        HandlerTable<String> table = new HandlerTable<>("test");
        table.register("B", "b");
        table.register("A", "a");

        // When & Then
        assertEquals(java.util.List.of("B", "A"), table.suffixes());
        assertFalse(table.isEmpty());
    }
}
