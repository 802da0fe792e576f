package com.flagship.expense_splitter.split;

import com.flagship.expense_splitter.ledger.exception.ErrorKind;
import com.flagship.expense_splitter.ledger.exception.SplitterException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Expense allocation over the group Alice, Bob, Charly, Django.
 */
class ExpenseAllocatorTest {

    private static final List<String> MEMBERS = List.of("Alice", "Bob", "Charly", "Django");

    private final ExpenseAllocator allocator = new ExpenseAllocator();

    private static Map<String, Long> deltas(long alice, long bob, long charly, long django) {
        Map<String, Long> deltas = new LinkedHashMap<>();
        deltas.put("Alice", alice);
        deltas.put("Bob", bob);
        deltas.put("Charly", charly);
        deltas.put("Django", django);
        return deltas;
    }

    private Map<String, Long> allocate(long total, List<String> from, List<String> to, boolean balanceRest) {
        Allocation allocation = allocator.allocate(total, MEMBERS, from, to, balanceRest);
        assertEquals(0, allocation.getChange().sum());
        return allocation.getChange().asMap();
    }

    @Test
    @DisplayName("One payer, whole group consumes")
    void testSinglePayer() {
        assertEquals(deltas(90, -30, -30, -30), allocate(120, List.of("Alice"), List.of(), false));
    }

    @Test
    @DisplayName("Explicit receiver, the rest is split among the others")
    void testExplicitReceiver() {
        assertEquals(deltas(-10, 90, -40, -40), allocate(130, List.of("Bob"), List.of("Alice:0,1"), false));
    }

    @Test
    @DisplayName("Two explicit receivers without balance_rest")
    void testTwoReceivers() {
        assertEquals(deltas(-10, 80, -10, -60),
            allocate(140, List.of("Bob"), List.of("Alice:0,1", "Charly:0.1"), false));
    }

    @Test
    @DisplayName("balance_rest lets receivers share the remainder too")
    void testBalanceRest() {
        assertEquals(deltas(-40, 110, -40, -30),
            allocate(140, List.of("Bob"), List.of("Alice:0,1", "Charly:0.1"), true));
    }

    @Test
    @DisplayName("Wildcard payers split the total")
    void testWildcardPayers() {
        assertEquals(deltas(30, 30, -30, -30), allocate(120, List.of("Alice", "Bob"), List.of(), false));
    }

    @Test
    @DisplayName("Explicit and wildcard payers mixed, odd unit goes to the first wildcard in group order")
    void testMixedPayers() {
        // Django pays 0.50, Alice and Bob share the remaining 0.51 (Alice first in group order)
        assertEquals(deltas(26 - 26, 25 - 25, -25, 50 - 25),
            allocate(101, List.of("Django:0,5", "Bob", "Alice"), List.of(), false));
    }

    @Test
    @DisplayName("Percentages on both sides")
    void testPercentages() {
        assertEquals(deltas(-2500, 7500, -2500, -2500),
            allocate(10000, List.of("Bob:100%"), List.of("Alice:25%"), false));
    }

    @Test
    @DisplayName("Every member named as receiver with nothing left over")
    void testAllMembersReceiveExactly() {
        assertEquals(deltas(70, -10, -10, -50),
            allocate(80, List.of("Alice"), List.of("Alice:0,1", "Bob:0,1", "Charly:0,1", "Django:0,5"), false));
    }

    @Test
    @DisplayName("Wildcard receivers are rejected")
    void testWildcardReceiver() {
        SplitterException e = assertThrows(SplitterException.class,
            () -> allocator.allocate(100, MEMBERS, List.of("Alice"), List.of("Bob"), false));
        assertEquals(ErrorKind.INVALID_TARGET_FORMAT, e.getKind());
    }

    @Test
    @DisplayName("Explicit payer amounts must cover the total exactly")
    void testPayersDoNotCoverTotal() {
        SplitterException e = assertThrows(SplitterException.class,
            () -> allocator.allocate(100, MEMBERS, List.of("Alice:0,5"), List.of(), false));
        assertEquals(ErrorKind.INVALID_SEMANTIC, e.getKind());
    }

    @Test
    @DisplayName("Payer amounts above the total are rejected")
    void testPayersExceedTotal() {
        SplitterException e = assertThrows(SplitterException.class,
            () -> allocator.allocate(100, MEMBERS, List.of("Alice:2", "Bob"), List.of(), false));
        assertEquals(ErrorKind.INVALID_SEMANTIC, e.getKind());
    }

    @Test
    @DisplayName("Unknown members are MEMBER_NOT_FOUND")
    void testUnknownMember() {
        SplitterException e = assertThrows(SplitterException.class,
            () -> allocator.allocate(100, MEMBERS, List.of("Eve"), List.of(), false));
        assertEquals(ErrorKind.MEMBER_NOT_FOUND, e.getKind());

        e = assertThrows(SplitterException.class,
            () -> allocator.allocate(100, MEMBERS, List.of("Alice"), List.of("Eve:0,1"), false));
        assertEquals(ErrorKind.MEMBER_NOT_FOUND, e.getKind());
    }

    @Test
    @DisplayName("A member named twice on one side is INVALID_NAME")
    void testDuplicateMember() {
        SplitterException e = assertThrows(SplitterException.class,
            () -> allocator.allocate(100, MEMBERS, List.of("Alice", "Alice"), List.of(), false));
        assertEquals(ErrorKind.INVALID_NAME, e.getKind());
    }

    @Test
    @DisplayName("Non-positive totals and missing payers are INVALID_SEMANTIC")
    void testInvalidTotals() {
        assertEquals(ErrorKind.INVALID_SEMANTIC, assertThrows(SplitterException.class,
            () -> allocator.allocate(0, MEMBERS, List.of("Alice"), List.of(), false)).getKind());
        assertEquals(ErrorKind.INVALID_SEMANTIC, assertThrows(SplitterException.class,
            () -> allocator.allocate(-5, MEMBERS, List.of("Alice"), List.of(), false)).getKind());
        assertEquals(ErrorKind.INVALID_SEMANTIC, assertThrows(SplitterException.class,
            () -> allocator.allocate(100, MEMBERS, List.of(), List.of(), false)).getKind());
    }

    @Test
    @DisplayName("Remainder with every member as explicit receiver needs balance_rest")
    void testRemainderWithoutConsumers() {
        List<String> everyone = List.of("Alice:0,1", "Bob:0,1", "Charly:0,1", "Django:0,1");

        SplitterException e = assertThrows(SplitterException.class,
            () -> allocator.allocate(100, MEMBERS, List.of("Alice"), everyone, false));
        assertEquals(ErrorKind.INVALID_SEMANTIC, e.getKind());

        assertEquals(deltas(75, -25, -25, -25), allocate(100, List.of("Alice"), everyone, true));
    }
}
