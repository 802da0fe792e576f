package com.flagship.expense_splitter.ledger;

import com.flagship.expense_splitter.config.JacksonConfig;
import com.flagship.expense_splitter.ledger.exception.ErrorKind;
import com.flagship.expense_splitter.ledger.exception.SplitterException;
import com.flagship.expense_splitter.observability.SplitterMetrics;
import com.flagship.expense_splitter.settlement.SettlementPlanner;
import com.flagship.expense_splitter.settlement.SettlementTransaction;
import com.flagship.expense_splitter.split.ExpenseAllocator;
import com.flagship.expense_splitter.split.TransactionChange;
import com.flagship.expense_splitter.store.InMemoryLedgerStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Service tests against the in-memory store.
 *
 * These tests verify:
 * - Operations are persisted through the store and mark the group as current
 * - Failed operations leave the stored ledger unchanged
 * - Undo restores balances after expenses, payments and settlements
 * - Outcomes are counted in metrics
 */
class GroupLedgerServiceTest {

    private InMemoryLedgerStore store;
    private SimpleMeterRegistry registry;
    private GroupLedgerService service;

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        store = new InMemoryLedgerStore(JacksonConfig.createObjectMapper());
        registry = new SimpleMeterRegistry();
        service = new GroupLedgerService(store, new ExpenseAllocator(), new SettlementPlanner(),
            new SplitterMetrics(registry), CurrencyCode.EUR);

        service.createGroup("trip", List.of("Alice", "Bob", "Charly", "Django"), null);
    }

    @Test
    @DisplayName("Created group is stored, current and uses the default currency")
    void testCreateGroup() {
        printTestHeader("Create Group");

        LedgerSnapshot snapshot = store.load();
        printOutput("Groups", snapshot.getGroups().size());
        printOutput("Current", snapshot.getCurrentGroup());

        assertEquals("trip", snapshot.getCurrentGroup());
        assertEquals(CurrencyCode.EUR, snapshot.resolve("trip").getCurrency());
        assertEquals(ErrorKind.INVALID_NAME, assertThrows(SplitterException.class,
            () -> service.createGroup("trip", List.of("Eve"), CurrencyCode.USD)).getKind());
        printSuccess("Group created and duplicate rejected");
    }

    @Test
    @DisplayName("Expense is applied, logged and persisted")
    void testAllocateExpense() {
        printTestHeader("Allocate Expense");
        printInput("Expense", "120 from Alice");

        TransactionChange change = service.allocateExpense("trip", "Dinner", 120, List.of("Alice"), List.of(), false);
        printOutput("Change", change);

        assertEquals(Map.of("Alice", 90L, "Bob", -30L, "Charly", -30L, "Django", -30L), change.asMap());
        Group stored = store.load().resolve("trip");
        assertEquals(change.asMap(), stored.getBalances());
        assertEquals(1, stored.getLog().size());
        SplitCommand command = (SplitCommand) stored.getLog().get(0).getCommand();
        assertEquals("Dinner", command.getDescription());
        assertEquals(120, command.getAmount());
        printSuccess("Expense persisted with its log entry");
    }

    @Test
    @DisplayName("Null group name addresses the current group")
    void testCurrentGroupResolution() {
        printTestHeader("Current Group Resolution");

        service.createGroup("flat", List.of("Emil", "Fred"), CurrencyCode.GBP);
        service.recordPayment(null, 250, "Emil", "Fred");
        printOutput("Current", service.currentGroup().orElse(null));

        assertEquals(250L, service.getGroup("flat").balanceOf("Emil"));
        assertEquals(0, service.getGroup("trip").getLog().size());

        service.allocateExpense("trip", null, 40, List.of("Bob"), List.of(), false);
        assertEquals("trip", service.currentGroup().orElseThrow());
        printSuccess("Current group follows the last mutating operation");
    }

    @Test
    @DisplayName("Failed operations do not change the stored ledger")
    void testFailureLeavesStateUntouched() {
        printTestHeader("Failure Leaves State Untouched");

        service.allocateExpense("trip", null, 120, List.of("Alice"), List.of(), false);
        Map<String, Long> before = store.load().resolve("trip").getBalances();

        SplitterException e = assertThrows(SplitterException.class,
            () -> service.allocateExpense("trip", null, 100, List.of("Alice"), List.of("Eve:0,5"), false));
        printOutput("Error", e.getKind() + ": " + e.getMessage());

        assertEquals(ErrorKind.MEMBER_NOT_FOUND, e.getKind());
        assertEquals(before, store.load().resolve("trip").getBalances());
        assertEquals(1, store.load().resolve("trip").getLog().size());
        assertEquals(ErrorKind.GROUP_NOT_FOUND, assertThrows(SplitterException.class,
            () -> service.getGroup("nope")).getKind());
        printSuccess("Ledger unchanged after rejected operation");
    }

    @Test
    @DisplayName("Undo restores balances after an expense and a payment")
    void testUndo() {
        printTestHeader("Undo");

        service.allocateExpense("trip", null, 130, List.of("Bob"), List.of("Alice:0,1"), false);
        Map<String, Long> afterExpense = service.getGroup("trip").getBalances();
        service.recordPayment("trip", 40, "Charly", "Bob");

        LogEntry undone = service.undo("trip", null);
        printOutput("Undone", undone.getCommand().describe(CurrencyCode.EUR));
        assertEquals(PaymentCommand.COMMAND_TYPE, undone.getCommand().getCommandType());
        assertEquals(afterExpense, service.getGroup("trip").getBalances());

        service.undo("trip", 0);
        assertTrue(service.getGroup("trip").getBalances().values().stream().allMatch(b -> b == 0));
        assertTrue(service.getLog("trip").isEmpty());
        printSuccess("Balances restored and log emptied");
    }

    @Test
    @DisplayName("Applying the planned settlement zeroes every balance and can be undone")
    void testSettlement() {
        printTestHeader("Plan and Apply Settlement");

        service.allocateExpense("trip", null, 2000, List.of("Charly"), List.of(), false);
        service.allocateExpense("trip", null, 600, List.of("Bob"), List.of("Alice:3"), true);
        Map<String, Long> before = service.getGroup("trip").getBalances();
        printInput("Balances", before);

        List<SettlementTransaction> plan = service.planSettlement("trip");
        printOutput("Plan", plan);
        assertEquals(2, service.getLog("trip").size(), "planning must not record anything");

        service.applySettlement("trip", plan);
        assertTrue(service.getGroup("trip").getBalances().values().stream().allMatch(b -> b == 0));
        assertTrue(service.planSettlement("trip").isEmpty());

        LogEntry undone = service.undo("trip", null);
        assertEquals(SettlementCommand.COMMAND_TYPE, undone.getCommand().getCommandType());
        assertEquals(before, service.getGroup("trip").getBalances());
        printSuccess("Settlement applied and reverted");
    }

    @Test
    @DisplayName("Empty settlements are rejected")
    void testEmptySettlement() {
        assertEquals(ErrorKind.INVALID_SEMANTIC, assertThrows(SplitterException.class,
            () -> service.applySettlement("trip", List.of())).getKind());
    }

    @Test
    @DisplayName("Members can be added and removed, groups deleted")
    void testMembersAndDeletion() {
        printTestHeader("Members and Deletion");

        service.addMembers("trip", List.of("Emil"));
        service.removeMembers("trip", List.of("Django"));
        assertEquals(List.of("Alice", "Bob", "Charly", "Emil"), service.getGroup("trip").getMemberNames());

        service.deleteGroup("trip");
        assertTrue(service.listGroups().isEmpty());
        assertTrue(service.currentGroup().isEmpty());
        assertEquals(ErrorKind.GROUP_NOT_FOUND, assertThrows(SplitterException.class,
            () -> service.recordPayment(null, 1, "Alice", "Bob")).getKind());
        printSuccess("Membership changes and deletion persisted");
    }

    @Test
    @DisplayName("Operation outcomes are counted by status and every outcome is timed")
    void testMetrics() {
        service.recordPayment("trip", 10, "Alice", "Bob");
        assertThrows(SplitterException.class, () -> service.recordPayment("trip", 10, "Alice", "Eve"));

        assertEquals(1.0, registry.counter("splitter.operations",
            "operation", "record_payment", "status", "success").count());
        assertEquals(1.0, registry.counter("splitter.operations",
            "operation", "record_payment", "status", "member_not_found").count());
        assertEquals(2, registry.timer("splitter.operations.latency", "operation", "record_payment").count());
    }
}
