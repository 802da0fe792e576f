package com.flagship.expense_splitter.ledger;

import com.flagship.expense_splitter.ledger.exception.SplitterException;
import com.flagship.expense_splitter.observability.CorrelationContext;
import com.flagship.expense_splitter.observability.SplitterMetrics;
import com.flagship.expense_splitter.settlement.SettlementPlanner;
import com.flagship.expense_splitter.settlement.SettlementTransaction;
import com.flagship.expense_splitter.split.Allocation;
import com.flagship.expense_splitter.split.ExpenseAllocator;
import com.flagship.expense_splitter.split.TransactionChange;
import com.flagship.expense_splitter.store.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Entry point for every ledger operation.
 *
 * Each call follows the same cycle:
 * 1. Load the whole snapshot from the {@link LedgerStore}
 * 2. Resolve the group (a {@code null} name means the current group)
 * 3. Validate and compute, then mutate the group
 * 4. Mark the group as current and save the snapshot
 *
 * A failed operation throws before the save, so the stored ledger is never partially updated.
 * Read-only operations skip the save.
 */
@Service
@Slf4j
public class GroupLedgerService {

    private final LedgerStore ledgerStore;
    private final ExpenseAllocator expenseAllocator;
    private final SettlementPlanner settlementPlanner;
    private final SplitterMetrics metrics;
    private final CurrencyCode defaultCurrency;

    public GroupLedgerService(LedgerStore ledgerStore,
                              ExpenseAllocator expenseAllocator,
                              SettlementPlanner settlementPlanner,
                              SplitterMetrics metrics,
                              @Value("${splitter.default-currency:EUR}") CurrencyCode defaultCurrency) {
        this.ledgerStore = ledgerStore;
        this.expenseAllocator = expenseAllocator;
        this.settlementPlanner = settlementPlanner;
        this.metrics = metrics;
        this.defaultCurrency = defaultCurrency;
    }

    /**
     * Creates a group and makes it the current one.
     *
     * @param currency display currency, {@code null} for the configured default
     */
    public Group createGroup(String name, List<String> members, CurrencyCode currency) {
        return execute("create_group", true, snapshot -> {
            MDC.put(CorrelationContext.GROUP_NAME_MDC_KEY, String.valueOf(name));
            Group group = Group.create(name, members, currency == null ? defaultCurrency : currency);
            snapshot.addGroup(group);
            snapshot.select(group);
            log.info("Created group with {} members, currency={}", members.size(), group.getCurrency());
            return group;
        });
    }

    public Group deleteGroup(String groupName) {
        return execute("delete_group", true, snapshot -> {
            Group group = snapshot.removeGroup(resolve(snapshot, groupName).getName());
            log.info("Deleted group with {} log entries", group.getLog().size());
            return group;
        });
    }

    public Group addMembers(String groupName, List<String> members) {
        return execute("add_members", true, snapshot -> {
            Group group = resolveAndSelect(snapshot, groupName);
            group.addMembers(members);
            log.info("Added members {}", members);
            return group;
        });
    }

    public Group removeMembers(String groupName, List<String> members) {
        return execute("remove_members", true, snapshot -> {
            Group group = resolveAndSelect(snapshot, groupName);
            group.removeMembers(members);
            log.info("Removed members {}", members);
            return group;
        });
    }

    /**
     * Splits an expense, applies it to the balances and logs it.
     *
     * @param totalAmount expense amount in minor units
     * @param from payer directives, {@code <name>[:<number>[%]]}
     * @param to receiver directives with explicit amounts, empty for the whole group
     * @param balanceRest whether receivers also share the unassigned remainder
     * @return the applied balance change
     */
    public TransactionChange allocateExpense(String groupName, String description, long totalAmount,
                                             List<String> from, List<String> to, boolean balanceRest) {
        return execute("allocate_expense", true, snapshot -> {
            Group group = resolveAndSelect(snapshot, groupName);
            Allocation allocation = expenseAllocator.allocate(
                totalAmount, group.getMemberNames(), from, to, balanceRest);
            SplitCommand command = new SplitCommand(description, totalAmount,
                allocation.getPayers(), allocation.getReceivers(), balanceRest);
            group.record(command, allocation.getChange());
            log.info("Recorded expense of {}: {}", totalAmount, allocation.getChange());
            return allocation.getChange();
        });
    }

    public LogEntry recordPayment(String groupName, long amount, String from, String to) {
        return execute("record_payment", true, snapshot -> {
            Group group = resolveAndSelect(snapshot, groupName);
            LogEntry entry = group.pay(amount, from, to);
            log.info("Recorded payment of {} from {} to {}", amount, from, to);
            return entry;
        });
    }

    /**
     * @param index log position, {@code null} for the latest entry
     * @return the entry that was reverted
     */
    public LogEntry undo(String groupName, Integer index) {
        return execute("undo", true, snapshot -> {
            Group group = resolveAndSelect(snapshot, groupName);
            LogEntry entry = group.undo(index);
            log.info("Undid {} entry recorded at {}", entry.getCommand().getCommandType(), entry.getRecordedAt());
            return entry;
        });
    }

    /**
     * Proposes payments that zero every balance. Nothing is changed.
     */
    public List<SettlementTransaction> planSettlement(String groupName) {
        return execute("plan_settlement", false, snapshot -> {
            Group group = resolve(snapshot, groupName);
            List<SettlementTransaction> plan = settlementPlanner.plan(group.getBalances());
            metrics.recordSettlementSize(plan.size());
            log.info("Planned settlement with {} payments", plan.size());
            return plan;
        });
    }

    /**
     * Applies a confirmed settlement plan as one log entry, so it can be undone as a whole.
     *
     * @return the applied balance change
     */
    public TransactionChange applySettlement(String groupName, List<SettlementTransaction> transactions) {
        return execute("apply_settlement", true, snapshot -> {
            Group group = resolveAndSelect(snapshot, groupName);
            if (transactions == null || transactions.isEmpty()) {
                throw SplitterException.semantic("There is nothing to settle");
            }
            Map<String, Long> deltas = new LinkedHashMap<>();
            for (SettlementTransaction transaction : transactions) {
                deltas.merge(transaction.getFrom(), transaction.getAmount(), Math::addExact);
                deltas.merge(transaction.getTo(), -transaction.getAmount(), Math::addExact);
            }
            TransactionChange change = new TransactionChange(deltas);
            group.record(new SettlementCommand(List.copyOf(transactions)), change);
            log.info("Applied settlement with {} payments", transactions.size());
            return change;
        });
    }

    public Group getGroup(String groupName) {
        return execute("get_group", false, snapshot -> resolve(snapshot, groupName));
    }

    public List<LogEntry> getLog(String groupName) {
        return execute("get_log", false, snapshot -> resolve(snapshot, groupName).getLog());
    }

    public List<Group> listGroups() {
        return execute("list_groups", false, LedgerSnapshot::getGroups);
    }

    /**
     * Name of the group that commands without a group name address, if any group exists.
     */
    public Optional<String> currentGroup() {
        return execute("current_group", false, snapshot -> snapshot.getGroups().isEmpty()
            ? Optional.<String>empty()
            : Optional.of(snapshot.resolve(null).getName()));
    }

    private Group resolve(LedgerSnapshot snapshot, String groupName) {
        Group group = snapshot.resolve(groupName);
        MDC.put(CorrelationContext.GROUP_NAME_MDC_KEY, group.getName());
        return group;
    }

    private Group resolveAndSelect(LedgerSnapshot snapshot, String groupName) {
        Group group = resolve(snapshot, groupName);
        snapshot.select(group);
        return group;
    }

    private <T> T execute(String operation, boolean save, Function<LedgerSnapshot, T> action) {
        long startTime = System.currentTimeMillis();
        try {
            LedgerSnapshot snapshot = ledgerStore.load();
            T result = action.apply(snapshot);
            if (save) {
                ledgerStore.save(snapshot);
            }

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperation(operation, SplitterMetrics.STATUS_SUCCESS);
            metrics.recordLatency(operation, Duration.ofMillis(duration));
            log.debug("Operation {} completed in {}ms", operation, duration);
            return result;

        } catch (SplitterException e) {
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperation(operation, e.getKind().name().toLowerCase());
            metrics.recordLatency(operation, Duration.ofMillis(duration));
            log.warn("Operation {} rejected: kind={}, error={}, duration={}ms",
                operation, e.getKind(), e.getMessage(), duration);
            throw e;
        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperation(operation, "error");
            metrics.recordLatency(operation, Duration.ofMillis(duration));
            log.error("Operation {} failed: error={}, duration={}ms", operation, e.getMessage(), duration, e);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.GROUP_NAME_MDC_KEY);
        }
    }
}
