package com.flagship.expense_splitter.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.expense_splitter.ledger.exception.ErrorKind;
import com.flagship.expense_splitter.ledger.exception.SplitterException;
import com.flagship.expense_splitter.split.MemberNames;
import com.flagship.expense_splitter.split.TransactionChange;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A group of members sharing expenses.
 *
 * Key invariants:
 * - Member names are unique and keep insertion order (the group iteration order)
 * - Balances are signed minor units: positive is owed money, negative owes money
 * - Every balance movement goes through the log, so it can be undone
 * - Each operation validates completely before it touches a balance
 */
public class Group {

    private final String name;
    private final CurrencyCode currency;
    private final LinkedHashMap<String, Long> balances;
    private final List<LogEntry> log;

    @JsonCreator
    public Group(@JsonProperty("name") String name,
                 @JsonProperty("currency") CurrencyCode currency,
                 @JsonProperty("balances") Map<String, Long> balances,
                 @JsonProperty("log") List<LogEntry> log) {
        this.name = name;
        this.currency = currency;
        this.balances = new LinkedHashMap<>(balances == null ? Map.of() : balances);
        this.log = new ArrayList<>(log == null ? List.of() : log);
    }

    /**
     * Creates an empty group with all balances at zero.
     *
     * @throws SplitterException INVALID_NAME for a malformed or duplicate name,
     *                           INVALID_SEMANTIC if no member is given
     */
    public static Group create(String name, List<String> members, CurrencyCode currency) {
        requireValidName(name, "group");
        if (members == null || members.isEmpty()) {
            throw SplitterException.semantic("A group needs at least one member");
        }
        Group group = new Group(name, currency, Map.of(), List.of());
        group.addMembers(members);
        return group;
    }

    public String getName() {
        return name;
    }

    public CurrencyCode getCurrency() {
        return currency;
    }

    public Map<String, Long> getBalances() {
        return Collections.unmodifiableMap(balances);
    }

    public List<LogEntry> getLog() {
        return Collections.unmodifiableList(log);
    }

    @JsonIgnore
    public List<String> getMemberNames() {
        return List.copyOf(balances.keySet());
    }

    public boolean hasMember(String member) {
        return balances.containsKey(member);
    }

    public long balanceOf(String member) {
        Long balance = balances.get(member);
        if (balance == null) {
            throw SplitterException.memberNotFound(member, name);
        }
        return balance;
    }

    /**
     * Adds members with a zero balance. All or nothing.
     *
     * @throws SplitterException INVALID_NAME for a malformed name or one already in use
     */
    public void addMembers(List<String> members) {
        Set<String> seen = new HashSet<>();
        for (String member : members) {
            requireValidName(member, "member");
            if (balances.containsKey(member) || !seen.add(member)) {
                throw new SplitterException(ErrorKind.INVALID_NAME,
                    String.format("Member '%s' already exists in group '%s'", member, name));
            }
        }
        for (String member : members) {
            balances.put(member, 0L);
        }
    }

    /**
     * Removes members. All or nothing; a member who still owes or is owed money stays.
     *
     * @throws SplitterException MEMBER_NOT_FOUND for an unknown member,
     *                           INVALID_SEMANTIC for a non-zero balance
     */
    public void removeMembers(List<String> members) {
        for (String member : members) {
            long balance = balanceOf(member);
            if (balance != 0) {
                throw SplitterException.semantic(String.format(
                    "Member '%s' still has a balance of %s, settle it first", member, currency.format(balance)));
            }
        }
        if (new HashSet<>(members).size() == balances.size()) {
            throw SplitterException.semantic("A group needs at least one member");
        }
        members.forEach(balances::remove);
    }

    /**
     * Adds each delta to the member's balance. Keys are checked before any balance moves.
     *
     * @throws SplitterException MEMBER_NOT_FOUND if the change names an unknown member
     */
    public void apply(TransactionChange change) {
        for (String member : change.asMap().keySet()) {
            if (!balances.containsKey(member)) {
                throw SplitterException.memberNotFound(member, name);
            }
        }
        change.asMap().forEach((member, delta) -> balances.merge(member, delta, Math::addExact));
    }

    /**
     * Applies the change and appends it to the log.
     */
    public LogEntry record(LoggedCommand command, TransactionChange change) {
        apply(change);
        LogEntry entry = new LogEntry(command, change, Instant.now().truncatedTo(ChronoUnit.MILLIS));
        log.add(entry);
        return entry;
    }

    /**
     * Reverts a log entry and removes it from the log.
     *
     * @param index position in the log, {@code null} for the latest entry
     * @return the removed entry
     * @throws SplitterException LOG_ENTRY_NOT_FOUND if the log is empty or index is out of range
     */
    public LogEntry undo(Integer index) {
        if (log.isEmpty()) {
            throw new SplitterException(ErrorKind.LOG_ENTRY_NOT_FOUND,
                String.format("Group '%s' has nothing to undo", name));
        }
        int position = index == null ? log.size() - 1 : index;
        if (position < 0 || position >= log.size()) {
            throw new SplitterException(ErrorKind.LOG_ENTRY_NOT_FOUND,
                String.format("No log entry %d in group '%s', valid range is 0..%d", position, name, log.size() - 1));
        }
        LogEntry entry = log.get(position);
        apply(entry.reversedChange());
        log.remove(position);
        return entry;
    }

    /**
     * Records a direct payment: the payer is credited and the payee debited.
     *
     * @throws SplitterException INVALID_SEMANTIC for a non-positive amount or a self payment,
     *                           MEMBER_NOT_FOUND for an unknown member
     */
    public LogEntry pay(long amount, String from, String to) {
        if (amount <= 0) {
            throw SplitterException.semantic("Payment amount must be positive, got " + amount);
        }
        if (from.equals(to)) {
            throw SplitterException.semantic(String.format("'%s' cannot pay themselves", from));
        }
        balanceOf(from);
        balanceOf(to);

        Map<String, Long> deltas = new LinkedHashMap<>();
        deltas.put(from, amount);
        deltas.put(to, -amount);
        return record(new PaymentCommand(amount, from, to), new TransactionChange(deltas));
    }

    private static void requireValidName(String value, String what) {
        if (!MemberNames.isValid(value)) {
            throw new SplitterException(ErrorKind.INVALID_NAME, String.format(
                "'%s' is not a valid %s name, it must match %s", value, what, MemberNames.NAME_REGEX));
        }
    }
}
