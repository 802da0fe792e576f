package com.flagship.expense_splitter.split;

import com.flagship.expense_splitter.ledger.exception.ErrorKind;
import com.flagship.expense_splitter.ledger.exception.SplitterException;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Distributes one expense over the members of a group.
 *
 * The expense of {@code totalAmount} was paid by the "from" side and benefits the "to" side, or
 * the whole group when "to" is empty. The resulting change credits the payers and debits the
 * consumers, so it always sums to zero.
 *
 * Validation runs completely before anything is computed:
 * 1. Total must be positive and someone must have paid
 * 2. Directives must parse, and receivers must name an explicit amount
 * 3. Without a wildcard payer the payer amounts must add up to the total
 * 4. No member may appear twice on one side, and every member must exist
 * 5. Without balanceRest, a remainder needs someone outside "to" to carry it
 */
@Component
public class ExpenseAllocator {

    /**
     * @param totalAmount expense amount in minor units
     * @param groupMembers member names in group order, which decides who gets the odd units
     * @param from payer directives
     * @param to receiver directives, empty for "everyone"
     * @param balanceRest whether members named in "to" also share the unassigned remainder
     * @return the change plus the parsed directives
     * @throws SplitterException if any validation step fails
     */
    public Allocation allocate(long totalAmount,
                               List<String> groupMembers,
                               List<String> from,
                               List<String> to,
                               boolean balanceRest) {
        if (totalAmount <= 0) {
            throw SplitterException.semantic("Expense amount must be positive, got " + totalAmount);
        }
        if (from == null || from.isEmpty()) {
            throw SplitterException.semantic("At least one member has to pay for the expense");
        }
        List<String> receiverDirectives = to == null ? List.of() : to;

        ParsedTargets payers = TargetParser.parseAll(from, totalAmount);
        ParsedTargets receivers = TargetParser.parseAll(receiverDirectives, totalAmount);

        if (receivers.hasWildcard()) {
            throw new SplitterException(ErrorKind.INVALID_TARGET_FORMAT,
                "Every receiver needs an explicit amount, use <name>:<number>[%]");
        }
        if (!payers.hasWildcard() && payers.getExplicitSum() != totalAmount) {
            throw SplitterException.semantic(String.format(
                "The payer amounts must add up to the total amount: %d vs %d",
                payers.getExplicitSum(), totalAmount));
        }

        requireDistinct(payers, "payer");
        requireDistinct(receivers, "receiver");
        requireMembers(payers, groupMembers);
        requireMembers(receivers, groupMembers);

        int consumerCount = balanceRest
            ? groupMembers.size()
            : groupMembers.size() - receivers.getTargets().size();
        long rest = totalAmount - receivers.getExplicitSum();
        if (consumerCount == 0 && rest != 0) {
            throw SplitterException.semantic(String.format(
                "%d left over but every member has an explicit share, enable balance_rest or adjust the amounts",
                rest));
        }

        Map<String, Long> deltas = new LinkedHashMap<>();
        for (String member : groupMembers) {
            deltas.put(member, 0L);
        }

        creditPayers(deltas, payers, totalAmount, groupMembers);
        debitConsumers(deltas, receivers, rest, consumerCount, balanceRest, groupMembers);

        TransactionChange change = new TransactionChange(deltas);
        if (change.sum() != 0) {
            throw new IllegalStateException("Allocation does not sum to zero: " + change);
        }
        return new Allocation(change, payers.getTargets(), receivers.getTargets());
    }

    private void creditPayers(Map<String, Long> deltas, ParsedTargets payers,
                              long totalAmount, List<String> groupMembers) {
        long[] wildcardShares = payers.hasWildcard()
            ? EqualSplitter.splitEqualAmong(totalAmount - payers.getExplicitSum(), payers.getWildcardCount())
            : new long[0];
        int next = 0;
        for (String member : groupMembers) {
            Target payer = payers.find(member).orElse(null);
            if (payer == null) {
                continue;
            }
            long credit = payer.isWildcard() ? wildcardShares[next++] : payer.getAmount();
            deltas.merge(member, credit, Math::addExact);
        }
    }

    private void debitConsumers(Map<String, Long> deltas, ParsedTargets receivers, long rest,
                                int consumerCount, boolean balanceRest, List<String> groupMembers) {
        long[] shares = consumerCount > 0
            ? EqualSplitter.splitEqualAmong(rest, consumerCount)
            : new long[0];
        int next = 0;
        for (String member : groupMembers) {
            Target receiver = receivers.find(member).orElse(null);
            long debit;
            if (receiver == null) {
                debit = shares[next++];
            } else if (balanceRest) {
                debit = Math.addExact(receiver.getAmount(), shares[next++]);
            } else {
                debit = receiver.getAmount();
            }
            deltas.merge(member, -debit, Math::addExact);
        }
    }

    private void requireDistinct(ParsedTargets targets, String side) {
        Set<String> seen = new HashSet<>();
        for (Target target : targets.getTargets()) {
            if (!seen.add(target.getMember())) {
                throw new SplitterException(ErrorKind.INVALID_NAME,
                    String.format("Member '%s' is named more than once as %s", target.getMember(), side));
            }
        }
    }

    private void requireMembers(ParsedTargets targets, List<String> groupMembers) {
        for (Target target : targets.getTargets()) {
            if (!groupMembers.contains(target.getMember())) {
                throw SplitterException.memberNotFound(target.getMember(), null);
            }
        }
    }
}
