package com.flagship.expense_splitter.settlement;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Computes a short list of payments that brings every balance back to zero.
 *
 * Greedy and deterministic, not a global optimum:
 * 1. Split members into creditors (balance > 0) and debtors (balance < 0)
 * 2. Sort creditors by balance and debtors by amount owed, both ascending and stable
 * 3. Settle every debtor that exactly offsets a creditor with a single payment
 * 4. Walk the remaining debtors and creditors with one cursor each, paying the smaller side off
 *
 * Pure function of the balances it is given. Applying the plan is up to the caller.
 */
@Component
public class SettlementPlanner {

    /**
     * @param balances member balances in group order, expected to sum to zero
     * @return payments in debtor-then-creditor order
     * @throws IllegalArgumentException if debts remain after every creditor is paid
     */
    public List<SettlementTransaction> plan(Map<String, Long> balances) {
        List<Position> creditors = new ArrayList<>();
        List<Position> debtors = new ArrayList<>();
        balances.forEach((member, balance) -> {
            if (balance > 0) {
                creditors.add(new Position(member, balance));
            } else if (balance < 0) {
                debtors.add(new Position(member, -balance));
            }
        });
        // List.sort is stable, so equal balances keep group order
        creditors.sort(Comparator.comparingLong(Position::getRemaining));
        debtors.sort(Comparator.comparingLong(Position::getRemaining));

        List<SettlementTransaction> transactions = new ArrayList<>();
        settleExactMatches(debtors, creditors, transactions);
        settleRemainders(debtors, creditors, transactions);
        return transactions;
    }

    private void settleExactMatches(List<Position> debtors, List<Position> creditors,
                                    List<SettlementTransaction> transactions) {
        for (Position debtor : debtors) {
            for (Position creditor : creditors) {
                if (creditor.getRemaining() == 0) {
                    continue;
                }
                if (creditor.getRemaining() > debtor.getRemaining()) {
                    break;
                }
                if (creditor.getRemaining() == debtor.getRemaining()) {
                    transactions.add(new SettlementTransaction(
                        debtor.getMember(), creditor.getMember(), debtor.getRemaining()));
                    creditor.settle(debtor.getRemaining());
                    debtor.settle(debtor.getRemaining());
                    break;
                }
            }
        }
    }

    private void settleRemainders(List<Position> debtors, List<Position> creditors,
                                  List<SettlementTransaction> transactions) {
        int cursor = 0;
        for (Position debtor : debtors) {
            while (debtor.getRemaining() > 0) {
                while (cursor < creditors.size() && creditors.get(cursor).getRemaining() == 0) {
                    cursor++;
                }
                if (cursor == creditors.size()) {
                    throw new IllegalArgumentException(String.format(
                        "Balances do not sum to zero, %s still owes %d with no creditor left",
                        debtor.getMember(), debtor.getRemaining()));
                }
                Position creditor = creditors.get(cursor);
                long amount = Math.min(debtor.getRemaining(), creditor.getRemaining());
                transactions.add(new SettlementTransaction(debtor.getMember(), creditor.getMember(), amount));
                debtor.settle(amount);
                creditor.settle(amount);
            }
        }
    }

    /**
     * Mutable working copy of one member's open amount.
     */
    private static final class Position {
        private final String member;
        private long remaining;

        Position(String member, long remaining) {
            this.member = member;
            this.remaining = remaining;
        }

        String getMember() {
            return member;
        }

        long getRemaining() {
            return remaining;
        }

        void settle(long amount) {
            remaining -= amount;
        }
    }
}
