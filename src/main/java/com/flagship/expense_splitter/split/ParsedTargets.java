package com.flagship.expense_splitter.split;

import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Result of parsing the from or the to side of an expense.
 *
 * Invariant: explicitSum is the sum of all non-wildcard amounts and wildcardCount the number
 * of wildcard targets in {@link #targets}.
 */
@Value
public class ParsedTargets {
    List<Target> targets;
    long explicitSum;
    int wildcardCount;

    public boolean hasWildcard() {
        return wildcardCount > 0;
    }

    public boolean isEmpty() {
        return targets.isEmpty();
    }

    public Optional<Target> find(String member) {
        return targets.stream()
            .filter(target -> target.getMember().equals(member))
            .findFirst();
    }
}
