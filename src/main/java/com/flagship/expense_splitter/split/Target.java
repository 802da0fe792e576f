package com.flagship.expense_splitter.split;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

/**
 * One parsed from/to directive: a member and the amount (minor units) they pay or take.
 *
 * A {@code null} amount marks a wildcard, whose share is resolved later by splitting the
 * remainder of the expense equally.
 */
@Value
public class Target {
    String member;
    Long amount;

    public static Target of(String member, long amount) {
        return new Target(member, amount);
    }

    public static Target wildcard(String member) {
        return new Target(member, null);
    }

    @JsonIgnore
    public boolean isWildcard() {
        return amount == null;
    }
}
