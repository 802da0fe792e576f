package com.flagship.expense_splitter.split;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ordered member to signed balance delta mapping, in minor units.
 *
 * Serialized as a plain JSON object so log entries stay readable in every store.
 */
@EqualsAndHashCode
public final class TransactionChange {

    private final Map<String, Long> deltas;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public TransactionChange(Map<String, Long> deltas) {
        this.deltas = Collections.unmodifiableMap(new LinkedHashMap<>(deltas));
    }

    public static TransactionChange empty() {
        return new TransactionChange(Map.of());
    }

    @JsonValue
    public Map<String, Long> asMap() {
        return deltas;
    }

    public long get(String member) {
        return deltas.getOrDefault(member, 0L);
    }

    public boolean isEmpty() {
        return deltas.isEmpty();
    }

    public long sum() {
        long sum = 0;
        for (long delta : deltas.values()) {
            sum = Math.addExact(sum, delta);
        }
        return sum;
    }

    /**
     * The change that undoes this one.
     */
    public TransactionChange reversed() {
        Map<String, Long> negated = new LinkedHashMap<>();
        deltas.forEach((member, delta) -> negated.put(member, Math.negateExact(delta)));
        return new TransactionChange(negated);
    }

    @Override
    public String toString() {
        return deltas.toString();
    }
}
