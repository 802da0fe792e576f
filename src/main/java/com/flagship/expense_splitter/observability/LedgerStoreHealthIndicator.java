package com.flagship.expense_splitter.observability;

import com.flagship.expense_splitter.ledger.LedgerSnapshot;
import com.flagship.expense_splitter.store.LedgerStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports whether the configured ledger store can be read.
 *
 * Down if loading the snapshot fails, since every operation starts with a load.
 */
@Component("ledgerStore")
public class LedgerStoreHealthIndicator implements HealthIndicator {

    private final LedgerStore ledgerStore;

    public LedgerStoreHealthIndicator(LedgerStore ledgerStore) {
        this.ledgerStore = ledgerStore;
    }

    @Override
    public Health health() {
        try {
            LedgerSnapshot snapshot = ledgerStore.load();

            return Health.up()
                    .withDetail("storageType", ledgerStore.getStorageType())
                    .withDetail("groups", snapshot.getGroups().size())
                    .withDetail("formatVersion", snapshot.getFormatVersion())
                    .build();

        } catch (Exception e) {
            return Health.down()
                    .withDetail("storageType", ledgerStore.getStorageType())
                    .withDetail("error", e.getMessage())
                    .build();
        }
    }
}
