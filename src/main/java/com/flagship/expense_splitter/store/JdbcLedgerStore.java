package com.flagship.expense_splitter.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.expense_splitter.ledger.CurrencyCode;
import com.flagship.expense_splitter.ledger.Group;
import com.flagship.expense_splitter.ledger.LedgerSnapshot;
import com.flagship.expense_splitter.ledger.LogEntry;
import com.flagship.expense_splitter.ledger.LoggedCommand;
import com.flagship.expense_splitter.split.TransactionChange;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Stores the ledger in a relational database.
 *
 * Schema (db/ledger-schema.sql, applied on startup):
 * - ledger_state: one row with the format version and the current group
 * - expense_groups, group_members: groups and balances, with explicit ordering columns
 * - group_log_entries: log entries, command and change kept as JSON
 *
 * A save replaces all rows in one transaction, matching the whole-snapshot model.
 */
@Component
@ConditionalOnProperty(name = "splitter.storage.type", havingValue = JdbcLedgerStore.TYPE, matchIfMissing = true)
@Slf4j
public class JdbcLedgerStore implements LedgerStore {

    public static final String TYPE = "jdbc";
    private static final String SCHEMA = "db/ledger-schema.sql";
    private static final int STATE_ROW_ID = 1;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcLedgerStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void initSchema() {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA));
        populator.execute(Objects.requireNonNull(jdbcTemplate.getDataSource(), "JdbcTemplate has no DataSource"));
        log.info("Ledger schema ready");
    }

    @Override
    @Transactional(readOnly = true)
    public LedgerSnapshot load() {
        try {
            List<Map<String, Object>> state = jdbcTemplate.queryForList(
                "SELECT format_version, current_group FROM ledger_state WHERE id = ?", STATE_ROW_ID);
            if (state.isEmpty()) {
                return LedgerSnapshot.empty();
            }
            String formatVersion = (String) state.get(0).get("format_version");
            String currentGroup = (String) state.get(0).get("current_group");

            List<Map<String, Object>> groupRows = jdbcTemplate.queryForList(
                "SELECT name, currency FROM expense_groups ORDER BY group_index");
            List<Group> groups = new ArrayList<>(groupRows.size());
            for (Map<String, Object> row : groupRows) {
                String name = (String) row.get("name");
                groups.add(new Group(
                    name,
                    CurrencyCode.valueOf((String) row.get("currency")),
                    loadBalances(name),
                    loadLog(name)
                ));
            }
            return new LedgerSnapshot(formatVersion, groups, currentGroup);
        } catch (DataAccessException e) {
            throw new LedgerStorageException("Failed to load ledger from database", e);
        }
    }

    @Override
    @Transactional
    public void save(LedgerSnapshot snapshot) {
        try {
            jdbcTemplate.update("DELETE FROM group_log_entries");
            jdbcTemplate.update("DELETE FROM group_members");
            jdbcTemplate.update("DELETE FROM expense_groups");
            jdbcTemplate.update("DELETE FROM ledger_state");

            jdbcTemplate.update(
                "INSERT INTO ledger_state (id, format_version, current_group) VALUES (?, ?, ?)",
                STATE_ROW_ID, snapshot.getFormatVersion(), snapshot.getCurrentGroup());

            List<Group> groups = snapshot.getGroups();
            for (int i = 0; i < groups.size(); i++) {
                insertGroup(groups.get(i), i);
            }
            log.debug("Saved ledger with {} groups", groups.size());
        } catch (DataAccessException e) {
            throw new LedgerStorageException("Failed to save ledger to database", e);
        }
    }

    @Override
    public String getStorageType() {
        return TYPE;
    }

    private void insertGroup(Group group, int groupIndex) {
        jdbcTemplate.update(
            "INSERT INTO expense_groups (name, currency, group_index) VALUES (?, ?, ?)",
            group.getName(), group.getCurrency().name(), groupIndex);

        List<Object[]> members = new ArrayList<>();
        int memberIndex = 0;
        for (Map.Entry<String, Long> balance : group.getBalances().entrySet()) {
            members.add(new Object[]{group.getName(), balance.getKey(), memberIndex++, balance.getValue()});
        }
        jdbcTemplate.batchUpdate(
            "INSERT INTO group_members (group_name, member_name, member_index, balance) VALUES (?, ?, ?, ?)",
            members);

        List<Object[]> entries = new ArrayList<>();
        List<LogEntry> log = group.getLog();
        for (int i = 0; i < log.size(); i++) {
            LogEntry entry = log.get(i);
            entries.add(new Object[]{
                group.getName(),
                i,
                toJson(entry.getCommand(), LoggedCommand.class),
                toJson(entry.getChange(), TransactionChange.class),
                OffsetDateTime.ofInstant(entry.getRecordedAt(), ZoneOffset.UTC)
            });
        }
        jdbcTemplate.batchUpdate(
            "INSERT INTO group_log_entries (group_name, entry_index, command_json, change_json, recorded_at) " +
            "VALUES (?, ?, ?, ?, ?)",
            entries);
    }

    private Map<String, Long> loadBalances(String groupName) {
        Map<String, Long> balances = new LinkedHashMap<>();
        jdbcTemplate.query(
            "SELECT member_name, balance FROM group_members WHERE group_name = ? ORDER BY member_index",
            (RowCallbackHandler) rs -> balances.put(rs.getString("member_name"), rs.getLong("balance")),
            groupName);
        return balances;
    }

    private List<LogEntry> loadLog(String groupName) {
        return jdbcTemplate.query(
            "SELECT command_json, change_json, recorded_at FROM group_log_entries " +
            "WHERE group_name = ? ORDER BY entry_index",
            (rs, rowNum) -> new LogEntry(
                fromJson(rs.getString("command_json"), LoggedCommand.class),
                fromJson(rs.getString("change_json"), TransactionChange.class),
                rs.getObject("recorded_at", OffsetDateTime.class).toInstant()
            ),
            groupName);
    }

    private <T> String toJson(T value, Class<T> type) {
        try {
            return objectMapper.writerFor(type).writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new LedgerStorageException("Failed to serialize " + type.getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new LedgerStorageException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }
}
