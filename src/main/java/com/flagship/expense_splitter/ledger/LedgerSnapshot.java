package com.flagship.expense_splitter.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.expense_splitter.ledger.exception.ErrorKind;
import com.flagship.expense_splitter.ledger.exception.SplitterException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Whole ledger state as handed to and from a {@code LedgerStore}: every group plus the one
 * that commands address when no group is named.
 */
public class LedgerSnapshot {

    public static final String FORMAT_VERSION = "1";

    private final String formatVersion;
    private final List<Group> groups;
    private String currentGroup;

    @JsonCreator
    public LedgerSnapshot(@JsonProperty("formatVersion") String formatVersion,
                          @JsonProperty("groups") List<Group> groups,
                          @JsonProperty("currentGroup") String currentGroup) {
        this.formatVersion = formatVersion == null ? FORMAT_VERSION : formatVersion;
        this.groups = new ArrayList<>(groups == null ? List.of() : groups);
        this.currentGroup = currentGroup;
    }

    public static LedgerSnapshot empty() {
        return new LedgerSnapshot(FORMAT_VERSION, List.of(), null);
    }

    public String getFormatVersion() {
        return formatVersion;
    }

    public List<Group> getGroups() {
        return Collections.unmodifiableList(groups);
    }

    public String getCurrentGroup() {
        return currentGroup;
    }

    public Optional<Group> findGroup(String name) {
        return groups.stream().filter(group -> group.getName().equals(name)).findFirst();
    }

    /**
     * Looks up the group a command addresses.
     *
     * @param name explicit group name, or {@code null} for the current group (falling back to
     *             the first group when no current group is set)
     * @throws SplitterException GROUP_NOT_FOUND if nothing matches
     */
    public Group resolve(String name) {
        if (name != null) {
            return findGroup(name).orElseThrow(() -> SplitterException.groupNotFound(name));
        }
        if (currentGroup != null) {
            Optional<Group> current = findGroup(currentGroup);
            if (current.isPresent()) {
                return current.get();
            }
        }
        if (groups.isEmpty()) {
            throw SplitterException.groupNotFound(null);
        }
        return groups.get(0);
    }

    /**
     * @throws SplitterException INVALID_NAME if a group with that name already exists
     */
    public void addGroup(Group group) {
        if (findGroup(group.getName()).isPresent()) {
            throw new SplitterException(ErrorKind.INVALID_NAME,
                String.format("Group '%s' already exists", group.getName()));
        }
        groups.add(group);
    }

    /**
     * @throws SplitterException GROUP_NOT_FOUND for an unknown group
     */
    public Group removeGroup(String name) {
        Group group = resolve(name);
        groups.remove(group);
        if (group.getName().equals(currentGroup)) {
            currentGroup = null;
        }
        return group;
    }

    public void select(Group group) {
        this.currentGroup = group.getName();
    }
}
