package com.flagship.expense_splitter.split;

import java.util.regex.Pattern;

/**
 * Name rules shared by groups, members and directives.
 */
public final class MemberNames {

    /** Matches the width of the name columns in {@code db/ledger-schema.sql}. */
    public static final int MAX_LENGTH = 128;

    public static final String NAME_REGEX = "^[a-zA-Z0-9][a-zA-Z0-9_\\-()]{0," + (MAX_LENGTH - 1) + "}$";

    private static final Pattern NAME_PATTERN = Pattern.compile(NAME_REGEX);

    private MemberNames() {
        // Utility class
    }

    public static boolean isValid(String name) {
        return name != null && NAME_PATTERN.matcher(name).matches();
    }
}
