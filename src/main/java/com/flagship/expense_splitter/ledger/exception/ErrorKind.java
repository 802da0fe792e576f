package com.flagship.expense_splitter.ledger.exception;

/**
 * Categories of ledger errors.
 *
 * All of them are caused by bad input or by a request that does not match the
 * current ledger state, so none of them is worth retrying.
 */
public enum ErrorKind {
    /**
     * A from/to directive does not follow {@code <name>[:<number>[%]]}.
     */
    INVALID_TARGET_FORMAT,

    /**
     * The amount part of a directive is not a number.
     */
    INVALID_NUMBER_FORMAT,

    /**
     * Amounts are well-formed but do not add up (e.g. payers cover more than the total).
     */
    INVALID_SEMANTIC,

    /**
     * A group or member name is malformed or already taken.
     */
    INVALID_NAME,

    MEMBER_NOT_FOUND,

    GROUP_NOT_FOUND,

    LOG_ENTRY_NOT_FOUND
}
