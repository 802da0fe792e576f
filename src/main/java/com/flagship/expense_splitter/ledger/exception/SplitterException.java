package com.flagship.expense_splitter.ledger.exception;

/**
 * Raised by the allocation, settlement and ledger code when a request cannot be applied.
 *
 * Thrown before any balance is touched, so a failed operation leaves the ledger unchanged.
 */
public class SplitterException extends RuntimeException {

    private final ErrorKind kind;

    public SplitterException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SplitterException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static SplitterException memberNotFound(String member, String groupName) {
        return new SplitterException(ErrorKind.MEMBER_NOT_FOUND, groupName == null
            ? String.format("No member '%s' in this group", member)
            : String.format("No member '%s' in group '%s'", member, groupName));
    }

    public static SplitterException groupNotFound(String groupName) {
        return new SplitterException(ErrorKind.GROUP_NOT_FOUND,
            groupName == null ? "No group exists yet" : "Group not found: " + groupName);
    }

    public static SplitterException semantic(String message) {
        return new SplitterException(ErrorKind.INVALID_SEMANTIC, message);
    }
}
