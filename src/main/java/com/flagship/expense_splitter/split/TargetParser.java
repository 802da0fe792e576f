package com.flagship.expense_splitter.split;

import com.flagship.expense_splitter.ledger.exception.ErrorKind;
import com.flagship.expense_splitter.ledger.exception.SplitterException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parser for from/to directives of the form {@code <name>[:<number>[%]]}.
 *
 * Numbers accept either '.' or ',' as the decimal separator. Plain numbers are major
 * currency units ({@code "peter:25,22"} is 2522 minor units), a trailing '%' makes the number
 * a percentage of the expense total. Results are rounded half away from zero.
 */
public final class TargetParser {

    private static final String FORMAT_HINT = "use the format <name>[:<number>[%]]";
    private static final Pattern NUMBER_PATTERN = Pattern.compile("-?\\d+(?:[.,]\\d+)?");
    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    private TargetParser() {
        // Utility class
    }

    /**
     * Parses a single directive.
     *
     * @param directive raw directive, e.g. {@code "alice"}, {@code "alice:12,50"} or {@code "alice:10%"}
     * @param totalAmount expense total in minor units, the base for percentages
     * @return the parsed target, a wildcard if no amount was given
     * @throws SplitterException INVALID_TARGET_FORMAT, INVALID_NAME or INVALID_NUMBER_FORMAT
     */
    public static Target parse(String directive, long totalAmount) {
        if (directive == null) {
            throw new SplitterException(ErrorKind.INVALID_TARGET_FORMAT, "Missing directive, " + FORMAT_HINT);
        }
        String trimmed = directive.trim();
        boolean percentage = trimmed.endsWith("%");
        String body = percentage ? trimmed.substring(0, trimmed.length() - 1) : trimmed;

        String[] parts = body.split(":", -1);
        String member = parts[0];
        if (member.isEmpty()) {
            throw new SplitterException(ErrorKind.INVALID_TARGET_FORMAT,
                String.format("Missing member name in '%s', %s", directive, FORMAT_HINT));
        }
        if (parts.length > 2) {
            throw new SplitterException(ErrorKind.INVALID_TARGET_FORMAT,
                String.format("Too many ':' in '%s', %s", directive, FORMAT_HINT));
        }
        if (!MemberNames.isValid(member)) {
            throw new SplitterException(ErrorKind.INVALID_NAME,
                String.format("'%s' is not a valid member name (maybe you forgot ':'?)", member));
        }

        if (parts.length == 1) {
            if (percentage) {
                throw new SplitterException(ErrorKind.INVALID_TARGET_FORMAT,
                    String.format("Percentage without amount in '%s', %s", directive, FORMAT_HINT));
            }
            return Target.wildcard(member);
        }

        BigDecimal number = parseNumber(parts[1].trim(), directive);
        BigDecimal minorUnits = percentage
            ? number.multiply(BigDecimal.valueOf(totalAmount)).divide(ONE_HUNDRED)
            : number.movePointRight(2);
        return Target.of(member, toMinorUnits(minorUnits, directive));
    }

    /**
     * Parses all directives of one side (from or to) of an expense.
     *
     * @throws SplitterException INVALID_SEMANTIC if the explicit amounts exceed the total
     */
    public static ParsedTargets parseAll(List<String> directives, long totalAmount) {
        List<Target> targets = new ArrayList<>(directives.size());
        long explicitSum = 0;
        int wildcardCount = 0;
        for (String directive : directives) {
            Target target = parse(directive, totalAmount);
            targets.add(target);
            if (target.isWildcard()) {
                wildcardCount++;
            } else {
                explicitSum = addWithinTotal(explicitSum, target.getAmount(), totalAmount);
            }
        }
        if (explicitSum > totalAmount || explicitSum < -totalAmount) {
            throw exceedsTotal(explicitSum, totalAmount);
        }
        return new ParsedTargets(List.copyOf(targets), explicitSum, wildcardCount);
    }

    private static long addWithinTotal(long explicitSum, long amount, long totalAmount) {
        try {
            return Math.addExact(explicitSum, amount);
        } catch (ArithmeticException e) {
            throw SplitterException.semantic(String.format(
                "The specified amounts sum up to more than the total amount %d", totalAmount));
        }
    }

    private static SplitterException exceedsTotal(long explicitSum, long totalAmount) {
        return SplitterException.semantic(String.format(
            "The specified amounts sum up to more than the total amount: %d vs %d", explicitSum, totalAmount));
    }

    private static BigDecimal parseNumber(String number, String directive) {
        if (!NUMBER_PATTERN.matcher(number).matches()) {
            throw new SplitterException(ErrorKind.INVALID_NUMBER_FORMAT,
                String.format("Invalid amount '%s' in '%s'", number, directive));
        }
        return new BigDecimal(number.replace(',', '.'));
    }

    private static long toMinorUnits(BigDecimal value, String directive) {
        try {
            return value.setScale(0, RoundingMode.HALF_UP).longValueExact();
        } catch (ArithmeticException e) {
            throw new SplitterException(ErrorKind.INVALID_NUMBER_FORMAT,
                String.format("Amount out of range in '%s'", directive), e);
        }
    }
}
