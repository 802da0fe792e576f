package com.flagship.expense_splitter.ledger;

/**
 * Currency label of a group, following ISO-4217 codes.
 *
 * Display only: there is no conversion, and amounts always use 100 minor units per major unit.
 */
public enum CurrencyCode {
    USD("$"),
    EUR("€"),
    GBP("£"),
    INR("₹"),
    JPY("¥");

    private final String symbol;

    CurrencyCode(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Renders minor units as a major-unit amount, e.g. {@code -1250} as {@code "-12.50€"}.
     */
    public String format(long minorUnits) {
        String sign = minorUnits < 0 ? "-" : "";
        long abs = Math.abs(minorUnits);
        return String.format("%s%d.%02d%s", sign, abs / 100, abs % 100, symbol);
    }
}
