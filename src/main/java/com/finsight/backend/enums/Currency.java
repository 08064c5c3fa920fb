package com.finsight.backend.enums;

public enum Currency {
    INR("₹"),
    USD("$"),
    EUR("€"),
    GBP("£"),
    BRL("R$");

    private final String symbol;

    Currency(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
