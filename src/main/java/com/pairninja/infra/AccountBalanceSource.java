package com.pairninja.infra;

/**
 * Current account equity in quote currency. Needed for EQUITY_RATIO sizing.
 */
public interface AccountBalanceSource {

    double fetchEquity() throws MarketDataException;
}
