package com.trading.quant.valuation;

import com.trading.quant.api.InvalidInputException;

/**
 * Valuation multiples and the prices they imply against peer multiples.
 */
public final class RelativeValuation {

    private RelativeValuation() {
        // Utility class
    }

    public static double priceToEarnings(double price, double earningsPerShare) {
        InvalidInputException.requirePositive("earningsPerShare", earningsPerShare);
        return price / earningsPerShare;
    }

    public static double priceFromEarnings(double earningsPerShare, double peerPe) {
        InvalidInputException.requirePositive("peerPe", peerPe);
        return earningsPerShare * peerPe;
    }

    public static double priceToBook(double price, double bookValuePerShare) {
        InvalidInputException.requirePositive("bookValuePerShare", bookValuePerShare);
        return price / bookValuePerShare;
    }

    public static double priceFromBook(double bookValuePerShare, double peerPb) {
        InvalidInputException.requirePositive("peerPb", peerPb);
        return bookValuePerShare * peerPb;
    }

    public static double priceToSales(double price, double salesPerShare) {
        InvalidInputException.requirePositive("salesPerShare", salesPerShare);
        return price / salesPerShare;
    }

    public static double priceFromSales(double salesPerShare, double peerPs) {
        InvalidInputException.requirePositive("peerPs", peerPs);
        return salesPerShare * peerPs;
    }

    public static double evToEbitda(double enterpriseValue, double ebitda) {
        InvalidInputException.requirePositive("ebitda", ebitda);
        return enterpriseValue / ebitda;
    }

    /**
     * Per-share equity value implied by a peer EV/EBITDA multiple:
     * {@code (ebitda * multiple - debt + cash) / shares}.
     */
    public static double priceFromEvToEbitda(double ebitda, double peerMultiple, double debt, double cash,
            double sharesOutstanding) {
        InvalidInputException.requirePositive("peerMultiple", peerMultiple);
        InvalidInputException.requirePositive("sharesOutstanding", sharesOutstanding);
        return (ebitda * peerMultiple - debt + cash) / sharesOutstanding;
    }

    /**
     * P/E divided by growth in percent, so a P/E of 20 with 10% growth gives 2.
     *
     * @param growthRate decimal, e.g. 0.10.
     */
    public static double pegRatio(double peRatio, double growthRate) {
        InvalidInputException.requirePositive("growthRate", growthRate);
        return peRatio / (growthRate * 100);
    }

    /** {@code marketCap + debt - cash + minorityInterest}. */
    public static double enterpriseValue(double marketCap, double debt, double cash, double minorityInterest) {
        return marketCap + debt - cash + minorityInterest;
    }

    public static double enterpriseValue(double marketCap, double debt, double cash) {
        return enterpriseValue(marketCap, debt, cash, 0.0);
    }
}
