package com.trading.quant.valuation;

import com.trading.quant.api.InvalidInputException;

/**
 * Inputs to a discounted-cash-flow valuation.
 *
 * <p>
 * The terminal value uses an exit multiple when both
 * {@code terminalMultiple} and {@code terminalYearCashFlow} are set, and the
 * Gordon growth model on the last forecast cash flow otherwise.
 *
 * @param freeCashFlows        forecast free cash flows for years 1..n.
 * @param discountRate         annual rate in {@code (0, 1)}, usually WACC.
 * @param terminalGrowthRate   perpetual growth after year n.
 * @param terminalMultiple     nullable exit multiple.
 * @param terminalYearCashFlow nullable cash flow the multiple applies to.
 */
public record DcfInputs(double[] freeCashFlows, double discountRate, double terminalGrowthRate,
        Double terminalMultiple, Double terminalYearCashFlow) {

    public DcfInputs {
        InvalidInputException.requireNonEmpty("freeCashFlows", freeCashFlows);
        InvalidInputException.requireOpenUnit("discountRate", discountRate);
        freeCashFlows = freeCashFlows.clone();
    }

    @Override
    public double[] freeCashFlows() {
        return freeCashFlows.clone();
    }

    public static DcfInputs gordon(double[] freeCashFlows, double discountRate, double terminalGrowthRate) {
        return new DcfInputs(freeCashFlows, discountRate, terminalGrowthRate, null, null);
    }

    public static DcfInputs exitMultiple(double[] freeCashFlows, double discountRate, double terminalMultiple,
            double terminalYearCashFlow) {
        return new DcfInputs(freeCashFlows, discountRate, 0.0, terminalMultiple, terminalYearCashFlow);
    }

    public boolean usesExitMultiple() {
        return terminalMultiple != null && terminalYearCashFlow != null;
    }
}
