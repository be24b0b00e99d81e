package my.wealthtracker.app.service.util;

/**
 * Compounding shared by the growth projection and the Monte Carlo paths. Rates are fractions per
 * period (0.01 is 1%); deposits are made at the start of each period.
 */
public final class CompoundingMath {
	private CompoundingMath() {
	}

	/**
	 * Monthly rate equivalent to an annual percentage: {@code (1 + annual/100)^(1/12) - 1}.
	 */
	public static double monthlyRate(double annualRatePct) {
		if (annualRatePct == 0.0) {
			return 0.0;
		}
		return Math.pow(1.0 + annualRatePct / 100.0, 1.0 / 12.0) - 1.0;
	}

	/**
	 * Value after {@code periods} periods of an opening balance plus a deposit at the start of every
	 * period. Each deposit compounds for the periods remaining, so with {@code rate == 0} this is plain
	 * summation.
	 */
	public static double compound(double opening, double depositPerPeriod, double rate, int periods) {
		if (periods <= 0) {
			return opening;
		}
		if (rate == 0.0) {
			return opening + depositPerPeriod * periods;
		}
		double growth = Math.pow(1.0 + rate, periods);
		double accumulatedDeposits = depositPerPeriod == 0.0
				? 0.0
				: depositPerPeriod * ((growth - 1.0) / rate) * (1.0 + rate);
		return opening * growth + accumulatedDeposits;
	}
}
