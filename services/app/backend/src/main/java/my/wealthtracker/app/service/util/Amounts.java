package my.wealthtracker.app.service.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class Amounts {
	public static final BigDecimal ONE_HUNDRED = new BigDecimal("100");
	public static final int MONEY_SCALE = 2;
	public static final int RATIO_SCALE = 10;

	private Amounts() {
	}

	public static BigDecimal safe(BigDecimal value) {
		return value == null ? BigDecimal.ZERO : value;
	}

	public static BigDecimal money(BigDecimal value) {
		return safe(value).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
	}

	public static BigDecimal money(double value) {
		return BigDecimal.valueOf(value).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
	}

	public static BigDecimal percent(BigDecimal value) {
		return safe(value).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
	}

	public static BigDecimal percentOf(BigDecimal part, BigDecimal whole) {
		if (whole == null || whole.signum() <= 0) {
			return BigDecimal.ZERO.setScale(MONEY_SCALE);
		}
		return safe(part).multiply(ONE_HUNDRED)
				.divide(whole, MONEY_SCALE, RoundingMode.HALF_UP);
	}

	public static BigDecimal applyRate(BigDecimal amount, BigDecimal ratePct) {
		return safe(amount).multiply(safe(ratePct))
				.divide(ONE_HUNDRED, MONEY_SCALE, RoundingMode.HALF_UP);
	}
}
