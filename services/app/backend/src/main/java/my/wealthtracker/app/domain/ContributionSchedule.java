package my.wealthtracker.app.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

public record ContributionSchedule(BigDecimal monthlyAmount,
								   LocalDate startDate,
								   BigDecimal stepUpPct,
								   boolean active) {
	public ContributionSchedule {
		monthlyAmount = monthlyAmount == null ? BigDecimal.ZERO : monthlyAmount;
		stepUpPct = stepUpPct == null ? BigDecimal.ZERO : stepUpPct;
	}

	public boolean contributes() {
		return active && monthlyAmount.signum() > 0;
	}
}
