package my.wealthtracker.app.service;

import my.wealthtracker.app.domain.ContributionSchedule;
import my.wealthtracker.app.domain.Holding;
import my.wealthtracker.app.domain.HoldingSnapshot;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

final class SnapshotValidator {
	private SnapshotValidator() {
	}

	static void validate(HoldingSnapshot snapshot) {
		if (snapshot == null) {
			throw new ValidationException("snapshot", "must not be null");
		}
		List<Holding> holdings = snapshot.holdings();
		for (int i = 0; i < holdings.size(); i++) {
			Holding holding = holdings.get(i);
			String prefix = "holdings[" + i + "]";
			if (holding == null) {
				throw new ValidationException(prefix, "must not be null");
			}
			if (holding.costBasis().signum() < 0) {
				throw new ValidationException(prefix + ".costBasis", "must not be negative");
			}
			if (holding.currentValue().signum() < 0) {
				throw new ValidationException(prefix + ".currentValue", "must not be negative");
			}
			ContributionSchedule schedule = holding.contributionSchedule();
			if (schedule != null) {
				if (schedule.monthlyAmount().signum() < 0) {
					throw new ValidationException(prefix + ".contributionSchedule.monthlyAmount", "must not be negative");
				}
				if (schedule.stepUpPct().signum() < 0) {
					throw new ValidationException(prefix + ".contributionSchedule.stepUpPct", "must not be negative");
				}
			}
		}
	}

	static void validateDated(HoldingSnapshot snapshot) {
		validate(snapshot);
		LocalDate valuationDate = snapshot.valuationDate();
		if (valuationDate == null) {
			throw new ValidationException("valuationDate", "must not be null");
		}
		List<Holding> holdings = snapshot.holdings();
		for (int i = 0; i < holdings.size(); i++) {
			LocalDate acquired = holdings.get(i).acquisitionDate();
			if (acquired == null) {
				throw new ValidationException("holdings[" + i + "].acquisitionDate", "must not be null");
			}
			if (acquired.isAfter(valuationDate)) {
				throw new ValidationException("holdings[" + i + "].acquisitionDate", "must not be after the valuation date");
			}
		}
	}

	static void requireNonNegative(String field, BigDecimal value) {
		if (value == null) {
			throw new ValidationException(field, "must not be null");
		}
		if (value.signum() < 0) {
			throw new ValidationException(field, "must not be negative");
		}
	}
}
