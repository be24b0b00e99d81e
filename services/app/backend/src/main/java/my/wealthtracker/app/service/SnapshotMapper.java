package my.wealthtracker.app.service;

import my.wealthtracker.app.domain.AssetCategory;
import my.wealthtracker.app.domain.ContributionSchedule;
import my.wealthtracker.app.domain.Holding;
import my.wealthtracker.app.domain.HoldingSnapshot;
import my.wealthtracker.app.dto.ContributionScheduleDto;
import my.wealthtracker.app.dto.FinancialFactsDto;
import my.wealthtracker.app.dto.HoldingDto;
import my.wealthtracker.app.dto.HoldingSnapshotDto;
import my.wealthtracker.app.dto.MilestoneDto;
import my.wealthtracker.app.model.FinancialFacts;
import my.wealthtracker.app.model.Milestone;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class SnapshotMapper {
	private final Clock clock;

	public SnapshotMapper(Clock clock) {
		this.clock = clock;
	}

	public HoldingSnapshot toSnapshot(HoldingSnapshotDto dto) {
		if (dto == null) {
			throw new ValidationException("snapshot", "must not be null");
		}
		List<HoldingDto> items = dto.holdings() == null ? List.of() : dto.holdings();
		List<Holding> holdings = new ArrayList<>(items.size());
		for (int i = 0; i < items.size(); i++) {
			holdings.add(toHolding(items.get(i), i));
		}
		LocalDate valuationDate = dto.valuationDate() == null ? LocalDate.now(clock) : dto.valuationDate();
		return new HoldingSnapshot(holdings, valuationDate);
	}

	public HoldingSnapshotDto toDto(HoldingSnapshot snapshot) {
		List<HoldingDto> holdings = snapshot.holdings().stream()
				.map(holding -> new HoldingDto(
						holding.id(),
						holding.name(),
						holding.category(),
						holding.costBasis(),
						holding.currentValue(),
						holding.acquisitionDate(),
						toDto(holding.contributionSchedule()),
						holding.metadata().isEmpty() ? null : holding.metadata()))
				.toList();
		return new HoldingSnapshotDto(holdings, snapshot.valuationDate());
	}

	public FinancialFacts toFacts(FinancialFactsDto dto) {
		if (dto == null) {
			return FinancialFacts.empty();
		}
		return new FinancialFacts(dto.monthlyIncome(), dto.monthlyExpenses(), dto.monthlyDebtPayments(),
				dto.emergencyFund(), dto.monthlySavings());
	}

	public List<Milestone> toMilestones(List<MilestoneDto> milestones) {
		if (milestones == null) {
			return List.of();
		}
		List<Milestone> mapped = new ArrayList<>(milestones.size());
		for (int i = 0; i < milestones.size(); i++) {
			MilestoneDto item = milestones.get(i);
			if (item == null) {
				throw new ValidationException("milestones[" + i + "]", "must not be null");
			}
			mapped.add(new Milestone(item.name(), item.targetAmount(), item.targetDate()));
		}
		return List.copyOf(mapped);
	}

	public Map<AssetCategory, BigDecimal> toCategoryRates(Map<String, BigDecimal> rates, String field) {
		Map<AssetCategory, BigDecimal> resolved = new EnumMap<>(AssetCategory.class);
		if (rates == null) {
			return resolved;
		}
		for (Map.Entry<String, BigDecimal> entry : rates.entrySet()) {
			if (entry.getValue() == null) {
				continue;
			}
			try {
				resolved.put(AssetCategory.fromKey(entry.getKey()), entry.getValue());
			} catch (IllegalArgumentException ex) {
				throw new ValidationException(field + "." + entry.getKey(), ex.getMessage());
			}
		}
		return resolved;
	}

	private Holding toHolding(HoldingDto dto, int index) {
		String prefix = "holdings[" + index + "]";
		if (dto == null) {
			throw new ValidationException(prefix, "must not be null");
		}
		if (dto.category() == null) {
			throw new ValidationException(prefix + ".category", "must not be null");
		}
		if (dto.costBasis() == null) {
			throw new ValidationException(prefix + ".costBasis", "must not be null");
		}
		if (dto.currentValue() == null) {
			throw new ValidationException(prefix + ".currentValue", "must not be null");
		}
		String id = dto.id() == null || dto.id().isBlank() ? "holding-" + (index + 1) : dto.id();
		return new Holding(id, dto.name(), dto.category(), dto.costBasis(), dto.currentValue(),
				dto.acquisitionDate(), toSchedule(dto.contributionSchedule()), dto.metadata());
	}

	private static ContributionSchedule toSchedule(ContributionScheduleDto dto) {
		if (dto == null) {
			return null;
		}
		return new ContributionSchedule(dto.monthlyAmount(), dto.startDate(), dto.stepUpPct(),
				dto.active() == null || dto.active());
	}

	private static ContributionScheduleDto toDto(ContributionSchedule schedule) {
		if (schedule == null) {
			return null;
		}
		return new ContributionScheduleDto(schedule.monthlyAmount(), schedule.startDate(), schedule.stepUpPct(),
				schedule.active());
	}
}
