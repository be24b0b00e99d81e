package my.wealthtracker.app.service;

import my.wealthtracker.app.domain.AssetCategory;
import my.wealthtracker.app.domain.Holding;
import my.wealthtracker.app.domain.HoldingSnapshot;
import my.wealthtracker.app.model.DashboardSummary;
import my.wealthtracker.app.model.DashboardSummary.MilestoneProgress;
import my.wealthtracker.app.model.DashboardSummary.RecentHolding;
import my.wealthtracker.app.model.Milestone;
import my.wealthtracker.app.service.util.Amounts;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class DashboardService {
	static final int RECENT_HOLDINGS = 5;

	public DashboardSummary summarize(HoldingSnapshot snapshot, List<Milestone> milestones) {
		SnapshotValidator.validate(snapshot);
		BigDecimal netWorth = Amounts.money(snapshot.totalCurrentValue());
		BigDecimal investment = Amounts.money(snapshot.totalCostBasis());
		BigDecimal gainLoss = netWorth.subtract(investment);

		Map<String, BigDecimal> allocation = new LinkedHashMap<>();
		for (Map.Entry<AssetCategory, BigDecimal> entry : snapshot.valueByCategory().entrySet()) {
			allocation.put(entry.getKey().key(), Amounts.money(entry.getValue()));
		}

		List<RecentHolding> recent = snapshot.holdings().stream()
				.sorted(Comparator.comparing(Holding::acquisitionDate,
						Comparator.nullsLast(Comparator.<LocalDate>reverseOrder())))
				.limit(RECENT_HOLDINGS)
				.map(holding -> new RecentHolding(
						holding.id(),
						holding.name(),
						holding.category().key(),
						Amounts.money(holding.currentValue()),
						holding.acquisitionDate()))
				.toList();

		return new DashboardSummary(
				netWorth,
				investment,
				gainLoss,
				Amounts.percentOf(gainLoss, investment),
				Collections.unmodifiableMap(allocation),
				recent,
				progress(netWorth, milestones)
		);
	}

	private static List<MilestoneProgress> progress(BigDecimal netWorth, List<Milestone> milestones) {
		if (milestones == null || milestones.isEmpty()) {
			return List.of();
		}
		List<MilestoneProgress> result = new ArrayList<>(milestones.size());
		for (int i = 0; i < milestones.size(); i++) {
			Milestone milestone = milestones.get(i);
			if (milestone == null || milestone.targetAmount() == null || milestone.targetAmount().signum() <= 0) {
				throw new ValidationException("milestones[" + i + "].targetAmount", "must be positive");
			}
			BigDecimal progress = Amounts.percentOf(netWorth, milestone.targetAmount()).min(Amounts.ONE_HUNDRED.setScale(Amounts.MONEY_SCALE));
			BigDecimal remaining = Amounts.money(milestone.targetAmount().subtract(netWorth).max(BigDecimal.ZERO));
			result.add(new MilestoneProgress(milestone.name(), milestone.targetAmount(), milestone.targetDate(),
					progress, remaining));
		}
		return List.copyOf(result);
	}
}
