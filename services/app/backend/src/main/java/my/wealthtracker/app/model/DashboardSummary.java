package my.wealthtracker.app.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public record DashboardSummary(BigDecimal totalNetWorth,
							   BigDecimal totalInvestment,
							   BigDecimal totalGainLoss,
							   BigDecimal gainLossPercentage,
							   Map<String, BigDecimal> assetAllocation,
							   List<RecentHolding> recentHoldings,
							   List<MilestoneProgress> milestones) {

	public record RecentHolding(String id,
								String name,
								String category,
								BigDecimal currentValue,
								LocalDate acquisitionDate) {
	}

	public record MilestoneProgress(String name,
									BigDecimal targetAmount,
									LocalDate targetDate,
									BigDecimal progressPct,
									BigDecimal remainingAmount) {
	}
}
