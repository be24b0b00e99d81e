package my.wealthtracker.app.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Per-holding and per-category return attribution. {@code averageReturnPct} of a sector is the plain
 * mean over its holdings (each holding counts once regardless of size) and is {@code null} when no
 * holding in the sector has a cost basis to measure against. {@code portfolioReturnPct} is value-weighted.
 */
public record AttributionResult(List<Performer> bestPerformers,
								Map<String, SectorPerformance> sectorAnalysis,
								BigDecimal portfolioReturnPct) {

	public record Performer(String holdingId,
							String name,
							String category,
							BigDecimal returnPct) {
	}

	public record SectorPerformance(BigDecimal allocationPct,
									BigDecimal averageReturnPct,
									int holdingCount) {
	}
}
