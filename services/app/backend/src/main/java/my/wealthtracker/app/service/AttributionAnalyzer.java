package my.wealthtracker.app.service;

import my.wealthtracker.app.domain.AssetCategory;
import my.wealthtracker.app.domain.Holding;
import my.wealthtracker.app.domain.HoldingSnapshot;
import my.wealthtracker.app.model.AttributionResult;
import my.wealthtracker.app.model.AttributionResult.Performer;
import my.wealthtracker.app.model.AttributionResult.SectorPerformance;
import my.wealthtracker.app.service.util.Amounts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class AttributionAnalyzer {
	private static final Logger logger = LoggerFactory.getLogger(AttributionAnalyzer.class);
	public static final int DEFAULT_TOP_PERFORMERS = 5;

	private final int topPerformers;

	public AttributionAnalyzer(int topPerformers) {
		this.topPerformers = topPerformers < 1 ? DEFAULT_TOP_PERFORMERS : topPerformers;
	}

	public AttributionResult attribute(HoldingSnapshot snapshot) {
		SnapshotValidator.validate(snapshot);
		BigDecimal totalValue = snapshot.totalCurrentValue();

		List<MeasuredHolding> measured = new ArrayList<>();
		Map<AssetCategory, SectorAccumulator> sectors = new EnumMap<>(AssetCategory.class);
		BigDecimal measuredCost = BigDecimal.ZERO;
		BigDecimal measuredValue = BigDecimal.ZERO;
		for (Holding holding : snapshot.holdings()) {
			SectorAccumulator sector = sectors.computeIfAbsent(holding.category(), key -> new SectorAccumulator());
			sector.value = sector.value.add(holding.currentValue());
			sector.holdings++;
			// a zero cost basis has no defined return; it still counts towards allocation
			if (holding.costBasis().signum() == 0) {
				continue;
			}
			BigDecimal returnPct = returnPct(holding);
			measured.add(new MeasuredHolding(holding, returnPct));
			sector.returnSum = sector.returnSum.add(returnPct);
			sector.measured++;
			measuredCost = measuredCost.add(holding.costBasis());
			measuredValue = measuredValue.add(holding.currentValue());
		}

		List<Performer> best = measured.stream()
				.sorted(Comparator.comparing(MeasuredHolding::returnPct).reversed())
				.limit(topPerformers)
				.map(item -> new Performer(
						item.holding().id(),
						item.holding().name(),
						item.holding().category().key(),
						Amounts.percent(item.returnPct())))
				.toList();

		Map<String, SectorPerformance> sectorAnalysis = new LinkedHashMap<>();
		for (Map.Entry<AssetCategory, SectorAccumulator> entry : sectors.entrySet()) {
			SectorAccumulator sector = entry.getValue();
			BigDecimal average = sector.measured == 0
					? null
					: sector.returnSum.divide(BigDecimal.valueOf(sector.measured), Amounts.MONEY_SCALE, RoundingMode.HALF_UP);
			sectorAnalysis.put(entry.getKey().key(), new SectorPerformance(
					Amounts.percentOf(sector.value, totalValue),
					average,
					sector.holdings));
		}

		BigDecimal portfolioReturn = Amounts.percentOf(measuredValue.subtract(measuredCost), measuredCost);
		logger.debug("Attributed {} holdings across {} categories", snapshot.holdings().size(), sectors.size());
		return new AttributionResult(best, Collections.unmodifiableMap(sectorAnalysis), portfolioReturn);
	}

	public int topPerformers() {
		return topPerformers;
	}

	static BigDecimal returnPct(Holding holding) {
		return holding.gain()
				.multiply(Amounts.ONE_HUNDRED)
				.divide(holding.costBasis(), Amounts.RATIO_SCALE, RoundingMode.HALF_UP);
	}

	private record MeasuredHolding(Holding holding, BigDecimal returnPct) {
	}

	private static final class SectorAccumulator {
		private BigDecimal value = BigDecimal.ZERO;
		private BigDecimal returnSum = BigDecimal.ZERO;
		private int holdings;
		private int measured;
	}
}
