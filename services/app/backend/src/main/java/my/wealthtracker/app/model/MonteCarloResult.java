package my.wealthtracker.app.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

public record MonteCarloResult(List<Integer> years,
							   List<BigDecimal> percentile10,
							   List<BigDecimal> percentile25,
							   List<BigDecimal> percentile50,
							   List<BigDecimal> percentile75,
							   List<BigDecimal> percentile90,
							   Map<String, BigDecimal> finalValues,
							   int simulationCount,
							   long seed) {
	public static final String WORST_CASE = "worst_case";
	public static final String PESSIMISTIC = "pessimistic";
	public static final String MOST_LIKELY = "most_likely";
	public static final String OPTIMISTIC = "optimistic";
	public static final String BEST_CASE = "best_case";
}
