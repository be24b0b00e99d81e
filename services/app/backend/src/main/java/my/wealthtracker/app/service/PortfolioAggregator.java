package my.wealthtracker.app.service;

import my.wealthtracker.app.model.ProjectionPoint;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Service
public class PortfolioAggregator {

	public List<ProjectionPoint> aggregate(List<List<ProjectionPoint>> perCategory, int horizonYears) {
		if (horizonYears < 1) {
			throw new ValidationException("horizonYears", "must be at least 1");
		}
		BigDecimal[] totals = zeros(horizonYears);
		BigDecimal[] contributions = zeros(horizonYears);
		BigDecimal[] lumpsums = zeros(horizonYears);
		List<List<ProjectionPoint>> series = perCategory == null ? List.of() : perCategory;
		for (int index = 0; index < series.size(); index++) {
			List<ProjectionPoint> points = series.get(index);
			int size = points == null ? 0 : points.size();
			if (size != horizonYears) {
				throw new ConfigurationException("projections[" + index + "]",
						"covers " + size + " years but the aggregate horizon is " + horizonYears);
			}
			for (int i = 0; i < horizonYears; i++) {
				ProjectionPoint point = points.get(i);
				if (point.year() != i + 1) {
					throw new ConfigurationException("projections[" + index + "]",
							"year " + point.year() + " found at position " + (i + 1));
				}
				totals[i] = totals[i].add(point.totalValue());
				contributions[i] = contributions[i].add(point.contributionValue());
				lumpsums[i] = lumpsums[i].add(point.lumpsumValue());
			}
		}
		List<ProjectionPoint> merged = new ArrayList<>(horizonYears);
		for (int i = 0; i < horizonYears; i++) {
			merged.add(new ProjectionPoint(i + 1, totals[i], contributions[i], lumpsums[i]));
		}
		return List.copyOf(merged);
	}

	private static BigDecimal[] zeros(int size) {
		BigDecimal[] values = new BigDecimal[size];
		for (int i = 0; i < size; i++) {
			values[i] = BigDecimal.ZERO.setScale(2);
		}
		return values;
	}
}
