package my.wealthtracker.app.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record Holding(String id,
					  String name,
					  AssetCategory category,
					  BigDecimal costBasis,
					  BigDecimal currentValue,
					  LocalDate acquisitionDate,
					  ContributionSchedule contributionSchedule,
					  Map<String, Object> metadata) {
	public Holding {
		Objects.requireNonNull(category, "category must not be null");
		Objects.requireNonNull(costBasis, "costBasis must not be null");
		Objects.requireNonNull(currentValue, "currentValue must not be null");
		name = name == null || name.isBlank() ? id : name;
		metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
	}

	public BigDecimal gain() {
		return currentValue.subtract(costBasis);
	}

	public boolean hasActiveContribution() {
		return contributionSchedule != null && contributionSchedule.contributes();
	}
}
