package my.wealthtracker.app.service;

import my.wealthtracker.app.config.AppProperties;
import my.wealthtracker.app.domain.AssetCategory;
import my.wealthtracker.app.dto.TaxConfigDto;
import my.wealthtracker.app.model.TaxConfig;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

@Service
public class TaxConfigService {
	private static final BigDecimal DEFAULT_LONG_TERM_RATE_PCT = new BigDecimal("10");
	private static final BigDecimal DEFAULT_SHORT_TERM_RATE_PCT = new BigDecimal("15");
	private static final BigDecimal DEFAULT_LONG_TERM_EXEMPTION = new BigDecimal("100000");

	private final TaxConfig defaults;

	public TaxConfigService(AppProperties properties) {
		this.defaults = fromProperties(properties == null ? null : properties.tax());
	}

	public TaxConfig defaults() {
		return defaults;
	}

	/**
	 * Returns the request's own table when one is given, otherwise the configured defaults. A request
	 * table is taken as a whole; it is not merged with the defaults.
	 */
	public TaxConfig resolve(TaxConfigDto override) {
		if (override == null) {
			return defaults;
		}
		return new TaxConfig(
				categoryDays(override.holdingPeriodDays(), "taxConfig.holdingPeriodDays"),
				override.longTermRatePct(),
				override.shortTermRatePct(),
				override.longTermExemption()
		);
	}

	static Map<AssetCategory, Integer> defaultHoldingPeriods() {
		Map<AssetCategory, Integer> days = new EnumMap<>(AssetCategory.class);
		days.put(AssetCategory.EQUITIES, 365);
		days.put(AssetCategory.POOLED_FUNDS, 365);
		days.put(AssetCategory.CRYPTO_ASSETS, 365);
		days.put(AssetCategory.REAL_ESTATE, 730);
		days.put(AssetCategory.FIXED_INCOME, 1095);
		days.put(AssetCategory.PRECIOUS_METALS, 1095);
		days.put(AssetCategory.OTHER, 1095);
		return days;
	}

	private static TaxConfig fromProperties(AppProperties.Tax tax) {
		Map<AssetCategory, Integer> days = defaultHoldingPeriods();
		if (tax == null) {
			return new TaxConfig(days, DEFAULT_LONG_TERM_RATE_PCT, DEFAULT_SHORT_TERM_RATE_PCT, DEFAULT_LONG_TERM_EXEMPTION);
		}
		days.putAll(categoryDays(tax.holdingPeriodDays(), "app.tax.holding-period-days"));
		return new TaxConfig(
				days,
				tax.longTermRatePct() == null ? DEFAULT_LONG_TERM_RATE_PCT : tax.longTermRatePct(),
				tax.shortTermRatePct() == null ? DEFAULT_SHORT_TERM_RATE_PCT : tax.shortTermRatePct(),
				tax.longTermExemption() == null ? DEFAULT_LONG_TERM_EXEMPTION : tax.longTermExemption()
		);
	}

	private static Map<AssetCategory, Integer> categoryDays(Map<String, Integer> raw, String subject) {
		Map<AssetCategory, Integer> days = new EnumMap<>(AssetCategory.class);
		if (raw == null) {
			return days;
		}
		for (Map.Entry<String, Integer> entry : raw.entrySet()) {
			if (entry.getValue() == null) {
				continue;
			}
			try {
				days.put(AssetCategory.fromKey(entry.getKey()), entry.getValue());
			} catch (IllegalArgumentException ex) {
				throw new ConfigurationException(subject + "." + entry.getKey(), ex.getMessage());
			}
		}
		return days;
	}
}
