package my.wealthtracker.app.service;

import my.wealthtracker.app.config.AppProperties;
import my.wealthtracker.app.domain.AssetCategory;
import my.wealthtracker.app.dto.TaxConfigDto;
import my.wealthtracker.app.model.TaxConfig;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaxConfigServiceTest {
	@Test
	void defaultsCoverEveryCategory() {
		TaxConfig defaults = new TaxConfigService(null).defaults();

		assertThat(defaults.holdingPeriodDays()).containsOnlyKeys(AssetCategory.values());
		assertThat(defaults.longTermRatePct()).isEqualByComparingTo("10");
		assertThat(defaults.shortTermRatePct()).isEqualByComparingTo("15");
		assertThat(defaults.longTermExemption()).isEqualByComparingTo("100000");
	}

	@Test
	void propertiesOverrideIndividualCategories() {
		AppProperties properties = new AppProperties(null, null, null, null,
				new AppProperties.Tax(new BigDecimal("12.5"), null, null, Map.of("gold", 730)));

		TaxConfig config = new TaxConfigService(properties).defaults();

		assertThat(config.longTermRatePct()).isEqualByComparingTo("12.5");
		assertThat(config.shortTermRatePct()).isEqualByComparingTo("15");
		assertThat(config.holdingPeriodDays()).containsEntry(AssetCategory.PRECIOUS_METALS, 730)
				.containsEntry(AssetCategory.EQUITIES, 365);
	}

	@Test
	void requestTableReplacesDefaults() {
		TaxConfigService service = new TaxConfigService(null);

		TaxConfig config = service.resolve(new TaxConfigDto(BigDecimal.ONE, BigDecimal.TEN, BigDecimal.ZERO,
				Map.of("stocks", 180)));

		assertThat(config.holdingPeriodDays()).containsOnlyKeys(AssetCategory.EQUITIES);
		assertThat(service.resolve(null)).isSameAs(service.defaults());
	}

	@Test
	void unknownCategoryInPropertiesFails() {
		AppProperties properties = new AppProperties(null, null, null, null,
				new AppProperties.Tax(null, null, null, Map.of("tulips", 30)));

		assertThatThrownBy(() -> new TaxConfigService(properties))
				.isInstanceOf(ConfigurationException.class)
				.hasMessageContaining("app.tax.holding-period-days.tulips");
	}
}
