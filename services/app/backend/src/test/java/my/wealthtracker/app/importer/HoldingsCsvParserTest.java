package my.wealthtracker.app.importer;

import my.wealthtracker.app.domain.AssetCategory;
import my.wealthtracker.app.domain.Holding;
import my.wealthtracker.app.domain.HoldingSnapshot;
import my.wealthtracker.app.service.ValidationException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.Objects;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HoldingsCsvParserTest {
	private static final LocalDate VALUATION_DATE = LocalDate.of(2025, 6, 30);

	private final HoldingsCsvParser parser = new HoldingsCsvParser();

	@Test
	void parsesSampleResourceFile() throws IOException {
		HoldingSnapshot snapshot = parser.parse(readResource("/imports/holdings.csv"), VALUATION_DATE);

		assertThat(snapshot.valuationDate()).isEqualTo(VALUATION_DATE);
		assertThat(snapshot.holdings()).extracting(Holding::id).containsExactly("h1", "h2", "h3", "h4");
		assertThat(snapshot.holdings()).extracting(Holding::category).containsExactly(
				AssetCategory.POOLED_FUNDS, AssetCategory.EQUITIES, AssetCategory.CRYPTO_ASSETS,
				AssetCategory.PRECIOUS_METALS);

		Holding fund = snapshot.holdings().get(0);
		assertThat(fund.costBasis()).isEqualByComparingTo("100000");
		assertThat(fund.acquisitionDate()).isEqualTo(LocalDate.of(2021, 3, 15));
		assertThat(fund.contributionSchedule().monthlyAmount()).isEqualByComparingTo("5000");
		assertThat(fund.contributionSchedule().stepUpPct()).isEqualByComparingTo("10");
		assertThat(fund.hasActiveContribution()).isTrue();

		assertThat(snapshot.holdings().get(1).contributionSchedule()).isNull();
		assertThat(snapshot.holdings().get(3).contributionSchedule().active()).isFalse();
	}

	@Test
	void parsesSemicolonFileWithBomAndDecimalCommas() throws IOException {
		HoldingSnapshot snapshot = parser.parse(readResource("/imports/holdings-semicolon.csv"), VALUATION_DATE);

		assertThat(snapshot.holdings()).hasSize(2);
		Holding deposit = snapshot.holdings().get(0);
		assertThat(deposit.id()).isEqualTo("f1");
		assertThat(deposit.category()).isEqualTo(AssetCategory.FIXED_INCOME);
		assertThat(deposit.costBasis()).isEqualByComparingTo("10000.50");
		assertThat(deposit.currentValue()).isEqualByComparingTo("10800.75");
		assertThat(snapshot.holdings().get(1).category()).isEqualTo(AssetCategory.REAL_ESTATE);
	}

	@Test
	void headerMatchingIgnoresCaseAndColumnOrder() {
		String csv = "Name,ID,Current_Value,Cost_Basis,Category,Acquisition_Date\n"
				+ "Bond Fund,b1,1100,1000,fixed-income,2023-01-01\n";

		HoldingSnapshot snapshot = parser.parse(csv.getBytes(StandardCharsets.UTF_8), VALUATION_DATE);

		assertThat(snapshot.holdings()).singleElement().satisfies(holding -> {
			assertThat(holding.id()).isEqualTo("b1");
			assertThat(holding.name()).isEqualTo("Bond Fund");
			assertThat(holding.currentValue()).isEqualByComparingTo("1100");
		});
	}

	@Test
	void missingRequiredColumnIsRejected() {
		String csv = "id,name,category,cost_basis,acquisition_date\n"
				+ "a,A,stocks,10,2024-01-01\n";

		assertThatThrownBy(() -> parser.parse(csv.getBytes(StandardCharsets.UTF_8), VALUATION_DATE))
				.isInstanceOf(ValidationException.class)
				.hasMessageContaining("current_value");
	}

	@Test
	void badCellReportsLineAndColumn() {
		String csv = "id,name,category,cost_basis,current_value,acquisition_date\n"
				+ "a,A,stocks,10,12,2024-01-01\n"
				+ "b,B,stocks,ten,12,2024-01-01\n";

		assertThatThrownBy(() -> parser.parse(csv.getBytes(StandardCharsets.UTF_8), VALUATION_DATE))
				.isInstanceOf(ValidationException.class)
				.extracting(ex -> ((ValidationException) ex).getField())
				.isEqualTo("line 3, column cost_basis");
	}

	@Test
	void unknownCategoryIsRejected() {
		String csv = "id,name,category,cost_basis,current_value,acquisition_date\n"
				+ "a,A,tulips,10,12,2024-01-01\n";

		assertThatThrownBy(() -> parser.parse(csv.getBytes(StandardCharsets.UTF_8), VALUATION_DATE))
				.isInstanceOf(ValidationException.class)
				.hasMessageContaining("column category")
				.hasMessageContaining("tulips");
	}

	@Test
	void negativeAmountIsRejected() {
		String csv = "id,name,category,cost_basis,current_value,acquisition_date\n"
				+ "a,A,stocks,-10,12,2024-01-01\n";

		assertThatThrownBy(() -> parser.parse(csv.getBytes(StandardCharsets.UTF_8), VALUATION_DATE))
				.isInstanceOf(ValidationException.class)
				.hasMessageContaining("must not be negative");
	}

	@Test
	void emptyPayloadIsRejected() {
		assertThatThrownBy(() -> parser.parse(new byte[0], VALUATION_DATE))
				.isInstanceOf(ValidationException.class)
				.hasMessageContaining("CSV is empty");
	}

	private byte[] readResource(String path) throws IOException {
		try (InputStream stream = getClass().getResourceAsStream(path)) {
			return Objects.requireNonNull(stream, "Missing test resource " + path).readAllBytes();
		}
	}
}
