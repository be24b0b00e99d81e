package my.wealthtracker.app.dto;

import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

public record FinancialFactsDto(
		@PositiveOrZero BigDecimal monthlyIncome,
		@PositiveOrZero BigDecimal monthlyExpenses,
		@PositiveOrZero BigDecimal monthlyDebtPayments,
		@PositiveOrZero BigDecimal emergencyFund,
		BigDecimal monthlySavings
) {
}
