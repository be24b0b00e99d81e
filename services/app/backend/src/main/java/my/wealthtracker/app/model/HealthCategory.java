package my.wealthtracker.app.model;

public enum HealthCategory {
	DIVERSIFICATION("diversification",
			"Diversify across more asset categories to reduce concentration risk",
			"Well diversified portfolio"),
	EMERGENCY_FUND("emergency_fund",
			"Build an emergency fund covering at least 6 months of expenses",
			"Strong emergency fund coverage"),
	DEBT_MANAGEMENT("debt_management",
			"Bring monthly debt payments below 36% of income",
			"Healthy debt levels"),
	SAVINGS_RATE("savings_rate",
			"Raise your savings rate towards 20-30% of income",
			"Excellent savings discipline"),
	GROWTH_TRAJECTORY("growth_trajectory",
			"Review underperforming holdings and your long-term growth allocation",
			"Strong portfolio growth");

	private final String key;
	private final String recommendation;
	private final String strength;

	HealthCategory(String key, String recommendation, String strength) {
		this.key = key;
		this.recommendation = recommendation;
		this.strength = strength;
	}

	public String key() {
		return key;
	}

	public String recommendation(String explanation) {
		return explanation == null || explanation.isBlank() ? recommendation : recommendation + ": " + explanation;
	}

	public String strength() {
		return strength;
	}
}
