package my.wealthtracker.app.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

public enum AssetCategory {
	EQUITIES("equities", "stocks"),
	POOLED_FUNDS("pooled-funds", "mutual_funds"),
	CRYPTO_ASSETS("crypto-assets", "cryptocurrency"),
	REAL_ESTATE("real-estate", "real_estate"),
	FIXED_INCOME("fixed-income", "fixed_deposits"),
	PRECIOUS_METALS("precious-metals", "gold"),
	OTHER("other", "others");

	private final String key;
	private final List<String> aliases;

	AssetCategory(String key, String... aliases) {
		this.key = key;
		this.aliases = List.of(aliases);
	}

	@JsonValue
	public String key() {
		return key;
	}

	@JsonCreator
	public static AssetCategory fromKey(String raw) {
		if (raw == null || raw.isBlank()) {
			throw new IllegalArgumentException("Asset category must not be blank");
		}
		String normalized = normalize(raw);
		for (AssetCategory category : values()) {
			if (normalize(category.key).equals(normalized) || normalize(category.name()).equals(normalized)) {
				return category;
			}
			for (String alias : category.aliases) {
				if (normalize(alias).equals(normalized)) {
					return category;
				}
			}
		}
		throw new IllegalArgumentException("Unknown asset category: " + raw);
	}

	private static String normalize(String value) {
		return value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
	}
}
