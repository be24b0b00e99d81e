package my.wealthtracker.app.util;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;

public final class CsvParsing {
	private CsvParsing() {
	}

	public static String stripBom(String value) {
		if (value == null || value.isEmpty()) {
			return value;
		}
		if (value.charAt(0) == '\uFEFF') {
			return value.substring(1);
		}
		return value;
	}

	public static char sniffDelimiter(String sample) {
		if (sample == null || sample.isEmpty()) {
			return ',';
		}
		return sample.indexOf(';') >= 0 ? ';' : ',';
	}

	public static String decodeUtf8(byte[] payload) {
		if (payload == null) {
			return "";
		}
		return stripBom(new String(payload, StandardCharsets.UTF_8));
	}

	public static BigDecimal parseDecimal(String raw) {
		String value = trim(raw).replace(" ", "");
		if (value.isEmpty()) {
			return null;
		}
		if (value.contains(",") && value.contains(".")) {
			value = value.replace(",", "");
		} else if (value.contains(",")) {
			value = value.replace(",", ".");
		}
		try {
			return new BigDecimal(value);
		} catch (NumberFormatException exc) {
			throw new IllegalArgumentException("not a number: " + raw.trim());
		}
	}

	public static LocalDate parseDate(String raw) {
		String value = trim(raw);
		if (value.isEmpty()) {
			return null;
		}
		try {
			return LocalDate.parse(value);
		} catch (DateTimeParseException exc) {
			throw new IllegalArgumentException("not an ISO date: " + value);
		}
	}

	public static boolean parseBoolean(String raw, boolean defaultValue) {
		String value = trim(raw).toLowerCase(Locale.ROOT);
		if (value.isEmpty()) {
			return defaultValue;
		}
		return switch (value) {
			case "1", "true", "yes", "y", "on" -> true;
			case "0", "false", "no", "n", "off" -> false;
			default -> throw new IllegalArgumentException("not a boolean: " + value);
		};
	}

	private static String trim(String value) {
		return value == null ? "" : value.trim();
	}
}
