package my.wealthtracker.app.importer;

import my.wealthtracker.app.domain.AssetCategory;
import my.wealthtracker.app.domain.ContributionSchedule;
import my.wealthtracker.app.domain.Holding;
import my.wealthtracker.app.domain.HoldingSnapshot;
import my.wealthtracker.app.service.ValidationException;
import my.wealthtracker.app.util.CsvParsing;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
public class HoldingsCsvParser {
	private static final Logger logger = LoggerFactory.getLogger(HoldingsCsvParser.class);
	private static final List<String> REQUIRED_COLUMNS = List.of(
			"id", "name", "category", "cost_basis", "current_value", "acquisition_date");
	private static final String MONTHLY_CONTRIBUTION = "monthly_contribution";
	private static final String CONTRIBUTION_START = "contribution_start";
	private static final String STEP_UP_PCT = "step_up_pct";
	private static final String CONTRIBUTION_ACTIVE = "contribution_active";

	public HoldingSnapshot parse(byte[] payload, LocalDate valuationDate) {
		String text = CsvParsing.decodeUtf8(payload);
		if (text.isBlank()) {
			throw new ValidationException("file", "CSV is empty");
		}
		int firstLineEnd = text.indexOf('\n');
		char delimiter = CsvParsing.sniffDelimiter(firstLineEnd < 0 ? text : text.substring(0, firstLineEnd));

		List<Holding> holdings = new ArrayList<>();
		CSVFormat format = CSVFormat.DEFAULT.builder()
				.setDelimiter(delimiter)
				.setHeader()
				.setSkipHeaderRecord(true)
				.setIgnoreEmptyLines(true)
				.setAllowMissingColumnNames(true)
				.build();
		try (CSVParser parser = CSVParser.parse(new StringReader(text), format)) {
			Map<String, String> headerMap = new HashMap<>();
			for (String header : parser.getHeaderNames()) {
				if (header != null && !header.isBlank()) {
					headerMap.put(header.trim().toLowerCase(Locale.ROOT), header);
				}
			}
			for (String required : REQUIRED_COLUMNS) {
				if (!headerMap.containsKey(required)) {
					throw new ValidationException("header", "CSV header must include '" + required + "'");
				}
			}
			for (CSVRecord record : parser) {
				if (isBlank(record)) {
					continue;
				}
				holdings.add(parseRow(record, headerMap));
			}
		} catch (IOException exc) {
			throw new ValidationException("file", "Failed to read CSV: " + exc.getMessage());
		}
		logger.info("Parsed {} holdings from CSV", holdings.size());
		return new HoldingSnapshot(holdings, valuationDate);
	}

	private Holding parseRow(CSVRecord record, Map<String, String> headerMap) {
		// header is line 1
		long line = record.getRecordNumber() + 1;
		String id = get(record, headerMap, "id");
		if (id.isBlank()) {
			throw cellError(line, "id", "is required");
		}
		AssetCategory category;
		try {
			category = AssetCategory.fromKey(get(record, headerMap, "category"));
		} catch (IllegalArgumentException exc) {
			throw cellError(line, "category", exc.getMessage());
		}
		BigDecimal costBasis = requiredDecimal(record, headerMap, line, "cost_basis");
		BigDecimal currentValue = requiredDecimal(record, headerMap, line, "current_value");
		LocalDate acquired = date(record, headerMap, line, "acquisition_date");

		ContributionSchedule schedule = null;
		BigDecimal monthly = decimal(record, headerMap, line, MONTHLY_CONTRIBUTION);
		if (monthly != null) {
			boolean active;
			try {
				active = CsvParsing.parseBoolean(get(record, headerMap, CONTRIBUTION_ACTIVE), true);
			} catch (IllegalArgumentException exc) {
				throw cellError(line, CONTRIBUTION_ACTIVE, exc.getMessage());
			}
			schedule = new ContributionSchedule(monthly,
					date(record, headerMap, line, CONTRIBUTION_START),
					decimal(record, headerMap, line, STEP_UP_PCT),
					active);
		}
		return new Holding(id, get(record, headerMap, "name"), category, costBasis, currentValue, acquired, schedule, null);
	}

	private BigDecimal requiredDecimal(CSVRecord record, Map<String, String> headerMap, long line, String column) {
		BigDecimal value = decimal(record, headerMap, line, column);
		if (value == null) {
			throw cellError(line, column, "is required");
		}
		if (value.signum() < 0) {
			throw cellError(line, column, "must not be negative");
		}
		return value;
	}

	private BigDecimal decimal(CSVRecord record, Map<String, String> headerMap, long line, String column) {
		try {
			return CsvParsing.parseDecimal(get(record, headerMap, column));
		} catch (IllegalArgumentException exc) {
			throw cellError(line, column, exc.getMessage());
		}
	}

	private LocalDate date(CSVRecord record, Map<String, String> headerMap, long line, String column) {
		try {
			return CsvParsing.parseDate(get(record, headerMap, column));
		} catch (IllegalArgumentException exc) {
			throw cellError(line, column, exc.getMessage());
		}
	}

	private String get(CSVRecord record, Map<String, String> headerMap, String key) {
		String header = headerMap.get(key);
		if (header == null || !record.isSet(header)) {
			return "";
		}
		String value = record.get(header);
		return value == null ? "" : value.trim();
	}

	private boolean isBlank(CSVRecord record) {
		for (String value : record) {
			if (value != null && !value.isBlank()) {
				return false;
			}
		}
		return true;
	}

	private ValidationException cellError(long line, String column, String message) {
		return new ValidationException("line " + line + ", column " + column, message);
	}
}
