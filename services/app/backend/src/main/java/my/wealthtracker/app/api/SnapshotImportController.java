package my.wealthtracker.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import my.wealthtracker.app.dto.HoldingSnapshotDto;
import my.wealthtracker.app.importer.HoldingsCsvParser;
import my.wealthtracker.app.service.SnapshotMapper;
import my.wealthtracker.app.service.ValidationException;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;

@RestController
@RequestMapping("/api/snapshots")
@Tag(name = "Snapshots")
public class SnapshotImportController {
	private final HoldingsCsvParser holdingsCsvParser;
	private final SnapshotMapper snapshotMapper;
	private final Clock clock;

	public SnapshotImportController(HoldingsCsvParser holdingsCsvParser, SnapshotMapper snapshotMapper, Clock clock) {
		this.holdingsCsvParser = holdingsCsvParser;
		this.snapshotMapper = snapshotMapper;
		this.clock = clock;
	}

	@PostMapping(value = "/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
	@Operation(summary = "Parse a holdings CSV into a snapshot")
	public HoldingSnapshotDto importCsv(@RequestPart("file") MultipartFile file,
										@RequestParam(value = "valuationDate", required = false)
										@DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate valuationDate) {
		if (file == null || file.isEmpty()) {
			throw new ValidationException("file", "must not be empty");
		}
		byte[] payload;
		try {
			payload = file.getBytes();
		} catch (IOException exc) {
			throw new ValidationException("file", "could not be read");
		}
		LocalDate asOf = valuationDate == null ? LocalDate.now(clock) : valuationDate;
		return snapshotMapper.toDto(holdingsCsvParser.parse(payload, asOf));
	}
}
