package my.wealthtracker.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.wealthtracker.app.dto.MonteCarloJobResponseDto;
import my.wealthtracker.app.dto.MonteCarloRequestDto;
import my.wealthtracker.app.service.MonteCarloJobService;
import my.wealthtracker.app.service.MonteCarloService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/analytics/monte-carlo/jobs")
@Tag(name = "Monte Carlo Jobs")
public class MonteCarloJobController {
	private final MonteCarloJobService monteCarloJobService;
	private final MonteCarloService monteCarloService;

	public MonteCarloJobController(MonteCarloJobService monteCarloJobService, MonteCarloService monteCarloService) {
		this.monteCarloJobService = monteCarloJobService;
		this.monteCarloService = monteCarloService;
	}

	@PostMapping
	@ResponseStatus(HttpStatus.ACCEPTED)
	@Operation(summary = "Start a Monte Carlo job")
	public MonteCarloJobResponseDto start(@Valid @RequestBody MonteCarloRequestDto request) {
		return monteCarloJobService.start(monteCarloService.parameters(request));
	}

	@GetMapping("/{jobId}")
	@Operation(summary = "Get Monte Carlo job status")
	public MonteCarloJobResponseDto get(@PathVariable("jobId") String jobId) {
		return monteCarloJobService.get(jobId);
	}

	@DeleteMapping("/{jobId}")
	@Operation(summary = "Cancel a Monte Carlo job")
	public MonteCarloJobResponseDto cancel(@PathVariable("jobId") String jobId) {
		return monteCarloJobService.cancel(jobId);
	}
}
