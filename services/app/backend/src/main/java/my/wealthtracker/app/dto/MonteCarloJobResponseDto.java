package my.wealthtracker.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import my.wealthtracker.app.model.MonteCarloResult;

public record MonteCarloJobResponseDto(
		@JsonProperty("jobId") String jobId,
		@JsonProperty("status") MonteCarloJobStatus status,
		@JsonProperty("result") MonteCarloResult result,
		@JsonProperty("error") String error
) {
}
