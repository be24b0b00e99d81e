package my.wealthtracker.app.service;

import my.wealthtracker.app.dto.MonteCarloJobResponseDto;
import my.wealthtracker.app.dto.MonteCarloJobStatus;
import my.wealthtracker.app.model.MonteCarloParameters;
import my.wealthtracker.app.model.MonteCarloResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.server.ResponseStatusException;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MonteCarloJobServiceTest {
	private static final MonteCarloParameters PARAMETERS = new MonteCarloParameters(
			new BigDecimal("1000"), new BigDecimal("7"), new BigDecimal("15"), 2, 100, 11L);

	@Mock
	private MonteCarloService monteCarloService;

	private MonteCarloJobService jobService;

	@BeforeEach
	void setUp() {
		jobService = new MonteCarloJobService(monteCarloService, null);
	}

	@AfterEach
	void tearDown() {
		jobService.shutdown();
	}

	@Test
	void completedJobCarriesResult() throws Exception {
		MonteCarloResult result = sampleResult();
		when(monteCarloService.newSignal()).thenReturn(CancellationSignal.none());
		when(monteCarloService.simulate(eq(PARAMETERS), any(CancellationSignal.class))).thenReturn(result);

		MonteCarloJobResponseDto started = jobService.start(PARAMETERS);
		assertThat(started.jobId()).isNotBlank();

		MonteCarloJobResponseDto finished = awaitStatus(started.jobId(), MonteCarloJobStatus.DONE);
		assertThat(finished.result()).isEqualTo(result);
		assertThat(finished.error()).isNull();
	}

	@Test
	void failedJobReportsErrorReference() throws Exception {
		when(monteCarloService.newSignal()).thenReturn(CancellationSignal.none());
		when(monteCarloService.simulate(eq(PARAMETERS), any(CancellationSignal.class)))
				.thenThrow(new IllegalStateException("boom"));

		MonteCarloJobResponseDto started = jobService.start(PARAMETERS);

		MonteCarloJobResponseDto failed = awaitStatus(started.jobId(), MonteCarloJobStatus.FAILED);
		assertThat(failed.error()).startsWith("Error ref MC-");
		assertThat(failed.result()).isNull();
	}

	@Test
	void overflowDuringRunReportsFieldMessage() throws Exception {
		when(monteCarloService.newSignal()).thenReturn(CancellationSignal.none());
		when(monteCarloService.simulate(eq(PARAMETERS), any(CancellationSignal.class)))
				.thenThrow(new ValidationException("startingValue", "result is not representable"));

		MonteCarloJobResponseDto started = jobService.start(PARAMETERS);

		MonteCarloJobResponseDto failed = awaitStatus(started.jobId(), MonteCarloJobStatus.FAILED);
		assertThat(failed.error()).isEqualTo("startingValue: result is not representable");
		assertThat(failed.result()).isNull();
	}

	@Test
	void cancelStopsRunningJob() throws Exception {
		when(monteCarloService.newSignal()).thenReturn(CancellationSignal.none());
		when(monteCarloService.simulate(eq(PARAMETERS), any(CancellationSignal.class))).thenAnswer(invocation -> {
			CancellationSignal signal = invocation.getArgument(1);
			while (!signal.isCancelled()) {
				Thread.sleep(5);
			}
			signal.throwIfCancelled();
			return null;
		});

		MonteCarloJobResponseDto started = jobService.start(PARAMETERS);
		awaitStatus(started.jobId(), MonteCarloJobStatus.RUNNING);

		jobService.cancel(started.jobId());

		MonteCarloJobResponseDto cancelled = awaitStatus(started.jobId(), MonteCarloJobStatus.CANCELLED);
		assertThat(cancelled.error()).isEqualTo("Simulation cancelled");
	}

	@Test
	void invalidParametersAreRejectedBeforeStart() {
		doThrow(new ValidationException("simulationCount", "must be at least 100"))
				.when(monteCarloService).validate(PARAMETERS);

		assertThatThrownBy(() -> jobService.start(PARAMETERS))
				.isInstanceOf(ValidationException.class);
		verify(monteCarloService, never()).simulate(any(), any());
	}

	@Test
	void unknownJobIsNotFound() {
		assertThatThrownBy(() -> jobService.get("missing"))
				.isInstanceOf(ResponseStatusException.class)
				.hasMessageContaining("not found");
		assertThatThrownBy(() -> jobService.cancel("missing"))
				.isInstanceOf(ResponseStatusException.class);
	}

	private MonteCarloJobResponseDto awaitStatus(String jobId, MonteCarloJobStatus expected) throws InterruptedException {
		long deadline = System.currentTimeMillis() + 5_000;
		MonteCarloJobResponseDto current = jobService.get(jobId);
		while (current.status() != expected) {
			if (System.currentTimeMillis() > deadline) {
				fail("Job " + jobId + " stuck in " + current.status() + ", expected " + expected);
			}
			Thread.sleep(10);
			current = jobService.get(jobId);
		}
		return current;
	}

	private static MonteCarloResult sampleResult() {
		List<BigDecimal> band = List.of(new BigDecimal("1000.00"), new BigDecimal("1070.00"));
		return new MonteCarloResult(List.of(1, 2), band, band, band, band, band,
				Map.of(MonteCarloResult.MOST_LIKELY, new BigDecimal("1070.00")), 100, 11L);
	}
}
