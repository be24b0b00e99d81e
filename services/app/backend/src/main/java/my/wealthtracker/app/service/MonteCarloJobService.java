package my.wealthtracker.app.service;

import jakarta.annotation.PreDestroy;
import my.wealthtracker.app.config.AppProperties;
import my.wealthtracker.app.dto.MonteCarloJobResponseDto;
import my.wealthtracker.app.dto.MonteCarloJobStatus;
import my.wealthtracker.app.model.MonteCarloParameters;
import my.wealthtracker.app.model.MonteCarloResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;

@Service
public class MonteCarloJobService {
	private static final Logger logger = LoggerFactory.getLogger(MonteCarloJobService.class);
	private static final Duration DEFAULT_JOB_TTL = Duration.ofMinutes(30);
	private static final int DEFAULT_MAX_CONCURRENT_JOBS = 2;

	private final MonteCarloService monteCarloService;
	private final Duration jobTtl;
	private final Map<String, JobState> jobs = new ConcurrentHashMap<>();
	private final ExecutorService executor = Executors.newCachedThreadPool();
	private final Semaphore concurrency;

	public MonteCarloJobService(MonteCarloService monteCarloService, AppProperties properties) {
		this.monteCarloService = monteCarloService;
		AppProperties.MonteCarlo config = properties == null ? null : properties.monteCarlo();
		this.jobTtl = config == null || config.jobTtlMinutes() == null
				? DEFAULT_JOB_TTL
				: Duration.ofMinutes(config.jobTtlMinutes());
		this.concurrency = new Semaphore(config == null || config.maxConcurrentJobs() == null
				? DEFAULT_MAX_CONCURRENT_JOBS
				: config.maxConcurrentJobs());
	}

	public MonteCarloJobResponseDto start(MonteCarloParameters parameters) {
		monteCarloService.validate(parameters);
		cleanupExpired();
		String jobId = UUID.randomUUID().toString();
		JobState job = new JobState(jobId, parameters, Instant.now());
		jobs.put(jobId, job);
		executor.submit(() -> runJob(jobId));
		return toDto(job);
	}

	public MonteCarloJobResponseDto get(String jobId) {
		cleanupExpired();
		return toDto(require(jobId));
	}

	public MonteCarloJobResponseDto cancel(String jobId) {
		cleanupExpired();
		JobState job = require(jobId);
		synchronized (job) {
			job.cancelRequested = true;
			if (job.status == MonteCarloJobStatus.PENDING) {
				job.status = MonteCarloJobStatus.CANCELLED;
				job.finishedAt = Instant.now();
			}
			CancellationSignal signal = job.signal;
			if (signal != null) {
				signal.cancel();
			}
		}
		return toDto(job);
	}

	@PreDestroy
	public void shutdown() {
		executor.shutdownNow();
	}

	private void runJob(String jobId) {
		JobState job = jobs.get(jobId);
		if (job == null) {
			return;
		}
		try {
			concurrency.acquire();
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			job.status = MonteCarloJobStatus.FAILED;
			job.error = failWithReference(job, ex);
			job.finishedAt = Instant.now();
			return;
		}
		try {
			CancellationSignal signal = monteCarloService.newSignal();
			synchronized (job) {
				if (job.cancelRequested) {
					return;
				}
				job.signal = signal;
				job.status = MonteCarloJobStatus.RUNNING;
			}
			job.result = monteCarloService.simulate(job.parameters, signal);
			job.status = MonteCarloJobStatus.DONE;
		} catch (SimulationCancelledException ex) {
			job.status = MonteCarloJobStatus.CANCELLED;
			job.error = ex.getMessage();
			logger.info("Monte Carlo job {} stopped: {}", job.jobId, ex.getMessage());
		} catch (ValidationException ex) {
			job.status = MonteCarloJobStatus.FAILED;
			job.error = ex.getMessage();
			logger.warn("Monte Carlo job {} rejected: {}", job.jobId, ex.getMessage());
		} catch (Exception ex) {
			job.status = MonteCarloJobStatus.FAILED;
			job.error = failWithReference(job, ex);
		} finally {
			if (job.finishedAt == null) {
				job.finishedAt = Instant.now();
			}
			concurrency.release();
		}
	}

	private JobState require(String jobId) {
		JobState job = jobId == null ? null : jobs.get(jobId);
		if (job == null) {
			throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Monte Carlo job not found");
		}
		return job;
	}

	private MonteCarloJobResponseDto toDto(JobState job) {
		return new MonteCarloJobResponseDto(
				job.jobId,
				job.status,
				job.result,
				job.error
		);
	}

	private void cleanupExpired() {
		Instant now = Instant.now();
		jobs.entrySet().removeIf(entry -> {
			JobState job = entry.getValue();
			Instant base = job.finishedAt == null ? job.createdAt : job.finishedAt;
			return base.plus(jobTtl).isBefore(now);
		});
	}

	private String failWithReference(JobState job, Exception ex) {
		String message = ex == null ? null : ex.getMessage();
		String reference = "MC-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
		logger.error("Monte Carlo job failed (ref={}, jobId={}, error={})", reference, job.jobId, message, ex);
		return "Error ref " + reference;
	}

	private static final class JobState {
		private final String jobId;
		private final MonteCarloParameters parameters;
		private final Instant createdAt;

		private volatile Instant finishedAt;
		private volatile MonteCarloJobStatus status;
		private volatile MonteCarloResult result;
		private volatile String error;
		private volatile boolean cancelRequested;
		private volatile CancellationSignal signal;

		private JobState(String jobId, MonteCarloParameters parameters, Instant createdAt) {
			this.jobId = jobId;
			this.parameters = parameters;
			this.createdAt = createdAt;
			this.status = MonteCarloJobStatus.PENDING;
		}
	}
}
