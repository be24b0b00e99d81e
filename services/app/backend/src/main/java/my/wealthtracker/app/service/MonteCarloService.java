package my.wealthtracker.app.service;

import my.wealthtracker.app.config.AppProperties;
import my.wealthtracker.app.domain.AssetCategory;
import my.wealthtracker.app.domain.HoldingSnapshot;
import my.wealthtracker.app.dto.MonteCarloRequestDto;
import my.wealthtracker.app.model.MonteCarloParameters;
import my.wealthtracker.app.model.MonteCarloResult;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;

@Service
public class MonteCarloService {
	static final int DEFAULT_SIMULATIONS = 5_000;
	static final BigDecimal DEFAULT_VOLATILITY_PCT = new BigDecimal("15");
	static final int DEFAULT_SNAPSHOT_YEARS = 20;
	static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

	private final MonteCarloSimulator simulator;
	private final ProjectionService projectionService;
	private final int defaultSimulations;
	private final BigDecimal defaultVolatilityPct;
	private final Duration timeout;

	public MonteCarloService(MonteCarloSimulator simulator,
							 ProjectionService projectionService,
							 AppProperties properties) {
		this.simulator = simulator;
		this.projectionService = projectionService;
		AppProperties.MonteCarlo config = properties == null ? null : properties.monteCarlo();
		this.defaultSimulations = config == null || config.defaultSimulations() == null
				? DEFAULT_SIMULATIONS
				: config.defaultSimulations();
		this.defaultVolatilityPct = config == null || config.defaultVolatilityPct() == null
				? DEFAULT_VOLATILITY_PCT
				: config.defaultVolatilityPct();
		this.timeout = config == null || config.timeoutSeconds() == null
				? DEFAULT_TIMEOUT
				: Duration.ofSeconds(config.timeoutSeconds());
	}

	public MonteCarloResult simulate(MonteCarloParameters parameters) {
		return simulate(parameters, newSignal());
	}

	public MonteCarloResult simulate(MonteCarloParameters parameters, CancellationSignal signal) {
		return simulator.simulate(parameters, signal);
	}

	public void validate(MonteCarloParameters parameters) {
		simulator.validate(parameters);
	}

	public CancellationSignal newSignal() {
		return CancellationSignal.withTimeout(timeout);
	}

	public MonteCarloParameters parameters(MonteCarloRequestDto request) {
		if (request == null) {
			throw new ValidationException("request", "must not be null");
		}
		if (request.horizonYears() == null) {
			throw new ValidationException("horizonYears", "must not be null");
		}
		return new MonteCarloParameters(
				request.startingValue(),
				request.expectedAnnualReturnPct(),
				request.volatilityPct() == null ? defaultVolatilityPct : request.volatilityPct(),
				request.horizonYears(),
				request.simulationCount() == null ? defaultSimulations : request.simulationCount(),
				request.seed()
		);
	}

	public MonteCarloParameters parameters(HoldingSnapshot snapshot,
										   Map<AssetCategory, BigDecimal> growthRateOverrides,
										   BigDecimal volatilityPct,
										   Integer years,
										   Integer simulationCount,
										   Long seed) {
		BigDecimal expected = projectionService.expectedReturnPct(snapshot, growthRateOverrides);
		return new MonteCarloParameters(
				snapshot.totalCurrentValue(),
				expected,
				volatilityPct == null ? defaultVolatilityPct : volatilityPct,
				years == null ? DEFAULT_SNAPSHOT_YEARS : years,
				simulationCount == null ? defaultSimulations : simulationCount,
				seed
		);
	}
}
