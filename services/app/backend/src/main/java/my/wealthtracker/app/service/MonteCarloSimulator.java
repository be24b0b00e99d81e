package my.wealthtracker.app.service;

import my.wealthtracker.app.config.AppProperties;
import my.wealthtracker.app.model.MonteCarloParameters;
import my.wealthtracker.app.model.MonteCarloResult;
import my.wealthtracker.app.service.util.Amounts;
import my.wealthtracker.app.service.util.CompoundingMath;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Simulates yearly portfolio values under normally distributed annual returns and reduces the paths
 * to percentile bands.
 * <p>
 * Paths are generated in fixed-size batches; batch {@code i} draws from its own generator seeded with
 * a mix of the run seed and {@code i}. The output for a seed is therefore the same whether the batches
 * run on the caller thread or on the worker pool.
 */
public class MonteCarloSimulator implements AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(MonteCarloSimulator.class);
	private static final double[] PERCENTILES = {10.0, 25.0, 50.0, 75.0, 90.0};
	private static final List<String> SCENARIOS = List.of(
			MonteCarloResult.WORST_CASE,
			MonteCarloResult.PESSIMISTIC,
			MonteCarloResult.MOST_LIKELY,
			MonteCarloResult.OPTIMISTIC,
			MonteCarloResult.BEST_CASE
	);
	private static final BigDecimal MIN_RETURN_PCT = new BigDecimal("-100");
	private static final BigDecimal MAX_RETURN_PCT = GrowthProjector.MAX_GROWTH_RATE_PCT;
	private static final BigDecimal MAX_VOLATILITY_PCT = new BigDecimal("500");

	private final RandomSourceFactory randomSourceFactory;
	private final Settings settings;
	private final ExecutorService executor;

	public MonteCarloSimulator(RandomSourceFactory randomSourceFactory, Settings settings) {
		this.randomSourceFactory = randomSourceFactory;
		this.settings = settings == null ? Settings.defaults() : settings;
		this.executor = this.settings.parallelism() > 1
				? Executors.newFixedThreadPool(this.settings.parallelism(), pathWorkers())
				: null;
	}

	public MonteCarloResult simulate(MonteCarloParameters parameters) {
		return simulate(parameters, CancellationSignal.none());
	}

	public MonteCarloResult simulate(MonteCarloParameters parameters, CancellationSignal signal) {
		validate(parameters);
		CancellationSignal cancellation = signal == null ? CancellationSignal.none() : signal;
		long seed = parameters.seed() != null ? parameters.seed() : randomSourceFactory.newSeed();
		int paths = parameters.simulationCount();
		PathModel model = new PathModel(
				parameters.startingValue().doubleValue(),
				parameters.expectedAnnualReturnPct().doubleValue() / 100.0,
				parameters.volatilityPct().doubleValue() / 100.0,
				parameters.horizonYears(),
				seed
		);
		double[][] valuesByYear = new double[model.years()][paths];
		List<PathBatch> batches = planBatches(paths);

		long started = System.nanoTime();
		if (executor != null && paths >= settings.parallelThreshold() && batches.size() > 1) {
			runParallel(batches, model, valuesByYear, cancellation);
		} else {
			for (PathBatch batch : batches) {
				runBatch(batch, model, valuesByYear, cancellation);
			}
		}
		MonteCarloResult result = summarize(valuesByYear, paths, seed);
		logger.debug("Simulated {} paths over {} years in {} ms", paths, model.years(),
				TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
		return result;
	}

	@Override
	public void close() {
		if (executor != null) {
			executor.shutdownNow();
		}
	}

	public Settings settings() {
		return settings;
	}

	private void runParallel(List<PathBatch> batches,
							 PathModel model,
							 double[][] valuesByYear,
							 CancellationSignal signal) {
		List<Future<?>> futures = new ArrayList<>(batches.size());
		try {
			for (PathBatch batch : batches) {
				futures.add(executor.submit(() -> runBatch(batch, model, valuesByYear, signal)));
			}
			for (Future<?> future : futures) {
				long remaining = signal.remainingNanos();
				if (remaining == Long.MAX_VALUE) {
					future.get();
				} else {
					future.get(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
				}
			}
		} catch (TimeoutException ex) {
			cancelAll(futures);
			throw new SimulationCancelledException("Simulation deadline exceeded");
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			cancelAll(futures);
			throw new SimulationCancelledException("Simulation interrupted");
		} catch (ExecutionException ex) {
			cancelAll(futures);
			Throwable cause = ex.getCause();
			if (cause instanceof RuntimeException runtime) {
				throw runtime;
			}
			throw new IllegalStateException("Simulation batch failed", cause);
		}
	}

	private void runBatch(PathBatch batch, PathModel model, double[][] valuesByYear, CancellationSignal signal) {
		signal.throwIfCancelled();
		RandomGenerator random = randomSourceFactory.create(batchSeed(model.seed(), batch.index()));
		for (int path = batch.from(); path < batch.to(); path++) {
			double value = model.startingValue();
			for (int year = 0; year < model.years(); year++) {
				double annualReturn = model.mean() + model.stdDev() * random.nextGaussian();
				// a single year can at most wipe out the position
				if (annualReturn < -1.0) {
					annualReturn = -1.0;
				}
				value = CompoundingMath.compound(value, 0.0, annualReturn, 1);
				if (!Double.isFinite(value)) {
					throw new ValidationException("startingValue", "result is not representable");
				}
				valuesByYear[year][path] = value;
			}
		}
	}

	private MonteCarloResult summarize(double[][] valuesByYear, int paths, long seed) {
		List<Integer> years = new ArrayList<>(valuesByYear.length);
		List<List<BigDecimal>> bands = new ArrayList<>(PERCENTILES.length);
		for (int i = 0; i < PERCENTILES.length; i++) {
			bands.add(new ArrayList<>(valuesByYear.length));
		}
		Percentile estimator = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
		for (int year = 0; year < valuesByYear.length; year++) {
			years.add(year + 1);
			estimator.setData(valuesByYear[year]);
			double previous = Double.NEGATIVE_INFINITY;
			for (int i = 0; i < PERCENTILES.length; i++) {
				// keep bands ordered even where interpolation rounds across neighbours
				double value = Math.max(previous, estimator.evaluate(PERCENTILES[i]));
				bands.get(i).add(Amounts.money(value));
				previous = value;
			}
		}
		Map<String, BigDecimal> finalValues = new LinkedHashMap<>();
		int last = valuesByYear.length - 1;
		for (int i = 0; i < SCENARIOS.size(); i++) {
			finalValues.put(SCENARIOS.get(i), bands.get(i).get(last));
		}
		return new MonteCarloResult(
				List.copyOf(years),
				List.copyOf(bands.get(0)),
				List.copyOf(bands.get(1)),
				List.copyOf(bands.get(2)),
				List.copyOf(bands.get(3)),
				List.copyOf(bands.get(4)),
				Collections.unmodifiableMap(finalValues),
				paths,
				seed
		);
	}

	private List<PathBatch> planBatches(int paths) {
		int batchSize = settings.batchSize();
		List<PathBatch> batches = new ArrayList<>();
		int index = 0;
		for (int from = 0; from < paths; from += batchSize) {
			batches.add(new PathBatch(index++, from, Math.min(paths, from + batchSize)));
		}
		return batches;
	}

	public void validate(MonteCarloParameters parameters) {
		if (parameters == null) {
			throw new ValidationException("parameters", "must not be null");
		}
		SnapshotValidator.requireNonNegative("startingValue", parameters.startingValue());
		if (Double.isInfinite(parameters.startingValue().doubleValue())) {
			throw new ValidationException("startingValue", "is too large");
		}
		BigDecimal expected = parameters.expectedAnnualReturnPct();
		if (expected == null) {
			throw new ValidationException("expectedAnnualReturnPct", "must not be null");
		}
		if (expected.compareTo(MIN_RETURN_PCT) < 0 || expected.compareTo(MAX_RETURN_PCT) > 0) {
			throw new ValidationException("expectedAnnualReturnPct", "must be between -100 and 1000");
		}
		BigDecimal volatility = parameters.volatilityPct();
		SnapshotValidator.requireNonNegative("volatilityPct", volatility);
		if (volatility.compareTo(MAX_VOLATILITY_PCT) > 0) {
			throw new ValidationException("volatilityPct", "must not exceed 500");
		}
		if (parameters.horizonYears() < 1 || parameters.horizonYears() > GrowthProjector.MAX_HORIZON_YEARS) {
			throw new ValidationException("horizonYears", "must be between 1 and " + GrowthProjector.MAX_HORIZON_YEARS);
		}
		if (parameters.simulationCount() < settings.minSimulations()) {
			throw new ValidationException("simulationCount", "must be at least " + settings.minSimulations());
		}
		if (parameters.simulationCount() > settings.maxSimulations()) {
			throw new ValidationException("simulationCount", "must not exceed " + settings.maxSimulations());
		}
	}

	// SplitMix64 finalizer
	static long batchSeed(long seed, int batchIndex) {
		long z = seed + (batchIndex + 1L) * 0x9E3779B97F4A7C15L;
		z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
		z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
		return z ^ (z >>> 31);
	}

	private static ThreadFactory pathWorkers() {
		AtomicInteger counter = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(runnable, "monte-carlo-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}

	private static void cancelAll(List<Future<?>> futures) {
		for (Future<?> future : futures) {
			future.cancel(true);
		}
	}

	public record Settings(int minSimulations,
						   int maxSimulations,
						   int batchSize,
						   int parallelThreshold,
						   int parallelism) {
		public static final int FLOOR_SIMULATIONS = 100;

		public Settings {
			minSimulations = Math.max(FLOOR_SIMULATIONS, minSimulations);
			maxSimulations = Math.max(minSimulations, maxSimulations);
			batchSize = Math.max(1, batchSize);
			parallelThreshold = Math.max(1, parallelThreshold);
			parallelism = Math.max(1, parallelism);
		}

		public static Settings defaults() {
			return new Settings(FLOOR_SIMULATIONS, 100_000, 500, 2_000,
					Runtime.getRuntime().availableProcessors());
		}

		public static Settings from(AppProperties.MonteCarlo properties) {
			Settings defaults = defaults();
			if (properties == null) {
				return defaults;
			}
			return new Settings(
					properties.minSimulations() == null ? defaults.minSimulations() : properties.minSimulations(),
					properties.maxSimulations() == null ? defaults.maxSimulations() : properties.maxSimulations(),
					properties.batchSize() == null ? defaults.batchSize() : properties.batchSize(),
					properties.parallelThreshold() == null ? defaults.parallelThreshold() : properties.parallelThreshold(),
					properties.parallelism() == null ? defaults.parallelism() : properties.parallelism()
			);
		}
	}

	private record PathModel(double startingValue, double mean, double stdDev, int years, long seed) {
	}

	private record PathBatch(int index, int from, int to) {
	}
}
