package my.wealthtracker.app.config;

import my.wealthtracker.app.service.AttributionAnalyzer;
import my.wealthtracker.app.service.HealthScorer;
import my.wealthtracker.app.service.MonteCarloSimulator;
import my.wealthtracker.app.service.RandomSourceFactory;
import my.wealthtracker.app.service.Well19937cRandomSourceFactory;
import my.wealthtracker.app.service.health.HealthCategoryEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Configuration
public class AnalyticsConfig {
	private static final Logger logger = LoggerFactory.getLogger(AnalyticsConfig.class);

	@Bean
	@ConditionalOnMissingBean
	public Clock clock() {
		return Clock.systemDefaultZone();
	}

	@Bean
	@ConditionalOnMissingBean
	public RandomSourceFactory randomSourceFactory() {
		return new Well19937cRandomSourceFactory();
	}

	@Bean(destroyMethod = "close")
	public MonteCarloSimulator monteCarloSimulator(RandomSourceFactory randomSourceFactory, AppProperties properties) {
		MonteCarloSimulator.Settings settings = MonteCarloSimulator.Settings.from(
				properties == null ? null : properties.monteCarlo());
		logger.info("Monte Carlo simulator ready (batchSize={}, parallelism={}, parallelThreshold={}).",
				settings.batchSize(), settings.parallelism(), settings.parallelThreshold());
		return new MonteCarloSimulator(randomSourceFactory, settings);
	}

	@Bean
	public HealthScorer healthScorer(List<HealthCategoryEvaluator> evaluators, AppProperties properties) {
		return new HealthScorer(evaluators, HealthScorer.Thresholds.from(properties == null ? null : properties.health()));
	}

	@Bean
	public AttributionAnalyzer attributionAnalyzer(AppProperties properties) {
		Integer topPerformers = properties == null || properties.attribution() == null
				? null
				: properties.attribution().topPerformers();
		return new AttributionAnalyzer(topPerformers == null ? AttributionAnalyzer.DEFAULT_TOP_PERFORMERS : topPerformers);
	}
}
