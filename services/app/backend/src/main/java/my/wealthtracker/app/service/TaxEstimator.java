package my.wealthtracker.app.service;

import my.wealthtracker.app.domain.Holding;
import my.wealthtracker.app.domain.HoldingSnapshot;
import my.wealthtracker.app.model.TaxConfig;
import my.wealthtracker.app.model.TaxEstimate;
import my.wealthtracker.app.model.TaxEstimate.CurrentYearTax;
import my.wealthtracker.app.model.TaxEstimate.TaxSavingOpportunity;
import my.wealthtracker.app.service.util.Amounts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Service
public class TaxEstimator {
	private static final Logger logger = LoggerFactory.getLogger(TaxEstimator.class);
	public static final String LOSS_HARVESTING = "tax_loss_harvesting";
	public static final String LONG_TERM_EXEMPTION = "long_term_exemption";
	public static final String HOLD_FOR_LONG_TERM = "hold_for_long_term";
	static final int NEAR_LONG_TERM_DAYS = 60;
	private static final BigDecimal MIN_GAIN_DIVISOR = new BigDecimal("0.01");

	public TaxEstimate estimate(HoldingSnapshot snapshot, TaxConfig config) {
		SnapshotValidator.validateDated(snapshot);
		validateConfig(config);

		List<ClassifiedHolding> classified = new ArrayList<>(snapshot.holdings().size());
		BigDecimal longTermGain = BigDecimal.ZERO;
		BigDecimal shortTermGain = BigDecimal.ZERO;
		for (Holding holding : snapshot.holdings()) {
			Integer threshold = config.holdingPeriodDays().get(holding.category());
			if (threshold == null) {
				throw new ConfigurationException(holding.category().key(), "no holding period configured");
			}
			long heldDays = ChronoUnit.DAYS.between(holding.acquisitionDate(), snapshot.valuationDate());
			ClassifiedHolding item = new ClassifiedHolding(holding, heldDays, threshold, heldDays >= threshold);
			classified.add(item);
			if (item.longTerm()) {
				longTermGain = longTermGain.add(holding.gain());
			} else {
				shortTermGain = shortTermGain.add(holding.gain());
			}
		}

		BigDecimal longTermTaxable = longTermGain.subtract(config.longTermExemption()).max(BigDecimal.ZERO);
		BigDecimal longTermLiability = Amounts.applyRate(longTermTaxable, config.longTermRatePct());
		BigDecimal shortTermLiability = Amounts.applyRate(shortTermGain.max(BigDecimal.ZERO), config.shortTermRatePct());
		BigDecimal total = longTermLiability.add(shortTermLiability);
		BigDecimal totalGain = longTermGain.add(shortTermGain);
		BigDecimal effectiveRate = total.multiply(Amounts.ONE_HUNDRED)
				.divide(totalGain.max(MIN_GAIN_DIVISOR), Amounts.MONEY_SCALE, RoundingMode.HALF_UP);

		List<TaxSavingOpportunity> opportunities = new ArrayList<>();
		opportunities.addAll(lossHarvesting(classified, config));
		opportunities.addAll(exemptionRoom(classified, config, longTermGain));
		opportunities.addAll(nearLongTerm(classified, config));

		logger.debug("Estimated tax {} on gains {} for {} holdings", total, totalGain, classified.size());
		return new TaxEstimate(
				total,
				effectiveRate,
				longTermLiability,
				shortTermLiability,
				new CurrentYearTax(Amounts.money(longTermGain), Amounts.money(shortTermGain)),
				List.copyOf(opportunities)
		);
	}

	private List<TaxSavingOpportunity> lossHarvesting(List<ClassifiedHolding> classified, TaxConfig config) {
		List<TaxSavingOpportunity> losses = new ArrayList<>();
		for (ClassifiedHolding item : classified) {
			BigDecimal gain = item.holding().gain();
			if (gain.signum() >= 0) {
				continue;
			}
			BigDecimal rate = item.longTerm() ? config.longTermRatePct() : config.shortTermRatePct();
			BigDecimal loss = gain.abs();
			losses.add(new TaxSavingOpportunity(
					LOSS_HARVESTING,
					item.holding().id(),
					"Realize the " + (item.longTerm() ? "long-term" : "short-term") + " loss of "
							+ Amounts.money(loss).toPlainString() + " on " + item.holding().name() + " to offset gains",
					Amounts.applyRate(loss, rate)));
		}
		losses.sort(Comparator.comparing(TaxSavingOpportunity::potentialTaxSaving).reversed());
		return losses;
	}

	private List<TaxSavingOpportunity> exemptionRoom(List<ClassifiedHolding> classified,
													 TaxConfig config,
													 BigDecimal longTermGain) {
		if (longTermGain.compareTo(config.longTermExemption()) >= 0) {
			return List.of();
		}
		BigDecimal room = Amounts.money(config.longTermExemption().subtract(longTermGain.max(BigDecimal.ZERO)));
		List<TaxSavingOpportunity> result = new ArrayList<>();
		for (ClassifiedHolding item : classified) {
			if (!item.longTerm() || item.holding().gain().signum() <= 0) {
				continue;
			}
			result.add(new TaxSavingOpportunity(
					LONG_TERM_EXEMPTION,
					item.holding().id(),
					"Gains on " + item.holding().name() + " are long-term; up to " + room.toPlainString()
							+ " more in long-term gains can be realized within the exemption",
					null));
		}
		return result;
	}

	private List<TaxSavingOpportunity> nearLongTerm(List<ClassifiedHolding> classified, TaxConfig config) {
		BigDecimal rateGap = config.shortTermRatePct().subtract(config.longTermRatePct());
		List<TaxSavingOpportunity> result = new ArrayList<>();
		for (ClassifiedHolding item : classified) {
			long daysLeft = item.thresholdDays() - item.heldDays();
			if (item.longTerm() || item.holding().gain().signum() <= 0 || daysLeft > NEAR_LONG_TERM_DAYS) {
				continue;
			}
			BigDecimal saving = rateGap.signum() > 0 ? Amounts.applyRate(item.holding().gain(), rateGap) : null;
			result.add(new TaxSavingOpportunity(
					HOLD_FOR_LONG_TERM,
					item.holding().id(),
					"Hold " + item.holding().name() + " " + daysLeft + " more days to qualify for the long-term rate",
					saving));
		}
		return result;
	}

	private static void validateConfig(TaxConfig config) {
		if (config == null) {
			throw new ConfigurationException("taxConfig", "must not be null");
		}
		requireRate("longTermRatePct", config.longTermRatePct());
		requireRate("shortTermRatePct", config.shortTermRatePct());
		requireRate("longTermExemption", config.longTermExemption());
		config.holdingPeriodDays().forEach((category, days) -> {
			if (days < 0) {
				throw new ConfigurationException(category.key(), "holding period must not be negative");
			}
		});
	}

	private static void requireRate(String subject, BigDecimal value) {
		if (value == null) {
			throw new ConfigurationException(subject, "must be configured");
		}
		if (value.signum() < 0) {
			throw new ConfigurationException(subject, "must not be negative");
		}
	}

	private record ClassifiedHolding(Holding holding, long heldDays, int thresholdDays, boolean longTerm) {
	}
}
