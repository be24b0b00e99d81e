package my.wealthtracker.app.service.util;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Maps a metric to an integer score by linear interpolation between breakpoints. Metrics outside the
 * breakpoint range take the score of the nearest end; the result is clamped to {@code [0, maxScore]}.
 */
public final class PiecewiseLinearRubric {
	private final List<Breakpoint> breakpoints;
	private final int maxScore;

	private PiecewiseLinearRubric(List<Breakpoint> breakpoints, int maxScore) {
		this.breakpoints = breakpoints;
		this.maxScore = maxScore;
	}

	/**
	 * @param points alternating metric/score pairs, e.g. {@code of(200, 0, 0, 6, 200)}
	 */
	public static PiecewiseLinearRubric of(int maxScore, double... points) {
		if (points == null || points.length < 2 || points.length % 2 != 0) {
			throw new IllegalArgumentException("Rubric needs metric/score pairs");
		}
		List<Breakpoint> parsed = new ArrayList<>();
		for (int i = 0; i < points.length; i += 2) {
			parsed.add(new Breakpoint(points[i], points[i + 1]));
		}
		parsed.sort(Comparator.comparingDouble(Breakpoint::metric));
		return new PiecewiseLinearRubric(List.copyOf(parsed), maxScore);
	}

	public int score(double metric) {
		if (Double.isNaN(metric)) {
			return 0;
		}
		Breakpoint first = breakpoints.get(0);
		Breakpoint last = breakpoints.get(breakpoints.size() - 1);
		double raw;
		if (metric <= first.metric()) {
			raw = first.score();
		} else if (metric >= last.metric()) {
			raw = last.score();
		} else {
			raw = last.score();
			for (int i = 1; i < breakpoints.size(); i++) {
				Breakpoint upper = breakpoints.get(i);
				if (metric <= upper.metric()) {
					Breakpoint lower = breakpoints.get(i - 1);
					double span = upper.metric() - lower.metric();
					double fraction = span == 0.0 ? 1.0 : (metric - lower.metric()) / span;
					raw = lower.score() + fraction * (upper.score() - lower.score());
					break;
				}
			}
		}
		long rounded = Math.round(raw);
		return (int) Math.max(0, Math.min(maxScore, rounded));
	}

	private record Breakpoint(double metric, double score) {
	}
}
