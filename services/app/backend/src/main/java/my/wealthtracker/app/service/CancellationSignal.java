package my.wealthtracker.app.service;

import java.time.Duration;

public final class CancellationSignal {
	private static final long NO_DEADLINE = Long.MAX_VALUE;

	private final long deadlineNanos;
	private volatile boolean cancelled;

	private CancellationSignal(long deadlineNanos) {
		this.deadlineNanos = deadlineNanos;
	}

	public static CancellationSignal none() {
		return new CancellationSignal(NO_DEADLINE);
	}

	public static CancellationSignal withTimeout(Duration timeout) {
		if (timeout == null || timeout.isNegative() || timeout.isZero()) {
			return none();
		}
		return new CancellationSignal(System.nanoTime() + timeout.toNanos());
	}

	public void cancel() {
		cancelled = true;
	}

	public boolean isCancelled() {
		return cancelled || remainingNanos() <= 0;
	}

	public long remainingNanos() {
		if (deadlineNanos == NO_DEADLINE) {
			return Long.MAX_VALUE;
		}
		return deadlineNanos - System.nanoTime();
	}

	public void throwIfCancelled() {
		if (cancelled) {
			throw new SimulationCancelledException("Simulation cancelled");
		}
		if (remainingNanos() <= 0) {
			throw new SimulationCancelledException("Simulation deadline exceeded");
		}
	}
}
