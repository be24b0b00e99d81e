package my.wealthtracker.app.dto;

public enum MonteCarloJobStatus {
	PENDING,
	RUNNING,
	DONE,
	FAILED,
	CANCELLED
}
