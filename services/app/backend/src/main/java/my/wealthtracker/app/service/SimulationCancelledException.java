package my.wealthtracker.app.service;

public class SimulationCancelledException extends RuntimeException {
	public SimulationCancelledException(String message) {
		super(message);
	}
}
