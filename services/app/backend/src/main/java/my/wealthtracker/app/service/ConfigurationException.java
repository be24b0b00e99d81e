package my.wealthtracker.app.service;

public class ConfigurationException extends IllegalStateException {
	private final String subject;

	public ConfigurationException(String subject, String message) {
		super(subject + ": " + message);
		this.subject = subject;
	}

	public String getSubject() {
		return subject;
	}
}
