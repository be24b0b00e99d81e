package my.wealthtracker.app.service;

public class ValidationException extends IllegalArgumentException {
	private final String field;

	public ValidationException(String field, String message) {
		super(field + ": " + message);
		this.field = field;
	}

	public String getField() {
		return field;
	}
}
