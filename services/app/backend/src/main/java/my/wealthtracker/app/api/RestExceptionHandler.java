package my.wealthtracker.app.api;

import jakarta.servlet.http.HttpServletRequest;
import my.wealthtracker.app.service.ConfigurationException;
import my.wealthtracker.app.service.SimulationCancelledException;
import my.wealthtracker.app.service.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;

@RestControllerAdvice
public class RestExceptionHandler {
	private static final Logger logger = LoggerFactory.getLogger(RestExceptionHandler.class);

	@ExceptionHandler(ValidationException.class)
	public ProblemDetail handleInvalidInput(ValidationException ex, HttpServletRequest request) {
		logger.warn("Invalid input on {}: {}", request.getRequestURI(), ex.getMessage());
		ProblemDetail detail = problem(HttpStatus.BAD_REQUEST, "Validation failed", ex.getMessage(), request);
		detail.setProperty("field", ex.getField());
		return detail;
	}

	@ExceptionHandler(ConfigurationException.class)
	public ProblemDetail handleConfiguration(ConfigurationException ex, HttpServletRequest request) {
		logger.warn("Configuration mismatch on {}: {}", request.getRequestURI(), ex.getMessage());
		ProblemDetail detail = problem(HttpStatus.UNPROCESSABLE_CONTENT, "Configuration error", ex.getMessage(), request);
		detail.setProperty("subject", ex.getSubject());
		return detail;
	}

	@ExceptionHandler(SimulationCancelledException.class)
	public ProblemDetail handleCancelled(SimulationCancelledException ex, HttpServletRequest request) {
		logger.warn("Simulation stopped on {}: {}", request.getRequestURI(), ex.getMessage());
		return problem(HttpStatus.SERVICE_UNAVAILABLE, "Simulation stopped", ex.getMessage(), request);
	}

	@ExceptionHandler(MethodArgumentNotValidException.class)
	public ProblemDetail handleConstraintViolations(MethodArgumentNotValidException ex, HttpServletRequest request) {
		List<String> errors = ex.getBindingResult().getFieldErrors().stream()
				.map(RestExceptionHandler::describe)
				.toList();
		logger.warn("Request constraints violated on {}: {}", request.getRequestURI(), errors);
		ProblemDetail detail = problem(HttpStatus.BAD_REQUEST, "Validation failed", null, request);
		detail.setProperty("errors", errors);
		return detail;
	}

	@ExceptionHandler(HttpMessageNotReadableException.class)
	public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
		logger.warn("Unreadable body on {}: {}", request.getRequestURI(), ex.getMessage());
		return problem(HttpStatus.BAD_REQUEST, "Bad Request", "Malformed request body.", request);
	}

	@ExceptionHandler(IllegalArgumentException.class)
	public ProblemDetail handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
		logger.warn("Rejected argument on {}: {}", request.getRequestURI(), ex.getMessage());
		return problem(HttpStatus.BAD_REQUEST, "Bad Request", "Invalid request.", request);
	}

	@ExceptionHandler(MaxUploadSizeExceededException.class)
	public ProblemDetail handleUploadTooLarge(MaxUploadSizeExceededException ex, HttpServletRequest request) {
		logger.warn("Snapshot upload too large on {}: {}", request.getRequestURI(), ex.getMessage());
		return problem(HttpStatus.PAYLOAD_TOO_LARGE, "Payload Too Large", "Snapshot file exceeds the upload limit.", request);
	}

	@ExceptionHandler({MultipartException.class, MissingServletRequestPartException.class})
	public ProblemDetail handleMultipart(Exception ex, HttpServletRequest request) {
		logger.warn("Snapshot upload unreadable on {}: {}", request.getRequestURI(), ex.getMessage());
		return problem(HttpStatus.BAD_REQUEST, "Invalid multipart request", "Expected a CSV file in part 'file'.", request);
	}

	@ExceptionHandler(ResponseStatusException.class)
	public ProblemDetail handleStatus(ResponseStatusException ex, HttpServletRequest request) {
		return problem(ex.getStatusCode(), null, ex.getReason(), request);
	}

	@ExceptionHandler(NoResourceFoundException.class)
	public ProblemDetail handleNoResource(NoResourceFoundException ex, HttpServletRequest request) {
		return problem(HttpStatus.NOT_FOUND, "Not Found", "Resource not found.", request);
	}

	@ExceptionHandler(Exception.class)
	public ProblemDetail handleUnexpected(Exception ex, HttpServletRequest request) {
		logger.error("Unexpected error on {}", request.getRequestURI(), ex);
		return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "Unexpected error", request);
	}

	private static ProblemDetail problem(HttpStatusCode status, String title, String message, HttpServletRequest request) {
		ProblemDetail detail = ProblemDetail.forStatus(status);
		if (title != null) {
			detail.setTitle(title);
		}
		if (message != null) {
			detail.setDetail(message);
		}
		detail.setProperty("path", request.getRequestURI());
		return detail;
	}

	private static String describe(FieldError error) {
		return error.getField() + ": " + error.getDefaultMessage();
	}
}
