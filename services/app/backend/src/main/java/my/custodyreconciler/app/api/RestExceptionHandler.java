package my.custodyreconciler.app.api;

import jakarta.servlet.http.HttpServletRequest;
import my.custodyreconciler.app.importer.FeedUnavailableException;
import my.custodyreconciler.app.service.ImportPipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;

@RestControllerAdvice
public class RestExceptionHandler {
	private static final Logger logger = LoggerFactory.getLogger(RestExceptionHandler.class);

	@ExceptionHandler(IllegalArgumentException.class)
	public ProblemDetail handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
		logger.warn("Bad request on {}: {}", request.getRequestURI(), ex.getMessage());
		return problem(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), request);
	}

	@ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class,
			HttpMessageNotReadableException.class})
	public ProblemDetail handleUnreadable(Exception ex, HttpServletRequest request) {
		logger.warn("Unreadable request on {}: {}", request.getRequestURI(), ex.getMessage());
		return problem(HttpStatus.BAD_REQUEST, "Bad Request", "Invalid request.", request);
	}

	@ExceptionHandler(FeedUnavailableException.class)
	public ProblemDetail handleFeedUnavailable(FeedUnavailableException ex, HttpServletRequest request) {
		logger.warn("Feed unavailable on {}: {}", request.getRequestURI(), ex.getMessage());
		return problem(HttpStatus.NOT_FOUND, "Feed Unavailable", ex.getMessage(), request);
	}

	@ExceptionHandler(ImportPipelineException.class)
	public ProblemDetail handlePipelineFailure(ImportPipelineException ex, HttpServletRequest request) {
		logger.error("Import failed on {}: {}", request.getRequestURI(), ex.getMessage());
		ProblemDetail detail = problem(HttpStatus.SERVICE_UNAVAILABLE, "Import Incomplete", ex.getMessage(), request);
		detail.setProperty("retryable", true);
		return detail;
	}

	@ExceptionHandler(NoResourceFoundException.class)
	public ProblemDetail handleNoResource(NoResourceFoundException ex, HttpServletRequest request) {
		return problem(HttpStatus.NOT_FOUND, "Not Found", "Resource not found.", request);
	}

	@ExceptionHandler(MethodArgumentNotValidException.class)
	public ProblemDetail handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
		logger.warn("Validation failed on {}", request.getRequestURI());
		ProblemDetail detail = problem(HttpStatus.BAD_REQUEST, "Validation failed", null, request);
		List<String> errors = ex.getBindingResult().getFieldErrors().stream()
				.map(this::formatFieldError)
				.toList();
		detail.setProperty("errors", errors);
		return detail;
	}

	@ExceptionHandler(Exception.class)
	public ProblemDetail handleUnhandled(Exception ex, HttpServletRequest request) {
		logger.error("Unexpected error on {}", request.getRequestURI(), ex);
		return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "Unexpected error", request);
	}

	private ProblemDetail problem(HttpStatus status, String title, String message, HttpServletRequest request) {
		ProblemDetail detail = ProblemDetail.forStatus(status);
		detail.setTitle(title);
		if (message != null) {
			detail.setDetail(message);
		}
		detail.setProperty("path", request.getRequestURI());
		return detail;
	}

	private String formatFieldError(FieldError error) {
		return error.getField() + ": " + error.getDefaultMessage();
	}
}
