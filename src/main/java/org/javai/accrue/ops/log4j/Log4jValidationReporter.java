package org.javai.accrue.ops.log4j;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.accrue.Errors;
import org.javai.accrue.ValidationError;
import org.javai.accrue.ops.ValidationReporter;

/**
 * Reports failed validations using Log4j2.
 *
 * <p>Each failed operation produces one WARN line summarising the failure, followed by
 * one DEBUG line per error carrying its path, message and cause. All lines carry the
 * {@code VALIDATION} marker so they can be routed separately.
 *
 * <p>Example output:
 * <pre>{@code
 * WARN  Validation failed in operation [signup]: 2 errors at [user.email, user.age]
 * DEBUG Validation error 1/2 in operation [signup]: path=user.email, message=invalid email format
 * }</pre>
 */
public class Log4jValidationReporter implements ValidationReporter {

	static final Marker VALIDATION_MARKER = MarkerManager.getMarker("VALIDATION");

	private final Logger logger;

	/**
	 * Creates a Log4jValidationReporter using the default logger name.
	 */
	public Log4jValidationReporter() {
		this(LogManager.getLogger("org.javai.accrue.ValidationReporter"));
	}

	public Log4jValidationReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jValidationReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(String operation, Errors errors) {
		logger.atWarn()
			.withMarker(VALIDATION_MARKER)
			.log("Validation failed in operation [{}]: {} at {}",
				operation,
				errors.size() == 1 ? "1 error" : errors.size() + " errors",
				paths(errors));

		if (!logger.isDebugEnabled(VALIDATION_MARKER)) {
			return;
		}
		for (int i = 0; i < errors.size(); i++) {
			logger.atDebug()
				.withMarker(VALIDATION_MARKER)
				.log(formatError(operation, errors.get(i), i + 1, errors.size()));
		}
	}

	private static String formatError(String operation, ValidationError error, int index, int total) {
		return """
			Validation error %d/%d in operation [%s]: \
			path=%s, message=%s%s\
			""".formatted(
				index,
				total,
				operation,
				formatPath(error.context().path()),
				error.message(),
				error.causeOption().fold(() -> "", cause -> ", cause=" + cause.getClass().getName())
			).trim();
	}

	private static String paths(Errors errors) {
		return errors.stream()
				.map(error -> formatPath(error.context().path()))
				.reduce((a, b) -> a + ", " + b)
				.map(joined -> "[" + joined + "]")
				.orElse("[]");
	}

	private static String formatPath(String path) {
		return path.isEmpty() ? "<root>" : path;
	}
}
