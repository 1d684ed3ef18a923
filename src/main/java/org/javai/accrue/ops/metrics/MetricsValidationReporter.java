package org.javai.accrue.ops.metrics;

import org.javai.accrue.Errors;
import org.javai.accrue.ValidationError;
import org.javai.accrue.ops.ValidationReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.format.DateTimeFormatter;

/**
 * Reports failed validations as JSON-lines metrics via SLF4J.
 *
 * <p>Outputs one JSON object per failed operation, suitable for metrics aggregation.
 * The tracking key is the operation name, prefixed with a configurable namespace.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"validation_failure","timestamp":"2024-01-20T10:30:00Z","trackingKey":"myapp.signup","operation":"signup","errorCount":"2","paths":["user.email","user.age"]}
 * }</pre>
 *
 * <p>Constructor options follow the Log4jValidationReporter pattern:</p>
 * <ul>
 *   <li>{@link #MetricsValidationReporter()} - no namespace, default logger</li>
 *   <li>{@link #MetricsValidationReporter(String)} - with namespace, default logger</li>
 *   <li>{@link #MetricsValidationReporter(String, String)} - with namespace and custom logger name</li>
 * </ul>
 */
public class MetricsValidationReporter implements ValidationReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.accrue.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

	private final String namespace;
	private final Logger logger;
	private final Clock clock;

	public MetricsValidationReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsValidationReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 * @param loggerName the logger name
	 */
	public MetricsValidationReporter(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName), Clock.systemUTC());
	}

	/**
	 * Package-private for testing.
	 */
	MetricsValidationReporter(String namespace, Logger logger, Clock clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
		this.clock = clock;
	}

	@Override
	public void report(String operation, Errors errors) {
		try {
			logger.info(buildFailureJson(operation, errors));
		} catch (RuntimeException e) {
			logger.warn("Unable to emit validation metrics for operation {}", operation, e);
		}
	}

	private String buildFailureJson(String operation, Errors errors) {
		StringBuilder sb = new StringBuilder();
		sb.append("{");
		appendField(sb, "eventType", "validation_failure", true);
		appendField(sb, "timestamp", ISO_FORMATTER.format(clock.instant()), false);
		appendField(sb, "trackingKey", buildTrackingKey(operation), false);
		appendField(sb, "operation", operation, false);
		appendField(sb, "errorCount", String.valueOf(errors.size()), false);
		appendPaths(sb, errors);
		sb.append("}");
		return sb.toString();
	}

	String buildTrackingKey(String operation) {
		if (namespace == null) {
			return operation;
		}
		return namespace + "." + operation;
	}

	private void appendField(StringBuilder sb, String key, String value, boolean first) {
		if (!first) {
			sb.append(",");
		}
		sb.append("\"").append(key).append("\":\"").append(escapeJson(value)).append("\"");
	}

	private void appendPaths(StringBuilder sb, Errors errors) {
		sb.append(",\"paths\":[");
		boolean first = true;
		for (ValidationError error : errors) {
			if (!first) {
				sb.append(",");
			}
			sb.append("\"").append(escapeJson(error.context().path())).append("\"");
			first = false;
		}
		sb.append("]");
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}

	static String escapeJson(String s) {
		if (s == null) {
			return "";
		}
		return s.replace("\\", "\\\\")
				.replace("\"", "\\\"")
				.replace("\n", "\\n")
				.replace("\r", "\\r")
				.replace("\t", "\\t");
	}
}
