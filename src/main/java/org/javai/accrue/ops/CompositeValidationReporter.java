package org.javai.accrue.ops;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.accrue.Errors;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A {@link ValidationReporter} that hands each failed validation to several reporters, in
 * the order they were given.
 *
 * <p>Every reporter sees the same {@link Errors}. A reporter that throws does not stop the
 * ones after it; once all have run, the failures are logged together in one WARN line
 * naming the operation, how many errors went unreported, and which reporters failed.
 *
 * <pre>{@code
 * ValidationReporter reporter = CompositeValidationReporter.of(
 *     new Log4jValidationReporter(),
 *     new MetricsValidationReporter("myapp"));
 * }</pre>
 */
public final class CompositeValidationReporter implements ValidationReporter {

	private static final Logger LOGGER = LogManager.getLogger(CompositeValidationReporter.class);

	private final List<ValidationReporter> reporters;
	private final Logger logger;

	CompositeValidationReporter(List<ValidationReporter> reporters, Logger logger) {
		for (ValidationReporter reporter : reporters) {
			Objects.requireNonNull(reporter, "reporters must not contain null");
		}
		this.reporters = List.copyOf(reporters);
		this.logger = Objects.requireNonNull(logger, "logger must not be null");
	}

	public static CompositeValidationReporter of(ValidationReporter... reporters) {
		return new CompositeValidationReporter(List.of(reporters), LOGGER);
	}

	@Override
	public void report(String operation, Errors errors) {
		List<String> failed = new ArrayList<>();
		RuntimeException first = null;
		for (ValidationReporter reporter : reporters) {
			try {
				reporter.report(operation, errors);
			} catch (RuntimeException e) {
				failed.add(reporter.getClass().getName());
				if (first == null) {
					first = e;
				}
			}
		}
		if (!failed.isEmpty()) {
			logger.warn("{} of {} reporters could not report {} validation error(s) for operation [{}]: {}",
					failed.size(), reporters.size(), errors.size(), operation, failed, first);
		}
	}
}
