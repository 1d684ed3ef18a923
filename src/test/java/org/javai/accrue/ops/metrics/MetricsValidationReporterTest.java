package org.javai.accrue.ops.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.accrue.Context;
import org.javai.accrue.Errors;
import org.javai.accrue.ValidationError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Marker;
import org.slf4j.event.Level;
import org.slf4j.helpers.LegacyAbstractLogger;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class MetricsValidationReporterTest {

	private static final ObjectMapper MAPPER = new ObjectMapper();
	private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-20T10:30:00Z"), ZoneOffset.UTC);

	private static final Errors ERRORS = Errors.of(
		ValidationError.of("x", Context.empty().push("user", "User", null).push("email", "string", "x"), "invalid"),
		ValidationError.of(null, "missing \"name\""));

	private CapturingLogger logger;
	private MetricsValidationReporter reporter;

	@BeforeEach
	void setUp() {
		logger = new CapturingLogger(false);
		reporter = new MetricsValidationReporter(null, logger, CLOCK);
	}

	@Test
	void report_emitsFailureEventAsJsonLine() throws Exception {
		reporter.report("signup", ERRORS);

		assertThat(logger.infoMessages).hasSize(1);
		JsonNode json = MAPPER.readTree(logger.infoMessages.get(0));
		assertThat(json.get("eventType").asText()).isEqualTo("validation_failure");
		assertThat(json.get("timestamp").asText()).isEqualTo("2024-01-20T10:30:00Z");
		assertThat(json.get("trackingKey").asText()).isEqualTo("signup");
		assertThat(json.get("operation").asText()).isEqualTo("signup");
		assertThat(json.get("errorCount").asText()).isEqualTo("2");
		assertThat(json.get("paths").size()).isEqualTo(2);
		assertThat(json.get("paths").get(0).asText()).isEqualTo("user.email");
		assertThat(json.get("paths").get(1).asText()).isEmpty();
	}

	@Test
	void report_withNamespace_prependsToTrackingKey() throws Exception {
		new MetricsValidationReporter("myapp", logger, CLOCK).report("order.create", ERRORS);

		JsonNode json = MAPPER.readTree(logger.infoMessages.get(0));
		assertThat(json.get("trackingKey").asText()).isEqualTo("myapp.order.create");
	}

	@Test
	void report_withBlankNamespace_usesOperationOnly() {
		MetricsValidationReporter blank = new MetricsValidationReporter("  ", logger, CLOCK);

		assertThat(blank.buildTrackingKey("order.create")).isEqualTo("order.create");
	}

	@Test
	void report_escapesOperationName() throws Exception {
		reporter.report("weird \"op\"\n", ERRORS);

		JsonNode json = MAPPER.readTree(logger.infoMessages.get(0));
		assertThat(json.get("operation").asText()).isEqualTo("weird \"op\"\n");
	}

	@Test
	void report_loggerFailure_doesNotPropagate() {
		CapturingLogger failing = new CapturingLogger(true);
		MetricsValidationReporter reporter = new MetricsValidationReporter(null, failing, CLOCK);

		assertThatCode(() -> reporter.report("signup", ERRORS)).doesNotThrowAnyException();
		assertThat(failing.warnMessages).containsExactly("Unable to emit validation metrics for operation {}");
	}

	@Test
	void escapeJson_handlesSpecialCharacters() {
		assertThat(MetricsValidationReporter.escapeJson("a\\b\"c\td")).isEqualTo("a\\\\b\\\"c\\td");
		assertThat(MetricsValidationReporter.escapeJson(null)).isEmpty();
	}

	private static final class CapturingLogger extends LegacyAbstractLogger {
		private final List<String> infoMessages = new ArrayList<>();
		private final List<String> warnMessages = new ArrayList<>();
		private final boolean failOnInfo;

		CapturingLogger(boolean failOnInfo) {
			this.name = "test";
			this.failOnInfo = failOnInfo;
		}

		@Override
		public boolean isTraceEnabled() { return false; }

		@Override
		public boolean isDebugEnabled() { return false; }

		@Override
		public boolean isInfoEnabled() { return true; }

		@Override
		public boolean isWarnEnabled() { return true; }

		@Override
		public boolean isErrorEnabled() { return true; }

		@Override
		protected String getFullyQualifiedCallerName() { return null; }

		@Override
		protected void handleNormalizedLoggingCall(Level level, Marker marker, String messagePattern,
												   Object[] arguments, Throwable throwable) {
			if (level == Level.INFO) {
				if (failOnInfo) {
					throw new IllegalStateException("appender down");
				}
				infoMessages.add(messagePattern);
			} else if (level == Level.WARN) {
				warnMessages.add(messagePattern);
			}
		}
	}
}
