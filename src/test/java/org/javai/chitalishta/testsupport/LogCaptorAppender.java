package org.javai.chitalishta.testsupport;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.Layout;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.config.Property;
import org.apache.logging.log4j.core.layout.PatternLayout;

/**
 * Log4j2 appender attached to a single logger for the duration of a test.
 * <p>
 * Usage:
 * <pre>
 * try (LogCaptorAppender appender = LogCaptorAppender.create(SqlAuditLogger.class, Level.INFO)) {
 *     guard.guard("Колко читалища има?", sql);
 *     assertThat(appender.messages()).anyMatch(msg -> msg.contains("SQL_QUERY_AUDIT"));
 * }
 * </pre>
 */
public final class LogCaptorAppender extends AbstractAppender implements AutoCloseable {

	private final LoggerContext context;
	private final LoggerConfig loggerConfig;
	private final Level previousLevel;
	private final boolean addedConfig;
	private final List<LogEvent> events = new CopyOnWriteArrayList<>();

	private LogCaptorAppender(String name, LoggerContext context, LoggerConfig loggerConfig, Level previousLevel,
			boolean addedConfig, Layout<? extends Serializable> layout) {
		super(name, null, layout, false, Property.EMPTY_ARRAY);
		this.context = context;
		this.loggerConfig = loggerConfig;
		this.previousLevel = previousLevel;
		this.addedConfig = addedConfig;
	}

	public static LogCaptorAppender create(Class<?> loggerClass, Level level) {
		String loggerName = loggerClass.getName();
		LoggerContext context = (LoggerContext) LogManager.getContext(false);
		Configuration configuration = context.getConfiguration();
		LoggerConfig loggerConfig = configuration.getLoggerConfig(loggerName);

		boolean addedConfig = false;
		if (!loggerConfig.getName().equals(loggerName)) {
			LoggerConfig childConfig = new LoggerConfig(loggerName, level, true);
			configuration.addLogger(loggerName, childConfig);
			loggerConfig = childConfig;
			addedConfig = true;
		}

		Level previousLevel = loggerConfig.getLevel();
		loggerConfig.setLevel(level);

		Layout<? extends Serializable> layout = PatternLayout.newBuilder()
				.withPattern(PatternLayout.SIMPLE_CONVERSION_PATTERN)
				.build();

		LogCaptorAppender appender = new LogCaptorAppender(
				"LogCaptor-" + System.nanoTime(),
				context,
				loggerConfig,
				previousLevel,
				addedConfig,
				layout
		);
		appender.start();
		loggerConfig.addAppender(appender, level, null);
		context.updateLoggers();
		return appender;
	}

	@Override
	public void append(LogEvent event) {
		events.add(event.toImmutable());
	}

	public List<LogEvent> events() {
		return Collections.unmodifiableList(events);
	}

	public List<LogEvent> events(Level level) {
		return events.stream()
				.filter(e -> e.getLevel().equals(level))
				.toList();
	}

	public List<String> messages() {
		return events.stream()
				.map(e -> e.getMessage().getFormattedMessage())
				.toList();
	}

	@Override
	public void close() {
		stop();
		loggerConfig.removeAppender(getName());
		if (addedConfig) {
			context.getConfiguration().removeLogger(loggerConfig.getName());
		} else {
			loggerConfig.setLevel(previousLevel);
		}
		context.updateLoggers();
		events.clear();
	}
}
