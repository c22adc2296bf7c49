/*
 * Copyright 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.cursory;

import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * Basic implementation of {@link ResultLogger} which logs via java.util.logging.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class DefaultResultLogger implements ResultLogger {
	@NonNull
	public static final String DEFAULT_LOGGER_NAME = "com.cursory.RESULT";
	@NonNull
	public static final Level DEFAULT_LOGGER_LEVEL = Level.FINE;

	/**
	 * The point at which we ellipsize statement descriptions and key lists.
	 */
	private static final int MAXIMUM_LOGGING_LENGTH = 100;

	@NonNull
	private final Logger logger;
	@NonNull
	private final Level loggerLevel;

	/**
	 * Creates a new result logger with the default logger name <code>{@value #DEFAULT_LOGGER_NAME}</code> and level.
	 */
	public DefaultResultLogger() {
		this(DEFAULT_LOGGER_NAME, DEFAULT_LOGGER_LEVEL);
	}

	/**
	 * Creates a new result logger with the given logger name and level.
	 *
	 * @param loggerName  the logger name to use
	 * @param loggerLevel the logger level to use
	 */
	public DefaultResultLogger(@NonNull String loggerName,
														 @NonNull Level loggerLevel) {
		requireNonNull(loggerName);
		requireNonNull(loggerLevel);

		this.logger = Logger.getLogger(loggerName);
		this.loggerLevel = loggerLevel;
	}

	@Override
	public void log(@NonNull ResultLog resultLog) {
		requireNonNull(resultLog);

		if (getLogger().isLoggable(getLoggerLevel()))
			getLogger().log(getLoggerLevel(), formatResultLog(resultLog));
	}

	@NonNull
	protected String formatResultLog(@NonNull ResultLog resultLog) {
		requireNonNull(resultLog);

		List<String> lines = new ArrayList<>(4);

		lines.add(ellipsize(resultLog.getExecutionContext().getStatementDescription().orElse("(no statement description)"),
				MAXIMUM_LOGGING_LENGTH));

		if (resultLog.getKeys().size() > 0)
			lines.add(format("Columns: %s", ellipsize(String.join(", ", resultLog.getKeys()), MAXIMUM_LOGGING_LENGTH)));

		List<String> summaryEntries = new ArrayList<>(4);
		summaryEntries.add(format("%d row%s via %s", resultLog.getRowsEmitted(), resultLog.getRowsEmitted() == 1 ? "" : "s",
				resultLog.getFetchStrategyName()));
		summaryEntries.add(format("%s fetching", resultLog.getFetchDuration()));
		summaryEntries.add(format("%s decoding", resultLog.getDecodeDuration()));
		lines.add(summaryEntries.stream().collect(joining(", ")));

		Throwable exception = resultLog.getException().orElse(null);

		if (exception != null) {
			if (exception instanceof DatabaseException && exception.getCause() != null)
				exception = exception.getCause();

			lines.add(format("Failed due to %s", exception));
		}

		return lines.stream().collect(joining("\n"));
	}

	/**
	 * Ellipsizes the given {@code string}, capping at {@code maximumLength}.
	 *
	 * @param string        the string to ellipsize
	 * @param maximumLength the maximum length of the ellipsized string, not including ellipsis
	 * @return an ellipsized version of {@code string}
	 */
	@NonNull
	protected String ellipsize(@NonNull String string,
														 int maximumLength) {
		requireNonNull(string);

		string = string.trim();

		if (string.length() <= maximumLength)
			return string;

		return format("%s...", string.substring(0, maximumLength));
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}

	@NonNull
	protected Level getLoggerLevel() {
		return this.loggerLevel;
	}
}
