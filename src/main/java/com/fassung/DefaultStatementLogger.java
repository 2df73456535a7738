/*
 * Copyright 2015-2022 Transmogrify LLC, 2022-2026 Revetware LLC.
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

package com.fassung;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * Basic implementation of {@link StatementLogger} which logs via java.util.logging.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public class DefaultStatementLogger implements StatementLogger {
	@Nonnull
	public static final String DEFAULT_LOGGER_NAME = "com.fassung.SQL";
	@Nonnull
	public static final Level DEFAULT_LOGGER_LEVEL = Level.FINE;

	/**
	 * The point at which we ellipsize output for parameters.
	 */
	private static final int MAXIMUM_PARAMETER_LOGGING_LENGTH = 100;
	/**
	 * The number of array or in-list elements shown before the rest are summarized.
	 */
	private static final int MAXIMUM_ELEMENT_LOGGING_COUNT = 10;

	@Nonnull
	private final Logger logger;
	@Nonnull
	private final Level loggerLevel;

	/**
	 * Creates a new statement logger with the default logger name <code>{@value #DEFAULT_LOGGER_NAME}</code> and level.
	 */
	public DefaultStatementLogger() {
		this(DEFAULT_LOGGER_NAME, DEFAULT_LOGGER_LEVEL);
	}

	/**
	 * Creates a new statement logger with the given logger name and level.
	 *
	 * @param loggerName  the logger name to use
	 * @param loggerLevel the logger level to use
	 */
	public DefaultStatementLogger(@Nonnull String loggerName,
																@Nonnull Level loggerLevel) {
		requireNonNull(loggerName);
		requireNonNull(loggerLevel);

		this.logger = Logger.getLogger(loggerName);
		this.loggerLevel = loggerLevel;
	}

	@Override
	public void log(@Nonnull StatementLog statementLog) {
		requireNonNull(statementLog);

		if (getLogger().isLoggable(getLoggerLevel()))
			getLogger().log(getLoggerLevel(), formatStatementLog(statementLog));
	}

	@Nonnull
	protected String formatStatementLog(@Nonnull StatementLog statementLog) {
		requireNonNull(statementLog);

		List<String> timingEntries = new ArrayList<>(3);

		statementLog.getCompilationDuration().ifPresent(duration -> timingEntries.add(format("%s compiling template", duration)));
		statementLog.getExecutionDuration().ifPresent(duration -> timingEntries.add(format("%s executing statement", duration)));
		statementLog.getResultMappingDuration().ifPresent(duration -> timingEntries.add(format("%s mapping rows", duration)));

		List<String> lines = new ArrayList<>(4);
		List<Object> parameters = statementLog.getCompiledStatement().getParameters();

		lines.add(statementLog.getCompiledStatement().getSql());

		if (parameters.size() > 0)
			lines.add(format("Parameters: %s", parameters.stream().map(this::formatParameter).collect(joining(", "))));

		if (timingEntries.size() > 0)
			lines.add(timingEntries.stream().collect(joining(", ")));

		Throwable exception = statementLog.getException().orElse(null);

		if (exception != null) {
			if (exception instanceof WireException && exception.getCause() != null)
				exception = exception.getCause();

			lines.add(format("Failed due to %s", exception));
		}

		return lines.stream().collect(joining("\n"));
	}

	@Nonnull
	protected String formatParameter(Object parameter) {
		if (parameter == null)
			return "null";

		if (parameter instanceof Number || parameter instanceof Boolean)
			return parameter.toString();

		if (parameter instanceof byte[])
			return format("[byte array of length %d]", ((byte[]) parameter).length);

		if (parameter instanceof ArrayParameter arrayParameter) {
			List<Object> elements = arrayParameter.getElements().orElse(null);

			if (elements == null)
				return format("%s[] null", arrayParameter.getBaseTypeName());

			String formattedElements = elements.stream()
					.limit(MAXIMUM_ELEMENT_LOGGING_COUNT)
					.map(this::formatParameter)
					.collect(joining(", "));

			if (elements.size() > MAXIMUM_ELEMENT_LOGGING_COUNT)
				formattedElements = format("%s, ... (%d more)", formattedElements, elements.size() - MAXIMUM_ELEMENT_LOGGING_COUNT);

			return format("%s[] {%s}", arrayParameter.getBaseTypeName(), formattedElements);
		}

		return format("'%s'", ellipsize(parameter.toString(), MAXIMUM_PARAMETER_LOGGING_LENGTH));
	}

	/**
	 * Ellipsizes the given {@code string}, capping at {@code maximumLength}.
	 *
	 * @param string        the string to ellipsize
	 * @param maximumLength the maximum length of the ellipsized string, not including ellipsis
	 * @return an ellipsized version of {@code string}
	 */
	@Nonnull
	protected String ellipsize(@Nonnull String string,
														 int maximumLength) {
		requireNonNull(string);

		string = string.trim();

		if (string.length() <= maximumLength)
			return string;

		return format("%s...", string.substring(0, maximumLength));
	}

	@Nonnull
	protected Logger getLogger() {
		return this.logger;
	}

	@Nonnull
	protected Level getLoggerLevel() {
		return this.loggerLevel;
	}
}
