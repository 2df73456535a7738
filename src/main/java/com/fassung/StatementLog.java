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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A log of one statement sent through a {@link Connection}, with timing and outcome.
 * <p>
 * Durations are broken out by phase: compiling the {@link Template}, the round trip to the database, and mapping rows.
 * A phase that did not happen (for example, mapping after a failed execution) has no duration.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class StatementLog {
	@NonNull
	private final CompiledStatement compiledStatement;
	@NonNull
	private final Duration totalDuration;
	@Nullable
	private final Duration compilationDuration;
	@Nullable
	private final Duration executionDuration;
	@Nullable
	private final Duration resultMappingDuration;
	@Nullable
	private final Long rowCount;
	@Nullable
	private final Exception exception;

	private StatementLog(@NonNull Builder builder) {
		requireNonNull(builder);

		this.compiledStatement = requireNonNull(builder.compiledStatement);
		this.compilationDuration = builder.compilationDuration;
		this.executionDuration = builder.executionDuration;
		this.resultMappingDuration = builder.resultMappingDuration;
		this.rowCount = builder.rowCount;
		this.exception = builder.exception;

		Duration totalDuration = Duration.ZERO;

		if (this.compilationDuration != null)
			totalDuration = totalDuration.plus(this.compilationDuration);

		if (this.executionDuration != null)
			totalDuration = totalDuration.plus(this.executionDuration);

		if (this.resultMappingDuration != null)
			totalDuration = totalDuration.plus(this.resultMappingDuration);

		this.totalDuration = totalDuration;
	}

	/**
	 * Creates a {@link StatementLog} builder for the given {@code compiledStatement}.
	 *
	 * @param compiledStatement the statement that was (or was attempted to be) executed
	 * @return a {@link StatementLog} builder
	 */
	@NonNull
	public static Builder withCompiledStatement(@NonNull CompiledStatement compiledStatement) {
		requireNonNull(compiledStatement);
		return new Builder(compiledStatement);
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(7);

		components.add(format("compiledStatement=%s", getCompiledStatement()));
		components.add(format("totalDuration=%s", getTotalDuration()));

		getCompilationDuration().ifPresent(duration -> components.add(format("compilationDuration=%s", duration)));
		getExecutionDuration().ifPresent(duration -> components.add(format("executionDuration=%s", duration)));
		getResultMappingDuration().ifPresent(duration -> components.add(format("resultMappingDuration=%s", duration)));
		getRowCount().ifPresent(rowCount -> components.add(format("rowCount=%s", rowCount)));
		getException().ifPresent(exception -> components.add(format("exception=%s", exception)));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof StatementLog))
			return false;

		StatementLog statementLog = (StatementLog) object;

		return Objects.equals(getCompiledStatement(), statementLog.getCompiledStatement())
				&& Objects.equals(getCompilationDuration(), statementLog.getCompilationDuration())
				&& Objects.equals(getExecutionDuration(), statementLog.getExecutionDuration())
				&& Objects.equals(getResultMappingDuration(), statementLog.getResultMappingDuration())
				&& Objects.equals(getRowCount(), statementLog.getRowCount())
				&& Objects.equals(getException(), statementLog.getException());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getCompiledStatement(), getCompilationDuration(), getExecutionDuration(),
				getResultMappingDuration(), getRowCount(), getException());
	}

	@NonNull
	public CompiledStatement getCompiledStatement() {
		return this.compiledStatement;
	}

	/**
	 * The sum of every phase duration that is present.
	 *
	 * @return how long the statement took
	 */
	@NonNull
	public Duration getTotalDuration() {
		return this.totalDuration;
	}

	@NonNull
	public Optional<Duration> getCompilationDuration() {
		return Optional.ofNullable(this.compilationDuration);
	}

	@NonNull
	public Optional<Duration> getExecutionDuration() {
		return Optional.ofNullable(this.executionDuration);
	}

	@NonNull
	public Optional<Duration> getResultMappingDuration() {
		return Optional.ofNullable(this.resultMappingDuration);
	}

	/**
	 * Rows returned, or rows affected for statements that return none.
	 *
	 * @return the row count, or empty if execution failed
	 */
	@NonNull
	public Optional<Long> getRowCount() {
		return Optional.ofNullable(this.rowCount);
	}

	@NonNull
	public Optional<Exception> getException() {
		return Optional.ofNullable(this.exception);
	}

	/**
	 * Builder used to construct instances of {@link StatementLog}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final CompiledStatement compiledStatement;
		@Nullable
		private Duration compilationDuration;
		@Nullable
		private Duration executionDuration;
		@Nullable
		private Duration resultMappingDuration;
		@Nullable
		private Long rowCount;
		@Nullable
		private Exception exception;

		private Builder(@NonNull CompiledStatement compiledStatement) {
			requireNonNull(compiledStatement);
			this.compiledStatement = compiledStatement;
		}

		@NonNull
		public Builder compilationDuration(@Nullable Duration compilationDuration) {
			this.compilationDuration = compilationDuration;
			return this;
		}

		@NonNull
		public Builder executionDuration(@Nullable Duration executionDuration) {
			this.executionDuration = executionDuration;
			return this;
		}

		@NonNull
		public Builder resultMappingDuration(@Nullable Duration resultMappingDuration) {
			this.resultMappingDuration = resultMappingDuration;
			return this;
		}

		@NonNull
		public Builder rowCount(@Nullable Long rowCount) {
			this.rowCount = rowCount;
			return this;
		}

		@NonNull
		public Builder exception(@Nullable Exception exception) {
			this.exception = exception;
			return this;
		}

		@NonNull
		public StatementLog build() {
			return new StatementLog(this);
		}
	}
}
