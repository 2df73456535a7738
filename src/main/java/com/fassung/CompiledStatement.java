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
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The flattened output of a {@link TemplateCompiler}: SQL text with positional placeholders and the parameter values
 * those placeholders refer to, in placeholder order.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class CompiledStatement {
	@Nonnull
	private final String sql;
	@Nonnull
	private final List<Object> parameters;

	private CompiledStatement(@Nonnull String sql,
							  @Nonnull List<Object> parameters) {
		requireNonNull(sql);
		requireNonNull(parameters);

		this.sql = sql;
		this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
	}

	/**
	 * Factory method for providing {@link CompiledStatement} instances.
	 *
	 * @param sql        the SQL text, containing one placeholder per parameter
	 * @param parameters the parameter values, which may include {@code null}
	 * @return a compiled statement instance
	 */
	@Nonnull
	public static CompiledStatement of(@Nonnull String sql,
									   @Nonnull List<Object> parameters) {
		requireNonNull(sql);
		requireNonNull(parameters);

		return new CompiledStatement(sql, parameters);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getSql(), getParameters());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof CompiledStatement))
			return false;

		CompiledStatement compiledStatement = (CompiledStatement) object;

		return Objects.equals(compiledStatement.getSql(), getSql())
				&& Objects.equals(compiledStatement.getParameters(), getParameters());
	}

	@Override
	@Nonnull
	public String toString() {
		// Strip out newlines for more compact SQL representation
		return format("%s{sql=%s, parameterCount=%d}", getClass().getSimpleName(),
				getSql().replaceAll("\n+", " ").trim(), getParameters().size());
	}

	@Nonnull
	public String getSql() {
		return this.sql;
	}

	@Nonnull
	public List<Object> getParameters() {
		return this.parameters;
	}
}
