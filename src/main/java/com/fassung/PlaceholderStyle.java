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

import static java.util.Objects.requireNonNull;

/**
 * Positional parameter syntax emitted by a {@link TemplateCompiler}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public enum PlaceholderStyle {
	/**
	 * Numbered placeholders {@code $1}, {@code $2}, ... as used by the PostgreSQL protocol.
	 */
	DOLLAR_NUMBERED {
		@Nonnull
		@Override
		public String placeholder(@Nonnull Integer index) {
			requireNonNull(index);
			return "$" + index;
		}
	},
	/**
	 * Anonymous {@code ?} placeholders as used by JDBC.
	 */
	QUESTION_MARK {
		@Nonnull
		@Override
		public String placeholder(@Nonnull Integer index) {
			requireNonNull(index);
			return "?";
		}
	};

	/**
	 * Renders the placeholder for the parameter at the given 1-based position.
	 *
	 * @param index the 1-based parameter position
	 * @return the placeholder text
	 */
	@Nonnull
	public abstract String placeholder(@Nonnull Integer index);
}
