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

import static java.util.Objects.requireNonNull;

/**
 * Contract for flattening a {@link Template} tree into a single {@link CompiledStatement}.
 * <p>
 * Implementations must emit template text verbatim and every scalar value as a placeholder, never the reverse, so
 * no value can alter the grammatical structure of the statement.
 * <p>
 * Implementations should be threadsafe.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
@FunctionalInterface
public interface TemplateCompiler {
	/**
	 * Compiles the given template.
	 *
	 * @param template the template to compile
	 * @return the compiled statement
	 * @throws TemplateCompileException if the template contains an unsupported value or a nesting cycle
	 */
	@Nonnull
	CompiledStatement compile(@Nonnull Template template);

	/**
	 * Acquires a compiler which emits {@link PlaceholderStyle#DOLLAR_NUMBERED} placeholders.
	 *
	 * @return a {@code TemplateCompiler} with default settings
	 */
	@Nonnull
	static TemplateCompiler withDefaultConfiguration() {
		return new DefaultTemplateCompiler(PlaceholderStyle.DOLLAR_NUMBERED);
	}

	/**
	 * Acquires a compiler which emits placeholders in the given style.
	 *
	 * @param placeholderStyle the placeholder syntax to emit
	 * @return a {@code TemplateCompiler} for the placeholder style
	 */
	@Nonnull
	static TemplateCompiler withPlaceholderStyle(@Nonnull PlaceholderStyle placeholderStyle) {
		requireNonNull(placeholderStyle);
		return new DefaultTemplateCompiler(placeholderStyle);
	}
}
