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
import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link TemplateCompiler}.
 * <p>
 * Performs a depth-first, left-to-right walk over the template tree with a single running placeholder counter, so
 * placeholder numbers are contiguous across the whole tree rather than per nested template.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
class DefaultTemplateCompiler implements TemplateCompiler {
	/**
	 * Fragments that keep producing fresh fragments cannot be caught by identity tracking, so depth is capped too.
	 */
	@Nonnull
	static final Integer MAXIMUM_NESTING_DEPTH = 256;

	@Nonnull
	private final PlaceholderStyle placeholderStyle;

	DefaultTemplateCompiler(@Nonnull PlaceholderStyle placeholderStyle) {
		requireNonNull(placeholderStyle);
		this.placeholderStyle = placeholderStyle;
	}

	@Nonnull
	@Override
	public CompiledStatement compile(@Nonnull Template template) {
		requireNonNull(template);

		Compilation compilation = new Compilation(getPlaceholderStyle());
		compilation.appendFragment(template);

		return CompiledStatement.of(compilation.sql.toString(), compilation.parameters);
	}

	@Nonnull
	public PlaceholderStyle getPlaceholderStyle() {
		return this.placeholderStyle;
	}

	/**
	 * Mutable state for a single {@link #compile(Template)} call.
	 */
	@NotThreadSafe
	private static final class Compilation {
		@Nonnull
		private final PlaceholderStyle placeholderStyle;
		@Nonnull
		private final StringBuilder sql;
		@Nonnull
		private final List<Object> parameters;
		@Nonnull
		private final Set<SqlFragment> activeFragments;
		@Nonnull
		private final List<Integer> slotPath;

		private Compilation(@Nonnull PlaceholderStyle placeholderStyle) {
			this.placeholderStyle = requireNonNull(placeholderStyle);
			this.sql = new StringBuilder();
			this.parameters = new ArrayList<>();
			this.activeFragments = Collections.newSetFromMap(new IdentityHashMap<>());
			this.slotPath = new ArrayList<>();
		}

		private void appendFragment(@Nonnull SqlFragment fragment) {
			requireNonNull(fragment);

			if (this.slotPath.size() > MAXIMUM_NESTING_DEPTH)
				throw new TemplateCompileException(format("Template nesting exceeds %d levels at template slot %s",
						MAXIMUM_NESTING_DEPTH, this.slotPath));

			if (!this.activeFragments.add(fragment))
				throw new CyclicTemplateException(this.slotPath);

			try {
				Template template = fragment.toTemplate();

				if (template == null)
					throw new TemplateCompileException(format("%s at template slot %s expanded to null",
							fragment.getClass().getName(), this.slotPath));

				// A fragment may hand back a template that is already being expanded further up
				if (template != fragment && this.activeFragments.contains(template))
					throw new CyclicTemplateException(this.slotPath);

				appendTemplate(template);
			} finally {
				this.activeFragments.remove(fragment);
			}
		}

		private void appendTemplate(@Nonnull Template template) {
			List<String> segments = template.getSegments();
			List<Object> values = template.getValues();

			for (int i = 0; i < values.size(); ++i) {
				this.sql.append(segments.get(i));
				this.slotPath.add(i);

				try {
					appendSlot(Slot.classify(values.get(i)));
				} finally {
					this.slotPath.remove(this.slotPath.size() - 1);
				}
			}

			this.sql.append(segments.get(segments.size() - 1));
		}

		private void appendSlot(@Nonnull Slot slot) {
			if (slot instanceof Slot.Scalar scalar) {
				appendParameter(scalar.getValue());
			} else if (slot instanceof Slot.Nested nested) {
				appendFragment(nested.getFragment());
			} else if (slot instanceof Slot.InList inList) {
				appendInList(inList);
			} else if (slot instanceof Slot.Invalid invalid) {
				throw new InvalidParameterTypeException(this.slotPath, invalid.getValue().getClass(), invalid.getReason().orElse(null));
			} else {
				throw new IllegalStateException(format("Unhandled slot type %s", slot.getClass().getName()));
			}
		}

		private void appendInList(@Nonnull Slot.InList inList) {
			List<Object> elements = inList.getElements();

			if (elements.isEmpty())
				throw new TemplateCompileException(format("IN-list at template slot %s must contain at least one element", this.slotPath));

			for (int i = 0; i < elements.size(); ++i) {
				Slot elementSlot = Slot.classify(elements.get(i));

				if (!(elementSlot instanceof Slot.Scalar scalar)) {
					Object element = elements.get(i);
					throw new InvalidParameterTypeException(this.slotPath, element == null ? null : element.getClass(),
							format("IN-list element %d is not a bindable scalar", i));
				}

				if (i > 0)
					this.sql.append(", ");

				appendParameter(scalar.getValue());
			}
		}

		private void appendParameter(Object value) {
			this.parameters.add(value);
			this.sql.append(this.placeholderStyle.placeholder(this.parameters.size()));
		}
	}
}
