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
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * An ordered sequence of trusted SQL text segments interleaved with value slots.
 * <p>
 * Segments are always one more than slots, so a template reads as
 * {@code segment[0] slot[0] segment[1] slot[1] ... segment[n]}. Segment text is emitted verbatim by the
 * {@link TemplateCompiler}; slot values never become SQL text. A slot whose value is a {@link SqlFragment}
 * (including another template) is spliced inline, which makes templates composable:
 * <pre>{@code
 * Template where = Template.format("WHERE major = {}", "Physics");
 * Template limit = pageSize == null ? Template.empty() : Template.format("LIMIT {}", pageSize);
 * Template query = Template.format("SELECT * FROM student {} ORDER BY id {}", where, limit);
 * }</pre>
 * Instances are immutable.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class Template implements SqlFragment {
	@Nonnull
	private static final String VALUE_MARKER;
	@Nonnull
	private static final String ESCAPED_VALUE_MARKER;
	@Nonnull
	private static final Template EMPTY;

	static {
		VALUE_MARKER = "{}";
		ESCAPED_VALUE_MARKER = "{{}}";
		EMPTY = new Template(List.of(""), List.of());
	}

	@Nonnull
	private final List<String> segments;
	@Nonnull
	private final List<Object> values;

	private Template(@Nonnull List<String> segments,
					 @Nonnull List<Object> values) {
		requireNonNull(segments);
		requireNonNull(values);

		if (segments.size() != values.size() + 1)
			throw new IllegalArgumentException(String.format("A template with %d values requires %d SQL segments, but %d were provided",
					values.size(), values.size() + 1, segments.size()));

		for (String segment : segments)
			requireNonNull(segment, "SQL segments cannot be null");

		this.segments = Collections.unmodifiableList(new ArrayList<>(segments));
		this.values = Collections.unmodifiableList(new ArrayList<>(values));
	}

	/**
	 * The template with no text and no values.
	 * <p>
	 * Splicing it into another template contributes nothing, which makes it the natural stand-in for an absent
	 * optional clause.
	 *
	 * @return the empty template
	 */
	@Nonnull
	public static Template empty() {
		return EMPTY;
	}

	/**
	 * Creates a template consisting only of trusted SQL text.
	 *
	 * @param sql the SQL text
	 * @return a template without values
	 */
	@Nonnull
	public static Template of(@Nonnull String sql) {
		requireNonNull(sql);
		return sql.isEmpty() ? EMPTY : new Template(List.of(sql), List.of());
	}

	/**
	 * Creates a template by splitting {@code sql} at each {@code {}} marker and placing the corresponding value in
	 * that slot.
	 * <p>
	 * Write {@code {{}}} for SQL that needs a literal {@code {}}, such as an empty PostgreSQL array literal:
	 * {@code Template.format("SELECT '{{}}'::int[] WHERE id = {}", id)}.
	 *
	 * @param sql    trusted SQL text containing one {@code {}} marker per value
	 * @param values the slot values, in marker order
	 * @return the template
	 * @throws IllegalArgumentException if the number of markers does not match the number of values
	 */
	@Nonnull
	public static Template format(@Nonnull String sql,
								  @Nullable Object... values) {
		requireNonNull(sql);

		Object[] slotValues = values == null ? new Object[]{null} : values;
		List<String> segments = new ArrayList<>(slotValues.length + 1);
		StringBuilder segment = new StringBuilder(sql.length());
		int i = 0;

		while (i < sql.length()) {
			if (sql.startsWith(ESCAPED_VALUE_MARKER, i)) {
				segment.append(VALUE_MARKER);
				i += ESCAPED_VALUE_MARKER.length();
			} else if (sql.startsWith(VALUE_MARKER, i)) {
				segments.add(segment.toString());
				segment.setLength(0);
				i += VALUE_MARKER.length();
			} else {
				segment.append(sql.charAt(i));
				++i;
			}
		}

		segments.add(segment.toString());

		if (segments.size() - 1 != slotValues.length)
			throw new IllegalArgumentException(String.format("SQL has %d value markers but %d values were provided: %s",
					segments.size() - 1, slotValues.length, sql));

		List<Object> valueList = new ArrayList<>(slotValues.length);
		Collections.addAll(valueList, slotValues);

		return new Template(segments, valueList);
	}

	/**
	 * Joins fragments into one template, separated by trusted {@code delimiter} text.
	 *
	 * @param delimiter trusted SQL text placed between fragments
	 * @param fragments the fragments to join
	 * @return the joined template, or {@link #empty()} if there are no fragments
	 */
	@Nonnull
	public static Template join(@Nonnull String delimiter,
								@Nonnull Collection<? extends SqlFragment> fragments) {
		requireNonNull(delimiter);
		requireNonNull(fragments);

		Builder builder = builder();
		boolean first = true;

		for (SqlFragment fragment : fragments) {
			requireNonNull(fragment, "Cannot join a null fragment");

			if (!first)
				builder.sql(delimiter);

			builder.fragment(fragment);
			first = false;
		}

		return builder.build();
	}

	/**
	 * Provides a builder for assembling a template piece by piece.
	 *
	 * @return a template builder
	 */
	@Nonnull
	public static Builder builder() {
		return new Builder();
	}

	@Nonnull
	@Override
	public Template toTemplate() {
		return this;
	}

	/**
	 * The trusted SQL segments; always one more than {@link #getValues()}.
	 *
	 * @return an unmodifiable list of segments
	 */
	@Nonnull
	public List<String> getSegments() {
		return this.segments;
	}

	/**
	 * The slot values, which may include {@code null}.
	 *
	 * @return an unmodifiable list of values
	 */
	@Nonnull
	public List<Object> getValues() {
		return this.values;
	}

	/**
	 * Does this template contribute neither text nor values?
	 *
	 * @return {@code true} if this template is empty
	 */
	@Nonnull
	public Boolean isEmpty() {
		return getValues().isEmpty() && getSegments().get(0).isEmpty();
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Template))
			return false;

		Template template = (Template) object;

		return Objects.equals(getSegments(), template.getSegments())
				&& Objects.equals(getValues(), template.getValues());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getSegments(), getValues());
	}

	@Override
	@Nonnull
	public String toString() {
		return String.format("%s{sql=%s, valueCount=%d}", getClass().getSimpleName(),
				String.join(VALUE_MARKER, getSegments()).replaceAll("\n+", " ").trim(), getValues().size());
	}

	/**
	 * Builder used to assemble {@link Template} instances.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static final class Builder {
		@Nonnull
		private final List<String> segments;
		@Nonnull
		private final List<Object> values;
		@Nonnull
		private StringBuilder currentSegment;

		private Builder() {
			this.segments = new ArrayList<>();
			this.values = new ArrayList<>();
			this.currentSegment = new StringBuilder();
		}

		/**
		 * Appends trusted SQL text.
		 *
		 * @param sql the SQL text
		 * @return this builder, for chaining
		 */
		@Nonnull
		public Builder sql(@Nonnull String sql) {
			requireNonNull(sql);
			this.currentSegment.append(sql);
			return this;
		}

		/**
		 * Appends a slot holding {@code value}.
		 *
		 * @param value the slot value (may be {@code null})
		 * @return this builder, for chaining
		 */
		@Nonnull
		public Builder value(@Nullable Object value) {
			this.segments.add(this.currentSegment.toString());
			this.values.add(value);
			this.currentSegment = new StringBuilder();
			return this;
		}

		/**
		 * Appends a slot holding a nested fragment, spliced inline at compile time.
		 *
		 * @param fragment the fragment
		 * @return this builder, for chaining
		 */
		@Nonnull
		public Builder fragment(@Nonnull SqlFragment fragment) {
			requireNonNull(fragment);
			return value(fragment);
		}

		@Nonnull
		public Template build() {
			List<String> segments = new ArrayList<>(this.segments);
			segments.add(this.currentSegment.toString());

			if (this.values.isEmpty() && segments.get(0).isEmpty())
				return EMPTY;

			return new Template(segments, this.values);
		}
	}
}
