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
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Reads a query's rows incrementally through a server-side cursor instead of materializing them all at once.
 * <p>
 * Cursors are opened inside a transaction via {@link Transaction#cursor(Template, Class)} and are closed when that
 * transaction ends, if not sooner:
 * <pre>{@code
 * pool.transaction(transaction -> {
 *   try (Cursor<Car> cursor = transaction.cursor(Template.of("SELECT * FROM car ORDER BY id"), Car.class)) {
 *     for (Car car : cursor)
 *       process(car);
 *   }
 * });
 * }</pre>
 * Iterating reads rows from the database {@link #getPrefetch()} at a time. {@link #fetch(Integer)},
 * {@link #fetchRow()} and {@link #forward(Long)} read or skip exactly the requested number of rows, and may be mixed
 * with iteration.
 *
 * @param <T> the type each row is mapped to
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public final class Cursor<T> implements AutoCloseable, Iterable<@Nullable T> {
	@NonNull
	public static final Integer DEFAULT_PREFETCH = 50;

	@NonNull
	private final Connection connection;
	@NonNull
	private final WireCursor wireCursor;
	@NonNull
	private final Class<T> resultType;
	@NonNull
	private final Integer prefetch;
	@Nullable
	private final Duration timeout;
	@NonNull
	private final Deque<Row> prefetchedRows;
	private long rowIndex;
	private boolean exhausted;
	private boolean closed;

	Cursor(@NonNull Connection connection,
				 @NonNull WireCursor wireCursor,
				 @NonNull Class<T> resultType,
				 @NonNull Integer prefetch,
				 @Nullable Duration timeout) {
		requireNonNull(connection);
		requireNonNull(wireCursor);
		requireNonNull(resultType);
		requireNonNull(prefetch);

		this.connection = connection;
		this.wireCursor = wireCursor;
		this.resultType = resultType;
		this.prefetch = prefetch;
		this.timeout = timeout;
		this.prefetchedRows = new ArrayDeque<>();
	}

	/**
	 * Reads up to {@code count} rows, using the timeout the cursor was opened with.
	 *
	 * @param count the maximum number of rows to read
	 * @return the mapped rows, fewer than {@code count} only if the result is exhausted
	 */
	@NonNull
	public List<@Nullable T> fetch(@NonNull Integer count) {
		return fetch(count, null);
	}

	/**
	 * Reads up to {@code count} rows.
	 *
	 * @param count   the maximum number of rows to read
	 * @param timeout how long to wait for the database, or {@code null} for the timeout the cursor was opened with
	 * @return the mapped rows, fewer than {@code count} only if the result is exhausted
	 */
	@NonNull
	public List<@Nullable T> fetch(@NonNull Integer count,
																 @Nullable Duration timeout) {
		requireNonNull(count);

		if (count < 0)
			throw new IllegalArgumentException(format("Row count cannot be negative, but was %d", count));

		ensureOpen();

		List<Row> rows = new ArrayList<>(Math.min(count, 1_024));

		while (rows.size() < count && !this.prefetchedRows.isEmpty())
			rows.add(this.prefetchedRows.removeFirst());

		if (rows.size() < count && !this.exhausted)
			rows.addAll(readRows(count - rows.size(), timeout));

		List<T> results = new ArrayList<>(rows.size());

		for (Row row : rows)
			results.add(mapRow(row));

		return results;
	}

	/**
	 * Reads the next row.
	 *
	 * @return the mapped row, or empty if the result is exhausted
	 */
	@NonNull
	public Optional<T> fetchRow() {
		return fetchRow(null);
	}

	/**
	 * Reads the next row.
	 *
	 * @param timeout how long to wait for the database, or {@code null} for the timeout the cursor was opened with
	 * @return the mapped row, or empty if the result is exhausted
	 */
	@NonNull
	public Optional<T> fetchRow(@Nullable Duration timeout) {
		List<T> results = fetch(1, timeout);
		return results.isEmpty() ? Optional.empty() : Optional.ofNullable(results.get(0));
	}

	/**
	 * Skips up to {@code count} rows without mapping them.
	 *
	 * @param count the maximum number of rows to skip
	 * @return the number of rows skipped, less than {@code count} only if the result is exhausted
	 */
	@NonNull
	public Long forward(@NonNull Long count) {
		return forward(count, null);
	}

	/**
	 * Skips up to {@code count} rows without mapping them.
	 *
	 * @param count   the maximum number of rows to skip
	 * @param timeout how long to wait for the database, or {@code null} for the timeout the cursor was opened with
	 * @return the number of rows skipped, less than {@code count} only if the result is exhausted
	 */
	@NonNull
	public Long forward(@NonNull Long count,
											@Nullable Duration timeout) {
		requireNonNull(count);

		if (count < 0)
			throw new IllegalArgumentException(format("Row count cannot be negative, but was %d", count));

		ensureOpen();

		long skipped = 0;

		while (skipped < count && !this.prefetchedRows.isEmpty()) {
			this.prefetchedRows.removeFirst();
			++skipped;
		}

		if (skipped < count && !this.exhausted) {
			long remaining = count - skipped;
			Duration effectiveTimeout = effectiveTimeout(timeout);
			Long forwarded = getConnection().roundTrip(wireLink -> getWireCursor().forward(remaining, effectiveTimeout));

			if (forwarded < remaining)
				this.exhausted = true;

			skipped += forwarded;
		}

		this.rowIndex += skipped;
		return skipped;
	}

	/**
	 * Iterates over the remaining rows, reading them from the database {@link #getPrefetch()} at a time.
	 * <p>
	 * The iterator consumes this cursor: rows it returns are not returned again by {@link #fetch(Integer)}.
	 *
	 * @return an iterator over the remaining mapped rows
	 */
	@Override
	@NonNull
	public Iterator<@Nullable T> iterator() {
		return new Iterator<>() {
			@Override
			public boolean hasNext() {
				ensureOpen();

				if (prefetchedRows.isEmpty() && !exhausted)
					prefetchedRows.addAll(readRows(getPrefetch(), null));

				return !prefetchedRows.isEmpty();
			}

			@Override
			@Nullable
			public T next() {
				if (!hasNext())
					throw new NoSuchElementException("Cursor is exhausted");

				return mapRow(prefetchedRows.removeFirst());
			}
		};
	}

	/**
	 * Closes the server-side cursor. Calling this more than once has no effect.
	 */
	@Override
	public void close() {
		if (this.closed)
			return;

		this.closed = true;
		this.prefetchedRows.clear();
		getConnection().forgetCursor(this);

		// Ending the lease or shutting down the pool already disposed of the link-side cursor
		if (getConnection().isReleased() || getConnection().getPooledConnection().getState() == ConnectionState.CLOSED)
			return;

		getConnection().control(wireLink -> getWireCursor().close());
	}

	@NonNull
	public Boolean isClosed() {
		return this.closed;
	}

	@NonNull
	public Integer getPrefetch() {
		return this.prefetch;
	}

	@NonNull
	public Class<T> getResultType() {
		return this.resultType;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{resultType=%s, prefetch=%d, rowIndex=%d, exhausted=%s, closed=%s}", getClass().getSimpleName(),
				getResultType().getSimpleName(), getPrefetch(), this.rowIndex, this.exhausted, isClosed());
	}

	@NonNull
	private List<Row> readRows(@NonNull Integer count,
														 @Nullable Duration timeout) {
		requireNonNull(count);

		Duration effectiveTimeout = effectiveTimeout(timeout);
		List<Row> rows = getConnection().roundTrip(wireLink -> getWireCursor().fetch(count, effectiveTimeout));

		if (rows.size() < count)
			this.exhausted = true;

		return rows;
	}

	@Nullable
	private T mapRow(@NonNull Row row) {
		requireNonNull(row);
		return getConnection().getPool().getResultMapper().mapRow(row, (int) this.rowIndex++, getResultType());
	}

	@Nullable
	private Duration effectiveTimeout(@Nullable Duration timeout) {
		return timeout == null ? this.timeout : timeout;
	}

	private void ensureOpen() {
		if (this.closed)
			throw new IllegalDatabaseStateException("This cursor has been closed");
	}

	@NonNull
	private Connection getConnection() {
		return this.connection;
	}

	@NonNull
	private WireCursor getWireCursor() {
		return this.wireCursor;
	}
}
