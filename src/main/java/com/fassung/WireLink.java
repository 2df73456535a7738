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
import java.time.Duration;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * One established network link to the database.
 * <p>
 * Links are used by a single {@link Connection} at a time and need not be threadsafe. Transaction control defaults to
 * sending the standard SQL commands through {@link #send(String, List, Duration)}; implementations whose protocol
 * has dedicated calls for them should override. Cursors and notifications are optional and unsupported by default.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public interface WireLink extends AutoCloseable {
	/**
	 * Sends a statement and waits for its result.
	 *
	 * @param sql        statement text containing positional placeholders
	 * @param parameters the values for those placeholders, in order
	 * @param timeout    how long to wait for the result, or {@code null} to wait indefinitely
	 * @return rows or an affected-row count
	 * @throws WireException             if the database or the link reports a failure
	 * @throws DatabaseTimeoutException if {@code timeout} expires first
	 */
	@Nonnull
	WireResult send(@Nonnull String sql,
					@Nonnull List<Object> parameters,
					@Nullable Duration timeout);

	/**
	 * Has this link failed in a way that makes it unsafe to reuse?
	 *
	 * @return {@code true} if the link must be discarded
	 */
	@Nonnull
	Boolean isBroken();

	/**
	 * Closes the link. Closing an already-closed link has no effect.
	 */
	@Override
	void close();

	default void begin() {
		send("BEGIN", List.of(), null);
	}

	default void commit() {
		send("COMMIT", List.of(), null);
	}

	default void rollback() {
		send("ROLLBACK", List.of(), null);
	}

	default void createSavepoint(@Nonnull String savepointName) {
		requireNonNull(savepointName);
		send("SAVEPOINT " + savepointName, List.of(), null);
	}

	default void releaseSavepoint(@Nonnull String savepointName) {
		requireNonNull(savepointName);
		send("RELEASE SAVEPOINT " + savepointName, List.of(), null);
	}

	default void rollbackToSavepoint(@Nonnull String savepointName) {
		requireNonNull(savepointName);
		send("ROLLBACK TO SAVEPOINT " + savepointName, List.of(), null);
	}

	/**
	 * Opens a server-side cursor over a query's rows. Only valid inside a transaction.
	 *
	 * @param sql        query text containing positional placeholders
	 * @param parameters the values for those placeholders, in order
	 * @param prefetch   how many rows the link should buffer per round trip
	 * @param timeout    how long to wait for the query to start, or {@code null} to wait indefinitely
	 * @return the open cursor, positioned before the first row
	 * @throws UnsupportedOperationException if this link has no cursor support
	 */
	@Nonnull
	default WireCursor openCursor(@Nonnull String sql,
								  @Nonnull List<Object> parameters,
								  @Nonnull Integer prefetch,
								  @Nullable Duration timeout) {
		throw new UnsupportedOperationException(format("%s does not support cursors", getClass().getSimpleName()));
	}

	/**
	 * Can this link receive asynchronous notifications via {@link #pollNotifications(Duration)}?
	 *
	 * @return {@code true} if notifications are supported
	 */
	@Nonnull
	default Boolean supportsNotifications() {
		return false;
	}

	default void listen(@Nonnull String channel) {
		requireNonNull(channel);
		send("LISTEN " + quoteIdentifier(channel), List.of(), null);
	}

	default void unlisten(@Nonnull String channel) {
		requireNonNull(channel);
		send("UNLISTEN " + quoteIdentifier(channel), List.of(), null);
	}

	default void unlistenAll() {
		send("UNLISTEN *", List.of(), null);
	}

	/**
	 * Returns the notifications received since the last call, waiting up to {@code timeout} for the first one if
	 * none are pending.
	 *
	 * @param timeout how long to wait, {@link Duration#ZERO} to return immediately, or {@code null} to wait indefinitely
	 * @return the received notifications in arrival order, possibly empty
	 * @throws UnsupportedOperationException if this link has no notification support
	 */
	@Nonnull
	default List<Notification> pollNotifications(@Nullable Duration timeout) {
		throw new UnsupportedOperationException(format("%s does not support notifications", getClass().getSimpleName()));
	}

	@Nonnull
	private static String quoteIdentifier(@Nonnull String identifier) {
		requireNonNull(identifier);
		return "\"" + identifier.replace("\"", "\"\"") + "\"";
	}
}
