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

import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;
import static java.util.logging.Level.WARNING;

/**
 * A lease on one pooled database connection.
 * <p>
 * Obtain instances from {@link Pool#acquire()} and release them with {@link #close()}, normally via
 * try-with-resources:
 * <pre>{@code
 * try (Connection connection = pool.acquire()) {
 *   List<Car> cars = connection.fetch(Template.format("SELECT * FROM car WHERE color = {}", color), Car.class);
 * }
 * }</pre>
 * A connection runs one statement at a time. Starting a statement while another is outstanding on the same
 * connection fails with {@link ConnectionBusyException}; using the handle after it was released fails with
 * {@link IllegalDatabaseStateException}.
 * <p>
 * If a statement times out, or fails while the calling thread is interrupted, the underlying link is discarded
 * instead of being returned to the pool when this lease ends.
 * <p>
 * Where the driver supports it, a connection can listen for notifications (PostgreSQL {@code LISTEN}/{@code NOTIFY})
 * via {@link #addListener(String, Class, NotificationListener)}. Listeners run on the calling thread after each
 * statement and during {@link #awaitNotifications(Duration)}; they are unregistered when the lease ends.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class Connection implements AutoCloseable {
	@NonNull
	private final Pool pool;
	@NonNull
	private final PooledConnection pooledConnection;
	@NonNull
	private final AtomicBoolean released;
	@NonNull
	private final AtomicReference<Transaction> currentTransaction;
	@NonNull
	private final Set<Cursor<?>> openCursors;
	@NonNull
	private final ReentrantLock listenerLock;
	@NonNull
	@GuardedBy("listenerLock")
	private final Map<String, List<ListenerRegistration<?>>> listenerRegistrationsByChannel;
	@NonNull
	private final Queue<Notification> pendingNotifications;
	@NonNull
	private final AtomicBoolean dispatchingNotifications;
	@NonNull
	private final Logger logger;

	Connection(@NonNull Pool pool,
						 @NonNull PooledConnection pooledConnection) {
		requireNonNull(pool);
		requireNonNull(pooledConnection);

		this.pool = pool;
		this.pooledConnection = pooledConnection;
		this.released = new AtomicBoolean(false);
		this.currentTransaction = new AtomicReference<>();
		this.openCursors = ConcurrentHashMap.newKeySet();
		this.listenerLock = new ReentrantLock();
		this.listenerRegistrationsByChannel = new LinkedHashMap<>();
		this.pendingNotifications = new ConcurrentLinkedQueue<>();
		this.dispatchingNotifications = new AtomicBoolean(false);
		this.logger = Logger.getLogger(getClass().getName());
	}

	/**
	 * Executes a statement that returns no rows (or whose rows are not needed).
	 *
	 * @param template the statement
	 * @return the number of rows affected
	 */
	@NonNull
	public Long execute(@NonNull Template template) {
		return execute(template, null);
	}

	/**
	 * Executes a statement that returns no rows (or whose rows are not needed).
	 *
	 * @param template the statement
	 * @param timeout  how long to wait for the database, or {@code null} for the pool's statement timeout
	 * @return the number of rows affected
	 */
	@NonNull
	public Long execute(@NonNull Template template,
											@Nullable Duration timeout) {
		requireNonNull(template);
		return send(template, timeout, WireResult::getUpdateCount);
	}

	/**
	 * Fetches every row of a query, mapped to {@code resultType}.
	 *
	 * @param template   the query
	 * @param resultType the type each row is mapped to
	 * @param <T>        result instance type token
	 * @return the mapped rows, in result order
	 */
	@NonNull
	public <T> List<@Nullable T> fetch(@NonNull Template template,
																		 @NonNull Class<T> resultType) {
		return fetch(template, resultType, null);
	}

	/**
	 * Fetches every row of a query, mapped to {@code resultType}.
	 *
	 * @param template   the query
	 * @param resultType the type each row is mapped to
	 * @param timeout    how long to wait for the database, or {@code null} for the pool's statement timeout
	 * @param <T>        result instance type token
	 * @return the mapped rows, in result order
	 */
	@NonNull
	public <T> List<@Nullable T> fetch(@NonNull Template template,
																		 @NonNull Class<T> resultType,
																		 @Nullable Duration timeout) {
		requireNonNull(template);
		requireNonNull(resultType);

		return send(template, timeout, wireResult -> getPool().getResultMapper().map(wireResult.getRows(), resultType));
	}

	/**
	 * Fetches at most one row of a query, mapped to {@code resultType}.
	 *
	 * @param template   the query
	 * @param resultType the type the row is mapped to
	 * @param <T>        result instance type token
	 * @return the mapped row, or empty if the query returned no rows
	 * @throws CardinalityException if the query returned more than one row
	 */
	@NonNull
	public <T> Optional<T> fetchRow(@NonNull Template template,
																	@NonNull Class<T> resultType) {
		return fetchRow(template, resultType, null);
	}

	/**
	 * Fetches at most one row of a query, mapped to {@code resultType}.
	 *
	 * @param template   the query
	 * @param resultType the type the row is mapped to
	 * @param timeout    how long to wait for the database, or {@code null} for the pool's statement timeout
	 * @param <T>        result instance type token
	 * @return the mapped row, or empty if the query returned no rows
	 * @throws CardinalityException if the query returned more than one row
	 */
	@NonNull
	public <T> Optional<T> fetchRow(@NonNull Template template,
																	@NonNull Class<T> resultType,
																	@Nullable Duration timeout) {
		requireNonNull(template);
		requireNonNull(resultType);

		return send(template, timeout, wireResult -> {
			List<Row> rows = wireResult.getRows();

			if (rows.size() > 1)
				throw new CardinalityException(format("Expected at most 1 row but the query returned %d", rows.size()));

			if (rows.isEmpty())
				return Optional.empty();

			return Optional.ofNullable(getPool().getResultMapper().mapRow(rows.get(0), 0, resultType));
		});
	}

	/**
	 * Fetches the single value of a query that returns exactly one row with exactly one column.
	 *
	 * @param template   the query
	 * @param resultType the type the value is coerced to
	 * @param <T>        result instance type token
	 * @return the value, which is {@code null} if the database returned {@code NULL}
	 * @throws CardinalityException if the result is not exactly one row and one column
	 */
	@Nullable
	public <T> T fetchValue(@NonNull Template template,
													@NonNull Class<T> resultType) {
		return fetchValue(template, resultType, null);
	}

	/**
	 * Fetches the single value of a query that returns exactly one row with exactly one column.
	 *
	 * @param template   the query
	 * @param resultType the type the value is coerced to
	 * @param timeout    how long to wait for the database, or {@code null} for the pool's statement timeout
	 * @param <T>        result instance type token
	 * @return the value, which is {@code null} if the database returned {@code NULL}
	 * @throws CardinalityException if the result is not exactly one row and one column
	 */
	@Nullable
	public <T> T fetchValue(@NonNull Template template,
													@NonNull Class<T> resultType,
													@Nullable Duration timeout) {
		requireNonNull(template);
		requireNonNull(resultType);

		return send(template, timeout, wireResult -> {
			List<Row> rows = wireResult.getRows();

			if (rows.size() != 1)
				throw new CardinalityException(format("Expected exactly 1 row but the query returned %d", rows.size()));

			Row row = rows.get(0);

			if (row.getColumnCount() != 1)
				throw new CardinalityException(format("Expected exactly 1 column but the row has %d: %s", row.getColumnCount(), row.getColumnNames()));

			return getPool().getResultMapper().mapRow(row, 0, resultType);
		});
	}

	/**
	 * Opens a cursor over a query's rows, prefetching {@link Cursor#DEFAULT_PREFETCH} rows at a time.
	 *
	 * @param template   the query
	 * @param resultType the type each row is mapped to
	 * @param <T>        result instance type token
	 * @return the open cursor, closed no later than the end of the current transaction
	 * @throws IllegalDatabaseStateException if no transaction is open on this connection
	 */
	@NonNull
	public <T> Cursor<T> cursor(@NonNull Template template,
															@NonNull Class<T> resultType) {
		return cursor(template, resultType, Cursor.DEFAULT_PREFETCH, null);
	}

	/**
	 * Opens a cursor over a query's rows.
	 *
	 * @param template   the query
	 * @param resultType the type each row is mapped to
	 * @param prefetch   how many rows to read per round trip while iterating
	 * @param timeout    how long each round trip may wait for the database, or {@code null} for the pool's statement
	 *                   timeout
	 * @param <T>        result instance type token
	 * @return the open cursor, closed no later than the end of the current transaction
	 * @throws IllegalDatabaseStateException if no transaction is open on this connection
	 */
	@NonNull
	public <T> Cursor<T> cursor(@NonNull Template template,
															@NonNull Class<T> resultType,
															@NonNull Integer prefetch,
															@Nullable Duration timeout) {
		requireNonNull(template);
		requireNonNull(resultType);
		requireNonNull(prefetch);

		if (prefetch < 1)
			throw new IllegalArgumentException(format("Prefetch must be at least 1, but was %d", prefetch));

		ensureUsable();

		if (this.currentTransaction.get() == null)
			throw new IllegalDatabaseStateException("Cursors can only be opened inside a transaction");

		Duration effectiveTimeout = timeout == null ? getPool().getStatementTimeout().orElse(null) : timeout;

		long compilationStartTime = System.nanoTime();
		CompiledStatement compiledStatement = getPool().getTemplateCompiler().compile(template);

		StatementLog.Builder statementLogBuilder = StatementLog.withCompiledStatement(compiledStatement)
				.compilationDuration(Duration.ofNanos(System.nanoTime() - compilationStartTime));

		long executionStartTime = System.nanoTime();
		WireCursor wireCursor;

		try {
			wireCursor = roundTrip(wireLink ->
					wireLink.openCursor(compiledStatement.getSql(), compiledStatement.getParameters(), prefetch, effectiveTimeout));
			statementLogBuilder.executionDuration(Duration.ofNanos(System.nanoTime() - executionStartTime));
		} catch (RuntimeException e) {
			statementLogBuilder.exception(e);
			throw e;
		} finally {
			logStatement(statementLogBuilder.build());
		}

		Cursor<T> cursor = new Cursor<>(this, wireCursor, resultType, prefetch, effectiveTimeout);
		this.openCursors.add(cursor);

		return cursor;
	}

	/**
	 * Registers a listener for notifications sent on {@code channel}, issuing {@code LISTEN} when it is the channel's
	 * first listener.
	 * <p>
	 * Payloads are parsed into {@code payloadType} by the pool's {@link ResultMapper#mapPayload(String, Class)}.
	 * Several listeners may share a channel.
	 *
	 * @param channel     the channel to listen on
	 * @param payloadType the type payloads are parsed into
	 * @param listener    the listener to invoke for each notification
	 * @param <T>         payload instance type token
	 * @throws IllegalArgumentException      if {@code listener} is already registered on {@code channel}
	 * @throws UnsupportedOperationException if the driver cannot deliver notifications
	 */
	public <T> void addListener(@NonNull String channel,
															@NonNull Class<T> payloadType,
															@NonNull NotificationListener<T> listener) {
		requireNonNull(channel);
		requireNonNull(payloadType);
		requireNonNull(listener);

		ensureUsable();
		ensureNotificationsSupported();

		getListenerLock().lock();

		try {
			List<ListenerRegistration<?>> listenerRegistrations = this.listenerRegistrationsByChannel.get(channel);

			if (listenerRegistrations != null && findListenerRegistration(listenerRegistrations, listener) != null)
				throw new IllegalArgumentException(format("Listener %s is already registered on channel '%s'", listener, channel));

			if (listenerRegistrations == null) {
				control(wireLink -> wireLink.listen(channel));
				listenerRegistrations = new ArrayList<>();
				this.listenerRegistrationsByChannel.put(channel, listenerRegistrations);
				getLogger().log(FINE, "Listening on channel ''{0}''", channel);
			}

			listenerRegistrations.add(new ListenerRegistration<>(payloadType, listener));
		} finally {
			getListenerLock().unlock();
		}
	}

	/**
	 * Unregisters a listener, issuing {@code UNLISTEN} when it was the channel's last listener.
	 *
	 * @param channel  the channel the listener was registered on
	 * @param listener the listener to remove
	 * @throws IllegalArgumentException if {@code listener} is not registered on {@code channel}
	 */
	public void removeListener(@NonNull String channel,
														 @NonNull NotificationListener<?> listener) {
		requireNonNull(channel);
		requireNonNull(listener);

		ensureUsable();

		getListenerLock().lock();

		try {
			List<ListenerRegistration<?>> listenerRegistrations = this.listenerRegistrationsByChannel.get(channel);
			ListenerRegistration<?> listenerRegistration = listenerRegistrations == null
					? null
					: findListenerRegistration(listenerRegistrations, listener);

			if (listenerRegistration == null)
				throw new IllegalArgumentException(format("Listener %s is not registered on channel '%s'", listener, channel));

			listenerRegistrations.remove(listenerRegistration);

			if (listenerRegistrations.isEmpty()) {
				this.listenerRegistrationsByChannel.remove(channel);
				control(wireLink -> wireLink.unlisten(channel));
				getLogger().log(FINE, "Stopped listening on channel ''{0}''", channel);
			}
		} finally {
			getListenerLock().unlock();
		}
	}

	/**
	 * Waits up to {@code timeout} for notifications and delivers them to the registered listeners.
	 * <p>
	 * Returns as soon as at least one notification has arrived; notifications already received are delivered
	 * without waiting.
	 *
	 * @param timeout how long to wait, {@link Duration#ZERO} to only deliver what has already arrived, or {@code null}
	 *                to wait indefinitely
	 * @return the number of notifications delivered to at least one listener
	 * @throws UnsupportedOperationException if the driver cannot deliver notifications
	 */
	@NonNull
	public Integer awaitNotifications(@Nullable Duration timeout) {
		if (timeout != null && timeout.isNegative())
			throw new IllegalArgumentException("Timeout cannot be negative");

		ensureUsable();
		ensureNotificationsSupported();

		List<Notification> notifications = roundTrip(wireLink -> wireLink.pollNotifications(timeout));
		this.pendingNotifications.addAll(notifications);

		return deliverPendingNotifications();
	}

	/**
	 * Performs an operation transactionally.
	 * <p>
	 * The transaction is committed when {@code transactionalOperation} returns normally and rolled back if it throws
	 * or marks the transaction rollback-only. Exactly one of COMMIT or ROLLBACK is sent.
	 *
	 * @param transactionalOperation the operation to perform transactionally
	 */
	public void transaction(@NonNull TransactionalOperation transactionalOperation) {
		requireNonNull(transactionalOperation);

		transaction(transaction -> {
			transactionalOperation.perform(transaction);
			return Optional.empty();
		});
	}

	/**
	 * Performs an operation transactionally and optionally returns a value.
	 * <p>
	 * The transaction is committed when {@code transactionalOperation} returns normally and rolled back if it throws
	 * or marks the transaction rollback-only. Exactly one of COMMIT or ROLLBACK is sent. The triggering exception is
	 * rethrown unchanged, except that checked exceptions are wrapped in a {@link RuntimeException}.
	 *
	 * @param transactionalOperation the operation to perform transactionally
	 * @param <T>                    the type to be returned
	 * @return the result of the transactional operation
	 * @throws IllegalDatabaseStateException if a transaction is already open on this connection
	 */
	@NonNull
	public <T> Optional<T> transaction(@NonNull ReturningTransactionalOperation<T> transactionalOperation) {
		requireNonNull(transactionalOperation);

		ensureUsable();

		Transaction transaction = new Transaction(this);

		if (!this.currentTransaction.compareAndSet(null, transaction))
			throw new IllegalDatabaseStateException("A transaction is already open on this connection; use Transaction#savepoint to nest");

		try {
			control(WireLink::begin);
			getLogger().log(FINE, "Began {0}", transaction);
		} catch (RuntimeException | Error e) {
			this.currentTransaction.set(null);
			throw e;
		}

		try {
			return Transaction.perform(transaction, transactionalOperation);
		} finally {
			this.currentTransaction.set(null);
		}
	}

	/**
	 * The transaction currently open on this connection, if any.
	 *
	 * @return the open transaction
	 */
	@NonNull
	public Optional<Transaction> currentTransaction() {
		return Optional.ofNullable(this.currentTransaction.get());
	}

	/**
	 * Has this lease ended?
	 *
	 * @return {@code true} once {@link #close()} has been called
	 */
	@NonNull
	public Boolean isReleased() {
		return this.released.get();
	}

	/**
	 * Releases this lease back to the pool. Calling this more than once has no effect.
	 *
	 * @throws IllegalDatabaseStateException if a transaction is still open on this connection
	 */
	@Override
	public void close() {
		if (this.currentTransaction.get() != null && !isReleased())
			throw new IllegalDatabaseStateException("Cannot release a connection while a transaction is open on it");

		if (!this.released.compareAndSet(false, true))
			return;

		// Another thread is still waiting on the link, so its state is unknown
		if (getPooledConnection().isRoundTripInFlight())
			getPooledConnection().requestDiscard();
		else
			stopListening();

		this.openCursors.clear();
		getPool().release(getPooledConnection());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{pooledConnection=%s, released=%s}", getClass().getSimpleName(), getPooledConnection(), isReleased());
	}

	/**
	 * Compiles, sends and post-processes one statement, logging it via the pool's {@link StatementLogger}.
	 */
	<R> R send(@NonNull Template template,
						 @Nullable Duration timeout,
						 @NonNull Function<WireResult, R> resultHandler) {
		requireNonNull(template);
		requireNonNull(resultHandler);

		ensureUsable();

		Duration effectiveTimeout = timeout == null ? getPool().getStatementTimeout().orElse(null) : timeout;

		long compilationStartTime = System.nanoTime();
		CompiledStatement compiledStatement = getPool().getTemplateCompiler().compile(template);
		Duration compilationDuration = Duration.ofNanos(System.nanoTime() - compilationStartTime);

		StatementLog.Builder statementLogBuilder = StatementLog.withCompiledStatement(compiledStatement)
				.compilationDuration(compilationDuration);

		long executionStartTime = System.nanoTime();
		R result;

		try {
			WireResult wireResult = roundTrip(wireLink ->
					wireLink.send(compiledStatement.getSql(), compiledStatement.getParameters(), effectiveTimeout));

			statementLogBuilder.executionDuration(Duration.ofNanos(System.nanoTime() - executionStartTime))
					.rowCount(wireResult.hasRows() ? (long) wireResult.getRows().size() : wireResult.getUpdateCount());

			long resultMappingStartTime = System.nanoTime();

			try {
				result = resultHandler.apply(wireResult);
				statementLogBuilder.resultMappingDuration(Duration.ofNanos(System.nanoTime() - resultMappingStartTime));
			} catch (RuntimeException e) {
				statementLogBuilder.resultMappingDuration(Duration.ofNanos(System.nanoTime() - resultMappingStartTime));
				throw e;
			}
		} catch (RuntimeException e) {
			statementLogBuilder.exception(e);
			throw e;
		} finally {
			logStatement(statementLogBuilder.build());
		}

		collectNotifications();

		return result;
	}

	/**
	 * Runs one exchange on the link under the one-at-a-time guard.
	 */
	<R> R roundTrip(@NonNull Function<WireLink, R> exchange) {
		requireNonNull(exchange);

		ensureUsable();

		if (!getPooledConnection().tryBeginRoundTrip())
			throw new ConnectionBusyException("Another statement is already in flight on this connection");

		// close() may have ended the lease between the usability check and claiming the link
		if (isReleased()) {
			getPooledConnection().endRoundTrip();
			throw new IllegalDatabaseStateException("This connection has been released back to the pool");
		}

		try {
			return exchange.apply(getPooledConnection().getWireLink());
		} catch (DatabaseTimeoutException e) {
			getPooledConnection().requestDiscard();
			throw e;
		} catch (RuntimeException | Error e) {
			if (Thread.currentThread().isInterrupted() || hasInterruptedCause(e))
				getPooledConnection().requestDiscard();

			throw e;
		} finally {
			getPooledConnection().endRoundTrip();
		}
	}

	void control(@NonNull WireLinkOperation wireLinkOperation) {
		requireNonNull(wireLinkOperation);

		roundTrip(wireLink -> {
			wireLinkOperation.perform(wireLink);
			return null;
		});
	}

	void ensureUsable() {
		if (isReleased())
			throw new IllegalDatabaseStateException("This connection has been released back to the pool");

		if (getPooledConnection().getState() == ConnectionState.CLOSED)
			throw new PoolClosedException("This connection was closed because its pool shut down");
	}

	void closeCursors() {
		for (Cursor<?> cursor : new ArrayList<>(this.openCursors))
			cursor.close();
	}

	void forgetCursor(@NonNull Cursor<?> cursor) {
		requireNonNull(cursor);
		this.openCursors.remove(cursor);
	}

	/**
	 * Picks up notifications that arrived during the last statement, if anyone is listening.
	 */
	protected void collectNotifications() {
		if (!isListening())
			return;

		List<Notification> notifications = roundTrip(wireLink -> wireLink.pollNotifications(Duration.ZERO));
		this.pendingNotifications.addAll(notifications);

		deliverPendingNotifications();
	}

	/**
	 * Delivers queued notifications in arrival order. Statements run by listeners queue further notifications for
	 * the outermost delivery loop rather than recursing.
	 */
	@NonNull
	protected Integer deliverPendingNotifications() {
		if (!this.dispatchingNotifications.compareAndSet(false, true))
			return 0;

		int deliveredCount = 0;

		try {
			Notification notification;

			while ((notification = this.pendingNotifications.poll()) != null)
				if (deliverNotification(notification))
					++deliveredCount;
		} finally {
			this.dispatchingNotifications.set(false);
		}

		return deliveredCount;
	}

	@NonNull
	protected Boolean deliverNotification(@NonNull Notification notification) {
		requireNonNull(notification);

		List<ListenerRegistration<?>> listenerRegistrations;

		getListenerLock().lock();

		try {
			listenerRegistrations = new ArrayList<>(this.listenerRegistrationsByChannel.getOrDefault(notification.getChannel(), List.of()));
		} finally {
			getListenerLock().unlock();
		}

		if (listenerRegistrations.isEmpty()) {
			getLogger().log(FINE, "No listener for {0}", notification);
			return false;
		}

		for (ListenerRegistration<?> listenerRegistration : listenerRegistrations) {
			try {
				listenerRegistration.deliver(this, notification);
			} catch (RuntimeException e) {
				getLogger().log(WARNING, format("Listener %s failed to handle %s", listenerRegistration.getListener(), notification), e);
			}
		}

		return true;
	}

	@NonNull
	protected Boolean isListening() {
		getListenerLock().lock();

		try {
			return !this.listenerRegistrationsByChannel.isEmpty();
		} finally {
			getListenerLock().unlock();
		}
	}

	/**
	 * Unregisters every listener so the next lessee starts with a link that listens on nothing. A link that cannot be
	 * reset is discarded.
	 */
	protected void stopListening() {
		boolean listening;

		getListenerLock().lock();

		try {
			listening = !this.listenerRegistrationsByChannel.isEmpty();
			this.listenerRegistrationsByChannel.clear();
		} finally {
			getListenerLock().unlock();
		}

		this.pendingNotifications.clear();

		if (!listening || getPooledConnection().getState() == ConnectionState.CLOSED)
			return;

		if (!getPooledConnection().tryBeginRoundTrip()) {
			getPooledConnection().requestDiscard();
			return;
		}

		try {
			WireLink wireLink = getPooledConnection().getWireLink();
			wireLink.unlistenAll();
			// Drop anything that arrived before UNLISTEN took effect
			wireLink.pollNotifications(Duration.ZERO);
		} catch (RuntimeException e) {
			getLogger().log(WARNING, format("Unable to stop listening on %s, so it will be discarded", getPooledConnection()), e);
			getPooledConnection().requestDiscard();
		} finally {
			getPooledConnection().endRoundTrip();
		}
	}

	protected void ensureNotificationsSupported() {
		if (!getPooledConnection().getWireLink().supportsNotifications())
			throw new UnsupportedOperationException(format("%s does not support notifications", getPool().getWireDriver()));
	}

	@Nullable
	private static ListenerRegistration<?> findListenerRegistration(@NonNull List<ListenerRegistration<?>> listenerRegistrations,
																																	@NonNull NotificationListener<?> listener) {
		requireNonNull(listenerRegistrations);
		requireNonNull(listener);

		for (ListenerRegistration<?> listenerRegistration : listenerRegistrations)
			if (listenerRegistration.getListener() == listener)
				return listenerRegistration;

		return null;
	}

	protected void logStatement(@NonNull StatementLog statementLog) {
		requireNonNull(statementLog);

		try {
			getPool().getStatementLogger().log(statementLog);
		} catch (RuntimeException e) {
			getLogger().log(WARNING, "Statement logger failed", e);
		}
	}

	@NonNull
	static Boolean hasInterruptedCause(@NonNull Throwable throwable) {
		for (Throwable current = throwable; current != null; current = current.getCause())
			if (current instanceof InterruptedException)
				return true;

		return false;
	}

	@NonNull
	Pool getPool() {
		return this.pool;
	}

	@NonNull
	PooledConnection getPooledConnection() {
		return this.pooledConnection;
	}

	@NonNull
	private ReentrantLock getListenerLock() {
		return this.listenerLock;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}

	@FunctionalInterface
	interface WireLinkOperation {
		void perform(@NonNull WireLink wireLink);
	}

	@ThreadSafe
	private static final class ListenerRegistration<T> {
		@NonNull
		private final Class<T> payloadType;
		@NonNull
		private final NotificationListener<T> listener;

		ListenerRegistration(@NonNull Class<T> payloadType,
												 @NonNull NotificationListener<T> listener) {
			requireNonNull(payloadType);
			requireNonNull(listener);

			this.payloadType = payloadType;
			this.listener = listener;
		}

		void deliver(@NonNull Connection connection,
								 @NonNull Notification notification) {
			requireNonNull(connection);
			requireNonNull(notification);

			T payload = connection.getPool().getResultMapper().mapPayload(notification.getPayload(), this.payloadType);
			this.listener.onNotification(connection, notification.getProcessId(), notification.getChannel(), payload);
		}

		@NonNull
		NotificationListener<T> getListener() {
			return this.listener;
		}
	}
}
