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

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;
import static java.util.logging.Level.WARNING;

/**
 * Represents a database transaction on a leased {@link Connection}.
 * <p>
 * Transactions are created by {@link Connection#transaction(TransactionalOperation)} and
 * {@link Pool#transaction(TransactionalOperation)}, which send BEGIN and, when the operation completes, exactly one of
 * COMMIT or ROLLBACK. The operation may end the transaction early with {@link #commit()} or {@link #rollback()};
 * afterwards every further use of the transaction fails with {@link IllegalDatabaseStateException}.
 * <p>
 * {@link #savepoint(TransactionalOperation)} opens a nested scope backed by a savepoint, if the {@link WireDriver}
 * supports them. A nested scope is itself a {@code Transaction} whose commit releases the savepoint and whose rollback
 * rolls back to it.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class Transaction {
	@NonNull
	private static final AtomicLong ID_GENERATOR;
	@NonNull
	private static final String SAVEPOINT_NAME_PREFIX = "fassung_savepoint_";

	static {
		ID_GENERATOR = new AtomicLong(0);
	}

	@NonNull
	private final Long id;
	@NonNull
	private final Connection connection;
	@Nullable
	private final Transaction parent;
	@Nullable
	private final String savepointName;
	@NonNull
	private final AtomicReference<TransactionStatus> status;
	@NonNull
	private final AtomicBoolean rollbackOnly;
	@NonNull
	private final AtomicReference<Transaction> openSavepoint;
	@NonNull
	private final AtomicLong savepointCounter;
	@NonNull
	private final List<@NonNull Consumer<TransactionResult>> postTransactionOperations;
	@NonNull
	private final Logger logger;

	Transaction(@NonNull Connection connection) {
		this(connection, null, null);
	}

	private Transaction(@NonNull Connection connection,
											@Nullable Transaction parent,
											@Nullable String savepointName) {
		requireNonNull(connection);

		this.id = ID_GENERATOR.incrementAndGet();
		this.connection = connection;
		this.parent = parent;
		this.savepointName = savepointName;
		this.status = new AtomicReference<>(TransactionStatus.OPEN);
		this.rollbackOnly = new AtomicBoolean(false);
		this.openSavepoint = new AtomicReference<>();
		this.savepointCounter = new AtomicLong(0);
		this.postTransactionOperations = new CopyOnWriteArrayList<>();
		this.logger = Logger.getLogger(Transaction.class.getName());
	}

	/**
	 * Runs {@code transactionalOperation} in {@code transaction} and sends its terminal command.
	 * <p>
	 * For a top-level transaction, post-transaction operations run once the terminal command has been sent.
	 */
	@NonNull
	static <T> Optional<T> perform(@NonNull Transaction transaction,
																 @NonNull ReturningTransactionalOperation<T> transactionalOperation) {
		requireNonNull(transaction);
		requireNonNull(transactionalOperation);

		Throwable thrown = null;

		try {
			Optional<T> returnValue = transactionalOperation.perform(transaction);

			// Safeguard in case user code accidentally returns null instead of Optional.empty()
			if (returnValue == null)
				returnValue = Optional.empty();

			if (transaction.getStatus() == TransactionStatus.OPEN) {
				if (transaction.isRollbackOnly())
					transaction.rollback();
				else
					transaction.commit();
			}

			return returnValue;
		} catch (RuntimeException e) {
			thrown = e;
			rollbackAfterFailure(transaction, e);
			restoreInterruptIfNeeded(e);
			throw e;
		} catch (Error e) {
			thrown = e;
			rollbackAfterFailure(transaction, e);
			restoreInterruptIfNeeded(e);
			throw e;
		} catch (Throwable t) {
			RuntimeException wrapped = new RuntimeException(t);
			thrown = wrapped;
			rollbackAfterFailure(transaction, wrapped);
			restoreInterruptIfNeeded(t);
			throw wrapped;
		} finally {
			if (!transaction.isSavepoint())
				runPostTransactionOperations(transaction, thrown);
		}
	}

	private static void rollbackAfterFailure(@NonNull Transaction transaction,
																					 @NonNull Throwable failure) {
		requireNonNull(transaction);
		requireNonNull(failure);

		if (transaction.getStatus() != TransactionStatus.OPEN)
			return;

		try {
			transaction.rollback();
		} catch (RuntimeException | Error rollbackException) {
			transaction.getLogger().log(WARNING, format("Unable to roll back %s", transaction), rollbackException);
			failure.addSuppressed(rollbackException);
		}
	}

	private static void runPostTransactionOperations(@NonNull Transaction transaction,
																									 @Nullable Throwable thrown) {
		requireNonNull(transaction);

		TransactionResult transactionResult = transaction.getStatus() == TransactionStatus.COMMITTED
				? TransactionResult.COMMITTED
				: TransactionResult.ROLLED_BACK;

		Throwable cleanupFailure = null;

		for (Consumer<TransactionResult> postTransactionOperation : transaction.getPostTransactionOperations()) {
			try {
				postTransactionOperation.accept(transactionResult);
			} catch (Throwable cleanupException) {
				if (cleanupFailure == null)
					cleanupFailure = cleanupException;
				else
					cleanupFailure.addSuppressed(cleanupException);
			}
		}

		if (cleanupFailure == null)
			return;

		if (thrown != null)
			thrown.addSuppressed(cleanupFailure);
		else if (cleanupFailure instanceof RuntimeException)
			throw (RuntimeException) cleanupFailure;
		else if (cleanupFailure instanceof Error)
			throw (Error) cleanupFailure;
		else
			throw new RuntimeException(cleanupFailure);
	}

	private static void restoreInterruptIfNeeded(@NonNull Throwable throwable) {
		requireNonNull(throwable);

		if (Connection.hasInterruptedCause(throwable))
			Thread.currentThread().interrupt();
	}

	@NonNull
	public Long execute(@NonNull Template template) {
		return execute(template, null);
	}

	@NonNull
	public Long execute(@NonNull Template template,
											@Nullable Duration timeout) {
		ensureOpen();
		return getConnection().execute(template, timeout);
	}

	@NonNull
	public <T> List<@Nullable T> fetch(@NonNull Template template,
																		 @NonNull Class<T> resultType) {
		return fetch(template, resultType, null);
	}

	@NonNull
	public <T> List<@Nullable T> fetch(@NonNull Template template,
																		 @NonNull Class<T> resultType,
																		 @Nullable Duration timeout) {
		ensureOpen();
		return getConnection().fetch(template, resultType, timeout);
	}

	@NonNull
	public <T> Optional<T> fetchRow(@NonNull Template template,
																	@NonNull Class<T> resultType) {
		return fetchRow(template, resultType, null);
	}

	@NonNull
	public <T> Optional<T> fetchRow(@NonNull Template template,
																	@NonNull Class<T> resultType,
																	@Nullable Duration timeout) {
		ensureOpen();
		return getConnection().fetchRow(template, resultType, timeout);
	}

	@Nullable
	public <T> T fetchValue(@NonNull Template template,
													@NonNull Class<T> resultType) {
		return fetchValue(template, resultType, null);
	}

	@Nullable
	public <T> T fetchValue(@NonNull Template template,
													@NonNull Class<T> resultType,
													@Nullable Duration timeout) {
		ensureOpen();
		return getConnection().fetchValue(template, resultType, timeout);
	}

	/**
	 * Opens a cursor over a query's rows, prefetching {@link Cursor#DEFAULT_PREFETCH} rows at a time.
	 * <p>
	 * The cursor is closed when the outermost transaction ends, if it was not closed before.
	 *
	 * @param template   the query
	 * @param resultType the type each row is mapped to
	 * @param <T>        result instance type token
	 * @return the open cursor
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
	 * @return the open cursor
	 */
	@NonNull
	public <T> Cursor<T> cursor(@NonNull Template template,
															@NonNull Class<T> resultType,
															@NonNull Integer prefetch,
															@Nullable Duration timeout) {
		ensureOpen();
		return getConnection().cursor(template, resultType, prefetch, timeout);
	}

	/**
	 * Commits now instead of when the transactional operation completes.
	 * <p>
	 * For a savepoint scope, releases the savepoint.
	 *
	 * @throws IllegalDatabaseStateException if this transaction has already ended
	 */
	public void commit() {
		finish(TransactionStatus.COMMITTED);
	}

	/**
	 * Rolls back now instead of when the transactional operation completes.
	 * <p>
	 * For a savepoint scope, rolls back to the savepoint.
	 *
	 * @throws IllegalDatabaseStateException if this transaction has already ended
	 */
	public void rollback() {
		finish(TransactionStatus.ROLLED_BACK);
	}

	private void finish(@NonNull TransactionStatus terminalStatus) {
		requireNonNull(terminalStatus);

		if (this.openSavepoint.get() != null)
			throw new IllegalDatabaseStateException(format("Cannot end %s while savepoint %s is open", this, this.openSavepoint.get()));

		TransactionStatus currentStatus = this.status.get();

		if (currentStatus != TransactionStatus.OPEN || !this.status.compareAndSet(TransactionStatus.OPEN, terminalStatus))
			throw new IllegalDatabaseStateException(format("%s has already ended", this));

		boolean commit = terminalStatus == TransactionStatus.COMMITTED;

		try {
			if (!isSavepoint())
				getConnection().closeCursors();

			if (isSavepoint()) {
				String savepointName = getSavepointName().get();
				getConnection().control(wireLink -> {
					if (commit)
						wireLink.releaseSavepoint(savepointName);
					else
						wireLink.rollbackToSavepoint(savepointName);
				});
			} else {
				getConnection().control(commit ? WireLink::commit : WireLink::rollback);
			}

			getLogger().log(FINE, "{0} {1}", new Object[]{commit ? "Committed" : "Rolled back", this});
		} catch (RuntimeException | Error e) {
			// A failed COMMIT leaves nothing committed
			if (commit)
				this.status.set(TransactionStatus.ROLLED_BACK);

			if (!isSavepoint())
				getConnection().getPooledConnection().requestDiscard();

			throw e;
		}
	}

	/**
	 * Performs an operation in a nested scope backed by a savepoint.
	 * <p>
	 * The savepoint is released when {@code transactionalOperation} returns normally and rolled back to if it throws
	 * or marks the nested transaction rollback-only. Either way the enclosing transaction stays open.
	 *
	 * @param transactionalOperation the operation to perform
	 * @throws UnsupportedOperationException if the {@link WireDriver} does not support savepoints
	 */
	public void savepoint(@NonNull TransactionalOperation transactionalOperation) {
		requireNonNull(transactionalOperation);

		savepoint(transaction -> {
			transactionalOperation.perform(transaction);
			return Optional.empty();
		});
	}

	/**
	 * Performs an operation in a nested scope backed by a savepoint, optionally returning a value.
	 *
	 * @param transactionalOperation the operation to perform
	 * @param <T>                    the type to be returned
	 * @return the result of the operation
	 * @throws UnsupportedOperationException if the {@link WireDriver} does not support savepoints
	 * @see #savepoint(TransactionalOperation)
	 */
	@NonNull
	public <T> Optional<T> savepoint(@NonNull ReturningTransactionalOperation<T> transactionalOperation) {
		requireNonNull(transactionalOperation);

		ensureOpen();

		if (!getConnection().getPool().getWireDriver().supportsSavepoints())
			throw new UnsupportedOperationException("The wire driver does not support savepoints");

		String savepointName = SAVEPOINT_NAME_PREFIX + getRoot().savepointCounter.incrementAndGet();
		Transaction savepoint = new Transaction(getConnection(), this, savepointName);

		if (!this.openSavepoint.compareAndSet(null, savepoint))
			throw new IllegalDatabaseStateException(format("%s already has an open savepoint", this));

		try {
			getConnection().control(wireLink -> wireLink.createSavepoint(savepointName));
			return perform(savepoint, transactionalOperation);
		} finally {
			this.openSavepoint.set(null);
		}
	}

	/**
	 * Should this transaction be rolled back upon completion?
	 * <p>
	 * Default value is {@code false}.
	 *
	 * @return {@code true} if this transaction should be rolled back, {@code false} otherwise
	 */
	@NonNull
	public Boolean isRollbackOnly() {
		return this.rollbackOnly.get();
	}

	/**
	 * Sets whether this transaction should be rolled back upon completion.
	 *
	 * @param rollbackOnly whether to set this transaction to be rollback-only
	 */
	public void setRollbackOnly(@NonNull Boolean rollbackOnly) {
		requireNonNull(rollbackOnly);
		this.rollbackOnly.set(rollbackOnly);
	}

	/**
	 * Adds an operation to run when the top-level transaction ends.
	 * <p>
	 * Operations added to a savepoint scope belong to the enclosing top-level transaction.
	 *
	 * @param postTransactionOperation the post-transaction operation to add
	 */
	public void addPostTransactionOperation(@NonNull Consumer<TransactionResult> postTransactionOperation) {
		requireNonNull(postTransactionOperation);
		getRoot().postTransactionOperations.add(postTransactionOperation);
	}

	/**
	 * Removes an operation from the list of operations to be executed when the transaction completes.
	 *
	 * @param postTransactionOperation the post-transaction operation to remove
	 * @return {@code true} if the post-transaction operation was removed, {@code false} otherwise
	 */
	@NonNull
	public Boolean removePostTransactionOperation(@NonNull Consumer<TransactionResult> postTransactionOperation) {
		requireNonNull(postTransactionOperation);
		return getRoot().postTransactionOperations.remove(postTransactionOperation);
	}

	/**
	 * Gets an unmodifiable list of post-transaction operations.
	 *
	 * @return the list of post-transaction operations
	 */
	@NonNull
	public List<@NonNull Consumer<TransactionResult>> getPostTransactionOperations() {
		return Collections.unmodifiableList(getRoot().postTransactionOperations);
	}

	@NonNull
	public Long getId() {
		return this.id;
	}

	@NonNull
	public TransactionStatus getStatus() {
		return this.status.get();
	}

	/**
	 * Is this a nested scope created by {@link #savepoint(TransactionalOperation)}?
	 *
	 * @return {@code true} for savepoint scopes
	 */
	@NonNull
	public Boolean isSavepoint() {
		return this.parent != null;
	}

	@NonNull
	public Optional<String> getSavepointName() {
		return Optional.ofNullable(this.savepointName);
	}

	@Override
	@NonNull
	public String toString() {
		return isSavepoint()
				? format("%s{id=%s, savepointName=%s, status=%s, isRollbackOnly=%s}", getClass().getSimpleName(), getId(),
				getSavepointName().get(), getStatus(), isRollbackOnly())
				: format("%s{id=%s, status=%s, isRollbackOnly=%s}", getClass().getSimpleName(), getId(), getStatus(), isRollbackOnly());
	}

	private void ensureOpen() {
		if (getStatus() != TransactionStatus.OPEN)
			throw new IllegalDatabaseStateException(format("%s has already ended", this));
	}

	@NonNull
	private Transaction getRoot() {
		Transaction root = this;

		while (root.parent != null)
			root = root.parent;

		return root;
	}

	@NonNull
	private Connection getConnection() {
		return this.connection;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
