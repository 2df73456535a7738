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

import org.postgresql.PGConnection;
import org.postgresql.PGNotification;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import javax.sql.DataSource;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Array;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.sql.Savepoint;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Currency;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;
import static java.util.logging.Level.WARNING;

/**
 * {@link WireDriver} backed by JDBC.
 * <p>
 * Links are opened from a {@link DataSource} or from a JDBC URL via {@link DriverManager}. Statements use
 * {@link PlaceholderStyle#QUESTION_MARK} placeholders; values read back are normalized to the kinds described by
 * {@link WireValueKind} ({@code java.sql.Date} becomes {@code LocalDate}, {@code java.sql.Array} becomes
 * {@code List}, and so on).
 * <p>
 * A failure whose SQLState is in class {@code 08} (connection exception), or which JDBC classifies as a connection
 * failure, marks the link broken so a {@link Pool} discards it. A statement with a timeout that fails with
 * {@link SQLTimeoutException} or SQLState {@code 57014} (query canceled, which is how PostgreSQL reports
 * {@code statement_timeout}) fails with {@link DatabaseTimeoutException}.
 * <p>
 * Cursors read through {@link PreparedStatement#setFetchSize(int)}, which drivers such as PostgreSQL's honor inside a
 * transaction. Notifications are available when the PostgreSQL driver is on the classpath and the link is a
 * PostgreSQL connection.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public class JdbcWireDriver implements WireDriver {
	@NonNull
	private static final String QUERY_CANCELED_SQL_STATE;
	@NonNull
	private static final Boolean POSTGRES_DRIVER_AVAILABLE;

	static {
		QUERY_CANCELED_SQL_STATE = "57014";

		boolean postgresDriverAvailable;

		try {
			Class.forName("org.postgresql.PGConnection", false, JdbcWireDriver.class.getClassLoader());
			postgresDriverAvailable = true;
		} catch (ClassNotFoundException e) {
			postgresDriverAvailable = false;
		}

		POSTGRES_DRIVER_AVAILABLE = postgresDriverAvailable;
	}

	@Nullable
	private final DataSource dataSource;
	@Nullable
	private final String url;
	@NonNull
	private final Properties properties;
	@NonNull
	private final Logger logger;

	/**
	 * Creates a driver which opens links from the given {@link DataSource}.
	 *
	 * @param dataSource the source of JDBC connections
	 */
	public JdbcWireDriver(@NonNull DataSource dataSource) {
		requireNonNull(dataSource);

		this.dataSource = dataSource;
		this.url = null;
		this.properties = new Properties();
		this.logger = Logger.getLogger(getClass().getName());
	}

	/**
	 * Creates a driver which opens links via {@link DriverManager#getConnection(String, Properties)}.
	 *
	 * @param url        the JDBC URL
	 * @param properties connection properties such as {@code user} and {@code password}
	 */
	public JdbcWireDriver(@NonNull String url,
												@NonNull Properties properties) {
		requireNonNull(url);
		requireNonNull(properties);

		this.dataSource = null;
		this.url = url;
		this.properties = new Properties();
		this.properties.putAll(properties);
		this.logger = Logger.getLogger(getClass().getName());
	}

	/**
	 * Creates a driver for parsed connection settings.
	 *
	 * @param connectionSettings the settings to connect with
	 * @return a driver for {@link ConnectionSettings#toJdbcUrl()}
	 */
	@NonNull
	public static JdbcWireDriver fromConnectionSettings(@NonNull ConnectionSettings connectionSettings) {
		requireNonNull(connectionSettings);
		return new JdbcWireDriver(connectionSettings.toJdbcUrl(), connectionSettings.toJdbcProperties());
	}

	@NonNull
	@Override
	public WireLink open() {
		Connection connection;

		try {
			connection = getDataSource().isPresent()
					? getDataSource().get().getConnection()
					: DriverManager.getConnection(this.url, this.properties);
		} catch (SQLException e) {
			throw new WireException("Unable to open JDBC connection", e);
		}

		if (connection == null)
			throw new WireException("JDBC source returned no connection");

		getLogger().log(FINE, "Opened JDBC connection {0}", connection);

		return new JdbcWireLink(this, connection);
	}

	@NonNull
	@Override
	public PlaceholderStyle getPlaceholderStyle() {
		return PlaceholderStyle.QUESTION_MARK;
	}

	@NonNull
	@Override
	public Boolean supportsSavepoints() {
		return true;
	}

	/**
	 * Binds one parameter, converting values JDBC has no standard mapping for.
	 *
	 * @param preparedStatement the statement to bind to
	 * @param parameterIndex    the 1-based parameter index
	 * @param parameter         the value to bind
	 * @throws SQLException if the driver rejects the value
	 */
	protected void bindParameter(@NonNull PreparedStatement preparedStatement,
															 @NonNull Integer parameterIndex,
															 @Nullable Object parameter) throws SQLException {
		requireNonNull(preparedStatement);
		requireNonNull(parameterIndex);

		if (parameter == null) {
			preparedStatement.setNull(parameterIndex, Types.NULL);
			return;
		}

		if (parameter instanceof ArrayParameter arrayParameter) {
			List<Object> elements = arrayParameter.getElements().orElse(null);

			if (elements == null) {
				preparedStatement.setNull(parameterIndex, Types.ARRAY);
			} else {
				Object[] normalizedElements = new Object[elements.size()];

				for (int i = 0; i < elements.size(); ++i)
					normalizedElements[i] = elements.get(i) == null ? null : normalizeParameter(elements.get(i));

				Array array = preparedStatement.getConnection().createArrayOf(arrayParameter.getBaseTypeName(), normalizedElements);
				preparedStatement.setArray(parameterIndex, array);
			}

			return;
		}

		Object normalizedParameter = normalizeParameter(parameter);

		if (normalizedParameter instanceof OffsetDateTime offsetDateTime) {
			if (!trySetObject(preparedStatement, parameterIndex, offsetDateTime, Types.TIMESTAMP_WITH_TIMEZONE))
				preparedStatement.setTimestamp(parameterIndex, java.sql.Timestamp.from(offsetDateTime.toInstant()));

			return;
		}

		if (normalizedParameter instanceof OffsetTime offsetTime) {
			if (!trySetObject(preparedStatement, parameterIndex, offsetTime, Types.TIME_WITH_TIMEZONE))
				preparedStatement.setString(parameterIndex, offsetTime.toString());

			return;
		}

		preparedStatement.setObject(parameterIndex, normalizedParameter);
	}

	/**
	 * Massages a parameter into a JDBC-friendly format if needed.
	 *
	 * @param parameter the parameter to (possibly) massage
	 * @return the result of the massaging process
	 */
	@NonNull
	protected Object normalizeParameter(@NonNull Object parameter) {
		requireNonNull(parameter);

		if (parameter instanceof java.sql.Timestamp || parameter instanceof java.sql.Date || parameter instanceof java.sql.Time)
			return parameter;
		if (parameter instanceof Date date)
			return new java.sql.Timestamp(date.getTime());
		if (parameter instanceof Instant instant)
			return instant.atOffset(ZoneOffset.UTC);
		if (parameter instanceof ZonedDateTime zonedDateTime)
			return zonedDateTime.toOffsetDateTime();
		if (parameter instanceof BigInteger bigInteger)
			return new BigDecimal(bigInteger);
		if (parameter instanceof Character character)
			return character.toString();
		if (parameter instanceof Locale locale)
			return locale.toLanguageTag();
		if (parameter instanceof Currency currency)
			return currency.getCurrencyCode();
		if (parameter instanceof Enum<?> enumValue)
			return enumValue.name();
		if (parameter instanceof ZoneId zoneId)
			return zoneId.getId();

		return parameter;
	}

	protected boolean trySetObject(@NonNull PreparedStatement preparedStatement,
																 @NonNull Integer parameterIndex,
																 @NonNull Object parameter,
																 @NonNull Integer sqlType) throws SQLException {
		requireNonNull(preparedStatement);
		requireNonNull(parameterIndex);
		requireNonNull(parameter);
		requireNonNull(sqlType);

		try {
			preparedStatement.setObject(parameterIndex, parameter, sqlType);
			return true;
		} catch (SQLFeatureNotSupportedException | AbstractMethodError e) {
			return false;
		}
	}

	/**
	 * Reads the current row of a result set.
	 *
	 * @param resultSet         the result set, positioned on a row
	 * @param resultSetMetaData metadata for {@code resultSet}
	 * @return the column values, normalized
	 * @throws SQLException if the driver fails to read a value
	 */
	@NonNull
	protected List<Object> readRowValues(@NonNull ResultSet resultSet,
																			 @NonNull ResultSetMetaData resultSetMetaData) throws SQLException {
		requireNonNull(resultSet);
		requireNonNull(resultSetMetaData);

		int columnCount = resultSetMetaData.getColumnCount();
		List<Object> values = new ArrayList<>(columnCount);

		for (int i = 1; i <= columnCount; ++i) {
			int columnType = resultSetMetaData.getColumnType(i);
			Object value;

			if (columnType == Types.TIMESTAMP_WITH_TIMEZONE)
				value = resultSet.getObject(i, OffsetDateTime.class);
			else if (columnType == Types.TIME_WITH_TIMEZONE)
				value = resultSet.getObject(i, OffsetTime.class);
			else
				value = resultSet.getObject(i);

			values.add(value == null ? null : normalizeValue(value));
		}

		return values;
	}

	/**
	 * Converts a value read from JDBC to one of the {@link WireValueKind}s.
	 *
	 * @param value the raw JDBC value
	 * @return the normalized value
	 * @throws SQLException if reading a LOB or array fails
	 */
	@NonNull
	protected Object normalizeValue(@NonNull Object value) throws SQLException {
		requireNonNull(value);

		if (value instanceof java.sql.Timestamp timestamp)
			return timestamp.toLocalDateTime();
		if (value instanceof java.sql.Date date)
			return date.toLocalDate();
		if (value instanceof java.sql.Time time)
			return time.toLocalTime();
		if (value instanceof Date date)
			return date.toInstant();

		if (value instanceof Clob clob) {
			try {
				return clob.getSubString(1, Math.toIntExact(clob.length()));
			} finally {
				clob.free();
			}
		}

		if (value instanceof Blob blob) {
			try {
				return blob.getBytes(1, Math.toIntExact(blob.length()));
			} finally {
				blob.free();
			}
		}

		if (value instanceof Array array) {
			try {
				Object[] elements = (Object[]) array.getArray();
				List<Object> normalizedElements = new ArrayList<>(elements.length);

				for (Object element : elements)
					normalizedElements.add(element == null ? null : normalizeValue(element));

				return normalizedElements;
			} finally {
				array.free();
			}
		}

		return value;
	}

	/**
	 * Does this failure mean the JDBC connection can no longer be trusted?
	 *
	 * @param e the failure
	 * @return {@code true} if the link should be discarded
	 */
	@NonNull
	protected Boolean isConnectionFailure(@NonNull SQLException e) {
		requireNonNull(e);

		for (Throwable current = e; current != null; current = current.getCause()) {
			if (current instanceof SQLNonTransientConnectionException
					|| current instanceof SQLTransientConnectionException
					|| current instanceof SQLRecoverableException)
				return true;

			if (current instanceof SQLException sqlException
					&& sqlException.getSQLState() != null
					&& sqlException.getSQLState().startsWith("08"))
				return true;
		}

		return false;
	}

	/**
	 * Did the database cancel this statement? PostgreSQL reports an expired {@code statement_timeout} this way rather
	 * than with a {@link SQLTimeoutException}.
	 *
	 * @param e the failure
	 * @return {@code true} if the failure carries SQLState {@code 57014}
	 */
	@NonNull
	protected Boolean isQueryCanceled(@NonNull SQLException e) {
		requireNonNull(e);

		for (Throwable current = e; current != null; current = current.getCause())
			if (current instanceof SQLException sqlException && QUERY_CANCELED_SQL_STATE.equals(sqlException.getSQLState()))
				return true;

		return false;
	}

	@NonNull
	protected Optional<DataSource> getDataSource() {
		return Optional.ofNullable(this.dataSource);
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}

	/**
	 * A {@link WireLink} over a single JDBC {@link Connection}.
	 */
	@NotThreadSafe
	protected static class JdbcWireLink implements WireLink {
		@NonNull
		private final JdbcWireDriver jdbcWireDriver;
		@NonNull
		private final Connection connection;
		@NonNull
		private final Map<String, Savepoint> savepointsByName;
		private boolean broken;
		private boolean closed;

		protected JdbcWireLink(@NonNull JdbcWireDriver jdbcWireDriver,
													 @NonNull Connection connection) {
			requireNonNull(jdbcWireDriver);
			requireNonNull(connection);

			this.jdbcWireDriver = jdbcWireDriver;
			this.connection = connection;
			this.savepointsByName = new HashMap<>();
		}

		@NonNull
		@Override
		public WireResult send(@NonNull String sql,
													 @NonNull List<Object> parameters,
													 @Nullable Duration timeout) {
			requireNonNull(sql);
			requireNonNull(parameters);

			ensureOpen();

			try (PreparedStatement preparedStatement = this.connection.prepareStatement(sql)) {
				if (timeout != null)
					preparedStatement.setQueryTimeout(toQueryTimeoutSeconds(timeout));

				for (int i = 0; i < parameters.size(); ++i)
					this.jdbcWireDriver.bindParameter(preparedStatement, i + 1, parameters.get(i));

				if (!preparedStatement.execute())
					return WireResult.ofUpdateCount((long) Math.max(preparedStatement.getUpdateCount(), 0));

				try (ResultSet resultSet = preparedStatement.getResultSet()) {
					ResultSetMetaData resultSetMetaData = resultSet.getMetaData();
					List<String> columnNames = new ArrayList<>(resultSetMetaData.getColumnCount());

					for (int i = 1; i <= resultSetMetaData.getColumnCount(); ++i)
						columnNames.add(resultSetMetaData.getColumnLabel(i));

					List<Row> rows = new ArrayList<>();

					while (resultSet.next())
						rows.add(Row.of(columnNames, this.jdbcWireDriver.readRowValues(resultSet, resultSetMetaData)));

					return WireResult.ofRows(columnNames, rows);
				}
			} catch (SQLException e) {
				throw statementFailure("Unable to execute statement", e, timeout);
			}
		}

		@NonNull
		@Override
		public WireCursor openCursor(@NonNull String sql,
																 @NonNull List<Object> parameters,
																 @NonNull Integer prefetch,
																 @Nullable Duration timeout) {
			requireNonNull(sql);
			requireNonNull(parameters);
			requireNonNull(prefetch);

			ensureOpen();

			PreparedStatement preparedStatement = null;

			try {
				preparedStatement = this.connection.prepareStatement(sql, ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY);
				preparedStatement.setFetchSize(prefetch);

				if (timeout != null)
					preparedStatement.setQueryTimeout(toQueryTimeoutSeconds(timeout));

				for (int i = 0; i < parameters.size(); ++i)
					this.jdbcWireDriver.bindParameter(preparedStatement, i + 1, parameters.get(i));

				return new JdbcWireCursor(this, preparedStatement, preparedStatement.executeQuery());
			} catch (SQLException e) {
				if (preparedStatement != null) {
					try {
						preparedStatement.close();
					} catch (SQLException closeException) {
						e.addSuppressed(closeException);
					}
				}

				throw statementFailure("Unable to open cursor", e, timeout);
			}
		}

		@NonNull
		@Override
		public Boolean supportsNotifications() {
			if (!POSTGRES_DRIVER_AVAILABLE || this.closed)
				return false;

			try {
				return PostgresNotifications.isPostgresConnection(this.connection);
			} catch (SQLException e) {
				this.jdbcWireDriver.getLogger().log(FINE, "Unable to determine whether JDBC connection supports notifications", e);
				return false;
			}
		}

		@NonNull
		@Override
		public List<Notification> pollNotifications(@Nullable Duration timeout) {
			ensureOpen();

			if (!supportsNotifications())
				throw new UnsupportedOperationException(format("%s does not support notifications", this));

			try {
				return PostgresNotifications.poll(this.connection, timeout);
			} catch (SQLException e) {
				throw wireException("Unable to read notifications", e);
			}
		}

		@Override
		public void begin() {
			ensureOpen();

			try {
				this.connection.setAutoCommit(false);
			} catch (SQLException e) {
				throw wireException("Unable to begin transaction", e);
			}
		}

		@Override
		public void commit() {
			ensureOpen();

			try {
				this.connection.commit();
			} catch (SQLException e) {
				throw wireException("Unable to commit transaction", e);
			} finally {
				endTransaction();
			}
		}

		@Override
		public void rollback() {
			ensureOpen();

			try {
				this.connection.rollback();
			} catch (SQLException e) {
				throw wireException("Unable to roll back transaction", e);
			} finally {
				endTransaction();
			}
		}

		@Override
		public void createSavepoint(@NonNull String savepointName) {
			requireNonNull(savepointName);
			ensureOpen();

			try {
				this.savepointsByName.put(savepointName, this.connection.setSavepoint(savepointName));
			} catch (SQLException e) {
				throw wireException(format("Unable to create savepoint %s", savepointName), e);
			}
		}

		@Override
		public void releaseSavepoint(@NonNull String savepointName) {
			requireNonNull(savepointName);
			ensureOpen();

			try {
				this.connection.releaseSavepoint(removeSavepoint(savepointName));
			} catch (SQLException e) {
				throw wireException(format("Unable to release savepoint %s", savepointName), e);
			}
		}

		@Override
		public void rollbackToSavepoint(@NonNull String savepointName) {
			requireNonNull(savepointName);
			ensureOpen();

			try {
				this.connection.rollback(removeSavepoint(savepointName));
			} catch (SQLException e) {
				throw wireException(format("Unable to roll back to savepoint %s", savepointName), e);
			}
		}

		@NonNull
		@Override
		public Boolean isBroken() {
			if (this.broken || this.closed)
				return true;

			try {
				return this.connection.isClosed();
			} catch (SQLException e) {
				this.jdbcWireDriver.getLogger().log(FINE, "Unable to determine whether JDBC connection is closed, treating as broken", e);
				return true;
			}
		}

		@Override
		public void close() {
			if (this.closed)
				return;

			this.closed = true;

			try {
				this.connection.close();
			} catch (SQLException e) {
				throw new WireException("Unable to close JDBC connection", e);
			}
		}

		@Override
		@NonNull
		public String toString() {
			return format("%s{connection=%s, broken=%s}", getClass().getSimpleName(), this.connection, this.broken);
		}

		protected void ensureOpen() {
			if (this.closed)
				throw new IllegalDatabaseStateException("JDBC link is closed");
		}

		protected void endTransaction() {
			this.savepointsByName.clear();

			try {
				this.connection.setAutoCommit(true);
			} catch (SQLException e) {
				// Auto-commit state is now unknown
				this.broken = true;
				this.jdbcWireDriver.getLogger().log(WARNING, "Unable to restore auto-commit, link will be discarded", e);
			}
		}

		@NonNull
		protected Savepoint removeSavepoint(@NonNull String savepointName) {
			requireNonNull(savepointName);

			Savepoint savepoint = this.savepointsByName.remove(savepointName);

			if (savepoint == null)
				throw new IllegalDatabaseStateException(format("No active savepoint named %s", savepointName));

			return savepoint;
		}

		@NonNull
		protected WireException wireException(@NonNull String message,
																					@NonNull SQLException e) {
			requireNonNull(message);
			requireNonNull(e);

			if (this.jdbcWireDriver.isConnectionFailure(e))
				this.broken = true;

			return new WireException(format("%s: %s", message, e.getMessage()), e);
		}

		@NonNull
		protected RuntimeException statementFailure(@NonNull String message,
																								@NonNull SQLException e,
																								@Nullable Duration timeout) {
			requireNonNull(message);
			requireNonNull(e);

			if (e instanceof SQLTimeoutException || (timeout != null && this.jdbcWireDriver.isQueryCanceled(e)))
				return new DatabaseTimeoutException(format("Statement did not complete within %s", timeout), e);

			return wireException(message, e);
		}

		protected static int toQueryTimeoutSeconds(@NonNull Duration timeout) {
			requireNonNull(timeout);

			long milliseconds = Math.max(timeout.toMillis(), 1L);
			return (int) Math.min(Integer.MAX_VALUE, (milliseconds + 999L) / 1000L);
		}
	}

	/**
	 * A {@link WireCursor} over an open JDBC {@link ResultSet}, which the driver fills {@code fetchSize} rows at a time.
	 */
	@NotThreadSafe
	protected static class JdbcWireCursor implements WireCursor {
		@NonNull
		private final JdbcWireLink jdbcWireLink;
		@NonNull
		private final PreparedStatement preparedStatement;
		@NonNull
		private final ResultSet resultSet;
		@NonNull
		private final ResultSetMetaData resultSetMetaData;
		@NonNull
		private final List<String> columnNames;
		private boolean closed;

		protected JdbcWireCursor(@NonNull JdbcWireLink jdbcWireLink,
														 @NonNull PreparedStatement preparedStatement,
														 @NonNull ResultSet resultSet) throws SQLException {
			requireNonNull(jdbcWireLink);
			requireNonNull(preparedStatement);
			requireNonNull(resultSet);

			this.jdbcWireLink = jdbcWireLink;
			this.preparedStatement = preparedStatement;
			this.resultSet = resultSet;
			this.resultSetMetaData = resultSet.getMetaData();
			this.columnNames = new ArrayList<>(this.resultSetMetaData.getColumnCount());

			for (int i = 1; i <= this.resultSetMetaData.getColumnCount(); ++i)
				this.columnNames.add(this.resultSetMetaData.getColumnLabel(i));
		}

		@NonNull
		@Override
		public List<Row> fetch(@NonNull Integer count,
													 @Nullable Duration timeout) {
			requireNonNull(count);
			ensureOpen();

			List<Row> rows = new ArrayList<>(Math.min(count, 1_024));

			try {
				applyTimeout(timeout);

				while (rows.size() < count && this.resultSet.next())
					rows.add(Row.of(this.columnNames, this.jdbcWireLink.jdbcWireDriver.readRowValues(this.resultSet, this.resultSetMetaData)));
			} catch (SQLException e) {
				throw this.jdbcWireLink.statementFailure("Unable to fetch from cursor", e, timeout);
			}

			return rows;
		}

		@NonNull
		@Override
		public Long forward(@NonNull Long count,
												@Nullable Duration timeout) {
			requireNonNull(count);
			ensureOpen();

			long skipped = 0;

			try {
				applyTimeout(timeout);

				while (skipped < count && this.resultSet.next())
					++skipped;
			} catch (SQLException e) {
				throw this.jdbcWireLink.statementFailure("Unable to move cursor forward", e, timeout);
			}

			return skipped;
		}

		@Override
		public void close() {
			if (this.closed)
				return;

			this.closed = true;

			try (PreparedStatement preparedStatement = this.preparedStatement) {
				this.resultSet.close();
			} catch (SQLException e) {
				throw this.jdbcWireLink.wireException("Unable to close cursor", e);
			}
		}

		protected void applyTimeout(@Nullable Duration timeout) throws SQLException {
			if (timeout != null)
				this.preparedStatement.setQueryTimeout(JdbcWireLink.toQueryTimeoutSeconds(timeout));
		}

		protected void ensureOpen() {
			if (this.closed)
				throw new IllegalDatabaseStateException("Cursor is closed");
		}
	}

	/**
	 * PostgreSQL driver calls, kept apart so nothing loads {@code org.postgresql} classes unless the driver is present.
	 */
	@ThreadSafe
	protected static final class PostgresNotifications {
		private PostgresNotifications() {}

		@NonNull
		static Boolean isPostgresConnection(@NonNull Connection connection) throws SQLException {
			requireNonNull(connection);
			return connection.isWrapperFor(PGConnection.class);
		}

		@NonNull
		static List<Notification> poll(@NonNull Connection connection,
																	 @Nullable Duration timeout) throws SQLException {
			requireNonNull(connection);

			PGConnection pgConnection = connection.unwrap(PGConnection.class);
			PGNotification[] pgNotifications;

			// pgjdbc waits indefinitely for a timeout of 0 and only returns what it has already read without one
			if (timeout == null)
				pgNotifications = pgConnection.getNotifications(0);
			else if (timeout.isZero())
				pgNotifications = pgConnection.getNotifications();
			else
				pgNotifications = pgConnection.getNotifications((int) Math.min(Integer.MAX_VALUE, Math.max(timeout.toMillis(), 1L)));

			if (pgNotifications == null)
				return List.of();

			List<Notification> notifications = new ArrayList<>(pgNotifications.length);

			for (PGNotification pgNotification : pgNotifications)
				notifications.add(new Notification(pgNotification.getPID(), pgNotification.getName(),
						pgNotification.getParameter() == null ? "" : pgNotification.getParameter()));

			return notifications;
		}
	}
}
