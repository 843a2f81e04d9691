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

package com.bindery;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.lang.String.format;
import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;

/**
 * Main class for performing database access operations.
 * <p>
 * A {@code Database} is the root {@link Conn}. Statements issued directly on it run on a connection borrowed from the
 * {@link DataSource} for that statement alone, and each call works on its own fork of the default bind store, so a
 * single instance can be shared freely between threads.
 * <pre>{@code
 * Database database = Database.withDataSource(dataSource)
 *   .statementLogger(new DefaultStatementLogger())
 *   .bind("schema", "public")
 *   .build();
 *
 * database.tx(conn -> {
 *   conn.insert(employee, employee);
 *   conn.with("id", employee.getId()).get(employee, employee);
 * });
 * }</pre>
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Database implements Conn {
	@NonNull
	private static final Duration DEFAULT_PING_TIMEOUT = Duration.ofSeconds(5);

	@NonNull
	private final DataSource dataSource;
	@NonNull
	private final StatementLogger statementLogger;
	@NonNull
	private final PreparedStatementBinder preparedStatementBinder;
	@Nullable
	private final Duration queryTimeout;
	@NonNull
	private final Bind defaultBind;
	@NonNull
	private final Session session;

	private Database(@NonNull Builder builder) {
		requireNonNull(builder);

		this.dataSource = requireNonNull(builder.dataSource);
		this.statementLogger = builder.statementLogger == null ? (statementLog) -> {} : builder.statementLogger;
		this.preparedStatementBinder = builder.preparedStatementBinder == null ? PreparedStatementBinder.withDefaultConfiguration() : builder.preparedStatementBinder;
		this.queryTimeout = builder.queryTimeout;
		this.defaultBind = Bind.of();

		for (Map.Entry<String, Object> entry : builder.bindings.entrySet())
			this.defaultBind.set(entry.getKey(), entry.getValue());

		this.session = new DataSourceSession(this.dataSource);
	}

	/**
	 * Provides a {@link Database} builder for the given {@link DataSource}.
	 *
	 * @param dataSource data source used to create the {@link Database} builder
	 * @return a {@link Database} builder
	 */
	@NonNull
	public static Builder withDataSource(@NonNull DataSource dataSource) {
		requireNonNull(dataSource);
		return new Builder(dataSource);
	}

	/**
	 * Creates a connection with a fresh fork of the default bind store.
	 *
	 * @return a new connection
	 */
	@NonNull
	public Conn conn() {
		return new DefaultConn(this.session, this.defaultBind.copy(), getStatementLogger(), getPreparedStatementBinder(), getQueryTimeout());
	}

	/**
	 * Creates an idle {@link Listener}. It takes a dedicated connection from the data source on its first
	 * {@link Listener#listen(String)} and holds it until closed.
	 *
	 * @return a new listener
	 */
	@NonNull
	public Listener listener() {
		return new DefaultListener(getDataSource());
	}

	/**
	 * Checks that a valid connection can be obtained from the data source, waiting up to 5 seconds.
	 *
	 * @return {@code true} if the connection is valid
	 * @throws DatabaseException if no connection could be obtained
	 */
	@NonNull
	public Boolean ping() {
		return ping(DEFAULT_PING_TIMEOUT);
	}

	/**
	 * Checks that a valid connection can be obtained from the data source.
	 *
	 * @param timeout how long to wait for validation
	 * @return {@code true} if the connection is valid
	 * @throws DatabaseException if no connection could be obtained
	 */
	@NonNull
	public Boolean ping(@NonNull Duration timeout) {
		requireNonNull(timeout);

		try (Connection connection = getDataSource().getConnection()) {
			return connection.isValid((int) Math.max(1, Math.min(timeout.toSeconds(), Integer.MAX_VALUE)));
		} catch (SQLException e) {
			throw new DatabaseException("Unable to acquire database connection", e);
		}
	}

	@Override
	@NonNull
	public Conn with(@Nullable Object @NonNull ... pairs) {
		requireNonNull(pairs);
		return new DefaultConn(this.session, this.defaultBind.copy(pairs), getStatementLogger(), getPreparedStatementBinder(), getQueryTimeout());
	}

	@Override
	@NonNull
	public Conn withTimeout(@Nullable Duration queryTimeout) {
		return conn().withTimeout(queryTimeout);
	}

	/**
	 * The default bind store. Every connection this database hands out starts from a copy of it, so changes show up
	 * in connections created afterwards.
	 */
	@Override
	@NonNull
	public Bind bind() {
		return this.defaultBind;
	}

	@Override
	public void tx(@NonNull TransactionalOperation transactionalOperation) {
		conn().tx(transactionalOperation);
	}

	@Override
	public void exec(@NonNull String query) {
		conn().exec(query);
	}

	@Override
	public void insert(@NonNull Reader reader,
										 @NonNull Writer writer) {
		conn().insert(reader, writer);
	}

	@Override
	public void patch(@NonNull Reader reader,
										@NonNull Selector selector,
										@NonNull Writer writer) {
		conn().patch(reader, selector, writer);
	}

	@Override
	public void delete(@NonNull Reader reader,
										 @NonNull Selector selector) {
		conn().delete(reader, selector);
	}

	@Override
	public void get(@NonNull Reader reader,
									@NonNull Selector selector) {
		conn().get(reader, selector);
	}

	@Override
	public void list(@NonNull Reader reader,
									 @NonNull Selector selector) {
		conn().list(reader, selector);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{dataSource=%s, queryTimeout=%s}", getClass().getSimpleName(), getDataSource(), getQueryTimeout());
	}

	@NonNull
	DataSource getDataSource() {
		return this.dataSource;
	}

	@NonNull
	StatementLogger getStatementLogger() {
		return this.statementLogger;
	}

	@NonNull
	PreparedStatementBinder getPreparedStatementBinder() {
		return this.preparedStatementBinder;
	}

	@Nullable
	Duration getQueryTimeout() {
		return this.queryTimeout;
	}

	/**
	 * Borrows a connection per statement; closing it returns it to the pool.
	 */
	@ThreadSafe
	private static final class DataSourceSession implements Session {
		@NonNull
		private final DataSource dataSource;

		private DataSourceSession(@NonNull DataSource dataSource) {
			requireNonNull(dataSource);
			this.dataSource = dataSource;
		}

		@Override
		public <R> R withConnection(@NonNull ConnectionOperation<R> connectionOperation) throws SQLException {
			requireNonNull(connectionOperation);

			long startTime = nanoTime();
			Connection connection;

			try {
				connection = this.dataSource.getConnection();
			} catch (SQLException e) {
				throw new DatabaseException("Unable to acquire database connection", e);
			}

			Duration connectionAcquisitionDuration = Duration.ofNanos(nanoTime() - startTime);
			Throwable thrown = null;

			try {
				return connectionOperation.perform(connection, connectionAcquisitionDuration);
			} catch (SQLException | RuntimeException | Error e) {
				thrown = e;
				throw e;
			} finally {
				try {
					connection.close();
				} catch (SQLException e) {
					if (thrown == null)
						throw new DatabaseException("Unable to close database connection", e);

					thrown.addSuppressed(e);
				}
			}
		}

		@Override
		@NonNull
		public Transaction begin() {
			return Transaction.begin(this.dataSource);
		}

		@Override
		@NonNull
		public String toString() {
			return getClass().getSimpleName();
		}
	}

	/**
	 * Builder used to construct instances of {@link Database}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final DataSource dataSource;
		@NonNull
		private final Map<@NonNull String, @Nullable Object> bindings;
		@Nullable
		private StatementLogger statementLogger;
		@Nullable
		private PreparedStatementBinder preparedStatementBinder;
		@Nullable
		private Duration queryTimeout;

		private Builder(@NonNull DataSource dataSource) {
			this.dataSource = requireNonNull(dataSource);
			this.bindings = new LinkedHashMap<>();
		}

		/**
		 * Receives a {@link StatementLog} for every statement executed. Defaults to a no-op.
		 *
		 * @param statementLogger the logger to use, or {@code null} for the default
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder statementLogger(@Nullable StatementLogger statementLogger) {
			this.statementLogger = statementLogger;
			return this;
		}

		@NonNull
		public Builder preparedStatementBinder(@Nullable PreparedStatementBinder preparedStatementBinder) {
			this.preparedStatementBinder = preparedStatementBinder;
			return this;
		}

		/**
		 * Default JDBC query timeout for statements. JDBC works in whole seconds; fractions are rounded up.
		 *
		 * @param queryTimeout the timeout, or {@code null} for none
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder queryTimeout(@Nullable Duration queryTimeout) {
			if (queryTimeout != null && queryTimeout.isNegative())
				throw new IllegalArgumentException(format("Query timeout must not be negative but was %s", queryTimeout));

			this.queryTimeout = queryTimeout;
			return this;
		}

		/**
		 * Seeds the default bind store with a variable, for example a schema name referenced as {@code ${"schema"}}.
		 *
		 * @param key   the variable name
		 * @param value the value
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder bind(@NonNull String key,
												@Nullable Object value) {
			requireNonNull(key);

			if (key.isEmpty())
				throw new IllegalArgumentException("Bind key must not be empty");

			this.bindings.put(key, value);
			return this;
		}

		@NonNull
		public Database build() {
			return new Database(this);
		}
	}
}
