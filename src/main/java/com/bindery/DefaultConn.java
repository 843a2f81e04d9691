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

import javax.annotation.concurrent.ThreadSafe;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.WARNING;

/**
 * The CRUD dispatcher behind every {@link Conn}.
 * <p>
 * Each statement goes through the same pipeline: expand {@code ${...}} placeholders against the bind store, rewrite
 * {@code @name} tokens to JDBC markers, bind their values, execute on the session's connection, scan, and report a
 * {@link StatementLog}.
 *
 * @since 1.0.0
 */
@ThreadSafe
final class DefaultConn implements Conn {
	@NonNull
	private static final String COUNT_TEMPLATE = "WITH sq AS (%s ${" + GROUP_BY_KEY + "}) SELECT COUNT(*) AS \"count\" FROM sq";
	@NonNull
	private static final String LIST_SUFFIX = " ${" + GROUP_BY_KEY + "} ${" + ORDER_BY_KEY + "} ${" + OFFSET_LIMIT_KEY + "}";

	@NonNull
	private final Session session;
	@NonNull
	private final Bind bind;
	@NonNull
	private final StatementLogger statementLogger;
	@NonNull
	private final PreparedStatementBinder preparedStatementBinder;
	@Nullable
	private final Duration queryTimeout;
	@NonNull
	private final Logger logger;

	DefaultConn(@NonNull Session session,
							@NonNull Bind bind,
							@NonNull StatementLogger statementLogger,
							@NonNull PreparedStatementBinder preparedStatementBinder,
							@Nullable Duration queryTimeout) {
		requireNonNull(session);
		requireNonNull(bind);
		requireNonNull(statementLogger);
		requireNonNull(preparedStatementBinder);

		this.session = session;
		this.bind = bind;
		this.statementLogger = statementLogger;
		this.preparedStatementBinder = preparedStatementBinder;
		this.queryTimeout = queryTimeout;
		this.logger = Logger.getLogger(DefaultConn.class.getName());
	}

	@Override
	@NonNull
	public Conn with(@Nullable Object @NonNull ... pairs) {
		requireNonNull(pairs);
		return new DefaultConn(getSession(), getBind().copy(pairs), getStatementLogger(), getPreparedStatementBinder(), getQueryTimeout());
	}

	@Override
	@NonNull
	public Conn withTimeout(@Nullable Duration queryTimeout) {
		if (queryTimeout != null && queryTimeout.isNegative())
			throw new IllegalArgumentException(format("Query timeout must not be negative but was %s", queryTimeout));

		return new DefaultConn(getSession(), getBind().copy(), getStatementLogger(), getPreparedStatementBinder(), queryTimeout);
	}

	@Override
	@NonNull
	public Bind bind() {
		return getBind();
	}

	@Override
	public void tx(@NonNull TransactionalOperation transactionalOperation) {
		requireNonNull(transactionalOperation);

		ensureNotInterrupted();

		Transaction transaction = getSession().begin();
		Throwable thrown = null;

		try {
			transactionalOperation.perform(new DefaultConn(transaction, getBind().copy(), getStatementLogger(), getPreparedStatementBinder(), getQueryTimeout()));
			transaction.commit();
		} catch (RuntimeException e) {
			thrown = e;
			rollback(transaction, e);
			restoreInterruptIfNeeded(e);
			throw e;
		} catch (Error e) {
			thrown = e;
			rollback(transaction, e);
			restoreInterruptIfNeeded(e);
			throw e;
		} catch (Exception e) {
			DatabaseException wrapped = new DatabaseException(e);
			thrown = wrapped;
			rollback(transaction, wrapped);
			restoreInterruptIfNeeded(e);
			throw wrapped;
		} finally {
			try {
				transaction.close();
			} catch (RuntimeException e) {
				if (thrown == null)
					throw e;

				logger.log(WARNING, format("Unable to close transaction %d", transaction.id()), e);
				thrown.addSuppressed(e);
			}
		}
	}

	@Override
	public void exec(@NonNull String query) {
		requireNonNull(query);
		execute(query, null);
	}

	@Override
	public void insert(@NonNull Reader reader,
										 @NonNull Writer writer) {
		requireNonNull(reader);
		requireNonNull(writer);

		queryRow(writer.insert(getBind()), reader);
	}

	@Override
	public void patch(@NonNull Reader reader,
										@NonNull Selector selector,
										@NonNull Writer writer) {
		requireNonNull(reader);
		requireNonNull(selector);
		requireNonNull(writer);

		String query = selector.select(getBind(), Operation.PATCH);
		writer.patch(getBind());
		queryRow(query, reader);
	}

	@Override
	public void delete(@NonNull Reader reader,
										 @NonNull Selector selector) {
		requireNonNull(reader);
		requireNonNull(selector);

		queryRow(selector.select(getBind(), Operation.DELETE), reader);
	}

	@Override
	public void get(@NonNull Reader reader,
									@NonNull Selector selector) {
		requireNonNull(reader);
		requireNonNull(selector);

		queryRow(selector.select(getBind(), Operation.GET), reader);
	}

	@Override
	public void list(@NonNull Reader reader,
									 @NonNull Selector selector) {
		requireNonNull(reader);
		requireNonNull(selector);

		getBind().set(GROUP_BY_KEY, "");
		getBind().set(ORDER_BY_KEY, "");
		getBind().set(OFFSET_LIMIT_KEY, "");

		String query = selector.select(getBind(), Operation.LIST);

		if (reader instanceof ListReader listReader)
			queryRow(format(COUNT_TEMPLATE, query), listReader::scanCount);

		execute(query + LIST_SUFFIX, resultSet -> {
			while (resultSet.next())
				reader.scan(resultSet);
		});
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{session=%s, bind=%s}", getClass().getSimpleName(), getSession(), getBind());
	}

	private void queryRow(@NonNull String query,
													@NonNull Reader reader) {
		requireNonNull(query);
		requireNonNull(reader);

		execute(query, resultSet -> {
			if (!resultSet.next())
				throw new NotFoundException();

			reader.scan(resultSet);
		});
	}

	/**
	 * Runs one statement. With a {@code null} {@code resultSetOperation} the statement is executed for its side effects
	 * only; otherwise it is executed as a query and its result set handed over for scanning.
	 */
	private void execute(@NonNull String query,
												 @Nullable ResultSetOperation resultSetOperation) {
		requireNonNull(query);

		ensureNotInterrupted();

		String sql = SqlTemplate.expand(query, getBind());
		NamedParameterSql namedParameterSql = NamedParameterSql.parse(sql);
		List<Object> parameters = getBind().values(namedParameterSql.getParameterNames());
		StatementLog.Builder statementLogBuilder = StatementLog.withSql(query, namedParameterSql.getSql()).parameters(parameters);
		Exception exception = null;
		Throwable thrown = null;

		try {
			getSession().withConnection((connection, connectionAcquisitionDuration) -> {
				statementLogBuilder.connectionAcquisitionDuration(connectionAcquisitionDuration);

				try (PreparedStatement preparedStatement = connection.prepareStatement(namedParameterSql.getSql())) {
					applyQueryTimeout(preparedStatement);

					for (int i = 0; i < parameters.size(); ++i)
						getPreparedStatementBinder().bindParameter(preparedStatement, i + 1, parameters.get(i));

					long startTime = nanoTime();

					try (StatementCanceller.Registration registration = StatementCanceller.watch(Thread.currentThread(), preparedStatement)) {
						try {
							if (resultSetOperation == null) {
								preparedStatement.execute();
								statementLogBuilder.executionDuration(Duration.ofNanos(nanoTime() - startTime));
								ensureNotInterruptedDuringRoundTrip();
								return null;
							}

							try (ResultSet resultSet = preparedStatement.executeQuery()) {
								statementLogBuilder.executionDuration(Duration.ofNanos(nanoTime() - startTime));
								ensureNotInterruptedDuringRoundTrip();
								startTime = nanoTime();

								try {
									resultSetOperation.perform(resultSet);
								} finally {
									statementLogBuilder.scanDuration(Duration.ofNanos(nanoTime() - startTime));
								}
							}
						} catch (SQLException e) {
							// A cancelled statement fails with a driver-specific error; report the interrupt instead
							if (registration.isCancelled() || Thread.currentThread().isInterrupted()) {
								DatabaseException interrupted = interruptedDuringRoundTrip();
								interrupted.addSuppressed(e);
								throw interrupted;
							}

							throw e;
						}
					}
				}

				return null;
			});
		} catch (SQLException e) {
			exception = e;
			DatabaseException wrapped = new DatabaseException(e);
			thrown = wrapped;
			throw wrapped;
		} catch (RuntimeException e) {
			exception = e;
			thrown = e;
			throw e;
		} catch (Error e) {
			exception = new DatabaseException(e);
			thrown = e;
			throw e;
		} finally {
			try {
				getStatementLogger().log(statementLogBuilder.exception(exception).build());
			} catch (RuntimeException | Error loggerFailure) {
				// The statement's own failure wins
				if (thrown != null)
					thrown.addSuppressed(loggerFailure);
				else
					throw loggerFailure;
			}
		}
	}

	private void applyQueryTimeout(@NonNull PreparedStatement preparedStatement) throws SQLException {
		requireNonNull(preparedStatement);

		Duration queryTimeout = getQueryTimeout();

		if (queryTimeout == null || queryTimeout.isZero())
			return;

		// JDBC timeouts are whole seconds, so round up
		long seconds = queryTimeout.getSeconds() + (queryTimeout.getNano() > 0 ? 1 : 0);
		preparedStatement.setQueryTimeout((int) Math.min(seconds, Integer.MAX_VALUE));
	}

	private void rollback(@NonNull Transaction transaction,
													@NonNull Throwable failure) {
		requireNonNull(transaction);
		requireNonNull(failure);

		// A failed commit has already completed the transaction
		if (transaction.isCompleted())
			return;

		try {
			transaction.rollback();
		} catch (RuntimeException e) {
			logger.log(WARNING, format("Unable to roll back transaction %d", transaction.id()), e);
			failure.addSuppressed(e);
		}
	}

	private static void ensureNotInterrupted() {
		if (Thread.currentThread().isInterrupted())
			throw new DatabaseException("Thread was interrupted before its database round trip", new InterruptedException());
	}

	private static void ensureNotInterruptedDuringRoundTrip() {
		if (Thread.currentThread().isInterrupted())
			throw interruptedDuringRoundTrip();
	}

	@NonNull
	private static DatabaseException interruptedDuringRoundTrip() {
		return new DatabaseException("Thread was interrupted during its database round trip", new InterruptedException());
	}

	private static void restoreInterruptIfNeeded(@NonNull Throwable throwable) {
		requireNonNull(throwable);

		Throwable current = throwable;

		while (current != null) {
			if (current instanceof InterruptedException) {
				Thread.currentThread().interrupt();
				return;
			}

			current = current.getCause();
		}
	}

	@NonNull
	Session getSession() {
		return this.session;
	}

	@NonNull
	Bind getBind() {
		return this.bind;
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

	@FunctionalInterface
	interface ResultSetOperation {
		void perform(@NonNull ResultSet resultSet) throws SQLException;
	}
}
