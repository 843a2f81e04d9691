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
import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;

/**
 * A database transaction handle.
 * <p>
 * A root transaction owns a connection taken from the {@link DataSource} with auto-commit switched off. A nested
 * transaction shares its parent's connection (and connection lock) and is backed by a {@link Savepoint}.
 * Once committed or rolled back a transaction rejects further use.
 * <p>
 * Commit, rollback and close are driven by {@link DefaultConn#tx(TransactionalOperation)}.
 *
 * @since 1.0.0
 */
@ThreadSafe
final class Transaction implements Session {
	@NonNull
	private static final AtomicLong ID_GENERATOR;

	static {
		ID_GENERATOR = new AtomicLong(0);
	}

	@NonNull
	private final Long id;
	@NonNull
	private final Connection connection;
	@Nullable
	private final Savepoint savepoint;
	@NonNull
	private final Integer depth;
	@NonNull
	private final Boolean initialAutoCommit;
	@NonNull
	private final ReentrantLock connectionLock;
	@NonNull
	private final AtomicBoolean completed;
	@NonNull
	private final Logger logger;
	@Nullable
	private Duration connectionAcquisitionDuration;

	private Transaction(@NonNull Connection connection,
											@Nullable Savepoint savepoint,
											@NonNull Integer depth,
											@NonNull Boolean initialAutoCommit,
											@NonNull ReentrantLock connectionLock,
											@Nullable Duration connectionAcquisitionDuration) {
		requireNonNull(connection);
		requireNonNull(depth);
		requireNonNull(initialAutoCommit);
		requireNonNull(connectionLock);

		this.id = ID_GENERATOR.incrementAndGet();
		this.connection = connection;
		this.savepoint = savepoint;
		this.depth = depth;
		this.initialAutoCommit = initialAutoCommit;
		this.connectionLock = connectionLock;
		this.connectionAcquisitionDuration = connectionAcquisitionDuration;
		this.completed = new AtomicBoolean(false);
		this.logger = Logger.getLogger(Transaction.class.getName());
	}

	/**
	 * Begins a root transaction on a connection from {@code dataSource}.
	 *
	 * @throws DatabaseException if a connection cannot be acquired or prepared
	 */
	@NonNull
	static Transaction begin(@NonNull DataSource dataSource) {
		requireNonNull(dataSource);

		long startTime = nanoTime();
		Connection connection;

		try {
			connection = dataSource.getConnection();
		} catch (SQLException e) {
			throw new DatabaseException("Unable to acquire database connection", e);
		}

		Duration connectionAcquisitionDuration = Duration.ofNanos(nanoTime() - startTime);

		try {
			// Put auto-commit back on close if it was on to begin with
			boolean initialAutoCommit = connection.getAutoCommit();

			if (initialAutoCommit)
				connection.setAutoCommit(false);

			Transaction transaction = new Transaction(connection, null, 0, initialAutoCommit, new ReentrantLock(), connectionAcquisitionDuration);
			transaction.logger.finer(format("Began transaction %d", transaction.id));
			return transaction;
		} catch (SQLException e) {
			DatabaseException wrapped = new DatabaseException("Unable to begin transaction", e);

			try {
				connection.close();
			} catch (SQLException closeException) {
				wrapped.addSuppressed(closeException);
			}

			throw wrapped;
		}
	}

	@Override
	@NonNull
	public Transaction begin() {
		getConnectionLock().lock();

		try {
			ensureActive();

			Savepoint savepoint;

			try {
				savepoint = this.connection.setSavepoint();
			} catch (SQLException e) {
				throw new DatabaseException("Unable to create savepoint", e);
			}

			Transaction transaction = new Transaction(this.connection, savepoint, this.depth + 1, false, getConnectionLock(), null);
			logger.finer(format("Began nested transaction %d at depth %d inside transaction %d", transaction.id, transaction.depth, this.id));
			return transaction;
		} finally {
			getConnectionLock().unlock();
		}
	}

	@Override
	public <R> R withConnection(@NonNull ConnectionOperation<R> connectionOperation) throws SQLException {
		requireNonNull(connectionOperation);

		getConnectionLock().lock();

		try {
			ensureActive();

			// Only the first statement of a root transaction pays for acquiring its connection
			Duration connectionAcquisitionDuration = this.connectionAcquisitionDuration;
			this.connectionAcquisitionDuration = null;

			return connectionOperation.perform(this.connection, connectionAcquisitionDuration);
		} finally {
			getConnectionLock().unlock();
		}
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{id=%s, depth=%s, completed=%s}", getClass().getSimpleName(), this.id, this.depth, this.completed.get());
	}

	void commit() {
		getConnectionLock().lock();

		try {
			ensureActive();
			this.completed.set(true);

			logger.finer(format("Committing transaction %d...", this.id));

			try {
				if (this.savepoint == null)
					this.connection.commit();
				else
					this.connection.releaseSavepoint(this.savepoint);
			} catch (SQLException e) {
				throw new DatabaseException(format("Unable to commit transaction %d", this.id), e);
			}

			logger.finer(format("Transaction %d committed.", this.id));
		} finally {
			getConnectionLock().unlock();
		}
	}

	void rollback() {
		getConnectionLock().lock();

		try {
			ensureActive();
			this.completed.set(true);

			logger.finer(format("Rolling back transaction %d...", this.id));

			try {
				if (this.savepoint == null)
					this.connection.rollback();
				else
					this.connection.rollback(this.savepoint);
			} catch (SQLException e) {
				throw new DatabaseException(format("Unable to roll back transaction %d", this.id), e);
			}

			logger.finer(format("Transaction %d rolled back.", this.id));
		} finally {
			getConnectionLock().unlock();
		}
	}

	/**
	 * Rolls back if still active, then, for a root transaction, restores auto-commit and closes the connection.
	 */
	void close() {
		if (!isCompleted())
			rollback();

		if (this.savepoint != null)
			return;

		getConnectionLock().lock();

		try {
			DatabaseException failure = null;

			try {
				if (this.initialAutoCommit && !this.connection.isClosed())
					this.connection.setAutoCommit(true);
			} catch (SQLException e) {
				failure = new DatabaseException("Unable to restore database connection autocommit setting", e);
			}

			try {
				this.connection.close();
			} catch (SQLException e) {
				if (failure == null)
					failure = new DatabaseException("Unable to close database connection", e);
				else
					failure.addSuppressed(e);
			}

			if (failure != null)
				throw failure;
		} finally {
			getConnectionLock().unlock();
		}
	}

	@NonNull
	Boolean isCompleted() {
		return this.completed.get();
	}

	@NonNull
	Long id() {
		return this.id;
	}

	@NonNull
	ReentrantLock getConnectionLock() {
		return this.connectionLock;
	}

	private void ensureActive() {
		if (isCompleted())
			throw new DatabaseException(format("Transaction %d has already completed", this.id));
	}
}
