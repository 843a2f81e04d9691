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
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;

import javax.annotation.concurrent.ThreadSafe;
import javax.sql.DataSource;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;

/**
 * {@link Listener} over the PostgreSQL JDBC driver.
 * <p>
 * Waiting polls {@link PGConnection#getNotifications(int)} in short slices so an interrupt ends the wait promptly.
 * Notifications delivered together are queued and handed out one per call, in arrival order.
 *
 * @since 1.0.0
 */
@ThreadSafe
final class DefaultListener implements Listener {
	@NonNull
	static final Duration POLL_INTERVAL = Duration.ofMillis(250);
	@NonNull
	private static final Duration MAXIMUM_TIMEOUT = Duration.ofNanos(Long.MAX_VALUE);

	@NonNull
	private final DataSource dataSource;
	@NonNull
	private final ReentrantLock lock;
	@NonNull
	private final Deque<@NonNull Notification> pendingNotifications;
	@NonNull
	private final Set<@NonNull String> channels;
	@NonNull
	private final Logger logger;
	@Nullable
	private Connection connection;
	@Nullable
	private PGConnection pgConnection;

	DefaultListener(@NonNull DataSource dataSource) {
		requireNonNull(dataSource);

		this.dataSource = dataSource;
		this.lock = new ReentrantLock();
		this.pendingNotifications = new ArrayDeque<>();
		this.channels = new LinkedHashSet<>();
		this.logger = Logger.getLogger(DefaultListener.class.getName());
	}

	@Override
	public void listen(@NonNull String channel) {
		requireNonNull(channel);

		this.lock.lock();

		try {
			if (this.connection == null)
				acquireConnection();

			execute(format("LISTEN %s", SqlTemplate.quoteIdentifier(channel)));
			this.channels.add(channel);

			logger.finer(format("Listening on channel '%s'", channel));
		} finally {
			this.lock.unlock();
		}
	}

	@Override
	public void unlisten(@NonNull String channel) {
		requireNonNull(channel);

		this.lock.lock();

		try {
			requireConnection();

			execute(format("UNLISTEN %s", SqlTemplate.quoteIdentifier(channel)));
			this.channels.remove(channel);

			logger.finer(format("Stopped listening on channel '%s'", channel));
		} finally {
			this.lock.unlock();
		}
	}

	@Override
	@NonNull
	public Notification waitForNotification() {
		return awaitNotification(null).get();
	}

	@Override
	@NonNull
	public Optional<Notification> waitForNotification(@NonNull Duration timeout) {
		requireNonNull(timeout);

		if (timeout.isNegative())
			throw new IllegalArgumentException(format("Timeout must not be negative but was %s", timeout));

		return awaitNotification(timeout);
	}

	@Override
	@NonNull
	public Set<@NonNull String> getChannels() {
		this.lock.lock();

		try {
			return Collections.unmodifiableSet(new LinkedHashSet<>(this.channels));
		} finally {
			this.lock.unlock();
		}
	}

	@Override
	public void close() {
		this.lock.lock();

		try {
			Connection connection = this.connection;
			PGConnection pgConnection = this.pgConnection;

			if (connection == null)
				return;

			this.connection = null;
			this.pgConnection = null;
			this.channels.clear();
			this.pendingNotifications.clear();

			DatabaseException failure = null;

			// A pooled handle would go back into rotation on close; close the physical connection underneath it first
			if (pgConnection instanceof Connection physicalConnection && physicalConnection != connection) {
				try {
					physicalConnection.close();
				} catch (SQLException e) {
					failure = new DatabaseException("Unable to close listener's physical connection", e);
				}
			}

			try {
				connection.close();
			} catch (SQLException e) {
				if (failure == null)
					failure = new DatabaseException("Unable to close listener connection", e);
				else
					failure.addSuppressed(e);
			}

			logger.finer("Listener connection closed");

			if (failure != null)
				throw failure;
		} finally {
			this.lock.unlock();
		}
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{channels=%s}", getClass().getSimpleName(), getChannels());
	}

	/**
	 * @param timeout how long to wait, or {@code null} to wait indefinitely
	 */
	@NonNull
	private Optional<Notification> awaitNotification(@Nullable Duration timeout) {
		long startTime = nanoTime();
		// Anything beyond Long.MAX_VALUE nanoseconds (about 292 years) waits indefinitely
		long timeoutNanos = timeout == null || timeout.compareTo(MAXIMUM_TIMEOUT) >= 0 ? -1 : timeout.toNanos();

		try {
			this.lock.lockInterruptibly();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new DatabaseException("Interrupted while waiting for listener", e);
		}

		try {
			requireConnection();

			while (true) {
				Notification notification = this.pendingNotifications.poll();

				if (notification != null)
					return Optional.of(notification);

				if (Thread.currentThread().isInterrupted())
					throw new DatabaseException("Interrupted while waiting for notification", new InterruptedException());

				long waitMillis = POLL_INTERVAL.toMillis();

				if (timeoutNanos >= 0) {
					long remainingNanos = timeoutNanos - (nanoTime() - startTime);

					if (remainingNanos <= 0) {
						// One last look for anything that already arrived
						receive(this.pgConnection.getNotifications());
						return Optional.ofNullable(this.pendingNotifications.poll());
					}

					// getNotifications(0) would block indefinitely
					waitMillis = Math.max(1, Math.min(waitMillis, TimeUnit.NANOSECONDS.toMillis(remainingNanos)));
				}

				receive(this.pgConnection.getNotifications((int) waitMillis));
			}
		} catch (SQLException e) {
			throw new DatabaseException("Unable to receive notifications", e);
		} finally {
			this.lock.unlock();
		}
	}

	private void receive(@Nullable PGNotification @Nullable [] notifications) {
		if (notifications == null)
			return;

		for (PGNotification notification : notifications) {
			if (notification == null)
				continue;

			String parameter = notification.getParameter();
			byte[] payload = parameter == null ? new byte[0] : parameter.getBytes(StandardCharsets.UTF_8);

			this.pendingNotifications.add(new Notification(notification.getName(), payload, notification.getPID()));
		}
	}

	private void acquireConnection() {
		Connection connection;

		try {
			connection = this.dataSource.getConnection();
		} catch (SQLException e) {
			throw new DatabaseException("Unable to acquire listener connection", e);
		}

		try {
			// LISTEN inside an open transaction only takes effect on commit
			if (!connection.getAutoCommit())
				connection.setAutoCommit(true);

			this.pgConnection = connection.unwrap(PGConnection.class);
			this.connection = connection;
		} catch (SQLException e) {
			DatabaseException failure = new DatabaseException("Listener requires a PostgreSQL connection", e);

			try {
				connection.close();
			} catch (SQLException closeException) {
				failure.addSuppressed(closeException);
			}

			throw failure;
		}

		logger.finer("Listener acquired a dedicated connection");
	}

	private void requireConnection() {
		if (this.connection == null || this.pgConnection == null)
			throw new DatabaseException("Listener has no connection; call listen() first");
	}

	private void execute(@NonNull String sql) {
		requireNonNull(sql);

		try (Statement statement = this.connection.createStatement()) {
			statement.execute(sql);
		} catch (SQLException e) {
			throw new DatabaseException(format("Unable to execute '%s'", sql), e);
		}
	}
}
