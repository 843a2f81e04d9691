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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import javax.sql.DataSource;
import java.io.PrintWriter;
import java.lang.reflect.Proxy;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

import static java.util.Objects.requireNonNull;

/**
 * Exercises {@link DefaultListener} against fake driver connections.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class ListenerTests {
	@Test
	public void testOperationsWithoutConnectionFail() {
		FakeDataSource dataSource = new FakeDataSource(false);

		try (Listener listener = new DefaultListener(dataSource)) {
			Assertions.assertThrows(DatabaseException.class, () -> listener.unlisten("jobs"));
			Assertions.assertThrows(DatabaseException.class, listener::waitForNotification);
			Assertions.assertThrows(DatabaseException.class, () -> listener.waitForNotification(Duration.ZERO));
		}

		Assertions.assertEquals(0, dataSource.getConnections().size(), "No connection should have been acquired");
	}

	@Test
	public void testListenAcquiresSingleConnection() {
		FakeDataSource dataSource = new FakeDataSource(false);

		try (Listener listener = new DefaultListener(dataSource)) {
			listener.listen("jobs");
			listener.listen("we\"ird");

			Assertions.assertEquals(1, dataSource.getConnections().size());
			Assertions.assertEquals(List.of("LISTEN \"jobs\"", "LISTEN \"we\"\"ird\""), dataSource.getConnections().get(0).getExecutedSql());
			Assertions.assertEquals(Set.of("jobs", "we\"ird"), listener.getChannels());

			listener.unlisten("jobs");

			Assertions.assertEquals("UNLISTEN \"jobs\"", dataSource.getConnections().get(0).getExecutedSql().get(2));
			Assertions.assertEquals(Set.of("we\"ird"), listener.getChannels());
		}
	}

	@Test
	public void testNotificationsAreDeliveredInOrder() {
		FakeDataSource dataSource = new FakeDataSource(false);

		try (Listener listener = new DefaultListener(dataSource)) {
			listener.listen("jobs");

			FakeConnection connection = dataSource.getConnections().get(0);
			connection.deliver(notification("jobs", "first", 11), notification("jobs", "second", 11));
			connection.deliver(notification("jobs", null, 12));

			Notification first = listener.waitForNotification();
			Notification second = listener.waitForNotification();
			Notification third = listener.waitForNotification();

			Assertions.assertEquals("jobs", first.getChannel());
			Assertions.assertEquals("first", first.getPayloadAsString());
			Assertions.assertEquals(11, first.getProcessId());
			Assertions.assertEquals("second", second.getPayloadAsString());
			Assertions.assertEquals(0, third.getPayload().length, "Missing payload should be empty");
			Assertions.assertEquals(12, third.getProcessId());
		}
	}

	@Test
	public void testWaitWithTimeout() {
		FakeDataSource dataSource = new FakeDataSource(false);

		try (Listener listener = new DefaultListener(dataSource)) {
			listener.listen("jobs");

			Assertions.assertEquals(Optional.empty(), listener.waitForNotification(Duration.ofMillis(50)));
			Assertions.assertEquals(Optional.empty(), listener.waitForNotification(Duration.ZERO));

			dataSource.getConnections().get(0).deliver(notification("jobs", "ready", 1));

			Assertions.assertEquals("ready", listener.waitForNotification(Duration.ZERO).get().getPayloadAsString());
			Assertions.assertThrows(IllegalArgumentException.class, () -> listener.waitForNotification(Duration.ofSeconds(-1)));
		}
	}

	@Test
	public void testWaitWithVeryLongTimeout() {
		FakeDataSource dataSource = new FakeDataSource(false);

		try (Listener listener = new DefaultListener(dataSource)) {
			listener.listen("jobs");

			FakeConnection connection = dataSource.getConnections().get(0);

			// An empty poll first, so the wait has to go around the loop
			connection.deliver();
			connection.deliver(notification("jobs", "later", 3));
			connection.deliver();
			connection.deliver(notification("jobs", "much later", 3));

			Assertions.assertEquals("later", listener.waitForNotification(Duration.ofSeconds(Long.MAX_VALUE)).get().getPayloadAsString());
			Assertions.assertEquals("much later", listener.waitForNotification(Duration.ofDays(365L * 200)).get().getPayloadAsString());
		}
	}

	@Test
	public void testWaitHonorsInterrupt() {
		FakeDataSource dataSource = new FakeDataSource(false);

		try (Listener listener = new DefaultListener(dataSource)) {
			listener.listen("jobs");

			Thread.currentThread().interrupt();

			try {
				DatabaseException e = Assertions.assertThrows(DatabaseException.class, listener::waitForNotification);
				Assertions.assertTrue(e.getCause() instanceof InterruptedException);
				Assertions.assertTrue(Thread.currentThread().isInterrupted(), "Interrupt flag should stay set");
			} finally {
				Thread.interrupted();
			}
		}
	}

	@Test
	public void testCloseForceClosesPhysicalConnection() {
		FakeDataSource dataSource = new FakeDataSource(true);
		Listener listener = new DefaultListener(dataSource);

		listener.listen("jobs");

		FakeConnection connection = dataSource.getConnections().get(0);

		listener.close();

		Assertions.assertTrue(connection.isPhysicalClosed(), "Physical connection should be closed");
		Assertions.assertTrue(connection.isHandleClosed(), "Pooled handle should be released");
		Assertions.assertTrue(listener.getChannels().isEmpty());
		Assertions.assertThrows(DatabaseException.class, () -> listener.unlisten("jobs"), "Closed listener should be idle");

		// Idempotent
		listener.close();

		listener.listen("jobs");
		Assertions.assertEquals(2, dataSource.getConnections().size(), "Listening again should take a fresh connection");
		listener.close();
	}

	@Test
	public void testCloseFailureStillReleasesConnection() {
		FakeDataSource dataSource = new FakeDataSource(true);
		Listener listener = new DefaultListener(dataSource);

		listener.listen("jobs");

		FakeConnection connection = dataSource.getConnections().get(0);
		connection.failPhysicalClose();

		DatabaseException e = Assertions.assertThrows(DatabaseException.class, listener::close);

		Assertions.assertTrue(e.getCause() instanceof SQLException);
		Assertions.assertTrue(connection.isHandleClosed(), "Handle should be closed even if the physical close failed");
		Assertions.assertThrows(DatabaseException.class, () -> listener.unlisten("jobs"), "Listener should be idle after a failed close");
		Assertions.assertDoesNotThrow(listener::close);
	}

	@Test
	public void testNotificationPayloadIsCopied() {
		byte[] payload = "abc".getBytes(StandardCharsets.UTF_8);
		Notification notification = new Notification("jobs", payload, 7);

		payload[0] = 'x';
		notification.getPayload()[1] = 'y';

		Assertions.assertEquals("abc", notification.getPayloadAsString());
		Assertions.assertEquals(new Notification("jobs", "abc".getBytes(StandardCharsets.UTF_8), 7), notification);
	}

	@Nonnull
	private static PGNotification notification(@Nonnull String channel,
																						 @Nullable String payload,
																						 int processId) {
		requireNonNull(channel);

		return new PGNotification() {
			@Override
			public String getName() {
				return channel;
			}

			@Override
			public int getPID() {
				return processId;
			}

			@Override
			public String getParameter() {
				return payload;
			}
		};
	}

	private static final class FakeConnection {
		@Nonnull
		private final List<String> executedSql;
		@Nonnull
		private final Deque<PGNotification[]> batches;
		@Nonnull
		private final Connection handle;
		@Nonnull
		private final Connection physical;
		private boolean handleClosed;
		private boolean physicalClosed;
		private boolean failPhysicalClose;

		private FakeConnection(boolean pooled) {
			this.executedSql = new ArrayList<>();
			this.batches = new ArrayDeque<>();
			this.physical = createConnection(true);
			this.handle = pooled ? createConnection(false) : this.physical;
		}

		private void deliver(@Nonnull PGNotification... notifications) {
			synchronized (this.batches) {
				this.batches.add(notifications);
			}
		}

		private void failPhysicalClose() {
			this.failPhysicalClose = true;
		}

		@Nonnull
		private List<String> getExecutedSql() {
			return this.executedSql;
		}

		private boolean isHandleClosed() {
			return this.handleClosed;
		}

		private boolean isPhysicalClosed() {
			return this.physicalClosed;
		}

		@Nonnull
		private Connection getHandle() {
			return this.handle;
		}

		@Nonnull
		private PGNotification[] nextBatch() {
			synchronized (this.batches) {
				PGNotification[] batch = this.batches.poll();
				return batch == null ? new PGNotification[0] : batch;
			}
		}

		@Nonnull
		private Connection createConnection(boolean physical) {
			Class<?>[] interfaces = physical ? new Class<?>[]{Connection.class, PGConnection.class} : new Class<?>[]{Connection.class};

			return (Connection) Proxy.newProxyInstance(ListenerTests.class.getClassLoader(), interfaces, (proxy, method, args) -> {
				switch (method.getName()) {
					case "getAutoCommit":
						return true;
					case "isClosed":
						return physical ? this.physicalClosed : this.handleClosed;
					case "unwrap":
						return this.physical;
					case "createStatement":
						return createStatement();
					case "getNotifications":
						return nextBatch();
					case "close":
						if (!physical) {
							this.handleClosed = true;
							return null;
						}

						if (this.failPhysicalClose)
							throw new SQLException("Connection reset");

						this.physicalClosed = true;

						// An unpooled connection is its own handle
						if (this.handle == proxy)
							this.handleClosed = true;

						return null;
					case "hashCode":
						return System.identityHashCode(proxy);
					case "equals":
						return proxy == args[0];
					case "toString":
						return physical ? "FakePhysicalConnection" : "FakePooledConnection";
					default:
						throw new UnsupportedOperationException(method.getName());
				}
			});
		}

		@Nonnull
		private Statement createStatement() {
			return (Statement) Proxy.newProxyInstance(ListenerTests.class.getClassLoader(), new Class<?>[]{Statement.class}, (proxy, method, args) -> {
				switch (method.getName()) {
					case "execute":
						this.executedSql.add((String) args[0]);
						return false;
					case "close":
						return null;
					default:
						throw new UnsupportedOperationException(method.getName());
				}
			});
		}
	}

	private static final class FakeDataSource implements DataSource {
		private final boolean pooled;
		@Nonnull
		private final List<FakeConnection> connections;

		private FakeDataSource(boolean pooled) {
			this.pooled = pooled;
			this.connections = new ArrayList<>();
		}

		@Nonnull
		private List<FakeConnection> getConnections() {
			return this.connections;
		}

		@Override
		public Connection getConnection() {
			FakeConnection connection = new FakeConnection(this.pooled);
			this.connections.add(connection);
			return connection.getHandle();
		}

		@Override
		public Connection getConnection(String username, String password) {
			return getConnection();
		}

		@Override
		public PrintWriter getLogWriter() {
			return null;
		}

		@Override
		public void setLogWriter(PrintWriter out) {}

		@Override
		public void setLoginTimeout(int seconds) {}

		@Override
		public int getLoginTimeout() {
			return 0;
		}

		@Override
		public Logger getParentLogger() throws SQLFeatureNotSupportedException {
			throw new SQLFeatureNotSupportedException();
		}

		@Override
		public <T> T unwrap(Class<T> iface) throws SQLException {
			throw new SQLException("Not a wrapper");
		}

		@Override
		public boolean isWrapperFor(Class<?> iface) {
			return false;
		}
	}
}
