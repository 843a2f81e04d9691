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

import org.hsqldb.jdbc.JDBCDataSource;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import javax.sql.DataSource;
import java.io.PrintWriter;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.LockSupport;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class DatabaseTests {
	@NotThreadSafe
	public static class Employee implements Selector, Writer, Reader {
		@Nullable
		private Integer id;
		@Nullable
		private String name;
		@Nullable
		private String department;

		public Employee() {}

		public Employee(@Nullable Integer id) {
			this.id = id;
		}

		@Override
		@Nonnull
		public String select(@Nonnull Bind bind,
												 @Nonnull Operation operation) {
			switch (operation) {
				case GET:
					return "SELECT id, name, department FROM employee WHERE id = " + bind.set("id", this.id);
				case PATCH:
					bind.set("id", this.id);
					return "UPDATE employee SET ${patch} WHERE id = @id";
				default:
					throw new NotImplementedException(operation);
			}
		}

		@Override
		@Nonnull
		public String insert(@Nonnull Bind bind) {
			throw new NotImplementedException(Operation.INSERT);
		}

		@Override
		public void patch(@Nonnull Bind bind) {
			bind.del("patch");

			if (this.name != null)
				bind.append("patch", "name = " + bind.set("name", this.name));
			if (this.department != null)
				bind.append("patch", "department = " + bind.set("department", this.department));

			String patch = bind.join("patch", ", ");

			if (patch.isEmpty())
				throw new BadParameterException("Nothing to patch");

			bind.set("patch", patch);
		}

		@Override
		public void scan(@Nonnull ResultSet resultSet) throws SQLException {
			this.id = resultSet.getInt("id");
			this.name = resultSet.getString("name");
			this.department = resultSet.getString("department");
		}

		@Nullable
		public Integer getId() {
			return this.id;
		}

		@Nullable
		public String getName() {
			return this.name;
		}

		public void setName(@Nullable String name) {
			this.name = name;
		}

		@Nullable
		public String getDepartment() {
			return this.department;
		}
	}

	@NotThreadSafe
	public static class EmployeeList implements Selector, ListReader {
		@Nullable
		private final String department;
		@Nonnull
		private final OffsetLimit offsetLimit;
		@Nonnull
		private final List<String> names;
		@Nullable
		private Long count;

		public EmployeeList(@Nullable String department,
												@Nonnull OffsetLimit offsetLimit) {
			this.department = department;
			this.offsetLimit = requireNonNull(offsetLimit);
			this.names = new ArrayList<>();
		}

		@Override
		@Nonnull
		public String select(@Nonnull Bind bind,
												 @Nonnull Operation operation) {
			if (operation != Operation.LIST)
				throw new NotImplementedException(operation);

			bind.set(Conn.ORDER_BY_KEY, "ORDER BY name");
			this.offsetLimit.bind(bind, 100);

			if (this.department == null)
				return "SELECT id, name, department FROM employee";

			return "SELECT id, name, department FROM employee WHERE department = " + bind.set("department", this.department);
		}

		@Override
		public void scan(@Nonnull ResultSet resultSet) throws SQLException {
			this.names.add(resultSet.getString("name"));
		}

		@Override
		public void scanCount(@Nonnull ResultSet resultSet) throws SQLException {
			this.count = resultSet.getLong("count");
		}

		@Nonnull
		public List<String> getNames() {
			return this.names;
		}

		@Nullable
		public Long getCount() {
			return this.count;
		}
	}

	@Test
	public void testGet() {
		Database database = createDatabase("testGet");

		Employee employee = new Employee(2);
		database.get(employee, employee);

		Assertions.assertEquals("Bob", employee.getName());
		Assertions.assertEquals("ops", employee.getDepartment());
	}

	@Test
	public void testGetMissingRowThrowsNotFound() {
		Database database = createDatabase("testGetMissingRowThrowsNotFound");

		Employee employee = new Employee(99);

		Assertions.assertThrows(NotFoundException.class, () -> database.get(employee, employee));
	}

	@Test
	public void testExecBindsParameters() {
		Database database = createDatabase("testExecBindsParameters");

		database.with("id", 10, "name", "Dee")
				.exec("INSERT INTO employee (id, name, department) VALUES (@id, @name, @department)");

		Employee employee = new Employee(10);
		database.get(employee, employee);

		Assertions.assertEquals("Dee", employee.getName());
		Assertions.assertNull(employee.getDepartment(), "Unbound parameter should bind NULL");
	}

	@Test
	public void testPatchClauseIsValidSql() {
		Database database = createDatabase("testPatchClauseIsValidSql");

		Employee patched = new Employee(1);
		patched.setName("Annie");

		// HSQLDB has no RETURNING, so the generated UPDATE runs as a plain statement here; DispatchTests covers Conn#patch
		Conn conn = database.conn();
		patched.patch(conn.bind());
		conn.exec(patched.select(conn.bind(), Operation.PATCH));

		Employee employee = new Employee(1);
		database.get(employee, employee);

		Assertions.assertEquals("Annie", employee.getName());
		Assertions.assertEquals("eng", employee.getDepartment(), "Unpatched column should be untouched");
	}

	@Test
	public void testPatchWithNothingToPatchFails() {
		List<StatementLog> statementLogs = new CopyOnWriteArrayList<>();
		Database database = Database.withDataSource(createInMemoryDataSource("testPatchWithNothingToPatchFails"))
				.statementLogger(statementLogs::add)
				.build();

		Employee employee = new Employee(1);

		Assertions.assertThrows(BadParameterException.class, () -> database.patch(employee, employee, employee));
		Assertions.assertTrue(statementLogs.isEmpty(), "No statement should run when there is nothing to patch");
	}

	@Test
	public void testUnsupportedOperationThrowsNotImplemented() {
		Database database = createDatabase("testUnsupportedOperationThrowsNotImplemented");

		Employee employee = new Employee(1);

		NotImplementedException e = Assertions.assertThrows(NotImplementedException.class, () -> database.delete(employee, employee));
		Assertions.assertTrue(e.getMessage().contains("DELETE"), "Message should name the operation");
		Assertions.assertThrows(NotImplementedException.class, () -> database.insert(employee, employee));
	}

	@Test
	public void testListWithCountAndPagination() {
		Database database = createDatabase("testListWithCountAndPagination");

		EmployeeList employees = new EmployeeList("eng", new OffsetLimit(1, 2L));
		database.list(employees, employees);

		Assertions.assertEquals(3L, employees.getCount(), "Count should ignore pagination");
		Assertions.assertEquals(List.of("Cat", "Eve"), employees.getNames());
	}

	@Test
	public void testListWithPlainReader() {
		Database database = createDatabase("testListWithPlainReader");

		List<Integer> ids = new ArrayList<>();
		database.list(resultSet -> ids.add(resultSet.getInt("id")), (bind, operation) -> {
			bind.set(Conn.ORDER_BY_KEY, "ORDER BY id DESC");
			return "SELECT id FROM employee";
		});

		Assertions.assertEquals(List.of(4, 3, 2, 1), ids);
	}

	@Test
	public void testListDoesNotLeakReservedFragments() {
		Database database = createDatabase("testListDoesNotLeakReservedFragments");
		Conn conn = database.conn();

		EmployeeList firstPage = new EmployeeList(null, new OffsetLimit(0, 1L));
		conn.list(firstPage, firstPage);
		Assertions.assertEquals(1, firstPage.getNames().size());

		List<String> names = new ArrayList<>();
		conn.list(resultSet -> names.add(resultSet.getString("name")), (bind, operation) -> "SELECT name FROM employee");

		Assertions.assertEquals(4, names.size(), "Previous list's pagination leaked into this one");
		Assertions.assertEquals(Optional.of(""), conn.bind().get(Conn.OFFSET_LIMIT_KEY));
		Assertions.assertEquals(Optional.of(""), conn.bind().get(Conn.ORDER_BY_KEY));
	}

	@Test
	public void testListScanFailureAbortsImmediately() {
		Database database = createDatabase("testListScanFailureAbortsImmediately");
		List<Integer> scanned = new ArrayList<>();

		IllegalStateException e = Assertions.assertThrows(IllegalStateException.class, () ->
				database.list(resultSet -> {
					scanned.add(resultSet.getInt("id"));
					throw new IllegalStateException("bad row");
				}, (bind, operation) -> "SELECT id FROM employee"));

		Assertions.assertEquals("bad row", e.getMessage(), "Reader failure should pass through unchanged");
		Assertions.assertEquals(1, scanned.size());
	}

	@Test
	public void testWithForksBindStore() {
		Database database = createDatabase("testWithForksBindStore");

		Conn parent = database.with("department", "eng");
		Conn child = parent.with("department", "ops", "extra", true);

		Assertions.assertEquals(Optional.of("eng"), parent.bind().get("department"));
		Assertions.assertEquals(Optional.of("ops"), child.bind().get("department"));
		Assertions.assertFalse(parent.bind().has("extra"));

		child.bind().set("name", "x");
		Assertions.assertFalse(parent.bind().has("name"));
		Assertions.assertFalse(database.bind().has("department"), "Forks must not write back to the database defaults");
	}

	@Test
	public void testBuilderBindSeedsConnections() {
		Database database = Database.withDataSource(createInMemoryDataSource("testBuilderBindSeedsConnections"))
				.bind("department", "ops")
				.build();

		createTestSchema(database);

		List<String> names = new ArrayList<>();
		database.list(resultSet -> names.add(resultSet.getString("name")),
				(bind, operation) -> "SELECT name FROM employee WHERE department = ${'department'}");

		Assertions.assertEquals(List.of("Bob"), names);
	}

	@Test
	public void testTransactionCommits() {
		Database database = createDatabase("testTransactionCommits");

		database.tx(conn -> conn.with("id", 5, "name", "Flo").exec("INSERT INTO employee (id, name) VALUES (@id, @name)"));

		Employee employee = new Employee(5);
		database.get(employee, employee);
		Assertions.assertEquals("Flo", employee.getName());
	}

	@Test
	public void testTransactionRollbackLeavesNoRows() {
		Database database = createDatabase("testTransactionRollbackLeavesNoRows");

		IllegalStateException e = Assertions.assertThrows(IllegalStateException.class, () -> database.tx(conn -> {
			conn.with("id", 5, "name", "Flo").exec("INSERT INTO employee (id, name) VALUES (@id, @name)");
			conn.with("id", 6, "name", "Gus").exec("INSERT INTO employee (id, name) VALUES (@id, @name)");
			throw new IllegalStateException("fail");
		}));

		Assertions.assertEquals("fail", e.getMessage());

		Employee employee = new Employee(5);
		Assertions.assertThrows(NotFoundException.class, () -> database.get(employee, employee));
		Employee other = new Employee(6);
		Assertions.assertThrows(NotFoundException.class, () -> database.get(other, other));
	}

	@Test
	public void testTransactionWrapsCheckedExceptions() {
		Database database = createDatabase("testTransactionWrapsCheckedExceptions");
		Exception failure = new Exception("checked");

		DatabaseException e = Assertions.assertThrows(DatabaseException.class, () -> database.tx(conn -> {
			throw failure;
		}));

		Assertions.assertSame(failure, e.getCause());
	}

	@Test
	public void testNestedTransactionRollsBackToSavepoint() {
		Database database = createDatabase("testNestedTransactionRollsBackToSavepoint");

		database.tx(conn -> {
			conn.with("id", 5, "name", "Flo").exec("INSERT INTO employee (id, name) VALUES (@id, @name)");

			Assertions.assertThrows(IllegalStateException.class, () -> conn.tx(nested -> {
				nested.with("id", 6, "name", "Gus").exec("INSERT INTO employee (id, name) VALUES (@id, @name)");
				throw new IllegalStateException("inner");
			}));

			conn.tx(nested -> nested.with("id", 7, "name", "Hal").exec("INSERT INTO employee (id, name) VALUES (@id, @name)"));
		});

		Employee flo = new Employee(5);
		database.get(flo, flo);
		Assertions.assertEquals("Flo", flo.getName());

		Employee gus = new Employee(6);
		Assertions.assertThrows(NotFoundException.class, () -> database.get(gus, gus), "Inner rollback should discard its row");

		Employee hal = new Employee(7);
		database.get(hal, hal);
		Assertions.assertEquals("Hal", hal.getName());
	}

	@Test
	public void testCompletedTransactionRejectsUse() {
		Database database = createDatabase("testCompletedTransactionRejectsUse");
		List<Conn> leaked = new ArrayList<>();

		database.tx(leaked::add);

		Assertions.assertThrows(DatabaseException.class, () -> leaked.get(0).exec("DELETE FROM employee"));

		List<String> names = new ArrayList<>();
		database.list(resultSet -> names.add(resultSet.getString("name")), (bind, operation) -> "SELECT name FROM employee");
		Assertions.assertEquals(4, names.size());
	}

	@Test
	public void testStatementLogging() {
		List<StatementLog> statementLogs = new CopyOnWriteArrayList<>();
		Database database = Database.withDataSource(createInMemoryDataSource("testStatementLogging"))
				.statementLogger(statementLogs::add)
				.build();

		createTestSchema(database);
		statementLogs.clear();

		Employee employee = new Employee(1);
		database.get(employee, employee);

		Assertions.assertEquals(1, statementLogs.size());

		StatementLog statementLog = statementLogs.get(0);

		Assertions.assertEquals("SELECT id, name, department FROM employee WHERE id = ?", statementLog.getSql());
		Assertions.assertEquals("SELECT id, name, department FROM employee WHERE id = @id", statementLog.getTemplate());
		Assertions.assertEquals(List.of(1), statementLog.getParameters());
		Assertions.assertTrue(statementLog.getConnectionAcquisitionDuration().isPresent());
		Assertions.assertTrue(statementLog.getExecutionDuration().isPresent());
		Assertions.assertTrue(statementLog.getException().isEmpty());

		Employee missing = new Employee(99);
		Assertions.assertThrows(NotFoundException.class, () -> database.get(missing, missing));
		Assertions.assertTrue(statementLogs.get(1).getException().orElse(null) instanceof NotFoundException);
	}

	@Test
	public void testStatementLoggerFailureDoesNotMaskStatementFailure() {
		IllegalStateException loggerFailure = new IllegalStateException("logger");
		Database database = Database.withDataSource(createInMemoryDataSource("testStatementLoggerFailureDoesNotMaskStatementFailure"))
				.statementLogger(statementLog -> {
					if (statementLog.getException().isPresent())
						throw loggerFailure;
				})
				.build();

		createTestSchema(database);

		Employee employee = new Employee(99);
		NotFoundException e = Assertions.assertThrows(NotFoundException.class, () -> database.get(employee, employee));

		Assertions.assertEquals(1, e.getSuppressed().length);
		Assertions.assertSame(loggerFailure, e.getSuppressed()[0]);
	}

	@Test
	public void testDriverErrorsAreWrapped() {
		Database database = createDatabase("testDriverErrorsAreWrapped");

		DatabaseException e = Assertions.assertThrows(DatabaseException.class, () -> database.exec("SELECT * FROM no_such_table"));

		Assertions.assertTrue(e.getCause() instanceof SQLException);
		Assertions.assertTrue(e.getSqlState().isPresent(), "SQLState should be carried over");
	}

	@Test
	public void testInterruptedThreadFailsFast() {
		Database database = createDatabase("testInterruptedThreadFailsFast");
		Employee employee = new Employee(1);

		Thread.currentThread().interrupt();

		try {
			DatabaseException e = Assertions.assertThrows(DatabaseException.class, () -> database.get(employee, employee));
			Assertions.assertTrue(e.getCause() instanceof InterruptedException);
			Assertions.assertTrue(Thread.currentThread().isInterrupted(), "Interrupt flag should stay set");
		} finally {
			Thread.interrupted();
		}
	}

	@Test
	public void testInterruptCancelsRunningStatement() throws InterruptedException {
		AtomicBoolean slowQueries = new AtomicBoolean(false);
		CountDownLatch executing = new CountDownLatch(1);
		CountDownLatch cancelled = new CountDownLatch(1);

		DataSource dataSource = new InterceptingDataSource(createInMemoryDataSource("testInterruptCancelsRunningStatement"), (preparedStatement, method, args) -> {
			if ("cancel".equals(method.getName())) {
				cancelled.countDown();
				return null;
			}

			if (!"executeQuery".equals(method.getName()) || !slowQueries.get())
				return invoke(method, preparedStatement, args);

			executing.countDown();

			// Like a driver blocked on a socket read: deaf to interrupts, only a cancel ends it early
			long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);

			while (cancelled.getCount() > 0 && System.nanoTime() - deadline < 0)
				LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(5));

			if (cancelled.getCount() == 0)
				throw new SQLException("canceling statement due to user request", "57014");

			return invoke(method, preparedStatement, args);
		});

		Database database = Database.withDataSource(dataSource).build();
		createTestSchema(database);
		slowQueries.set(true);

		AtomicReference<Throwable> failure = new AtomicReference<>();
		AtomicBoolean interruptFlagKept = new AtomicBoolean(false);
		Employee employee = new Employee(1);

		Thread worker = new Thread(() -> {
			try {
				database.get(employee, employee);
			} catch (Throwable t) {
				failure.set(t);
			}

			interruptFlagKept.set(Thread.currentThread().isInterrupted());
		});

		worker.start();
		Assertions.assertTrue(executing.await(5, TimeUnit.SECONDS), "Statement never started");

		long interruptTime = System.nanoTime();
		worker.interrupt();
		worker.join(TimeUnit.SECONDS.toMillis(5));

		Assertions.assertFalse(worker.isAlive(), "Interrupted statement should have been abandoned");
		Assertions.assertTrue(System.nanoTime() - interruptTime < TimeUnit.SECONDS.toNanos(5));
		Assertions.assertEquals(0, cancelled.getCount(), "Running statement should have been cancelled");

		Assertions.assertTrue(failure.get() instanceof DatabaseException, "Expected a DatabaseException but got " + failure.get());
		Assertions.assertTrue(failure.get().getCause() instanceof InterruptedException);
		Assertions.assertEquals(1, failure.get().getSuppressed().length, "Driver's cancellation error should be kept");
		Assertions.assertEquals("57014", ((SQLException) failure.get().getSuppressed()[0]).getSQLState());
		Assertions.assertNull(employee.getName(), "Nothing should have been scanned");
		Assertions.assertTrue(interruptFlagKept.get(), "Interrupt flag should stay set");
	}

	@Test
	public void testInterruptDuringRoundTripFailsStatement() {
		AtomicBoolean interruptAfterExecute = new AtomicBoolean(false);

		DataSource dataSource = new InterceptingDataSource(createInMemoryDataSource("testInterruptDuringRoundTripFailsStatement"), (preparedStatement, method, args) -> {
			if ("cancel".equals(method.getName()))
				return null;

			Object result = invoke(method, preparedStatement, args);

			// The interrupt lands just as the driver hands back its result
			if ("execute".equals(method.getName()) && interruptAfterExecute.get())
				Thread.currentThread().interrupt();

			return result;
		});

		Database database = Database.withDataSource(dataSource).build();
		createTestSchema(database);
		interruptAfterExecute.set(true);

		try {
			DatabaseException e = Assertions.assertThrows(DatabaseException.class,
					() -> database.exec("UPDATE employee SET name = 'Zed' WHERE id = 1"));

			Assertions.assertTrue(e.getCause() instanceof InterruptedException, "Success must not be reported after an interrupt");
			Assertions.assertTrue(Thread.currentThread().isInterrupted(), "Interrupt flag should stay set");
		} finally {
			Thread.interrupted();
		}
	}

	@Test
	public void testQueryTimeoutIsApplied() {
		List<Integer> queryTimeouts = new CopyOnWriteArrayList<>();
		DataSource dataSource = new InterceptingDataSource(createInMemoryDataSource("testQueryTimeoutIsApplied"), (preparedStatement, method, args) -> {
			if ("setQueryTimeout".equals(method.getName()))
				queryTimeouts.add((Integer) args[0]);

			return invoke(method, preparedStatement, args);
		});
		Database database = Database.withDataSource(dataSource)
				.queryTimeout(Duration.ofMillis(1500))
				.build();

		createTestSchema(database);
		queryTimeouts.clear();

		Employee employee = new Employee(1);
		database.get(employee, employee);
		database.withTimeout(Duration.ofSeconds(30)).get(employee, employee);
		database.withTimeout(null).get(employee, employee);

		Assertions.assertEquals(List.of(2, 30), queryTimeouts, "Timeouts should round up to whole seconds");
		Assertions.assertThrows(IllegalArgumentException.class, () -> database.withTimeout(Duration.ofSeconds(-1)));
	}

	@Test
	public void testPing() {
		Database database = createDatabase("testPing");
		Assertions.assertTrue(database.ping());
	}

	@Nonnull
	protected Database createDatabase(@Nonnull String databaseName) {
		requireNonNull(databaseName);

		Database database = Database.withDataSource(createInMemoryDataSource(databaseName)).build();
		createTestSchema(database);
		return database;
	}

	protected void createTestSchema(@Nonnull Database database) {
		requireNonNull(database);

		database.exec("""
				CREATE TABLE employee (
				  id INT PRIMARY KEY,
				  name VARCHAR(255) NOT NULL,
				  department VARCHAR(255)
				)
				""");

		database.exec("INSERT INTO employee VALUES (1, 'Ann', 'eng')");
		database.exec("INSERT INTO employee VALUES (2, 'Bob', 'ops')");
		database.exec("INSERT INTO employee VALUES (3, 'Cat', 'eng')");
		database.exec("INSERT INTO employee VALUES (4, 'Eve', 'eng')");
	}

	@Nonnull
	protected DataSource createInMemoryDataSource(@Nonnull String databaseName) {
		requireNonNull(databaseName);

		JDBCDataSource dataSource = new JDBCDataSource();
		dataSource.setUrl(format("jdbc:hsqldb:mem:%s", databaseName));
		dataSource.setUser("sa");
		dataSource.setPassword("");

		return dataSource;
	}

	@Nullable
	private static Object invoke(@Nonnull Method method,
															 @Nonnull Object target,
															 @Nullable Object[] args) throws Throwable {
		requireNonNull(method);
		requireNonNull(target);

		try {
			return method.invoke(target, args);
		} catch (InvocationTargetException e) {
			throw e.getCause();
		}
	}

	/**
	 * Sees every call made on a prepared statement before deciding whether to pass it to the real one.
	 */
	@FunctionalInterface
	private interface StatementInterceptor {
		@Nullable
		Object intercept(@Nonnull PreparedStatement preparedStatement,
										 @Nonnull Method method,
										 @Nullable Object[] args) throws Throwable;
	}

	private static final class InterceptingDataSource implements DataSource {
		@Nonnull
		private final DataSource delegate;
		@Nonnull
		private final StatementInterceptor statementInterceptor;

		private InterceptingDataSource(@Nonnull DataSource delegate,
																	 @Nonnull StatementInterceptor statementInterceptor) {
			this.delegate = requireNonNull(delegate);
			this.statementInterceptor = requireNonNull(statementInterceptor);
		}

		@Override
		public Connection getConnection() throws SQLException {
			return wrapConnection(this.delegate.getConnection());
		}

		@Override
		public Connection getConnection(String username, String password) throws SQLException {
			return wrapConnection(this.delegate.getConnection(username, password));
		}

		@Override
		public PrintWriter getLogWriter() throws SQLException {
			return this.delegate.getLogWriter();
		}

		@Override
		public void setLogWriter(PrintWriter out) throws SQLException {
			this.delegate.setLogWriter(out);
		}

		@Override
		public void setLoginTimeout(int seconds) throws SQLException {
			this.delegate.setLoginTimeout(seconds);
		}

		@Override
		public int getLoginTimeout() throws SQLException {
			return this.delegate.getLoginTimeout();
		}

		@Override
		public Logger getParentLogger() throws SQLFeatureNotSupportedException {
			return this.delegate.getParentLogger();
		}

		@Override
		public <T> T unwrap(Class<T> iface) throws SQLException {
			if (iface.isInstance(this))
				return iface.cast(this);

			return this.delegate.unwrap(iface);
		}

		@Override
		public boolean isWrapperFor(Class<?> iface) throws SQLException {
			return iface.isInstance(this) || this.delegate.isWrapperFor(iface);
		}

		private Connection wrapConnection(@Nonnull Connection connection) {
			requireNonNull(connection);

			return (Connection) Proxy.newProxyInstance(
					Connection.class.getClassLoader(),
					new Class<?>[]{Connection.class},
					(proxy, method, args) -> {
						Object result = invoke(method, connection, args);

						if (result instanceof PreparedStatement && "prepareStatement".equals(method.getName()))
							return wrapPreparedStatement((PreparedStatement) result);

						return result;
					});
		}

		private PreparedStatement wrapPreparedStatement(@Nonnull PreparedStatement preparedStatement) {
			requireNonNull(preparedStatement);

			return (PreparedStatement) Proxy.newProxyInstance(
					PreparedStatement.class.getClassLoader(),
					new Class<?>[]{PreparedStatement.class},
					(proxy, method, args) -> this.statementInterceptor.intercept(preparedStatement, method, args));
		}
	}
}
