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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;

/**
 * Thrown when an error occurs when interacting with the database.
 * <p>
 * Driver failures are wrapped as-is: the {@code cause} is the original {@link SQLException}, and
 * {@link #getErrorCode()} and {@link #getSqlState()} are shorthand for its values. When the cause is a PostgreSQL
 * server error, the server-reported fields ({@link #getConstraint()}, {@link #getDetail()} and friends) are exposed too.
 * <p>
 * The subclasses {@link NotFoundException}, {@link NotImplementedException} and {@link BadParameterException}
 * are raised by this library and its capability implementations; everything else is a pass-through.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class DatabaseException extends RuntimeException {
	@Nullable
	private final Integer errorCode;
	@Nullable
	private final String sqlState;
	@Nullable
	private final String column;
	@Nullable
	private final String constraint;
	@Nullable
	private final String detail;
	@Nullable
	private final String hint;
	@Nullable
	private final String dbmsMessage;
	@Nullable
	private final String schema;
	@Nullable
	private final String severity;
	@Nullable
	private final String table;

	/**
	 * Creates a {@code DatabaseException} with the given {@code message}.
	 *
	 * @param message a message describing this exception
	 */
	public DatabaseException(@Nullable String message) {
		this(message, null);
	}

	/**
	 * Creates a {@code DatabaseException} which wraps the given {@code cause}.
	 *
	 * @param cause the cause of this exception
	 */
	public DatabaseException(@Nullable Throwable cause) {
		this(cause == null ? null : cause.getMessage(), cause);
	}

	/**
	 * Creates a {@code DatabaseException} which wraps the given {@code cause}.
	 *
	 * @param message a message describing this exception
	 * @param cause   the cause of this exception
	 */
	public DatabaseException(@Nullable String message,
													 @Nullable Throwable cause) {
		super(message, cause);

		Integer errorCode = null;
		String sqlState = null;
		String column = null;
		String constraint = null;
		String detail = null;
		String hint = null;
		String dbmsMessage = null;
		String schema = null;
		String severity = null;
		String table = null;

		SQLException sqlException = findSqlException(cause).orElse(null);

		if (sqlException != null) {
			errorCode = sqlException.getErrorCode();
			sqlState = sqlException.getSQLState();

			// Avoid a hard dependency on the Postgres driver being loaded
			if ("org.postgresql.util.PSQLException".equals(sqlException.getClass().getName())) {
				org.postgresql.util.ServerErrorMessage serverErrorMessage = ((org.postgresql.util.PSQLException) sqlException).getServerErrorMessage();

				if (serverErrorMessage != null) {
					column = serverErrorMessage.getColumn();
					constraint = serverErrorMessage.getConstraint();
					detail = serverErrorMessage.getDetail();
					hint = serverErrorMessage.getHint();
					dbmsMessage = serverErrorMessage.getMessage();
					schema = serverErrorMessage.getSchema();
					severity = serverErrorMessage.getSeverity();
					table = serverErrorMessage.getTable();

					if (serverErrorMessage.getSQLState() != null)
						sqlState = serverErrorMessage.getSQLState();
				}
			}
		}

		this.errorCode = errorCode;
		this.sqlState = sqlState;
		this.column = column;
		this.constraint = constraint;
		this.detail = detail;
		this.hint = hint;
		this.dbmsMessage = dbmsMessage;
		this.schema = schema;
		this.severity = severity;
		this.table = table;
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(12);

		if (getMessage() != null && getMessage().trim().length() > 0)
			components.add(format("message=%s", getMessage()));

		getErrorCode().ifPresent(value -> components.add(format("errorCode=%s", value)));
		getSqlState().ifPresent(value -> components.add(format("sqlState=%s", value)));
		getSeverity().ifPresent(value -> components.add(format("severity=%s", value)));
		getSchema().ifPresent(value -> components.add(format("schema=%s", value)));
		getTable().ifPresent(value -> components.add(format("table=%s", value)));
		getColumn().ifPresent(value -> components.add(format("column=%s", value)));
		getConstraint().ifPresent(value -> components.add(format("constraint=%s", value)));
		getDetail().ifPresent(value -> components.add(format("detail=%s", value)));
		getHint().ifPresent(value -> components.add(format("hint=%s", value)));
		getDbmsMessage().ifPresent(value -> components.add(format("dbmsMessage=%s", value)));

		return format("%s: %s", getClass().getName(), components.stream().collect(Collectors.joining(", ")));
	}

	/**
	 * Shorthand for {@link SQLException#getErrorCode()} if this exception was caused by a {@link SQLException}.
	 *
	 * @return the value of {@link SQLException#getErrorCode()}, or empty if not available
	 */
	@Nonnull
	public Optional<Integer> getErrorCode() {
		return Optional.ofNullable(this.errorCode);
	}

	/**
	 * Shorthand for {@link SQLException#getSQLState()} if this exception was caused by a {@link SQLException}.
	 * <p>
	 * A cancelled or timed-out PostgreSQL statement reports {@code 57014}.
	 *
	 * @return the value of {@link SQLException#getSQLState()}, or empty if not available
	 */
	@Nonnull
	public Optional<String> getSqlState() {
		return Optional.ofNullable(this.sqlState);
	}

	/**
	 * @return the offending {@code column}, or empty if not available
	 */
	@Nonnull
	public Optional<String> getColumn() {
		return Optional.ofNullable(this.column);
	}

	/**
	 * @return the violated {@code constraint}, or empty if not available
	 */
	@Nonnull
	public Optional<String> getConstraint() {
		return Optional.ofNullable(this.constraint);
	}

	/**
	 * @return the server's error {@code detail}, or empty if not available
	 */
	@Nonnull
	public Optional<String> getDetail() {
		return Optional.ofNullable(this.detail);
	}

	/**
	 * @return the server's error {@code hint}, or empty if not available
	 */
	@Nonnull
	public Optional<String> getHint() {
		return Optional.ofNullable(this.hint);
	}

	/**
	 * @return the server's primary error message, or empty if not available
	 */
	@Nonnull
	public Optional<String> getDbmsMessage() {
		return Optional.ofNullable(this.dbmsMessage);
	}

	@Nonnull
	public Optional<String> getSchema() {
		return Optional.ofNullable(this.schema);
	}

	@Nonnull
	public Optional<String> getSeverity() {
		return Optional.ofNullable(this.severity);
	}

	@Nonnull
	public Optional<String> getTable() {
		return Optional.ofNullable(this.table);
	}

	@Nonnull
	private static Optional<SQLException> findSqlException(@Nullable Throwable cause) {
		Throwable current = cause;

		while (current != null) {
			if (current instanceof SQLException sqlException)
				return Optional.of(sqlException);

			current = current.getCause();
		}

		return Optional.empty();
	}
}
