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

import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Contract for binding {@link Bind} values to the {@code ?} markers of a {@link PreparedStatement}.
 * <p>
 * Acquire the stock implementation via {@link #withDefaultConfiguration()}, or implement your own to support
 * additional value types:
 * <pre>{@code  PreparedStatementBinder binder = (preparedStatement, parameterIndex, parameter) -> {
 *   if (parameter instanceof Money money)
 *     preparedStatement.setBigDecimal(parameterIndex, money.amount());
 *   else
 *     PreparedStatementBinder.withDefaultConfiguration().bindParameter(preparedStatement, parameterIndex, parameter);
 * };}</pre>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface PreparedStatementBinder {
	/**
	 * Binds a single parameter.
	 *
	 * @param preparedStatement the prepared statement to bind to
	 * @param parameterIndex    the 1-based index of the marker
	 * @param parameter         the value, {@code null} for unset or null-valued variables
	 * @throws SQLException if an error occurs during binding
	 */
	void bindParameter(@NonNull PreparedStatement preparedStatement,
										 int parameterIndex,
										 @Nullable Object parameter) throws SQLException;

	/**
	 * Acquires the stock implementation. The returned instance is thread-safe.
	 *
	 * @return the default binder
	 */
	@NonNull
	static PreparedStatementBinder withDefaultConfiguration() {
		return DefaultPreparedStatementBinder.INSTANCE;
	}
}
