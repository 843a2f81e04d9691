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
import java.sql.ParameterMetaData;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Currency;
import java.util.Date;
import java.util.Locale;
import java.util.TimeZone;

import static java.util.Objects.requireNonNull;

/**
 * Stock implementation of {@link PreparedStatementBinder}.
 * <p>
 * Handles {@code java.time} values, legacy {@link Date}s, enums (by {@link Enum#name()}) and
 * {@link Locale}/{@link ZoneId}/{@link TimeZone}/{@link Currency} (by their string identifiers);
 * everything else, {@link java.util.UUID} included, goes to {@link PreparedStatement#setObject(int, Object)} unchanged.
 * {@code null} binds as a typed SQL {@code NULL} where the driver can infer the marker's type.
 *
 * @since 1.0.0
 */
@ThreadSafe
final class DefaultPreparedStatementBinder implements PreparedStatementBinder {
	@NonNull
	static final DefaultPreparedStatementBinder INSTANCE = new DefaultPreparedStatementBinder();

	private DefaultPreparedStatementBinder() {}

	@Override
	public void bindParameter(@NonNull PreparedStatement preparedStatement,
														int parameterIndex,
														@Nullable Object parameter) throws SQLException {
		requireNonNull(preparedStatement);

		if (parameter == null) {
			bindNull(preparedStatement, parameterIndex);
			return;
		}

		Object normalizedParameter = normalizeParameter(parameter);

		if (normalizedParameter instanceof Instant instant) {
			if (!trySetObject(preparedStatement, parameterIndex, instant.atOffset(java.time.ZoneOffset.UTC), Types.TIMESTAMP_WITH_TIMEZONE))
				preparedStatement.setTimestamp(parameterIndex, Timestamp.from(instant));

			return;
		}

		if (normalizedParameter instanceof OffsetDateTime offsetDateTime) {
			if (!trySetObject(preparedStatement, parameterIndex, offsetDateTime, Types.TIMESTAMP_WITH_TIMEZONE))
				preparedStatement.setTimestamp(parameterIndex, Timestamp.from(offsetDateTime.toInstant()));

			return;
		}

		if (normalizedParameter instanceof LocalDateTime localDateTime) {
			if (!trySetObject(preparedStatement, parameterIndex, localDateTime, Types.TIMESTAMP))
				preparedStatement.setTimestamp(parameterIndex, Timestamp.valueOf(localDateTime));

			return;
		}

		if (normalizedParameter instanceof LocalDate localDate) {
			if (!trySetObject(preparedStatement, parameterIndex, localDate, Types.DATE))
				preparedStatement.setDate(parameterIndex, java.sql.Date.valueOf(localDate));

			return;
		}

		if (normalizedParameter instanceof LocalTime localTime) {
			// Some drivers offset LocalTime; a tz-free string is the safest form
			preparedStatement.setString(parameterIndex, localTime.toString());
			return;
		}

		preparedStatement.setObject(parameterIndex, normalizedParameter);
	}

	private void bindNull(@NonNull PreparedStatement preparedStatement,
												int parameterIndex) throws SQLException {
		requireNonNull(preparedStatement);

		// Prefer the type the driver inferred for the marker
		try {
			ParameterMetaData parameterMetaData = preparedStatement.getParameterMetaData();

			if (parameterMetaData != null) {
				preparedStatement.setNull(parameterIndex, parameterMetaData.getParameterType(parameterIndex));
				return;
			}
		} catch (SQLFeatureNotSupportedException | AbstractMethodError e) {
			// Fall through to an untyped null
		}

		preparedStatement.setNull(parameterIndex, Types.NULL);
	}

	@NonNull
	private Object normalizeParameter(@NonNull Object parameter) {
		requireNonNull(parameter);

		if (parameter instanceof ZonedDateTime zonedDateTime)
			return zonedDateTime.toOffsetDateTime();
		if (parameter instanceof java.sql.Timestamp || parameter instanceof java.sql.Date || parameter instanceof java.sql.Time)
			return parameter;
		if (parameter instanceof Date date)
			return date.toInstant();
		if (parameter instanceof Locale locale)
			return locale.toLanguageTag();
		if (parameter instanceof Currency currency)
			return currency.getCurrencyCode();
		if (parameter instanceof ZoneId zoneId)
			return zoneId.getId();
		if (parameter instanceof TimeZone timeZone)
			return timeZone.getID();
		if (parameter instanceof Enum<?> e)
			return e.name();

		return parameter;
	}

	private boolean trySetObject(@NonNull PreparedStatement preparedStatement,
															 int parameterIndex,
															 @NonNull Object value,
															 int sqlType) throws SQLException {
		try {
			preparedStatement.setObject(parameterIndex, value, sqlType);
			return true;
		} catch (SQLFeatureNotSupportedException e) {
			return false;
		}
	}
}
