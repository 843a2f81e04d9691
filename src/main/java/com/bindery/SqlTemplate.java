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
import java.util.List;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Expands {@code ${...}} placeholders in a query template using the current contents of a {@link Bind}.
 * <p>
 * Supported forms:
 * <ul>
 *   <li>{@code ${key}} - the value's string form, unquoted. Intended for SQL fragments such as {@code ORDER BY}
 *   clauses, never for untrusted input</li>
 *   <li>{@code ${'key'}} - the value as a single-quoted literal. A sequence of strings renders as a comma-separated
 *   list of individually quoted literals, for use in {@code IN (...)}</li>
 *   <li>{@code ${"key"}} - the value as a double-quoted identifier</li>
 *   <li>{@code $1}, {@code ${1}} - positional parameters are passed through unchanged</li>
 *   <li>{@code $$}, {@code ${$}} - rendered as {@code $$}</li>
 * </ul>
 * Any other {@code $} is copied verbatim, so dollar-quoted bodies ({@code $fn$ ... $fn$}) are left alone.
 * Unset keys and {@code null} values render as the empty string. Expansion never fails.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class SqlTemplate {
	private SqlTemplate() {
		// Non-instantiable
	}

	/**
	 * Expands all placeholders in {@code template}.
	 *
	 * @param template the query template
	 * @param bind     the variables to substitute
	 * @return the expanded SQL
	 */
	@NonNull
	public static String expand(@NonNull String template,
															@NonNull Bind bind) {
		requireNonNull(template);
		requireNonNull(bind);

		if (template.indexOf('$') == -1)
			return template;

		StringBuilder sql = new StringBuilder(template.length() + 16);

		for (int i = 0; i < template.length(); ) {
			char c = template.charAt(i);

			if (c != '$' || i + 1 >= template.length()) {
				sql.append(c);
				++i;
				continue;
			}

			char next = template.charAt(i + 1);

			if (next == '$') {
				sql.append("$$");
				i += 2;
				continue;
			}

			if (Character.isDigit(next)) {
				// Positional parameters are the driver's business, one digit at a time
				sql.append('$').append(next);
				i += 2;
				continue;
			}

			if (next == '{') {
				int end = template.indexOf('}', i + 2);

				if (end != -1 && end > i + 2) {
					sql.append(substitute(template.substring(i + 2, end), bind));
					i = end + 1;
					continue;
				}
			}

			sql.append(c);
			++i;
		}

		return sql.toString();
	}

	/**
	 * Quotes {@code value} as a SQL string literal, doubling embedded single quotes.
	 *
	 * @param value the value to quote
	 * @return the quoted literal
	 */
	@NonNull
	public static String quote(@NonNull String value) {
		requireNonNull(value);
		return "'" + value.replace("'", "''") + "'";
	}

	/**
	 * Quotes {@code value} as a SQL identifier, doubling embedded double quotes.
	 *
	 * @param value the identifier to quote
	 * @return the quoted identifier
	 */
	@NonNull
	public static String quoteIdentifier(@NonNull String value) {
		requireNonNull(value);
		return "\"" + value.replace("\"", "\"\"") + "\"";
	}

	@NonNull
	private static String substitute(@NonNull String name,
																	 @NonNull Bind bind) {
		requireNonNull(name);
		requireNonNull(bind);

		if (name.equals("$"))
			return "$$";

		if (isNumeric(name))
			return "$" + name;

		if (isWrapped(name, '\'')) {
			Object value = bind.get(name.substring(1, name.length() - 1)).orElse(null);
			List<Object> elements = Bind.elementsOf(value).orElse(null);

			if (elements != null && elements.stream().allMatch(element -> element instanceof CharSequence))
				return elements.stream()
						.map(element -> quote(element.toString()))
						.collect(Collectors.joining(","));

			return quote(stringValue(value));
		}

		if (isWrapped(name, '"'))
			return quoteIdentifier(stringValue(bind.get(name.substring(1, name.length() - 1)).orElse(null)));

		return stringValue(bind.get(name).orElse(null));
	}

	@NonNull
	private static String stringValue(@Nullable Object value) {
		return value == null ? "" : value.toString();
	}

	private static boolean isNumeric(@NonNull String name) {
		for (int i = 0; i < name.length(); ++i)
			if (!Character.isDigit(name.charAt(i)))
				return false;

		return true;
	}

	private static boolean isWrapped(@NonNull String name,
																	 char quote) {
		return name.length() >= 2 && name.charAt(0) == quote && name.charAt(name.length() - 1) == quote;
	}
}
