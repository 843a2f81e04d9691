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
import java.util.ArrayList;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Expanded SQL with its {@code @name} parameter tokens rewritten to JDBC {@code ?} markers.
 * <p>
 * Tokens inside string literals, quoted identifiers, comments and dollar-quoted bodies are left alone, as are
 * PostgreSQL operators that merely contain {@code @} ({@code @>}, {@code <@}, {@code @@}).
 * A bare {@code ?} is rejected since nothing could bind it; {@code ??} is passed through for drivers that treat it
 * as an escaped question mark.
 *
 * @since 1.0.0
 */
@ThreadSafe
final class NamedParameterSql {
	@NonNull
	private final String sql;
	@NonNull
	private final List<@NonNull String> parameterNames;

	private NamedParameterSql(@NonNull String sql,
														@NonNull List<@NonNull String> parameterNames) {
		requireNonNull(sql);
		requireNonNull(parameterNames);

		this.sql = sql;
		this.parameterNames = parameterNames;
	}

	private enum Mode {
		CODE,
		SINGLE_QUOTE,
		ESCAPED_SINGLE_QUOTE,
		DOUBLE_QUOTE,
		LINE_COMMENT,
		BLOCK_COMMENT,
		DOLLAR_QUOTE
	}

	@NonNull
	static NamedParameterSql parse(@NonNull String sql) {
		requireNonNull(sql);

		if (sql.indexOf('@') == -1 && sql.indexOf('?') == -1)
			return new NamedParameterSql(sql, List.of());

		StringBuilder rewritten = new StringBuilder(sql.length());
		List<String> parameterNames = new ArrayList<>();
		Mode mode = Mode.CODE;
		String dollarTag = null;
		int i = 0;

		while (i < sql.length()) {
			char c = sql.charAt(i);
			char next = i + 1 < sql.length() ? sql.charAt(i + 1) : '\0';

			switch (mode) {
				case SINGLE_QUOTE, ESCAPED_SINGLE_QUOTE -> {
					if (mode == Mode.ESCAPED_SINGLE_QUOTE && c == '\\' && i + 1 < sql.length()) {
						rewritten.append(c).append(next);
						i += 2;
					} else if (c == '\'' && next == '\'') {
						rewritten.append("''");
						i += 2;
					} else {
						if (c == '\'')
							mode = Mode.CODE;

						rewritten.append(c);
						++i;
					}
				}
				case DOUBLE_QUOTE -> {
					if (c == '"' && next == '"') {
						rewritten.append("\"\"");
						i += 2;
					} else {
						if (c == '"')
							mode = Mode.CODE;

						rewritten.append(c);
						++i;
					}
				}
				case LINE_COMMENT -> {
					if (c == '\n' || c == '\r')
						mode = Mode.CODE;

					rewritten.append(c);
					++i;
				}
				case BLOCK_COMMENT -> {
					if (c == '*' && next == '/') {
						rewritten.append("*/");
						i += 2;
						mode = Mode.CODE;
					} else {
						rewritten.append(c);
						++i;
					}
				}
				case DOLLAR_QUOTE -> {
					if (sql.startsWith(dollarTag, i)) {
						rewritten.append(dollarTag);
						i += dollarTag.length();
						dollarTag = null;
						mode = Mode.CODE;
					} else {
						rewritten.append(c);
						++i;
					}
				}
				case CODE -> {
					if (c == '-' && next == '-') {
						rewritten.append("--");
						i += 2;
						mode = Mode.LINE_COMMENT;
					} else if (c == '/' && next == '*') {
						rewritten.append("/*");
						i += 2;
						mode = Mode.BLOCK_COMMENT;
					} else if ((c == 'E' || c == 'e') && next == '\'' && !isIdentifierTail(sql, i)) {
						rewritten.append(c).append('\'');
						i += 2;
						mode = Mode.ESCAPED_SINGLE_QUOTE;
					} else if (c == '\'') {
						rewritten.append(c);
						++i;
						mode = Mode.SINGLE_QUOTE;
					} else if (c == '"') {
						rewritten.append(c);
						++i;
						mode = Mode.DOUBLE_QUOTE;
					} else if (c == '$' && (dollarTag = dollarQuoteTag(sql, i)) != null) {
						rewritten.append(dollarTag);
						i += dollarTag.length();
						mode = Mode.DOLLAR_QUOTE;
					} else if (c == '?') {
						if (next != '?')
							throw new IllegalArgumentException(format("Positional parameters ('?') are not supported. Bind values with %s#set and reference them as '@name'. SQL: %s",
									Bind.class.getSimpleName(), sql));

						rewritten.append("??");
						i += 2;
					} else if (c == '@' && next == '@') {
						// Text-search match operator, even when written without a following space
						rewritten.append("@@");
						i += 2;
					} else if (c == '@' && Character.isJavaIdentifierStart(next) && next != '$' && !isIdentifierTail(sql, i) && !isContainedByOperator(sql, i)) {
						int end = i + 2;

						while (end < sql.length() && isParameterNamePart(sql.charAt(end)))
							++end;

						parameterNames.add(sql.substring(i + 1, end));
						rewritten.append('?');
						i = end;
					} else {
						rewritten.append(c);
						++i;
					}
				}
			}
		}

		return new NamedParameterSql(rewritten.toString(), List.copyOf(parameterNames));
	}

	@NonNull
	String getSql() {
		return this.sql;
	}

	/**
	 * Parameter names in marker order; a name appears once per occurrence.
	 */
	@NonNull
	List<@NonNull String> getParameterNames() {
		return this.parameterNames;
	}

	private static boolean isParameterNamePart(char c) {
		return c != '$' && Character.isJavaIdentifierPart(c);
	}

	// e.g. the "e" in "name='x'" must not start an escape string, nor may "@" in "user@host" start a parameter
	private static boolean isIdentifierTail(@NonNull String sql,
																					int index) {
		return index > 0 && Character.isJavaIdentifierPart(sql.charAt(index - 1));
	}

	// "<@" is PostgreSQL's contained-by operator, so "a <@b" has no parameter
	private static boolean isContainedByOperator(@NonNull String sql,
																							 int index) {
		return index > 0 && sql.charAt(index - 1) == '<';
	}

	@Nullable
	private static String dollarQuoteTag(@NonNull String sql,
																			 int start) {
		requireNonNull(sql);

		// $$ or $tag$, where tag is an identifier that does not start with a digit ($1 is a positional parameter)
		if (start + 1 < sql.length() && Character.isDigit(sql.charAt(start + 1)))
			return null;

		if (isIdentifierTail(sql, start))
			return null;

		for (int i = start + 1; i < sql.length(); ++i) {
			char c = sql.charAt(i);

			if (c == '$')
				return sql.substring(start, i + 1);

			if (!Character.isLetterOrDigit(c) && c != '_')
				return null;
		}

		return null;
	}
}
