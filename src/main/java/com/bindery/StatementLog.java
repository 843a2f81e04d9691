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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Diagnostics for one executed statement, handed to a {@link StatementLogger}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class StatementLog {
	@NonNull
	private final String template;
	@NonNull
	private final String sql;
	@NonNull
	private final List<@Nullable Object> parameters;
	@NonNull
	private final Duration totalDuration;
	@Nullable
	private final Duration connectionAcquisitionDuration;
	@Nullable
	private final Duration executionDuration;
	@Nullable
	private final Duration scanDuration;
	@Nullable
	private final Exception exception;

	private StatementLog(@NonNull Builder builder) {
		requireNonNull(builder);

		this.template = requireNonNull(builder.template);
		this.sql = requireNonNull(builder.sql);
		this.parameters = builder.parameters == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(builder.parameters));
		this.connectionAcquisitionDuration = builder.connectionAcquisitionDuration;
		this.executionDuration = builder.executionDuration;
		this.scanDuration = builder.scanDuration;
		this.exception = builder.exception;

		Duration totalDuration = Duration.ZERO;

		for (Duration duration : new Duration[]{this.connectionAcquisitionDuration, this.executionDuration, this.scanDuration})
			if (duration != null)
				totalDuration = totalDuration.plus(duration);

		this.totalDuration = totalDuration;
	}

	/**
	 * Creates a {@link StatementLog} builder.
	 *
	 * @param template the statement template as produced by a capability or caller
	 * @param sql      the SQL sent to the driver, after template expansion and parameter rewriting
	 * @return a {@link StatementLog} builder
	 */
	@NonNull
	public static Builder withSql(@NonNull String template,
																@NonNull String sql) {
		requireNonNull(template);
		requireNonNull(sql);

		return new Builder(template, sql);
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(8);

		components.add(format("sql=%s", getSql().replaceAll("\\s+", " ").trim()));

		if (getParameters().size() > 0)
			components.add(format("parameters=%s", getParameters()));

		components.add(format("totalDuration=%s", getTotalDuration()));
		getConnectionAcquisitionDuration().ifPresent(duration -> components.add(format("connectionAcquisitionDuration=%s", duration)));
		getExecutionDuration().ifPresent(duration -> components.add(format("executionDuration=%s", duration)));
		getScanDuration().ifPresent(duration -> components.add(format("scanDuration=%s", duration)));
		getException().ifPresent(exception -> components.add(format("exception=%s", exception)));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof StatementLog statementLog))
			return false;

		return Objects.equals(getTemplate(), statementLog.getTemplate())
				&& Objects.equals(getSql(), statementLog.getSql())
				&& Objects.equals(getParameters(), statementLog.getParameters())
				&& Objects.equals(getConnectionAcquisitionDuration(), statementLog.getConnectionAcquisitionDuration())
				&& Objects.equals(getExecutionDuration(), statementLog.getExecutionDuration())
				&& Objects.equals(getScanDuration(), statementLog.getScanDuration())
				&& Objects.equals(getException(), statementLog.getException());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getTemplate(), getSql(), getParameters(), getConnectionAcquisitionDuration(),
				getExecutionDuration(), getScanDuration(), getException());
	}

	/**
	 * The statement template before {@code ${...}} expansion.
	 *
	 * @return the template
	 */
	@NonNull
	public String getTemplate() {
		return this.template;
	}

	/**
	 * The SQL handed to the driver, with {@code @name} tokens rewritten to {@code ?}.
	 *
	 * @return the executed SQL
	 */
	@NonNull
	public String getSql() {
		return this.sql;
	}

	/**
	 * Values bound to the {@code ?} markers, in order.
	 *
	 * @return the bound values
	 */
	@NonNull
	public List<@Nullable Object> getParameters() {
		return this.parameters;
	}

	/**
	 * How long did it take to acquire a {@link java.sql.Connection}?
	 * <p>
	 * Only present for statements run outside a transaction, which borrow a connection per statement.
	 *
	 * @return how long it took to acquire a {@link java.sql.Connection}, if available
	 */
	@NonNull
	public Optional<Duration> getConnectionAcquisitionDuration() {
		return Optional.ofNullable(this.connectionAcquisitionDuration);
	}

	@NonNull
	public Optional<Duration> getExecutionDuration() {
		return Optional.ofNullable(this.executionDuration);
	}

	/**
	 * How long did the {@link Reader}s take to consume the {@link java.sql.ResultSet}?
	 *
	 * @return scan time, if the statement returned rows
	 */
	@NonNull
	public Optional<Duration> getScanDuration() {
		return Optional.ofNullable(this.scanDuration);
	}

	/**
	 * Sum of the connection acquisition, execution and scan durations.
	 *
	 * @return how long the statement took in total
	 */
	@NonNull
	public Duration getTotalDuration() {
		return this.totalDuration;
	}

	@NonNull
	public Optional<Exception> getException() {
		return Optional.ofNullable(this.exception);
	}

	/**
	 * Builder used to construct instances of {@link StatementLog}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final String template;
		@NonNull
		private final String sql;
		@Nullable
		private List<@Nullable Object> parameters;
		@Nullable
		private Duration connectionAcquisitionDuration;
		@Nullable
		private Duration executionDuration;
		@Nullable
		private Duration scanDuration;
		@Nullable
		private Exception exception;

		private Builder(@NonNull String template,
										@NonNull String sql) {
			this.template = requireNonNull(template);
			this.sql = requireNonNull(sql);
		}

		@NonNull
		public Builder parameters(@Nullable List<@Nullable Object> parameters) {
			this.parameters = parameters;
			return this;
		}

		@NonNull
		public Builder connectionAcquisitionDuration(@Nullable Duration connectionAcquisitionDuration) {
			this.connectionAcquisitionDuration = connectionAcquisitionDuration;
			return this;
		}

		@NonNull
		public Builder executionDuration(@Nullable Duration executionDuration) {
			this.executionDuration = executionDuration;
			return this;
		}

		@NonNull
		public Builder scanDuration(@Nullable Duration scanDuration) {
			this.scanDuration = scanDuration;
			return this;
		}

		@NonNull
		public Builder exception(@Nullable Exception exception) {
			this.exception = exception;
			return this;
		}

		@NonNull
		public StatementLog build() {
			return new StatementLog(this);
		}
	}
}
