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
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Pagination request: an offset and an optional limit, rendered as a {@code LIMIT}/{@code OFFSET} fragment under the
 * reserved {@value Conn#OFFSET_LIMIT_KEY} variable that {@link Conn#list(Reader, Selector)} appends to list queries.
 * <p>
 * There is no unbounded list: {@link #bind(Bind, long)} always applies a maximum.
 * <pre>{@code
 * public String select(Bind bind, Operation operation) {
 *   this.offsetLimit.bind(bind, 100);
 *   return "SELECT id, name FROM employee";
 * }}</pre>
 *
 * @since 1.0.0
 */
@NotThreadSafe
public final class OffsetLimit {
	private long offset;
	@Nullable
	private Long limit;

	public OffsetLimit() {
		this(0, null);
	}

	/**
	 * @param offset the number of rows to skip
	 * @param limit  the maximum number of rows to return, or {@code null} for the caller's maximum
	 * @throws BadParameterException if either value is negative
	 */
	public OffsetLimit(long offset,
										 @Nullable Long limit) {
		setOffset(offset);
		setLimit(limit);
	}

	/**
	 * Clamps the limit to {@code max} (defaulting it to {@code max} when unset) and stores the resulting fragment.
	 *
	 * @param bind the variables to store the fragment in
	 * @param max  the largest limit the caller will serve
	 */
	public void bind(@NonNull Bind bind,
									 long max) {
		requireNonNull(bind);

		if (max < 0)
			throw new BadParameterException(format("Maximum limit must not be negative but was %d", max));

		if (this.limit == null || this.limit > max)
			this.limit = max;

		bind.set(Conn.OFFSET_LIMIT_KEY, fragment());
	}

	/**
	 * Reduces the limit, if set, to at most {@code length}.
	 *
	 * @param length a known result size
	 */
	public void clamp(long length) {
		if (this.limit != null)
			this.limit = Math.min(this.limit, length);
	}

	public long getOffset() {
		return this.offset;
	}

	public void setOffset(long offset) {
		if (offset < 0)
			throw new BadParameterException(format("Offset must not be negative but was %d", offset));

		this.offset = offset;
	}

	@NonNull
	public Optional<Long> getLimit() {
		return Optional.ofNullable(this.limit);
	}

	public void setLimit(@Nullable Long limit) {
		if (limit != null && limit < 0)
			throw new BadParameterException(format("Limit must not be negative but was %d", limit));

		this.limit = limit;
	}

	@NonNull
	String fragment() {
		if (this.offset != 0 && this.limit != null)
			return format("LIMIT %d OFFSET %d", this.limit, this.offset);
		if (this.limit != null)
			return format("LIMIT %d", this.limit);
		if (this.offset != 0)
			return format("OFFSET %d", this.offset);

		return "";
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof OffsetLimit offsetLimit))
			return false;

		return offsetLimit.offset == this.offset && Objects.equals(offsetLimit.limit, this.limit);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.offset, this.limit);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{offset=%d, limit=%s}", getClass().getSimpleName(), this.offset, this.limit);
	}
}
