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
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A set of named variables used to parameterize and template SQL.
 * <p>
 * Values are consumed two ways:
 * <ul>
 *   <li>textually, through {@code ${key}} placeholders expanded by {@link SqlTemplate}</li>
 *   <li>as driver-bound parameters, through the {@code @key} token returned by {@link #set(String, Object)}</li>
 * </ul>
 * Mutating operations take an exclusive lock and read operations a shared lock. Sequences of separate calls
 * (for example {@link #has(String)} followed by {@link #set(String, Object)}) are not atomic.
 * <p>
 * A {@link #copy(Object...)} is independent of its source: sequences created by {@link #append(String, Object)}
 * are cloned, so appending to a fork never shows through to its parent.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Bind {
	@NonNull
	private final Map<@NonNull String, @Nullable Object> vars;
	@NonNull
	private final ReadWriteLock lock;

	private Bind(@NonNull Map<@NonNull String, @Nullable Object> vars) {
		requireNonNull(vars);

		this.vars = vars;
		this.lock = new ReentrantReadWriteLock();
	}

	/**
	 * Creates a bind store seeded with alternating key/value pairs, e.g. {@code Bind.of("schema", "public", "id", 42)}.
	 *
	 * @param pairs alternating non-empty {@link String} keys and values
	 * @return a new bind store
	 * @throws IllegalArgumentException if the number of arguments is odd or a key is not a non-empty string
	 */
	@NonNull
	public static Bind of(@Nullable Object @NonNull ... pairs) {
		requireNonNull(pairs);

		Map<String, Object> vars = new HashMap<>();
		putPairs(vars, pairs);
		return new Bind(vars);
	}

	/**
	 * Makes an independent copy of this bind store, overlaying the given key/value pairs on the copied entries.
	 *
	 * @param pairs alternating non-empty {@link String} keys and values
	 * @return the copy
	 * @throws IllegalArgumentException if the number of arguments is odd or a key is not a non-empty string
	 */
	@NonNull
	public Bind copy(@Nullable Object @NonNull ... pairs) {
		requireNonNull(pairs);

		Map<String, Object> vars;

		this.lock.readLock().lock();

		try {
			vars = new HashMap<>(this.vars.size() + (pairs.length >> 1));

			for (Map.Entry<String, Object> entry : this.vars.entrySet()) {
				Object value = entry.getValue();
				vars.put(entry.getKey(), value instanceof AppendedValues ? new AppendedValues((AppendedValues) value) : value);
			}
		} finally {
			this.lock.readLock().unlock();
		}

		putPairs(vars, pairs);
		return new Bind(vars);
	}

	/**
	 * Sets a variable.
	 *
	 * @param key   the variable name
	 * @param value the value, may be {@code null}
	 * @return the parameter token ({@code @key}) to embed in SQL for driver binding, or the empty string if
	 * {@code key} is empty (in which case nothing is stored)
	 */
	@NonNull
	public String set(@NonNull String key,
										@Nullable Object value) {
		requireNonNull(key);

		if (key.isEmpty())
			return "";

		this.lock.writeLock().lock();

		try {
			this.vars.put(key, value);
		} finally {
			this.lock.writeLock().unlock();
		}

		return "@" + key;
	}

	/**
	 * Gets a variable.
	 *
	 * @param key the variable name
	 * @return the value, or empty if unset or bound to {@code null}. A sequence built by
	 * {@link #append(String, Object)} is returned as an unmodifiable snapshot
	 */
	@NonNull
	public Optional<Object> get(@NonNull String key) {
		requireNonNull(key);

		this.lock.readLock().lock();

		try {
			Object value = this.vars.get(key);

			if (value instanceof AppendedValues)
				return Optional.of(Collections.unmodifiableList(new ArrayList<>((AppendedValues) value)));

			return Optional.ofNullable(value);
		} finally {
			this.lock.readLock().unlock();
		}
	}

	/**
	 * Is a variable with the given name set (possibly to {@code null})?
	 *
	 * @param key the variable name
	 * @return {@code true} if the variable is set
	 */
	@NonNull
	public Boolean has(@NonNull String key) {
		requireNonNull(key);

		this.lock.readLock().lock();

		try {
			return this.vars.containsKey(key);
		} finally {
			this.lock.readLock().unlock();
		}
	}

	/**
	 * Removes a variable. Removing an unset variable is a no-op.
	 *
	 * @param key the variable name
	 */
	public void del(@NonNull String key) {
		requireNonNull(key);

		this.lock.writeLock().lock();

		try {
			this.vars.remove(key);
		} finally {
			this.lock.writeLock().unlock();
		}
	}

	/**
	 * Renders a variable as a string, joining sequence elements with {@code separator}.
	 * <p>
	 * {@link Collection}s and arrays have each element rendered with {@link Object#toString()}. Scalars are
	 * rendered as-is. An unset variable, a {@code null} value and {@code null} elements render as the empty string,
	 * as they do in {@link SqlTemplate}.
	 *
	 * @param key       the variable name
	 * @param separator the element separator
	 * @return the joined string
	 */
	@NonNull
	public String join(@NonNull String key,
										 @NonNull String separator) {
		requireNonNull(key);
		requireNonNull(separator);

		this.lock.readLock().lock();

		try {
			Object value = this.vars.get(key);

			if (value == null)
				return "";

			List<Object> elements = elementsOf(value).orElse(null);

			if (elements == null)
				return value.toString();

			return elements.stream()
					.map(element -> element == null ? "" : element.toString())
					.collect(Collectors.joining(separator));
		} finally {
			this.lock.readLock().unlock();
		}
	}

	/**
	 * Appends a value to the sequence stored under {@code key}, creating the sequence if the variable is unset.
	 *
	 * @param key   the variable name
	 * @param value the value to append
	 * @return {@code true} if appended, {@code false} if the variable holds a value that is not a {@link List}
	 * (the store is left unchanged)
	 */
	@NonNull
	public Boolean append(@NonNull String key,
												@Nullable Object value) {
		requireNonNull(key);

		if (key.isEmpty())
			return false;

		this.lock.writeLock().lock();

		try {
			Object existing = this.vars.get(key);
			AppendedValues values;

			if (existing == null && !this.vars.containsKey(key)) {
				values = new AppendedValues();
			} else if (existing instanceof AppendedValues) {
				values = (AppendedValues) existing;
			} else if (existing instanceof List<?>) {
				values = new AppendedValues((List<?>) existing);
			} else {
				return false;
			}

			values.add(value);
			this.vars.put(key, values);
			return true;
		} finally {
			this.lock.writeLock().unlock();
		}
	}

	/**
	 * Snapshot of the values for the given variable names, in order, with {@code null} for unset names.
	 */
	@NonNull
	List<@Nullable Object> values(@NonNull List<@NonNull String> keys) {
		requireNonNull(keys);

		this.lock.readLock().lock();

		try {
			List<Object> values = new ArrayList<>(keys.size());

			for (String key : keys)
				values.add(this.vars.get(key));

			return values;
		} finally {
			this.lock.readLock().unlock();
		}
	}

	@Override
	@NonNull
	public String toString() {
		this.lock.readLock().lock();

		try {
			return format("%s{vars=%s}", getClass().getSimpleName(), new TreeMap<>(this.vars));
		} finally {
			this.lock.readLock().unlock();
		}
	}

	/**
	 * The elements of a {@link Collection} or array value, or empty for anything else.
	 */
	@NonNull
	static Optional<List<@Nullable Object>> elementsOf(@Nullable Object value) {
		if (value instanceof Collection<?> collection)
			return Optional.of(new ArrayList<>(collection));

		if (value != null && value.getClass().isArray()) {
			int length = Array.getLength(value);
			List<Object> elements = new ArrayList<>(length);

			for (int i = 0; i < length; ++i)
				elements.add(Array.get(value, i));

			return Optional.of(elements);
		}

		return Optional.empty();
	}

	private static void putPairs(@NonNull Map<String, Object> vars,
															 @Nullable Object @NonNull [] pairs) {
		requireNonNull(vars);
		requireNonNull(pairs);

		if (pairs.length % 2 != 0)
			throw new IllegalArgumentException(format("Expected alternating key/value pairs but got %d arguments", pairs.length));

		for (int i = 0; i < pairs.length; i += 2) {
			if (!(pairs[i] instanceof String key) || key.isEmpty())
				throw new IllegalArgumentException(format("Bind key at position %d must be a non-empty string but was %s", i, pairs[i]));

			vars.put(key, pairs[i + 1]);
		}
	}

	/**
	 * Sequence owned by a single bind store; cloned on {@link #copy(Object...)}.
	 */
	private static final class AppendedValues extends ArrayList<@Nullable Object> {
		private AppendedValues() {
			super(5);
		}

		private AppendedValues(@NonNull List<?> values) {
			super(values);
		}
	}
}
