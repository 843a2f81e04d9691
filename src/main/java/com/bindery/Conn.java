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

import java.time.Duration;

/**
 * A logical database session: a transaction handle (or the pool, for {@link Database}) plus a {@link Bind} store.
 * <p>
 * The single-row operations ({@link #insert(Reader, Writer)}, {@link #patch(Reader, Selector, Writer)},
 * {@link #delete(Reader, Selector)} and {@link #get(Reader, Selector)}) scan the first row of their result into the
 * reader and throw {@link NotFoundException} when there is none.
 * <p>
 * A {@code Conn} is meant for one flow of control at a time. Fork it with {@link #with(Object...)} before fanning out;
 * forks get independent bind stores but share the transaction handle, and statements on a shared transaction are
 * serialized.
 *
 * @since 1.0.0
 */
public interface Conn {
	/**
	 * Reserved variable holding the {@code GROUP BY} fragment appended to list queries.
	 */
	@NonNull
	String GROUP_BY_KEY = "groupby";
	/**
	 * Reserved variable holding the {@code ORDER BY} fragment appended to list queries.
	 */
	@NonNull
	String ORDER_BY_KEY = "orderby";
	/**
	 * Reserved variable holding the {@code LIMIT}/{@code OFFSET} fragment appended to list queries.
	 *
	 * @see OffsetLimit#bind(Bind, long)
	 */
	@NonNull
	String OFFSET_LIMIT_KEY = "offsetlimit";

	/**
	 * Forks this connection. The fork shares the transaction handle but gets a copy of the bind store with
	 * {@code pairs} overlaid on it.
	 *
	 * @param pairs alternating non-empty {@link String} keys and values
	 * @return the fork
	 */
	@NonNull
	Conn with(@Nullable Object @NonNull ... pairs);

	/**
	 * Forks this connection so that its statements carry the given query timeout.
	 *
	 * @param queryTimeout the timeout, or {@code null} for none
	 * @return the fork
	 */
	@NonNull
	Conn withTimeout(@Nullable Duration queryTimeout);

	/**
	 * The bind store this connection expands templates against.
	 *
	 * @return the bind store
	 */
	@NonNull
	Bind bind();

	/**
	 * Runs {@code transactionalOperation} in a nested transaction, committing if it returns normally and rolling back
	 * otherwise.
	 * <p>
	 * A rollback failure is attached to the operation's exception via {@link Throwable#addSuppressed(Throwable)}.
	 * Checked exceptions are wrapped in {@link DatabaseException}.
	 *
	 * @param transactionalOperation the work to perform, given a transaction-bound connection
	 */
	void tx(@NonNull TransactionalOperation transactionalOperation);

	/**
	 * Expands and executes a statement that returns no rows.
	 *
	 * @param query the statement template
	 */
	void exec(@NonNull String query);

	/**
	 * Executes the writer's insert statement and scans the first returned row into {@code reader}.
	 *
	 * @throws NotFoundException if the statement returns no rows
	 */
	void insert(@NonNull Reader reader,
							@NonNull Writer writer);

	/**
	 * Executes the selector's {@link Operation#PATCH} statement after the writer has bound its changes, and scans the
	 * first returned row into {@code reader}.
	 *
	 * @throws NotFoundException if the statement returns no rows
	 */
	void patch(@NonNull Reader reader,
						 @NonNull Selector selector,
						 @NonNull Writer writer);

	/**
	 * Executes the selector's {@link Operation#DELETE} statement and scans the first returned row into {@code reader}.
	 *
	 * @throws NotFoundException if the statement returns no rows
	 */
	void delete(@NonNull Reader reader,
							@NonNull Selector selector);

	/**
	 * Executes the selector's {@link Operation#GET} statement and scans the first returned row into {@code reader}.
	 *
	 * @throws NotFoundException if the statement returns no rows
	 */
	void get(@NonNull Reader reader,
					 @NonNull Selector selector);

	/**
	 * Executes the selector's {@link Operation#LIST} statement and scans every returned row into {@code reader}.
	 * <p>
	 * The reserved {@value #GROUP_BY_KEY}, {@value #ORDER_BY_KEY} and {@value #OFFSET_LIMIT_KEY} variables are cleared
	 * before the selector runs and appended, in that order, to the statement it returns. When {@code reader} is a
	 * {@link ListReader}, the unpaginated row count is scanned first.
	 */
	void list(@NonNull Reader reader,
						@NonNull Selector selector);
}
