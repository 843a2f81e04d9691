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

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;

/**
 * A place to run statements: either the pool (a connection borrowed per statement) or a {@link Transaction}.
 *
 * @since 1.0.0
 */
interface Session {
	/**
	 * Runs {@code connectionOperation} with a connection, serialized against other users of this session.
	 *
	 * @throws DatabaseException if no connection could be provided
	 * @throws SQLException      if {@code connectionOperation} fails
	 */
	<R> R withConnection(@NonNull ConnectionOperation<R> connectionOperation) throws SQLException;

	/**
	 * Begins a transaction nested inside this session: a root transaction for the pool, a savepoint for a transaction.
	 *
	 * @return the new transaction
	 */
	@NonNull
	Transaction begin();

	@FunctionalInterface
	interface ConnectionOperation<R> {
		/**
		 * @param connection                    the connection to use
		 * @param connectionAcquisitionDuration how long the connection took to obtain, if it was obtained for this call
		 */
		R perform(@NonNull Connection connection,
							@Nullable Duration connectionAcquisitionDuration) throws SQLException;
	}
}
