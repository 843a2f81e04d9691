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

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Decodes a result row into the implementing object.
 * <p>
 * For single-row operations the dispatcher has already positioned {@code resultSet} on the only row it reads; for
 * {@link Conn#list(Reader, Selector)} this is called once per row. Implementations must not advance the cursor.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface Reader {
	/**
	 * Reads the current row.
	 *
	 * @param resultSet the result set, positioned on the row to read
	 * @throws SQLException if a column cannot be read
	 */
	void scan(@NonNull ResultSet resultSet) throws SQLException;
}
