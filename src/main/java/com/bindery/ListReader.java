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
 * A {@link Reader} that also wants the total number of rows a list query would return, ignoring pagination.
 * <p>
 * The count is read from a single row with one column named {@code count}.
 *
 * @since 1.0.0
 */
public interface ListReader extends Reader {
	/**
	 * Reads the count row.
	 *
	 * @param resultSet the result set, positioned on the count row
	 * @throws SQLException if the count cannot be read
	 */
	void scanCount(@NonNull ResultSet resultSet) throws SQLException;
}
