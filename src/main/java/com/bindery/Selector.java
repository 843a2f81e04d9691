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

/**
 * Produces the statement for an {@link Operation}, binding the variables that select the affected rows
 * (typically a primary key, or filters for {@link Operation#LIST}).
 * <p>
 * Implementations that cannot serve an operation throw {@link NotImplementedException} rather than returning SQL.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface Selector {
	/**
	 * @param bind      the variables for this call
	 * @param operation the statement variant requested
	 * @return the statement template
	 * @throws NotImplementedException if {@code operation} is not supported
	 */
	@NonNull
	String select(@NonNull Bind bind,
								@NonNull Operation operation);
}
