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

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Thrown by a {@link Selector} or {@link Writer} asked for an {@link Operation} it does not support.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class NotImplementedException extends DatabaseException {
	/**
	 * @param operation the unsupported operation
	 */
	public NotImplementedException(@Nullable Operation operation) {
		super(String.format("Operation %s is not implemented", operation));
	}

	/**
	 * @param message a message describing this exception
	 */
	public NotImplementedException(@Nullable String message) {
		super(message);
	}
}
