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

import javax.annotation.concurrent.ThreadSafe;

/**
 * Contract for handling statement log events.
 * <p>
 * Implementations should be threadsafe. A logger that throws never masks the failure of the statement it is logging.
 *
 * @since 1.0.0
 */
@ThreadSafe
@FunctionalInterface
public interface StatementLogger {
	/**
	 * Performs a logging operation on the given {@code statementLog}.
	 * <p>
	 * Implementors might choose to no-op, write to a logging framework, flag slow queries, and so on.
	 *
	 * @param statementLog the event to log
	 */
	void log(@NonNull StatementLog statementLog);
}
