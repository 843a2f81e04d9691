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
 * The statement variant a {@link Selector} is asked to produce.
 * <p>
 * Ordinals are stable: {@code NONE=0, GET=1, INSERT=2, PATCH=3, DELETE=4, LIST=5}.
 *
 * @since 1.0.0
 */
public enum Operation {
	NONE,
	GET,
	INSERT,
	PATCH,
	DELETE,
	LIST;

	/**
	 * @return {@code GET}, {@code INSERT}, {@code PATCH}, {@code DELETE} or {@code LIST}; {@code UNKNOWN} for {@link #NONE}
	 */
	@Override
	@NonNull
	public String toString() {
		return this == NONE ? "UNKNOWN" : name();
	}
}
