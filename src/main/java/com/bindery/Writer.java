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
 * Binds an object's values for inserting or patching.
 * <p>
 * Example:
 * <pre>{@code
 * public String insert(Bind bind) {
 *   bind.set("name", this.name);
 *   return "INSERT INTO employee (name) VALUES (@name) RETURNING id, name";
 * }
 *
 * public void patch(Bind bind) {
 *   bind.del("patch");
 *
 *   if (this.name != null)
 *     bind.append("patch", "name=" + bind.set("name", this.name));
 *
 *   String patch = bind.join("patch", ", ");
 *
 *   if (patch.isEmpty())
 *     throw new BadParameterException("Nothing to patch");
 *
 *   bind.set("patch", patch);
 * }}</pre>
 *
 * @since 1.0.0
 */
public interface Writer {
	/**
	 * Sets the variables for an insert.
	 *
	 * @param bind the variables for this call
	 * @return the insert statement template
	 */
	@NonNull
	String insert(@NonNull Bind bind);

	/**
	 * Sets the variables for a patch. The statement itself comes from the {@link Selector}.
	 *
	 * @param bind the variables for this call
	 * @throws BadParameterException if there is nothing to patch
	 */
	void patch(@NonNull Bind bind);
}
