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
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A notification received on a {@code LISTEN}ed channel.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Notification {
	@NonNull
	private final String channel;
	@NonNull
	private final byte[] payload;
	@NonNull
	private final Integer processId;

	public Notification(@NonNull String channel,
											@NonNull byte[] payload,
											@NonNull Integer processId) {
		requireNonNull(channel);
		requireNonNull(payload);
		requireNonNull(processId);

		this.channel = channel;
		this.payload = payload.clone();
		this.processId = processId;
	}

	@NonNull
	public String getChannel() {
		return this.channel;
	}

	/**
	 * @return a copy of the payload bytes
	 */
	@NonNull
	public byte[] getPayload() {
		return this.payload.clone();
	}

	@NonNull
	public String getPayloadAsString() {
		return new String(this.payload, StandardCharsets.UTF_8);
	}

	/**
	 * The process ID of the server backend that sent the notification.
	 */
	@NonNull
	public Integer getProcessId() {
		return this.processId;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{channel=%s, payload=%s, processId=%s}", getClass().getSimpleName(), getChannel(), getPayloadAsString(), getProcessId());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Notification))
			return false;

		Notification notification = (Notification) object;

		return Objects.equals(this.channel, notification.channel)
				&& Arrays.equals(this.payload, notification.payload)
				&& Objects.equals(this.processId, notification.processId);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.channel, Arrays.hashCode(this.payload), this.processId);
	}
}
