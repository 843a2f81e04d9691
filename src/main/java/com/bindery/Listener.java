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

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * A {@code LISTEN}/{@code NOTIFY} subscription bound to one dedicated connection.
 * <p>
 * A listener starts idle. The first {@link #listen(String)} takes a connection out of the data source and keeps it
 * for the listener's lifetime; {@link #close()} force-closes it so that a connection still in a {@code LISTEN} state
 * never goes back into pool rotation. All operations are mutually exclusive: a call made while another thread is
 * waiting for a notification blocks until that wait ends.
 *
 * @since 1.0.0
 */
public interface Listener extends AutoCloseable {
	/**
	 * Subscribes to {@code channel}, acquiring the dedicated connection if none is held yet.
	 *
	 * @param channel the channel name, quoted as an identifier when issued
	 */
	void listen(@NonNull String channel);

	/**
	 * Unsubscribes from {@code channel}.
	 *
	 * @param channel the channel name
	 * @throws DatabaseException if no connection is held
	 */
	void unlisten(@NonNull String channel);

	/**
	 * Blocks until a notification arrives on a subscribed channel.
	 *
	 * @return the notification
	 * @throws DatabaseException if no connection is held, or if the waiting thread is interrupted (the interrupt flag
	 *                           stays set)
	 */
	@NonNull
	Notification waitForNotification();

	/**
	 * Blocks until a notification arrives or {@code timeout} elapses.
	 *
	 * @param timeout how long to wait; zero checks for a pending notification without waiting
	 * @return the notification, or empty on timeout
	 * @throws DatabaseException if no connection is held, or if the waiting thread is interrupted
	 */
	@NonNull
	Optional<Notification> waitForNotification(@NonNull Duration timeout);

	/**
	 * The channels currently subscribed to.
	 *
	 * @return an immutable snapshot of the channel names
	 */
	@NonNull
	Set<@NonNull String> getChannels();

	/**
	 * Releases the dedicated connection, if held. Closing an idle listener is a no-op.
	 *
	 * @throws DatabaseException if the connection could not be closed; the listener is idle afterwards regardless
	 */
	@Override
	void close();
}
