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
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;
import static java.util.logging.Level.WARNING;

/**
 * Cancels an in-flight JDBC statement once the thread that issued it is interrupted.
 * <p>
 * Blocking JDBC calls do not respond to {@link Thread#interrupt()}, so a shared daemon thread polls the interrupt flag
 * of every watched thread and calls {@link Statement#cancel()} on its statement.
 *
 * @since 1.0.0
 */
@ThreadSafe
final class StatementCanceller {
	@NonNull
	static final Duration POLL_INTERVAL = Duration.ofMillis(50);

	@NonNull
	private static final ScheduledExecutorService SCHEDULER;
	@NonNull
	private static final Logger LOGGER;

	static {
		AtomicInteger threadCounter = new AtomicInteger(1);

		SCHEDULER = Executors.newSingleThreadScheduledExecutor(runnable -> {
			Thread thread = new Thread(runnable, "bindery-statement-canceller-" + threadCounter.getAndIncrement());
			thread.setDaemon(true);
			return thread;
		});

		LOGGER = Logger.getLogger(StatementCanceller.class.getName());
	}

	private StatementCanceller() {
		// Non-instantiable
	}

	/**
	 * Starts watching {@code thread}; the statement is cancelled at most once, and never after the returned handle
	 * is closed.
	 */
	@NonNull
	static Registration watch(@NonNull Thread thread,
														@NonNull Statement statement) {
		requireNonNull(thread);
		requireNonNull(statement);

		Registration registration = new Registration(thread, statement);
		registration.start();
		return registration;
	}

	@ThreadSafe
	static final class Registration implements AutoCloseable {
		@NonNull
		private final Thread thread;
		@NonNull
		private final Statement statement;
		@NonNull
		private final AtomicBoolean cancelled;
		@NonNull
		private final AtomicBoolean closed;
		private volatile ScheduledFuture<?> future;

		private Registration(@NonNull Thread thread,
												 @NonNull Statement statement) {
			requireNonNull(thread);
			requireNonNull(statement);

			this.thread = thread;
			this.statement = statement;
			this.cancelled = new AtomicBoolean(false);
			this.closed = new AtomicBoolean(false);
		}

		private void start() {
			long pollMillis = POLL_INTERVAL.toMillis();
			this.future = SCHEDULER.scheduleWithFixedDelay(this::poll, pollMillis, pollMillis, TimeUnit.MILLISECONDS);
		}

		// close() cannot return while a cancel is in flight
		private synchronized void poll() {
			if (this.closed.get() || this.cancelled.get() || !this.thread.isInterrupted())
				return;

			this.cancelled.set(true);

			ScheduledFuture<?> future = this.future;

			if (future != null)
				future.cancel(false);

			try {
				this.statement.cancel();
				LOGGER.log(FINE, format("Cancelled statement for interrupted thread %s", this.thread.getName()));
			} catch (SQLException | RuntimeException e) {
				LOGGER.log(WARNING, format("Unable to cancel statement for interrupted thread %s", this.thread.getName()), e);
			}
		}

		@NonNull
		Boolean isCancelled() {
			return this.cancelled.get();
		}

		@Override
		public synchronized void close() {
			if (!this.closed.compareAndSet(false, true))
				return;

			ScheduledFuture<?> future = this.future;

			if (future != null)
				future.cancel(false);
		}
	}
}
