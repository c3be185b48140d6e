////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.groovydiag.worker;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.eclipse.lsp4j.jsonrpc.CancelChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cooperative cancellation signal shared between the work queue, workers and
 * analyzers.
 *
 * <p>A token is cancelled at most once. Callbacks registered through
 * {@link #onCancel(Runnable)} run exactly once, either on the cancelling
 * thread or immediately on registration if the token is already cancelled.
 * Tokens derived with {@link #linked} or {@link #withTimeout} hold
 * registrations on their sources and timers; {@link #close()} releases them.</p>
 */
public class CancellationToken implements CancelChecker, AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(CancellationToken.class);

	private static final CancellationToken NONE = new CancellationToken() {
		@Override
		public void cancel() {
			// never cancelled
		}

		@Override
		public Registration onCancel(Runnable callback) {
			return () -> {
			};
		}
	};

	/**
	 * Handle to a callback registered with {@link #onCancel(Runnable)}.
	 * Closing it unregisters the callback.
	 */
	public interface Registration extends AutoCloseable {
		@Override
		void close();
	}

	private final Object lock = new Object();
	private volatile boolean canceled = false;
	private final List<Runnable> callbacks = new ArrayList<>();
	private final List<Registration> sourceRegistrations = new ArrayList<>();
	private ScheduledFuture<?> timer;

	/** A token that is never cancelled. */
	public static CancellationToken none() {
		return NONE;
	}

	/**
	 * Returns a new token that is cancelled as soon as either {@code first}
	 * or {@code second} is cancelled.
	 */
	public static CancellationToken linked(CancellationToken first, CancellationToken second) {
		CancellationToken child = new CancellationToken();
		child.linkTo(first);
		child.linkTo(second);
		return child;
	}

	/**
	 * Returns a new token that cancels itself after {@code timeoutMs}.
	 */
	public static CancellationToken withTimeout(long timeoutMs, ScheduledExecutorService scheduler) {
		CancellationToken token = new CancellationToken();
		ScheduledFuture<?> future = scheduler.schedule(token::cancel, timeoutMs, TimeUnit.MILLISECONDS);
		synchronized (token.lock) {
			token.timer = future;
		}
		return token;
	}

	private void linkTo(CancellationToken source) {
		if (source == NONE) {
			return;
		}
		Registration registration = source.onCancel(this::cancel);
		synchronized (lock) {
			sourceRegistrations.add(registration);
		}
	}

	public void cancel() {
		List<Runnable> toRun;
		synchronized (lock) {
			if (canceled) {
				return;
			}
			canceled = true;
			toRun = new ArrayList<>(callbacks);
			callbacks.clear();
		}
		for (Runnable callback : toRun) {
			runCallback(callback);
		}
	}

	public boolean isCanceled() {
		return canceled;
	}

	@Override
	public void checkCanceled() {
		if (canceled) {
			throw new CancellationException("Operation cancelled");
		}
	}

	/**
	 * Registers a callback to run when this token is cancelled. If the token
	 * is already cancelled the callback runs immediately on the calling thread.
	 */
	public Registration onCancel(Runnable callback) {
		synchronized (lock) {
			if (!canceled) {
				callbacks.add(callback);
				return () -> {
					synchronized (lock) {
						callbacks.remove(callback);
					}
				};
			}
		}
		runCallback(callback);
		return () -> {
		};
	}

	private static void runCallback(Runnable callback) {
		try {
			callback.run();
		} catch (RuntimeException e) {
			logger.warn("Cancellation callback failed: {}", e.getMessage(), e);
		}
	}

	/**
	 * Releases links to source tokens and any pending timer. Does not cancel
	 * the token.
	 */
	@Override
	public void close() {
		List<Registration> registrations;
		ScheduledFuture<?> pendingTimer;
		synchronized (lock) {
			registrations = new ArrayList<>(sourceRegistrations);
			sourceRegistrations.clear();
			pendingTimer = timer;
			timer = null;
		}
		for (Registration registration : registrations) {
			registration.close();
		}
		if (pendingTimer != null) {
			pendingTimer.cancel(false);
		}
	}

	@Override
	public String toString() {
		return "CancellationToken{canceled=" + canceled + "}";
	}
}
