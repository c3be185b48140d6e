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
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed set of daemon threads draining an {@link AnalyzerWorkQueue}.
 *
 * <p>Every item taken from the queue is acknowledged with
 * {@link AnalyzerWorkQueue#workComplete(QueueItem)} whatever happens while
 * processing it. A failing item never ends the loop; only {@link #stop()}
 * (which closes the queue) or an interrupt does.</p>
 */
public class DiagnosticWorkerPool {
	private static final Logger logger = LoggerFactory.getLogger(DiagnosticWorkerPool.class);

	private static final long JOIN_TIMEOUT_MS = TimeUnit.SECONDS.toMillis(5);

	/** Does the work for one dequeued item. */
	@FunctionalInterface
	public interface ItemProcessor {
		void process(QueueItem item) throws InterruptedException;
	}

	private final AnalyzerWorkQueue queue;
	private final int threadCount;
	private final ItemProcessor processor;
	private final List<Thread> threads = new ArrayList<>();
	private volatile boolean stopping = false;

	public DiagnosticWorkerPool(AnalyzerWorkQueue queue, int threadCount, ItemProcessor processor) {
		this.queue = queue;
		this.threadCount = threadCount;
		this.processor = processor;
	}

	public synchronized void start() {
		if (!threads.isEmpty()) {
			throw new IllegalStateException("Worker pool already started");
		}
		for (int i = 1; i <= threadCount; i++) {
			Thread thread = new Thread(this::runLoop, "groovydiag-worker-" + i);
			thread.setDaemon(true);
			threads.add(thread);
			thread.start();
		}
		logger.info("Started {} diagnostic worker thread(s)", threadCount);
	}

	/**
	 * Lets every worker finish its current item, then joins them. Workers
	 * still running after 5 seconds are interrupted.
	 */
	public synchronized void stop() {
		stopping = true;
		queue.close();
		long deadline = System.currentTimeMillis() + JOIN_TIMEOUT_MS;
		try {
			for (Thread thread : threads) {
				long remaining = deadline - System.currentTimeMillis();
				if (remaining > 0) {
					thread.join(remaining);
				}
				if (thread.isAlive()) {
					logger.warn("Worker {} did not stop in time, interrupting", thread.getName());
					thread.interrupt();
				}
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
		threads.clear();
		logger.info("Diagnostic workers stopped");
	}

	public synchronized int getAliveCount() {
		int alive = 0;
		for (Thread thread : threads) {
			if (thread.isAlive()) {
				alive++;
			}
		}
		return alive;
	}

	private void runLoop() {
		while (!stopping) {
			QueueItem item;
			try {
				item = queue.takeWork();
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				break;
			}
			if (item == null) {
				break;
			}
			try {
				processor.process(item);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			} catch (RuntimeException e) {
				logger.error("Unexpected failure while processing {}", item, e);
			} finally {
				queue.workComplete(item);
			}
			if (Thread.currentThread().isInterrupted()) {
				break;
			}
		}
		logger.debug("Worker {} exiting", Thread.currentThread().getName());
	}
}
