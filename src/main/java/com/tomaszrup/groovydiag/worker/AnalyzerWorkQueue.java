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
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.groovydiag.workspace.DocumentId;

/**
 * Two-class priority queue of analysis work keyed by document.
 *
 * <p>Guarantees:</p>
 * <ul>
 *   <li>At most one pending item per document. A second enqueue merges into
 *       the pending item: the item keeps its token and queue position, and
 *       additionally carries the new batch. The merged item is Foreground if
 *       either enqueue was Foreground; Foreground is never demoted.</li>
 *   <li>At most one in-flight item per document. Enqueueing a document that
 *       is being analyzed cancels the running analysis and queues a fresh
 *       item, which is not handed out until the running one is acknowledged
 *       through {@link #workComplete(QueueItem)}.</li>
 *   <li>{@link #takeWork()} returns every eligible Foreground item before any
 *       Background item, FIFO within a class.</li>
 * </ul>
 *
 * <p>All state is guarded by one {@link ReentrantLock}. Batch callbacks are
 * made after the lock is released.</p>
 */
public class AnalyzerWorkQueue {
	private static final Logger logger = LoggerFactory.getLogger(AnalyzerWorkQueue.class);

	private final ReentrantLock lock = new ReentrantLock();
	private final Condition workAvailable = lock.newCondition();
	private final Condition foregroundDrained = lock.newCondition();

	private final LinkedHashMap<DocumentId, QueueItem> pendingForeground = new LinkedHashMap<>();
	private final LinkedHashMap<DocumentId, QueueItem> pendingBackground = new LinkedHashMap<>();
	private final Map<DocumentId, QueueItem> active = new HashMap<>();
	private int activeForeground = 0;
	private boolean closed = false;

	private final BatchListener batchListener;

	public AnalyzerWorkQueue() {
		this(BatchListener.NOOP);
	}

	public AnalyzerWorkQueue(BatchListener batchListener) {
		this.batchListener = batchListener;
	}

	/**
	 * Enqueues one item per document as a single batch with a project count
	 * of one.
	 */
	public void putWork(Collection<DocumentId> documentIds, AnalyzerWorkType workType) {
		putWork(documentIds, workType, 1);
	}

	/**
	 * Enqueues one item per distinct document as a single batch. Never blocks
	 * on analysis.
	 *
	 * @param projectCount number of projects the documents belong to, for progress reporting
	 */
	public void putWork(Collection<DocumentId> documentIds, AnalyzerWorkType workType, int projectCount) {
		Set<DocumentId> distinct = new LinkedHashSet<>(documentIds);
		if (distinct.isEmpty()) {
			return;
		}
		WorkBatch batch = new WorkBatch(distinct.size(), projectCount, workType);
		List<CancellationToken> toCancel = new ArrayList<>();

		lock.lock();
		try {
			if (closed) {
				logger.debug("Queue closed, dropping {} document(s)", distinct.size());
				return;
			}
			for (DocumentId documentId : distinct) {
				QueueItem pending = findPending(documentId);
				if (pending != null) {
					AnalyzerWorkType mergedType = pending.getWorkType() == AnalyzerWorkType.FOREGROUND
							? AnalyzerWorkType.FOREGROUND : workType;
					QueueItem merged = pending.supersededBy(batch, mergedType);
					if (mergedType == pending.getWorkType()) {
						restorePending(pending, merged);
					} else {
						pendingFor(pending.getWorkType()).remove(documentId);
						pendingFor(mergedType).put(documentId, merged);
					}
					continue;
				}
				QueueItem running = active.get(documentId);
				if (running != null) {
					toCancel.add(running.getCancellationToken());
				}
				List<WorkBatch> batches = new ArrayList<>(1);
				batches.add(batch);
				pendingFor(workType).put(documentId,
						new QueueItem(documentId, workType, new CancellationToken(), batches));
			}
			workAvailable.signalAll();
		} finally {
			lock.unlock();
		}

		for (CancellationToken token : toCancel) {
			token.cancel();
		}
		logger.trace("Queued {} document(s) as {}", distinct.size(), workType);
	}

	/**
	 * Moves a pending Background item to the Foreground class. The item keeps
	 * its token and batches.
	 *
	 * @return {@code true} if an item was promoted
	 */
	public boolean tryPromote(DocumentId documentId) {
		lock.lock();
		try {
			QueueItem item = pendingBackground.remove(documentId);
			if (item == null) {
				return false;
			}
			item.setWorkType(AnalyzerWorkType.FOREGROUND);
			pendingForeground.put(documentId, item);
			workAvailable.signalAll();
			return true;
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Blocks until an item is eligible and returns it. Items whose document is
	 * still in flight are skipped until that analysis is acknowledged.
	 *
	 * @return the next item, or {@code null} once the queue is closed
	 * @throws InterruptedException if the calling thread is interrupted while waiting
	 */
	public QueueItem takeWork() throws InterruptedException {
		QueueItem item;
		lock.lockInterruptibly();
		try {
			while (true) {
				if (closed) {
					return null;
				}
				item = pollEligible(pendingForeground);
				if (item == null) {
					item = pollEligible(pendingBackground);
				}
				if (item != null) {
					active.put(item.getDocumentId(), item);
					if (item.getWorkType() == AnalyzerWorkType.FOREGROUND) {
						activeForeground++;
					}
					break;
				}
				workAvailable.await();
			}
		} finally {
			lock.unlock();
		}

		for (WorkBatch batch : item.getBatches()) {
			batch.onItemDispatched(batchListener);
		}
		return item;
	}

	/**
	 * Acknowledges an item returned by {@link #takeWork()}, whatever the
	 * analysis outcome. Each of the item's batches is decremented once.
	 */
	public void workComplete(QueueItem item) {
		lock.lock();
		try {
			if (active.get(item.getDocumentId()) != item) {
				logger.warn("Ignoring completion of {}: not in flight", item);
				return;
			}
			active.remove(item.getDocumentId());
			if (item.getWorkType() == AnalyzerWorkType.FOREGROUND) {
				activeForeground--;
			}
			if (pendingForeground.containsKey(item.getDocumentId())
					|| pendingBackground.containsKey(item.getDocumentId())) {
				workAvailable.signalAll();
			}
			if (!hasForegroundWork()) {
				foregroundDrained.signalAll();
			}
		} finally {
			lock.unlock();
		}

		for (WorkBatch batch : item.getBatches()) {
			batch.onItemCompleted(batchListener);
		}
	}

	/**
	 * Blocks until no Foreground item is pending or in flight. Returns early,
	 * without error, when {@code cancellationToken} fires or the queue closes.
	 *
	 * @throws InterruptedException if the calling thread is interrupted while waiting
	 */
	public void waitForegroundWorkComplete(CancellationToken cancellationToken) throws InterruptedException {
		try (CancellationToken.Registration registration = cancellationToken.onCancel(this::wakeForegroundWaiters)) {
			lock.lockInterruptibly();
			try {
				while (hasForegroundWork() && !closed && !cancellationToken.isCanceled()) {
					foregroundDrained.await();
				}
			} finally {
				lock.unlock();
			}
		}
	}

	/**
	 * Wakes every blocked caller. Afterwards {@link #takeWork()} returns
	 * {@code null} and new work is dropped. Items already in flight can still
	 * be acknowledged.
	 */
	public void close() {
		lock.lock();
		try {
			closed = true;
			workAvailable.signalAll();
			foregroundDrained.signalAll();
		} finally {
			lock.unlock();
		}
	}

	public boolean isClosed() {
		lock.lock();
		try {
			return closed;
		} finally {
			lock.unlock();
		}
	}

	// --- Introspection ---

	/** Class of the pending item for the document, or {@code null} if none is pending. */
	public AnalyzerWorkType getPendingWorkType(DocumentId documentId) {
		lock.lock();
		try {
			if (pendingForeground.containsKey(documentId)) {
				return AnalyzerWorkType.FOREGROUND;
			}
			if (pendingBackground.containsKey(documentId)) {
				return AnalyzerWorkType.BACKGROUND;
			}
			return null;
		} finally {
			lock.unlock();
		}
	}

	public int getPendingCount() {
		lock.lock();
		try {
			return pendingForeground.size() + pendingBackground.size();
		} finally {
			lock.unlock();
		}
	}

	public int getPendingForegroundCount() {
		lock.lock();
		try {
			return pendingForeground.size();
		} finally {
			lock.unlock();
		}
	}

	public boolean isInFlight(DocumentId documentId) {
		lock.lock();
		try {
			return active.containsKey(documentId);
		} finally {
			lock.unlock();
		}
	}

	public boolean hasForegroundWork() {
		lock.lock();
		try {
			return !pendingForeground.isEmpty() || activeForeground > 0;
		} finally {
			lock.unlock();
		}
	}

	// --- Internals (lock held) ---

	private LinkedHashMap<DocumentId, QueueItem> pendingFor(AnalyzerWorkType workType) {
		return workType == AnalyzerWorkType.FOREGROUND ? pendingForeground : pendingBackground;
	}

	private QueueItem findPending(DocumentId documentId) {
		QueueItem item = pendingForeground.get(documentId);
		if (item == null) {
			item = pendingBackground.get(documentId);
		}
		return item;
	}

	private void restorePending(QueueItem previous, QueueItem replacement) {
		// put() on an existing key keeps the insertion position
		pendingFor(previous.getWorkType()).put(previous.getDocumentId(), replacement);
	}

	private QueueItem pollEligible(LinkedHashMap<DocumentId, QueueItem> pending) {
		Iterator<QueueItem> iterator = pending.values().iterator();
		while (iterator.hasNext()) {
			QueueItem candidate = iterator.next();
			if (!active.containsKey(candidate.getDocumentId())) {
				iterator.remove();
				return candidate;
			}
		}
		return null;
	}

	private void wakeForegroundWaiters() {
		lock.lock();
		try {
			foregroundDrained.signalAll();
		} finally {
			lock.unlock();
		}
	}
}
