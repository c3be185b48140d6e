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
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.eclipse.lsp4j.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.groovydiag.analysis.AnalysisContext;
import com.tomaszrup.groovydiag.analysis.AnalysisContextFactory;
import com.tomaszrup.groovydiag.analysis.AnalyzerEngine;
import com.tomaszrup.groovydiag.analysis.AnalyzerProvider;
import com.tomaszrup.groovydiag.analysis.DocumentAnalyzer;
import com.tomaszrup.groovydiag.workspace.DocumentSnapshot;
import com.tomaszrup.groovydiag.workspace.ProjectSnapshot;

/**
 * Invokes the {@link AnalyzerEngine} for one document under the per-document
 * timeout.
 *
 * <p>The engine runs on the analysis pool while the caller waits. The token
 * handed to the engine fires when either the caller's token or the timeout
 * fires; either one also cancels the pending future, so the caller returns
 * even if the analyzer never looks at its token.</p>
 *
 * <p>Outcomes: analyzer failure and timeout are logged at ERROR and produce an
 * empty list. Cancellation through the caller's token is rethrown as
 * {@link CancellationException}.</p>
 *
 * <p>A timed-out analyzer that ignores both its token and interrupts keeps
 * its analysis pool thread until it returns on its own, and may still be
 * running when the next analysis of the same document starts. Its result is
 * discarded. Such analyses are counted by {@link #getAbandonedCount()} and
 * logged at WARN.</p>
 */
public class DocumentAnalysisRunner {
	private static final Logger logger = LoggerFactory.getLogger(DocumentAnalysisRunner.class);

	private static final int QUEUED = 0;
	private static final int RUNNING = 1;
	private static final int DONE = 2;
	private static final int ABANDONED = 3;

	private final AnalyzerEngine engine;
	private final AnalyzerProvider analyzerProvider;
	private final AnalysisContextFactory contextFactory;
	private final ExecutorService analysisPool;
	private final ScheduledExecutorService scheduler;
	private final long timeoutMs;
	private final AtomicInteger abandoned = new AtomicInteger();

	public DocumentAnalysisRunner(AnalyzerEngine engine, AnalyzerProvider analyzerProvider,
			AnalysisContextFactory contextFactory, ExecutorService analysisPool, ScheduledExecutorService scheduler,
			long timeoutMs) {
		this.engine = engine;
		this.analyzerProvider = analyzerProvider;
		this.contextFactory = contextFactory;
		this.analysisPool = analysisPool;
		this.scheduler = scheduler;
		this.timeoutMs = timeoutMs;
	}

	public long getTimeoutMs() {
		return timeoutMs;
	}

	/** Timed-out analyses whose analyzer is still running. */
	public int getAbandonedCount() {
		return abandoned.get();
	}

	/**
	 * @return the document's diagnostics, empty if the analysis failed or timed out
	 * @throws CancellationException if {@code callerToken} was cancelled
	 * @throws InterruptedException if the calling thread was interrupted while waiting
	 */
	public List<Diagnostic> analyze(ProjectSnapshot project, DocumentSnapshot document, CancellationToken callerToken)
			throws InterruptedException {
		callerToken.checkCanceled();
		try (CancellationToken timeoutToken = CancellationToken.withTimeout(timeoutMs, scheduler);
				CancellationToken analysisToken = CancellationToken.linked(callerToken, timeoutToken)) {
			AtomicInteger state = new AtomicInteger(QUEUED);
			Future<List<Diagnostic>> future = analysisPool.submit(() -> {
				state.set(RUNNING);
				try {
					List<DocumentAnalyzer> analyzers = analyzerProvider.getAnalyzers(project);
					AnalysisContext context = contextFactory.create(project);
					return engine.analyze(project, analyzers, context, document, analysisToken);
				} finally {
					if (state.getAndSet(DONE) == ABANDONED) {
						int remaining = abandoned.decrementAndGet();
						logger.info("Abandoned analysis of {} returned, {} still running", document.getPath(),
								remaining);
					}
				}
			});
			try (CancellationToken.Registration registration = analysisToken.onCancel(() -> future.cancel(true))) {
				List<Diagnostic> diagnostics = future.get(timeoutMs, TimeUnit.MILLISECONDS);
				return diagnostics != null ? diagnostics : new ArrayList<>();
			} catch (TimeoutException e) {
				future.cancel(true);
				markAbandoned(document, state);
				return timedOut(document, callerToken);
			} catch (CancellationException e) {
				markAbandoned(document, state);
				return timedOut(document, callerToken);
			} catch (ExecutionException e) {
				Throwable cause = e.getCause();
				if (cause instanceof CancellationException) {
					return timedOut(document, callerToken);
				}
				logger.error("Analysis of {} failed: {}", document.getPath(),
						cause != null ? cause.toString() : e.toString(), cause);
				return new ArrayList<>();
			} catch (InterruptedException e) {
				future.cancel(true);
				throw e;
			}
		}
	}

	private void markAbandoned(DocumentSnapshot document, AtomicInteger state) {
		if (state.compareAndSet(RUNNING, ABANDONED)) {
			int count = abandoned.incrementAndGet();
			logger.warn("Analyzer for {} is still running after cancellation, {} abandoned analysis thread(s)",
					document.getPath(), count);
		}
	}

	private List<Diagnostic> timedOut(DocumentSnapshot document, CancellationToken callerToken) {
		if (callerToken.isCanceled()) {
			throw new CancellationException("Analysis of " + document.getPath() + " was cancelled");
		}
		logger.error("Analysis of {} timed out after {} ms", document.getPath(), timeoutMs);
		return new ArrayList<>();
	}
}
