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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

import org.eclipse.lsp4j.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.groovydiag.ExecutorPools;
import com.tomaszrup.groovydiag.analysis.AnalysisContextFactory;
import com.tomaszrup.groovydiag.analysis.AnalyzerEngine;
import com.tomaszrup.groovydiag.analysis.AnalyzerProvider;
import com.tomaszrup.groovydiag.util.MdcProjectContext;
import com.tomaszrup.groovydiag.workspace.DocumentId;
import com.tomaszrup.groovydiag.workspace.DocumentSnapshot;
import com.tomaszrup.groovydiag.workspace.ProjectId;
import com.tomaszrup.groovydiag.workspace.ProjectSnapshot;
import com.tomaszrup.groovydiag.workspace.Workspace;
import com.tomaszrup.groovydiag.workspace.WorkspaceSnapshot;

/**
 * Keeps the diagnostics of every workspace document up to date.
 *
 * <p>Owns the work queue, the worker pool and the result cache, and exposes
 * the query operations used by the LSP layer. Edits are never blocked by
 * analysis: enqueueing only touches the queue, and queries that need fresh
 * results promote the documents they ask for and wait for Foreground work to
 * drain.</p>
 */
public class DiagnosticWorker {
	private static final Logger logger = LoggerFactory.getLogger(DiagnosticWorker.class);

	private final Workspace workspace;
	private final DiagnosticWorkerOptions options;
	private final ExecutorPools executorPools;
	private final AnalyzerWorkQueue queue;
	private final DiagnosticResultCache cache = new DiagnosticResultCache();
	private final DocumentAnalysisRunner runner;
	private final DiagnosticWorkerPool workerPool;
	private final DiagnosticsSink diagnosticsSink;

	public DiagnosticWorker(Workspace workspace, AnalyzerEngine engine, AnalyzerProvider analyzerProvider,
			AnalysisContextFactory contextFactory, DiagnosticWorkerOptions options, ExecutorPools executorPools,
			DiagnosticsSink diagnosticsSink, BackgroundStatusSink statusSink) {
		this.workspace = workspace;
		this.options = options;
		this.executorPools = executorPools;
		this.diagnosticsSink = diagnosticsSink;
		this.queue = new AnalyzerWorkQueue(new BackgroundProgressReporter(statusSink));
		this.runner = new DocumentAnalysisRunner(engine, analyzerProvider, contextFactory,
				executorPools.getAnalysisPool(), executorPools.getSchedulingPool(),
				options.getDocumentAnalysisTimeoutMs());
		this.workerPool = new DiagnosticWorkerPool(queue, options.getThreadCount(), this::processItem);
	}

	public void start() {
		logger.info("Starting diagnostic worker: {}", options);
		workerPool.start();
	}

	/**
	 * Stops accepting work, lets running analyses finish and joins the
	 * workers.
	 */
	public void shutdown() {
		workerPool.stop();
	}

	public AnalyzerWorkQueue getWorkQueue() {
		return queue;
	}

	public DiagnosticResultCache getCache() {
		return cache;
	}

	public DiagnosticWorkerOptions getOptions() {
		return options;
	}

	// --- Queries ---

	/**
	 * Returns fresh diagnostics for the given files. Paths that are not
	 * workspace documents are dropped. Pending work for the documents is
	 * promoted and the call waits, at most three times the per-document
	 * timeout, for Foreground work to drain. Documents whose analysis has not
	 * completed by then are left out of the result.
	 */
	public CompletableFuture<List<DocumentDiagnostics>> getDiagnostics(Collection<Path> documentPaths) {
		return CompletableFuture.supplyAsync(() -> {
			Set<DocumentId> documentIds = new LinkedHashSet<>();
			for (Path path : documentPaths) {
				DocumentId documentId = workspace.getDocumentId(path);
				if (documentId == null) {
					logger.debug("Ignoring diagnostics request for unknown document {}", path);
					continue;
				}
				documentIds.add(documentId);
			}
			for (DocumentId documentId : documentIds) {
				queue.tryPromote(documentId);
			}
			try (CancellationToken timeout = CancellationToken.withTimeout(options.getQueryTimeoutMs(),
					executorPools.getSchedulingPool())) {
				queue.waitForegroundWorkComplete(timeout);
				if (timeout.isCanceled()) {
					logger.info("Timed out waiting for foreground diagnostics after {} ms", options.getQueryTimeoutMs());
				}
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				logger.debug("Interrupted while waiting for foreground diagnostics");
			}
			return cache.getAll(documentIds);
		}, executorPools.getRequestPool());
	}

	/**
	 * Cached diagnostics of every document currently in the workspace. Does
	 * not wait or promote, so results may be stale or missing.
	 */
	public List<DocumentDiagnostics> getAllDiagnostics() {
		return cache.getAll(workspace.getCurrentSnapshot().getDocumentIds());
	}

	/**
	 * Queues every workspace document as Background work. The batch counts
	 * only projects that own at least one document.
	 *
	 * @return the queued documents
	 */
	public List<DocumentId> queueDocumentsForDiagnostics() {
		WorkspaceSnapshot snapshot = workspace.getCurrentSnapshot();
		List<DocumentId> documentIds = new ArrayList<>();
		int projectCount = 0;
		for (ProjectSnapshot project : snapshot.getProjects()) {
			List<DocumentId> projectDocuments = project.getDocumentIds();
			if (!projectDocuments.isEmpty()) {
				projectCount++;
				documentIds.addAll(projectDocuments);
			}
		}
		queueForAnalysis(documentIds, AnalyzerWorkType.BACKGROUND, projectCount);
		return documentIds;
	}

	/**
	 * Queues every document of the given projects as Background work.
	 * Unknown projects are skipped.
	 *
	 * @return the queued documents
	 */
	public List<DocumentId> queueDocumentsForDiagnostics(Collection<ProjectId> projectIds) {
		WorkspaceSnapshot snapshot = workspace.getCurrentSnapshot();
		List<DocumentId> documentIds = new ArrayList<>();
		int projectCount = 0;
		for (ProjectId projectId : new LinkedHashSet<>(projectIds)) {
			ProjectSnapshot project = snapshot.getProject(projectId);
			if (project == null) {
				logger.debug("Ignoring unknown project {}", projectId);
				continue;
			}
			if (!project.getDocumentIds().isEmpty()) {
				projectCount++;
				documentIds.addAll(project.getDocumentIds());
			}
		}
		queueForAnalysis(documentIds, AnalyzerWorkType.BACKGROUND, projectCount);
		return documentIds;
	}

	public void queueForAnalysis(Collection<DocumentId> documentIds, AnalyzerWorkType workType, int projectCount) {
		if (documentIds.isEmpty()) {
			return;
		}
		queue.putWork(documentIds, workType, projectCount);
	}

	/**
	 * Analyzes one document right away, bypassing the queue and the cache.
	 * The per-document timeout still applies. Completes exceptionally with
	 * {@link CancellationException} if {@code cancellationToken} fires.
	 */
	public CompletableFuture<DocumentDiagnostics> analyzeDocumentAsync(DocumentSnapshot document,
			CancellationToken cancellationToken) {
		return CompletableFuture.supplyAsync(() -> {
			ProjectSnapshot project = workspace.getCurrentSnapshot().getProject(document.getProjectId());
			if (project == null) {
				logger.debug("Project of {} is gone, returning no diagnostics", document.getPath());
				return new DocumentDiagnostics(document.getId(), document.getPath(), document.getProjectId(), null,
						Collections.emptyList());
			}
			MdcProjectContext.setProject(project.getName());
			try {
				List<Diagnostic> diagnostics = runner.analyze(project, document, cancellationToken);
				return new DocumentDiagnostics(document.getId(), document.getPath(), project.getId(),
						project.getName(), diagnostics);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new CancellationException("Interrupted while analyzing " + document.getPath());
			} finally {
				MdcProjectContext.clear();
			}
		}, executorPools.getRequestPool());
	}

	/**
	 * Queues all documents of {@code project} as Foreground work and waits for
	 * Foreground work to drain.
	 *
	 * <p>The result is every cached entry of the workspace, not only those of
	 * {@code project}. Callers wanting one project's diagnostics should filter
	 * on {@link DocumentDiagnostics#getProjectId()}.</p>
	 */
	public CompletableFuture<List<DocumentDiagnostics>> analyzeProjectsAsync(ProjectSnapshot project,
			CancellationToken cancellationToken) {
		return CompletableFuture.supplyAsync(() -> {
			queueForAnalysis(project.getDocumentIds(), AnalyzerWorkType.FOREGROUND, 1);
			try {
				queue.waitForegroundWorkComplete(cancellationToken);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				logger.debug("Interrupted while waiting for project {}", project.getName());
			}
			return cache.values();
		}, executorPools.getRequestPool());
	}

	/**
	 * Drops the cached entry of a removed document and publishes an empty
	 * diagnostics list for its file.
	 *
	 * @return {@code true} if there was an entry
	 */
	public boolean removeDocumentDiagnostics(DocumentId documentId) {
		DocumentDiagnostics removed = cache.remove(documentId);
		if (removed == null) {
			logger.debug("No cached diagnostics to remove for {}", documentId);
			return false;
		}
		publish(new DocumentDiagnostics(documentId, removed.getFilePath(), removed.getProjectId(),
				removed.getProjectName(), Collections.emptyList()));
		return true;
	}

	// --- Worker ---

	void processItem(QueueItem item) throws InterruptedException {
		DocumentId documentId = item.getDocumentId();
		ProjectSnapshot project = workspace.getCurrentSnapshot().getOwningProject(documentId);
		DocumentSnapshot document = project != null ? project.getDocument(documentId) : null;
		if (document == null) {
			logger.debug("Skipping {}: no longer in the workspace", documentId);
			return;
		}

		MdcProjectContext.setProject(project.getName());
		try {
			List<Diagnostic> diagnostics;
			try {
				diagnostics = runner.analyze(project, document, item.getCancellationToken());
			} catch (CancellationException e) {
				logger.info("Analysis of {} cancelled, a newer request is queued", document.getPath());
				return;
			}
			DocumentDiagnostics result = new DocumentDiagnostics(documentId, document.getPath(), project.getId(),
					project.getName(), diagnostics);
			cache.put(result);
			if (workspace.getCurrentSnapshot().getDocument(documentId) == null) {
				// removed while it was being analyzed
				cache.remove(documentId);
				return;
			}
			logger.debug("{} diagnostic(s) for {}", diagnostics.size(), document.getPath());
			publish(result);
		} finally {
			MdcProjectContext.clear();
		}
	}

	private void publish(DocumentDiagnostics diagnostics) {
		try {
			diagnosticsSink.publish(diagnostics);
		} catch (RuntimeException e) {
			logger.warn("Failed to publish diagnostics for {}: {}", diagnostics.getFilePath(), e.getMessage(), e);
		}
	}
}
