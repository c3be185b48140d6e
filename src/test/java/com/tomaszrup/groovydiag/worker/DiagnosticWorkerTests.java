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
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.groovydiag.worker;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tomaszrup.groovydiag.ExecutorPools;
import com.tomaszrup.groovydiag.TestWorkspaceHelper;
import com.tomaszrup.groovydiag.analysis.AnalysisContextFactory;
import com.tomaszrup.groovydiag.analysis.AnalyzerEngine;
import com.tomaszrup.groovydiag.workspace.DocumentId;
import com.tomaszrup.groovydiag.workspace.DocumentSnapshot;
import com.tomaszrup.groovydiag.workspace.ProjectId;
import com.tomaszrup.groovydiag.workspace.ProjectSnapshot;
import com.tomaszrup.groovydiag.workspace.Workspace;

/**
 * End-to-end tests for {@link DiagnosticWorker} driven through a real
 * {@link Workspace} and {@link WorkspaceChangeHandler}, with a scripted
 * analyzer engine.
 */
class DiagnosticWorkerTests {

	private static final long AWAIT_MS = 5000;

	private final Path root = Paths.get("/ws/app").toAbsolutePath();
	private final List<DocumentDiagnostics> published = new CopyOnWriteArrayList<>();
	private final List<String> statuses = new CopyOnWriteArrayList<>();
	private final List<String> analyzed = new CopyOnWriteArrayList<>();

	private volatile AnalyzerEngine behavior;
	private ExecutorPools pools;
	private Workspace workspace;
	private DiagnosticWorker worker;
	private WorkspaceChangeHandler handler;

	@BeforeEach
	void setup() {
		pools = new ExecutorPools();
		workspace = new Workspace();
		behavior = (project, analyzers, context, document, checker) -> Collections.singletonList(
				TestWorkspaceHelper.diagnostic(document.getText()));
	}

	@AfterEach
	void tearDown() {
		if (handler != null) {
			handler.stop();
		}
		if (worker != null) {
			worker.shutdown();
		}
		pools.shutdownAll();
	}

	private DiagnosticWorker createWorker(int threads, long timeoutMs) {
		AnalyzerEngine recording = (project, analyzers, context, document, checker) -> {
			analyzed.add(document.getName());
			return behavior.analyze(project, analyzers, context, document, checker);
		};
		worker = new DiagnosticWorker(workspace, recording, project -> Collections.emptyList(),
				new AnalysisContextFactory(), new DiagnosticWorkerOptions(threads, timeoutMs), pools,
				published::add,
				(status, projectCount, documentCount, remaining) -> statuses
						.add(status + " " + projectCount + "/" + documentCount + "/" + remaining));
		return worker;
	}

	private void startWithHandler(int threads, long timeoutMs) {
		createWorker(threads, timeoutMs).start();
		handler = new WorkspaceChangeHandler(workspace, worker);
		handler.start();
	}

	private boolean analyzedCount(int count) throws InterruptedException {
		return TestWorkspaceHelper.waitFor(() -> worker.getCache().size() == count, AWAIT_MS);
	}

	// ------------------------------------------------------------------
	// Background sweep
	// ------------------------------------------------------------------

	@Test
	void testInitializationAnalyzesEveryDocumentInBackground() throws Exception {
		startWithHandler(2, AWAIT_MS);
		ProjectSnapshot project = TestWorkspaceHelper.project("app", root, "A.groovy", "B.groovy", "C.groovy");

		workspace.initialize(Collections.singletonList(project));

		Assertions.assertTrue(analyzedCount(3), "Every document should be analyzed");
		Assertions.assertTrue(TestWorkspaceHelper.waitFor(() -> statuses.contains("FINISHED 1/3/0"), AWAIT_MS));
		Assertions.assertEquals("STARTED 1/3/3", statuses.get(0));
		Assertions.assertEquals(3, published.size(), "Each analysis is published once");
		DocumentSnapshot b = TestWorkspaceHelper.document(project, "B.groovy");
		Assertions.assertEquals("// B.groovy",
				worker.getCache().get(b.getId()).getDiagnostics().get(0).getMessage());
	}

	@Test
	void testGetDiagnosticsPromotesPendingDocument() throws Exception {
		CountDownLatch entered = new CountDownLatch(1);
		CountDownLatch gate = new CountDownLatch(1);
		behavior = (project, analyzers, context, document, checker) -> {
			if ("A.groovy".equals(document.getName())) {
				entered.countDown();
				try {
					gate.await(AWAIT_MS, TimeUnit.MILLISECONDS);
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
			}
			return Collections.singletonList(TestWorkspaceHelper.diagnostic(document.getName()));
		};
		startWithHandler(1, 10_000);
		ProjectSnapshot project = TestWorkspaceHelper.project("app", root, "A.groovy", "B.groovy", "C.groovy");
		DocumentSnapshot c = TestWorkspaceHelper.document(project, "C.groovy");
		workspace.initialize(Collections.singletonList(project));
		Assertions.assertTrue(entered.await(AWAIT_MS, TimeUnit.MILLISECONDS));

		CompletableFuture<List<DocumentDiagnostics>> request =
				worker.getDiagnostics(Collections.singletonList(c.getPath()));
		Assertions.assertTrue(TestWorkspaceHelper.waitFor(
				() -> worker.getWorkQueue().getPendingWorkType(c.getId()) == AnalyzerWorkType.FOREGROUND, AWAIT_MS),
				"Requested document should be promoted while still pending");
		gate.countDown();

		List<DocumentDiagnostics> result = request.get(AWAIT_MS, TimeUnit.MILLISECONDS);
		Assertions.assertEquals(1, result.size());
		Assertions.assertEquals(c.getId(), result.get(0).getDocumentId());
		Assertions.assertTrue(analyzedCount(3));
		Assertions.assertEquals(Arrays.asList("A.groovy", "C.groovy", "B.groovy"), analyzed,
				"Promoted document runs before the rest of the background batch");
	}

	@Test
	void testGetDiagnosticsIgnoresUnknownPaths() throws Exception {
		startWithHandler(1, AWAIT_MS);
		workspace.initialize(Collections.emptyList());

		List<DocumentDiagnostics> result = worker.getDiagnostics(
				Collections.singletonList(root.resolve("Nope.groovy"))).get(AWAIT_MS, TimeUnit.MILLISECONDS);

		Assertions.assertTrue(result.isEmpty());
	}

	// ------------------------------------------------------------------
	// Failure isolation
	// ------------------------------------------------------------------

	@Test
	void testHungAnalyzerTimesOutAndWorkerContinues() throws Exception {
		CountDownLatch never = new CountDownLatch(1);
		behavior = (project, analyzers, context, document, checker) -> {
			if ("Hung.groovy".equals(document.getName())) {
				try {
					never.await();
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
			}
			return Collections.singletonList(TestWorkspaceHelper.diagnostic(document.getName()));
		};
		startWithHandler(1, 200);
		ProjectSnapshot project = TestWorkspaceHelper.project("app", root, "Hung.groovy", "Ok.groovy");

		workspace.initialize(Collections.singletonList(project));

		Assertions.assertTrue(analyzedCount(2), "Worker should move past the hung document");
		Assertions.assertTrue(worker.getCache().get(TestWorkspaceHelper.document(project, "Hung.groovy").getId())
				.getDiagnostics().isEmpty(), "Timed-out document gets an empty snapshot");
		Assertions.assertEquals(1, worker.getCache().get(TestWorkspaceHelper.document(project, "Ok.groovy").getId())
				.getDiagnostics().size());
	}

	@Test
	void testThrowingAnalyzerLeavesEmptySnapshot() throws Exception {
		behavior = (project, analyzers, context, document, checker) -> {
			if ("Bad.groovy".equals(document.getName())) {
				throw new IllegalStateException("analyzer defect");
			}
			return Collections.singletonList(TestWorkspaceHelper.diagnostic(document.getName()));
		};
		startWithHandler(2, AWAIT_MS);
		ProjectSnapshot project = TestWorkspaceHelper.project("app", root, "Bad.groovy", "Good.groovy");

		workspace.initialize(Collections.singletonList(project));

		Assertions.assertTrue(analyzedCount(2));
		DocumentId bad = TestWorkspaceHelper.document(project, "Bad.groovy").getId();
		Assertions.assertTrue(worker.getCache().get(bad).getDiagnostics().isEmpty());
	}

	// ------------------------------------------------------------------
	// Cache maintenance
	// ------------------------------------------------------------------

	@Test
	void testDocumentChangeReplacesCachedDiagnostics() throws Exception {
		startWithHandler(1, AWAIT_MS);
		ProjectSnapshot project = TestWorkspaceHelper.project("app", root, "A.groovy");
		DocumentId a = TestWorkspaceHelper.document(project, "A.groovy").getId();
		workspace.initialize(Collections.singletonList(project));
		Assertions.assertTrue(analyzedCount(1));

		workspace.changeDocumentText(a, "edited");

		Assertions.assertTrue(TestWorkspaceHelper.waitFor(
				() -> "edited".equals(worker.getCache().get(a).getDiagnostics().get(0).getMessage()), AWAIT_MS),
				"Edit should replace the cached snapshot");
		Assertions.assertEquals(1, worker.getCache().get(a).getDiagnostics().size());
	}

	@Test
	void testRemovedDocumentDropsCacheAndPublishesEmptyList() throws Exception {
		startWithHandler(1, AWAIT_MS);
		ProjectSnapshot project = TestWorkspaceHelper.project("app", root, "A.groovy", "B.groovy");
		DocumentSnapshot a = TestWorkspaceHelper.document(project, "A.groovy");
		workspace.initialize(Collections.singletonList(project));
		Assertions.assertTrue(TestWorkspaceHelper.waitFor(() -> published.size() == 2, AWAIT_MS));

		workspace.removeDocument(a.getId());

		Assertions.assertFalse(worker.getCache().contains(a.getId()));
		DocumentDiagnostics last = published.get(published.size() - 1);
		Assertions.assertEquals(a.getPath(), last.getFilePath());
		Assertions.assertTrue(last.getDiagnostics().isEmpty(), "Client should be told to clear the file");
		Assertions.assertEquals(1, worker.getAllDiagnostics().size());
	}

	@Test
	void testCancelledItemDoesNotOverwriteCache() throws Exception {
		createWorker(1, AWAIT_MS);
		ProjectSnapshot project = TestWorkspaceHelper.project("app", root, "A.groovy");
		DocumentSnapshot a = TestWorkspaceHelper.document(project, "A.groovy");
		workspace.initialize(Collections.singletonList(project));
		DocumentDiagnostics previous = new DocumentDiagnostics(a.getId(), a.getPath(), project.getId(), "app",
				Collections.singletonList(TestWorkspaceHelper.diagnostic("previous")));
		worker.getCache().put(previous);
		CancellationToken token = new CancellationToken();
		token.cancel();
		WorkBatch batch = new WorkBatch(1, 1, AnalyzerWorkType.FOREGROUND);

		worker.processItem(new QueueItem(a.getId(), AnalyzerWorkType.FOREGROUND, token,
				Collections.singletonList(batch)));

		Assertions.assertSame(previous, worker.getCache().get(a.getId()));
		Assertions.assertTrue(published.isEmpty());
	}

	@Test
	void testItemForVanishedDocumentIsSkipped() throws Exception {
		createWorker(1, AWAIT_MS);
		workspace.initialize(Collections.emptyList());
		DocumentId ghost = DocumentId.create("Ghost.groovy");

		worker.processItem(new QueueItem(ghost, AnalyzerWorkType.BACKGROUND, new CancellationToken(),
				Collections.singletonList(new WorkBatch(1, 1, AnalyzerWorkType.BACKGROUND))));

		Assertions.assertTrue(analyzed.isEmpty(), "Engine should not run for a removed document");
		Assertions.assertEquals(0, worker.getCache().size());
	}

	// ------------------------------------------------------------------
	// Direct analysis
	// ------------------------------------------------------------------

	@Test
	void testAnalyzeDocumentAsyncBypassesQueueAndCache() throws Exception {
		createWorker(1, AWAIT_MS).start();
		ProjectSnapshot project = TestWorkspaceHelper.project("app", root, "A.groovy");
		workspace.addProject(project);

		DocumentDiagnostics result = worker.analyzeDocumentAsync(TestWorkspaceHelper.document(project, "A.groovy"),
				new CancellationToken()).get(AWAIT_MS, TimeUnit.MILLISECONDS);

		Assertions.assertEquals(1, result.getDiagnostics().size());
		Assertions.assertEquals("app", result.getProjectName());
		Assertions.assertEquals(0, worker.getCache().size(), "Direct analysis must not touch the cache");
	}

	@Test
	void testAnalyzeDocumentAsyncWithCancelledToken() {
		createWorker(1, AWAIT_MS).start();
		ProjectSnapshot project = TestWorkspaceHelper.project("app", root, "A.groovy");
		workspace.addProject(project);
		CancellationToken token = new CancellationToken();
		token.cancel();

		CompletableFuture<DocumentDiagnostics> future =
				worker.analyzeDocumentAsync(TestWorkspaceHelper.document(project, "A.groovy"), token);

		CompletionException thrown = Assertions.assertThrows(CompletionException.class, future::join);
		Assertions.assertTrue(thrown.getCause() instanceof CancellationException);
	}

	@Test
	void testAnalyzeDocumentAsyncForUnknownProjectIsEmpty() throws Exception {
		createWorker(1, AWAIT_MS).start();
		ProjectSnapshot detached = TestWorkspaceHelper.project("detached", root, "A.groovy");

		DocumentDiagnostics result = worker.analyzeDocumentAsync(TestWorkspaceHelper.document(detached, "A.groovy"),
				CancellationToken.none()).get(AWAIT_MS, TimeUnit.MILLISECONDS);

		Assertions.assertTrue(result.getDiagnostics().isEmpty());
		Assertions.assertTrue(analyzed.isEmpty());
	}

	@Test
	void testAnalyzeProjectsAsyncWaitsForTheProject() throws Exception {
		createWorker(2, AWAIT_MS).start();
		ProjectSnapshot project = TestWorkspaceHelper.project("app", root, "A.groovy", "B.groovy");
		workspace.addProject(project);

		List<DocumentDiagnostics> result = worker.analyzeProjectsAsync(project, CancellationToken.none())
				.get(AWAIT_MS, TimeUnit.MILLISECONDS);

		Assertions.assertEquals(2, result.size());
		Assertions.assertTrue(statuses.isEmpty(), "Foreground work is not reported as a background sweep");
	}

	// ------------------------------------------------------------------
	// Queueing
	// ------------------------------------------------------------------

	@Test
	void testQueueDocumentsForDiagnosticsSkipsUnknownProjects() {
		createWorker(1, AWAIT_MS);
		ProjectSnapshot project = TestWorkspaceHelper.project("app", root, "A.groovy", "B.groovy");
		workspace.addProject(project);

		List<DocumentId> queued = worker.queueDocumentsForDiagnostics(
				Arrays.asList(project.getId(), ProjectId.create("ghost")));

		Assertions.assertEquals(2, queued.size());
		Assertions.assertEquals(2, worker.getWorkQueue().getPendingCount());
		Assertions.assertEquals(AnalyzerWorkType.BACKGROUND,
				worker.getWorkQueue().getPendingWorkType(queued.get(0)));
	}

	@Test
	void testBatchCountsOnlyProjectsWithDocuments() throws Exception {
		createWorker(1, AWAIT_MS);
		ProjectSnapshot project = TestWorkspaceHelper.project("app", root, "A.groovy", "B.groovy");
		ProjectSnapshot empty = TestWorkspaceHelper.project("empty", Paths.get("/ws/empty").toAbsolutePath());
		workspace.initialize(Arrays.asList(project, empty));
		workspace.getOrCreateMiscellaneousProject();

		List<DocumentId> queued = worker.queueDocumentsForDiagnostics();

		Assertions.assertEquals(2, queued.size());
		WorkBatch batch = worker.getWorkQueue().takeWork().getBatches().get(0);
		Assertions.assertEquals(1, batch.getProjectCount());
		Assertions.assertEquals(2, batch.getDocumentCount());
	}

	@Test
	void testSelectedEmptyProjectIsNotCounted() throws Exception {
		createWorker(1, AWAIT_MS);
		ProjectSnapshot project = TestWorkspaceHelper.project("app", root, "A.groovy");
		ProjectSnapshot empty = TestWorkspaceHelper.project("empty", Paths.get("/ws/empty").toAbsolutePath());
		workspace.initialize(Arrays.asList(project, empty));

		worker.queueDocumentsForDiagnostics(Arrays.asList(project.getId(), empty.getId()));

		Assertions.assertEquals(1, worker.getWorkQueue().takeWork().getBatches().get(0).getProjectCount());
	}

	@Test
	void testShutdownClosesQueue() {
		createWorker(2, AWAIT_MS).start();

		worker.shutdown();

		Assertions.assertTrue(worker.getWorkQueue().isClosed());
		worker.queueDocumentsForDiagnostics();
		Assertions.assertEquals(0, worker.getWorkQueue().getPendingCount());
	}
}
