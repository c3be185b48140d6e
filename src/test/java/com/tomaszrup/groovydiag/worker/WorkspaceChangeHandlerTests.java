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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tomaszrup.groovydiag.ExecutorPools;
import com.tomaszrup.groovydiag.TestWorkspaceHelper;
import com.tomaszrup.groovydiag.analysis.AnalysisContextFactory;
import com.tomaszrup.groovydiag.workspace.DocumentId;
import com.tomaszrup.groovydiag.workspace.DocumentSnapshot;
import com.tomaszrup.groovydiag.workspace.ProjectSnapshot;
import com.tomaszrup.groovydiag.workspace.Workspace;

/**
 * Tests for {@link WorkspaceChangeHandler}. The worker is never started, so
 * queued work stays pending and can be inspected.
 */
class WorkspaceChangeHandlerTests {

	private final Path root = Paths.get("/ws/app").toAbsolutePath();
	private ExecutorPools pools;
	private Workspace workspace;
	private DiagnosticWorker worker;
	private AnalyzerWorkQueue queue;
	private WorkspaceChangeHandler handler;
	private ProjectSnapshot project;
	private DocumentSnapshot a;
	private DocumentSnapshot b;

	@BeforeEach
	void setup() {
		pools = new ExecutorPools();
		workspace = new Workspace();
		worker = new DiagnosticWorker(workspace, (p, analyzers, context, document, checker) -> Collections.emptyList(),
				p -> Collections.emptyList(), new AnalysisContextFactory(), new DiagnosticWorkerOptions(1, 1000), pools,
				DiagnosticsSink.NOOP, BackgroundStatusSink.NOOP);
		queue = worker.getWorkQueue();
		handler = new WorkspaceChangeHandler(workspace, worker);
		project = TestWorkspaceHelper.project("app", root, "A.groovy", "B.groovy");
		a = TestWorkspaceHelper.document(project, "A.groovy");
		b = TestWorkspaceHelper.document(project, "B.groovy");
	}

	@AfterEach
	void tearDown() {
		handler.stop();
		worker.shutdown();
		pools.shutdownAll();
	}

	@Test
	void testInitializationQueuesEverythingInBackground() {
		handler.start();

		workspace.initialize(Collections.singletonList(project));

		Assertions.assertEquals(2, queue.getPendingCount());
		Assertions.assertEquals(AnalyzerWorkType.BACKGROUND, queue.getPendingWorkType(a.getId()));
	}

	@Test
	void testStartOnInitializedWorkspaceQueuesEverything() {
		workspace.initialize(Collections.singletonList(project));

		handler.start();

		Assertions.assertEquals(2, queue.getPendingCount());
	}

	@Test
	void testDocumentEditIsForeground() {
		workspace.initialize(Collections.singletonList(project));
		handler.start();

		workspace.changeDocumentText(b.getId(), "class B {}");

		Assertions.assertEquals(AnalyzerWorkType.FOREGROUND, queue.getPendingWorkType(b.getId()),
				"Edited document should be promoted by the merge");
		Assertions.assertEquals(AnalyzerWorkType.BACKGROUND, queue.getPendingWorkType(a.getId()));
	}

	@Test
	void testDocumentAddedIsForeground() {
		handler.start();
		workspace.initialize(Collections.singletonList(project));

		workspace.addDocument(project.getId(), root.resolve("src/C.groovy"), "class C {}");

		Assertions.assertEquals(1, queue.getPendingForegroundCount());
		Assertions.assertEquals(3, queue.getPendingCount());
	}

	@Test
	void testDocumentMoveIsForeground() {
		workspace.initialize(Collections.singletonList(project));
		handler.start();

		workspace.changeDocumentPath(b.getId(), root.resolve("src/Renamed.groovy"));

		Assertions.assertEquals(AnalyzerWorkType.FOREGROUND, queue.getPendingWorkType(b.getId()));
	}

	@Test
	void testDocumentRemovalDropsCachedDiagnostics() {
		workspace.initialize(Collections.singletonList(project));
		handler.start();
		worker.getCache().put(new DocumentDiagnostics(a.getId(), a.getPath(), project.getId(), "app",
				Collections.singletonList(TestWorkspaceHelper.diagnostic("stale"))));

		workspace.removeDocument(a.getId());

		Assertions.assertFalse(worker.getCache().contains(a.getId()));
	}

	/** Dispatches and acknowledges everything pending, as the worker pool would. */
	private void drain() throws InterruptedException {
		while (queue.getPendingCount() > 0) {
			queue.workComplete(queue.takeWork());
		}
	}

	/** Takes every pending item without acknowledging it. */
	private List<QueueItem> takeAll() throws InterruptedException {
		List<QueueItem> items = new ArrayList<>();
		while (queue.getPendingCount() > 0) {
			items.add(queue.takeWork());
		}
		return items;
	}

	@Test
	void testProjectAddedQueuesTheProjectInBackground() {
		handler.start();
		workspace.initialize(Collections.emptyList());

		workspace.addProject(project);

		Assertions.assertEquals(2, queue.getPendingCount());
		Assertions.assertEquals(0, queue.getPendingForegroundCount());
	}

	@Test
	void testAnalyzerConfigChangeQueuesNewBackgroundBatch() throws InterruptedException {
		handler.start();
		workspace.initialize(Collections.singletonList(project));
		drain();

		workspace.changeAnalyzerConfig(project.getId(), root.resolve(".editorconfig"), true);

		List<QueueItem> items = takeAll();
		Assertions.assertEquals(2, items.size());
		WorkBatch batch = items.get(0).getBatches().get(0);
		for (QueueItem item : items) {
			Assertions.assertEquals(AnalyzerWorkType.BACKGROUND, item.getWorkType());
			Assertions.assertEquals(Collections.singletonList(batch), item.getBatches());
		}
		Assertions.assertEquals(2, batch.getDocumentCount());
		Assertions.assertEquals(1, batch.getProjectCount());
	}

	@Test
	void testSolutionReloadQueuesEveryDocumentInBackground() throws InterruptedException {
		ProjectSnapshot other = TestWorkspaceHelper.project("lib", Paths.get("/ws/lib").toAbsolutePath(),
				"L.groovy");
		handler.start();
		workspace.initialize(Collections.singletonList(project));
		drain();

		workspace.reloadSolution(Arrays.asList(project, other));

		List<QueueItem> items = takeAll();
		Set<DocumentId> queued = new HashSet<>();
		for (QueueItem item : items) {
			Assertions.assertEquals(AnalyzerWorkType.BACKGROUND, item.getWorkType());
			queued.add(item.getDocumentId());
		}
		Assertions.assertEquals(new HashSet<>(workspace.getCurrentSnapshot().getDocumentIds()), queued);
		WorkBatch batch = items.get(0).getBatches().get(0);
		Assertions.assertEquals(3, batch.getDocumentCount());
		Assertions.assertEquals(2, batch.getProjectCount());
	}

	@Test
	void testStopUnsubscribes() {
		handler.start();
		handler.stop();

		workspace.initialize(Collections.singletonList(project));
		workspace.changeDocumentText(a.getId(), "changed");

		Assertions.assertEquals(0, queue.getPendingCount());
	}
}
