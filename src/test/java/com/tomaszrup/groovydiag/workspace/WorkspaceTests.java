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
package com.tomaszrup.groovydiag.workspace;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tomaszrup.groovydiag.TestWorkspaceHelper;

/**
 * Tests for {@link Workspace}: snapshot replacement, change events and the
 * miscellaneous-files project.
 */
class WorkspaceTests {

	private final Path root = Paths.get("/ws/app").toAbsolutePath();
	private final List<WorkspaceChangeEvent> events = new ArrayList<>();
	private final List<Boolean> initializations = new ArrayList<>();
	private Workspace workspace;
	private ProjectSnapshot project;

	@BeforeEach
	void setup() {
		workspace = new Workspace();
		workspace.addChangeListener(events::add);
		workspace.addInitializationListener(initializations::add);
		project = TestWorkspaceHelper.project("app", root, "A.groovy", "B.groovy");
	}

	private List<WorkspaceChangeKind> kinds() {
		List<WorkspaceChangeKind> kinds = new ArrayList<>();
		for (WorkspaceChangeEvent event : events) {
			kinds.add(event.getKind());
		}
		return kinds;
	}

	// ------------------------------------------------------------------
	// Initialization
	// ------------------------------------------------------------------

	@Test
	void testInitializeRaisesSignalWithoutChangeEvents() {
		Assertions.assertFalse(workspace.isInitialized());

		workspace.initialize(Collections.singletonList(project));

		Assertions.assertTrue(workspace.isInitialized());
		Assertions.assertEquals(Collections.singletonList(true), initializations);
		Assertions.assertTrue(events.isEmpty());
		Assertions.assertEquals(2, workspace.getCurrentSnapshot().getDocumentCount());
	}

	@Test
	void testSecondInitializeReloadsSolution() {
		workspace.initialize(Collections.singletonList(project));
		ProjectSnapshot smaller = project.withoutDocument(TestWorkspaceHelper.document(project, "B.groovy").getId());

		workspace.initialize(Collections.singletonList(smaller));

		Assertions.assertEquals(1, initializations.size(), "Signal is raised only once");
		Assertions.assertEquals(Arrays.asList(WorkspaceChangeKind.DOCUMENT_REMOVED,
				WorkspaceChangeKind.SOLUTION_RELOADED), kinds());
	}

	@Test
	void testRemovedListenerIsNotCalled() {
		workspace.initialize(Collections.singletonList(project));
		WorkspaceChangeListener extra = events::add;
		workspace.addChangeListener(extra);
		workspace.removeChangeListener(extra);

		workspace.changeDocumentText(TestWorkspaceHelper.document(project, "A.groovy").getId(), "x");

		Assertions.assertEquals(1, events.size());
	}

	@Test
	void testFailingListenerDoesNotBlockOthers() {
		Workspace ws = new Workspace();
		ws.addChangeListener(event -> {
			throw new IllegalStateException("listener bug");
		});
		List<WorkspaceChangeEvent> seen = new ArrayList<>();
		ws.addChangeListener(seen::add);

		ws.addProject(project);

		Assertions.assertEquals(1, seen.size());
	}

	// ------------------------------------------------------------------
	// Documents
	// ------------------------------------------------------------------

	@Test
	void testDocumentIdSurvivesEditsAndMoves() {
		workspace.initialize(Collections.singletonList(project));
		DocumentId a = TestWorkspaceHelper.document(project, "A.groovy").getId();
		Path moved = root.resolve("src/Moved.groovy");

		Assertions.assertTrue(workspace.changeDocumentText(a, "class A {}"));
		Assertions.assertTrue(workspace.changeDocumentPath(a, moved));

		Assertions.assertEquals(a, workspace.getDocumentId(moved));
		Assertions.assertNull(workspace.getDocumentId(root.resolve("src/A.groovy")));
		Assertions.assertEquals("class A {}", workspace.getCurrentSnapshot().getDocument(a).getText());
		Assertions.assertEquals(Arrays.asList(WorkspaceChangeKind.DOCUMENT_CHANGED,
				WorkspaceChangeKind.DOCUMENT_INFO_CHANGED), kinds());
	}

	@Test
	void testSnapshotsAreImmutable() {
		workspace.initialize(Collections.singletonList(project));
		WorkspaceSnapshot before = workspace.getCurrentSnapshot();
		DocumentId a = TestWorkspaceHelper.document(project, "A.groovy").getId();

		workspace.reloadDocument(a, "reloaded");

		Assertions.assertEquals("// A.groovy", before.getDocument(a).getText(), "Old snapshot must not change");
		Assertions.assertEquals("reloaded", workspace.getCurrentSnapshot().getDocument(a).getText());
		Assertions.assertSame(events.get(0).getNewSnapshot(), workspace.getCurrentSnapshot());
	}

	@Test
	void testAddAndRemoveDocument() {
		workspace.initialize(Collections.singletonList(project));
		Path path = root.resolve("src/C.groovy");

		DocumentId c = workspace.addDocument(project.getId(), path, "class C {}");

		Assertions.assertEquals(c, workspace.getDocumentId(path));
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> workspace.addDocument(project.getId(), path, "again"));
		Assertions.assertTrue(workspace.removeDocument(c));
		Assertions.assertFalse(workspace.removeDocument(c), "Second removal is a no-op");
		Assertions.assertEquals(Arrays.asList(WorkspaceChangeKind.DOCUMENT_ADDED,
				WorkspaceChangeKind.DOCUMENT_REMOVED), kinds());
	}

	@Test
	void testUnknownDocumentMutationsReturnFalse() {
		DocumentId ghost = DocumentId.create("Ghost.groovy");

		Assertions.assertFalse(workspace.changeDocumentText(ghost, "x"));
		Assertions.assertFalse(workspace.reloadDocument(ghost, "x"));
		Assertions.assertFalse(workspace.changeDocumentPath(ghost, root.resolve("x.groovy")));
		Assertions.assertTrue(events.isEmpty());
	}

	// ------------------------------------------------------------------
	// Projects
	// ------------------------------------------------------------------

	@Test
	void testUpdateProjectReportsDroppedDocuments() {
		workspace.initialize(Collections.singletonList(project));
		DocumentId b = TestWorkspaceHelper.document(project, "B.groovy").getId();

		workspace.updateProject(project.withoutDocument(b));

		Assertions.assertEquals(Arrays.asList(WorkspaceChangeKind.DOCUMENT_REMOVED,
				WorkspaceChangeKind.PROJECT_CHANGED), kinds());
		Assertions.assertEquals(b, events.get(0).getDocumentId());
	}

	@Test
	void testRemoveProjectRemovesItsDocuments() {
		workspace.initialize(Collections.singletonList(project));

		Assertions.assertTrue(workspace.removeProject(project.getId()));

		Assertions.assertEquals(0, workspace.getCurrentSnapshot().getDocumentCount());
		Assertions.assertEquals(Arrays.asList(WorkspaceChangeKind.DOCUMENT_REMOVED,
				WorkspaceChangeKind.DOCUMENT_REMOVED, WorkspaceChangeKind.PROJECT_REMOVED), kinds());
		Assertions.assertFalse(workspace.removeProject(project.getId()));
	}

	@Test
	void testAddingDuplicateProjectIsRejected() {
		workspace.addProject(project);

		Assertions.assertThrows(IllegalArgumentException.class, () -> workspace.addProject(project));
	}

	@Test
	void testFindProjectForPathPrefersDeepestRoot() {
		ProjectSnapshot nested = TestWorkspaceHelper.project("lib", root.resolve("lib"), "L.groovy");
		workspace.initialize(Arrays.asList(project, nested));

		Assertions.assertEquals(nested.getId(),
				workspace.findProjectForPath(root.resolve("lib/src/L.groovy")).getId());
		Assertions.assertEquals(project.getId(), workspace.findProjectForPath(root.resolve("src/A.groovy")).getId());
		Assertions.assertNull(workspace.findProjectForPath(Paths.get("/elsewhere/X.groovy").toAbsolutePath()));
	}

	@Test
	void testAnalyzerConfigChangeUpdatesProject() {
		workspace.initialize(Collections.singletonList(project));
		Path config = root.resolve(".editorconfig");

		workspace.changeAnalyzerConfig(project.getId(), config, true);
		Assertions.assertEquals(Collections.singletonList(config),
				workspace.getCurrentSnapshot().getProject(project.getId()).getAnalyzerConfigPaths());

		workspace.changeAnalyzerConfig(project.getId(), config, false);
		Assertions.assertTrue(
				workspace.getCurrentSnapshot().getProject(project.getId()).getAnalyzerConfigPaths().isEmpty());
		Assertions.assertEquals(Arrays.asList(WorkspaceChangeKind.ANALYZER_CONFIG_DOCUMENT_CHANGED,
				WorkspaceChangeKind.ANALYZER_CONFIG_DOCUMENT_CHANGED), kinds());
	}

	// ------------------------------------------------------------------
	// Miscellaneous files
	// ------------------------------------------------------------------

	@Test
	void testMiscellaneousProjectIsCreatedOnceAndSurvivesReload() {
		workspace.initialize(Collections.singletonList(project));

		ProjectId misc = workspace.getOrCreateMiscellaneousProject();
		Assertions.assertEquals(misc, workspace.getOrCreateMiscellaneousProject());
		workspace.addDocument(misc, Paths.get("/tmp/Scratch.groovy").toAbsolutePath(), "println 1");

		workspace.reloadSolution(Collections.emptyList());

		ProjectSnapshot survivor = workspace.getCurrentSnapshot().getProject(misc);
		Assertions.assertNotNull(survivor);
		Assertions.assertTrue(survivor.isMiscellaneous());
		Assertions.assertEquals(Workspace.MISCELLANEOUS_PROJECT_NAME, survivor.getName());
		Assertions.assertEquals(1, survivor.getDocumentIds().size());
	}

	@Test
	void testBuildProjectWinsPathLookupOverMiscellaneousCopy() {
		workspace.initialize(Collections.emptyList());
		ProjectId misc = workspace.getOrCreateMiscellaneousProject();
		Path path = root.resolve("src/A.groovy");
		DocumentId orphan = workspace.addDocument(misc, path, "open buffer");

		workspace.addProject(project);

		Assertions.assertNotEquals(orphan, workspace.getDocumentId(path));
		Assertions.assertEquals(TestWorkspaceHelper.document(project, "A.groovy").getId(),
				workspace.getDocumentId(path));
	}
}
