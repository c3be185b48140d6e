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

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.eclipse.lsp4j.Diagnostic;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.groovydiag.TestWorkspaceHelper;
import com.tomaszrup.groovydiag.workspace.DocumentId;
import com.tomaszrup.groovydiag.workspace.ProjectId;

class DiagnosticResultCacheTests {

	private final DiagnosticResultCache cache = new DiagnosticResultCache();
	private final ProjectId projectId = ProjectId.create("app");

	private DocumentDiagnostics entry(DocumentId documentId, String... messages) {
		List<Diagnostic> diagnostics = new ArrayList<>();
		for (String message : messages) {
			diagnostics.add(TestWorkspaceHelper.diagnostic(message));
		}
		return new DocumentDiagnostics(documentId, Paths.get("/ws/app/src/" + documentId + ".groovy"), projectId,
				"app", diagnostics);
	}

	@Test
	void testLastWriterWins() {
		DocumentId a = DocumentId.create("A.groovy");
		cache.put(entry(a, "old"));
		cache.put(entry(a, "new", "newer"));

		Assertions.assertEquals(1, cache.size());
		Assertions.assertEquals(2, cache.get(a).getDiagnostics().size(), "Entries are replaced, never merged");
	}

	@Test
	void testGetAllSkipsMissingAndKeepsArgumentOrder() {
		DocumentId a = DocumentId.create("A.groovy");
		DocumentId b = DocumentId.create("B.groovy");
		DocumentId missing = DocumentId.create("Missing.groovy");
		cache.put(entry(a));
		cache.put(entry(b));

		List<DocumentDiagnostics> result = cache.getAll(Arrays.asList(b, missing, a));

		Assertions.assertEquals(2, result.size());
		Assertions.assertEquals(b, result.get(0).getDocumentId());
		Assertions.assertEquals(a, result.get(1).getDocumentId());
	}

	@Test
	void testRemoveReturnsRemovedEntry() {
		DocumentId a = DocumentId.create("A.groovy");
		cache.put(entry(a, "x"));

		DocumentDiagnostics removed = cache.remove(a);

		Assertions.assertNotNull(removed);
		Assertions.assertFalse(cache.contains(a));
		Assertions.assertNull(cache.remove(a), "Second removal finds nothing");
		Assertions.assertTrue(cache.getAll(Collections.singletonList(a)).isEmpty());
	}

	@Test
	void testEntriesAreImmutable() {
		DocumentId a = DocumentId.create("A.groovy");
		cache.put(entry(a, "x"));

		Assertions.assertThrows(UnsupportedOperationException.class,
				() -> cache.get(a).getDiagnostics().clear());
	}
}
