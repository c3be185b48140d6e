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
package com.tomaszrup.groovydiag.analysis;

import java.util.List;

import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.jsonrpc.CancelChecker;

import com.tomaszrup.groovydiag.workspace.DocumentSnapshot;
import com.tomaszrup.groovydiag.workspace.ProjectSnapshot;

/**
 * Runs an analyzer set over one document.
 *
 * <p>Implementations signal cancellation by throwing
 * {@link java.util.concurrent.CancellationException} (usually through
 * {@link CancelChecker#checkCanceled()}). Any other exception is an analyzer
 * defect; callers convert it to an empty result.</p>
 */
@FunctionalInterface
public interface AnalyzerEngine {
	List<Diagnostic> analyze(ProjectSnapshot project, List<DocumentAnalyzer> analyzers, AnalysisContext context,
			DocumentSnapshot document, CancelChecker cancelChecker);
}
