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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.jsonrpc.CancelChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.groovydiag.workspace.DocumentSnapshot;
import com.tomaszrup.groovydiag.workspace.ProjectSnapshot;

/**
 * Runs each analyzer in turn and concatenates their diagnostics.
 *
 * <p>A failing analyzer is logged and skipped; the others still run.
 * Cancellation aborts the whole document. Documents of the miscellaneous-files
 * project only get syntax-only analyzers.</p>
 */
public class DefaultAnalyzerEngine implements AnalyzerEngine {
	private static final Logger logger = LoggerFactory.getLogger(DefaultAnalyzerEngine.class);

	@Override
	public List<Diagnostic> analyze(ProjectSnapshot project, List<DocumentAnalyzer> analyzers,
			AnalysisContext context, DocumentSnapshot document, CancelChecker cancelChecker) {
		List<Diagnostic> diagnostics = new ArrayList<>();
		for (DocumentAnalyzer analyzer : analyzers) {
			if (project.isMiscellaneous() && !analyzer.isSyntaxOnly()) {
				continue;
			}
			cancelChecker.checkCanceled();
			try {
				diagnostics.addAll(analyzer.analyze(context, document, cancelChecker));
			} catch (CancellationException e) {
				throw e;
			} catch (RuntimeException e) {
				logger.debug("Analyzer {} failed on {}: {}", analyzer.getId(), document.getPath(), e.getMessage(), e);
			}
		}
		return diagnostics;
	}
}
