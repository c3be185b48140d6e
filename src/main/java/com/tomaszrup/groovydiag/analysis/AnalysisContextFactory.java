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

import java.nio.charset.StandardCharsets;

import org.codehaus.groovy.control.CompilerConfiguration;

import com.tomaszrup.groovydiag.workspace.ProjectSnapshot;

/**
 * Builds the {@link AnalysisContext} for a project from its current snapshot.
 */
public class AnalysisContextFactory {
	/** Number of errors the compiler collects before giving up on a source. */
	private static final int COMPILER_TOLERANCE = 10;

	public AnalysisContext create(ProjectSnapshot project) {
		AnalyzerOptions options = project.isMiscellaneous()
				? AnalyzerOptions.EMPTY
				: AnalyzerOptions.load(project.getAnalyzerConfigPaths());
		return new AnalysisContext(project, getConfiguration(), options);
	}

	protected CompilerConfiguration getConfiguration() {
		CompilerConfiguration compilerConfiguration = new CompilerConfiguration();
		compilerConfiguration.setSourceEncoding(StandardCharsets.UTF_8.name());
		compilerConfiguration.setTolerance(COMPILER_TOLERANCE);
		return compilerConfiguration;
	}
}
