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

import org.codehaus.groovy.control.CompilerConfiguration;

import com.tomaszrup.groovydiag.workspace.ProjectSnapshot;

/**
 * Everything an analyzer needs besides the document: the owning project, the
 * compiler configuration for it and its analyzer options.
 */
public final class AnalysisContext {
	private final ProjectSnapshot project;
	private final CompilerConfiguration compilerConfiguration;
	private final AnalyzerOptions options;

	public AnalysisContext(ProjectSnapshot project, CompilerConfiguration compilerConfiguration,
			AnalyzerOptions options) {
		this.project = project;
		this.compilerConfiguration = compilerConfiguration;
		this.options = options;
	}

	public ProjectSnapshot getProject() {
		return project;
	}

	public CompilerConfiguration getCompilerConfiguration() {
		return compilerConfiguration;
	}

	public AnalyzerOptions getOptions() {
		return options;
	}
}
