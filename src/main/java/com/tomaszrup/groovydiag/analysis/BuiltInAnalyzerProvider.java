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
import java.util.Collections;
import java.util.List;

import com.tomaszrup.groovydiag.workspace.ProjectSnapshot;

/**
 * The analyzers shipped with the server: Groovy syntax checking, and
 * optionally the {@code .editorconfig} line-length rule.
 */
public class BuiltInAnalyzerProvider implements AnalyzerProvider {
	private final List<DocumentAnalyzer> analyzers;

	public BuiltInAnalyzerProvider(boolean lineLengthEnabled) {
		List<DocumentAnalyzer> list = new ArrayList<>();
		list.add(new GroovySyntaxAnalyzer());
		if (lineLengthEnabled) {
			list.add(new LineLengthAnalyzer());
		}
		this.analyzers = Collections.unmodifiableList(list);
	}

	@Override
	public List<DocumentAnalyzer> getAnalyzers(ProjectSnapshot project) {
		return analyzers;
	}
}
