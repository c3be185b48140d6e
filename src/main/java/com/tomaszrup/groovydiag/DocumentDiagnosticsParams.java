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
package com.tomaszrup.groovydiag;

import java.util.ArrayList;
import java.util.List;

import org.eclipse.lsp4j.Diagnostic;

import com.tomaszrup.groovydiag.worker.DocumentDiagnostics;

/**
 * Diagnostics of one file as returned by the {@code groovy/*Diagnostics}
 * requests.
 */
public class DocumentDiagnosticsParams {

    private String uri;
    private String projectName;
    private List<Diagnostic> diagnostics = new ArrayList<>();

    public DocumentDiagnosticsParams() {
    }

    public DocumentDiagnosticsParams(String uri, String projectName, List<Diagnostic> diagnostics) {
        this.uri = uri;
        this.projectName = projectName;
        this.diagnostics = diagnostics;
    }

    public static DocumentDiagnosticsParams from(DocumentDiagnostics diagnostics) {
        return new DocumentDiagnosticsParams(diagnostics.getFilePath().toUri().toString(),
                diagnostics.getProjectName(), new ArrayList<>(diagnostics.getDiagnostics()));
    }

    public static List<DocumentDiagnosticsParams> fromAll(List<DocumentDiagnostics> diagnostics) {
        List<DocumentDiagnosticsParams> result = new ArrayList<>(diagnostics.size());
        for (DocumentDiagnostics entry : diagnostics) {
            result.add(from(entry));
        }
        return result;
    }

    public String getUri() {
        return uri;
    }

    public void setUri(String uri) {
        this.uri = uri;
    }

    public String getProjectName() {
        return projectName;
    }

    public void setProjectName(String projectName) {
        this.projectName = projectName;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public void setDiagnostics(List<Diagnostic> diagnostics) {
        this.diagnostics = diagnostics;
    }
}
