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

import com.tomaszrup.groovydiag.worker.BackgroundDiagnosticStatus;

/**
 * Parameters for the {@code groovy/backgroundDiagnosticStatus} notification,
 * sent while a background analysis sweep runs.
 */
public class BackgroundDiagnosticStatusParams {

    private BackgroundDiagnosticStatus status;
    private int numberProjects;
    private int numberFilesTotal;
    private int numberFilesRemaining;

    public BackgroundDiagnosticStatusParams() {
    }

    public BackgroundDiagnosticStatusParams(BackgroundDiagnosticStatus status, int numberProjects,
            int numberFilesTotal, int numberFilesRemaining) {
        this.status = status;
        this.numberProjects = numberProjects;
        this.numberFilesTotal = numberFilesTotal;
        this.numberFilesRemaining = numberFilesRemaining;
    }

    public BackgroundDiagnosticStatus getStatus() {
        return status;
    }

    public void setStatus(BackgroundDiagnosticStatus status) {
        this.status = status;
    }

    public int getNumberProjects() {
        return numberProjects;
    }

    public void setNumberProjects(int numberProjects) {
        this.numberProjects = numberProjects;
    }

    public int getNumberFilesTotal() {
        return numberFilesTotal;
    }

    public void setNumberFilesTotal(int numberFilesTotal) {
        this.numberFilesTotal = numberFilesTotal;
    }

    public int getNumberFilesRemaining() {
        return numberFilesRemaining;
    }

    public void setNumberFilesRemaining(int numberFilesRemaining) {
        this.numberFilesRemaining = numberFilesRemaining;
    }
}
