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
package com.tomaszrup.groovydiag.worker;

/**
 * Receives lifecycle notifications for a {@link WorkBatch}. Calls for one
 * batch are serialized; calls for different batches may interleave.
 */
public interface BatchListener {

	BatchListener NOOP = new BatchListener() {
	};

	/** The first item of the batch was handed to a worker. */
	default void batchStarted(WorkBatch batch) {
	}

	/** Emitted every {@link WorkBatch#getProgressInterval()} completed items and when the batch drains. */
	default void batchProgress(WorkBatch batch, int remaining) {
	}

	/** The last outstanding item of the batch was acknowledged. */
	default void batchFinished(WorkBatch batch) {
	}
}
