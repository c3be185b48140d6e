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

import java.nio.file.Path;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.groovydiag.workspace.ProjectSnapshot;
import com.tomaszrup.groovydiag.workspace.Workspace;

/**
 * Provides fail-soft request execution and error handling for the custom
 * LSP requests. A failed request is logged and answered with a fallback
 * value; only {@link VirtualMachineError}s propagate. Cancellation also
 * propagates, so lsp4j can answer the client's {@code $/cancelRequest}.
 */
class LspRequestGuard {
	private static final Logger logger = LoggerFactory.getLogger(LspRequestGuard.class);

	private final Workspace workspace;

	LspRequestGuard(Workspace workspace) {
		this.workspace = workspace;
	}

	<T> CompletableFuture<T> failSoftRequest(String requestName, Path path,
			Supplier<CompletableFuture<T>> requestCall, T fallbackValue) {
		try {
			CompletableFuture<T> future = requestCall.get();
			if (future == null) {
				return CompletableFuture.completedFuture(fallbackValue);
			}
			return future.exceptionally(throwable -> {
				Throwable root = unwrapRequestThrowable(throwable);
				if (isFatalRequestThrowable(root) || root instanceof CancellationException) {
					throwAsUnchecked(root);
				}
				logRequestFailure(requestName, path, root, true);
				return fallbackValue;
			});
		} catch (Exception | LinkageError throwable) {
			Throwable root = unwrapRequestThrowable(throwable);
			if (isFatalRequestThrowable(root)) {
				throwAsUnchecked(root);
			}
			logRequestFailure(requestName, path, root, false);
			return CompletableFuture.completedFuture(fallbackValue);
		}
	}

	void logRequestFailure(String requestName, Path path, Throwable throwable, boolean fromAsyncStage) {
		ProjectSnapshot project = path != null ? workspace.findProjectForPath(path) : null;
		String phase = fromAsyncStage ? "async" : "sync";
		if (logger.isWarnEnabled()) {
			logger.warn("{} request failed ({}), path={}, project={}, error={}", requestName, phase,
					path, project != null ? project.getName() : null, summarizeThrowable(throwable));
		}
		logger.debug("{} request failure details", requestName, throwable);
	}

	static String summarizeThrowable(Throwable throwable) {
		if (throwable == null) {
			return "<null>";
		}
		String message = throwable.getMessage();
		if (message == null || message.isBlank()) {
			return throwable.getClass().getName();
		}
		return throwable.getClass().getName() + ": " + message;
	}

	static Throwable unwrapRequestThrowable(Throwable throwable) {
		Throwable current = throwable;
		while (current instanceof CompletionException || current instanceof ExecutionException) {
			Throwable cause = current.getCause();
			if (cause == null) {
				break;
			}
			current = cause;
		}
		return current;
	}

	static boolean isFatalRequestThrowable(Throwable throwable) {
		return throwable instanceof VirtualMachineError;
	}

	static void throwAsUnchecked(Throwable throwable) {
		if (throwable instanceof RuntimeException) {
			throw (RuntimeException) throwable;
		}
		if (throwable instanceof Error) {
			throw (Error) throwable;
		}
		throw new IllegalStateException("Unexpected checked throwable", throwable);
	}
}
