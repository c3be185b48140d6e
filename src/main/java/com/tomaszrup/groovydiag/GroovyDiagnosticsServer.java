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

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.tomaszrup.groovydiag.analysis.AnalysisContextFactory;
import com.tomaszrup.groovydiag.analysis.AnalyzerEngine;
import com.tomaszrup.groovydiag.analysis.BuiltInAnalyzerProvider;
import com.tomaszrup.groovydiag.analysis.DefaultAnalyzerEngine;
import com.tomaszrup.groovydiag.worker.CancellationToken;
import com.tomaszrup.groovydiag.worker.DiagnosticWorker;
import com.tomaszrup.groovydiag.worker.WorkspaceChangeHandler;
import com.tomaszrup.groovydiag.workspace.DocumentId;
import com.tomaszrup.groovydiag.workspace.DocumentSnapshot;
import com.tomaszrup.groovydiag.workspace.ProjectDiscovery;
import com.tomaszrup.groovydiag.workspace.ProjectId;
import com.tomaszrup.groovydiag.workspace.ProjectSnapshot;
import com.tomaszrup.groovydiag.workspace.Workspace;
import org.eclipse.lsp4j.*;
import org.eclipse.lsp4j.jsonrpc.Launcher;
import org.eclipse.lsp4j.jsonrpc.services.JsonRequest;
import org.eclipse.lsp4j.services.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.Future;
import java.util.logging.Level;

/**
 * LSP entry point. Keeps diagnostics of a Groovy workspace fresh and answers
 * the custom {@code groovy/*} diagnostic requests.
 *
 * <p>Lifecycle: {@code initialize} reads the options and starts the
 * diagnostic worker; {@code initialized} imports the workspace on the import
 * pool, which queues every document for background analysis;
 * {@code shutdown} unsubscribes from the workspace, joins the workers and
 * shuts down every pool.</p>
 */
public class GroovyDiagnosticsServer implements LanguageServer, LanguageClientAware {

    private static final Logger logger = LoggerFactory.getLogger(GroovyDiagnosticsServer.class);

    public static void main(String[] args) throws IOException {
        Thread.setDefaultUncaughtExceptionHandler((thread, throwable) -> {
            System.err.println("[FATAL] Uncaught exception on thread " + thread.getName());
            throwable.printStackTrace(System.err);
            logger.error("Uncaught exception on thread {}: {}",
                    thread.getName(), throwable.getMessage(), throwable);
        });

        // "Unmatched cancel notification" warnings are expected when a
        // request finished before the client's $/cancelRequest arrived.
        java.util.logging.Logger.getLogger("org.eclipse.lsp4j.jsonrpc.RemoteEndpoint")
                .setLevel(Level.SEVERE);
        if (args.length > 0 && "--tcp".equals(args[0])) {
            int port = 5007;
            if (args.length > 1) {
                try {
                    port = Integer.parseInt(args[1]);
                } catch (NumberFormatException e) {
                    logger.error("Invalid port number: {}", args[1]);
                    System.exit(1);
                }
            }

            try (ServerSocket serverSocket = new ServerSocket(port, 50, InetAddress.getLoopbackAddress())) {
                logger.info("Groovy Diagnostics Server listening on port {} (localhost only)", port);
                try (Socket socket = serverSocket.accept()) {
                    logger.info("Client connected.");
                    startServer(socket.getInputStream(), socket.getOutputStream());
                }
            }
        } else {
            logger.info("Groovy Diagnostics Server starting in stdio mode.");
            InputStream in = System.in;
            OutputStream out = System.out;
            startServer(in, out);
        }
    }

    private static void startServer(InputStream in, OutputStream out) {
        // stdout carries JSON-RPC
        System.setOut(new PrintStream(System.err));

        GroovyDiagnosticsServer server = new GroovyDiagnosticsServer();
        Launcher<GroovyDiagnosticsClient> launcher =
                Launcher.createLauncher(server, GroovyDiagnosticsClient.class, in, out);
        server.connect(launcher.getRemoteProxy());

        // All pool threads are daemons; block the main thread on the listener.
        Future<Void> future = launcher.startListening();
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Language server listener interrupted");
        } catch (ExecutionException e) {
            logger.error("Language server listener terminated with error: {}",
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage(), e);
        }
    }

    private final ExecutorPools executorPools;
    private final AnalyzerEngine analyzerEngine;
    private final Workspace workspace = new Workspace();
    private final ClientNotifier notifier = new ClientNotifier();
    private final DiagnosticsServices services;
    private final LspRequestGuard requestGuard;

    private volatile Path workspaceRoot;
    private volatile DiagnosticWorker diagnosticWorker;
    private volatile WorkspaceChangeHandler changeHandler;
    private volatile Future<?> importFuture;

    public GroovyDiagnosticsServer() {
        this(new ExecutorPools(), new DefaultAnalyzerEngine());
    }

    GroovyDiagnosticsServer(ExecutorPools executorPools, AnalyzerEngine analyzerEngine) {
        this.executorPools = executorPools;
        this.analyzerEngine = analyzerEngine;
        this.services = new DiagnosticsServices(workspace, executorPools.getImportPool());
        this.requestGuard = new LspRequestGuard(workspace);
    }

    public Workspace getWorkspace() {
        return workspace;
    }

    public DiagnosticWorker getDiagnosticWorker() {
        return diagnosticWorker;
    }

    Future<?> getImportFuture() {
        return importFuture;
    }

    @Override
    public CompletableFuture<InitializeResult> initialize(InitializeParams params) {
        workspaceRoot = resolveWorkspaceRoot(params);

        InitializationOptionsParser.ParsedOptions options =
                InitializationOptionsParser.parse(params.getInitializationOptions());

        DiagnosticWorker worker = new DiagnosticWorker(workspace, analyzerEngine,
                new BuiltInAnalyzerProvider(options.analyzersEnabled), new AnalysisContextFactory(),
                options.toWorkerOptions(), executorPools, notifier, notifier);
        WorkspaceChangeHandler handler = new WorkspaceChangeHandler(workspace, worker);
        worker.start();
        handler.start();
        this.diagnosticWorker = worker;
        this.changeHandler = handler;

        TextDocumentSyncOptions syncOptions = new TextDocumentSyncOptions();
        syncOptions.setOpenClose(true);
        syncOptions.setChange(TextDocumentSyncKind.Full);
        syncOptions.setSave(new SaveOptions(false));
        ServerCapabilities serverCapabilities = new ServerCapabilities();
        serverCapabilities.setTextDocumentSync(syncOptions);

        return CompletableFuture.completedFuture(new InitializeResult(serverCapabilities));
    }

    @SuppressWarnings("deprecation")
    private static Path resolveWorkspaceRoot(InitializeParams params) {
        List<WorkspaceFolder> folders = params.getWorkspaceFolders();
        if (folders != null && !folders.isEmpty()) {
            return DiagnosticsServices.uriToPath(folders.get(0).getUri());
        }
        return DiagnosticsServices.uriToPath(params.getRootUri());
    }

    @Override
    public void initialized(InitializedParams params) {
        importFuture = executorPools.getImportPool().submit(this::importWorkspace);
    }

    void importWorkspace() {
        Path root = workspaceRoot;
        if (root == null) {
            logger.info("No workspace root, only open files will be analyzed");
            workspace.initialize(Collections.emptyList());
            notifier.statusUpdate(StatusUpdateParams.READY, "No workspace folder");
            return;
        }
        notifier.statusUpdate(StatusUpdateParams.IMPORTING, "Discovering projects in " + root);
        List<ProjectSnapshot> projects = new ArrayList<>();
        try {
            for (Path projectRoot : ProjectDiscovery.discoverProjectRoots(root)) {
                projects.add(services.withOpenDocuments(ProjectDiscovery.loadProject(projectRoot, null)));
            }
        } catch (IOException e) {
            String failMsg = "Project discovery failed: " + e.getMessage();
            logger.error(failMsg, e);
            notifier.logMessage(MessageType.Error, failMsg);
            notifier.statusUpdate(StatusUpdateParams.ERROR, failMsg);
        }
        workspace.initialize(projects);
        services.removeShadowedMiscellaneousDocuments();
        int documents = workspace.getCurrentSnapshot().getDocumentCount();
        notifier.statusUpdate(StatusUpdateParams.READY, projects.size() + " project(s), " + documents + " file(s)");
    }

    @Override
    public CompletableFuture<Object> shutdown() {
        if (importFuture != null) {
            importFuture.cancel(true);
        }
        if (changeHandler != null) {
            changeHandler.stop();
        }
        if (diagnosticWorker != null) {
            diagnosticWorker.shutdown();
        }
        executorPools.shutdownAll();
        return CompletableFuture.completedFuture(new Object());
    }

    @Override
    public void exit() {
        System.exit(0);
    }

    // --- Custom requests ---

    /**
     * Fresh diagnostics for the given files. Pending work for them is
     * prioritized; files still being analyzed when the wait times out are
     * left out.
     *
     * @param params a JSON object with a {@code uris} string array
     */
    @JsonRequest("groovy/getDiagnostics")
    public CompletableFuture<List<DocumentDiagnosticsParams>> getDiagnostics(JsonObject params) {
        List<Path> paths = readPaths(params, "uris");
        return requestGuard.failSoftRequest(Protocol.REQUEST_GET_DIAGNOSTICS, paths.isEmpty() ? null : paths.get(0),
                () -> requireWorker().getDiagnostics(paths).thenApply(DocumentDiagnosticsParams::fromAll),
                Collections.emptyList());
    }

    /**
     * Cached diagnostics of every workspace file, without waiting.
     */
    @JsonRequest("groovy/getAllDiagnostics")
    public CompletableFuture<List<DocumentDiagnosticsParams>> getAllDiagnostics(JsonObject params) {
        return requestGuard.failSoftRequest(Protocol.REQUEST_GET_ALL_DIAGNOSTICS, null,
                () -> CompletableFuture.completedFuture(
                        DocumentDiagnosticsParams.fromAll(requireWorker().getAllDiagnostics())),
                Collections.emptyList());
    }

    /**
     * Queues files for background analysis: the projects rooted at
     * {@code projectUris} if given, the whole workspace otherwise.
     *
     * @return the number of queued files
     */
    @JsonRequest("groovy/queueDiagnostics")
    public CompletableFuture<Integer> queueDiagnostics(JsonObject params) {
        List<Path> projectRoots = readPaths(params, "projectUris");
        return requestGuard.failSoftRequest(Protocol.REQUEST_QUEUE_DIAGNOSTICS, null, () -> {
            DiagnosticWorker worker = requireWorker();
            if (projectRoots.isEmpty()) {
                return CompletableFuture.completedFuture(worker.queueDocumentsForDiagnostics().size());
            }
            List<ProjectId> projectIds = new ArrayList<>();
            for (Path projectRoot : projectRoots) {
                ProjectSnapshot project = workspace.findProjectForPath(projectRoot);
                if (project != null) {
                    projectIds.add(project.getId());
                }
            }
            return CompletableFuture.completedFuture(worker.queueDocumentsForDiagnostics(projectIds).size());
        }, 0);
    }

    /**
     * Analyzes one file right away, ignoring the queue and the cache.
     *
     * @param params a JSON object with a {@code uri} string field
     * @return the diagnostics, or {@code null} if the file is not in the workspace
     */
    @JsonRequest("groovy/analyzeDocument")
    public CompletableFuture<DocumentDiagnosticsParams> analyzeDocument(JsonObject params) {
        Path path = readPath(params, "uri");
        CancellationToken token = new CancellationToken();
        CompletableFuture<DocumentDiagnosticsParams> result = requestGuard.failSoftRequest(
                Protocol.REQUEST_ANALYZE_DOCUMENT, path, () -> {
                    DocumentId documentId = path != null ? workspace.getDocumentId(path) : null;
                    DocumentSnapshot document = documentId != null
                            ? workspace.getCurrentSnapshot().getDocument(documentId) : null;
                    if (document == null) {
                        return CompletableFuture.completedFuture(null);
                    }
                    return requireWorker().analyzeDocumentAsync(document, token)
                            .thenApply(DocumentDiagnosticsParams::from);
                }, null);
        return cancelTokenWith(result, token);
    }

    /**
     * Analyzes every file of the project containing {@code uri} with
     * Foreground priority and waits for it. The result holds the cached
     * diagnostics of the whole workspace.
     */
    @JsonRequest("groovy/analyzeProject")
    public CompletableFuture<List<DocumentDiagnosticsParams>> analyzeProject(JsonObject params) {
        Path path = readPath(params, "uri");
        CancellationToken token = new CancellationToken();
        CompletableFuture<List<DocumentDiagnosticsParams>> result = requestGuard.failSoftRequest(
                Protocol.REQUEST_ANALYZE_PROJECT, path, () -> {
                    ProjectSnapshot project = path != null ? workspace.findProjectForPath(path) : null;
                    if (project == null) {
                        return CompletableFuture.completedFuture(Collections.emptyList());
                    }
                    return requireWorker().analyzeProjectsAsync(project, token)
                            .thenApply(DocumentDiagnosticsParams::fromAll);
                }, Collections.emptyList());
        return cancelTokenWith(result, token);
    }

    @JsonRequest("groovy/getProtocolVersion")
    public CompletableFuture<String> getProtocolVersion(JsonObject params) {
        return CompletableFuture.completedFuture(Protocol.VERSION);
    }

    private static <T> CompletableFuture<T> cancelTokenWith(CompletableFuture<T> future, CancellationToken token) {
        future.whenComplete((value, throwable) -> {
            if (future.isCancelled()) {
                token.cancel();
            }
        });
        return future;
    }

    private DiagnosticWorker requireWorker() {
        DiagnosticWorker worker = diagnosticWorker;
        if (worker == null) {
            throw new IllegalStateException("Server not initialized");
        }
        return worker;
    }

    private static Path readPath(JsonObject params, String field) {
        if (params == null || !params.has(field) || !params.get(field).isJsonPrimitive()) {
            return null;
        }
        return DiagnosticsServices.uriToPath(params.get(field).getAsString());
    }

    private static List<Path> readPaths(JsonObject params, String field) {
        List<Path> paths = new ArrayList<>();
        if (params == null || !params.has(field) || !params.get(field).isJsonArray()) {
            return paths;
        }
        JsonArray array = params.getAsJsonArray(field);
        for (JsonElement element : array) {
            if (element.isJsonPrimitive()) {
                Path path = DiagnosticsServices.uriToPath(element.getAsString());
                if (path != null) {
                    paths.add(path);
                }
            }
        }
        return paths;
    }

    @Override
    public TextDocumentService getTextDocumentService() {
        return services;
    }

    @Override
    public WorkspaceService getWorkspaceService() {
        return services;
    }

    @Override
    public void connect(LanguageClient client) {
        notifier.connect(client);
    }
}
