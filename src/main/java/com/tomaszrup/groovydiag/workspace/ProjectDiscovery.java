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
package com.tomaszrup.groovydiag.workspace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.*;

/**
 * Turns a directory tree into {@link ProjectSnapshot}s.
 *
 * <p>{@link #discoverProjectRoots(Path)} performs a <b>single</b> filesystem
 * walk to find every Gradle or Maven project root. {@link #loadProject}
 * then walks one project root and collects its Groovy sources and
 * {@code .editorconfig} files.</p>
 *
 * <h3>Directory pruning</h3>
 * Both walks skip directories that never contain sources worth analysing:
 * {@code .git}, {@code .gradle}, {@code .idea}, {@code node_modules},
 * {@code build}, {@code target}, {@code bin}, {@code out} and any hidden
 * directory. While loading a project, nested directories that carry their own
 * build file are skipped too; they are separate projects.
 */
public final class ProjectDiscovery {

    private static final Logger logger = LoggerFactory.getLogger(ProjectDiscovery.class);

    private static final Set<String> PRUNED_DIRS = Set.of(
            ".git", ".gradle", ".idea", ".svn", ".hg", ".settings",
            "node_modules", "build", "target", "bin", "out", "__pycache__"
    );

    private static final Set<String> BUILD_FILE_NAMES = Set.of(
            "build.gradle", "build.gradle.kts", "pom.xml"
    );

    public static final String ANALYZER_CONFIG_FILE_NAME = ".editorconfig";

    private ProjectDiscovery() {
        // utility class
    }

    public static boolean isBuildFile(Path path) {
        Path fileName = path.getFileName();
        return fileName != null && BUILD_FILE_NAMES.contains(fileName.toString());
    }

    public static boolean isAnalyzerConfigFile(Path path) {
        Path fileName = path.getFileName();
        return fileName != null && ANALYZER_CONFIG_FILE_NAME.equals(fileName.toString());
    }

    public static boolean isGroovySource(Path path) {
        Path fileName = path.getFileName();
        return fileName != null && fileName.toString().endsWith(".groovy");
    }

    /**
     * Returns {@code true} if {@code file} sits in a build output directory
     * ({@code build/}, {@code target/}, ...) below {@code projectRoot}.
     */
    public static boolean isBuildOutputFile(Path file, Path projectRoot) {
        Path normalized = file.toAbsolutePath().normalize();
        Path root = projectRoot.toAbsolutePath().normalize();
        if (!normalized.startsWith(root)) {
            return false;
        }
        Path relative = root.relativize(normalized);
        for (int i = 0; i < relative.getNameCount() - 1; i++) {
            String segment = relative.getName(i).toString();
            if (segment.startsWith(".") || PRUNED_DIRS.contains(segment.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Walk the workspace root once and collect every directory that holds a
     * Gradle or Maven build file.
     *
     * @return project roots in walk order
     * @throws IOException if the walk fails
     */
    public static List<Path> discoverProjectRoots(Path workspaceRoot) throws IOException {
        Set<Path> projectRoots = new LinkedHashSet<>();

        Files.walkFileTree(workspaceRoot, EnumSet.noneOf(FileVisitOption.class),
                Integer.MAX_VALUE, new SimpleFileVisitor<>() {

            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(workspaceRoot)) {
                    return FileVisitResult.CONTINUE;
                }
                return isPruned(dir) ? FileVisitResult.SKIP_SUBTREE : FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && isBuildFile(file) && file.getParent() != null) {
                    projectRoots.add(file.getParent().toAbsolutePath().normalize());
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                logger.debug("Cannot access {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });

        logger.info("Discovered {} project(s) in {}", projectRoots.size(), workspaceRoot);
        return new ArrayList<>(projectRoots);
    }

    /**
     * Loads the project rooted at {@code projectRoot}. When {@code previous}
     * is given, its project id is kept and documents whose path still exists
     * keep their document ids, so a reload does not look like remove + add.
     *
     * @param previous the currently loaded version of this project, or {@code null}
     * @throws IOException if the walk fails
     */
    public static ProjectSnapshot loadProject(Path projectRoot, ProjectSnapshot previous) throws IOException {
        Path root = projectRoot.toAbsolutePath().normalize();
        String name = root.getFileName() != null ? root.getFileName().toString() : root.toString();
        ProjectId projectId = previous != null ? previous.getId() : ProjectId.create(name);

        Map<Path, DocumentId> knownIds = new HashMap<>();
        if (previous != null) {
            for (DocumentSnapshot document : previous.getDocuments()) {
                knownIds.put(document.getPath(), document.getId());
            }
        }

        List<DocumentSnapshot> documents = new ArrayList<>();
        List<Path> analyzerConfigs = new ArrayList<>();

        Files.walkFileTree(root, EnumSet.noneOf(FileVisitOption.class),
                Integer.MAX_VALUE, new SimpleFileVisitor<>() {

            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(root)) {
                    return FileVisitResult.CONTINUE;
                }
                if (isPruned(dir) || containsBuildFile(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (!attrs.isRegularFile()) {
                    return FileVisitResult.CONTINUE;
                }
                Path normalized = file.toAbsolutePath().normalize();
                if (isAnalyzerConfigFile(normalized)) {
                    analyzerConfigs.add(normalized);
                } else if (isGroovySource(normalized)) {
                    try {
                        String text = Files.readString(normalized, StandardCharsets.UTF_8);
                        DocumentId documentId = knownIds.get(normalized);
                        if (documentId == null) {
                            documentId = DocumentId.create(normalized.getFileName().toString());
                        }
                        documents.add(new DocumentSnapshot(documentId, projectId, normalized, text));
                    } catch (IOException e) {
                        logger.warn("Cannot read {}: {}", normalized, e.getMessage());
                    }
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                logger.debug("Cannot access {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });

        logger.debug("Loaded project {} with {} document(s), {} analyzer config(s)",
                name, documents.size(), analyzerConfigs.size());
        return new ProjectSnapshot(projectId, name, root, false, documents, analyzerConfigs);
    }

    private static boolean isPruned(Path dir) {
        Path fileName = dir.getFileName();
        if (fileName == null) {
            return false;
        }
        String dirName = fileName.toString();
        return dirName.startsWith(".") || PRUNED_DIRS.contains(dirName.toLowerCase(Locale.ROOT));
    }

    private static boolean containsBuildFile(Path dir) {
        for (String buildFileName : BUILD_FILE_NAMES) {
            if (Files.isRegularFile(dir.resolve(buildFileName))) {
                return true;
            }
        }
        return false;
    }
}
