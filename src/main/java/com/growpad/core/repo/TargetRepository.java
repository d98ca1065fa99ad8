package com.growpad.core.repo;

import com.growpad.core.model.Workspace;
import com.growpad.core.process.ProcessExecutionException;
import com.growpad.core.process.ProcessOutcome;
import com.growpad.core.process.ProcessRunner;
import com.growpad.core.store.StoreProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Owns the per-workspace working tree under {@code repos/<workspace_id>}.
 * <p>
 * A run takes the workspace lease for its whole duration, then resets the tree:
 * {@code local://<name>} copies a baseline from {@link RepositoryProperties#getLocalRoot()},
 * anything else is freshly cloned with {@code git clone --branch}.
 */
@Service
public class TargetRepository {

    private static final Logger log = LoggerFactory.getLogger(TargetRepository.class);

    public static final String LOCAL_SCHEME = "local://";

    private final Path reposDir;
    private final RepositoryProperties properties;
    private final ProcessRunner processRunner;
    private final ConcurrentHashMap<String, ReentrantLock> workspaceLocks = new ConcurrentHashMap<>();

    @Autowired
    public TargetRepository(StoreProperties storeProperties, RepositoryProperties properties,
                            ProcessRunner processRunner) {
        this(Path.of(storeProperties.getDataDir()), properties, processRunner);
    }

    public TargetRepository(Path dataDir, RepositoryProperties properties, ProcessRunner processRunner) {
        this.reposDir = dataDir.resolve("repos");
        this.properties = properties;
        this.processRunner = processRunner;
    }

    /**
     * Exclusive use of the workspace's working tree until the lease is closed.
     *
     * @throws RepositoryException if another run holds the tree past the lock timeout
     */
    public Lease acquire(String workspaceId) {
        ReentrantLock lock = workspaceLocks.computeIfAbsent(workspaceId, k -> new ReentrantLock());
        try {
            if (!lock.tryLock(properties.getLockTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                throw new RepositoryException("Workspace %s is busy with another run (waited %ss)"
                        .formatted(workspaceId, properties.getLockTimeout().toSeconds()));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RepositoryException("Interrupted waiting for workspace " + workspaceId, e);
        }
        return lock::unlock;
    }

    /**
     * Resets the working tree to the workspace's baseline.
     *
     * @return the working tree root
     */
    public Path prepare(Workspace workspace) {
        Path tree = workingTree(workspace.workspaceId());
        deleteRecursively(tree);
        String url = workspace.repoUrl();
        if (url.startsWith(LOCAL_SCHEME)) {
            Path baseline = Path.of(properties.getLocalRoot()).resolve(url.substring(LOCAL_SCHEME.length()));
            if (!Files.isDirectory(baseline)) {
                throw new RepositoryException("Baseline not found: " + baseline);
            }
            copyRecursively(baseline, tree);
            initGit(tree);
            log.info("Prepared {} from baseline {}", tree, baseline);
        } else {
            clone(url, workspace.branch(), tree);
            log.info("Cloned {} ({}) into {}", url, workspace.branch(), tree);
        }
        return tree;
    }

    public Path workingTree(String workspaceId) {
        return reposDir.resolve(workspaceId);
    }

    /**
     * Current contents of {@code files}, formatted as generation context.
     */
    public String readContext(Path tree, List<String> files) {
        StringBuilder context = new StringBuilder();
        for (String relative : files) {
            Path file = tree.resolve(relative).normalize();
            if (!file.startsWith(tree.normalize())) {
                context.append("File: ").append(relative).append(" (outside repository)\n");
                continue;
            }
            if (!Files.isRegularFile(file)) {
                context.append("File: ").append(relative).append(" (not found)\n");
                continue;
            }
            try {
                context.append("File: ").append(relative).append("\n```\n")
                        .append(Files.readString(file, StandardCharsets.UTF_8)).append("\n```\n\n");
            } catch (IOException e) {
                context.append("File: ").append(relative).append(" (error reading)\n");
            }
        }
        return context.toString();
    }

    private void clone(String url, String branch, Path tree) {
        try {
            Files.createDirectories(reposDir);
            ProcessOutcome outcome = processRunner.run(reposDir, properties.getCloneTimeout(),
                    List.of("git", "clone", "--depth", "1", "--branch", branch, url, tree.toAbsolutePath().toString()));
            if (!outcome.succeeded()) {
                throw new RepositoryException("git clone of %s failed (exit code %d): %s"
                        .formatted(url, outcome.exitCode(), outcome.stderr().trim()));
            }
        } catch (IOException | ProcessExecutionException e) {
            throw new RepositoryException("git clone of " + url + " failed: " + e.getMessage(), e);
        }
    }

    private void initGit(Path tree) {
        try {
            ProcessOutcome outcome = processRunner.run(tree, properties.getCloneTimeout(), List.of("git", "init", "-q"));
            if (!outcome.succeeded()) {
                log.warn("git init failed in {}: {}", tree, outcome.stderr().trim());
            }
        } catch (ProcessExecutionException e) {
            log.warn("git not available to initialize {}: {}", tree, e.getMessage());
        }
    }

    private static void copyRecursively(Path source, Path target) {
        try (Stream<Path> paths = Files.walk(source)) {
            for (Path path : (Iterable<Path>) paths::iterator) {
                Path relative = source.relativize(path);
                if (relative.toString().equals(".git") || relative.startsWith(".git")) {
                    continue;
                }
                Path destination = target.resolve(relative.toString());
                if (Files.isDirectory(path)) {
                    Files.createDirectories(destination);
                } else {
                    Files.createDirectories(destination.getParent());
                    Files.copy(path, destination, StandardCopyOption.REPLACE_EXISTING);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to copy " + source + " to " + target, e);
        }
    }

    private static void deleteRecursively(Path root) {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            for (Path path : (Iterable<Path>) paths.sorted(Comparator.reverseOrder())::iterator) {
                Files.delete(path);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to clear " + root, e);
        }
    }

    /**
     * Releases the workspace tree.
     */
    @FunctionalInterface
    public interface Lease extends AutoCloseable {
        @Override
        void close();
    }
}
