package com.growpad.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.growpad.core.events.RunEvent;
import com.growpad.core.model.Run;
import com.growpad.core.model.RunRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Filesystem-backed run state: {@code runs/<run_id>/state.json} plus an
 * {@code artifacts/} directory holding generated files and the append-only
 * {@code run-log.jsonl}.
 * <p>
 * Saves are atomic (temp file in the same directory, then rename), so a concurrent
 * reader sees either the previous or the new state in full. All writers of one run
 * serialize on a per-run lock; {@link #update} reloads under that lock before mutating.
 */
@Service
public class RunStore {

    private static final Logger log = LoggerFactory.getLogger(RunStore.class);

    public static final String STATE_FILE = "state.json";
    public static final String ARTIFACTS_DIR = "artifacts";
    public static final String RUN_LOG = "run-log.jsonl";

    static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final Path runsDir;
    private final ObjectMapper mapper = JsonSupport.newMapper();
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Autowired
    public RunStore(StoreProperties properties) {
        this(Path.of(properties.getDataDir()));
    }

    public RunStore(Path dataDir) {
        this.runsDir = dataDir.resolve("runs");
    }

    /**
     * Creates a new PENDING run with a fresh identity and an empty artifacts directory.
     */
    public Run create(RunRequest request, String inputsHash) {
        String runId = "run_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        Run run = new Run(runId, request.workspaceId(), inputsHash, Instant.now());
        run.setEvidenceDir(request.evidenceDir());
        run.setGoalStatement(request.goalStatement());
        run.setFastMode(request.fastMode());
        run.setSelectedFeatureIndex(request.selectedFeatureIndex());
        try {
            Files.createDirectories(artifactsDir(runId));
        } catch (IOException e) {
            throw new StoreException("Failed to create run directory for " + runId, e);
        }
        save(run);
        log.info("Created run {} for workspace {}", runId, request.workspaceId());
        return run;
    }

    public void save(Run run) {
        ReentrantLock lock = lockFor(run.getRunId());
        lock.lock();
        try {
            writeAtomically(runDir(run.getRunId()).resolve(STATE_FILE), mapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsBytes(run));
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize run " + run.getRunId(), e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @throws RunNotFoundException if no state exists for {@code runId}
     */
    public Run load(String runId) {
        if (runId == null || !SAFE_ID.matcher(runId).matches()) {
            throw new RunNotFoundException(String.valueOf(runId));
        }
        Path stateFile = runDir(runId).resolve(STATE_FILE);
        try {
            return mapper.readValue(Files.readAllBytes(stateFile), Run.class);
        } catch (NoSuchFileException e) {
            throw new RunNotFoundException(runId);
        } catch (IOException e) {
            throw new StoreException("Failed to read run " + runId, e);
        }
    }

    public boolean exists(String runId) {
        return runId != null && SAFE_ID.matcher(runId).matches() && Files.isRegularFile(runDir(runId).resolve(STATE_FILE));
    }

    /**
     * Reload, mutate and save under the run's lock.
     *
     * @return the saved state
     */
    public Run update(String runId, Consumer<Run> mutation) {
        ReentrantLock lock = lockFor(runId);
        lock.lock();
        try {
            Run run = load(runId);
            mutation.accept(run);
            save(run);
            return run;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends one JSON line to the run's event log.
     */
    public void appendEvent(String runId, RunEvent event) {
        ReentrantLock lock = lockFor(runId);
        lock.lock();
        try {
            String line = mapper.writeValueAsString(event) + "\n";
            Files.writeString(artifactsDir(runId).resolve(RUN_LOG), line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new StoreException("Failed to append event for run " + runId, e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replays the event log. Malformed lines are skipped.
     */
    public List<RunEvent> readEvents(String runId) {
        if (!exists(runId)) {
            throw new RunNotFoundException(runId);
        }
        Path logFile = artifactsDir(runId).resolve(RUN_LOG);
        if (!Files.exists(logFile)) {
            return List.of();
        }
        List<RunEvent> events = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(logFile, StandardCharsets.UTF_8)) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    events.add(mapper.readValue(line, RunEvent.class));
                } catch (JsonProcessingException e) {
                    log.warn("Skipping malformed event line in run {}: {}", runId, e.getOriginalMessage());
                }
            }
        } catch (IOException e) {
            throw new StoreException("Failed to read event log for run " + runId, e);
        }
        return events;
    }

    /**
     * Runs newest first, optionally restricted to one workspace.
     */
    public List<Run> list(String workspaceId, int limit) {
        if (!Files.isDirectory(runsDir)) {
            return List.of();
        }
        List<Run> runs = new ArrayList<>();
        try (Stream<Path> dirs = Files.list(runsDir)) {
            for (Path dir : (Iterable<Path>) dirs::iterator) {
                String runId = dir.getFileName().toString();
                if (!exists(runId)) {
                    continue;
                }
                Run run = load(runId);
                if (workspaceId == null || workspaceId.equals(run.getWorkspaceId())) {
                    runs.add(run);
                }
            }
        } catch (IOException e) {
            throw new StoreException("Failed to list runs", e);
        }
        runs.sort(Comparator.comparing((Run r) -> r.getTimestamps().get(Run.CREATED_AT),
                Comparator.nullsLast(Comparator.reverseOrder())));
        return runs.size() > limit ? runs.subList(0, limit) : runs;
    }

    /**
     * Writes a UTF-8 artifact and returns its path relative to the run directory.
     */
    public String writeArtifact(String runId, String name, String content) {
        return writeArtifact(runId, name, content.getBytes(StandardCharsets.UTF_8));
    }

    public String writeArtifact(String runId, String name, byte[] content) {
        Path target = artifactsDir(runId).resolve(name);
        try {
            Files.createDirectories(target.getParent());
            writeAtomically(target, content);
        } catch (IOException e) {
            throw new StoreException("Failed to write artifact " + name + " for run " + runId, e);
        }
        return ARTIFACTS_DIR + "/" + name;
    }

    public String writeJsonArtifact(String runId, String name, Object value) {
        try {
            return writeArtifact(runId, name, mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(value));
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize artifact " + name, e);
        }
    }

    public Path runDir(String runId) {
        return runsDir.resolve(runId);
    }

    public Path artifactsDir(String runId) {
        return runDir(runId).resolve(ARTIFACTS_DIR);
    }

    /**
     * SHA-256 over the canonical JSON form of a run request.
     */
    public String inputsHash(RunRequest request) {
        try {
            return JsonSupport.sha256Hex(mapper.writeValueAsString(request.canonicalPayload()));
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to hash run request", e);
        }
    }

    private ReentrantLock lockFor(String runId) {
        return locks.computeIfAbsent(runId, k -> new ReentrantLock());
    }

    private void writeAtomically(Path target, byte[] content) {
        Path dir = target.getParent();
        Path temp = dir.resolve("." + target.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.createDirectories(dir);
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StoreException("Failed to write " + target, e);
        } finally {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException e) {
                log.debug("Could not remove temp file {}: {}", temp, e.getMessage());
            }
        }
    }
}
