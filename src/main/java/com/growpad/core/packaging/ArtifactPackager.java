package com.growpad.core.packaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.growpad.core.model.StageRecord;
import com.growpad.core.store.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Writes {@code manifest.json} and bundles every artifact into {@code artifacts.zip}.
 * <p>
 * Output depends only on the artifact bytes and the stage history passed in: entries are
 * sorted, timestamps come from stage records and zip entries carry a fixed time.
 */
@Service
public class ArtifactPackager {

    private static final Logger log = LoggerFactory.getLogger(ArtifactPackager.class);

    /** 1980-01-02T00:00:00Z, inside the zip DOS date range in every time zone. */
    static final long FIXED_ENTRY_TIME = 315_619_200_000L;

    private final ObjectMapper mapper = JsonSupport.newMapper();

    /**
     * @return path of the written archive
     */
    public Path pack(Path artifactsDir, List<StageRecord> stageHistory, Map<String, Instant> timestamps) {
        Manifest manifest = buildManifest(artifactsDir, stageHistory, timestamps);
        try {
            byte[] manifestBytes = mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(manifest);
            Files.write(artifactsDir.resolve(ArtifactStages.MANIFEST), manifestBytes);

            Path archive = artifactsDir.resolve(ArtifactStages.ARCHIVE);
            Path temp = artifactsDir.resolve("." + ArtifactStages.ARCHIVE + ".tmp");
            try (OutputStream out = Files.newOutputStream(temp); ZipOutputStream zip = new ZipOutputStream(out)) {
                for (ManifestEntry entry : manifest.artifacts()) {
                    writeEntry(zip, entry.name(), Files.readAllBytes(artifactsDir.resolve(entry.name())));
                }
                writeEntry(zip, ArtifactStages.MANIFEST, manifestBytes);
            }
            Files.move(temp, archive, StandardCopyOption.REPLACE_EXISTING);
            log.info("Packaged {} artifacts into {} ({} missing)", manifest.artifacts().size(), archive,
                    manifest.missing().size());
            return archive;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to package artifacts in " + artifactsDir, e);
        }
    }

    public Manifest buildManifest(Path artifactsDir, List<StageRecord> stageHistory, Map<String, Instant> timestamps) {
        Map<String, Instant> stageTimes = latestCompletion(stageHistory);
        Instant fallback = stageHistory.stream()
                .map(StageRecord::completedAt)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(timestamps.get("created_at"));
        Instant runTime = timestamps.get("completed_at") != null ? timestamps.get("completed_at") : fallback;

        List<ManifestEntry> entries = new ArrayList<>();
        for (String name : listArtifacts(artifactsDir)) {
            Path file = artifactsDir.resolve(name);
            try {
                byte[] bytes = Files.readAllBytes(file);
                String stage = ArtifactStages.stageOf(name);
                Instant timestamp = switch (stage) {
                    case ArtifactStages.RUN -> runTime;
                    case ArtifactStages.UNKNOWN -> null;
                    default -> stageTimes.getOrDefault(stage, fallback);
                };
                entries.add(new ManifestEntry(name, JsonSupport.sha256Hex(bytes), bytes.length, stage, timestamp));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read artifact " + file, e);
            }
        }
        List<String> present = entries.stream().map(ManifestEntry::name).toList();
        List<String> missing = ArtifactStages.REQUIRED.stream().filter(r -> !present.contains(r)).toList();
        return new Manifest(entries, missing);
    }

    private static List<String> listArtifacts(Path artifactsDir) {
        try (Stream<Path> files = Files.walk(artifactsDir)) {
            return files.filter(Files::isRegularFile)
                    .map(p -> artifactsDir.relativize(p).toString().replace('\\', '/'))
                    .filter(name -> !name.equals(ArtifactStages.MANIFEST) && !name.equals(ArtifactStages.ARCHIVE))
                    .filter(name -> !name.startsWith(".") && !name.contains("/."))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + artifactsDir, e);
        }
    }

    private static Map<String, Instant> latestCompletion(List<StageRecord> stageHistory) {
        Map<String, Instant> latest = new HashMap<>();
        for (StageRecord record : stageHistory) {
            if (record.completedAt() == null) {
                continue;
            }
            latest.merge(record.stage().name(), record.completedAt(), (a, b) -> a.isAfter(b) ? a : b);
        }
        return latest;
    }

    private static void writeEntry(ZipOutputStream zip, String name, byte[] bytes) throws IOException {
        ZipEntry entry = new ZipEntry(name);
        entry.setTime(FIXED_ENTRY_TIME);
        zip.putNextEntry(entry);
        zip.write(bytes);
        zip.closeEntry();
    }
}
