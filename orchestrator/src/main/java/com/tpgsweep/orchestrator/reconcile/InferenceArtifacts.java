package com.tpgsweep.orchestrator.reconcile;

import com.tpgsweep.orchestrator.layout.SweepLayout;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Locates TPG directories and their inference documents under a sweep root.
 *
 * Listings are sorted by path so that every caller sees the same discovery
 * order on every run.
 */
@Component
public class InferenceArtifacts {

    private static final String JSON_GLOB = "*.json";

    private final SweepLayout layout;

    public InferenceArtifacts(SweepLayout layout) {
        this.layout = layout;
    }

    /**
     * Every directory directly under {@code <root>/training_results}.
     *
     * @throws IllegalStateException if the training results directory does not exist
     */
    public List<Path> tpgDirs(Path root) {
        Path base = layout.trainingResults(root);
        if (!Files.isDirectory(base)) {
            throw new IllegalStateException("Expected " + base + " under " + root + ", not found");
        }
        try (Stream<Path> entries = Files.list(base)) {
            return entries.filter(Files::isDirectory).sorted().toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + base, e);
        }
    }

    public List<Path> configFiles(Path root) {
        return collect(root, layout::inferenceConfigsDir);
    }

    public List<Path> resultFiles(Path root) {
        return collect(root, layout::inferenceResultsDir);
    }

    private List<Path> collect(Path root, Function<Path, Path> folder) {
        List<Path> files = new ArrayList<>();
        for (Path tpgDir : tpgDirs(root)) {
            Path dir = folder.apply(tpgDir);
            if (!Files.isDirectory(dir)) {
                continue;
            }
            try (DirectoryStream<Path> json = Files.newDirectoryStream(dir, JSON_GLOB)) {
                json.forEach(files::add);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot list " + dir, e);
            }
        }
        files.sort(null);
        return files;
    }
}
