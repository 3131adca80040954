package io.raggedcsv.source;

import io.raggedcsv.core.Record;
import io.raggedcsv.core.Source;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Emits one record per regular file, carrying its path. Directories given as roots are listed
 * (non-recursively) and their files sorted by path, so the emission order is deterministic.
 * Reading the file is left to the transform.
 */
public class FileListSource implements Source<Path> {
    private final List<Path> files;
    private int idx = 0;

    public FileListSource(List<Path> roots) throws IOException {
        List<Path> collected = new ArrayList<>();
        for (Path root : roots) {
            if (Files.isDirectory(root)) {
                try (var stream = Files.list(root)) {
                    stream.filter(Files::isRegularFile)
                            .sorted(Comparator.comparing(Path::toString))
                            .forEach(collected::add);
                }
            } else if (Files.isRegularFile(root)) {
                collected.add(root);
            } else {
                throw new IOException("Not a file or directory: " + root);
            }
        }
        this.files = List.copyOf(collected);
    }

    public static FileListSource of(Path... roots) throws IOException {
        return new FileListSource(List.of(roots));
    }

    public List<Path> files() { return files; }

    @Override
    public Optional<Record<Path>> poll() {
        if (idx >= files.size()) return Optional.empty();
        Record<Path> r = new Record<>(idx, files.get(idx));
        idx++;
        return Optional.of(r);
    }

    @Override
    public boolean isFinished() {
        return idx >= files.size();
    }
}
