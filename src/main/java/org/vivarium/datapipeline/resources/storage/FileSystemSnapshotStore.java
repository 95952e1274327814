package org.vivarium.datapipeline.resources.storage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.vivarium.runtime.model.LifeSnapshot;
import org.vivarium.runtime.spi.ISnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Stores snapshots as {@code snapshot_%06d.json} files in one directory.
 * <p>
 * Writes go to a temporary file that is atomically moved into place, so readers never see a
 * partial snapshot. Only the newest {@code maxSnapshots} files are kept (0 keeps all).
 */
public class FileSystemSnapshotStore implements ISnapshotStore {

    private static final Logger LOG = LoggerFactory.getLogger(FileSystemSnapshotStore.class);
    private static final Pattern FILE_NAME = Pattern.compile("snapshot_(\\d+)\\.json");

    private final Path directory;
    private final int maxSnapshots;
    private final LifeSnapshotCodec codec = new LifeSnapshotCodec(false);

    /**
     * @param options {@code directory} (required) and {@code maxSnapshots} (default 10).
     * @throws IllegalArgumentException if the directory is missing or cannot be created.
     */
    public FileSystemSnapshotStore(Config options) {
        this(Paths.get(requireDirectory(options)),
            options.hasPath("maxSnapshots") ? options.getInt("maxSnapshots") : 10);
    }

    public FileSystemSnapshotStore(Path directory, int maxSnapshots) {
        if (maxSnapshots < 0) {
            throw new IllegalArgumentException("maxSnapshots must be >= 0");
        }
        this.directory = directory;
        this.maxSnapshots = maxSnapshots;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot create snapshot directory: " + directory, e);
        }
    }

    private static String requireDirectory(Config options) {
        if (!options.hasPath("directory")) {
            throw new IllegalArgumentException("directory is required for FileSystemSnapshotStore");
        }
        return options.getString("directory");
    }

    public static String fileNameFor(long tick) {
        return String.format("snapshot_%06d.json", tick);
    }

    @Override
    public void save(LifeSnapshot snapshot) throws IOException {
        Path target = directory.resolve(fileNameFor(snapshot.tick()));
        Path temp = directory.resolve(target.getFileName() + "." + UUID.randomUUID() + ".tmp");
        Files.writeString(temp, codec.encode(snapshot), StandardCharsets.UTF_8);
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
        LOG.debug("Wrote snapshot {}", target);
        prune();
    }

    @Override
    public Optional<LifeSnapshot> loadLatest() throws IOException {
        List<Path> files = listSnapshots();
        if (files.isEmpty()) {
            return Optional.empty();
        }
        Path latest = files.get(files.size() - 1);
        try {
            return Optional.of(codec.decode(Files.readString(latest, StandardCharsets.UTF_8)));
        } catch (IllegalArgumentException e) {
            throw new IOException("Corrupt snapshot " + latest + ": " + e.getMessage(), e);
        }
    }

    /**
     * @return snapshot files ordered by tick, oldest first.
     * @throws IOException if the directory cannot be listed.
     */
    public List<Path> listSnapshots() throws IOException {
        try (Stream<Path> stream = Files.list(directory)) {
            return stream
                .filter(p -> FILE_NAME.matcher(p.getFileName().toString()).matches())
                .sorted(Comparator.comparingLong(FileSystemSnapshotStore::tickOf))
                .collect(Collectors.toList());
        }
    }

    private void prune() throws IOException {
        if (maxSnapshots == 0) {
            return;
        }
        List<Path> files = new ArrayList<>(listSnapshots());
        while (files.size() > maxSnapshots) {
            Files.deleteIfExists(files.remove(0));
        }
    }

    private static long tickOf(Path path) {
        Matcher m = FILE_NAME.matcher(path.getFileName().toString());
        return m.matches() ? Long.parseLong(m.group(1)) : -1L;
    }

    public Path getDirectory() {
        return directory;
    }
}
