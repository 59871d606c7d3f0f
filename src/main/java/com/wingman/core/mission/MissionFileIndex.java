package com.wingman.core.mission;

import com.wingman.logging.AppLogger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * The {@code *.mission} files of the simulator mission folder. Every call to {@link #iterator()}
 * lists the folder again, so the index can be walked any number of times and sees files written
 * in between. A folder that does not exist yields nothing.
 */
public final class MissionFileIndex implements Iterable<Path> {
    private static final Logger LOGGER = AppLogger.get();
    private static final String EXTENSION = ".mission";

    private final Path folder;

    public MissionFileIndex(Path folder) {
        this.folder = Objects.requireNonNull(folder, "folder");
    }

    public Path folder() {
        return folder;
    }

    @Override
    public Iterator<Path> iterator() {
        if (!Files.isDirectory(folder)) {
            return List.<Path>of().iterator();
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(folder)) {
            for (Path entry : stream) {
                if (isMissionFile(entry)) {
                    files.add(entry);
                }
            }
        } catch (IOException ex) {
            LOGGER.warning("Unable to list mission folder " + folder + ": " + ex.getMessage());
            throw new UncheckedIOException(ex);
        }
        files.sort(Path::compareTo);
        return files.iterator();
    }

    static boolean isMissionFile(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(EXTENSION) && Files.isRegularFile(path);
    }
}
