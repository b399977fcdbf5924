package at.sv.tide.tide;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads tide tables from a directory, e.g. files downloaded with NOAA's annual prediction export.
 */
public final class DirectoryTideResourceProvider implements TideResourceProvider {

    private final Path directory;

    public DirectoryTideResourceProvider(Path directory) {
        this.directory = directory;
    }

    @Override
    public InputStream open(String stationId, int year) throws IOException {
        Path file = directory.resolve(TideResourceProvider.resourceName(stationId, year));
        if (!Files.isRegularFile(file)) {
            throw new TideResourceMissingException("Tide table '" + file.toAbsolutePath() + "' does not exist");
        }
        return Files.newInputStream(file);
    }
}
