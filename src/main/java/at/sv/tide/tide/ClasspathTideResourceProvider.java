package at.sv.tide.tide;

import java.io.InputStream;

/**
 * Loads tide tables bundled with the application, e.g. {@code tides/tides_9410583_2024.txt}.
 */
public final class ClasspathTideResourceProvider implements TideResourceProvider {

    private final String basePath;
    private final ClassLoader classLoader;

    public ClasspathTideResourceProvider(String basePath) {
        this(basePath, ClasspathTideResourceProvider.class.getClassLoader());
    }

    ClasspathTideResourceProvider(String basePath, ClassLoader classLoader) {
        this.basePath = basePath.endsWith("/") || basePath.isEmpty() ? basePath : basePath + "/";
        this.classLoader = classLoader;
    }

    @Override
    public InputStream open(String stationId, int year) {
        String path = basePath + TideResourceProvider.resourceName(stationId, year);
        InputStream stream = classLoader.getResourceAsStream(path);
        if (stream == null) {
            throw new TideResourceMissingException("No tide table on classpath: '" + path + "'");
        }
        return stream;
    }
}
