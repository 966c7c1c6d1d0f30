package io.blockfrost.sdk;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Resolves the project id from the environment, falling back to a properties file.
 *
 * <pre>{@code
 * String projectId = ProjectIdLoader.load()
 *     .orElseThrow(() -> new IllegalStateException("BLOCKFROST_PROJECT_ID not found"));
 * BlockfrostApi api = new BlockfrostApi(Config.builder().projectId(projectId).build());
 * }</pre>
 */
public final class ProjectIdLoader {

    public static final String ENV_VARIABLE = "BLOCKFROST_PROJECT_ID";
    public static final String PROPERTY_KEY = "project_id";
    public static final Path DEFAULT_FILE = Path.of("blockfrost.properties");

    private ProjectIdLoader() {
    }

    public static Optional<String> load() throws LocalIoException {
        return load(System.getenv(), DEFAULT_FILE);
    }

    /**
     * @param environment variables to consult first
     * @param file        properties file consulted when the variable is absent; a missing file is not an error
     * @throws LocalIoException when the file exists but cannot be read or parsed
     */
    public static Optional<String> load(Map<String, String> environment, Path file) throws LocalIoException {
        Objects.requireNonNull(environment, "environment");
        String fromEnv = trimToNull(environment.get(ENV_VARIABLE));
        if (fromEnv != null) {
            return Optional.of(fromEnv);
        }
        if (file == null || !Files.exists(file)) {
            return Optional.empty();
        }
        return fromFile(file);
    }

    public static Optional<String> fromFile(Path file) throws LocalIoException {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException | IllegalArgumentException ex) {
            IOException cause = ex instanceof IOException ? (IOException) ex : new IOException(ex.getMessage(), ex);
            throw new LocalIoException(file, cause);
        }
        return Optional.ofNullable(trimToNull(properties.getProperty(PROPERTY_KEY)));
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
