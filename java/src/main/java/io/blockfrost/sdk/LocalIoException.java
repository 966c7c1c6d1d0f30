package io.blockfrost.sdk;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Local I/O failure outside the network path, such as an unreadable settings file.
 */
public final class LocalIoException extends BlockfrostException {

    private static final long serialVersionUID = 1L;

    private final transient Path path;

    public LocalIoException(Path path, IOException cause) {
        super("io error:\n  path: " + path + "\n  reason: " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
