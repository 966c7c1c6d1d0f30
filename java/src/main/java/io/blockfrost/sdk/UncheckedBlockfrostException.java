package io.blockfrost.sdk;

import java.util.Objects;

/**
 * Wraps a {@link BlockfrostException} so it can escape {@link java.util.stream.Stream} pipelines.
 */
public final class UncheckedBlockfrostException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public UncheckedBlockfrostException(BlockfrostException cause) {
        super(Objects.requireNonNull(cause, "cause").getMessage(), cause);
    }

    @Override
    public synchronized BlockfrostException getCause() {
        return (BlockfrostException) super.getCause();
    }
}
