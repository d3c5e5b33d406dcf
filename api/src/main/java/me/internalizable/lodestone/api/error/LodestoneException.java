package me.internalizable.lodestone.api.error;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Typed failure of a control-plane operation.
 *
 * <p>The detail string is safe to show to callers; the cause is only
 * meant for logs.</p>
 */
public class LodestoneException extends RuntimeException {

    private final ErrorKind kind;

    public LodestoneException(@Nonnull ErrorKind kind, @Nonnull String detail) {
        this(kind, detail, null);
    }

    public LodestoneException(@Nonnull ErrorKind kind, @Nonnull String detail, @Nullable Throwable cause) {
        super(Objects.requireNonNull(detail, "detail"), cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    @Nonnull
    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Get the human-readable detail.
     *
     * @return detail message
     */
    @Nonnull
    public String getDetail() {
        return getMessage();
    }

    @Nonnull
    public static LodestoneException notFound(@Nonnull String detail) {
        return new LodestoneException(ErrorKind.NOT_FOUND, detail);
    }

    @Nonnull
    public static LodestoneException badRequest(@Nonnull String detail) {
        return new LodestoneException(ErrorKind.BAD_REQUEST, detail);
    }

    @Nonnull
    public static LodestoneException ioFailure(@Nonnull String detail, @Nullable Throwable cause) {
        return new LodestoneException(ErrorKind.IO_FAILURE, detail, cause);
    }
}
