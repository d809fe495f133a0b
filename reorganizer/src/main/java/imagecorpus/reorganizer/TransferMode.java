package imagecorpus.reorganizer;

import java.util.Locale;

/**
 * Transfer strategies selectable from the command line. The name is resolved once, when the
 * configuration is built; the pipeline only ever sees the {@link TransferStrategy} instance.
 */
public enum TransferMode {
    COPY,
    RSYNC,
    CP,
    SYMLINK;

    public static TransferMode parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown strategy '" + value + "' (expected copy, rsync, cp or symlink)", e);
        }
    }

    public TransferStrategy newStrategy() {
        return switch (this) {
            case COPY -> new FilesCopyStrategy();
            case RSYNC -> ExternalToolStrategy.rsync();
            case CP -> ExternalToolStrategy.cp();
            case SYMLINK -> new SymlinkStrategy();
        };
    }
}
