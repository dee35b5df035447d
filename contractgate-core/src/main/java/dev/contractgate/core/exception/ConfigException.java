package dev.contractgate.core.exception;

import java.nio.file.Path;

/**
 * Thrown when a contract, exemption or CI configuration file cannot be interpreted.
 */
public class ConfigException extends ContractGateException {

    private final Path source;

    public ConfigException(String message) {
        this(message, (Path) null);
    }

    public ConfigException(String message, Path source) {
        super(source == null ? message : message + " (" + source + ")");
        this.source = source;
    }

    public ConfigException(String message, Path source, Throwable cause) {
        super(source == null ? message : message + " (" + source + ")", cause);
        this.source = source;
    }

    /**
     * Get the file the error was found in, if known.
     *
     * @return the offending file or null
     */
    public Path getSource() {
        return source;
    }
}
