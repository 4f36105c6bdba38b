package notestore.domain.note;

import notestore.domain.exceptions.InvalidBackend;
import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * The persistence engines a note store can be backed by.
 */
public enum BackendType {
    RELATIONAL("relational"),
    DOCUMENT("document"),
    GRAPH("graph"),
    WIDE_COLUMN("wide-column"),
    IN_MEMORY("in-memory"),
    REMOTE_PROXY("remote-proxy");

    private final String configName;

    BackendType(final String configName) {
        this.configName = configName;
    }

    /**
     * Resolve the backend named in the configuration. Matching ignores case and surrounding whitespace.
     *
     * @param name The configured backend name
     * @return The matching backend
     * @throws InvalidBackend if the name matches no backend
     */
    public static BackendType fromConfig(final String name) {
        final String trimmed = StringUtils.trimToEmpty(name);
        return Arrays.stream(values())
                .filter(type -> type.configName.equalsIgnoreCase(trimmed))
                .findFirst()
                .orElseThrow(() -> new InvalidBackend("Unknown note store backend \"" + name + "\". Expected one of "
                        + Arrays.stream(values()).map(BackendType::getConfigName).collect(Collectors.joining(", "))));
    }

    public String getConfigName() {
        return configName;
    }

    @Override
    public String toString() {
        return configName;
    }
}
