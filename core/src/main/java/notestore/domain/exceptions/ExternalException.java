package notestore.domain.exceptions;

/**
 * Marker interface for external exceptions raised by a storage engine or the network between us and it.
 * These exceptions might be transient and may be resolved by retrying.
 */
public interface ExternalException {
}
