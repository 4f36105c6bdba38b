package notestore.domain.exceptions;

/**
 * Marker interface for internal exceptions. Usually this means the caller supplied invalid inputs or configuration.
 * These exceptions typically can not be resolved by retrying.
 */
public interface InternalException {
}
