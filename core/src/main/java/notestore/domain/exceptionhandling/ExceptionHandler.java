package notestore.domain.exceptionhandling;

/**
 * Turns exceptions into log friendly messages.
 */
public interface ExceptionHandler {
    String getExceptionMessage(Throwable e);
}
