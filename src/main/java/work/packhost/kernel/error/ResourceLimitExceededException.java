package work.packhost.kernel.error;

/**
 * The guest exceeded the memory or CPU budget of its capability descriptor.
 */
public final class ResourceLimitExceededException extends PackHostException {
    public ResourceLimitExceededException(String message) {
        super("resource_limit_exceeded", message);
    }
}
