package work.packhost.kernel.error;

public final class NotAuthenticatedException extends PackHostException {
    public NotAuthenticatedException(String message) {
        super("not_authenticated", message);
    }
}
