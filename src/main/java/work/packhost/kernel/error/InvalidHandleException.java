package work.packhost.kernel.error;

public final class InvalidHandleException extends PackHostException {
    public InvalidHandleException(String kind, int id) {
        super("invalid_handle", kind + " handle " + id + " is not live");
    }
}
