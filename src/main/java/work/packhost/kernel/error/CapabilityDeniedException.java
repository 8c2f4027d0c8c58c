package work.packhost.kernel.error;

/**
 * A sandboxed operation asked for a capability its descriptor does not grant.
 */
public class CapabilityDeniedException extends PackHostException {
    public CapabilityDeniedException(String code, String message, Object data) {
        super(code, message, data);
    }

    @Override
    public final boolean securityFailure() {
        return true;
    }
}
