package work.packhost.kernel.error;

import java.util.Map;

public final class ZipSlipViolationException extends PackHostException {
    public ZipSlipViolationException(String entryName) {
        super("zip_slip_violation", "Archive entry escapes the destination directory: " + entryName,
            Map.of("entry", entryName));
    }

    @Override
    public boolean securityFailure() {
        return true;
    }
}
