package work.packhost.kernel.error;

import java.util.List;
import java.util.Map;

/**
 * Lists every required environment name that was not supplied at start time.
 */
public final class MissingRequiredSecretsException extends PackHostException {
    private final List<String> missingKeys;

    public MissingRequiredSecretsException(List<String> missingKeys) {
        super("missing_required_secrets", "Missing required secrets: " + String.join(", ", missingKeys),
            Map.of("keys", List.copyOf(missingKeys)));
        this.missingKeys = List.copyOf(missingKeys);
    }

    public List<String> missingKeys() {
        return missingKeys;
    }
}
