package work.packhost.kernel.pack;

import java.util.Locale;

public enum PackType {
    WASM("wasm"),
    WORKFLOW("workflow");

    private final String wireName;

    PackType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static PackType from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Pack type is missing");
        }
        var normalized = value.trim().toLowerCase(Locale.ROOT);
        for (PackType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported pack type: " + value);
    }
}
