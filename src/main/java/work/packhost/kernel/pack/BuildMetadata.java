package work.packhost.kernel.pack;

public record BuildMetadata(String gitSha, String builtAt, String target) {
    public static BuildMetadata unknown() {
        return new BuildMetadata("", "", "");
    }
}
