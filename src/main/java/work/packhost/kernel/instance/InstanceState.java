package work.packhost.kernel.instance;

public enum InstanceState {
    STOPPED,
    RUNNING,
    PAUSED
}
