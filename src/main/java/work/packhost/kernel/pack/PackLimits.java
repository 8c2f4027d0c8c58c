package work.packhost.kernel.pack;

public record PackLimits(int memoryMb, int cpuMsPerSec) {
}
