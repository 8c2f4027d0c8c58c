package work.packhost.kernel.instance;

import java.util.List;

public interface ExecutionHistory {
    void record(ExecutionRecord record);

    List<ExecutionRecord> forInstance(String instanceId);

    void deleteForInstance(String instanceId);
}
