package work.packhost.kernel.instance;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

public final class InMemoryExecutionHistory implements ExecutionHistory {
    private final Map<String, List<ExecutionRecord>> records = new ConcurrentHashMap<>();

    @Override
    public void record(ExecutionRecord record) {
        records.computeIfAbsent(record.instanceId(), ignored -> new CopyOnWriteArrayList<>()).add(record);
    }

    @Override
    public List<ExecutionRecord> forInstance(String instanceId) {
        var list = records.get(instanceId);
        return list == null ? List.of() : List.copyOf(list);
    }

    @Override
    public void deleteForInstance(String instanceId) {
        records.remove(instanceId);
    }
}
