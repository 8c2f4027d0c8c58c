package work.packhost.kernel.instance;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryInstanceRepository implements InstanceRepository {
    private final Map<String, Instance> instances = new ConcurrentHashMap<>();

    @Override
    public void save(Instance instance) {
        instances.put(instance.id(), instance);
    }

    @Override
    public Optional<Instance> findById(String instanceId) {
        return instanceId == null ? Optional.empty() : Optional.ofNullable(instances.get(instanceId));
    }

    @Override
    public boolean delete(String instanceId) {
        return instanceId != null && instances.remove(instanceId) != null;
    }

    @Override
    public List<Instance> list() {
        var all = new ArrayList<>(instances.values());
        all.sort(Comparator.comparing(Instance::createdAt).thenComparing(Instance::id));
        return all;
    }
}
