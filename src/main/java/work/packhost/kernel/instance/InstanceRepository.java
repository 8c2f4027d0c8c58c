package work.packhost.kernel.instance;

import java.util.List;
import java.util.Optional;

public interface InstanceRepository {
    void save(Instance instance);

    Optional<Instance> findById(String instanceId);

    boolean delete(String instanceId);

    List<Instance> list();

    default List<Instance> listForPack(String packId) {
        return list().stream().filter(instance -> instance.packId().equals(packId)).toList();
    }
}
