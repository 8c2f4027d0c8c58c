package work.packhost.kernel.pack;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryPackRepository implements PackRepository {
    private final Map<String, Pack> packs = new ConcurrentHashMap<>();

    @Override
    public void insert(Pack pack) {
        packs.put(pack.id(), pack);
    }

    @Override
    public Optional<Pack> getById(String packId) {
        return packId == null ? Optional.empty() : Optional.ofNullable(packs.get(packId));
    }

    @Override
    public boolean delete(String packId) {
        return packId != null && packs.remove(packId) != null;
    }

    @Override
    public List<Pack> list() {
        var all = new ArrayList<>(packs.values());
        all.sort(Comparator.comparing(Pack::id));
        return all;
    }
}
