package work.packhost.kernel.pack;

import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for installed packs. {@link #insert(Pack)} replaces any record with the same id.
 */
public interface PackRepository {
    void insert(Pack pack);

    Optional<Pack> getById(String packId);

    boolean delete(String packId);

    List<Pack> list();
}
