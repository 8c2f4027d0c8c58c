package work.packhost.kernel.kv;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class InMemoryKvStoreTest {
    private final KvStore store = new InMemoryKvStore();

    @Test
    void namespacesArePerPack() {
        store.put("weather", "city", "\"Lyon\"");
        store.put("stocks", "city", "\"Paris\"");

        assertEquals(Optional.of("\"Lyon\""), store.get("weather", "city"));
        assertEquals(Optional.of("\"Paris\""), store.get("stocks", "city"));
        assertEquals(Optional.empty(), store.get("other", "city"));
    }

    @Test
    void deleteAndClear() {
        store.put("p", "a", "1");
        store.put("p", "b", "2");

        assertTrue(store.delete("p", "a"));
        assertFalse(store.delete("p", "a"));
        assertEquals(Set.of("b"), store.keys("p"));
        store.clear("p");
        assertEquals(Set.of(), store.keys("p"));
    }

    @Test
    void rejectsBlankIdentifiers() {
        assertThrows(IllegalArgumentException.class, () -> store.put(" ", "k", "1"));
        assertThrows(IllegalArgumentException.class, () -> store.put("p", "", "1"));
    }
}
