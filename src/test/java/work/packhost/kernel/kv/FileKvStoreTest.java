package work.packhost.kernel.kv;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileKvStoreTest {
    @TempDir
    Path root;

    @Test
    void valuesSurviveAReload() {
        var first = new FileKvStore(root);
        first.put("weather", "last", "{\"t\":21}");
        first.put("weather", "city", "\"Lyon\"");

        var second = new FileKvStore(root);

        assertEquals(Optional.of("{\"t\":21}"), second.get("weather", "last"));
        assertEquals(Set.of("city", "last"), second.keys("weather"));
        assertTrue(Files.exists(root.resolve("weather.json")));
    }

    @Test
    void writesLeaveNoTemporaryFiles() throws Exception {
        var store = new FileKvStore(root);
        for (int i = 0; i < 5; i++) {
            store.put("p", "k" + i, String.valueOf(i));
        }
        assertTrue(store.delete("p", "k0"));

        try (var files = Files.list(root)) {
            assertEquals(Set.of("p.json"), files.map(f -> f.getFileName().toString()).collect(Collectors.toSet()));
        }
    }

    @Test
    void packsDoNotShareDocuments() {
        var store = new FileKvStore(root);
        store.put("a", "k", "1");

        assertEquals(Optional.empty(), store.get("b", "k"));
        assertFalse(store.delete("b", "k"));
        store.clear("a");
        assertFalse(Files.exists(root.resolve("a.json")));
    }

    @Test
    void packIdsCannotEscapeTheRoot() {
        var store = new FileKvStore(root);

        assertThrows(IllegalArgumentException.class, () -> store.put("../evil", "k", "1"));
        assertThrows(IllegalArgumentException.class, () -> store.put("nested/pack", "k", "1"));
    }
}
