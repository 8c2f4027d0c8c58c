package work.packhost.kernel.sandbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.packhost.kernel.shared.Json;

/**
 * Least-privilege description of what one sandboxed execution may touch. Derived from the pack
 * manifest on every start and never cached.
 */
public record CapabilityDescriptor(
    List<PreopenDir> preopenDirs,
    Map<String, String> envVars,
    boolean inheritStdout,
    boolean inheritStderr,
    int memoryLimitMb,
    int cpuLimitMsPerSec
) {
    public CapabilityDescriptor {
        preopenDirs = preopenDirs == null ? List.of() : List.copyOf(preopenDirs);
        envVars = envVars == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(envVars));
    }

    public Optional<PreopenDir> preopen(String guestPath) {
        return preopenDirs.stream().filter(dir -> dir.guestPath().equals(guestPath)).findFirst();
    }

    /**
     * Sandbox-facing rendering with snake_case keys.
     */
    public Map<String, Object> toJsonMap() {
        var dirs = new ArrayList<Map<String, Object>>();
        for (PreopenDir dir : preopenDirs) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("guest_path", dir.guestPath());
            entry.put("host_path", dir.hostPath().toString());
            entry.put("readonly", dir.readonly());
            dirs.add(entry);
        }
        var map = new LinkedHashMap<String, Object>();
        map.put("preopen_dirs", dirs);
        map.put("env_vars", envVars);
        map.put("inherit_stdout", inheritStdout);
        map.put("inherit_stderr", inheritStderr);
        map.put("memory_limit_mb", memoryLimitMb);
        map.put("cpu_limit_ms_per_sec", cpuLimitMsPerSec);
        return map;
    }

    public String toJson() {
        try {
            return Json.mapper().writeValueAsString(toJsonMap());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to render capability descriptor", ex);
        }
    }
}
