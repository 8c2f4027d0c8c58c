package work.packhost.kernel.pack;

import java.util.List;

/**
 * @param connect allow-listed outbound URL prefixes
 * @param listenLocalhost whether the pack may bind loopback sockets
 */
public record NetworkPermissions(List<String> connect, boolean listenLocalhost) {
    public NetworkPermissions {
        connect = connect == null ? List.of() : List.copyOf(connect);
    }

    public static NetworkPermissions none() {
        return new NetworkPermissions(List.of(), false);
    }
}
