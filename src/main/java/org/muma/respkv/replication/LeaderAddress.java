package org.muma.respkv.replication;

/**
 * Master 地址，配置格式为 "&lt;host&gt; &lt;port&gt;"
 */
public record LeaderAddress(String host, int port) {

    public static LeaderAddress parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("leader address is missing");
        }
        String[] parts = value.trim().split("\\s+");
        if (parts.length != 2 || parts[0].isEmpty()) {
            throw new IllegalArgumentException("expected '<host> <port>'");
        }

        int port;
        try {
            port = Integer.parseInt(parts[1]);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid port: " + parts[1]);
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        return new LeaderAddress(parts[0], port);
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
