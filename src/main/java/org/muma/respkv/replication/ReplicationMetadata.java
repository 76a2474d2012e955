package org.muma.respkv.replication;

import lombok.Getter;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.protocol.SimpleString;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 复制元数据 (从节点视角)
 */
public class ReplicationMetadata {

    @Getter
    private final LeaderAddress leader;

    // PSYNC 回复中 Master 的 RunID 和复制偏移量
    @Getter
    private volatile String masterRunId = "?";
    @Getter
    private volatile long masterOffset = -1;
    // true 表示 Master 回复了 +CONTINUE (部分同步)
    @Getter
    private volatile boolean partialSync;

    // 握手完成后收到的数据流字节数
    private final AtomicLong streamBytes = new AtomicLong();

    public ReplicationMetadata(LeaderAddress leader) {
        this.leader = leader;
    }

    /**
     * 解析 +FULLRESYNC &lt;runid&gt; &lt;offset&gt; 或 +CONTINUE，其他形式原样忽略
     */
    void applyPsyncReply(RedisMessage reply) {
        if (!(reply instanceof SimpleString ss)) {
            return;
        }
        String[] parts = ss.content().split(" ");
        if ("FULLRESYNC".equalsIgnoreCase(parts[0]) && parts.length >= 3) {
            masterRunId = parts[1];
            try {
                masterOffset = Long.parseLong(parts[2]);
            } catch (NumberFormatException e) {
                masterOffset = -1;
            }
        } else if ("CONTINUE".equalsIgnoreCase(parts[0])) {
            partialSync = true;
            if (parts.length >= 2) {
                masterRunId = parts[1];
            }
        }
    }

    void addStreamBytes(long delta) {
        streamBytes.addAndGet(delta);
    }

    public long getStreamBytes() {
        return streamBytes.get();
    }
}
