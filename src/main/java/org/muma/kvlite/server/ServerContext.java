package org.muma.kvlite.server;

import lombok.Getter;
import org.muma.kvlite.command.CommandDispatcher;
import org.muma.kvlite.config.KvLiteConfig;
import org.muma.kvlite.rdb.RdbLoader;
import org.muma.kvlite.rdb.SnapshotLoadResult;
import org.muma.kvlite.store.KeyValueStore;
import org.muma.kvlite.store.impl.ExpiringMemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 服务器上下文
 * 负责组装各个模块：配置 -> RDB 加载 -> 存储 -> 命令分发。
 */
@Getter
public class ServerContext {

    private static final Logger log = LoggerFactory.getLogger(ServerContext.class);

    private final KvLiteConfig config;
    private final SnapshotLoadResult snapshotResult;
    private final KeyValueStore store;
    private final CommandDispatcher dispatcher;

    public ServerContext(KvLiteConfig config) {
        this.config = config;

        // 1. 数据恢复：失败时 records 为空，照常启动
        this.snapshotResult = new RdbLoader(config).load();
        log.info("Snapshot boot finished: {} ({})", snapshotResult.status(), snapshotResult.detail());

        // 2. Storage
        this.store = new ExpiringMemoryStore(snapshotResult.records());

        // 3. Dispatcher
        this.dispatcher = new CommandDispatcher(store, config);
    }
}
