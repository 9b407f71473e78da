package org.muma.kvlite;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.muma.kvlite.config.KvLiteConfig;
import org.muma.kvlite.protocol.RespDecoder;
import org.muma.kvlite.protocol.RespEncoder;
import org.muma.kvlite.server.ClientCommandHandler;
import org.muma.kvlite.server.ServerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

public class KvLiteServer {

    private static final Logger log = LoggerFactory.getLogger(KvLiteServer.class);

    private final ServerContext context;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public KvLiteServer(ServerContext context) {
        this.context = context;
    }

    /**
     * 绑定端口并开始接受连接 (不阻塞)
     *
     * @return 实际绑定的地址 (端口配置为 0 时由系统分配)
     */
    public InetSocketAddress start() throws InterruptedException {
        // 守护线程，进程退出不等待事件循环
        bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("kvlite-boss", true));
        workerGroup = new NioEventLoopGroup(0, new DefaultThreadFactory("kvlite-worker", true));

        var bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                // 在 Boss 线程增加 Netty 自带的日志 Handler，可以看到 TCP 连接握手细节
                .handler(new LoggingHandler(LogLevel.INFO))
                // 开启 TCP_NODELAY (禁用 Nagle 算法)，降低延迟
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        // 编解码器有状态，每个连接一份；dispatcher 全局共享
                        ch.pipeline()
                                .addLast(new RespDecoder())
                                .addLast(new RespEncoder())
                                .addLast(new ClientCommandHandler(context.getDispatcher()));
                    }
                });

        int port = context.getConfig().getPort();
        log.info("Starting kv-lite server on port {}", port);
        serverChannel = bootstrap.bind(port).sync().channel();

        InetSocketAddress address = (InetSocketAddress) serverChannel.localAddress();
        log.info("kv-lite started successfully, listening on {}", address);
        return address;
    }

    public void awaitTermination() throws InterruptedException {
        serverChannel.closeFuture().sync();
    }

    /**
     * 直接关闭，不等待进行中的命令
     */
    public void stop() {
        if (serverChannel != null) {
            serverChannel.close();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }
        log.info("kv-lite stopped");
    }

    public static void main(String[] args) {
        // 1. 初始化配置并解析参数
        KvLiteConfig config = KvLiteConfig.load(args);

        // 2. 组装模块 (包含 RDB 加载)
        KvLiteServer server = new KvLiteServer(new ServerContext(config));
        try {
            server.start();
            Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "kvlite-shutdown"));
            server.awaitTermination();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            server.stop();
        } catch (Exception e) {
            // 端口绑定失败是唯一的致命错误
            log.error("Failed to start server", e);
            server.stop();
            System.exit(1);
        }
    }
}
