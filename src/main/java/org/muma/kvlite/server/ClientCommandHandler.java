package org.muma.kvlite.server;

import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import org.muma.kvlite.command.CommandDispatcher;
import org.muma.kvlite.protocol.BulkString;
import org.muma.kvlite.protocol.RedisArray;
import org.muma.kvlite.protocol.RedisMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 每个连接一个实例。Netty 保证同一个 Channel 的回调都在同一个 EventLoop 线程上执行，
 * 所以单个连接同一时刻只有一条命令在执行；不同连接在不同的 worker 线程上并发。
 */
public class ClientCommandHandler extends SimpleChannelInboundHandler<RedisMessage> {

    private static final Logger log = LoggerFactory.getLogger(ClientCommandHandler.class);

    // 记录连接的客户端数量
    private static final AtomicInteger connectedClients = new AtomicInteger();

    private final CommandDispatcher dispatcher;
    private ClientContext context;

    public ClientCommandHandler(CommandDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        context = new ClientContext(String.valueOf(ctx.channel().remoteAddress()));
        log.info("Client connected: {}, total clients: {}", context.getRemoteAddress(), connectedClients.incrementAndGet());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        log.info("Client disconnected: {}, total clients: {}", ctx.channel().remoteAddress(), connectedClients.decrementAndGet());
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RedisMessage msg) {
        // QUIT 之后同一批字节里剩下的帧不再执行
        if (context.isCloseRequested()) {
            log.debug("Dropping frame after QUIT from {}", context.getRemoteAddress());
            return;
        }

        if (!(msg instanceof RedisArray array) || !isCommandFrame(array)) {
            // 请求必须是非空的 BulkString 数组，其余都按协议错误处理：断开连接
            log.warn("Protocol error from {}: expected a non-empty array of bulk strings, got {}", ctx.channel().remoteAddress(), msg);
            ctx.close();
            return;
        }

        String commandName = ((BulkString) array.elements()[0]).asString();
        if (log.isDebugEnabled()) {
            log.debug("Execute Command: {} argc={} from {}", commandName, array.size(), context.getRemoteAddress());
        }

        RedisMessage response = dispatcher.dispatch(commandName, array, context);

        if (context.isCloseRequested()) {
            ctx.channel().config().setAutoRead(false);
        }

        if (response != null) {
            ChannelFuture future = ctx.writeAndFlush(response);
            future.addListener(ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE);
            if (context.isCloseRequested()) {
                future.addListener(ChannelFutureListener.CLOSE);
            }
        } else if (context.isCloseRequested()) {
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof DecoderException) {
            log.warn("Malformed RESP frame from {}, closing: {}", ctx.channel().remoteAddress(), cause.getMessage());
        } else if (cause instanceof IOException) {
            log.info("Connection error from {}, closing: {}", ctx.channel().remoteAddress(), cause.getMessage());
        } else {
            log.error("Unexpected error on connection {}, closing", ctx.channel().remoteAddress(), cause);
        }
        ctx.close();
    }

    private boolean isCommandFrame(RedisArray array) {
        if (array.isNull() || array.size() == 0) {
            return false;
        }
        for (RedisMessage element : array.elements()) {
            if (!(element instanceof BulkString bulk) || bulk.isNull()) {
                return false;
            }
        }
        return true;
    }
}
