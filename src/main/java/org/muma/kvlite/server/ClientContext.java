package org.muma.kvlite.server;

/**
 * 命令执行上下文
 * 封装了与当前连接相关的状态，每个连接一个实例，只在该连接的 EventLoop 线程上访问。
 */
public class ClientContext {

    private final String remoteAddress;
    private boolean closeRequested;

    public ClientContext(String remoteAddress) {
        this.remoteAddress = remoteAddress;
    }

    public String getRemoteAddress() {
        return remoteAddress;
    }

    /**
     * 回复写出后关闭连接 (QUIT)
     */
    public void requestClose() {
        this.closeRequested = true;
    }

    public boolean isCloseRequested() {
        return closeRequested;
    }
}
