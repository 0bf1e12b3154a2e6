package mu.fleet.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.timeout.IdleStateHandler;
import mu.fleet.api.Controller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Netty HTTP server of the web viewer.
 */
public final class ViewerServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ViewerServer.class);

    private final RouterHandler router;

    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;

    public ViewerServer(List<Controller> controllers) {
        this.router = new RouterHandler(controllers);
    }

    ChannelInitializer<SocketChannel> pipelineInitializer() {
        return new ChannelInitializer<>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ChannelPipeline p = ch.pipeline();
                p.addLast(new IdleStateHandler(60, 0, 0, TimeUnit.SECONDS));
                p.addLast(new HttpServerCodec());
                p.addLast(new HttpObjectAggregator(64 * 1024));
                p.addLast(router);
            }
        };
    }

    /**
     * Bind and start serving.
     *
     * @param port 0 for an ephemeral port
     * @return the bound port
     */
    public synchronized int start(String host, int port) {
        if (serverChannel != null) {
            return boundPort();
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        try {
            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(pipelineInitializer());

            serverChannel = b.bind(host, port).syncUninterruptibly().channel();
        } catch (Exception e) {
            // bind failures surface as undeclared checked exceptions
            stop();
            throw e;
        }
        int bound = boundPort();
        log.info("Web viewer listening on {}:{}", host, bound);
        return bound;
    }

    public synchronized void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
        } finally {
            if (workerGroup != null) { workerGroup.shutdownGracefully(); workerGroup = null; }
            if (bossGroup != null)   { bossGroup.shutdownGracefully();   bossGroup = null;   }
        }
        log.info("Web viewer stopped");
    }

    public synchronized boolean isRunning() {
        return serverChannel != null;
    }

    private int boundPort() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    @Override
    public void close() {
        stop();
    }

    /** Await the server channel being closed. */
    public void awaitClose() throws InterruptedException {
        Channel channel;
        synchronized (this) {
            channel = serverChannel;
        }
        if (channel != null) {
            channel.closeFuture().sync();
        }
    }
}
