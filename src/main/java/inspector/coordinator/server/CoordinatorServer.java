package inspector.coordinator.server;

import inspector.coordinator.config.Dependencies;
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
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * Netty server exposing the HTTP API and the {@code /ws/events} stream.
 */
public final class CoordinatorServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorServer.class);

    public static final String EVENTS_PATH = "/ws/events";

    private final Dependencies deps;

    private volatile boolean running = false;
    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;

    public CoordinatorServer(Dependencies deps) {
        this.deps = deps;
    }

    ChannelInitializer<SocketChannel> pipelineInitializer() {
        RouterHandler router = deps.routerHandler();
        int maxContentLength = deps.config().maxContentLength();

        return new ChannelInitializer<>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ChannelPipeline p = ch.pipeline();
                p.addLast(new HttpServerCodec());
                p.addLast(new HttpObjectAggregator(maxContentLength));
                p.addLast(new WebSocketServerProtocolHandler(EVENTS_PATH, null, true));
                p.addLast(new EventStreamHandler(deps.broadcastHub(), deps::newLockController));
                p.addLast(router);
            }
        };
    }

    /**
     * Bind to the configured port.
     */
    public int start() throws InterruptedException {
        return start(deps.config().serverPort());
    }

    /**
     * Bind to {@code port}; 0 picks a free port.
     *
     * @return the bound port
     */
    public synchronized int start(int port) throws InterruptedException {
        if (running) {
            return port();
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        try {
            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(pipelineInitializer());

            serverChannel = b.bind(deps.config().serverHost(), port).sync().channel();
            running = true;
            log.info("Coordinator listening on {}:{}", deps.config().serverHost(), port());
            return port();
        } catch (InterruptedException | RuntimeException e) {
            log.error("Failed to start server on port {}", port, e);
            stop();
            throw e;
        }
    }

    public int port() {
        Channel ch = serverChannel;
        return ch == null ? -1 : ((InetSocketAddress) ch.localAddress()).getPort();
    }

    public boolean isRunning() {
        return running;
    }

    public synchronized void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
        } finally {
            if (workerGroup != null) {
                workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
                workerGroup = null;
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
                bossGroup = null;
            }
            if (running) {
                log.info("Coordinator stopped");
            }
            running = false;
        }
    }

    @Override
    public void close() {
        stop();
    }
}
