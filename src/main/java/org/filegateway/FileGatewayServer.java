package org.filegateway;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.stream.ChunkedWriteHandler;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import org.filegateway.accounts.CredentialVerifier;
import org.filegateway.accounts.UserRegistry;
import org.filegateway.handlers.AuthOperations;
import org.filegateway.handlers.FileGatewayHandler;
import org.filegateway.handlers.FileOperations;
import org.filegateway.handlers.GatewayObjectAggregator;
import org.filegateway.handlers.LandingPage;
import org.filegateway.handlers.RouteTable;
import org.filegateway.managers.FolderMapping;
import org.filegateway.managers.SessionStore;
import org.filegateway.multipart.MultipartParser;
import org.filegateway.security.PathResolver;
import org.filegateway.utils.GatewayConfig;
import org.filegateway.utils.GatewayLogger;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * HTTP file gateway server.
 * Owns the session store, the folder mapping and the Netty listener.
 */
public class FileGatewayServer {

    private static final String TAG = "SYSTEM";

    private final GatewayConfig config;
    private final UserRegistry users;
    private final SessionStore sessions;
    private final FolderMapping folders;
    private final RouteTable routes;
    private final AtomicBoolean stopping = new AtomicBoolean(false);

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup handlerGroup;
    private Channel serverChannel;

    public FileGatewayServer(GatewayConfig config, CredentialVerifier credentials, UserRegistry users) {
        this.config = config;
        this.users = users;
        this.sessions = new SessionStore(config.getSessionTtl());
        this.folders = new FolderMapping(config.getFoldersFile(), config.getAdminUsername());

        PathResolver resolver = new PathResolver(config.getRootFolder(), sessions, folders);
        this.routes = new RouteTable(
            new LandingPage(config.getLandingPage()),
            new AuthOperations(credentials, sessions, resolver),
            new FileOperations(resolver, new MultipartParser()));
    }

    /**
     * Loads the folder mapping, creates the root folder and binds the
     * listener. Returns once the port is bound.
     */
    public void start() throws IOException, InterruptedException {
        folders.load();
        Files.createDirectories(config.getRootFolder());
        stopping.set(false);

        GatewayLogger.info(TAG, "Server starting on " + config.getBindAddress() + ":" + config.getPort()
            + ", root folder " + config.getRootFolder());

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        handlerGroup = new DefaultEventExecutorGroup(config.getHandlerThreads());

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .handler(new AcceptErrorLogger(stopping))
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();
                        pipeline.addLast(new HttpServerCodec());
                        pipeline.addLast(new GatewayObjectAggregator(config.getMaxUploadBytes()));
                        pipeline.addLast(new ChunkedWriteHandler());
                        // file I/O stays off the event loop
                        pipeline.addLast(handlerGroup, "gateway", new FileGatewayHandler(routes, sessions));
                    }
                });

        try {
            serverChannel = bootstrap.bind(config.getBindAddress(), config.getPort()).sync().channel();
        } catch (Exception e) {
            shutdownGroups();
            throw e;
        }
        GatewayLogger.info(TAG, "Server started successfully on port " + getPort());
    }

    /**
     * Stops accepting, persists the folder mapping and releases the event loops.
     */
    public void stop() {
        if (!stopping.compareAndSet(false, true)) {
            return;
        }
        GatewayLogger.info(TAG, "Server stopping");
        try {
            folders.save();
        } catch (IOException e) {
            GatewayLogger.error(TAG, "Failed to save folder mapping: " + e.getMessage());
        }
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
            serverChannel = null;
        }
        shutdownGroups();
        GatewayLogger.info(TAG, "Server stopped");
    }

    private void shutdownGroups() {
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }
        if (handlerGroup != null) {
            handlerGroup.shutdownGracefully();
        }
    }

    /**
     * Registers an account and gives it a folder named after the user.
     *
     * @throws IllegalArgumentException if the username is invalid or taken
     */
    public void createUser(String username, String password) throws IOException {
        users.createAccount(username, password);
        folders.assign(username, username);
        folders.save();
    }

    /**
     * Removes the account and its folder mapping. Files on disk are kept.
     */
    public boolean deleteUser(String username) throws IOException {
        if (config.getAdminUsername().equals(username)) {
            GatewayLogger.warn(TAG, "Refusing to delete admin account");
            return false;
        }
        folders.remove(username);
        folders.save();
        return users.deleteAccount(username);
    }

    /**
     * @return the bound port, or the configured one before {@link #start()}
     */
    public int getPort() {
        if (serverChannel != null) {
            return ((InetSocketAddress) serverChannel.localAddress()).getPort();
        }
        return config.getPort();
    }

    public FolderMapping getFolders() {
        return folders;
    }

    /**
     * Logs accept failures on the listening channel, except while stopping,
     * and passes them on so the acceptor can pause accepting.
     */
    static class AcceptErrorLogger extends ChannelInboundHandlerAdapter {

        private final AtomicBoolean stopping;

        AcceptErrorLogger(AtomicBoolean stopping) {
            this.stopping = stopping;
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            if (!stopping.get()) {
                GatewayLogger.error(TAG, "Accept error: " + cause.getMessage());
            }
            ctx.fireExceptionCaught(cause);
        }
    }
}
