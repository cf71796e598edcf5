package org.tlsfixtures.impl;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tlsfixtures.HttpApplication;
import org.tlsfixtures.ServerStopTimeoutException;
import org.tlsfixtures.TestingApplication;
import org.tlsfixtures.TlsServer;
import org.tlsfixtures.TlsServerBootstrap;
import org.tlsfixtures.TlsServerStartException;
import org.tlsfixtures.extras.CertificateFiles;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * <p>
 * Primary implementation of a {@link TlsServer}, built on Netty.
 * </p>
 *
 * <p>
 * Each server owns exactly one event loop thread, which accepts connections, terminates TLS and runs the
 * {@link HttpApplication}. Only that thread touches the server's channels. {@link #stop()} never closes them
 * directly: it posts the close as a task to the loop's queue, asks the loop to terminate, and then joins the thread.
 * </p>
 *
 * <p>
 * {@link DefaultTlsServer} is bootstrapped by calling {@link #bootstrap()} or {@link #bootstrapFromFile(String)},
 * and then calling {@link TlsServerBootstrap#start()}. For example:
 * </p>
 *
 * <pre>
 * TlsServer server =
 *         DefaultTlsServer
 *                 .bootstrap()
 *                 .withHost("127.0.0.1")
 *                 .withCertificateFiles(files)
 *                 .start();
 * </pre>
 */
public class DefaultTlsServer implements TlsServer {
    private static final Logger LOG = LoggerFactory.getLogger(DefaultTlsServer.class);

    public static final String DEFAULT_NAME = "TlsServer";
    public static final String DEFAULT_SCHEME = "https";
    public static final String DEFAULT_HOST = "localhost";
    public static final long DEFAULT_STOP_TIMEOUT_MS = 30_000L;

    private static final int MAX_CONTENT_LENGTH = 1024 * 1024;

    /**
     * Global counter used to tell threads of servers with the same name apart.
     */
    private static final AtomicInteger serverCount = new AtomicInteger(0);

    private final String name;
    private final int serverId;
    private final String scheme;
    private final String host;
    private final int requestedPort;
    private final CertificateFiles certificateFiles;
    private final HttpApplication application;
    private final List<String> protocols;
    private final long stopTimeoutMs;

    /**
     * True when the server has already been stopped by calling {@link #stop()}.
     */
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private final CategorizedThreadFactory threadFactory;
    private EventLoopGroup eventLoop;

    /**
     * All channels of this server. Only modified and closed on the event loop thread.
     */
    private ChannelGroup allChannels;

    private volatile InetSocketAddress boundAddress;

    /**
     * Bootstrap a new {@link DefaultTlsServer} starting from scratch.
     */
    public static TlsServerBootstrap bootstrap() {
        return new DefaultTlsServerBootstrap();
    }

    /**
     * Bootstrap a new {@link DefaultTlsServer} using defaults from the given properties file. Recognized keys are
     * {@code name}, {@code scheme}, {@code host}, {@code port}, {@code stop_timeout_ms} and {@code protocols}
     * (comma separated). A missing file leaves every default in place.
     */
    public static TlsServerBootstrap bootstrapFromFile(String path) {
        final Path propsFile = Paths.get(path);
        Properties props = new Properties();

        if (Files.isRegularFile(propsFile)) {
            try (InputStream is = Files.newInputStream(propsFile)) {
                props.load(is);
            } catch (final IOException e) {
                LOG.warn("Could not load props file?", e);
            }
        }

        return new DefaultTlsServerBootstrap(props);
    }

    private DefaultTlsServer(String name,
            String scheme,
            String host,
            int requestedPort,
            CertificateFiles certificateFiles,
            HttpApplication application,
            List<String> protocols,
            long stopTimeoutMs) {
        this.name = name;
        this.serverId = serverCount.getAndIncrement();
        this.scheme = scheme;
        this.host = host;
        this.requestedPort = requestedPort;
        this.certificateFiles = certificateFiles;
        this.application = application;
        this.protocols = protocols;
        this.stopTimeoutMs = stopTimeoutMs;
        this.threadFactory = new CategorizedThreadFactory(name, "EventLoop", serverId);
    }

    @Override
    public String getScheme() {
        return scheme;
    }

    @Override
    public String getHost() {
        return host;
    }

    @Override
    public int getPort() {
        return boundAddress.getPort();
    }

    @Override
    public InetSocketAddress getListenAddress() {
        return boundAddress;
    }

    @Override
    public boolean isStopped() {
        return stopped.get();
    }

    /**
     * Threads owned by this server. Exactly one between start and stop, none alive after stop.
     */
    public List<Thread> getThreads() {
        return threadFactory.getThreads();
    }

    private TlsServer start() {
        InetSocketAddress requestedAddress = new InetSocketAddress(host, requestedPort);
        LOG.info("Starting {} at address: {}", name, requestedAddress);

        SslContext sslContext = buildSslContext();

        eventLoop = new NioEventLoopGroup(1, threadFactory);
        allChannels = new DefaultChannelGroup(name, eventLoop.next());

        ServerBootstrap serverBootstrap = new ServerBootstrap()
                .group(eventLoop, eventLoop)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childHandler(new ChannelInitializer<Channel>() {
                    @Override
                    protected void initChannel(Channel ch) {
                        allChannels.add(ch);
                        ChannelPipeline pipeline = ch.pipeline();
                        pipeline.addLast("ssl", sslContext.newHandler(ch.alloc()));
                        pipeline.addLast("http-codec", new HttpServerCodec());
                        pipeline.addLast("http-aggregator", new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                        pipeline.addLast("application", new HttpApplicationHandler(application));
                    }
                });

        ChannelFuture future = serverBootstrap.bind(requestedAddress)
                .addListener(new ChannelFutureListener() {
                    @Override
                    public void operationComplete(ChannelFuture future) {
                        if (future.isSuccess()) {
                            allChannels.add(future.channel());
                        }
                    }
                }).awaitUninterruptibly();

        Throwable cause = future.cause();
        if (cause != null) {
            stopped.set(true);
            eventLoop.shutdownGracefully(0, 0, TimeUnit.MILLISECONDS).awaitUninterruptibly();
            throw new TlsServerStartException(requestedAddress, cause);
        }

        this.boundAddress = (InetSocketAddress) future.channel().localAddress();
        LOG.info("{} started at address: {}", name, this.boundAddress);
        return this;
    }

    private SslContext buildSslContext() {
        try {
            SslContextBuilder builder = SslContextBuilder
                    .forServer(certificateFiles.getServerCertificateChain().toFile(),
                            certificateFiles.getServerPrivateKey().toFile())
                    .sslProvider(SslProvider.JDK);
            if (!protocols.isEmpty()) {
                List<String> enabled = TlsUtils.filterSupportedProtocols(protocols);
                LOG.debug("Enabling protocols {} for {}", enabled, name);
                builder.protocols(enabled);
            }
            return builder.build();
        } catch (SSLException | IllegalArgumentException e) {
            throw new TlsServerStartException("Unable to load TLS material from " + certificateFiles, e);
        }
    }

    @Override
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            LOG.info("Stop requested, but {} is already stopped. Doing nothing.", name);
            return;
        }

        LOG.info("Shutting down {} at address: {}", name, boundAddress);

        // both requests are queued on the loop thread, which runs them in order and then exits
        eventLoop.execute(this::closeAllChannels);
        eventLoop.shutdownGracefully(0, 0, TimeUnit.MILLISECONDS);

        try {
            if (!awaitTermination(eventLoop, threadFactory, stopTimeoutMs)) {
                throw new ServerStopTimeoutException(name, stopTimeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();

            LOG.warn("Interrupted while waiting for {} to shut down", name);
            return;
        }

        LOG.info("Done shutting down {}", name);
    }

    /**
     * Waits for the loop to terminate and its threads to die, both within one budget of {@code timeoutMs}.
     *
     * @return true if everything ended before the deadline
     */
    static boolean awaitTermination(EventLoopGroup group, CategorizedThreadFactory threads, long timeoutMs)
            throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        if (!group.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
            return false;
        }
        return threads.joinAll(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
    }

    /**
     * Runs on the event loop thread.
     */
    private void closeAllChannels() {
        LOG.debug("Closing {} channels of {}", allChannels.size(), name);
        allChannels.close();
    }

    private static class DefaultTlsServerBootstrap implements TlsServerBootstrap {
        private String name = DEFAULT_NAME;
        private String scheme = DEFAULT_SCHEME;
        private String host = DEFAULT_HOST;
        private int port = 0;
        private CertificateFiles certificateFiles;
        private HttpApplication application = new TestingApplication();
        private List<String> protocols = ImmutableList.of();
        private long stopTimeoutMs = DEFAULT_STOP_TIMEOUT_MS;

        private DefaultTlsServerBootstrap() {
        }

        private DefaultTlsServerBootstrap(Properties props) {
            this.withName(TlsUtils.extractString(props, "name", DEFAULT_NAME));
            this.withScheme(TlsUtils.extractString(props, "scheme", DEFAULT_SCHEME));
            this.withHost(TlsUtils.extractString(props, "host", DEFAULT_HOST));
            this.withPort(TlsUtils.extractInt(props, "port", 0));
            this.withStopTimeout(TlsUtils.extractLong(props, "stop_timeout_ms", DEFAULT_STOP_TIMEOUT_MS));
            this.withProtocols(TlsUtils.extractList(props, "protocols"));
        }

        @Override
        public TlsServerBootstrap withName(String name) {
            this.name = Preconditions.checkNotNull(name);
            return this;
        }

        @Override
        public TlsServerBootstrap withScheme(String scheme) {
            this.scheme = Preconditions.checkNotNull(scheme);
            return this;
        }

        @Override
        public TlsServerBootstrap withHost(String host) {
            this.host = Preconditions.checkNotNull(host);
            return this;
        }

        @Override
        public TlsServerBootstrap withPort(int port) {
            Preconditions.checkArgument(port >= 0 && port <= 65535, "Invalid port: %s", port);
            this.port = port;
            return this;
        }

        @Override
        public TlsServerBootstrap withCertificateFiles(CertificateFiles certificateFiles) {
            this.certificateFiles = Preconditions.checkNotNull(certificateFiles);
            return this;
        }

        @Override
        public TlsServerBootstrap withApplication(HttpApplication application) {
            this.application = Preconditions.checkNotNull(application);
            return this;
        }

        @Override
        public TlsServerBootstrap withProtocols(List<String> protocols) {
            this.protocols = ImmutableList.copyOf(protocols);
            return this;
        }

        @Override
        public TlsServerBootstrap withStopTimeout(long stopTimeoutMs) {
            Preconditions.checkArgument(stopTimeoutMs > 0, "Stop timeout must be positive: %s", stopTimeoutMs);
            this.stopTimeoutMs = stopTimeoutMs;
            return this;
        }

        @Override
        public TlsServer start() {
            Preconditions.checkState(certificateFiles != null, "No certificate files configured");
            return new DefaultTlsServer(name, scheme, host, port, certificateFiles, application, protocols,
                    stopTimeoutMs).start();
        }
    }
}
