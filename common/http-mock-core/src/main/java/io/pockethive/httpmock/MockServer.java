package io.pockethive.httpmock;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.GlobalEventExecutor;
import io.pockethive.httpmock.handler.InFlightTracker;
import io.pockethive.httpmock.handler.MockRequestHandler;
import io.pockethive.httpmock.matching.RequestMatcher;
import io.pockethive.httpmock.model.Expectation;
import io.pockethive.httpmock.model.ExpectationViolation;
import io.pockethive.httpmock.model.MockDefinition;
import io.pockethive.httpmock.model.RecordedRequest;
import io.pockethive.httpmock.model.ResponseTemplate;
import io.pockethive.httpmock.model.Scope;
import io.pockethive.httpmock.model.VerificationReport;
import io.pockethive.httpmock.service.MockRule;
import io.pockethive.httpmock.service.MountTable;
import io.pockethive.httpmock.service.RequestLog;
import io.pockethive.httpmock.util.MockServerMetrics;
import java.net.InetSocketAddress;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Programmable HTTP server for tests.
 * <p>
 * Rules are mounted with {@link #mount(MockDefinition)} (until the server stops) or
 * {@link #mountScoped(MockDefinition)} (until the returned guard is released). Each request is logged, matched
 * against the mounted rules newest first and answered by the winning rule, or with 404 and an empty body when
 * nothing matches. {@link #stop()} drains in-flight requests and verifies the call-count expectation of every
 * rule still mounted.
 * <pre>{@code
 * MockServer server = MockServer.builder().port(0).create();
 * server.start();
 * server.mount(MockDefinition.given(path("/health")).expect(Expectation.once()));
 * // ... exercise the client against server.baseUrl() ...
 * server.stop().assertSatisfied();
 * }</pre>
 */
public final class MockServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MockServer.class);

    private final MockServerOptions options;
    private final Clock clock;
    private final MockServerMetrics metrics;
    private final MountTable mountTable;
    private final RequestLog requestLog = new RequestLog();
    private final InFlightTracker inFlight = new InFlightTracker();
    private final Lock startStopLock;
    private final Lock mountLock;

    private volatile ServerState state = ServerState.CREATED;
    private volatile InetSocketAddress address;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private ChannelGroup connections;
    private Channel serverChannel;

    public MockServer(MockServerOptions options) {
        this(options, Clock.systemUTC());
    }

    MockServer(MockServerOptions options, Clock clock) {
        this.options = Objects.requireNonNull(options, "options");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = new MockServerMetrics(options.meterRegistry());
        this.mountTable = new MountTable(clock, metrics);
        ReentrantReadWriteLock lifecycle = new ReentrantReadWriteLock();
        this.startStopLock = lifecycle.writeLock();
        this.mountLock = lifecycle.readLock();
    }

    public static MockServer create() {
        return new MockServer(MockServerOptions.defaults());
    }

    public static MockServerOptions.Builder builder() {
        return MockServerOptions.builder();
    }

    /**
     * Binds the host and port from the options.
     */
    public void start() {
        start(options.host(), options.port());
    }

    /**
     * Binds the given address; port {@code 0} lets the operating system choose.
     *
     * @throws MockServerBindException if the address cannot be bound
     * @throws IllegalStateException   if the server was already started or stopped
     */
    public void start(String host, int port) {
        MockServerOptions effective = options.withAddress(host, port);
        startStopLock.lock();
        try {
            if (state != ServerState.CREATED) {
                throw new IllegalStateException("Mock server cannot be started from state " + state);
            }
            bind(new InetSocketAddress(effective.host(), effective.port()));
            state = ServerState.RUNNING;
        } finally {
            startStopLock.unlock();
        }
        log.info("HTTP mock server started on {}", address);
    }

    private void bind(InetSocketAddress requested) {
        EventLoopGroup boss = new NioEventLoopGroup(1, new DefaultThreadFactory("http-mock-boss", true));
        EventLoopGroup worker = new NioEventLoopGroup(0, new DefaultThreadFactory("http-mock-worker", true));
        ChannelGroup group = new DefaultChannelGroup("http-mock-connections", GlobalEventExecutor.INSTANCE);
        MockRequestHandler handler = new MockRequestHandler(this::handle, inFlight, metrics, clock);

        ServerBootstrap bootstrap = new ServerBootstrap()
            .group(boss, worker)
            .channel(NioServerSocketChannel.class)
            .childHandler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch) {
                    group.add(ch);
                    ChannelPipeline pipeline = ch.pipeline();
                    pipeline.addLast("codec", new HttpServerCodec());
                    pipeline.addLast("aggregator", new HttpObjectAggregator(options.maxContentLength()));
                    pipeline.addLast("mock", handler);
                }
            })
            .option(ChannelOption.SO_BACKLOG, 128)
            .childOption(ChannelOption.TCP_NODELAY, true);

        ChannelFuture bound = bootstrap.bind(requested).awaitUninterruptibly();
        if (!bound.isSuccess()) {
            worker.shutdownGracefully(0, 0, TimeUnit.MILLISECONDS);
            boss.shutdownGracefully(0, 0, TimeUnit.MILLISECONDS);
            throw new MockServerBindException(requested, bound.cause());
        }
        this.bossGroup = boss;
        this.workerGroup = worker;
        this.connections = group;
        this.serverChannel = bound.channel();
        this.address = (InetSocketAddress) serverChannel.localAddress();
    }

    /**
     * Stops accepting connections, waits for in-flight requests (up to the drain timeout), verifies every rule
     * still mounted and destroys them.
     *
     * @return all violations found, never fail-fast
     * @throws AlreadyStoppedException if the server is already stopped
     */
    public VerificationReport stop() {
        startStopLock.lock();
        try {
            if (state == ServerState.STOPPED) {
                throw new AlreadyStoppedException("Mock server has already been stopped");
            }
            ServerState previous = state;
            state = ServerState.STOPPED;
            if (previous == ServerState.RUNNING) {
                shutdownTransport();
            }
            VerificationReport report = mountTable.verifyAll();
            List<MockRule> destroyed = mountTable.clear();
            log.info("HTTP mock server {} stopped (rules={}, requests={})",
                address == null ? "(never started)" : address, destroyed.size(), requestLog.size());
            return report;
        } finally {
            startStopLock.unlock();
        }
    }

    private void shutdownTransport() {
        serverChannel.close().awaitUninterruptibly();
        boolean drained;
        try {
            drained = inFlight.awaitIdle(options.drainTimeout());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            drained = false;
        }
        if (!drained) {
            log.warn("Closing {} in-flight request(s) on {} after drain timeout of {}",
                inFlight.active(), address, options.drainTimeout());
        }
        connections.close().awaitUninterruptibly();
        workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
        bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
    }

    /**
     * Stops the server and throws {@link ExpectationViolationException} when a rule was violated. Closing an
     * already stopped server does nothing.
     */
    @Override
    public void close() {
        VerificationReport report;
        startStopLock.lock();
        try {
            if (state == ServerState.STOPPED) {
                return;
            }
            report = stop();
        } finally {
            startStopLock.unlock();
        }
        report.assertSatisfied();
    }

    /**
     * Decides the answer for one request: log it, pick the newest matching rule and count the call.
     */
    public ResponseTemplate handle(RecordedRequest request) {
        Objects.requireNonNull(request, "request");
        if (options.recordRequests()) {
            requestLog.append(request);
        }
        Optional<MockRule> selected = mountTable.selectAndRecord(request);
        if (selected.isPresent()) {
            MockRule rule = selected.get();
            metrics.incrementMatched();
            log.debug("{} answered by rule {} with {}", request, rule.id(), rule.response().status());
            return rule.response();
        }
        metrics.incrementUnmatched();
        if (options.recordRequests()) {
            requestLog.appendUnmatched(request);
        }
        log.debug("{} matched no rule; answering 404", request);
        return ResponseTemplate.notFound();
    }

    public RuleHandle mount(MockDefinition definition) {
        return mount(definition, Scope.GLOBAL);
    }

    public ScopeGuard mountScoped(MockDefinition definition) {
        return (ScopeGuard) mount(definition, Scope.SCOPED);
    }

    /**
     * Mounts a rule; it takes precedence over every rule mounted before it.
     *
     * @return a {@link ScopeGuard} for {@link Scope#SCOPED} rules, a plain {@link RuleHandle} otherwise
     * @throws IllegalStateException if the server has stopped
     */
    public RuleHandle mount(MockDefinition definition, Scope scope) {
        Objects.requireNonNull(definition, "definition");
        Objects.requireNonNull(scope, "scope");
        mountLock.lock();
        try {
            if (state == ServerState.STOPPED) {
                throw new IllegalStateException("Cannot mount rules on a stopped mock server");
            }
            MockRule rule = mountTable.mount(definition, scope);
            return scope == Scope.SCOPED ? new ScopeGuard(this, rule) : new RuleHandle(this, rule);
        } finally {
            mountLock.unlock();
        }
    }

    /**
     * Unmounts a rule without verifying it.
     *
     * @return {@code false} if no rule with that id was mounted
     */
    public boolean unmount(String id) {
        mountLock.lock();
        try {
            return mountTable.unmount(id).isPresent();
        } finally {
            mountLock.unlock();
        }
    }

    public boolean isMounted(String id) {
        return mountTable.find(id).isPresent();
    }

    /**
     * Handles of the currently mounted rules, in mount order.
     */
    public List<RuleHandle> rules() {
        List<RuleHandle> handles = new ArrayList<>();
        for (MockRule rule : mountTable.rules()) {
            handles.add(new RuleHandle(this, rule));
        }
        return List.copyOf(handles);
    }

    /**
     * Verifies every mounted rule without unmounting anything.
     */
    public VerificationReport verifyMounted() {
        return mountTable.verifyAll();
    }

    /**
     * Checks how many logged requests satisfy {@code matcher}. Requires request recording.
     */
    public VerificationReport verifyRequests(RequestMatcher matcher, Expectation expectation) {
        Objects.requireNonNull(expectation, "expectation");
        long observed = requestLog.matching(matcher).size();
        if (expectation.contains(observed)) {
            return new VerificationReport(1, List.of());
        }
        return new VerificationReport(1, List.of(
            new ExpectationViolation("request-log", matcher.description(), expectation, observed)));
    }

    /**
     * Copy of the request log; later requests never show up in a returned list.
     */
    public List<RecordedRequest> requests() {
        return requestLog.requests();
    }

    public List<RecordedRequest> unmatchedRequests() {
        return requestLog.unmatchedRequests();
    }

    public List<RecordedRequest> requestsMatching(RequestMatcher matcher) {
        return requestLog.matching(matcher);
    }

    public int requestCount() {
        return requestLog.size();
    }

    public ServerState state() {
        return state;
    }

    /**
     * The bound address, available once the server has started (and still after it stopped).
     */
    public InetSocketAddress address() {
        InetSocketAddress bound = address;
        if (bound == null) {
            throw new IllegalStateException("Mock server has not been started");
        }
        return bound;
    }

    public int port() {
        return address().getPort();
    }

    public String baseUrl() {
        InetSocketAddress bound = address();
        String host = bound.getHostString();
        if (host.indexOf(':') >= 0) {
            host = "[" + host + "]";
        }
        return "http://" + host + ":" + bound.getPort();
    }

    public String url(String path) {
        Objects.requireNonNull(path, "path");
        return baseUrl() + (path.startsWith("/") ? path : "/" + path);
    }

    public MockServerOptions options() {
        return options;
    }

    public MockServerMetrics metrics() {
        return metrics;
    }

    @Override
    public String toString() {
        return "MockServer{" + state + (address != null ? ", " + address : "") + '}';
    }
}
