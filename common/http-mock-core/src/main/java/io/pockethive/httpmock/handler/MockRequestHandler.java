package io.pockethive.httpmock.handler;

import io.micrometer.core.instrument.Timer;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.pockethive.httpmock.model.RecordedRequest;
import io.pockethive.httpmock.model.ResponseTemplate;
import io.pockethive.httpmock.util.MockServerMetrics;
import java.net.SocketAddress;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts aggregated Netty requests into {@link RecordedRequest} snapshots, hands them to the
 * {@link RequestDispatcher} and writes the chosen {@link ResponseTemplate} back.
 * <p>
 * The client always receives a response: malformed requests get 400 and any dispatcher failure, errors
 * included, gets 500.
 */
@ChannelHandler.Sharable
public final class MockRequestHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(MockRequestHandler.class);
    private static final ResponseTemplate BAD_REQUEST = ResponseTemplate.status(400).build();
    private static final ResponseTemplate SERVER_ERROR = ResponseTemplate.status(500).build();

    private final RequestDispatcher dispatcher;
    private final InFlightTracker inFlight;
    private final MockServerMetrics metrics;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    public MockRequestHandler(RequestDispatcher dispatcher, InFlightTracker inFlight, MockServerMetrics metrics, Clock clock) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.inFlight = Objects.requireNonNull(inFlight, "inFlight");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest msg) {
        inFlight.begin();
        Timer.Sample sample = metrics.startTimer();

        if (msg.decoderResult().isFailure()) {
            log.debug("Rejecting malformed request from {}: {}", ctx.channel().remoteAddress(), msg.decoderResult().cause());
            metrics.incrementErrors();
            write(ctx, BAD_REQUEST, false, sample);
            return;
        }

        boolean keepAlive = HttpUtil.isKeepAlive(msg);
        ResponseTemplate template;
        try {
            RecordedRequest request = toRecordedRequest(ctx, msg);
            template = dispatcher.dispatch(request);
        } catch (VirtualMachineError ex) {
            inFlight.end();
            throw ex;
        } catch (Throwable ex) {
            log.warn("Failed to handle {} {}; answering 500", msg.method(), msg.uri(), ex);
            metrics.incrementErrors();
            template = SERVER_ERROR;
        }

        if (template.hasDelay()) {
            ResponseTemplate delayed = template;
            try {
                ctx.executor().schedule(() -> write(ctx, delayed, keepAlive, sample),
                    template.delay().toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException ex) {
                log.debug("Event loop rejected delayed response for {} {}: {}", msg.method(), msg.uri(), ex.toString());
                inFlight.end();
                ctx.close();
            }
        } else {
            write(ctx, template, keepAlive, sample);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.debug("Closing connection from {} after transport error: {}", ctx.channel().remoteAddress(), cause.toString());
        ctx.close();
    }

    private RecordedRequest toRecordedRequest(ChannelHandlerContext ctx, FullHttpRequest msg) {
        RecordedRequest.Builder builder = RecordedRequest.builder(msg.method().name(), msg.uri())
            .sequence(sequence.incrementAndGet())
            .receivedAt(clock.instant())
            .remoteAddress(describe(ctx.channel().remoteAddress()))
            .body(ByteBufUtil.getBytes(msg.content()));
        for (Map.Entry<String, String> header : msg.headers()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder.build();
    }

    private void write(ChannelHandlerContext ctx, ResponseTemplate template, boolean keepAlive, Timer.Sample sample) {
        FullHttpResponse response = new DefaultFullHttpResponse(
            HttpVersion.HTTP_1_1,
            HttpResponseStatus.valueOf(template.status()),
            Unpooled.wrappedBuffer(template.body()));
        for (Map.Entry<String, List<String>> header : template.headers().entrySet()) {
            response.headers().add(header.getKey(), header.getValue());
        }
        response.headers().set(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes());
        HttpUtil.setKeepAlive(response, keepAlive);

        ctx.writeAndFlush(response).addListener((ChannelFutureListener) future -> {
            try {
                metrics.recordDuration(sample);
                if (!keepAlive || !future.isSuccess()) {
                    future.channel().close();
                }
            } finally {
                inFlight.end();
            }
        });
    }

    private static String describe(SocketAddress address) {
        return address == null ? "unknown" : address.toString();
    }

    /**
     * Decides the response for a recorded request.
     */
    @FunctionalInterface
    public interface RequestDispatcher {

        ResponseTemplate dispatch(RecordedRequest request);
    }
}
