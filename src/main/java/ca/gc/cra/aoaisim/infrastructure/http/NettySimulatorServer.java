package ca.gc.cra.aoaisim.infrastructure.http;

import ca.gc.cra.aoaisim.config.ServerConfig;
import ca.gc.cra.aoaisim.domain.http.SimulatorRequest;
import ca.gc.cra.aoaisim.domain.http.SimulatorResponse;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> HTTP/1.1 listener that feeds every request into the simulator router.
 * <p><strong>How:</strong> Netty {@link HttpServerCodec} plus {@link HttpObjectAggregator}; each aggregated request is
 * copied into a {@link SimulatorRequest} and the router's stage is written back when it completes, so delayed
 * responses never block an event loop.</p>
 * <p><strong>Thread-safety:</strong> {@link #start()} and {@link #stop()} are synchronized. The worker group is
 * supplied by the caller so it can also drive latency timers.</p>
 *
 * @since 0.1.0
 */
public final class NettySimulatorServer implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(NettySimulatorServer.class);
  private static final int SO_BACKLOG = 1024;

  private final ServerConfig config;
  private final EventLoopGroup workerGroup;
  private final Function<SimulatorRequest, CompletionStage<SimulatorResponse>> handler;

  private volatile EventLoopGroup bossGroup;
  private volatile Channel serverChannel;

  /**
   * Creates a server.
   *
   * @param config listener settings
   * @param workerGroup event loops serving connections; owned by the caller
   * @param handler request handler, normally {@code SimulatorRouter::route}
   */
  public NettySimulatorServer(
      ServerConfig config,
      EventLoopGroup workerGroup,
      Function<SimulatorRequest, CompletionStage<SimulatorResponse>> handler) {
    this.config = Objects.requireNonNull(config, "config");
    this.workerGroup = Objects.requireNonNull(workerGroup, "workerGroup");
    this.handler = Objects.requireNonNull(handler, "handler");
  }

  /**
   * Binds the listener.
   *
   * @throws InterruptedException when interrupted while binding
   */
  public synchronized void start() throws InterruptedException {
    if (serverChannel != null) {
      return;
    }
    bossGroup = new NioEventLoopGroup(1);
    try {
      ServerBootstrap bootstrap = new ServerBootstrap()
          .group(bossGroup, workerGroup)
          .channel(NioServerSocketChannel.class)
          .option(ChannelOption.SO_BACKLOG, SO_BACKLOG)
          .childOption(ChannelOption.TCP_NODELAY, true)
          .childOption(ChannelOption.SO_KEEPALIVE, true)
          .childHandler(new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch) {
              ch.pipeline().addLast(new HttpServerCodec());
              ch.pipeline().addLast(new HttpObjectAggregator(config.maxContentLength()));
              ch.pipeline().addLast(new SimulatorHttpHandler());
            }
          });
      serverChannel = bootstrap.bind(config.host(), config.port()).sync().channel();
      log.info("Simulator listening on {}:{}", config.host(), boundPort());
    } catch (InterruptedException | RuntimeException ex) {
      stop();
      throw ex;
    }
  }

  /** @return bound port, useful when configured with port {@code 0}; {@code -1} when not started */
  public int boundPort() {
    Channel channel = serverChannel;
    if (channel == null || !(channel.localAddress() instanceof InetSocketAddress address)) {
      return -1;
    }
    return address.getPort();
  }

  /** Closes the listener and the boss group; the worker group is left to its owner. */
  public synchronized void stop() {
    Channel channel = serverChannel;
    serverChannel = null;
    if (channel != null) {
      channel.close().syncUninterruptibly();
    }
    EventLoopGroup boss = bossGroup;
    bossGroup = null;
    if (boss != null) {
      boss.shutdownGracefully().syncUninterruptibly();
      log.info("Simulator listener stopped");
    }
  }

  @Override
  public void close() {
    stop();
  }

  private final class SimulatorHttpHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
      boolean keepAlive = HttpUtil.isKeepAlive(req);
      if (!req.decoderResult().isSuccess()) {
        writeResponse(ctx, keepAlive, SimulatorResponse.text(400, "bad request"));
        return;
      }
      SimulatorRequest request = toSimulatorRequest(req);
      CompletionStage<SimulatorResponse> stage;
      try {
        stage = handler.apply(request);
      } catch (RuntimeException ex) {
        log.error("Request handler failed for {} {}", request.method(), request.path(), ex);
        writeResponse(ctx, keepAlive, SimulatorResponse.empty(500));
        return;
      }
      stage.whenComplete((response, ex) -> {
        if (ex != null) {
          log.error("Request handler failed for {} {}", request.method(), request.path(), ex);
          writeResponse(ctx, keepAlive, SimulatorResponse.empty(500));
        } else {
          writeResponse(ctx, keepAlive, response);
        }
      });
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
      log.warn("HTTP channel failure on {}", ctx.channel().remoteAddress(), cause);
      ctx.close();
    }
  }

  static SimulatorRequest toSimulatorRequest(FullHttpRequest req) {
    Map<String, List<String>> headers = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : req.headers()) {
      headers.computeIfAbsent(entry.getKey(), k -> new ArrayList<>()).add(entry.getValue());
    }
    byte[] body = ByteBufUtil.getBytes(req.content());
    return SimulatorRequest.of(req.method().name(), req.uri(), headers, body);
  }

  private static void writeResponse(ChannelHandlerContext ctx, boolean keepAlive, SimulatorResponse response) {
    FullHttpResponse out = new DefaultFullHttpResponse(
        HttpVersion.HTTP_1_1,
        HttpResponseStatus.valueOf(response.status()),
        Unpooled.wrappedBuffer(response.body()));
    response.headers().forEach((name, value) -> out.headers().set(name, value));
    out.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, out.content().readableBytes());
    if (keepAlive) {
      out.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
      ctx.writeAndFlush(out);
    } else {
      out.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
      ctx.writeAndFlush(out).addListener(ChannelFutureListener.CLOSE);
    }
  }
}
