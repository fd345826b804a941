package site.minikv.server.handler;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import lombok.extern.slf4j.Slf4j;
import site.minikv.command.CommandDispatcher;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespRequest;

import java.io.IOException;

/**
 * 命令处理器，连接管道的最后一环
 *
 * <p>每收到一条请求就交给 {@link CommandDispatcher} 执行并写回一条回复，
 * 同一连接上的回复顺序与请求顺序一致。运行在独立的命令执行线程组上，
 * 等待存储锁不会阻塞I/O线程。
 *
 * @author minikv
 * @since 1.0.0
 */
@Slf4j
public class RespCommandHandler extends SimpleChannelInboundHandler<RespRequest> {

    private final CommandDispatcher dispatcher;

    public RespCommandHandler(final CommandDispatcher dispatcher) {
        if (dispatcher == null) {
            throw new IllegalArgumentException("命令分发器不能为null");
        }
        this.dispatcher = dispatcher;
    }

    @Override
    public void channelActive(final ChannelHandlerContext ctx) throws Exception {
        log.info("客户端连接: {}", ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
        log.info("客户端断开: {}", ctx.channel().remoteAddress());
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final RespRequest request) {
        final Resp response = dispatcher.dispatch(request);
        if (!ctx.channel().isActive()) {
            log.debug("连接已关闭，丢弃 {} 的回复", request.getCommandName());
            return;
        }
        ctx.writeAndFlush(response);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        if (cause instanceof IOException) {
            log.debug("连接 {} I/O异常: {}", ctx.channel().remoteAddress(), cause.getMessage());
        } else {
            log.error("连接 {} 异常: {}", ctx.channel().remoteAddress(), cause.getMessage(), cause);
        }
        ctx.close();
    }
}
