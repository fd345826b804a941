package site.minikv.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import lombok.extern.slf4j.Slf4j;
import site.minikv.protocol.ProtocolException;
import site.minikv.protocol.RespCodec;
import site.minikv.protocol.RespRequest;

import java.util.List;

/**
 * RESP请求解码器
 *
 * <p>把入站字节流切分为 {@link RespRequest}。一次读取中到达的多条请求会全部解码，
 * 不完整的尾部留在累积缓冲区等待后续数据。
 *
 * <p>遇到 {@link ProtocolException} 时字节流已无法对齐，丢弃剩余数据并关闭连接，
 * 不发送任何回复。
 *
 * @author minikv
 * @since 1.0.0
 */
@Slf4j
public class RespDecoder extends ByteToMessageDecoder {

    @Override
    protected void decode(final ChannelHandlerContext ctx, final ByteBuf in, final List<Object> out) {
        while (in.isReadable()) {
            final RespRequest request;
            try {
                request = RespCodec.decodeRequest(in);
            } catch (ProtocolException e) {
                log.warn("协议错误，关闭连接 {}: {}", ctx.channel().remoteAddress(), e.getMessage());
                in.skipBytes(in.readableBytes());
                ctx.close();
                return;
            }
            if (request == null) {
                return;
            }
            log.debug("解码请求: {}", request);
            out.add(request);
        }
    }

    @Override
    protected void decodeLast(final ChannelHandlerContext ctx, final ByteBuf in, final List<Object> out)
            throws Exception {
        super.decodeLast(ctx, in, out);
        if (in.isReadable()) {
            log.debug("连接 {} 关闭时丢弃不完整的帧 ({} bytes)",
                    ctx.channel().remoteAddress(), in.readableBytes());
            in.skipBytes(in.readableBytes());
        }
    }
}
