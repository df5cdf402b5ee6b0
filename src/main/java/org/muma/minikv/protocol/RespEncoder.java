package org.muma.minikv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import org.muma.minikv.utils.RespCodecUtil;

/**
 * RESP 协议编码器
 * 具体写法在 RespCodecUtil 中，ByteBuf (命令传播的原始字节) 不经过这里，直接透传
 */
public class RespEncoder extends MessageToByteEncoder<RedisMessage> {

    @Override
    protected void encode(ChannelHandlerContext ctx, RedisMessage msg, ByteBuf out) {
        RespCodecUtil.write(out, msg);
    }
}
