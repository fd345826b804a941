package site.minikv.command;

import site.minikv.protocol.Resp;
import site.minikv.protocol.RespRequest;

/**
 * 命令接口
 *
 * <p>每个请求创建一个新的命令实例：先由 {@link #setContext(RespRequest)} 解析并校验参数，
 * 再由 {@link #handle()} 访问存储并生成回复。参数个数在创建实例之前已经由
 * {@link CommandType} 检查过。
 *
 * @author minikv
 * @since 1.0.0
 */
public interface Command {

    /**
     * 解析请求参数
     *
     * @param request 已通过参数个数检查的请求
     * @throws CommandArgumentException 参数格式不正确
     */
    void setContext(RespRequest request);

    /**
     * 执行命令并返回回复
     *
     * @return RESP格式的执行结果
     */
    Resp handle();
}
