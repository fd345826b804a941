package site.minikv.command;

import lombok.extern.slf4j.Slf4j;
import site.minikv.protocol.Errors;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespRequest;
import site.minikv.store.KvStore;
import site.minikv.store.WrongTypeException;

/**
 * 命令分发器
 *
 * <p>处理流程：
 * <ul>
 *     <li>查找命令类型，命令名为空或未知时直接回复错误</li>
 *     <li>检查参数个数，不符合时不创建命令，存储保持不变</li>
 *     <li>创建命令实例，解析参数</li>
 *     <li>执行命令，把异常转换为错误回复</li>
 * </ul>
 * 任何命令级别的失败都只产生一条错误回复，不影响连接本身。
 * 线程安全，可被所有连接共享。
 *
 * @author minikv
 * @since 1.0.0
 */
@Slf4j
public class CommandDispatcher {

    private static final Errors EMPTY_COMMAND_ERROR = new Errors("ERR empty command");

    private static final Errors WRONG_TYPE_ERROR = new Errors(WrongTypeException.MESSAGE);

    private final KvStore store;

    public CommandDispatcher(final KvStore store) {
        if (store == null) {
            throw new IllegalArgumentException("存储不能为null");
        }
        this.store = store;
    }

    /**
     * 执行一条请求
     *
     * @param request 解码后的请求
     * @return 回复，永不为null
     */
    public Resp dispatch(final RespRequest request) {
        if (request.getCommand().isEmpty()) {
            return EMPTY_COMMAND_ERROR;
        }

        final CommandType commandType = CommandType.findByBytes(request.getCommand());
        if (commandType == null) {
            log.debug("未知命令: {}", request.getCommand());
            return new Errors("ERR unknown command '" + request.getCommand().getString() + "'");
        }
        if (!commandType.acceptsArgCount(request.argCount())) {
            return new Errors("ERR wrong number of arguments for '" + commandType.displayName() + "' command");
        }

        try {
            final Command command = commandType.createCommand(store);
            command.setContext(request);
            final Resp response = command.handle();
            log.debug("执行命令 {} 参数个数 {} -> {}", commandType, request.argCount(),
                    response.getClass().getSimpleName());
            return response;
        } catch (CommandArgumentException e) {
            return new Errors("ERR " + e.getMessage());
        } catch (WrongTypeException e) {
            return WRONG_TYPE_ERROR;
        } catch (RuntimeException e) {
            log.error("命令 {} 执行失败", commandType, e);
            return new Errors("ERR " + e.getMessage());
        }
    }
}
