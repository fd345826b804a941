package site.minikv.client;

import lombok.extern.slf4j.Slf4j;
import site.minikv.config.CommandLineOptions;
import site.minikv.config.ConfigLoader;
import site.minikv.config.KvConfig;
import site.minikv.config.LogLevels;
import site.minikv.protocol.Resp;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 交互式命令行客户端
 *
 * <p>用法：{@code MiniKvCli [--config <path>]}。每行按空白切分为命令和参数，
 * 输入 {@code exit} 退出，空行忽略。参数不支持引号，值中不能含空白。
 */
@Slf4j
public class MiniKvCli {

    static final String PROMPT = "> ";

    static final String EXIT = "exit";

    private final MiniKvClient client;

    private final PrintStream out;

    public MiniKvCli(final MiniKvClient client, final PrintStream out) {
        this.client = client;
        this.out = out;
    }

    public static void main(String[] args) {
        final CommandLineOptions options;
        try {
            options = CommandLineOptions.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("用法: MiniKvCli [--config <path>]");
            System.exit(1);
            return;
        }
        final KvConfig config = ConfigLoader.loadOrDefault(options.getConfigPath());
        LogLevels.apply(config.getLogLevel());

        final String address = config.getHost() + ":" + config.getPort();
        try (MiniKvClient client = new MiniKvClient(config.getHost(), config.getPort())) {
            System.out.println("Connected to minikv server at " + address + ". Type 'exit' to quit.");
            final BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            if (!new MiniKvCli(client, System.out).run(in)) {
                System.exit(1);
            }
        } catch (IOException e) {
            System.err.println("Could not connect to " + address + ": " + e.getMessage());
            System.exit(1);
        }
    }

    /**
     * 读取并执行命令直到输入结束或 exit
     *
     * @param in 命令输入
     * @return 正常结束返回true，连接中断返回false
     * @throws IOException 读取输入失败
     */
    public boolean run(final BufferedReader in) throws IOException {
        while (true) {
            out.print(PROMPT);
            out.flush();
            final String line = in.readLine();
            if (line == null) {
                out.println();
                return true;
            }
            final List<String> tokens = tokenize(line);
            if (tokens.isEmpty()) {
                continue;
            }
            if (tokens.size() == 1 && EXIT.equalsIgnoreCase(tokens.get(0))) {
                return true;
            }

            final Resp reply;
            try {
                reply = client.execute(tokens.get(0),
                        tokens.subList(1, tokens.size()).toArray(new String[0]));
            } catch (IOException e) {
                log.debug("连接中断", e);
                out.println("(error) connection lost: " + e.getMessage());
                return false;
            }
            out.println(reply.render());
        }
    }

    /**
     * 按空白切分一行输入
     */
    static List<String> tokenize(final String line) {
        final String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Arrays.asList(trimmed.split("\\s+")));
    }
}
