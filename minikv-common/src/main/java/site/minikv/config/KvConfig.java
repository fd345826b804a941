package site.minikv.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 配置文件的映射对象
 *
 * <p>对应的JSON格式：
 * <pre>
 * {
 *   "server_host": "localhost",
 *   "server_port": "6379",
 *   "log_level": "info"
 * }
 * </pre>
 * 端口既可以写成字符串也可以写成数字；缺失的字段使用默认值，未知字段被忽略。
 *
 * @author minikv
 * @since 1.0.0
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class KvConfig {

    public static final String DEFAULT_HOST = "localhost";

    public static final int DEFAULT_PORT = 6379;

    public static final String DEFAULT_LOG_LEVEL = "info";

    @JsonProperty("server_host")
    private String host = DEFAULT_HOST;

    @JsonProperty("server_port")
    private int port = DEFAULT_PORT;

    @JsonProperty("log_level")
    private String logLevel = DEFAULT_LOG_LEVEL;

    /**
     * 内置默认配置：localhost:6379，日志级别info
     */
    public static KvConfig defaults() {
        return new KvConfig();
    }
}
