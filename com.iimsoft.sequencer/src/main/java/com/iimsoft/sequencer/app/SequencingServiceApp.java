package com.iimsoft.sequencer.app;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.iimsoft.sequencer.api.dto.SequenceRequest;
import com.iimsoft.sequencer.api.dto.SequenceResponse;
import com.iimsoft.sequencer.config.SequencerConfig;
import com.iimsoft.sequencer.service.RequestedResourceAssigner;
import com.iimsoft.sequencer.service.SequencingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 命令行入口：读取 SequenceRequest JSON，排序后把 SequenceResponse 打印到 stdout。
 *
 * 用法：
 * <pre>
 * mvn exec:java -pl com.iimsoft.sequencer -Dexec.args="request.json --insert-mode BEST"
 * mvn exec:java -pl com.iimsoft.sequencer -Dexec.args="- --config my-config.json" &lt; request.json
 * </pre>
 * 命令行选项写入 request.options，优先于请求文件本身和配置文件。
 *
 * 退出码：0 成功，1 请求无效或无法读取，2 参数错误。
 */
public class SequencingServiceApp {

    private static final Logger LOGGER = LoggerFactory.getLogger(SequencingServiceApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID_REQUEST = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = "用法：<request.json | -> [--config 文件或classpath资源] [--insert-mode APPEND|BEST]"
            + " [--branch-improve] [--no-improve] [--time-limit 秒]";

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    static int run(String[] args, InputStream stdin, PrintStream out, PrintStream err) {
        Arguments arguments;
        try {
            arguments = Arguments.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        ObjectMapper mapper = new ObjectMapper();
        try {
            SequencerConfig config = loadConfig(arguments.config);
            SequenceRequest request = readRequest(mapper, arguments.input, stdin);
            arguments.applyTo(request);

            SequenceResponse response = new SequencingService(config, new RequestedResourceAssigner()).solve(request);
            out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(response));
            if (!response.complete) {
                err.println("时间预算已用完，部分资源未优化");
            }
            LOGGER.info("Wrote {} task results, score {}", response.tasks.size(), response.score);
            return EXIT_OK;
        } catch (IllegalArgumentException e) {
            err.println("请求无效：" + e.getMessage());
            return EXIT_INVALID_REQUEST;
        } catch (IOException e) {
            err.println("无法读取请求：" + e.getMessage());
            return EXIT_INVALID_REQUEST;
        } catch (UncheckedIOException e) {
            err.println("无法读取配置：" + e.getMessage());
            return EXIT_INVALID_REQUEST;
        }
    }

    private static SequencerConfig loadConfig(String config) {
        if (config == null) {
            return SequencerConfig.load();
        }
        Path path = Path.of(config);
        return Files.isRegularFile(path) ? SequencerConfig.load(path) : SequencerConfig.load(config);
    }

    private static SequenceRequest readRequest(ObjectMapper mapper, String input, InputStream stdin) throws IOException {
        if ("-".equals(input)) {
            return mapper.readValue(stdin, SequenceRequest.class);
        }
        Path path = Path.of(input);
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("请求文件不存在或是目录：" + path.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(path)) {
            return mapper.readValue(in, SequenceRequest.class);
        }
    }

    // ************************************************************************
    // Arguments
    // ************************************************************************

    static class Arguments {
        String input;
        String config;
        String insertMode;
        Boolean improve;
        Boolean branchImprove;
        Integer timeLimitSeconds;

        static Arguments parse(String[] args) {
            Arguments a = new Arguments();
            if (args == null) {
                args = new String[0];
            }
            for (int i = 0; i < args.length; i++) {
                String arg = args[i] == null ? "" : args[i].trim();
                switch (arg) {
                    case "--config":
                        a.config = value(args, ++i, arg);
                        break;
                    case "--insert-mode":
                        a.insertMode = value(args, ++i, arg);
                        break;
                    case "--branch-improve":
                        a.branchImprove = Boolean.TRUE;
                        break;
                    case "--no-improve":
                        a.improve = Boolean.FALSE;
                        break;
                    case "--time-limit":
                        String seconds = value(args, ++i, arg);
                        try {
                            a.timeLimitSeconds = Integer.parseInt(seconds);
                        } catch (NumberFormatException e) {
                            throw new IllegalArgumentException("--time-limit 需要整数秒，实际为 " + seconds, e);
                        }
                        break;
                    default:
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("未知选项：" + arg);
                        }
                        if (arg.isEmpty() || a.input != null) {
                            throw new IllegalArgumentException("只能指定一个请求文件（或 '-' 代表 stdin）");
                        }
                        a.input = arg;
                }
            }
            if (a.input == null) {
                throw new IllegalArgumentException("缺少参数：SequenceRequest JSON 文件路径，或 '-' 代表从 stdin 读取");
            }
            return a;
        }

        private static String value(String[] args, int index, String option) {
            if (index >= args.length || args[index] == null || args[index].isBlank()) {
                throw new IllegalArgumentException(option + " 缺少取值");
            }
            return args[index].trim();
        }

        void applyTo(SequenceRequest request) {
            if (insertMode == null && improve == null && branchImprove == null && timeLimitSeconds == null) {
                return;
            }
            if (request.options == null) {
                request.options = new SequenceRequest.OptionsDto();
            }
            if (insertMode != null) request.options.insertMode = insertMode;
            if (improve != null) request.options.improve = improve;
            if (branchImprove != null) request.options.branchImprove = branchImprove;
            if (timeLimitSeconds != null) request.options.timeLimitSeconds = timeLimitSeconds;
        }
    }
}
