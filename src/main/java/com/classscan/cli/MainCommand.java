package com.classscan.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.classscan.config.Constants;
import com.classscan.config.ScannerConfig;
import com.classscan.config.ScannerConfigException;
import com.classscan.text.ClassInfo;
import com.classscan.text.ClassTokenScanner;
import com.classscan.text.ScanResult;
import com.classscan.text.SelectionInfo;
import com.classscan.text.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

@Command(
    name = "cscan",
    description = "🧩 类名变体扫描工具",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.ScanSubcommand.class,
        MainCommand.SelectSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(MainCommand.class);

    @Option(names = {"--config"}, description = "JSON 配置文件路径")
    private Path configFile;

    @Option(names = {"--separator"}, description = "变体分隔符（默认 :）")
    private String separator;

    @Option(names = {"--brackets"}, description = "识别括号分组")
    private boolean brackets;

    @Option(names = {"--open"}, description = "左括号字符集（默认 (）")
    private String openChars;

    @Option(names = {"--close"}, description = "右括号字符集（默认 )）")
    private String closeChars;

    @Option(names = {"--important"}, description = "识别结尾的 important 标记")
    private boolean important;

    @Option(names = {"--twin"}, description = "twin 语法：分隔符固定为 :，并启用括号与 important")
    private boolean twin;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🧩 类名变体扫描工具");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    /**
     * 合并配置文件与命令行选项，命令行优先。
     */
    ScannerConfig buildConfig() {
        ScannerConfig config = configFile != null ? ScannerConfig.load(configFile) : ScannerConfig.defaults();
        if (separator != null) {
            config.setSeparator(separator);
        }
        if (brackets) {
            config.setHandleBrackets(true);
        }
        if (openChars != null) {
            config.setOpenChars(openChars);
        }
        if (closeChars != null) {
            config.setCloseChars(closeChars);
        }
        if (important) {
            config.setHandleImportant(true);
        }
        if (twin) {
            config.applyTwin();
        }
        return config;
    }

    private String readInput(String rawText) throws IOException {
        String text = "-".equals(rawText)
            ? new String(System.in.readAllBytes(), StandardCharsets.UTF_8)
            : rawText;
        if (text == null) {
            return "";
        }
        if (text.length() > Constants.MAX_INPUT_LENGTH) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                "输入长度超过限制（最大 " + Constants.MAX_INPUT_LENGTH + " 字符）");
        }
        return text;
    }

    private static String formatToken(Token token) {
        return "\"" + token.text() + "\" [" + token.start() + ", " + token.end() + ")";
    }

    private static String joinVariants(List<Token> variants) {
        return variants.stream().map(Token::text).collect(Collectors.joining(", ", "[", "]"));
    }

    private static void printJson(Object value) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value));
    }

    @Command(name = "scan", description = "📋 列出文本中的全部类名")
    static class ScanSubcommand implements Callable<Integer> {

        @Parameters(description = "要扫描的类名文本，- 表示从标准输入读取", arity = "1")
        private String text;

        @Option(names = {"--start"}, description = "扫描起始偏移", defaultValue = "0")
        private int start;

        @Option(names = {"--end"}, description = "扫描结束偏移（不含），默认到文本末尾", defaultValue = "-1")
        private int end;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                String input = main.readInput(text);
                ClassTokenScanner scanner = new ClassTokenScanner(main.buildConfig());
                int effectiveEnd = end < 0 ? input.length() : end;
                ScanResult result = scanner.scan(input, start, effectiveEnd, Constants.NO_CURSOR);

                if ("json".equalsIgnoreCase(format)) {
                    printJson(result.classList());
                } else {
                    printTextResult(result.classList());
                }
                return 0;
            } catch (ScannerConfigException exception) {
                System.err.println("❌ 配置错误: " + exception.getMessage());
                return 1;
            } catch (Exception exception) {
                logger.error("扫描失败", exception);
                System.err.println("❌ 扫描失败: " + exception.getMessage());
                return 1;
            }
        }

        private void printTextResult(List<ClassInfo> classList) {
            if (classList.isEmpty()) {
                System.out.println("⚠️ 未找到类名");
                return;
            }

            int rank = 1;
            for (ClassInfo classInfo : classList) {
                StringBuilder line = new StringBuilder();
                line.append(rank++).append(". ").append(formatToken(classInfo.token()));
                if (!classInfo.variants().isEmpty()) {
                    line.append("  variants=").append(joinVariants(classInfo.variants()));
                }
                if (classInfo.inGroup()) {
                    line.append("  (group)");
                }
                if (classInfo.important()) {
                    line.append("  !important");
                }
                System.out.println(line);
            }
            System.out.println();
            System.out.println("📊 共 " + classList.size() + " 个类名");
        }
    }

    @Command(name = "select", description = "🎯 解析光标所在的类名或变体")
    static class SelectSubcommand implements Callable<Integer> {

        @Parameters(description = "类名文本，- 表示从标准输入读取", arity = "1")
        private String text;

        @Option(names = {"-c", "--cursor"}, description = "光标偏移", required = true)
        private int cursor;

        @Option(names = {"--hover"}, description = "使用悬停语义（光标须严格位于词内）")
        private boolean hover;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                String input = main.readInput(text);
                ScannerConfig config = main.buildConfig();
                config.setHoverMode(hover);
                config.setGreedy(false);
                SelectionInfo selection = new ClassTokenScanner(config).scan(input, cursor).selection();

                if ("json".equalsIgnoreCase(format)) {
                    printJson(selection);
                } else {
                    printTextResult(selection);
                }
                return 0;
            } catch (ScannerConfigException exception) {
                System.err.println("❌ 配置错误: " + exception.getMessage());
                return 1;
            } catch (Exception exception) {
                logger.error("解析光标失败", exception);
                System.err.println("❌ 解析失败: " + exception.getMessage());
                return 1;
            }
        }

        private void printTextResult(SelectionInfo selection) {
            if (!selection.hasSelection()) {
                System.out.println("⚠️ 光标未落在任何类名上");
            } else {
                System.out.println("🎯 选中: " + formatToken(selection.selected()));
            }
            System.out.println("   变体链: " + joinVariants(selection.variants()));
            System.out.println("   分组内: " + selection.inGroup());
            System.out.println("   important: " + selection.important());
        }
    }
}
