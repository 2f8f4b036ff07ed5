package com.classscan.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 扫描器运行时配置
 *
 * 支持从CLI参数或JSON配置文件注入，覆盖Constants默认值。
 * 扫描器在构造时校验并复制一份快照，之后修改本对象不影响已创建的扫描器。
 */
public class ScannerConfig {
    private static final Logger logger = LoggerFactory.getLogger(ScannerConfig.class);

    private String separator = Constants.DEFAULT_SEPARATOR;
    private boolean handleBrackets = false;
    private String openChars = Constants.DEFAULT_OPEN_CHARS;
    private String closeChars = Constants.DEFAULT_CLOSE_CHARS;
    private boolean handleImportant = false;
    private char importantMarker = Constants.DEFAULT_IMPORTANT_MARKER;
    private boolean hoverMode = false;
    private boolean greedy = true;
    private int maxNestingDepth = Constants.MAX_NESTING_DEPTH;

    public String getSeparator() {
        return separator;
    }

    public void setSeparator(String separator) {
        this.separator = separator;
    }

    public boolean isHandleBrackets() {
        return handleBrackets;
    }

    public void setHandleBrackets(boolean handleBrackets) {
        this.handleBrackets = handleBrackets;
    }

    public String getOpenChars() {
        return openChars;
    }

    public void setOpenChars(String openChars) {
        this.openChars = openChars;
    }

    public String getCloseChars() {
        return closeChars;
    }

    public void setCloseChars(String closeChars) {
        this.closeChars = closeChars;
    }

    public boolean isHandleImportant() {
        return handleImportant;
    }

    public void setHandleImportant(boolean handleImportant) {
        this.handleImportant = handleImportant;
    }

    public char getImportantMarker() {
        return importantMarker;
    }

    public void setImportantMarker(char importantMarker) {
        this.importantMarker = importantMarker;
    }

    public boolean isHoverMode() {
        return hoverMode;
    }

    public void setHoverMode(boolean hoverMode) {
        this.hoverMode = hoverMode;
    }

    public boolean isGreedy() {
        return greedy;
    }

    public void setGreedy(boolean greedy) {
        this.greedy = greedy;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public void setMaxNestingDepth(int maxNestingDepth) {
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * 校验配置，任何会导致零宽匹配或括号歧义的取值都视为调用方错误。
     */
    public void validate() {
        if (separator == null || separator.isEmpty()) {
            throw new ScannerConfigException("分隔符不能为空", "separator", String.valueOf(separator));
        }
        if (containsWhitespace(separator)) {
            throw new ScannerConfigException("分隔符不能包含空白字符", "separator", separator);
        }
        if (handleBrackets) {
            if (openChars == null || openChars.isEmpty()) {
                throw new ScannerConfigException("左括号字符集不能为空", "openChars", String.valueOf(openChars));
            }
            if (closeChars == null || closeChars.isEmpty()) {
                throw new ScannerConfigException("右括号字符集不能为空", "closeChars", String.valueOf(closeChars));
            }
            if (containsWhitespace(openChars)) {
                throw new ScannerConfigException("括号字符不能是空白字符", "openChars", openChars);
            }
            if (containsWhitespace(closeChars)) {
                throw new ScannerConfigException("括号字符不能是空白字符", "closeChars", closeChars);
            }
            for (int index = 0; index < openChars.length(); index++) {
                if (closeChars.indexOf(openChars.charAt(index)) >= 0) {
                    throw new ScannerConfigException("左右括号字符集不能重叠", "closeChars", closeChars);
                }
            }
            for (int index = 0; index < separator.length(); index++) {
                char ch = separator.charAt(index);
                if (openChars.indexOf(ch) >= 0 || closeChars.indexOf(ch) >= 0) {
                    throw new ScannerConfigException("分隔符不能包含括号字符", "separator", separator);
                }
            }
        }
        if (handleImportant) {
            if (Character.isWhitespace(importantMarker)) {
                throw new ScannerConfigException("important 标记不能是空白字符", "importantMarker",
                    String.valueOf(importantMarker));
            }
            if (separator.indexOf(importantMarker) >= 0) {
                throw new ScannerConfigException("important 标记不能出现在分隔符中", "importantMarker",
                    String.valueOf(importantMarker));
            }
        }
        if (maxNestingDepth <= 0) {
            throw new ScannerConfigException("最大嵌套深度必须为正数", "maxNestingDepth", String.valueOf(maxNestingDepth));
        }
    }

    /**
     * 复制当前配置，供派生不同模式的扫描器使用。
     */
    public ScannerConfig copy() {
        ScannerConfig copy = new ScannerConfig();
        copy.separator = separator;
        copy.handleBrackets = handleBrackets;
        copy.openChars = openChars;
        copy.closeChars = closeChars;
        copy.handleImportant = handleImportant;
        copy.importantMarker = importantMarker;
        copy.hoverMode = hoverMode;
        copy.greedy = greedy;
        copy.maxNestingDepth = maxNestingDepth;
        return copy;
    }

    /**
     * 切换为 twin 语法：分隔符固定为冒号，并启用括号分组与 important 标记。
     */
    public ScannerConfig applyTwin() {
        this.separator = Constants.TWIN_SEPARATOR;
        this.handleBrackets = true;
        this.handleImportant = true;
        return this;
    }

    /**
     * 使用默认配置创建实例
     */
    public static ScannerConfig defaults() {
        return new ScannerConfig();
    }

    /**
     * 创建 twin 语法的配置实例
     */
    public static ScannerConfig twin() {
        return new ScannerConfig().applyTwin();
    }

    /**
     * 从JSON文件加载配置，未出现的字段保留默认值，未知字段忽略。
     */
    public static ScannerConfig load(Path configFile) {
        ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        try {
            ScannerConfig config = mapper.readValue(Files.readString(configFile), ScannerConfig.class);
            if (config == null) {
                throw new ScannerConfigException("配置文件内容为空", "config", String.valueOf(configFile));
            }
            logger.info("已加载扫描配置: {} (separator={}, brackets={}, important={})",
                configFile, config.getSeparator(), config.isHandleBrackets(), config.isHandleImportant());
            return config;
        } catch (IOException exception) {
            throw new ScannerConfigException("无法读取配置文件: " + exception.getMessage(), "config",
                String.valueOf(configFile), exception);
        }
    }

    private static boolean containsWhitespace(String value) {
        for (int index = 0; index < value.length(); index++) {
            if (Character.isWhitespace(value.charAt(index))) {
                return true;
            }
        }
        return false;
    }
}
