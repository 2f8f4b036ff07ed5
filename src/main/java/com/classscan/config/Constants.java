package com.classscan.config;

/**
 * 全局常量定义
 *
 * 包含扫描器默认配置、哨兵值和资源上限
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 扫描默认值 ====================
    /** 变体分隔符 */
    public static final String DEFAULT_SEPARATOR = ":";
    /** 左括号字符集 */
    public static final String DEFAULT_OPEN_CHARS = "(";
    /** 右括号字符集 */
    public static final String DEFAULT_CLOSE_CHARS = ")";
    /** important 标记字符 */
    public static final char DEFAULT_IMPORTANT_MARKER = '!';
    /** twin 模式固定使用的分隔符 */
    public static final String TWIN_SEPARATOR = ":";

    // ==================== 哨兵值 ====================
    /** 表示未提供光标位置 */
    public static final int NO_CURSOR = -1;
    /** 表示未找到匹配的右括号 */
    public static final int NO_MATCH = -1;

    // ==================== 资源上限 ====================
    /** 括号嵌套的最大递归深度，超出部分整体跳过 */
    public static final int MAX_NESTING_DEPTH = 32;
    /** CLI 单次输入的最大字符数 */
    public static final int MAX_INPUT_LENGTH = 1_000_000;
}
