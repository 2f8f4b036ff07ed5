package com.classscan.text;

import com.classscan.config.Constants;
import com.classscan.config.ScannerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 类名扫描器
 *
 * 从左到右扫描空白分隔的类名，识别变体前缀链、括号分组与 important 标记，
 * 并在同一趟扫描中解析光标所在的词项。括号分组通过递归扫描子窗口实现，
 * 子窗口产出的偏移始终是原文中的绝对偏移。
 *
 * 实例不可变，扫描状态全部保存在单次调用的局部变量中，可在多线程间共享。
 */
public class ClassTokenScanner implements ClassTokenizer {
    private static final Logger logger = LoggerFactory.getLogger(ClassTokenScanner.class);

    private final String separator;
    private final boolean handleBrackets;
    private final boolean handleImportant;
    private final char importantMarker;
    private final boolean hoverMode;
    private final boolean greedy;
    private final int maxNestingDepth;
    private final BracketMatcher bracketMatcher;

    /**
     * 使用默认配置创建扫描器。
     */
    public ClassTokenScanner() {
        this(ScannerConfig.defaults());
    }

    /**
     * 校验配置并保存快照。
     */
    public ClassTokenScanner(ScannerConfig config) {
        config.validate();
        this.separator = config.getSeparator();
        this.handleBrackets = config.isHandleBrackets();
        this.handleImportant = config.isHandleImportant();
        this.importantMarker = config.getImportantMarker();
        this.hoverMode = config.isHoverMode();
        this.greedy = config.isGreedy();
        this.maxNestingDepth = config.getMaxNestingDepth();
        this.bracketMatcher = new BracketMatcher(config.getOpenChars(), config.getCloseChars());
    }

    @Override
    public ScanResult scan(String text, int start, int end, int cursorIndex) {
        if (text == null || text.isEmpty()) {
            return new ScanResult(List.of(), SelectionInfo.empty());
        }
        int windowEnd = Math.max(0, Math.min(end, text.length()));
        int windowStart = Math.max(0, Math.min(start, windowEnd));
        return scanWindow(text, windowStart, windowEnd, cursorIndex, 0);
    }

    /**
     * 扫描一个窗口；depth 为当前所处的括号嵌套层数。
     */
    private ScanResult scanWindow(String text, int start, int end, int cursor, int depth) {
        List<ClassInfo> classList = new ArrayList<>();
        SelectionState state = new SelectionState();
        int position = start;

        while (true) {
            int candidateStart = skipWhitespace(text, position, end);
            if (candidateStart >= end) {
                break;
            }

            int openBracket = handleBrackets ? findGroupOpen(text, candidateStart, end) : Constants.NO_MATCH;
            if (openBracket != Constants.NO_MATCH) {
                position = scanGroup(text, candidateStart, openBracket, end, cursor, depth, classList, state);
                if (position == Constants.NO_MATCH) {
                    // 未闭合的分组吞掉窗口剩余部分
                    break;
                }
            } else {
                position = scanBareToken(text, candidateStart, end, cursor, classList, state);
            }

            if (!greedy && state.selected != null) {
                break;
            }
        }

        return new ScanResult(classList, state.toSelection());
    }

    /**
     * 处理分组头 {@code variant:variant:(...)}，返回分组之后的扫描位置；
     * 分组未闭合时返回 {@link Constants#NO_MATCH}。
     */
    private int scanGroup(String text, int headStart, int openBracket, int end, int cursor, int depth,
                          List<ClassInfo> classList, SelectionState state) {
        List<Token> groupVariants = new ArrayList<>();
        int chainEnd = collectVariants(text, headStart, openBracket, groupVariants);
        for (Token variant : groupVariants) {
            if (variant.contains(cursor)) {
                state.selected = variant;
            }
        }
        if (chainEnd != openBracket) {
            logger.debug("分组头 [{}, {}) 的变体链未以分隔符结尾", headStart, openBracket);
        }

        int contentStart = openBracket + 1;
        int closeBracket = bracketMatcher.findClosing(text, contentStart, end);
        int contentEnd = closeBracket == Constants.NO_MATCH ? end : closeBracket;
        if (closeBracket == Constants.NO_MATCH) {
            logger.debug("偏移 {} 处的括号未闭合，分组延伸至窗口末尾 {}", openBracket, end);
        }
        if (cursor >= contentStart && cursor <= contentEnd) {
            state.inGroup = true;
        }

        ScanResult nested;
        if (depth >= maxNestingDepth) {
            logger.debug("括号嵌套超过上限 {}，跳过分组 [{}, {})", maxNestingDepth, openBracket, contentEnd);
            nested = new ScanResult(List.of(), SelectionInfo.empty());
        } else {
            nested = scanWindow(text, contentStart, contentEnd, cursor, depth + 1);
        }

        for (ClassInfo nestedClass : nested.classList()) {
            classList.add(nestedClass.nestedUnder(groupVariants));
        }

        if (cursor > contentEnd) {
            state.variants = new ArrayList<>();
        } else if (cursor >= headStart) {
            state.variants = new ArrayList<>(groupVariants);
        }
        if (cursor >= headStart) {
            SelectionInfo nestedSelection = nested.selection();
            if (nestedSelection.hasSelection()) {
                state.selected = nestedSelection.selected();
            }
            if (nestedSelection.inGroup()) {
                state.inGroup = true;
            }
            state.variants.addAll(nestedSelection.variants());
        }

        return closeBracket == Constants.NO_MATCH ? Constants.NO_MATCH : closeBracket + 1;
    }

    /**
     * 处理一个普通类名（最长非空白串），返回其结束偏移。
     */
    private int scanBareToken(String text, int tokenStart, int end, int cursor,
                              List<ClassInfo> classList, SelectionState state) {
        int tokenEnd = tokenStart;
        while (tokenEnd < end && !Character.isWhitespace(text.charAt(tokenEnd))) {
            tokenEnd++;
        }

        // 悬停取开区间；编辑模式下光标紧贴词尾仍算在词内，便于输入后立即补全
        boolean active = cursor >= tokenStart && (hoverMode ? cursor < tokenEnd : cursor <= tokenEnd);

        List<Token> variants = new ArrayList<>();
        int baseStart = collectVariants(text, tokenStart, tokenEnd, variants);
        int baseEnd = tokenEnd;
        boolean important = false;
        if (handleImportant && baseEnd > baseStart && text.charAt(baseEnd - 1) == importantMarker) {
            important = true;
            baseEnd--;
        }
        Token base = new Token(baseStart, baseEnd, text.substring(baseStart, baseEnd));

        if (active) {
            state.variants = new ArrayList<>(variants);
        }
        for (Token variant : variants) {
            if (variant.contains(cursor)) {
                state.selected = variant;
            }
        }
        if (active && cursor >= baseStart) {
            state.selected = base;
            state.important = important;
        }

        classList.add(new ClassInfo(base, variants, false, important));
        return tokenEnd;
    }

    /**
     * 在 [from, limit) 内依次提取变体，返回最后一个分隔符之后的偏移。
     */
    private int collectVariants(String text, int from, int limit, List<Token> variants) {
        int position = from;
        Token variant;
        while ((variant = nextVariant(text, position, limit)) != null) {
            variants.add(variant);
            position = variant.end() + separator.length();
        }
        return position;
    }

    /**
     * 查找下一个变体：最短的非空词字符串，且其后紧跟分隔符并完整落在 limit 之内。
     */
    private Token nextVariant(String text, int from, int limit) {
        int segmentStart = from;
        while (segmentStart < limit) {
            int index = segmentStart;
            while (index < limit && isTokenChar(text.charAt(index))) {
                index++;
                if (index + separator.length() <= limit && text.startsWith(separator, index)) {
                    return new Token(segmentStart, index, text.substring(segmentStart, index));
                }
            }
            segmentStart = index + 1;
        }
        return null;
    }

    /**
     * 判断从 from 开始的候选是否为分组头，是则返回开括号偏移。
     * 分组头为零个或多个 (变体, 分隔符) 片段后紧跟开括号。
     */
    private int findGroupOpen(String text, int from, int end) {
        int index = from;
        while (index < end && isTokenChar(text.charAt(index))) {
            index++;
        }
        if (index >= end || !bracketMatcher.isOpen(text.charAt(index))) {
            return Constants.NO_MATCH;
        }
        int chainLength = index - from;
        if (chainLength == 0) {
            return index;
        }
        if (chainLength > separator.length() && text.startsWith(separator, index - separator.length())) {
            return index;
        }
        return Constants.NO_MATCH;
    }

    private boolean isTokenChar(char ch) {
        if (Character.isWhitespace(ch)) {
            return false;
        }
        return !handleBrackets || !bracketMatcher.isBracket(ch);
    }

    private static int skipWhitespace(String text, int position, int end) {
        int index = position;
        while (index < end && Character.isWhitespace(text.charAt(index))) {
            index++;
        }
        return index;
    }

    /** 单次窗口扫描内累积的选中状态 */
    private static final class SelectionState {
        private Token selected;
        private boolean inGroup;
        private boolean important;
        private List<Token> variants = new ArrayList<>();

        private SelectionInfo toSelection() {
            return new SelectionInfo(selected, inGroup, important, variants);
        }
    }
}
