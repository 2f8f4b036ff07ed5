package com.classscan.text;

import com.classscan.config.Constants;

/**
 * 括号匹配器
 *
 * 使用深度计数向前扫描，开括号与闭括号各由一个字符集定义。
 */
public final class BracketMatcher {

    private final String openChars;
    private final String closeChars;

    public BracketMatcher(String openChars, String closeChars) {
        this.openChars = openChars;
        this.closeChars = closeChars;
    }

    public boolean isOpen(char ch) {
        return openChars.indexOf(ch) >= 0;
    }

    public boolean isClose(char ch) {
        return closeChars.indexOf(ch) >= 0;
    }

    public boolean isBracket(char ch) {
        return isOpen(ch) || isClose(ch);
    }

    /**
     * 查找与已消费开括号配对的闭括号位置。
     *
     * @param text 原文
     * @param start 开括号之后的第一个偏移
     * @param limit 扫描上界（不含）
     * @return 闭括号偏移，未配对时返回 {@link Constants#NO_MATCH}
     */
    public int findClosing(CharSequence text, int start, int limit) {
        int depth = 1;
        int end = Math.min(limit, text.length());
        for (int index = Math.max(0, start); index < end; index++) {
            char ch = text.charAt(index);
            if (isOpen(ch)) {
                depth++;
            } else if (isClose(ch)) {
                depth--;
                if (depth == 0) {
                    return index;
                }
            }
        }
        return Constants.NO_MATCH;
    }
}
