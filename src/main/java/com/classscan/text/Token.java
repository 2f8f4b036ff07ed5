package com.classscan.text;

/**
 * 一个词法单元在原文中的跨度，end 为开区间。
 */
public record Token(
    int start,
    int end,
    String text
) {
    public int length() {
        return end - start;
    }

    /**
     * 判断偏移是否落在 [start, end) 内。
     */
    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }
}
