package com.classscan.text;

import com.classscan.config.Constants;

public interface ClassTokenizer {

    /**
     * 扫描 [start, end) 窗口内的类名，并解析 cursorIndex 处的选中信息。
     * 所有偏移均为相对整个 text 的绝对偏移。
     */
    ScanResult scan(String text, int start, int end, int cursorIndex);

    default ScanResult scan(String text, int cursorIndex) {
        return scan(text, 0, text == null ? 0 : text.length(), cursorIndex);
    }

    default ScanResult scan(String text) {
        return scan(text, Constants.NO_CURSOR);
    }
}
