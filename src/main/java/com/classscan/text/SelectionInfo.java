package com.classscan.text;

import java.util.List;
import java.util.Optional;

/**
 * 光标位置的解析结果。selected 为 null 表示光标不在任何词项或变体上。
 */
public record SelectionInfo(
    Token selected,
    boolean inGroup,
    boolean important,
    List<Token> variants
) {
    public SelectionInfo {
        variants = List.copyOf(variants);
    }

    public static SelectionInfo empty() {
        return new SelectionInfo(null, false, false, List.of());
    }

    public boolean hasSelection() {
        return selected != null;
    }

    public Optional<Token> selectedToken() {
        return Optional.ofNullable(selected);
    }
}
