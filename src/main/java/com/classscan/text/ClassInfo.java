package com.classscan.text;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次类名出现：基础类名、变体链、是否位于括号分组内、是否带 important 标记。
 */
public record ClassInfo(
    Token token,
    List<Token> variants,
    boolean inGroup,
    boolean important
) {
    public ClassInfo {
        variants = List.copyOf(variants);
    }

    /**
     * 将外层分组的变体链拼接到前面，并标记为分组内。
     */
    ClassInfo nestedUnder(List<Token> outerVariants) {
        List<Token> merged = new ArrayList<>(outerVariants.size() + variants.size());
        merged.addAll(outerVariants);
        merged.addAll(variants);
        return new ClassInfo(token, merged, true, important);
    }
}
