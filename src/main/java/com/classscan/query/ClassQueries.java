package com.classscan.query;

import com.classscan.config.Constants;
import com.classscan.config.ScannerConfig;
import com.classscan.text.ClassInfo;
import com.classscan.text.ClassTokenScanner;
import com.classscan.text.ClassTokenizer;
import com.classscan.text.ScanResult;
import com.classscan.text.SelectionInfo;
import com.classscan.text.Token;

import java.util.List;
import java.util.Optional;

/**
 * 面向编辑器功能的查询入口
 *
 * 基于同一份基础配置派生三种扫描器：全量枚举（诊断、装饰）、悬停、补全。
 */
public class ClassQueries {

    private final ClassTokenizer fullScanner;
    private final ClassTokenizer hoverScanner;
    private final ClassTokenizer completionScanner;

    /**
     * 使用默认配置构造查询入口。
     */
    public ClassQueries() {
        this(ScannerConfig.defaults());
    }

    /**
     * 复制基础配置并按用途覆盖 hoverMode 与 greedy，基础配置本身不被修改。
     */
    public ClassQueries(ScannerConfig baseConfig) {
        this.fullScanner = new ClassTokenScanner(withMode(baseConfig, baseConfig.isHoverMode(), true));
        this.hoverScanner = new ClassTokenScanner(withMode(baseConfig, true, false));
        this.completionScanner = new ClassTokenScanner(withMode(baseConfig, false, false));
    }

    /**
     * 枚举文本中的全部类名。
     */
    public List<ClassInfo> findAll(String text) {
        return fullScanner.scan(text, Constants.NO_CURSOR).classList();
    }

    /**
     * 枚举 [start, end) 区间内的全部类名，偏移仍相对整个文本。
     */
    public List<ClassInfo> findAll(String text, int start, int end) {
        return fullScanner.scan(text, start, end, Constants.NO_CURSOR).classList();
    }

    /**
     * 悬停语义：光标必须严格落在词项内部。
     */
    public SelectionInfo hoverAt(String text, int offset) {
        return hoverScanner.scan(text, offset).selection();
    }

    /**
     * 补全语义：光标紧贴词尾也视为在词内，返回当前变体链与正在输入的前缀。
     */
    public SelectionInfo completionAt(String text, int offset) {
        return completionScanner.scan(text, offset).selection();
    }

    /**
     * 返回悬停位置所属的类名条目；光标落在分组共享变体上时返回该分组的第一个条目。
     */
    public Optional<ClassInfo> classAt(String text, int offset) {
        ScanResult result = hoverScanner.scan(text, offset);
        Token selected = result.selection().selected();
        if (selected == null) {
            return Optional.empty();
        }
        for (ClassInfo classInfo : result.classList()) {
            if (classInfo.token().equals(selected) || classInfo.variants().contains(selected)) {
                return Optional.of(classInfo);
            }
        }
        return Optional.empty();
    }

    private static ScannerConfig withMode(ScannerConfig baseConfig, boolean hoverMode, boolean greedy) {
        ScannerConfig config = baseConfig.copy();
        config.setHoverMode(hoverMode);
        config.setGreedy(greedy);
        return config;
    }
}
