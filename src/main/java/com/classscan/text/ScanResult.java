package com.classscan.text;

import java.util.List;

public record ScanResult(
    List<ClassInfo> classList,
    SelectionInfo selection
) {
    public ScanResult {
        classList = List.copyOf(classList);
    }
}
