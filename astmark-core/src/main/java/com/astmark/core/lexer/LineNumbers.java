package com.astmark.core.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * 行列号与字符偏移之间的换算（行列均从 1 开始）
 */
public final class LineNumbers {
    private final int length;
    private final int[] lineOffsets;

    public LineNumbers(String text) {
        this.length = text.length();
        List<Integer> offsets = new ArrayList<>();
        offsets.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                offsets.add(i + 1);
            }
        }
        this.lineOffsets = new int[offsets.size()];
        for (int i = 0; i < lineOffsets.length; i++) {
            lineOffsets[i] = offsets.get(i);
        }
    }

    public int getLineCount() {
        return lineOffsets.length;
    }

    /**
     * 行列号转字符偏移；超出范围的行列会被截断到文本边界或行尾
     */
    public int lineToOffset(int line, int column) {
        if (line < 1) return 0;
        if (line > lineOffsets.length) return length;
        int lineStart = lineOffsets[line - 1];
        int lineEnd = line < lineOffsets.length ? lineOffsets[line] : length;
        return Math.min(lineStart + Math.max(column - 1, 0), lineEnd);
    }

    /**
     * 字符偏移所在的行号
     */
    public int offsetToLine(int offset) {
        int lo = 0;
        int hi = lineOffsets.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (lineOffsets[mid] <= offset) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return lo + 1;
    }

    /**
     * 字符偏移所在的列号
     */
    public int offsetToColumn(int offset) {
        return offset - lineOffsets[offsetToLine(offset) - 1] + 1;
    }
}
