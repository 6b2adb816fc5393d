package com.astmark.core.marker;

import com.astmark.core.GrammarVersion;

/**
 * token 标记配置
 */
public class MarkerConfig {
    private GrammarVersion grammarVersion = GrammarVersion.CURRENT;
    private boolean skipTrailingComma = true;

    public MarkerConfig() {
    }

    public GrammarVersion getGrammarVersion() {
        return grammarVersion;
    }

    public void setGrammarVersion(GrammarVersion grammarVersion) {
        this.grammarVersion = grammarVersion;
    }

    /**
     * 括号修复补闭括号时是否越过其前的一个逗号（如 [1, 2,]）
     */
    public boolean isSkipTrailingComma() {
        return skipTrailingComma;
    }

    public void setSkipTrailingComma(boolean skipTrailingComma) {
        this.skipTrailingComma = skipTrailingComma;
    }
}
