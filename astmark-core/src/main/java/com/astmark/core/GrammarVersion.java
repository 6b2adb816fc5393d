package com.astmark.core;

/**
 * 语法版本
 *
 * <p>两个版本只在集合/字典推导式的位置上不同：当前语法把推导式定位到 '{'，
 * 旧语法与列表推导式一样定位到元素表达式。</p>
 */
public enum GrammarVersion {
    CURRENT,
    LEGACY
}
