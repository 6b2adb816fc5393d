package com.astmark.core.ast.expr;

import com.astmark.core.ast.AstNode;
import com.astmark.core.ast.AstVisitor;
import com.astmark.core.ast.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * 集合字面量（如 [1, 2, 3], {1, 2}, {a: 1, b: 2}），位置指向左括号
 */
public class CollectionLiteral extends Expression {
    private final CollectionKind kind;
    private final List<Expression> elements;
    private final List<MapEntry> mapEntries;  // 仅 MAP

    public CollectionLiteral(SourceLocation location, CollectionKind kind,
                             List<Expression> elements, List<MapEntry> mapEntries) {
        super(location);
        this.kind = kind;
        this.elements = elements;
        this.mapEntries = mapEntries;
    }

    public CollectionKind getKind() {
        return kind;
    }

    public List<Expression> getElements() {
        return elements;
    }

    public List<MapEntry> getMapEntries() {
        return mapEntries;
    }

    @Override
    public List<AstNode> children() {
        if (kind != CollectionKind.MAP) {
            return childList(elements);
        }
        // 键值交错，保持源码顺序
        List<AstNode> result = new ArrayList<AstNode>(mapEntries.size() * 2);
        for (MapEntry entry : mapEntries) {
            result.add(entry.getKey());
            result.add(entry.getValue());
        }
        return result;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCollectionLiteral(this, context);
    }

    /**
     * 集合类型
     */
    public enum CollectionKind {
        LIST,
        SET,
        MAP
    }

    /**
     * Map 条目
     */
    public static final class MapEntry {
        private final Expression key;
        private final Expression value;

        public MapEntry(Expression key, Expression value) {
            this.key = key;
            this.value = value;
        }

        public Expression getKey() {
            return key;
        }

        public Expression getValue() {
            return value;
        }
    }
}
