package com.astmark.cli;

import com.astmark.core.AstTokens;
import com.astmark.core.ast.AstNode;
import com.astmark.core.lexer.Token;
import com.google.gson.JsonObject;

/**
 * 已标记节点的 JSON 表示
 */
final class MarkedTreeJson {

    private MarkedTreeJson() {
    }

    static JsonObject nodeToJson(AstTokens atok, AstNode node, int depth) {
        JsonObject obj = new JsonObject();
        obj.addProperty("kind", node.getNodeName());
        obj.addProperty("depth", depth);
        if (!node.isMarked()) {
            return obj;
        }
        int[] range = atok.getTextRange(node);
        obj.add("first", tokenToJson(node.getFirstToken()));
        obj.add("last", tokenToJson(node.getLastToken()));
        obj.addProperty("start", range[0]);
        obj.addProperty("end", range[1]);
        obj.addProperty("text", atok.getText(node));
        return obj;
    }

    static JsonObject tokenToJson(Token token) {
        JsonObject obj = new JsonObject();
        obj.addProperty("index", token.getIndex());
        obj.addProperty("type", token.getType().name());
        obj.addProperty("text", token.getText());
        obj.addProperty("line", token.getLine());
        obj.addProperty("column", token.getColumn());
        return obj;
    }
}
