package com.astmark.cli;

import com.astmark.core.AstTokens;
import com.astmark.core.ast.AstNode;
import com.astmark.core.lexer.Lexer;
import com.astmark.core.lexer.LineNumbers;
import com.astmark.core.lexer.Token;
import com.astmark.core.lexer.TokenStream;
import com.astmark.core.marker.MarkerConfig;
import com.astmark.core.marker.MarkingException;
import com.astmark.core.marker.TreeWalker;
import com.astmark.core.parser.ParseException;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * dump / tokens 执行器：读文件、标记并输出；错误写到 err 并返回非零退出码
 */
public class MarkRunner {

    static final int EXIT_OK = 0;
    static final int EXIT_INPUT_ERROR = 1;
    static final int EXIT_MARKING_ERROR = 2;

    private final PrintWriter out;
    private final PrintWriter err;

    public MarkRunner(PrintWriter out, PrintWriter err) {
        this.out = out;
        this.err = err;
    }

    /**
     * 输出每个节点的区间；kinds 为 null 时不过滤
     */
    public int dump(String filePath, MarkerConfig config, boolean json, Set<String> kinds) {
        String source = readSource(filePath);
        if (source == null) {
            return EXIT_INPUT_ERROR;
        }

        AstTokens atok;
        try {
            atok = parse(source, filePath, config);
        } catch (ParseException e) {
            err.println("语法错误: " + e.getMessage());
            return EXIT_INPUT_ERROR;
        } catch (MarkingException e) {
            err.println("标记错误: " + e.getMessage());
            return EXIT_MARKING_ERROR;
        }

        List<NodeEntry> entries = collect(atok.getTree(), kinds);
        if (json) {
            JsonArray array = new JsonArray();
            for (NodeEntry entry : entries) {
                array.add(MarkedTreeJson.nodeToJson(atok, entry.node, entry.depth));
            }
            out.println(new GsonBuilder().setPrettyPrinting().create().toJson(array));
        } else {
            LineNumbers lines = atok.getTokenStream().getLineNumbers();
            for (NodeEntry entry : entries) {
                out.println(formatNode(atok, lines, entry));
            }
        }
        out.flush();
        return EXIT_OK;
    }

    /**
     * 输出 token 流
     */
    public int tokens(String filePath, boolean includeExtra) {
        String source = readSource(filePath);
        if (source == null) {
            return EXIT_INPUT_ERROR;
        }

        ByteArrayOutputStream lexerErrors = new ByteArrayOutputStream();
        TokenStream stream;
        try (PrintStream errStream = new PrintStream(lexerErrors, true, StandardCharsets.UTF_8.name())) {
            stream = new TokenStream(source,
                    new Lexer(source, filePath, errStream).scanTokens());
        } catch (UnsupportedEncodingException e) {
            throw new IllegalStateException(e);
        }

        for (Token token : stream.getTokens()) {
            if (!includeExtra && token.getType().isExtra()) continue;
            out.println(String.format("%4d %-10s %-12s %d:%d", token.getIndex(), token.getType(),
                    quote(token.getText()), token.getLine(), token.getColumn()));
        }
        out.flush();

        String errors = new String(lexerErrors.toByteArray(), StandardCharsets.UTF_8);
        if (!errors.isEmpty()) {
            err.print(errors);
            err.flush();
            return EXIT_INPUT_ERROR;
        }
        return EXIT_OK;
    }

    private AstTokens parse(String source, String filePath, MarkerConfig config) {
        ByteArrayOutputStream lexerErrors = new ByteArrayOutputStream();
        try (PrintStream errStream = new PrintStream(lexerErrors, true, StandardCharsets.UTF_8.name())) {
            return AstTokens.parse(source, filePath, config, errStream);
        } catch (UnsupportedEncodingException e) {
            throw new IllegalStateException(e);
        } finally {
            String errors = new String(lexerErrors.toByteArray(), StandardCharsets.UTF_8);
            if (!errors.isEmpty()) {
                err.print(errors);
                err.flush();
            }
        }
    }

    private String readSource(String filePath) {
        Path path = Paths.get(filePath);
        if (!Files.exists(path)) {
            err.println("错误: 文件不存在 - " + filePath);
            err.flush();
            return null;
        }
        try {
            return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("错误: 无法读取文件 - " + filePath + " (" + e.getMessage() + ")");
            err.flush();
            return null;
        }
    }

    // ============ 输出格式 ============

    static final class NodeEntry {
        final AstNode node;
        final int depth;

        NodeEntry(AstNode node, int depth) {
            this.node = node;
            this.depth = depth;
        }
    }

    /**
     * 先序收集节点及其深度
     */
    static List<NodeEntry> collect(AstNode root, final Set<String> kinds) {
        final List<NodeEntry> entries = new ArrayList<NodeEntry>();
        TreeWalker.walk(root, new TreeWalker.Callbacks<Integer>() {
            @Override
            public TreeWalker.Relay<Integer> before(AstNode node, Integer inherited) {
                int depth = inherited != null ? inherited : 0;
                if (kinds == null || kinds.contains(node.getNodeName())) {
                    entries.add(new NodeEntry(node, depth));
                }
                return new TreeWalker.Relay<Integer>(depth + 1, depth);
            }

            @Override
            public void after(AstNode node, Integer inherited, Integer own) {
                // 只需先序
            }
        });
        return entries;
    }

    static String formatNode(AstTokens atok, LineNumbers lines, NodeEntry entry) {
        AstNode node = entry.node;
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < entry.depth; i++) {
            sb.append("  ");
        }
        sb.append(node.getNodeName());
        if (!node.isMarked()) {
            return sb.append(" <unmarked>").toString();
        }
        Token first = node.getFirstToken();
        int end = node.getLastToken().getEndOffset();
        sb.append(String.format(" [%d..%d] %d:%d-%d:%d ", first.getIndex(), node.getLastToken().getIndex(),
                first.getLine(), first.getColumn(), lines.offsetToLine(end), lines.offsetToColumn(end)));
        sb.append(quote(atok.getText(node)));
        return sb.toString();
    }

    static String quote(String text) {
        return "'" + text.replace("\\", "\\\\").replace("\n", "\\n").replace("\r", "\\r")
                .replace("\t", "\\t") + "'";
    }
}
