package com.astmark.cli;

import com.astmark.core.GrammarVersion;
import com.astmark.core.marker.MarkerConfig;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * picocli dump 子命令：按先序输出每个节点的 token 区间与文本
 */
@Command(name = "dump", description = "输出已标记语法树的节点区间")
public class DumpCommand implements Callable<Integer> {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Parameters(index = "0", description = "源码文件路径")
    String file;

    @Option(names = "--json", description = "以 JSON 格式输出")
    boolean json;

    @Option(names = "--legacy-grammar", description = "集合/字典推导式按旧语法定位")
    boolean legacyGrammar;

    @Option(names = "--kind", description = "只输出指定类型的节点（可重复，如 CallExpr）")
    List<String> kinds;

    @Override
    public Integer call() {
        MarkerConfig config = new MarkerConfig();
        if (legacyGrammar) {
            config.setGrammarVersion(GrammarVersion.LEGACY);
        }
        Set<String> kindFilter = kinds != null ? new LinkedHashSet<String>(kinds) : null;
        return runner().dump(file, config, json, kindFilter);
    }

    private MarkRunner runner() {
        CommandLine cmd = spec.commandLine();
        return new MarkRunner(cmd.getOut(), cmd.getErr());
    }
}
