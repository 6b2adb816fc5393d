package com.astmark.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * picocli tokens 子命令：输出 token 流
 */
@Command(name = "tokens", description = "输出源码的 token 流")
public class TokensCommand implements Callable<Integer> {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Parameters(index = "0", description = "源码文件路径")
    String file;

    @Option(names = "--extra", description = "包含注释与非逻辑换行")
    boolean extra;

    @Override
    public Integer call() {
        CommandLine cmd = spec.commandLine();
        return new MarkRunner(cmd.getOut(), cmd.getErr()).tokens(file, extra);
    }
}
