package com.astmark.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * astmark CLI 入口点（picocli）
 */
@Command(name = "astmark", version = "astmark v0.1.0",
         mixinStandardHelpOptions = true,
         description = "为语法树节点标记首尾 token",
         subcommands = {DumpCommand.class, TokensCommand.class})
public class Main implements Runnable {

    static final String LOGGER_NAME = "com.astmark";

    // 持有强引用，级别才不会随 Logger 回收丢失
    private static final Logger ROOT_LOGGER = Logger.getLogger(LOGGER_NAME);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "输出标记过程的调试日志")
    void setVerbose(boolean verbose) {
        if (verbose) {
            enableVerboseLogging();
        }
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    static void enableVerboseLogging() {
        ROOT_LOGGER.setLevel(Level.FINE);
        for (Handler handler : ROOT_LOGGER.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                return;
            }
        }
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        ROOT_LOGGER.addHandler(handler);
    }

    static CommandLine createCommandLine() {
        return new CommandLine(new Main());
    }

    public static void main(String[] args) {
        // Windows 控制台可能不是 UTF-8，按系统原生编码输出
        String charsetName = getConsoleCharsetName();

        try {
            PrintStream out = new PrintStream(System.out, true, charsetName);
            PrintStream err = new PrintStream(System.err, true, charsetName);
            System.setOut(out);
            System.setErr(err);

            Charset consoleCharset = Charset.forName(charsetName);
            CommandLine cmd = createCommandLine();
            cmd.setOut(new PrintWriter(new OutputStreamWriter(out, consoleCharset), true));
            cmd.setErr(new PrintWriter(new OutputStreamWriter(err, consoleCharset), true));
            System.exit(cmd.execute(args));
        } catch (UnsupportedEncodingException e) {
            System.exit(createCommandLine().execute(args));
        }
    }

    /**
     * 控制台实际使用的字符编码名；native.encoding 不可用时退回默认编码
     */
    private static String getConsoleCharsetName() {
        String nativeEnc = System.getProperty("native.encoding");
        if (nativeEnc != null) {
            try {
                if (Charset.isSupported(nativeEnc)) {
                    return nativeEnc;
                }
            } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                return Charset.defaultCharset().name();
            }
        }
        return Charset.defaultCharset().name();
    }
}
