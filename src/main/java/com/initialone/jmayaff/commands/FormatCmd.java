package com.initialone.jmayaff.commands;

import com.initialone.jmayaff.config.FormatterConfig;
import com.initialone.jmayaff.lexer.SourceSyntaxException;
import com.initialone.jmayaff.rewrite.FlagFormatter;
import com.initialone.jmayaff.rewrite.FormatResult;
import com.initialone.jmayaff.util.ConsoleStyle;
import com.initialone.jmayaff.util.SourceFile;
import com.initialone.jmayaff.util.SourceFileFinder;
import com.initialone.jmayaff.util.SourceFiles;
import com.initialone.jmayaff.util.UnifiedDiff;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 把 .py 文件里 cmds 调用的短 flag 改写成长名（原地写回）。
 * 特性：
 * - 并发 (--max-concurrent / --single-thread)，一个文件一个任务
 * - 不中断：单文件失败只记录错误并继续，最后以退出码 1 体现
 * - --check / --diff 只检查不写盘，有改动时退出码 1
 *
 * 退出码：0 正常；1 有文件失败，或 --check/--diff 发现改动；2 参数错误或没有输入文件。
 */
@CommandLine.Command(
        name = "format",
        mixinStandardHelpOptions = true,
        sortOptions = false,
        description = "Rewrite short Maya command flags to their long names in Python sources"
)
public class FormatCmd implements Callable<Integer> {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(arity = "1..*", paramLabel = "SOURCE",
            description = "Python files or directories to format")
    List<String> sources;

    @CommandLine.Mixin
    TableOptions table;

    @CommandLine.Option(names = "--check", defaultValue = "false",
            description = "Don't write files back, only report through the exit code")
    boolean check;

    @CommandLine.Option(names = "--diff", defaultValue = "false",
            description = "Don't write files back, print a unified diff per changed file")
    boolean diff;

    @CommandLine.Option(names = {"-q", "--quiet"}, defaultValue = "false",
            description = "Print nothing except errors")
    boolean quiet;

    @CommandLine.Option(names = {"-v", "--verbose"}, defaultValue = "false",
            description = "Also report unchanged files")
    boolean verbose;

    @CommandLine.Option(names = "--exclude", paramLabel = "REGEX", defaultValue = SourceFileFinder.DEFAULT_EXCLUDE,
            description = "Skip files and directories whose name matches (default: ${DEFAULT-VALUE})")
    String exclude;

    @CommandLine.Option(names = "--exclude-files", paramLabel = "FILE", arity = "1..*",
            description = "Files to skip while walking directories, space separated")
    List<String> excludeFiles = new ArrayList<>();

    @CommandLine.Option(names = "--single-thread", defaultValue = "false",
            description = "Format files one at a time")
    boolean singleThread;

    @CommandLine.Option(names = "--max-concurrent", defaultValue = "0",
            description = "Max concurrent workers (default: number of CPUs)")
    int maxConcurrent;

    enum Status { CHANGED, UNCHANGED, FAILED }

    /** 单个文件的结果，在主线程里按文件顺序打印 */
    static class FileReport {
        final Path path;
        final Status status;
        final int edits;
        final String diff;
        final String error;

        FileReport(Path path, Status status, int edits, String diff, String error) {
            this.path = path;
            this.status = status;
            this.edits = edits;
            this.diff = diff;
            this.error = error;
        }
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        CommandLine.Help.Ansi ansi = spec.commandLine().getColorScheme().ansi();

        Pattern excludePattern;
        try {
            excludePattern = Pattern.compile(exclude);
        } catch (PatternSyntaxException e) {
            err.println(ConsoleStyle.red(ansi, "[format] invalid --exclude regular expression: " + e.getDescription()));
            return 2;
        }

        // 配置错误在读任何文件之前抛出
        FormatterConfig config = table.toConfig();

        List<Path> files;
        try {
            files = SourceFileFinder.find(sources, excludeFiles, excludePattern);
        } catch (IOException e) {
            err.println(ConsoleStyle.red(ansi, "[format] cannot list input files: " + e));
            return 2;
        }
        if (files.isEmpty()) {
            err.println(ConsoleStyle.red(ansi, "[format] no input files found"));
            return 2;
        }

        int threads = singleThread ? 1
                : (maxConcurrent > 0 ? maxConcurrent : Runtime.getRuntime().availableProcessors());
        threads = Math.max(1, Math.min(threads, files.size()));
        if (verbose && !quiet) {
            out.println("[format] table=" + config.flagTable().version()
                    + " modules=" + config.modules()
                    + " files=" + files.size() + " workers=" + threads);
        }

        FlagFormatter formatter = new FlagFormatter(config);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        List<Future<FileReport>> futs = new ArrayList<>();
        for (Path p : files) {
            futs.add(pool.submit(() -> processFile(p, formatter)));
        }

        int changed = 0;
        int unchanged = 0;
        int failed = 0;
        try {
            for (int i = 0; i < futs.size(); i++) {
                FileReport r;
                try {
                    r = futs.get(i).get();
                } catch (ExecutionException e) {
                    // processFile 自己捕获了异常，这里兜底
                    r = new FileReport(files.get(i), Status.FAILED, 0, null, String.valueOf(e.getCause()));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    err.println(ConsoleStyle.red(ansi, "[format] interrupted"));
                    return 1;
                }

                String name = display(r.path);
                switch (r.status) {
                    case CHANGED:
                        changed++;
                        if (diff) {
                            out.print(UnifiedDiff.colorize(r.diff, ansi));
                        } else if (!quiet) {
                            out.println((check ? "would reformat " : "reformatted ") + name
                                    + " (" + r.edits + " flag" + (r.edits == 1 ? "" : "s") + ")");
                        }
                        break;
                    case UNCHANGED:
                        unchanged++;
                        if (verbose && !quiet) out.println("[format] unchanged " + name);
                        break;
                    case FAILED:
                    default:
                        failed++;
                        err.println(ConsoleStyle.red(ansi, "error: cannot format " + name + ": " + r.error));
                        break;
                }
            }
        } finally {
            pool.shutdownNow();
        }

        if (!quiet) {
            printSummary(out, err, ansi, changed, unchanged, failed);
        }
        out.flush();
        err.flush();
        if (failed > 0) return 1;
        return (changed > 0 && (check || diff)) ? 1 : 0;
    }

    FileReport processFile(Path path, FlagFormatter formatter) {
        try {
            SourceFile file = SourceFiles.read(path);
            FormatResult result = formatter.format(file.text, path.toString());
            if (!result.isChanged()) {
                return new FileReport(path, Status.UNCHANGED, 0, null, null);
            }
            String d = null;
            if (diff) {
                d = UnifiedDiff.render(result.before, result.after, display(path), UnifiedDiff.DEFAULT_CONTEXT);
            } else if (!check) {
                SourceFiles.write(file, result.after);
            }
            return new FileReport(path, Status.CHANGED, result.editCount, d, null);
        } catch (SourceSyntaxException e) {
            return new FileReport(path, Status.FAILED, 0, null, e.getMessage());
        } catch (IOException | RuntimeException e) {
            return new FileReport(path, Status.FAILED, 0, null, e.toString());
        }
    }

    private void printSummary(PrintWriter out, PrintWriter err, CommandLine.Help.Ansi ansi,
                              int changed, int unchanged, int failed) {
        List<String> parts = new ArrayList<>();
        if (changed > 0) {
            parts.add(changed + (changed == 1 ? " file " : " files ")
                    + (check || diff ? "would be reformatted" : "reformatted"));
        }
        if (unchanged > 0) {
            parts.add(unchanged + (unchanged == 1 ? " file" : " files") + " left unchanged");
        }
        if (!parts.isEmpty()) {
            out.println(ConsoleStyle.bold(ansi, String.join(", ", parts) + "."));
        }
        if (failed > 0) {
            err.println(ConsoleStyle.red(ansi, failed + (failed == 1 ? " file" : " files") + " failed to reformat."));
        }
    }

    // 当前目录下的文件显示相对路径
    private static String display(Path p) {
        Path cwd = Paths.get("").toAbsolutePath().normalize();
        return p.startsWith(cwd) ? cwd.relativize(p).toString() : p.toString();
    }
}
