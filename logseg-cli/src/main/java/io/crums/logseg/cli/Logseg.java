/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.logseg.cli;


import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.lang.System.Logger.Level;
import java.nio.charset.Charset;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.json.simple.JSONObject;

import io.crums.logseg.ByteSource;
import io.crums.logseg.EntryFilter;
import io.crums.logseg.LogEntry;
import io.crums.logseg.LogSegmenter;
import io.crums.logseg.LogsegConstants;
import io.crums.logseg.Progress;
import io.crums.logseg.SegmentException;
import io.crums.logseg.SegmentResult;
import io.crums.logseg.SegmenterSettings;
import io.crums.logseg.Severity;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Log file segmentation tool: splits a log into logical entries and
 * prints them, or their statistics.
 */
@Command(
    name = "logseg",
    mixinStandardHelpOptions = true,
    version = "logseg 0.1",
    synopsisHeading = "",
    customSynopsis = {
        "Log file segmentation tool.",
        "",
        "Groups a log's lines into logical entries. A line with a timestamp, a severity",
        "token (ERROR, WARN, INFO, ..), or an opening '{' starts a new entry, unless it's",
        "blank, indented, or looks like a stack trace frame; such lines are appended to",
        "the entry before them.",
        "",
        "@|bold Usage:|@",
        "",
        "  @|bold logseg|@ @|fg(yellow) FILE|@ [OPTIONS] COMMAND",
        "  @|bold logseg help|@ COMMAND",
        "  @|bold logseg|@ [@|fg(yellow) -hV|@]",
        "",
        },
    subcommands = {
        HelpCommand.class,
        Stats.class,
        ListCmd.class,
        Json.class,
    })
public class Logseg {


  public static void main(String[] args) {
    int exitCode = newCommandLine().execute(args);
    System.exit(exitCode);
  }


  /** Returns a new command line instance, configured. */
  static CommandLine newCommandLine() {
    return new CommandLine(new Logseg()).setCaseInsensitiveEnumValuesAllowed(true);
  }


  /** Exit code on I/O or decoding errors. (Usage errors exit with 2.) */
  final static int ERR_IO = 4;

  /** Default file size ceiling: 30 MB. */
  final static long DEFAULT_MAX_SIZE = 30L * 1024 * 1024;



  @Spec
  private CommandSpec spec;


  private File logFile;

  @Parameters(
      arity = "1",
      paramLabel = "FILE",
      description = {
          "Text-based log file",
      })
  public void setLogFile(File logFile) {
    this.logFile = logFile;
    if (!logFile.isFile())
      throw new ParameterException(spec.commandLine(), "not a file: " + logFile);
    else if (!logFile.canRead())
      throw new ParameterException(spec.commandLine(), "need read permission: " + logFile);
  }


  public File getLogFile() {
    return logFile;
  }



  @Option(
      names = "--config",
      paramLabel = "PROPS",
      description = {
          "Properties file with parse settings. Keys:",
          "  " + LogsegConstants.CHUNK_SIZE_PROPERTY,
          "  " + LogsegConstants.PROGRESS_INTERVAL_PROPERTY,
          "  " + LogsegConstants.CHARSET_PROPERTY,
          "  " + LogsegConstants.STRICT_PROPERTY,
          "Command line options override these."
      })
  private File configFile;


  private Integer chunkSize;

  @Option(
      names = "--chunk-size",
      paramLabel = "BYTES",
      description = {
          "Bytes read per chunk (default: 262144)",
      })
  public void setChunkSize(int size) {
    if (size < LogsegConstants.MIN_CHUNK_SIZE)
      throw new ParameterException(
          spec.commandLine(),
          "chunk size %d < %d".formatted(size, LogsegConstants.MIN_CHUNK_SIZE));
    this.chunkSize = size;
  }


  private long maxSize = DEFAULT_MAX_SIZE;

  @Option(
      names = "--max-size",
      paramLabel = "BYTES",
      description = {
          "Maximum file size parsed (default: 30 MB)",
          "Zero means no limit."
      })
  public void setMaxSize(long max) {
    if (max < 0)
      throw new ParameterException(spec.commandLine(), "negative max size: " + max);
    this.maxSize = max;
  }


  private Charset charset;

  @Option(
      names = "--charset",
      paramLabel = "NAME",
      description = {
          "Character set the log is encoded in (default: UTF-8)",
      })
  public void setCharset(String name) {
    try {
      this.charset = Charset.forName(name);
    } catch (IllegalArgumentException iax) {
      throw new ParameterException(spec.commandLine(), "unsupported charset: " + name);
    }
  }


  @Option(
      names = "--strict",
      description = {
          "Fail on malformed input. By default, malformed bytes",
          "are replaced with U+FFFD.",
      })
  private boolean strict;


  @Option(
      names = "--progress",
      description = "Prints parse progress to stderr")
  private boolean progress;




  /**
   * Returns the effective parse settings: the config file's, if any,
   * overridden by options set on the command line.
   */
  SegmenterSettings settings() {
    SegmenterSettings settings;
    if (configFile == null)
      settings = SegmenterSettings.DEFAULT;
    else try {
      settings = SegmenterSettings.load(configFile.toPath());
    } catch (IOException iox) {
      throw new ParameterException(
          spec.commandLine(), "failed to read config " + configFile + ": " + iox.getMessage());
    } catch (IllegalArgumentException iax) {
      throw new ParameterException(
          spec.commandLine(), "bad config " + configFile + ": " + iax.getMessage());
    }

    if (chunkSize != null)
      settings = settings.chunkSize(chunkSize);
    if (charset != null)
      settings = settings.charset(charset);
    if (strict)
      settings = settings.strict(true);
    return settings;
  }



  /**
   * Parses the log file.
   *
   * @param settings  parse settings
   * @param listener  additional listener (progress is handled here)
   *
   * @throws ParameterException if the file exceeds the max size
   */
  SegmentResult parse(SegmenterSettings settings, LogSegmenter.Listener listener)
      throws SegmentException {

    long size = logFile.length();
    if (maxSize != 0 && size > maxSize)
      throw new ParameterException(
          spec.commandLine(),
          "file too large. Maximum size is %s, got %s".formatted(
              Texts.formatBytes(maxSize), Texts.formatBytes(size)));

    LogSegmenter.Listener effective = progress ?
        new ProgressPrinter(spec.commandLine().getErr(), listener) : listener;

    try (var source = ByteSource.of(logFile.toPath())) {
      return new LogSegmenter(settings).parse(source, effective);
    } catch (SegmentException sx) {
      throw sx;
    } catch (IOException iox) {
      throw new SegmentException(
          SegmentException.Kind.SOURCE_READ,
          "failed to open or close " + logFile + ": " + iox.getMessage(),
          iox);
    }
  }



  int printError(SegmentException sx) {
    var err = spec.commandLine().getErr();
    err.println(Ansi.AUTO.string(
        "[@|fg(red),bold ERROR|@]: " + sx.kind() + " - " + sx.getMessage()));
    err.flush();
    LogsegConstants.sysLogger().log(Level.DEBUG, "parse failed", sx);
    return ERR_IO;
  }




  /** Prints progress on a single (rewritten) line. */
  private static class ProgressPrinter implements LogSegmenter.Listener {

    private final PrintWriter err;
    private final LogSegmenter.Listener delegate;

    ProgressPrinter(PrintWriter err, LogSegmenter.Listener delegate) {
      this.err = err;
      this.delegate = delegate;
    }

    @Override
    public void progress(Progress progress) {
      err.print("\rparsing.. %3d%%  %s, %s".formatted(
          progress.percent(),
          Texts.nOf(progress.lines(), "line"),
          Texts.nOf(progress.entries(), "entry", "entries")));
      err.flush();
      delegate.progress(progress);
    }

    @Override
    public void entry(LogEntry entry) {
      delegate.entry(entry);
    }

    @Override
    public void completed(SegmentResult result) {
      err.println();
      err.flush();
      delegate.completed(result);
    }

    @Override
    public void failed(SegmentException error) {
      err.println();
      err.flush();
      delegate.failed(error);
    }
  }

}



/**
 * Filter and limit options shared by the listing commands.
 */
class FilterOptions {

  @Option(
      names = { "-s", "--severity" },
      paramLabel = "LEVEL",
      description = {
          "Only entries with this severity: ${COMPLETION-CANDIDATES}",
          "WARN also matches WARNING."
      })
  Severity severity;


  @Option(
      names = { "-g", "--grep" },
      paramLabel = "TEXT",
      description = "Only entries containing this text (case-insensitive)")
  String grep;


  @Option(
      names = "--limit",
      paramLabel = "COUNT",
      description = "Maximum number of entries output")
  int limit = -1;


  EntryFilter filter() {
    return EntryFilter.ALL.severity(severity).text(grep);
  }


  List<LogEntry> apply(List<LogEntry> entries) {
    var filtered = filter().apply(entries);
    if (limit >= 0 && filtered.size() > limit)
      filtered = filtered.subList(0, limit);
    return filtered;
  }
}



@Command(
    name = Stats.NAME,
    description = {
        "Prints parse statistics and a severity histogram",
        "",
    })
class Stats implements Callable<Integer> {

  final static String NAME = "stats";

  @ParentCommand
  private Logseg logseg;

  @Spec
  private CommandSpec spec;


  @Override
  public Integer call() {

    Map<Severity, Long> histogram = new EnumMap<>(Severity.class);
    long[] unclassified = { 0 };
    long[] multiLine = { 0 };

    LogSegmenter.Listener counter = new LogSegmenter.Listener() {
      @Override
      public void entry(LogEntry entry) {
        entry.severity().ifPresentOrElse(
            sev -> histogram.merge(sev, 1L, Long::sum),
            () -> ++unclassified[0]);
        if (entry.isMultiLine())
          ++multiLine[0];
      }
    };

    SegmentResult result;
    try {
      result = logseg.parse(logseg.settings().retainEntries(false), counter);
    } catch (SegmentException sx) {
      return logseg.printError(sx);
    }

    var out = spec.commandLine().getOut();
    var stats = result.stats();
    out.println(Ansi.AUTO.string("[@|fg(green),bold STATS|@]: " + logseg.getLogFile()));
    out.println("  bytes:    " + Texts.formatBytes(stats.totalBytes()) +
        " (" + Texts.nOf(stats.bytesProcessed(), "byte") + ")");
    out.println("  lines:    " + stats.lines());
    out.println("  entries:  " + stats.entries() +
        " (" + multiLine[0] + " multi-line)");
    out.println("  time:     " + stats.durationMs() + " ms");
    out.println();
    out.println(Ansi.AUTO.string("[@|fg(blue),bold SEVERITY|@]:"));
    for (var e : histogram.entrySet())
      out.println("  %-8s %d".formatted(e.getKey(), e.getValue()));
    out.println("  %-8s %d".formatted("(none)", unclassified[0]));
    out.flush();
    return 0;
  }

}



@Command(
    name = ListCmd.NAME,
    description = {
        "Lists the log's entries",
        "Each entry is headed by its line range and severity.",
        "",
    })
class ListCmd implements Callable<Integer> {

  final static String NAME = "list";

  @ParentCommand
  private Logseg logseg;

  @Spec
  private CommandSpec spec;

  @Mixin
  private FilterOptions filterOptions;


  @Override
  public Integer call() {
    SegmentResult result;
    try {
      result = logseg.parse(logseg.settings().retainEntries(true), LogSegmenter.NOOP);
    } catch (SegmentException sx) {
      return logseg.printError(sx);
    }

    var out = spec.commandLine().getOut();
    var entries = filterOptions.apply(result.entries());
    for (var entry : entries)
      printEntry(entry, out);

    out.println();
    out.println("%d of %s shown.".formatted(
        entries.size(), Texts.nOf(result.entries().size(), "entry", "entries")));
    out.flush();
    return 0;
  }


  static void printEntry(LogEntry entry, PrintWriter out) {
    String range = entry.isMultiLine() ?
        "[%d-%d]".formatted(entry.lineStart(), entry.lineEnd()) :
          "[%d]".formatted(entry.lineStart());
    String sev = entry.severity().map(Severity::name).orElse("-");
    // log text is not passed thru Ansi (it may contain markup)
    out.println(Ansi.AUTO.string(
        "@|faint " + range + "|@ @|bold " + "%-7s".formatted(sev) + "|@ ") +
        entry.firstLine());

    String text = entry.text();
    int nl = text.indexOf('\n');
    if (nl != -1)
      out.println(text.substring(nl + 1));
  }

}



@Command(
    name = Json.NAME,
    description = {
        "Prints the log's entries and parse statistics as JSON",
        "Output is a single object: @|bold {\"entries\": [..], \"stats\": {..}}|@",
        "",
    })
class Json implements Callable<Integer> {

  final static String NAME = "json";

  @ParentCommand
  private Logseg logseg;

  @Spec
  private CommandSpec spec;

  @Mixin
  private FilterOptions filterOptions;


  @Override
  public Integer call() {
    SegmentResult result;
    try {
      result = logseg.parse(logseg.settings().retainEntries(true), LogSegmenter.NOOP);
    } catch (SegmentException sx) {
      return logseg.printError(sx);
    }

    var entries = filterOptions.apply(result.entries());
    JSONObject jObj = SegmentResult.WRITER.toJsonObject(result.withEntries(entries));

    var out = spec.commandLine().getOut();
    out.println(jObj.toJSONString());
    out.flush();
    return 0;
  }

}
