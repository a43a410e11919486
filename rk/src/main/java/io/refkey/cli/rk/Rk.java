/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey.cli.rk;


import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Objects;
import java.util.concurrent.Callable;

import io.refkey.EventAttributes;
import io.refkey.InputValidationException;
import io.refkey.Verifier;
import io.refkey.history.FileHistoryLedger;
import io.refkey.history.HistoryAudit;
import io.refkey.history.HistoryEntry;
import io.refkey.history.StorageException;
import io.refkey.template.Template;
import io.refkey.template.TemplateRenderer;
import io.refkey.template.TemplateSyntaxException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.ParseResult;
import picocli.CommandLine.Spec;

/**
 * Issues and verifies referee match keys.
 */
@Command(
    name = "rk",
    mixinStandardHelpOptions = true,
    version = "rk 0.1",
    synopsisHeading = "",
    customSynopsis = {
        "",
        "Referee match key tool.",
        "",
        "A match key is a short code derived from the two participants, the date and the",
        "time of a match, and a secret. Anyone holding the secret can check a key without",
        "a lookup.",
        "",
        "Usage: @|bold rk|@ [@|fg(yellow) -c FILE|@] COMMAND",
        "       @|bold rk help|@ COMMAND",
        "       @|bold rk|@ [@|fg(yellow) -hV|@]",
        "",
    },
    subcommands = {
        HelpCommand.class,
        Generate.class,
        Verify.class,
        TemplateCmd.class,
        History.class,
        Stats.class,
        Audit.class,
        Clear.class,
    })
public class Rk implements Runnable {
  
  
  public static void main(String[] args) {
    int exitCode;
    try {
      exitCode = newCommandLine(new Rk()).execute(args);
    } catch (Exception x) {
      System.err.printf("Unhandled exception: %s%n", x.toString());
      x.printStackTrace();
      exitCode = ERR_SOFT;
    }
    System.exit(exitCode);
  }
  
  
  /**
   * Returns a command line for the given instance, with library exceptions
   * mapped to exit codes.
   */
  public static CommandLine newCommandLine(Rk rk) {
    var cl = new CommandLine(rk);
    cl.setExecutionExceptionHandler(Rk::handleExecutionException);
    return cl;
  }
  
  
  final static int ERR_SOFT = 1;
  final static int ERR_USER = 2;
  /** Token (or history entry) does not verify. */
  final static int MISMATCH = 3;
  final static int ERR_IO = 4;
  
  
  
  private static int handleExecutionException(
      Exception x, CommandLine commandLine, ParseResult parseResult) {
    
    var err = commandLine.getErr();
    int code;
    if (x instanceof InputValidationException ||
        x instanceof TemplateSyntaxException ||
        x instanceof IllegalArgumentException)
      code = ERR_USER;
    else if (x instanceof StorageException ||
        x instanceof UncheckedIOException ||
        x instanceof IOException)
      code = ERR_IO;
    else {
      x.printStackTrace(err);
      code = ERR_SOFT;
    }
    printError(err, "%s", x.getMessage());
    return code;
  }
  
  
  
  @Spec
  private CommandSpec spec;
  
  
  private File configFile;
  
  @Option(
      names = { "-c", "--config" },
      paramLabel = "FILE",
      description = {
          "Configuration (properties) file",
          "Default: built-in settings; paths relative to the working directory",
      })
  public void setConfig(File configFile) {
    this.configFile = configFile;
    if (!configFile.isFile())
      throw new ParameterException(spec.commandLine(), "not a file: " + configFile);
    else if (!configFile.canRead())
      throw new ParameterException(spec.commandLine(), "need read permission: " + configFile);
  }
  
  
  /**  Returns the configuration file, if set. */
  public File getConfigFile() {
    return configFile;
  }
  
  
  private Clock clock = Clock.systemDefaultZone();
  
  
  /** Sets the clock issued entries are stamped with. */
  public void setClock(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "null clock");
  }
  
  
  public Clock getClock() {
    return clock;
  }
  
  
  LocalDate today() {
    return LocalDate.now(clock);
  }
  
  
  private RkConfig config;
  
  
  public RkConfig getConfig() {
    if (config == null)
      config = configFile == null ? RkConfig.defaultConfig() : new RkConfig(configFile);
    return config;
  }
  
  
  private Settings settings;
  
  
  public Settings getSettings() {
    if (settings == null)
      settings = new Settings(getConfig().getSettingsFile());
    return settings;
  }
  
  
  private FileHistoryLedger ledger;
  
  
  public FileHistoryLedger getLedger() {
    if (ledger == null)
      ledger = getConfig().newLedger();
    return ledger;
  }
  
  
  
  @Override
  public void run() {
    throw new ParameterException(spec.commandLine(), "Missing required subcommand");
  }
  
  
  PrintWriter out() {
    return spec.commandLine().getOut();
  }
  
  
  /**
   * Invokes {@code out().printf(format, args)} after pre-processing
   * Jansi markup in the {@code format}. Arguments are printed as is:
   * user-entered text is never interpreted as markup.
   * 
   * @see Ansi#string(String)
   * @see Ansi#AUTO
   */
  public void printf(String format, Object... args) {
    var out = out();
    out.printf(Ansi.AUTO.string(format), args);
    out.flush();
  }
  
  
  /**
   * Prints a line of error message in red. As with
   * {@linkplain #printf(String, Object...)}, only the {@code format} may
   * contain markup.
   */
  public void printfError(String format, Object... args) {
    printError(spec.commandLine().getErr(), format, args);
  }
  
  
  private static void printError(PrintWriter err, String format, Object... args) {
    err.println(Ansi.AUTO.string("@|red " + format + "|@").formatted(args));
    err.flush();
  }
  
  
  static String nOf(long count, String noun) {
    return count + " " + (count == 1 ? noun : plural(noun));
  }
  
  
  private static String plural(String noun) {
    return noun.endsWith("y") ?
        noun.substring(0, noun.length() - 1) + "ies" : noun + "s";
  }

}


@Command(
    name = Generate.NAME,
    description = {
        "Issue a key for a match, and print the message payload to encode",
        "",
        "Values not given fall back to those last entered. The values given are saved.",
        "The key itself is not printed: it only appears inside the message payload.",
        "",
    })
class Generate implements Callable<Integer> {
  
  public final static String NAME = "generate";
  
  @ParentCommand
  private Rk rk;
  
  @Option(names = { "-a", "--a" }, paramLabel = "NAME", description = "First participant (team)")
  private String participantA;
  
  @Option(names = { "-b", "--b" }, paramLabel = "NAME", description = "Second participant (team)")
  private String participantB;
  
  @Option(names = "--date", paramLabel = "YYYY-MM-DD", description = "Match date. Default: today")
  private String date;
  
  @Option(names = "--time", paramLabel = "HH:MM", description = "Match time. Default: 18:30")
  private String time;
  
  @Option(
      names = { "-o", "--out" },
      paramLabel = "FILE",
      description = "Also write the payload (UTF-8) to this file")
  private File payloadFile;
  
  
  @Override
  public Integer call() throws IOException {
    var settings = rk.getSettings();
    
    var attributes = EventAttributes.parse(
        participantA == null ? settings.participantA() : participantA,
        participantB == null ? settings.participantB() : participantB,
        date == null ? settings.eventDate(rk.today()).toString() : date,
        time == null ? settings.eventTime().toString() : time);
    
    var issuance = rk.getConfig().newIssuer(rk.getClock()).issue(attributes, settings.template());
    
    // the key is recorded: print before anything else can fail
    rk.printf("%n@|bold %s vs %s|@%n", attributes.participantA(), attributes.participantB());
    rk.printf("%s %s%n", attributes.dateString(), attributes.timeString());
    rk.printf("%nImage file: %s%n", issuance.suggestedFilename());
    rk.printf("%nPayload:%n%s%n", issuance.qrPayload());
    
    settings.setForm(attributes);
    settings.save();
    
    if (payloadFile != null)
      Files.writeString(payloadFile.toPath(), issuance.qrPayload(), StandardCharsets.UTF_8);
    
    return 0;
  }
}


@Command(
    name = Verify.NAME,
    description = {
        "Verify a key against the match it was issued for",
        "",
        "Exit code " + Rk.MISMATCH + " if the key does not match.",
        "",
    })
class Verify implements Callable<Integer> {
  
  public final static String NAME = "verify";
  
  @ParentCommand
  private Rk rk;
  
  @Option(names = { "-a", "--a" }, paramLabel = "NAME", required = true, description = "First participant (team)")
  private String participantA;
  
  @Option(names = { "-b", "--b" }, paramLabel = "NAME", required = true, description = "Second participant (team)")
  private String participantB;
  
  @Option(names = "--date", paramLabel = "YYYY-MM-DD", required = true, description = "Match date")
  private String date;
  
  @Option(names = "--time", paramLabel = "HH:MM", required = true, description = "Match time")
  private String time;
  
  @Parameters(paramLabel = "TOKEN", description = "The key to verify")
  private String token;
  
  
  @Override
  public Integer call() {
    var verifier = new Verifier(rk.getConfig().newTokenDeriver());
    var attributes = EventAttributes.parse(participantA, participantB, date, time);
    var verification = verifier.verify(attributes, token);
    var report = verification.report(LocalDateTime.now(rk.getClock()));
    if (verification.valid()) {
      rk.printf("%n%s", report);
      return 0;
    }
    rk.printfError("%n%s", report.stripTrailing());
    return Rk.MISMATCH;
  }
}


@Command(
    name = TemplateCmd.NAME,
    description = {
        "Show, test or change the message template",
        "",
        "Variables: {participant_a} {participant_b} {event_date} {event_time} {token}",
        "Literal braces are written doubled: {{ and }}",
        "",
        "With no subcommand, same as @|bold show|@.",
        "",
    },
    subcommands = {
        TemplateCmd.Show.class,
        TemplateCmd.Test.class,
        TemplateCmd.Reset.class,
        TemplateCmd.Set.class,
    })
class TemplateCmd implements Runnable {
  
  public final static String NAME = "template";
  
  @ParentCommand
  private Rk rk;
  
  
  @Override
  public void run() {
    show();
  }
  
  
  void show() {
    var settings = rk.getSettings();
    var template = settings.template();
    rk.printf("%n%s%n", settings.hasSavedTemplate() ? "[saved template]" : "[built-in template]");
    rk.printf("%s%n", template.text());
  }
  
  
  @Command(name = "show", description = "Print the current template")
  static class Show implements Runnable {
    @ParentCommand
    private TemplateCmd parent;
    
    @Override
    public void run() {
      parent.show();
    }
  }
  
  
  @Command(name = "test", description = "Render the current template with sample values")
  static class Test implements Runnable {
    @ParentCommand
    private TemplateCmd parent;
    
    @Override
    public void run() {
      var rk = parent.rk;
      var template = rk.getSettings().template();
      String preview = template.preview();
      rk.printf("%n%s%n", preview);
      rk.printf(
          "%n%d characters (%s)%n",
          template.charCount(),
          template.size().name().toLowerCase());
    }
  }
  
  
  @Command(name = "reset", description = "Revert to the built-in template")
  static class Reset implements Runnable {
    @ParentCommand
    private TemplateCmd parent;
    
    @Override
    public void run() {
      var settings = parent.rk.getSettings();
      settings.resetTemplate();
      settings.save();
      parent.rk.printf("Template reset to built-in.%n");
    }
  }
  
  
  @Command(name = "set", description = "Replace the template with the contents of a file")
  static class Set implements Callable<Integer> {
    @ParentCommand
    private TemplateCmd parent;
    
    @Parameters(paramLabel = "FILE", description = "UTF-8 text file")
    private File file;
    
    @Override
    public Integer call() throws IOException {
      String text = Files.readString(file.toPath(), StandardCharsets.UTF_8);
      TemplateRenderer.INSTANCE.validate(text);
      var template = new Template(text);
      var settings = parent.rk.getSettings();
      settings.setTemplate(template);
      settings.save();
      parent.rk.printf(
          "Template saved (%d characters, %s).%n",
          template.charCount(),
          template.size().name().toLowerCase());
      return 0;
    }
  }
}


@Command(
    name = History.NAME,
    description = {
        "List issued keys, newest first",
        "",
        "Keys themselves are not shown.",
        "",
    })
class History implements Runnable {
  
  public final static String NAME = "history";
  
  private final static DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("dd/MM/uuuu HH:mm");
  
  @ParentCommand
  private Rk rk;
  
  @Option(
      names = { "-n", "--limit" },
      paramLabel = "COUNT",
      description = "Maximum number of entries listed. Default: all")
  private int limit = Integer.MAX_VALUE;
  
  
  @Override
  public void run() {
    var entries = new ArrayList<HistoryEntry>(rk.getLedger().load());
    if (entries.isEmpty()) {
      rk.printf("%nNo history.%n");
      return;
    }
    Collections.reverse(entries);
    int count = Math.min(Math.max(limit, 0), entries.size());
    rk.printf("%n");
    for (var e : entries.subList(0, count))
      rk.printf(
          "%s  %s vs %s  (%s %s)%n",
          STAMP.format(e.issuedAt()),
          e.participantA(),
          e.participantB(),
          e.attributes().dateString(),
          e.attributes().timeString());
    if (count < entries.size())
      rk.printf("%n%s not shown%n", Rk.nOf(entries.size() - count, "older entry"));
  }
}


@Command(name = Stats.NAME, description = "Count issued keys")
class Stats implements Runnable {
  
  public final static String NAME = "stats";
  
  @ParentCommand
  private Rk rk;
  
  @Override
  public void run() {
    var stats = rk.getLedger().stats(rk.today());
    rk.printf("%nTotal issued : %d%n", stats.total());
    rk.printf("Issued today : %d%n", stats.issuedToday());
  }
}


@Command(
    name = Audit.NAME,
    description = {
        "Check every recorded key re-derives from its match",
        "",
        "Exit code " + Rk.MISMATCH + " if any does not.",
        "",
    })
class Audit implements Callable<Integer> {
  
  public final static String NAME = "audit";
  
  @ParentCommand
  private Rk rk;
  
  @Override
  public Integer call() {
    var entries = rk.getLedger().load();
    var audit = HistoryAudit.run(entries, rk.getConfig().newTokenDeriver());
    if (audit.passed()) {
      rk.printf("%nOK. %s verified.%n", Rk.nOf(audit.checked(), "entry"));
      return 0;
    }
    rk.printfError(
        "%n%s of %d do not verify:",
        Rk.nOf(audit.mismatches().size(), "entry"),
        audit.checked());
    for (int index : audit.mismatches()) {
      var e = entries.get(index);
      rk.printfError("  [%d] %s", index + 1, e.attributes().matchLabel());
    }
    return Rk.MISMATCH;
  }
}


@Command(
    name = Clear.NAME,
    description = {
        "Delete the entire history",
        "",
        "@|italic Irreversible.|@ Requires the @|bold --yes|@ option.",
        "",
    })
class Clear implements Runnable {
  
  public final static String NAME = "clear";
  
  @ParentCommand
  private Rk rk;
  
  @Spec
  private CommandSpec spec;
  
  @Option(names = "--yes", description = "Confirm deletion")
  private boolean confirmed;
  
  @Override
  public void run() {
    if (!confirmed)
      throw new ParameterException(spec.commandLine(), "clearing the history requires --yes");
    var ledger = rk.getLedger();
    int count = ledger.size();
    ledger.clear();
    rk.printf("%s deleted.%n", Rk.nOf(count, "entry"));
  }
}
