package quark;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableSet;
import com.google.common.io.Files;

public class CompilerMain {
  private static final Logger LOG = Logger.getLogger(CompilerMain.class.getName());

  private static final ImmutableSet<String> COMMANDS =
      ImmutableSet.of("lex", "parse", "check", "emit");

  private static final String USAGE =
      "Usage: quarkc <lex|parse|check|emit> file.qrk [-o out.cpp] [--debug] [--verbose]";

  public static void main(String[] args) throws IOException {
    int status = run(args, System.out, System.err);
    if (status != 0) {
      System.exit(status);
    }
  }

  static int run(String[] args, PrintStream out, PrintStream err) throws IOException {
    List<String> positional = new ArrayList<>();
    String outputPath = null;
    boolean debug = false;
    for (int i = 0; i < args.length; i++) {
      switch (args[i]) {
        case "-o":
          if (++i >= args.length) {
            err.println(USAGE);
            return 1;
          }
          outputPath = args[i];
          break;
        case "--debug":
          debug = true;
          break;
        case "--verbose":
          setVerbose();
          break;
        default:
          positional.add(args[i]);
      }
    }
    if (positional.size() != 2 || !COMMANDS.contains(positional.get(0))) {
      err.println(USAGE);
      return 1;
    }

    String command = positional.get(0);
    File file = new File(positional.get(1));
    if (!file.isFile()) {
      LOG.warning("no such file: " + file);
      err.println("ERROR: cannot read " + file);
      return 1;
    }
    Compilation compilation = Compilation.compile(read(file), CompilerOptions.forFile(file));

    switch (command) {
      case "lex":
        compilation
            .tokens()
            .forEach(t -> out.println(String.format("%d:%d %s", t.line(), t.column(), t)));
        return compilation.errorsByKind().containsKey(CompilerException.Kind.LEX) ? 1 : 0;
      case "parse":
        compilation.tree().ifPresent(t -> out.print(t.toTreeString()));
        if (compilation.errorsByKind().containsKey(CompilerException.Kind.LEX)
            || compilation.errorsByKind().containsKey(CompilerException.Kind.PARSE)) {
          compilation.printErrors(err);
          return 1;
        }
        return 0;
      default:
        break;
    }

    if (debug) {
      compilation.tree().ifPresent(t -> err.print(t.toTypedTreeString()));
    }
    if (!compilation.succeeded()) {
      compilation.printErrors(err);
      err.println("Compilation failed.  See errors above.");
      return 1;
    }

    if (command.equals("check")) {
      out.println("No errors found.");
      return 0;
    }

    File target = outputPath != null ? new File(outputPath) : defaultOutput(file);
    write(compilation.output().get(), target);
    out.println("Wrote " + target);
    return 0;
  }

  private static File defaultOutput(File source) {
    String name = Files.getNameWithoutExtension(source.getName()) + ".cpp";
    return new File(source.getAbsoluteFile().getParentFile(), name);
  }

  private static void setVerbose() {
    Logger root = Logger.getLogger("");
    root.setLevel(Level.FINE);
    for (Handler handler : root.getHandlers()) {
      handler.setLevel(Level.FINE);
    }
  }

  private static String read(File file) throws IOException {
    return Files.asCharSource(file, StandardCharsets.UTF_8).read();
  }

  private static void write(String string, File file) throws IOException {
    Files.asCharSink(file, StandardCharsets.UTF_8).write(string);
  }
}
