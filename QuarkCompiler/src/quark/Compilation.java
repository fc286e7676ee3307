package quark;

import java.io.PrintStream;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Multimaps;

/**
 * The result of running the whole pipeline over one source unit.
 *
 * <p>Each stage runs only if every earlier stage reported no errors, so a failed compilation
 * carries the products of the stages that did run plus the diagnostics of the stage that stopped
 * it.
 */
@AutoValue
public abstract class Compilation {
  private static final Logger LOG = Logger.getLogger(Compilation.class.getName());

  public abstract CompilerOptions options();

  public abstract ImmutableList<Token> tokens();

  /** Present once parsing ran, even if it reported errors. */
  public abstract Optional<Node> tree();

  public abstract Optional<Analysis> analysis();

  public abstract Optional<String> output();

  public abstract ImmutableList<CompilerException> errors();

  @Memoized
  public ImmutableListMultimap<CompilerException.Kind, CompilerException> errorsByKind() {
    return Multimaps.index(errors(), CompilerException::kind);
  }

  public boolean succeeded() {
    return errors().isEmpty() && output().isPresent();
  }

  public void printErrors(PrintStream out) {
    errors().forEach(e -> e.print(options().fileName(), out));
  }

  private static Compilation create(
      CompilerOptions options,
      ImmutableList<Token> tokens,
      Optional<Node> tree,
      Optional<Analysis> analysis,
      Optional<String> output,
      ImmutableList<CompilerException> errors) {
    return new AutoValue_Compilation(options, tokens, tree, analysis, output, errors);
  }

  public static Compilation compile(String source, CompilerOptions options) {
    Stopwatch stopwatch = Stopwatch.createStarted();
    ImmutableList<Token> tokens = new Tokenizer(source).tokenize();
    LOG.fine(String.format("%s: %d tokens", options.fileName(), tokens.size()));

    Parser parser = new Parser(tokens);
    Node tree = parser.parse();
    if (parser.hasErrors()) {
      return create(
          options, tokens, Optional.of(tree), Optional.empty(), Optional.empty(), parser.errors());
    }

    if (options.resolveImports() && options.sourceFile().isPresent()) {
      ModuleLoader loader = new ModuleLoader();
      loader.resolveImports(tree, options.sourceFile().get());
      if (loader.hasErrors()) {
        return create(
            options, tokens, Optional.of(tree), Optional.empty(), Optional.empty(), loader.errors());
      }
    }
    LOG.fine(
        String.format(
            "%s: parsed %d statements in %dms",
            options.fileName(), tree.childCount(), stopwatch.elapsed(TimeUnit.MILLISECONDS)));

    Analysis analysis = new Analyzer(options.builtins()).analyzeTree(tree);
    if (analysis.hasErrors()) {
      return create(
          options, tokens, Optional.of(tree), Optional.of(analysis), Optional.empty(),
          analysis.errors());
    }

    String output = new Compiler(analysis, options.builtins(), options.abi()).compile();
    LOG.fine(
        String.format(
            "%s: compiled in %dms", options.fileName(), stopwatch.elapsed(TimeUnit.MILLISECONDS)));
    return create(
        options, tokens, Optional.of(tree), Optional.of(analysis), Optional.of(output),
        ImmutableList.of());
  }

  /** Compiles {@code source}, throwing the first diagnostic if any stage fails. */
  public static String compileOrThrow(String source, CompilerOptions options)
      throws CompilerException {
    Compilation compilation = compile(source, options);
    if (!compilation.errors().isEmpty()) {
      throw compilation.errors().get(0);
    }
    return compilation.output().get();
  }
}
