package quark;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.common.io.Files;

public class CompilationTest {

  @TempDir File dir;

  @Test
  public void successfulCompilationCarriesEveryProduct() {
    Compilation compilation = Compilation.compile("x = 1\nprint x\n", CompilerOptions.defaults());

    assertThat(compilation.succeeded()).isTrue();
    assertThat(compilation.tokens()).isNotEmpty();
    assertThat(compilation.tree()).isPresent();
    assertThat(compilation.analysis()).isPresent();
    assertThat(compilation.output().get()).contains("q_print(x);");
  }

  @Test
  public void parseErrorsStopBeforeAnalysis() {
    Compilation compilation = Compilation.compile("x = )\n", CompilerOptions.defaults());

    assertThat(compilation.succeeded()).isFalse();
    assertThat(compilation.tree()).isPresent();
    assertThat(compilation.analysis()).isEmpty();
    assertThat(compilation.errorsByKind().keySet()).containsExactly(CompilerException.Kind.PARSE);
  }

  @Test
  public void lexErrorsAreReportedAsLexErrors() {
    Compilation compilation = Compilation.compile("x = 'open\n", CompilerOptions.defaults());

    assertThat(compilation.errorsByKind().get(CompilerException.Kind.LEX)).hasSize(1);
    assertThat(compilation.output()).isEmpty();
  }

  @Test
  public void typeErrorsStopBeforeLowering() {
    Compilation compilation =
        Compilation.compile("a = 1 + 'x'\nb = missing\n", CompilerOptions.defaults());

    assertThat(compilation.analysis()).isPresent();
    assertThat(compilation.output()).isEmpty();
    assertThat(compilation.errorsByKind().get(CompilerException.Kind.TYPE)).hasSize(2);
  }

  @Test
  public void compileOrThrowThrowsFirstError() {
    CompilerException e =
        assertThrows(
            CompilerException.class,
            () -> Compilation.compileOrThrow("print nope\n", CompilerOptions.defaults()));

    assertThat(e.kind()).isEqualTo(CompilerException.Kind.TYPE);
    assertThat(e).hasMessageThat().isEqualTo("undefined symbol 'nope'");
  }

  @Test
  public void fileImportsResolveRelativeToSource() throws Exception {
    Files.asCharSink(new File(dir, "util.qrk"), StandardCharsets.UTF_8)
        .write("module util:\n    fn twice(x) -> x * 2\n");
    File main = new File(dir, "main.qrk");
    String source = "use './util'\nprint twice 4\n";

    Compilation compilation = Compilation.compile(source, CompilerOptions.forFile(main));

    assertThat(compilation.errors()).isEmpty();
    assertThat(compilation.output().get()).contains("quark_fn_util_twice(nullptr, qv_int(4LL))");
  }

  @Test
  public void importErrorsStopBeforeAnalysis() {
    File main = new File(dir, "main.qrk");

    Compilation compilation =
        Compilation.compile("use './absent'\n", CompilerOptions.forFile(main));

    assertThat(compilation.analysis()).isEmpty();
    assertThat(compilation.errorsByKind().keySet()).containsExactly(CompilerException.Kind.IMPORT);
  }

  @Test
  public void unresolvedImportsAreTypeErrorsWithoutSourceFile() {
    Compilation compilation = Compilation.compile("use './util'\n", CompilerOptions.defaults());

    assertThat(compilation.errorsByKind().get(CompilerException.Kind.TYPE)).hasSize(1);
  }

  @Test
  public void importResolutionCanBeDisabled() {
    CompilerOptions options =
        CompilerOptions.forFile(new File(dir, "main.qrk")).toBuilder()
            .setResolveImports(false)
            .build();

    Compilation compilation = Compilation.compile("use './absent'\n", options);

    assertThat(compilation.errorsByKind().keySet()).containsExactly(CompilerException.Kind.TYPE);
  }

  @Test
  public void printsErrorsAgainstFileName() {
    CompilerOptions options = CompilerOptions.builder().setFileName("demo.qrk").build();
    Compilation compilation = Compilation.compile("x = 1\nprint y\n", options);
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();

    compilation.printErrors(new PrintStream(bytes, true));

    assertThat(bytes.toString().trim()).isEqualTo("ERROR: demo.qrk@2:7 undefined symbol 'y'");
  }
}
