package quark;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

/** Base for compiler stages that report diagnostics instead of throwing them. */
abstract class ErrorCollector {
  private final List<CompilerException> errors = new ArrayList<>();

  public ImmutableList<CompilerException> errors() {
    return ImmutableList.copyOf(errors);
  }

  protected void logError(CompilerException ex) {
    errors.add(ex);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }
}
