package quark;

import java.io.File;
import java.util.Optional;

import com.google.auto.value.AutoValue;

/** Settings for one compilation. */
@AutoValue
public abstract class CompilerOptions {

  /** The name diagnostics are reported against. */
  public abstract String fileName();

  /** The file the source was read from; file imports resolve relative to it. */
  public abstract Optional<File> sourceFile();

  public abstract Builtins builtins();

  public abstract ValueAbi abi();

  public abstract boolean resolveImports();

  public static Builder builder() {
    return new AutoValue_CompilerOptions.Builder()
        .setFileName("<input>")
        .setBuiltins(Builtins.defaults())
        .setResolveImports(true);
  }

  public static CompilerOptions defaults() {
    return builder().build();
  }

  /** Options for compiling {@code file}, reported under its name. */
  public static CompilerOptions forFile(File file) {
    return builder().setFileName(file.getName()).setSourceFile(file).build();
  }

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setFileName(String fileName);

    public abstract Builder setSourceFile(File sourceFile);

    public abstract Builder setBuiltins(Builtins builtins);

    public abstract Builder setAbi(ValueAbi abi);

    public abstract Builder setResolveImports(boolean resolveImports);

    abstract Builtins builtins();

    abstract Optional<ValueAbi> abi();

    abstract CompilerOptions autoBuild();

    /** Defaults the ABI to C++ over the configured builtins. */
    public CompilerOptions build() {
      if (!abi().isPresent()) {
        setAbi(new CppValueAbi(builtins()));
      }
      return autoBuild();
    }
  }
}
