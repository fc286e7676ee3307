package quark;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.Graphs;
import com.google.common.graph.ImmutableGraph;
import com.google.common.graph.MutableGraph;
import com.google.common.io.Files;

/**
 * Resolves {@code use './path'} imports by parsing the referenced {@code .qrk} files and splicing
 * their top-level statements into the importing tree, followed by a synthetic {@code use} of the
 * imported file's module.
 *
 * <p>Paths are relative to the importing file. Each file is loaded at most once per loader.
 */
public class ModuleLoader extends ErrorCollector {
  private static final Logger LOG = Logger.getLogger(ModuleLoader.class.getName());

  static final String EXTENSION = ".qrk";

  // Edges run from an importing file to each file it imports.
  private final MutableGraph<File> imports = GraphBuilder.directed().allowsSelfLoops(true).build();

  /** Resolves all file imports in {@code root}, which was parsed from {@code file}. */
  public void resolveImports(Node root, File file) {
    File absolute = normalize(file);
    imports.addNode(absolute);
    resolveIn(root, absolute);
  }

  /** Every file seen so far, with an edge from each importer to the files it imports. */
  public ImmutableGraph<File> importGraph() {
    return ImmutableGraph.copyOf(imports);
  }

  private static File normalize(File file) {
    return file.getAbsoluteFile().toPath().normalize().toFile();
  }

  private void error(Node at, String msg) {
    logError(CompilerException.at(CompilerException.Kind.IMPORT, at, msg));
  }

  // Shortest import path from 'from' to 'to', both included.
  private List<File> importPath(File from, File to) {
    Map<File, File> reachedFrom = new HashMap<>();
    Deque<File> queue = new ArrayDeque<>();
    queue.add(from);
    while (!queue.isEmpty()) {
      File f = queue.remove();
      if (f.equals(to)) {
        break;
      }
      for (File next : imports.successors(f)) {
        if (!next.equals(from) && reachedFrom.putIfAbsent(next, f) == null) {
          queue.add(next);
        }
      }
    }
    List<File> path = new ArrayList<>();
    for (File f = to; !f.equals(from); f = reachedFrom.get(f)) {
      path.add(f);
    }
    path.add(from);
    return Lists.reverse(path);
  }

  private String chain(File importer, File target) {
    List<String> names = new ArrayList<>();
    importPath(target, importer).forEach(f -> names.add(f.getName()));
    names.add(target.getName());
    return String.join(" -> ", names);
  }

  private void resolveIn(Node root, File file) {
    List<Node> children = new ArrayList<>();
    for (Node child : root.children()) {
      if (child.is(NodeKind.USE) && child.child(0).is(NodeKind.LITERAL)) {
        children.addAll(load(child, file));
      } else {
        children.add(child);
      }
    }
    root.replaceChildren(children);
  }

  // The nodes replacing one file import; empty when the import fails or was already loaded.
  private ImmutableList<Node> load(Node use, File importer) {
    String path = use.child(0).literal();
    if (!path.startsWith("./") && !path.startsWith("../")) {
      error(use, String.format(
          "cannot import '%s': only relative paths such as './module' are supported", path));
      return ImmutableList.of();
    }

    File target = normalize(new File(importer.getParentFile(), path + EXTENSION));
    if (imports.nodes().contains(target)) {
      imports.putEdge(importer, target);
      // A file still being resolved reaches its importer; a finished one never does.
      if (Graphs.reachableNodes(imports, target).contains(importer)) {
        error(use, "circular import detected: " + chain(importer, target));
      }
      return ImmutableList.of();
    }
    if (!target.isFile()) {
      error(use, String.format(
          "cannot find module '%s': file '%s' does not exist", path, target.getPath()));
      return ImmutableList.of();
    }

    String source;
    try {
      source = Files.asCharSource(target, StandardCharsets.UTF_8).read();
    } catch (IOException ex) {
      error(use, String.format("cannot read '%s': %s", target.getPath(), ex.getMessage()));
      return ImmutableList.of();
    }

    Parser parser = new Parser(new Tokenizer(source).tokenize());
    Node imported = parser.parse();
    if (parser.hasErrors()) {
      parser.errors().forEach(e -> error(use, String.format("in '%s': %s", path, e.describe())));
      return ImmutableList.of();
    }

    imports.putEdge(importer, target);
    resolveIn(imported, target);

    List<Node> modules =
        imported.children().stream()
            .filter(n -> n.is(NodeKind.MODULE))
            .collect(Collectors.toList());
    if (modules.isEmpty()) {
      error(use, String.format("imported file '%s' does not define a module", path));
      return ImmutableList.of();
    }
    // Transitive imports are spliced before the file's own module, so the last one is ours.
    String moduleName = modules.get(modules.size() - 1).child(0).literal();
    LOG.fine(String.format("loaded module '%s' from %s", moduleName, target));

    Token useToken = use.token().get();
    Node synthetic =
        new Node(
            NodeKind.USE,
            useToken,
            new Node(
                NodeKind.NAME,
                Token.create(TokenKind.ID, moduleName, useToken.line(), useToken.column())));
    return ImmutableList.<Node>builder().addAll(imported.children()).add(synthetic).build();
  }
}
