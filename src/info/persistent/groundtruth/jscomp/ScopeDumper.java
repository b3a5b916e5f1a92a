package info.persistent.groundtruth.jscomp;

import info.persistent.groundtruth.jscomp.ScopeGraph.Binding;
import info.persistent.groundtruth.jscomp.ScopeGraph.Reference;

import java.io.PrintStream;
import java.util.Collection;
import java.util.Map;

/**
 * Prints a {@link ScopeGraph}: bindings with their resolved references, then
 * unresolved references grouped by name.
 */
public class ScopeDumper {
  private final PrintStream out;

  public ScopeDumper(PrintStream out) {
    this.out = out;
  }

  public void dump(ScopeGraph graph) {
    out.println("=== SCOPE ANALYSIS ===");
    out.println("scopes: " + graph.getScopeCount());
    out.println("bindings: " + graph.getBindings().size());
    out.println();

    for (Binding binding : graph.getBindings()) {
      out.println("  " + binding.id + " \"" + binding.name + "\" scope="
          + binding.scopeId + " flags=" + ScopeGraph.formatFlags(binding.flags)
          + " refs=" + binding.getReferences().size());
      printReferences(binding.getReferences());
    }

    out.println();
    out.println("unresolved:");
    for (Map.Entry<String, Collection<Reference>> entry
        : graph.getUnresolved().asMap().entrySet()) {
      out.println("  \"" + entry.getKey() + "\" refs=" + entry.getValue().size());
      printReferences(entry.getValue());
    }
  }

  private void printReferences(Collection<Reference> references) {
    for (Reference reference : references) {
      out.println("    ref " + reference.span + " "
          + ScopeGraph.formatFlags(reference.flags));
    }
  }
}
