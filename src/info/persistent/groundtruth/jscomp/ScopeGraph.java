package info.persistent.groundtruth.jscomp;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Lists;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Resolved bindings and references of one source file.
 */
public final class ScopeGraph {
  public enum BindingFlag {
    FUNCTION_SCOPED_VARIABLE("FunctionScopedVariable"),
    BLOCK_SCOPED_VARIABLE("BlockScopedVariable"),
    CONST_VARIABLE("ConstVariable"),
    FUNCTION("Function"),
    CLASS("Class"),
    PARAMETER("Parameter"),
    CATCH_VARIABLE("CatchVariable"),
    IMPORT("Import");

    private final String label;

    BindingFlag(String label) {
      this.label = label;
    }

    @Override public String toString() {
      return label;
    }
  }

  public enum ReferenceFlag {
    READ("Read"),
    WRITE("Write");

    private final String label;

    ReferenceFlag(String label) {
      this.label = label;
    }

    @Override public String toString() {
      return label;
    }
  }

  public static final class Binding {
    public final int id;
    public final String name;
    public final int scopeId;
    public final Set<BindingFlag> flags;
    private final List<Reference> references = Lists.newArrayList();

    Binding(int id, String name, int scopeId, Set<BindingFlag> flags) {
      this.id = id;
      this.name = name;
      this.scopeId = scopeId;
      this.flags = flags;
    }

    public List<Reference> getReferences() {
      return references;
    }

    void addReference(Reference reference) {
      references.add(reference);
    }
  }

  public static final class Reference {
    public final int id;
    public final String name;
    public final Span span;
    public final Set<ReferenceFlag> flags;
    // Null when unresolved.
    public final Binding binding;

    Reference(
        int id, String name, Span span, Set<ReferenceFlag> flags, Binding binding) {
      this.id = id;
      this.name = name;
      this.span = span;
      this.flags = flags;
      this.binding = binding;
    }
  }

  private final int scopeCount;
  private final ImmutableList<Binding> bindings;
  private final ImmutableListMultimap<String, Reference> unresolved;

  ScopeGraph(
      int scopeCount,
      List<Binding> bindings,
      ImmutableListMultimap<String, Reference> unresolved) {
    this.scopeCount = scopeCount;
    this.bindings = ImmutableList.copyOf(bindings);
    this.unresolved = unresolved;
  }

  public int getScopeCount() {
    return scopeCount;
  }

  /** Bindings in id order. */
  public ImmutableList<Binding> getBindings() {
    return bindings;
  }

  /** Unresolved references grouped by name, in order of first occurrence. */
  public ImmutableListMultimap<String, Reference> getUnresolved() {
    return unresolved;
  }

  static String formatFlags(Set<?> flags) {
    return Joiner.on('|').join(flags);
  }

  static Set<ReferenceFlag> referenceFlags(boolean read, boolean write) {
    Set<ReferenceFlag> flags = EnumSet.noneOf(ReferenceFlag.class);
    if (read) {
      flags.add(ReferenceFlag.READ);
    }
    if (write) {
      flags.add(ReferenceFlag.WRITE);
    }
    return flags;
  }
}
