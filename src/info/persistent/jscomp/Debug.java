package info.persistent.jscomp;

import com.google.javascript.jscomp.CodePrinter;
import com.google.javascript.jscomp.CompilerOptions;
import com.google.javascript.rhino.Node;

public class Debug {
  /**
   * Prints {@code root} in compact form. No license tracker is installed, so
   * no comments of any kind survive.
   */
  public static String toCompactSource(
      Node root, CompilerOptions options, boolean tagAsStrict) {
    return new CodePrinter.Builder(root)
        .setCompilerOptions(options)
        .setPrettyPrint(false)
        .setLineBreak(false)
        .setOutputTypes(false)
        .setTagAsStrict(tagAsStrict)
        .build();
  }
}
