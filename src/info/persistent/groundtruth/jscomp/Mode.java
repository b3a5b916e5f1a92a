package info.persistent.groundtruth.jscomp;

import com.google.common.collect.ImmutableList;

/**
 * What {@link GroundTruth} prints for a file.
 */
public enum Mode {
  LEX("lex", "tokens"),
  AST("ast", "parse"),
  MINIFY("minify"),
  MANGLE("mangle"),
  SCOPE("scope"),
  ALL("all");

  private final ImmutableList<String> names;

  Mode(String... names) {
    this.names = ImmutableList.copyOf(names);
  }

  public static Mode forName(String name) throws UsageException {
    for (Mode mode : values()) {
      if (mode.names.contains(name)) {
        return mode;
      }
    }
    throw new UsageException("unknown mode: " + name);
  }
}
