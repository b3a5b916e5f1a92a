package info.persistent.groundtruth.jscomp;

import com.google.javascript.jscomp.CheckLevel;
import com.google.javascript.jscomp.JSError;
import com.google.javascript.jscomp.WarningsGuard;

/**
 * Silences every diagnostic except parse errors, so that rendering only
 * fails on input Closure could not read.
 */
public class RenderWarningsGuard extends WarningsGuard {
  @Override public CheckLevel level(JSError error) {
    if (ClosureFrontEnd.isParseError(error)) {
      return null;
    }
    return CheckLevel.OFF;
  }

  @Override protected int getPriority() {
    return Priority.MAX.getValue();
  }
}
