package info.persistent.groundtruth.jscomp;

/**
 * Thrown when Closure cannot produce output for a source that parsed.
 */
public class RenderException extends Exception {
  public RenderException(String message) {
    super(message);
  }
}
