package info.persistent.groundtruth.jscomp;

/**
 * Thrown for a command line that does not name a mode and a file.
 */
public class UsageException extends Exception {
  public UsageException() {
    super();
  }

  public UsageException(String message) {
    super(message);
  }
}
