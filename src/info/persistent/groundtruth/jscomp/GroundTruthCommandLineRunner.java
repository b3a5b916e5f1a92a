package info.persistent.groundtruth.jscomp;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

public class GroundTruthCommandLineRunner {
  public static void main(String[] args) {
    PrintStream out = new PrintStream(
        new FileOutputStream(FileDescriptor.out), false, StandardCharsets.UTF_8);
    PrintStream err = new PrintStream(
        new FileOutputStream(FileDescriptor.err), true, StandardCharsets.UTF_8);
    int exitCode = new GroundTruth(out, err).run(args);
    out.flush();
    err.flush();
    System.exit(exitCode);
  }
}
