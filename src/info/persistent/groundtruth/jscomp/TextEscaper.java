package info.persistent.groundtruth.jscomp;

/**
 * Turns arbitrary source slices into single-line printable text.
 */
public class TextEscaper {
  private TextEscaper() {}

  public static String escape(String text) {
    StringBuilder out = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); ) {
      int codePoint = text.codePointAt(i);
      i += Character.charCount(codePoint);
      switch (codePoint) {
        case '\n':
          out.append("\\n");
          break;
        case '\r':
          out.append("\\r");
          break;
        case '\t':
          out.append("\\t");
          break;
        case '\0':
          out.append("\\0");
          break;
        case '\\':
          out.append("\\\\");
          break;
        default:
          if (Character.isISOControl(codePoint)) {
            out.append(String.format("\\u{%04x}", codePoint));
          } else {
            out.appendCodePoint(codePoint);
          }
      }
    }
    return out.toString();
  }
}
