package info.persistent.groundtruth.jscomp;

import com.google.common.base.CharMatcher;
import com.google.common.io.Files;
import com.google.common.primitives.Ints;

import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * The text of one input file together with its UTF-8 encoding. Closure
 * reports positions as UTF-16 offsets; everything printed uses UTF-8 byte
 * offsets, so this class owns the translation between the two.
 */
public final class SourceText {
  public static final int NODE_SNIPPET_BYTES = 50;
  public static final int TOKEN_SNIPPET_BYTES = 80;

  private final String name;
  private final String text;
  private final byte[] bytes;
  // byteOffsets[i] is the UTF-8 offset of UTF-16 index i.
  private final int[] byteOffsets;
  // UTF-16 offset where each line starts, using the parser's line terminators.
  private final int[] lineStarts;

  private SourceText(String name, String text, byte[] bytes) {
    this.name = name;
    this.text = text;
    this.bytes = bytes;
    this.byteOffsets = computeByteOffsets(text);
    this.lineStarts = computeLineStarts(text);
  }

  /**
   * Reads {@code file}, rejecting content that is not well-formed UTF-8.
   */
  public static SourceText read(File file) throws IOException {
    byte[] bytes = Files.toByteArray(file);
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
    String text = decoder.decode(ByteBuffer.wrap(bytes)).toString();
    return new SourceText(file.getPath(), text, bytes);
  }

  public static SourceText fromCode(String name, String text) {
    return new SourceText(name, text, text.getBytes(StandardCharsets.UTF_8));
  }

  private static int[] computeByteOffsets(String text) {
    int length = text.length();
    int[] offsets = new int[length + 1];
    int offset = 0;
    for (int i = 0; i < length; i++) {
      offsets[i] = offset;
      char c = text.charAt(i);
      if (c < 0x80) {
        offset += 1;
      } else if (c < 0x800) {
        offset += 2;
      } else if (Character.isHighSurrogate(c) && i + 1 < length
          && Character.isLowSurrogate(text.charAt(i + 1))) {
        offset += 4;
        offsets[++i] = offset;
      } else if (Character.isSurrogate(c)) {
        // Unpaired surrogates are encoded as '?'.
        offset += 1;
      } else {
        offset += 3;
      }
    }
    offsets[length] = offset;
    return offsets;
  }

  private static int[] computeLineStarts(String text) {
    List<Integer> starts = new ArrayList<>();
    starts.add(0);
    int length = text.length();
    for (int i = 0; i < length; i++) {
      char c = text.charAt(i);
      switch (c) {
        case '\r':
          if (i + 1 < length && text.charAt(i + 1) == '\n') {
            i++;
          }
          starts.add(i + 1);
          break;
        case '\n':
        case '\u2028':
        case '\u2029':
          starts.add(i + 1);
          break;
        default:
          break;
      }
    }
    return Ints.toArray(starts);
  }

  public String getName() {
    return name;
  }

  public String getText() {
    return text;
  }

  public int getByteLength() {
    return bytes.length;
  }

  /** Number of lines, not counting an empty line after a final newline. */
  public int getLineCount() {
    if (text.isEmpty()) {
      return 0;
    }
    int newlines = CharMatcher.is('\n').countIn(text);
    return text.endsWith("\n") ? newlines : newlines + 1;
  }

  public Span getWholeSpan() {
    return new Span(0, bytes.length);
  }

  /** The UTF-8 offset of a UTF-16 offset, clamped to the source. */
  public int toByteOffset(int charOffset) {
    if (charOffset <= 0) {
      return 0;
    }
    if (charOffset >= text.length()) {
      return bytes.length;
    }
    return byteOffsets[charOffset];
  }

  /**
   * The UTF-16 offset of a 1-based line and 0-based column as recorded on
   * parse tree nodes, or -1 when the line is unknown.
   */
  public int toCharOffset(int lineno, int charno) {
    if (lineno < 1 || lineno > lineStarts.length || charno < 0) {
      return -1;
    }
    return lineStarts[lineno - 1] + charno;
  }

  /** Span for the UTF-16 range {@code [charStart, charEnd)}. */
  public Span span(int charStart, int charEnd) {
    int start = toByteOffset(charStart);
    return new Span(start, Math.max(start, toByteOffset(charEnd)));
  }

  /** Raw source text covered by {@code span}, clamped to the source. */
  public String slice(Span span) {
    int start = Math.min(span.start, bytes.length);
    int end = Math.min(span.end, bytes.length);
    if (end <= start) {
      return "";
    }
    return new String(bytes, start, end - start, StandardCharsets.UTF_8);
  }

  /**
   * The escaped source text of {@code span}, truncated to at most
   * {@code maxBytes} bytes without splitting a character.
   */
  public String snippet(Span span, int maxBytes) {
    int start = Math.min(span.start, bytes.length);
    int end = Math.min(span.end, bytes.length);
    if (end <= start) {
      return "";
    }
    if (end - start > maxBytes) {
      end = start + maxBytes;
      while (end > start && isContinuationByte(bytes[end])) {
        end--;
      }
    }
    return TextEscaper.escape(
        new String(bytes, start, end - start, StandardCharsets.UTF_8));
  }

  private static boolean isContinuationByte(byte b) {
    return (b & 0xC0) == 0x80;
  }
}
