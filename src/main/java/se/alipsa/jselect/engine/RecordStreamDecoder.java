package se.alipsa.jselect.engine;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jselect.DecodeException;
import se.alipsa.jselect.RecordArityMismatchException;

/**
 * Splits a newline delimited response stream into token arrays, one per line.
 *
 * <p>
 * Tokens are separated by a single delimiter character. Quoted fields are not
 * recognised: a delimiter inside a quoted value splits the value, and quote
 * characters are kept as part of the token. Records end at {@code \n} only; a
 * {@code \r} directly before the {@code \n} is dropped, any other {@code \r}
 * is part of the value. Lines must be valid UTF-8. A line with a token count
 * other than the expected one aborts the stream with a
 * {@link RecordArityMismatchException}, invalid UTF-8 with a
 * {@link DecodeException}.
 *
 * <p>
 * The stream is closed when it is exhausted, when decoding fails and when
 * {@link #close()} is called. A decoder is single-pass and must be used by one
 * thread at a time.
 */
public final class RecordStreamDecoder implements Closeable {

  private static final Logger log = LoggerFactory.getLogger(RecordStreamDecoder.class);

  private final InputStream in;
  private final CharsetDecoder utf8 = StandardCharsets.UTF_8.newDecoder()
      .onMalformedInput(CodingErrorAction.REPORT)
      .onUnmappableCharacter(CodingErrorAction.REPORT);
  private final ByteArrayOutputStream lineBytes = new ByteArrayOutputStream(256);
  private final char delimiter;
  private final int expectedTokens;
  private long lineNumber;
  private boolean closed;
  private RuntimeException failure;

  /**
   * Create a decoder for a UTF-8 encoded stream.
   *
   * @param in
   *          the response stream; owned by the decoder from now on
   * @param delimiter
   *          the field delimiter
   * @param expectedTokens
   *          number of tokens every line must have
   */
  public RecordStreamDecoder(InputStream in, char delimiter, int expectedTokens) {
    Objects.requireNonNull(in, "in");
    if (delimiter == '\n' || delimiter == '\r') {
      throw new IllegalArgumentException("Line terminators cannot be used as field delimiter");
    }
    if (expectedTokens < 1) {
      throw new IllegalArgumentException("expectedTokens must be positive: " + expectedTokens);
    }
    this.in = new BufferedInputStream(in);
    this.delimiter = delimiter;
    this.expectedTokens = expectedTokens;
  }

  /**
   * Read and split the next line.
   *
   * @return the tokens of the next line, or {@code null} when the stream is
   *         exhausted or the decoder was closed
   * @throws IOException
   *           if reading fails; the stream is closed
   * @throws RecordArityMismatchException
   *           if the line has the wrong number of tokens; the stream is closed
   * @throws DecodeException
   *           if the line is not valid UTF-8; the stream is closed
   * @throws IllegalStateException
   *           if a previous call failed
   */
  public String[] next() throws IOException {
    if (failure != null) {
      throw new IllegalStateException("Stream was aborted after line " + lineNumber, failure);
    }
    if (closed) {
      return null;
    }
    String line;
    try {
      line = readLine();
    } catch (CharacterCodingException e) {
      DecodeException invalid = new DecodeException("Record at line " + (lineNumber + 1) + " is not valid UTF-8", e);
      abort(invalid);
      throw invalid;
    } catch (IOException e) {
      closeQuietlyAfter(e);
      throw e;
    }
    if (line == null) {
      close();
      return null;
    }
    lineNumber++;
    String[] tokens = split(line, delimiter);
    if (tokens.length != expectedTokens) {
      RecordArityMismatchException e = new RecordArityMismatchException(lineNumber, expectedTokens, tokens.length);
      abort(e);
      throw e;
    }
    return tokens;
  }

  /**
   * Read the bytes up to the next {@code \n} and decode them.
   *
   * @return the line without its terminator, or {@code null} at end of stream
   */
  private String readLine() throws IOException {
    int b = in.read();
    if (b < 0) {
      return null;
    }
    lineBytes.reset();
    while (b >= 0 && b != '\n') {
      lineBytes.write(b);
      b = in.read();
    }
    byte[] bytes = lineBytes.toByteArray();
    int length = bytes.length;
    if (b == '\n' && length > 0 && bytes[length - 1] == '\r') {
      length--;
    }
    return utf8.decode(ByteBuffer.wrap(bytes, 0, length)).toString();
  }

  /**
   * Number of lines read so far.
   *
   * @return the 1-based number of the last line returned
   */
  public long lineNumber() {
    return lineNumber;
  }

  /**
   * Mark the stream as failed and release it. Subsequent reads throw.
   *
   * @param cause
   *          the failure that aborts the stream
   */
  void abort(RuntimeException cause) {
    failure = cause;
    closeQuietlyAfter(cause);
  }

  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    log.debug("Closing record stream after {} line(s)", lineNumber);
    in.close();
  }

  private void closeQuietlyAfter(Exception primary) {
    try {
      close();
    } catch (IOException e) {
      primary.addSuppressed(e);
    }
  }

  /**
   * Split on every occurrence of {@code delimiter}, keeping empty tokens.
   *
   * @param line
   *          the line without its terminator
   * @param delimiter
   *          the separator
   * @return the tokens; never empty, a blank line yields one empty token
   */
  static String[] split(String line, char delimiter) {
    List<String> tokens = new ArrayList<>();
    int start = 0;
    int idx = line.indexOf(delimiter);
    while (idx >= 0) {
      tokens.add(line.substring(start, idx));
      start = idx + 1;
      idx = line.indexOf(delimiter, start);
    }
    tokens.add(line.substring(start));
    return tokens.toArray(new String[0]);
  }
}
