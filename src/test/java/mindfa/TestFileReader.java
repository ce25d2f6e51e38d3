package mindfa;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads fixture files of pattern test cases.
 *
 * Each case is three lines: the pattern, the input in double quotes, and
 * {@code true} or {@code false}. Comment lines (starting with {@code //}) and
 * blank lines are skipped. Inputs may use {@code \\uXXXX} escapes.
 */
final class TestFileReader implements AutoCloseable {

  private static final Pattern UNICODE_ESCAPES = Pattern.compile("\\\\u([0-9a-fA-F]{4})");

  private final BufferedReader reader;

  private final String filePath;

  private int lineNumber = 0;

  TestFileReader(InputStream input, String filePath) {
    this.reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
    this.filePath = filePath;
  }

  /**
   * Open a fixture on the test classpath.
   *
   * @param resource absolute resource name
   * @throws IOException if the resource does not exist
   */
  static TestFileReader fromResource(String resource) throws IOException {
    final InputStream input = TestFileReader.class.getResourceAsStream(resource);
    if (input == null) {
      throw new IOException("Missing test resource " + resource);
    }
    return new TestFileReader(input, resource);
  }

  /**
   * Read the next line which is neither blank nor a comment.
   *
   * @return line or {@code null} at the end of the file
   */
  String readLine() throws IOException {
    while (true) {
      final String line = reader.readLine();
      lineNumber++;
      if (line == null) {
        return null;
      } else if (line.isBlank() || line.startsWith("//")) {
        continue;
      }
      return line.strip();
    }
  }

  /**
   * Read the next test case.
   *
   * @return test case or {@code null} at the end of the file
   */
  TestCase readTestCase() throws IOException {
    final String pattern = readLine();
    if (pattern == null) {
      return null;
    }
    final int startLine = lineNumber;
    final String input = readLine();
    final String expected = readLine();
    if (input == null || expected == null) {
      throw new IOException(filePath + ":" + startLine + ": truncated test case");
    }
    if (input.length() < 2 || !input.startsWith("\"") || !input.endsWith("\"")) {
      throw new IOException(filePath + ":" + lineNumber + ": input must be in double quotes");
    }
    if (!expected.equals("true") && !expected.equals("false")) {
      throw new IOException(filePath + ":" + lineNumber + ": expected 'true' or 'false'");
    }

    final String unquoted = processEscapes(input.substring(1, input.length() - 1));
    return new TestCase(pattern, unquoted, Boolean.parseBoolean(expected), filePath, startLine);
  }

  /**
   * Read every remaining test case.
   */
  List<TestCase> readAll() throws IOException {
    final var testCases = new ArrayList<TestCase>();
    TestCase testCase;
    while ((testCase = readTestCase()) != null) {
      testCases.add(testCase);
    }
    return testCases;
  }

  private static String processEscapes(String line) {
    return UNICODE_ESCAPES.matcher(line).replaceAll(result ->
      Character.toString((char) Integer.parseInt(result.group(1), 16))
    );
  }

  @Override
  public void close() throws IOException {
    reader.close();
  }
}
