package com.gentoro.timeline.ingest;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.gentoro.timeline.exception.IoException;
import com.gentoro.timeline.format.LabelFormatter;
import com.gentoro.timeline.logging.LoggingService;
import com.gentoro.timeline.model.TaskRecord;
import com.gentoro.timeline.utility.JacksonUtility;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

/**
 * Reads a trace CSV into {@link TaskRecord}s.
 *
 * <p>Columns: {@code start, end, lane, name [, overhead [, color [, arg ...]]]}. A record ends
 * at the first line break outside a quoted field, so quoted values may span several lines; a
 * record is numbered after its first line. Records that cannot be turned into a task are skipped
 * and reported as {@link ParseDiagnostic}s; parsing always continues with the next record.
 *
 * <p>Times and overheads are plain decimal numbers with an optional exponent ({@code 12},
 * {@code -0.5}, {@code 1.5e3}). Literal forms such as {@code 10f} or {@code 0x1p3} are rejected.
 */
public class TraceCsvParser {
  private static final Logger log = LoggingService.getLogger(TraceCsvParser.class);

  static final int MIN_COLUMNS = 4;
  private static final int COL_START = 0;
  private static final int COL_END = 1;
  private static final int COL_LANE = 2;
  private static final int COL_NAME = 3;
  private static final int COL_OVERHEAD = 4;
  private static final int COL_COLOR = 5;
  private static final int COL_FIRST_ARG = 6;

  private static final Pattern DECIMAL =
      Pattern.compile("[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?");

  private final LabelFormatter formatter;
  private final ObjectReader rowReader;

  public TraceCsvParser(LabelFormatter formatter) {
    this.formatter = formatter == null ? LabelFormatter.verbatim() : formatter;
    this.rowReader = JacksonUtility.getCsvMapper().readerFor(String[].class);
  }

  public ParseResult parse(Path file) {
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      return parse(reader);
    } catch (IOException e) {
      throw new IoException("Failed to read trace input", e).withContext("input", file);
    }
  }

  public ParseResult parse(Reader source) throws IOException {
    BufferedReader reader = source instanceof BufferedReader b ? b : new BufferedReader(source);
    List<TaskRecord> tasks = new ArrayList<>();
    List<ParseDiagnostic> diagnostics = new ArrayList<>();

    String line;
    int lineIndex = 0;
    while ((line = reader.readLine()) != null) {
      int lineNumber = ++lineIndex;
      if (lineNumber == 1 && !line.isEmpty() && line.charAt(0) == '\uFEFF') {
        line = line.substring(1);
      }
      StringBuilder text = new StringBuilder(line);
      while (endsInsideQuotes(text) && (line = reader.readLine()) != null) {
        lineIndex++;
        text.append('\n').append(line);
      }
      String record = text.toString();
      if (record.isBlank()) {
        continue;
      }
      try {
        String[] columns = split(record);
        if (Arrays.stream(columns).allMatch(StringUtils::isBlank)) {
          continue;
        }
        tasks.add(toRecord(columns, lineNumber));
      } catch (RecordException e) {
        ParseDiagnostic diagnostic = new ParseDiagnostic(lineNumber, e.getMessage(), record);
        diagnostics.add(diagnostic);
        log.warn("Skipping {}", diagnostic);
      }
    }

    log.debug("Parsed {} task(s), skipped {} line(s)", tasks.size(), diagnostics.size());
    return new ParseResult(tasks, diagnostics);
  }

  /**
   * Whether {@code text} stops inside a quoted field. A quote opens a field only at its start
   * (after optional blanks); {@code ""} inside a quoted field is an escaped quote.
   */
  static boolean endsInsideQuotes(CharSequence text) {
    boolean quoted = false;
    boolean fieldStart = true;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (quoted) {
        if (c == '"') {
          if (i + 1 < text.length() && text.charAt(i + 1) == '"') {
            i++;
          } else {
            quoted = false;
          }
        }
      } else if (c == ',') {
        fieldStart = true;
      } else if (c == '"' && fieldStart) {
        quoted = true;
        fieldStart = false;
      } else if (!Character.isWhitespace(c)) {
        fieldStart = false;
      }
    }
    return quoted;
  }

  private String[] split(String record) {
    try (MappingIterator<String[]> it = rowReader.readValues(record)) {
      return it.hasNextValue() ? it.nextValue() : new String[0];
    } catch (IOException | RuntimeException e) {
      throw new RecordException("malformed CSV (" + e.getMessage() + ")");
    }
  }

  private TaskRecord toRecord(String[] columns, int lineNumber) {
    if (columns.length < MIN_COLUMNS) {
      throw new RecordException(
          "expected at least " + MIN_COLUMNS + " columns, found " + columns.length);
    }
    double start = timestamp(columns[COL_START], "start");
    double end = timestamp(columns[COL_END], "end");
    String lane = columns[COL_LANE].trim();
    String name = columns[COL_NAME].trim();

    Double overhead =
        columns.length > COL_OVERHEAD ? overhead(columns[COL_OVERHEAD], lineNumber) : null;
    Long color = columns.length > COL_COLOR ? ColorToken.parse(columns[COL_COLOR]) : null;
    List<String> args = arguments(columns);

    return new TaskRecord(
        start,
        end,
        lane,
        name,
        formatter.format(name, args),
        args,
        overhead,
        color,
        lineNumber - 1,
        lineNumber);
  }

  private static double timestamp(String raw, String field) {
    String value = raw.trim();
    if (!DECIMAL.matcher(value).matches()) {
      throw new RecordException("bad " + field + " time '" + value + "'");
    }
    double parsed = Double.parseDouble(value);
    if (!Double.isFinite(parsed)) {
      throw new RecordException("bad " + field + " time '" + value + "'");
    }
    return parsed;
  }

  private static Double overhead(String raw, int lineNumber) {
    String value = raw.trim();
    if (value.isEmpty()) {
      return null;
    }
    if (!DECIMAL.matcher(value).matches()) {
      log.debug("line {}: ignoring unparseable overhead '{}'", lineNumber, value);
      return null;
    }
    double parsed = Double.parseDouble(value);
    if (Double.isFinite(parsed) && parsed >= 0) {
      return parsed;
    }
    log.debug("line {}: ignoring negative or non-finite overhead '{}'", lineNumber, value);
    return null;
  }

  /**
   * Columns after the color are arguments. A single argument written as {@code [a, b, c]} is
   * expanded into its items.
   */
  static List<String> arguments(String[] columns) {
    if (columns.length <= COL_FIRST_ARG) {
      return List.of();
    }
    List<String> args = new ArrayList<>();
    for (int i = COL_FIRST_ARG; i < columns.length; i++) {
      args.add(columns[i].trim());
    }
    if (args.size() == 1) {
      String only = args.get(0);
      if (only.length() >= 2 && only.startsWith("[") && only.endsWith("]")) {
        String inner = only.substring(1, only.length() - 1).trim();
        if (inner.isEmpty()) {
          return List.of();
        }
        List<String> items = new ArrayList<>();
        for (String item : inner.split(",")) {
          items.add(StringUtils.strip(item.trim(), "\"'"));
        }
        return items;
      }
    }
    // trailing empty columns come from trailing commas
    while (!args.isEmpty() && args.get(args.size() - 1).isEmpty()) {
      args.remove(args.size() - 1);
    }
    return args;
  }

  /** Signals a line that cannot become a record; the message becomes the diagnostic reason. */
  static final class RecordException extends RuntimeException {
    RecordException(String message) {
      super(message);
    }
  }
}
