package com.gentoro.timeline.format;

import com.gentoro.timeline.logging.LoggingService;
import java.util.IllegalFormatException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.slf4j.Logger;

/**
 * printf-style label formatter.
 *
 * <p>Recognized placeholders are {@code %%} and {@code %[flags][width][.precision]conv} where
 * {@code conv} is one of {@code s d i u f F g G e E x X c}. Placeholders consume arguments
 * positionally.
 *
 * <ul>
 *   <li>Numeric conversions coerce the argument; integral conversions truncate decimals.
 *   <li>If coercion or formatting fails the raw argument text is inserted instead. Widths and
 *       precisions above {@value #MAX_FIELD_SIZE} count as failures.
 *   <li>A placeholder with no argument left stays verbatim; surplus arguments are ignored.
 * </ul>
 */
public class PrintfLabelFormatter implements LabelFormatter {
  private static final Logger log = LoggingService.getLogger(PrintfLabelFormatter.class);

  static final int MAX_FIELD_SIZE = 999;

  private static final Pattern PLACEHOLDER =
      Pattern.compile("%(%|([-+ #0]*)(\\d+)?(?:\\.(\\d+))?([sdiufFgGeExXc]))");

  @Override
  public String format(String template, List<String> args) {
    if (template == null || template.isEmpty()) {
      return "";
    }
    List<String> values = args == null ? List.of() : args;
    Matcher m = PLACEHOLDER.matcher(template);
    StringBuilder out = new StringBuilder(template.length() + 16);
    int next = 0;
    while (m.find()) {
      String replacement;
      if ("%".equals(m.group(1))) {
        replacement = "%";
      } else if (next >= values.size()) {
        replacement = m.group();
      } else {
        replacement = substitute(m, values.get(next++));
      }
      m.appendReplacement(out, Matcher.quoteReplacement(replacement));
    }
    m.appendTail(out);
    return out.toString();
  }

  private String substitute(Matcher m, String arg) {
    String flags = m.group(2) == null ? "" : m.group(2);
    String width = m.group(3) == null ? "" : m.group(3);
    String precision = m.group(4) == null ? "" : "." + m.group(4);
    char conv = m.group(5).charAt(0);
    String value = arg == null ? "" : arg.trim();
    if (oversized(m.group(3)) || oversized(m.group(4))) {
      log.debug(
          "Field size in '{}' exceeds {}, inserting argument as-is", m.group(), MAX_FIELD_SIZE);
      return arg == null ? "" : arg;
    }
    try {
      switch (conv) {
        case 'd':
        case 'i':
        case 'u':
          return javaFormat(flags, width, "", 'd', integral(value));
        case 'x':
        case 'X':
          return javaFormat(flags, width, "", conv, integral(value));
        case 'f':
        case 'F':
          return javaFormat(flags, width, precision, 'f', decimal(value));
        case 'e':
        case 'E':
        case 'g':
        case 'G':
          return javaFormat(flags, width, precision, conv, decimal(value));
        case 'c':
          return javaFormat(flags, width, "", 'c', character(value));
        default:
          return javaFormat(flags, width, precision, 's', arg == null ? "" : arg);
      }
    } catch (NumberFormatException | IllegalFormatException e) {
      log.debug("Cannot apply '{}' to argument '{}', inserting it as-is", m.group(), arg);
      return arg == null ? "" : arg;
    }
  }

  private static boolean oversized(String digits) {
    if (digits == null) {
      return false;
    }
    String significant = StringUtils.stripStart(digits, "0");
    return significant.length() > 3 || NumberUtils.toInt(significant) > MAX_FIELD_SIZE;
  }

  private static String javaFormat(
      String flags, String width, String precision, char conv, Object value) {
    return String.format(Locale.ROOT, "%" + flags + width + precision + conv, value);
  }

  private static long integral(String value) {
    if (NumberUtils.isCreatable(value)) {
      return NumberUtils.createNumber(value).longValue();
    }
    throw new NumberFormatException("Not a number: " + value);
  }

  private static double decimal(String value) {
    if (NumberUtils.isParsable(value)) {
      return Double.parseDouble(value);
    }
    // hex and other literal forms
    if (NumberUtils.isCreatable(value)) {
      return NumberUtils.createNumber(value).doubleValue();
    }
    throw new NumberFormatException("Not a number: " + value);
  }

  private static int character(String value) {
    if (NumberUtils.isDigits(value)) {
      return Integer.parseInt(value);
    }
    if (value.isEmpty()) {
      throw new NumberFormatException("Empty character argument");
    }
    return value.codePointAt(0);
  }
}
