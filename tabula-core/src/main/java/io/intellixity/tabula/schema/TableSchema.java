package io.intellixity.tabula.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/** Name plus ordered column list of a caller table. */
public record TableSchema(String name, List<ColumnSpec> columns) {
  /** Name of the reserved history table. */
  public static final String HISTORY_TABLE = "history";

  private static final Pattern IDENT = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  public TableSchema {
    Objects.requireNonNull(name, "name");
    if (!isIdentifier(name)) throw new IllegalArgumentException("Invalid table name '" + name + "'");
    columns = columns == null ? List.of() : List.copyOf(columns);
    if (columns.isEmpty()) throw new IllegalArgumentException("Table '" + name + "' has no columns");
  }

  /**
   * Parse the textual column form, e.g. {@code "Id INT, Name TEXT, Price DECIMAL(10,2)"}.
   * Each comma-separated part is {@code <name> [<declared type>]}; commas inside parentheses do not split.
   */
  public static TableSchema parse(String name, String columnSpec) {
    if (columnSpec == null || columnSpec.isBlank()) {
      throw new IllegalArgumentException("Column spec for table '" + name + "' is blank");
    }
    List<ColumnSpec> out = new ArrayList<>();
    for (String part : splitTopLevel(columnSpec)) {
      String p = part.trim();
      if (p.isEmpty()) throw new IllegalArgumentException("Empty column definition in '" + columnSpec + "'");
      int ws = firstWhitespace(p);
      String colName = ws < 0 ? p : p.substring(0, ws);
      String type = ws < 0 ? "" : p.substring(ws + 1).trim();
      out.add(new ColumnSpec(colName, type));
    }
    return new TableSchema(name, out);
  }

  /** True for the reserved history table name, compared case-insensitively. */
  public static boolean isReserved(String tableName) {
    return tableName != null && HISTORY_TABLE.equalsIgnoreCase(tableName.trim());
  }

  /** True for a plain SQL identifier: a letter or underscore, then letters, digits or underscores. */
  public static boolean isIdentifier(String s) {
    return s != null && IDENT.matcher(s).matches();
  }

  // Declared types are spliced into DDL, so anything that could end or comment out the statement is refused.
  static boolean isSafeTypeText(String s) {
    if (s == null) return false;
    if (s.contains("--") || s.contains("/*")) return false;
    int depth = 0;
    for (int i = 0; i < s.length(); i++) {
      char ch = s.charAt(i);
      switch (ch) {
        case ';', '\'', '"', '`', '[', ']' -> { return false; }
        case '(' -> depth++;
        case ')' -> {
          if (--depth < 0) return false;
        }
        default -> {
          if (Character.isISOControl(ch)) return false;
        }
      }
    }
    return depth == 0;
  }

  private static List<String> splitTopLevel(String s) {
    List<String> parts = new ArrayList<>();
    int depth = 0;
    int start = 0;
    for (int i = 0; i < s.length(); i++) {
      char ch = s.charAt(i);
      if (ch == '(') depth++;
      else if (ch == ')') depth--;
      else if (ch == ',' && depth == 0) {
        parts.add(s.substring(start, i));
        start = i + 1;
      }
    }
    parts.add(s.substring(start));
    return parts;
  }

  private static int firstWhitespace(String s) {
    for (int i = 0; i < s.length(); i++) {
      if (Character.isWhitespace(s.charAt(i))) return i;
    }
    return -1;
  }
}
