package io.intellixity.tabula.schema;

import java.util.Objects;

/**
 * One column of a caller table: its name and the declared type text passed to the engine as-is.
 * An empty declared type is allowed (untyped column).
 */
public record ColumnSpec(String name, String declaredType) {
  public ColumnSpec {
    Objects.requireNonNull(name, "name");
    if (!TableSchema.isIdentifier(name)) {
      throw new IllegalArgumentException("Invalid column name '" + name + "'");
    }
    declaredType = declaredType == null ? "" : declaredType.trim();
    if (!TableSchema.isSafeTypeText(declaredType)) {
      throw new IllegalArgumentException("Invalid declared type '" + declaredType + "' for column '" + name + "'");
    }
  }

  public static ColumnSpec of(String name, String declaredType) {
    return new ColumnSpec(name, declaredType);
  }
}
