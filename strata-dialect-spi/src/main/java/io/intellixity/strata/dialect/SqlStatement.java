package io.intellixity.strata.dialect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Final SQL text and its positional parameters: the i-th placeholder in the text binds {@code params.get(i)}. */
public record SqlStatement(String sql, List<Object> params) {
  public SqlStatement {
    if (sql == null) throw new IllegalArgumentException("sql is required");
    params = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
  }
}
