package io.intellixity.snowgate.dmlast;

import io.intellixity.snowgate.sql.TableRef;

/** Write statement read by the grammars. */
public interface DmlAst {
  TableRef table();
}
