package blockgen.codegen;

import blockgen.util.CText;

/**
 * Accumulates C text with brace-aware indentation.
 */
public class CCodeBuilder {
  private final StringBuilder text = new StringBuilder();
  private int nrTabs = 0;

  public CCodeBuilder line(String line) {
    text.append(CText.tab.repeat(nrTabs)).append(line).append('\n');
    return this;
  }

  public CCodeBuilder blank() {
    text.append('\n');
    return this;
  }

  /** Appends text that already carries its own line breaks and indentation. */
  public CCodeBuilder raw(String block) {
    text.append(block);
    if (!block.endsWith("\n"))
      text.append('\n');
    return this;
  }

  public CCodeBuilder comment(String comment) { return line(CText.comment(comment)); }

  public CCodeBuilder open(String header) {
    line(header.isEmpty() ? "{" : header + " {");
    nrTabs++;
    return this;
  }

  public CCodeBuilder close() { return close(""); }

  /** Closes a brace block, e.g. close(" my_struct_t;") for a typedef. */
  public CCodeBuilder close(String trailer) {
    if (nrTabs == 0)
      throw new IllegalStateException("Unbalanced closing brace");
    nrTabs--;
    return line("}" + trailer);
  }

  /** Function body opening with the brace on its own line. */
  public CCodeBuilder function(String signature) {
    line(signature);
    line("{");
    nrTabs++;
    return this;
  }

  public boolean isEmpty() { return text.length() == 0; }

  @Override
  public String toString() {
    return text.toString();
  }
}
