package org.dxworks.ommltex.model;

public class EquationResult {
    public int index; // 1-based position of the equation in its document
    public String text; // raw text of the equation's runs, for manual review
    public String latex;
    public String delimited; // latex wrapped in \( \) or \[ \]
    public boolean inline;
}
