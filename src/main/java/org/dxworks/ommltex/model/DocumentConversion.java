package org.dxworks.ommltex.model;

import java.util.ArrayList;
import java.util.List;

public class DocumentConversion {
    public String kind = "document";
    public String filePath;
    public String format; // docx or xml
    public List<EquationResult> equations = new ArrayList<>();

    public int getEquationCount() {
        return equations.size();
    }
}
