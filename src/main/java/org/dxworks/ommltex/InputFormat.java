package org.dxworks.ommltex;

public enum InputFormat {
    DOCX("docx"),
    XML("xml");

    private final String name;

    InputFormat(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
