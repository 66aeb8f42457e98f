package com.fcube.plugin.plan;

public enum FileAction {
    CREATE("create"),
    OVERWRITE("overwrite");

    private final String label;

    FileAction(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
