package com.libragraph.chatmedia.core.model;

public enum TaskState {
    PENDING(0, "PENDING"),
    RUNNING(1, "RUNNING"),
    SUCCEEDED(2, "SUCCEEDED"),
    FAILED(3, "FAILED");

    private final int id;
    private final String label;

    TaskState(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }

    public static TaskState fromId(int id) {
        for (TaskState s : values()) {
            if (s.id == id) return s;
        }
        throw new IllegalArgumentException("Unknown TaskState id: " + id);
    }
}
