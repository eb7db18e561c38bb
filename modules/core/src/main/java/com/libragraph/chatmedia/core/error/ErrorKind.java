package com.libragraph.chatmedia.core.error;

/**
 * Failure categories surfaced to callers.
 */
public enum ErrorKind {
    SOURCE_MISSING(0, "SourceMissing", Affordance.UNRESOLVABLE),
    KEY_MISSING(1, "KeyMissing", Affordance.UNRESOLVABLE),
    DECRYPTION_FAILED(2, "DecryptionFailed", Affordance.UNRESOLVABLE),
    DECODE_FAILED(3, "DecodeFailed", Affordance.UNRESOLVABLE),
    ENCODE_FAILED(4, "EncodeFailed", Affordance.UNRESOLVABLE),
    TIMEOUT(5, "Timeout", Affordance.NEEDS_DECODE),
    CORRUPT_OUTPUT(6, "CorruptOutput", Affordance.UNRESOLVABLE),
    UNRESOLVABLE(7, "Unresolvable", Affordance.UNRESOLVABLE);

    /**
     * What a caller can offer the user for a failed attachment.
     */
    public enum Affordance {
        /** Transient; resolving again on demand may succeed. */
        NEEDS_DECODE,
        /** Permanent for this session. */
        UNRESOLVABLE
    }

    private final int id;
    private final String label;
    private final Affordance affordance;

    ErrorKind(int id, String label, Affordance affordance) {
        this.id = id;
        this.label = label;
        this.affordance = affordance;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public Affordance affordance() {
        return affordance;
    }

    public boolean retryable() {
        return affordance == Affordance.NEEDS_DECODE;
    }

    public static ErrorKind fromId(int id) {
        for (ErrorKind k : values()) {
            if (k.id == id) return k;
        }
        throw new IllegalArgumentException("Unknown ErrorKind id: " + id);
    }
}
