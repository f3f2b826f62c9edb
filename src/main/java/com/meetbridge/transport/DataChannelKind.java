package com.meetbridge.transport;

/**
 * Data channels the bridge recognises, by label.
 */
public enum DataChannelKind {
    COLLECTIONS("collections"),
    CAPTIONS("captions"),
    MEDIA_DIRECTOR("media-director"),
    OTHER(null);

    private final String label;

    DataChannelKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static DataChannelKind fromLabel(String label) {
        for (DataChannelKind kind : values()) {
            if (kind.label != null && kind.label.equals(label)) {
                return kind;
            }
        }
        return OTHER;
    }
}
