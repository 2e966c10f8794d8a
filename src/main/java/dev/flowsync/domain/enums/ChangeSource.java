package dev.flowsync.domain.enums;

public enum ChangeSource {
    VISUAL, CHAT;

    public ChangeSource opposite() {
        return this == VISUAL ? CHAT : VISUAL;
    }
}
