package io.workline.core.session;

import java.time.Instant;

public record TranscriptEntry(Speaker speaker, String text, Instant at) {
    public enum Speaker {
        CALLER,
        AGENT
    }

    public TranscriptEntry {
        speaker = speaker == null ? Speaker.CALLER : speaker;
        text = text == null ? "" : text;
    }
}
