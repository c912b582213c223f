package com.gravitychain.dkg;

import lombok.Getter;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;

@Getter
public class DkgSession {

    private final DkgSessionMetadata metadata;
    private final long startTimeMicros;
    @Nullable
    private byte[] transcript;

    public DkgSession(DkgSessionMetadata metadata, long startTimeMicros) {
        this.metadata = metadata;
        this.startTimeMicros = startTimeMicros;
    }

    public long getDealerEpoch() {
        return metadata.getDealerEpoch();
    }

    public boolean isCompleted() {
        return transcript != null;
    }

    @Nullable
    public byte[] getTranscript() {
        return transcript == null ? null : Arrays.copyOf(transcript, transcript.length);
    }

    void complete(byte[] transcript) {
        this.transcript = Arrays.copyOf(transcript, transcript.length);
    }
}
