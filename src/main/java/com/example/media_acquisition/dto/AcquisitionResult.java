package com.example.media_acquisition.dto;

import com.example.media_acquisition.util.AudioPresence;
import com.example.media_acquisition.util.FailureKind;

import java.util.List;

/**
 * Outcome of one acquisition. Exactly two shapes exist: {@link Success} and {@link Failure}.
 */
public interface AcquisitionResult {

    boolean isSuccess();

    static Success fromCache(CanonicalMediaRef ref, CacheEntry entry, LinkedTrack linked) {
        return new Success(ref, entry.deliveryHandle(), entry.title(), entry.durationSeconds(),
                entry.audioPresence(), entry.recognizedTrack(), linked, true);
    }

    static Failure failure(FailureKind kind, String detail) {
        return new Failure(kind, detail, List.of());
    }

    record Success(CanonicalMediaRef ref,
                   String deliveryHandle,
                   String title,
                   Integer durationSeconds,
                   AudioPresence audioPresence,
                   TrackMatch recognizedTrack,
                   LinkedTrack linkedTrack,
                   boolean fromCache) implements AcquisitionResult {
        @Override
        public boolean isSuccess() {
            return true;
        }

        public Success withLinkedTrack(LinkedTrack linked) {
            return new Success(ref, deliveryHandle, title, durationSeconds, audioPresence, recognizedTrack, linked, fromCache);
        }

        public Success withRecognizedTrack(TrackMatch track) {
            return new Success(ref, deliveryHandle, title, durationSeconds, audioPresence, track, linkedTrack, fromCache);
        }
    }

    record Failure(FailureKind kind, String detail, List<BackendAttempt> attempts) implements AcquisitionResult {
        public Failure {
            attempts = attempts == null ? List.of() : List.copyOf(attempts);
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
