package com.example.media_acquisition.service;

import com.example.media_acquisition.dto.UploadMetadata;
import com.example.media_acquisition.exception.StorageException;
import com.example.media_acquisition.exception.UploadFailedException;
import com.example.media_acquisition.util.MediaFormat;
import com.example.media_acquisition.util.MediaPlatform;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LocalDeliveryStoreTest {

    @TempDir
    Path dir;

    @Test
    void uploadCopiesUnderPlatformKey() throws IOException {
        LocalDeliveryStore store = new LocalDeliveryStore(dir, "delivery", 1_000_000);
        Path artifact = Files.write(dir.resolve("XYZ.mp4"), new byte[4096]);

        String handle = store.upload(artifact, new UploadMetadata(MediaPlatform.INSTAGRAM, "XYZ", "Clip", MediaFormat.VIDEO));

        assertThat(handle).isEqualTo("instagram/XYZ.mp4");
        assertThat(store.exists(handle)).isTrue();
        assertThat(dir.resolve("delivery").resolve(handle)).hasSize(4096);
        assertThat(artifact).exists();
    }

    @Test
    void unsafeIdCharactersAreReplaced() throws IOException {
        LocalDeliveryStore store = new LocalDeliveryStore(dir, "delivery", 1_000_000);
        Path artifact = Files.write(dir.resolve("a.mp4"), new byte[64]);

        String handle = store.upload(artifact, new UploadMetadata(MediaPlatform.INSTAGRAM, "../x y", "Clip", MediaFormat.VIDEO));

        assertThat(handle).isEqualTo("instagram/___x_y.mp4");
    }

    @Test
    void oversizedArtifactIsRejected() throws IOException {
        LocalDeliveryStore store = new LocalDeliveryStore(dir, "delivery", 100);
        Path artifact = Files.write(dir.resolve("big.mp3"), new byte[101]);

        assertThrows(UploadFailedException.class, () -> store.upload(artifact,
                new UploadMetadata(MediaPlatform.YOUTUBE, "abc", "Track", MediaFormat.AUDIO)));
        assertThat(store.exists("youtube/abc.mp3")).isFalse();
    }

    @Test
    void missingArtifactIsRejected() {
        LocalDeliveryStore store = new LocalDeliveryStore(dir, "delivery", 100);

        assertThrows(UploadFailedException.class, () -> store.upload(dir.resolve("gone.mp3"),
                new UploadMetadata(MediaPlatform.YOUTUBE, "abc", "Track", MediaFormat.AUDIO)));
    }

    @Test
    void handlesCannotEscapeTheDeliveryRoot() {
        LocalDeliveryStore store = new LocalDeliveryStore(dir, "delivery", 100);

        assertThrows(StorageException.class, () -> store.exists("../../etc/passwd"));
        assertThrows(StorageException.class, () -> store.exists(" "));
    }
}
