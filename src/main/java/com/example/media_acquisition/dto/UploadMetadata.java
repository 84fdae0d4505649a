package com.example.media_acquisition.dto;

import com.example.media_acquisition.util.MediaFormat;
import com.example.media_acquisition.util.MediaPlatform;

public record UploadMetadata(MediaPlatform platform, String canonicalId, String title, MediaFormat format) {
}
