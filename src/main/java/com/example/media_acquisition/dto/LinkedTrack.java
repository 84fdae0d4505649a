package com.example.media_acquisition.dto;

import com.example.media_acquisition.util.MediaPlatform;

public record LinkedTrack(MediaPlatform platform, String canonicalId, String title, String deliveryHandle) {
}
