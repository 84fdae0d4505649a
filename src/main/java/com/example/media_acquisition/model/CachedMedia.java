package com.example.media_acquisition.model;

import com.example.media_acquisition.util.AudioPresence;
import com.example.media_acquisition.util.MediaFormat;
import com.example.media_acquisition.util.MediaPlatform;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

/**
 * One delivered artifact per (platform, canonical id, format).
 */
@Entity
@Table(name = "media_cache", uniqueConstraints = @UniqueConstraint(name = "ux_media_cache_key", columnNames = {"platform", "canonical_id", "format"}))
public class CachedMedia {
    @Id
    @GeneratedValue
    @UuidGenerator
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "platform", nullable = false, length = 32)
    private MediaPlatform platform;

    @Column(name = "canonical_id", nullable = false, length = 128)
    private String canonicalId;

    @Enumerated(EnumType.STRING)
    @Column(name = "format", nullable = false, length = 16)
    private MediaFormat format;

    @Column(name = "title", length = 512)
    private String title;

    @Column(name = "delivery_handle", length = 1024)
    private String deliveryHandle;

    @Column(name = "duration_seconds")
    private Integer durationSeconds;

    @Enumerated(EnumType.STRING)
    @Column(name = "has_audio", nullable = false, length = 16)
    private AudioPresence hasAudio = AudioPresence.UNKNOWN;

    @Column(name = "recognized_title", length = 512)
    private String recognizedTitle;

    @Column(name = "recognized_artist", length = 512)
    private String recognizedArtist;

    @Enumerated(EnumType.STRING)
    @Column(name = "linked_platform", length = 32)
    private MediaPlatform linkedPlatform;

    @Column(name = "linked_canonical_id", length = 128)
    private String linkedCanonicalId;

    @Enumerated(EnumType.STRING)
    @Column(name = "track_platform", length = 32)
    private MediaPlatform trackPlatform;

    @Column(name = "track_canonical_id", length = 128)
    private String trackCanonicalId;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    protected CachedMedia() {
    }

    public CachedMedia(MediaPlatform platform, String canonicalId, MediaFormat format) {
        this.platform = platform;
        this.canonicalId = canonicalId;
        this.format = format;
    }

    public UUID getId() {
        return id;
    }

    public MediaPlatform getPlatform() {
        return platform;
    }

    public String getCanonicalId() {
        return canonicalId;
    }

    public MediaFormat getFormat() {
        return format;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDeliveryHandle() {
        return deliveryHandle;
    }

    public void setDeliveryHandle(String deliveryHandle) {
        this.deliveryHandle = deliveryHandle;
    }

    public Integer getDurationSeconds() {
        return durationSeconds;
    }

    public void setDurationSeconds(Integer durationSeconds) {
        this.durationSeconds = durationSeconds;
    }

    public AudioPresence getHasAudio() {
        return hasAudio;
    }

    public void setHasAudio(AudioPresence hasAudio) {
        this.hasAudio = hasAudio;
    }

    public String getRecognizedTitle() {
        return recognizedTitle;
    }

    public void setRecognizedTitle(String recognizedTitle) {
        this.recognizedTitle = recognizedTitle;
    }

    public String getRecognizedArtist() {
        return recognizedArtist;
    }

    public void setRecognizedArtist(String recognizedArtist) {
        this.recognizedArtist = recognizedArtist;
    }

    public MediaPlatform getLinkedPlatform() {
        return linkedPlatform;
    }

    public void setLinkedPlatform(MediaPlatform linkedPlatform) {
        this.linkedPlatform = linkedPlatform;
    }

    public String getLinkedCanonicalId() {
        return linkedCanonicalId;
    }

    public void setLinkedCanonicalId(String linkedCanonicalId) {
        this.linkedCanonicalId = linkedCanonicalId;
    }

    public MediaPlatform getTrackPlatform() {
        return trackPlatform;
    }

    public void setTrackPlatform(MediaPlatform trackPlatform) {
        this.trackPlatform = trackPlatform;
    }

    public String getTrackCanonicalId() {
        return trackCanonicalId;
    }

    public void setTrackCanonicalId(String trackCanonicalId) {
        this.trackCanonicalId = trackCanonicalId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
