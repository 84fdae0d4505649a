package com.example.media_acquisition.repository;

import com.example.media_acquisition.model.CachedMedia;
import com.example.media_acquisition.util.MediaFormat;
import com.example.media_acquisition.util.MediaPlatform;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CachedMediaRepository extends JpaRepository<CachedMedia, UUID> {

    Optional<CachedMedia> findByPlatformAndCanonicalIdAndFormat(MediaPlatform platform, String canonicalId,
                                                                MediaFormat format);

    @Query("""
            select m from CachedMedia m
            where m.linkedPlatform = :platform
              and m.linkedCanonicalId = :canonicalId
              and m.deliveryHandle is not null
            order by m.createdAt asc
            """)
    List<CachedMedia> findLinkedTo(@Param("platform") MediaPlatform platform,
                                   @Param("canonicalId") String canonicalId);
}
