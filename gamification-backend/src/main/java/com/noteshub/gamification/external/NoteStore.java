package com.noteshub.gamification.external;

import java.util.Collection;
import java.util.Map;

/**
 * Counters over uploaded notes and downloads.
 */
public interface NoteStore {

    /**
     * @param approvedOnly count only notes that passed moderation
     */
    long countUploads(String userId, boolean approvedOnly);

    /**
     * Total times the user's notes have been downloaded by anyone.
     */
    long sumDownloadCount(String userId);

    /**
     * Notes this user has downloaded.
     */
    long countDownloadsBy(String userId);

    /**
     * Batched form of {@code countUploads(userId, true)}; users without notes may be absent.
     */
    Map<String, Long> countApprovedUploadsByUser(Collection<String> userIds);

    /**
     * Batched form of {@link #sumDownloadCount(String)}; users without notes may be absent.
     */
    Map<String, Long> sumDownloadCountByUser(Collection<String> userIds);
}
