package com.noteshub.gamification.external;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Read-only view of a platform user, as far as gamification needs it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserProfile {
    private String userId;
    private String handle;          // university seat number (USN)
    private String department;
    private String college;
    private Integer studyYear;
    private String profilePicture;
}
