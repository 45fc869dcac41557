package com.noteshub.gamification.achievement;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.noteshub.gamification.achievement.AchievementCategory.*;
import static com.noteshub.gamification.achievement.Rarity.*;

/**
 * The static achievement catalog. Entries are defined in code, never persisted and never changed at runtime.
 * Adding an achievement means adding one line below; ids are stored in user_achievement and must stay stable.
 */
@Component
public class AchievementCatalog {

    private static final List<AchievementDefinition> DEFINITIONS;
    private static final Map<String, AchievementDefinition> BY_ID;

    static {
        List<AchievementDefinition> list = new ArrayList<>();

        // upload
        list.add(single("first_note", "First Note", "Upload your first note", UPLOAD, "📝", StatKey.UPLOADS, 1, COMMON, 50));
        list.add(single("getting_started", "Getting Started", "Upload 5 notes", UPLOAD, "🌱", StatKey.UPLOADS, 5, COMMON, 75));
        list.add(single("generous", "Generous", "Upload 10 notes", UPLOAD, "🎁", StatKey.UPLOADS, 10, UNCOMMON, 150));
        list.add(single("contributor", "Contributor", "Upload 25 notes", UPLOAD, "🗂️", StatKey.UPLOADS, 25, UNCOMMON, 250));
        list.add(single("scholar", "Scholar", "Upload 50 notes", UPLOAD, "📚", StatKey.UPLOADS, 50, RARE, 500));
        list.add(single("professor", "Professor", "Upload 100 notes", UPLOAD, "🎓", StatKey.UPLOADS, 100, EPIC, 1000));
        list.add(single("library_builder", "Library Builder", "Upload 250 notes", UPLOAD, "🏛️", StatKey.UPLOADS, 250, LEGENDARY, 2500));

        // download
        list.add(single("first_download", "First Download", "Download your first note", DOWNLOAD, "⬇️", StatKey.DOWNLOADS, 1, COMMON, 10));
        list.add(single("curious_mind", "Curious Mind", "Download 5 notes", DOWNLOAD, "🤔", StatKey.DOWNLOADS, 5, COMMON, 25));
        list.add(single("knowledge_seeker", "Knowledge Seeker", "Download 20 notes", DOWNLOAD, "🔍", StatKey.DOWNLOADS, 20, COMMON, 50));
        list.add(single("study_buddy", "Study Buddy", "Download 50 notes", DOWNLOAD, "📒", StatKey.DOWNLOADS, 50, UNCOMMON, 100));
        list.add(single("bookworm", "Bookworm", "Download 100 notes", DOWNLOAD, "📖", StatKey.DOWNLOADS, 100, UNCOMMON, 150));
        list.add(single("archivist", "Archivist", "Download 500 notes", DOWNLOAD, "🗄️", StatKey.DOWNLOADS, 500, EPIC, 600));

        // downloads received on the user's own notes
        list.add(single("first_fan", "First Fan", "Someone downloaded your note", SOCIAL, "🙌", StatKey.NOTE_DOWNLOADS, 1, COMMON, 25));
        list.add(single("rising_star", "Rising Star", "Your notes downloaded 25 times", SOCIAL, "🌟", StatKey.NOTE_DOWNLOADS, 25, COMMON, 75));
        list.add(single("helper", "Helper", "Your notes downloaded 100 times", SOCIAL, "🤝", StatKey.NOTE_DOWNLOADS, 100, UNCOMMON, 200));
        list.add(single("popular", "Popular", "Your notes downloaded 500 times", SOCIAL, "⭐", StatKey.NOTE_DOWNLOADS, 500, RARE, 500));
        list.add(single("influencer", "Influencer", "Your notes downloaded 1000 times", SOCIAL, "📣", StatKey.NOTE_DOWNLOADS, 1000, EPIC, 1000));
        list.add(single("legendary_author", "Legendary Author", "Your notes downloaded 5000 times", SOCIAL, "👑", StatKey.NOTE_DOWNLOADS, 5000, LEGENDARY, 3000));

        // streak
        list.add(single("streak_starter", "Streak Starter", "3-day streak", STREAK, "✨", StatKey.STREAK, 3, COMMON, 25));
        list.add(single("week_warrior", "Week Warrior", "7-day streak", STREAK, "🔥", StatKey.STREAK, 7, COMMON, 100));
        list.add(single("fortnight_focus", "Fortnight Focus", "14-day streak", STREAK, "🎯", StatKey.STREAK, 14, UNCOMMON, 150));
        list.add(single("month_master", "Month Master", "30-day streak", STREAK, "📆", StatKey.STREAK, 30, UNCOMMON, 300));
        list.add(single("hundred_days", "Hundred Days", "100-day streak", STREAK, "💯", StatKey.STREAK, 100, RARE, 800));
        list.add(single("half_year_hero", "Half-Year Hero", "180-day streak", STREAK, "🏅", StatKey.STREAK, 180, EPIC, 1500));
        list.add(single("year_champion_streak", "Year Champion", "365-day streak", STREAK, "🎉", StatKey.STREAK, 365, LEGENDARY, 3000));

        // activity
        list.add(single("active_learner", "Active Learner", "Record 10 activities", ACTIVITY, "🏃", StatKey.TOTAL_ACTIVITIES, 10, COMMON, 25));
        list.add(single("regular", "Regular", "Record 50 activities", ACTIVITY, "📈", StatKey.TOTAL_ACTIVITIES, 50, COMMON, 75));
        list.add(single("dedicated", "Dedicated", "Record 200 activities", ACTIVITY, "💪", StatKey.TOTAL_ACTIVITIES, 200, UNCOMMON, 200));
        list.add(single("unstoppable", "Unstoppable", "Record 1000 activities", ACTIVITY, "🚀", StatKey.TOTAL_ACTIVITIES, 1000, RARE, 600));

        // referral
        list.add(flag("welcome_aboard", "Welcome Aboard", "Join with a friend's referral code", REFERRAL, "👋", StatKey.REFERRED, COMMON, 20));
        list.add(single("first_referral", "First Referral", "Refer your first friend", REFERRAL, "💌", StatKey.REFERRALS, 1, COMMON, 50));
        list.add(single("referral_trio", "Squad Goals", "Refer 3 friends", REFERRAL, "👥", StatKey.REFERRALS, 3, UNCOMMON, 100));
        list.add(single("referral_master", "Referral Master", "Refer 10 friends", REFERRAL, "🎯", StatKey.REFERRALS, 10, EPIC, 800));
        list.add(single("ambassador", "Ambassador", "Refer 25 friends", REFERRAL, "🏳️", StatKey.REFERRALS, 25, EPIC, 1200));
        list.add(single("referral_legend", "Referral Legend", "Refer 50 friends", REFERRAL, "🏆", StatKey.REFERRALS, 50, LEGENDARY, 2500));

        // sharing
        list.add(single("first_share", "First Share", "Share a note", SHARING, "🔗", StatKey.SHARES, 1, COMMON, 10));
        list.add(single("sharer", "Sharer", "Share 10 notes", SHARING, "📤", StatKey.SHARES, 10, COMMON, 50));
        list.add(single("promoter", "Promoter", "Share 50 notes", SHARING, "📢", StatKey.SHARES, 50, UNCOMMON, 150));
        list.add(single("viral", "Viral", "Share 200 notes", SHARING, "🌐", StatKey.SHARES, 200, RARE, 400));

        // followers
        list.add(single("first_follower", "First Follower", "Get your first follower", FOLLOWERS, "👤", StatKey.FOLLOWERS, 1, COMMON, 10));
        list.add(single("noticed", "Getting Noticed", "Reach 10 followers", FOLLOWERS, "👀", StatKey.FOLLOWERS, 10, COMMON, 50));
        list.add(single("crowd_favorite", "Crowd Favorite", "Reach 50 followers", FOLLOWERS, "🎊", StatKey.FOLLOWERS, 50, UNCOMMON, 200));
        list.add(single("celebrity", "Campus Celebrity", "Reach 200 followers", FOLLOWERS, "🌠", StatKey.FOLLOWERS, 200, RARE, 600));

        // following
        list.add(single("networker", "Networker", "Follow 10 students", FOLLOWING, "🧭", StatKey.FOLLOWING, 10, COMMON, 25));

        // groups
        list.add(single("team_player", "Team Player", "Join a study group", GROUPS, "🤜", StatKey.GROUPS_JOINED, 1, COMMON, 25));
        list.add(single("group_hopper", "Group Hopper", "Join 10 study groups", GROUPS, "🦘", StatKey.GROUPS_JOINED, 10, UNCOMMON, 100));
        list.add(single("group_founder", "Group Founder", "Create a study group", GROUPS, "🏕️", StatKey.GROUPS_CREATED, 1, COMMON, 50));
        list.add(single("community_builder", "Community Builder", "Create 5 study groups", GROUPS, "🏗️", StatKey.GROUPS_CREATED, 5, UNCOMMON, 200));

        // level
        list.add(single("level_helper", "Helping Hand", "Reach level 5", LEVEL, "🥉", StatKey.LEVEL, 5, COMMON, 100));
        list.add(single("level_expert", "Expert", "Reach level 10", LEVEL, "🥈", StatKey.LEVEL, 10, UNCOMMON, 250));
        list.add(single("level_master", "Master", "Reach level 20", LEVEL, "🥇", StatKey.LEVEL, 20, RARE, 600));
        list.add(single("level_legend", "Legend", "Reach level 50", LEVEL, "💎", StatKey.LEVEL, 50, LEGENDARY, 5000));

        // multi-criteria
        list.add(new AchievementDefinition("all_rounder", "All-Rounder",
                "Upload 5 notes, download 25 notes or share 10 notes", SPECIAL, "🎲",
                List.of(new AtLeast(StatKey.UPLOADS, 5), new AtLeast(StatKey.DOWNLOADS, 25), new AtLeast(StatKey.SHARES, 10)),
                CriteriaMode.ANY, UNCOMMON, 150));
        list.add(new AchievementDefinition("community_pillar", "Community Pillar",
                "Upload 25 notes, reach 25 followers and create a study group", SPECIAL, "🏛",
                List.of(new AtLeast(StatKey.UPLOADS, 25), new AtLeast(StatKey.FOLLOWERS, 25), new AtLeast(StatKey.GROUPS_CREATED, 1)),
                CriteriaMode.ALL, EPIC, 1000));

        Map<String, AchievementDefinition> byId = new LinkedHashMap<>();
        for (AchievementDefinition definition : list) {
            if (byId.put(definition.getId(), definition) != null) {
                throw new IllegalStateException("Duplicate achievement id " + definition.getId());
            }
        }
        DEFINITIONS = Collections.unmodifiableList(list);
        BY_ID = Collections.unmodifiableMap(byId);
    }

    private static AchievementDefinition single(String id, String name, String description, AchievementCategory category,
                                                String icon, StatKey stat, long minimum, Rarity rarity, int points) {
        return new AchievementDefinition(id, name, description, category, icon,
                List.of(new AtLeast(stat, minimum)), CriteriaMode.ANY, rarity, points);
    }

    private static AchievementDefinition flag(String id, String name, String description, AchievementCategory category,
                                              String icon, StatKey stat, Rarity rarity, int points) {
        return new AchievementDefinition(id, name, description, category, icon,
                List.of(new Exactly(stat, true)), CriteriaMode.ANY, rarity, points);
    }

    /**
     * All entries in catalog order.
     */
    public List<AchievementDefinition> getAll() {
        return DEFINITIONS;
    }

    public Optional<AchievementDefinition> findById(String id) {
        return Optional.ofNullable(BY_ID.get(id));
    }

    public int size() {
        return DEFINITIONS.size();
    }
}
