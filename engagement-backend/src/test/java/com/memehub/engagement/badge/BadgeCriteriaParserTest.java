package com.memehub.engagement.badge;

import com.memehub.engagement.badge.criteria.AllOfCriteria;
import com.memehub.engagement.badge.criteria.RankCriteria;
import com.memehub.engagement.badge.criteria.StreakCriteria;
import com.memehub.engagement.badge.criteria.ThresholdCriteria;
import com.memehub.engagement.entity.Rank;
import com.memehub.engagement.service.RankPolicy;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BadgeCriteriaParserTest {

    private final BadgeCriteriaParser parser = new BadgeCriteriaParser();
    private final RankPolicy rankPolicy = new RankPolicy();

    private UserStatistics stats(long memes, long likes, long comments, int streak, long points) {
        return new UserStatistics(1L, memes, likes, comments, streak, points, rankPolicy.rankFor(points));
    }

    @Test
    void testParseThreshold() {
        BadgeCriteria criteria = parser.parse("memes_created >= 5");

        assertEquals(new ThresholdCriteria(Counter.MEMES_CREATED, 5), criteria);
        assertFalse(criteria.isSatisfiedBy(stats(4, 0, 0, 0, 0)));
        assertTrue(criteria.isSatisfiedBy(stats(5, 0, 0, 0, 0)));
    }

    @Test
    void testParseStreakAndRank() {
        assertEquals(new StreakCriteria(7), parser.parse("login_streak>=7"));
        assertEquals(new RankCriteria(Rank.ROOKIE_MEMER), parser.parse("rank >= rookie_memer"));

        BadgeCriteria rank = parser.parse("rank >= PRO_MEMER");
        assertFalse(rank.isSatisfiedBy(stats(0, 0, 0, 0, 499)));
        assertTrue(rank.isSatisfiedBy(stats(0, 0, 0, 0, 1000)));
    }

    @Test
    void testParseNestedAll() {
        BadgeCriteria criteria = parser.parse("all(memes_created >= 5, all(likes_received >= 50, comments_made >= 1))");

        assertEquals(new AllOfCriteria(List.of(
                new ThresholdCriteria(Counter.MEMES_CREATED, 5),
                new AllOfCriteria(List.of(
                        new ThresholdCriteria(Counter.LIKES_RECEIVED, 50),
                        new ThresholdCriteria(Counter.COMMENTS_MADE, 1))))), criteria);
        assertFalse(criteria.isSatisfiedBy(stats(5, 50, 0, 0, 0)));
        assertTrue(criteria.isSatisfiedBy(stats(5, 50, 1, 0, 0)));
        assertEquals("all(memes_created >= 5, all(likes_received >= 50, comments_made >= 1))", criteria.describe());
    }

    @Test
    void testParseIsCached() {
        assertSame(parser.parse("total_points >= 100"), parser.parse("  total_points >= 100 "));
    }

    @Test
    void testParseRejectsMalformedDescriptors() {
        assertThrows(IllegalArgumentException.class, () -> parser.parse(""));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("memes_created > 5"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("followers >= 5"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("memes_created >= lots"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("rank >= EMPEROR"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("all(memes_created >= 1"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("all(memes_created >= 1,)"));
    }
}
