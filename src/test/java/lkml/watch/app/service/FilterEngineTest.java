package lkml.watch.app.service;

import lkml.watch.app.entity.FeedMessage;
import lkml.watch.app.entity.FilterRule;
import lkml.watch.app.model.FilterDecision;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FilterEngineTest {

    private final FilterEngine engine = new FilterEngine();

    private static FilterRule rule(String name, boolean exclusive, String key, Object value) {
        FilterRule rule = new FilterRule();
        rule.setName(name);
        rule.setExclusive(exclusive);
        Map<String, Object> conditions = new LinkedHashMap<>();
        conditions.put(key, value);
        rule.setConditions(conditions);
        return rule;
    }

    private static FeedMessage message(String author, String email, String subject) {
        FeedMessage message = new FeedMessage();
        message.setMessageIdHeader("m@x");
        message.setAuthor(author);
        message.setAuthorEmail(email);
        message.setSubject(subject);
        return message;
    }

    @Test
    void evaluate_WithNoRules_ShouldAllowWithoutMatches() {
        FilterDecision decision = engine.evaluate(message("A", "a@x", "[PATCH] foo"), List.of());

        assertTrue(decision.isAllowed());
        assertFalse(decision.hasMatches());
    }

    @Test
    void evaluate_WithExclusiveAndNonExclusiveRules_ShouldFollowPriorityTier() {
        // Given
        FilterRule exclusive = rule("maintainer", true, FilterEngine.AUTHOR, "Jane Doe");
        FilterRule keyword = rule("bpf", false, FilterEngine.SUBJECT_KEYWORDS, List.of("bpf"));
        List<FilterRule> rules = List.of(exclusive, keyword);

        // When
        FilterDecision fromAuthor = engine.evaluate(message("Jane Doe", "jane@x", "[PATCH] mm: cleanup"), rules);
        FilterDecision withKeyword = engine.evaluate(message("John", "john@x", "[PATCH] bpf: verifier fix"), rules);
        FilterDecision neither = engine.evaluate(message("John", "john@x", "[PATCH] mm: cleanup"), rules);

        // Then
        assertTrue(fromAuthor.isAllowed());
        assertEquals(List.of("maintainer"), fromAuthor.getMatchedFilters());
        assertTrue(withKeyword.isAllowed());
        assertEquals(List.of("bpf"), withKeyword.getMatchedFilters());
        assertFalse(neither.isAllowed());
    }

    @Test
    void evaluate_WithExclusiveMatch_ShouldReportAllMatches() {
        List<FilterRule> rules = List.of(
                rule("maintainer", true, FilterEngine.AUTHOR, "Jane"),
                rule("bpf", false, FilterEngine.SUBJECT_KEYWORDS, "bpf"));

        FilterDecision decision = engine.evaluate(message("Jane", "jane@x", "[PATCH] bpf: thing"), rules);

        assertTrue(decision.isAllowed());
        assertEquals(List.of("maintainer", "bpf"), decision.getMatchedFilters());
    }

    @Test
    void evaluate_WithOnlyNonMatchingNonExclusiveRules_ShouldAllow() {
        List<FilterRule> rules = List.of(rule("bpf", false, FilterEngine.SUBJECT_KEYWORDS, "bpf"));

        FilterDecision decision = engine.evaluate(message("John", "john@x", "[PATCH] mm"), rules);

        assertTrue(decision.isAllowed());
        assertFalse(decision.hasMatches());
    }

    @Test
    void evaluate_ShouldIgnoreDisabledRules() {
        FilterRule exclusive = rule("maintainer", true, FilterEngine.AUTHOR, "Jane");
        exclusive.setEnabled(false);

        FilterDecision decision = engine.evaluate(message("John", "john@x", "[PATCH] mm"), List.of(exclusive));

        assertTrue(decision.isAllowed());
        assertFalse(decision.hasMatches());
    }

    @Test
    void matches_WithDelimitedRegex_ShouldMatchCaseInsensitive() {
        FilterRule rule = rule("intel", false, FilterEngine.AUTHOR_EMAIL, "/@intel\\.com$/");

        assertTrue(engine.matches(message("A", "Someone@INTEL.com", "s"), rule));
        assertFalse(engine.matches(message("A", "someone@intel.com.evil", "s"), rule));
    }

    @Test
    void matches_WithSubstring_ShouldBeCaseInsensitive() {
        FilterRule rule = rule("jane", false, FilterEngine.AUTHOR, "jane");

        assertTrue(engine.matches(message("JANE Doe", "j@x", "s"), rule));
    }

    @Test
    void matches_WithSubjectRegex_ShouldAlwaysTreatAsRegex() {
        FilterRule rule = rule("netdev", false, FilterEngine.SUBJECT_REGEX, "net(-next)?:");

        assertTrue(engine.matches(message("A", "a@x", "[PATCH] net-next: foo"), rule));
        assertFalse(engine.matches(message("A", "a@x", "[PATCH] mm: foo"), rule));
    }

    @Test
    void matches_WithInvalidRegex_ShouldNotMatch() {
        FilterRule rule = rule("broken", false, FilterEngine.SUBJECT_REGEX, "([unclosed");

        assertFalse(engine.matches(message("A", "a@x", "([unclosed"), rule));
    }

    @Test
    void matches_ShouldRequireAllConditions() {
        FilterRule rule = rule("both", false, FilterEngine.AUTHOR, "Jane");
        rule.getConditions().put(FilterEngine.SUBJECT_KEYWORDS, List.of("bpf", "xdp"));

        assertTrue(engine.matches(message("Jane", "j@x", "[PATCH] xdp: thing"), rule));
        assertFalse(engine.matches(message("Jane", "j@x", "[PATCH] mm: thing"), rule));
        assertFalse(engine.matches(message("John", "j@x", "[PATCH] xdp: thing"), rule));
    }

    @Test
    void matches_WithEmptyConditions_ShouldMatchEverything() {
        FilterRule rule = new FilterRule();
        rule.setName("all");

        assertTrue(engine.matches(message("A", "a@x", "s"), rule));
    }
}
