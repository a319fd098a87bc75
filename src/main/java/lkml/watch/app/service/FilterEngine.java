package lkml.watch.app.service;

import lkml.watch.app.entity.FeedMessage;
import lkml.watch.app.entity.FilterRule;
import lkml.watch.app.model.FilterDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Evaluates a message against filter rules.
 * <p>
 * Exclusive rules form a gate: as soon as one enabled exclusive rule exists, a message must match
 * an exclusive rule or at least one other rule to be allowed. Without exclusive rules everything
 * is allowed and the matching rule names are only used for highlighting.
 */
@Slf4j
@Component
public class FilterEngine {
    public static final String AUTHOR = "author";
    public static final String AUTHOR_EMAIL = "author_email";
    public static final String SUBJECT_KEYWORDS = "subject_keywords";
    public static final String SUBJECT_REGEX = "subject_regex";

    public FilterDecision evaluate(FeedMessage message, List<FilterRule> rules) {
        List<FilterRule> enabled = rules.stream()
                .filter(FilterRule::isEnabled)
                .collect(Collectors.toList());
        if (enabled.isEmpty()) {
            return FilterDecision.allow(List.of());
        }

        List<String> matched = new ArrayList<>();
        boolean exclusiveMatch = false;
        for (FilterRule rule : enabled) {
            if (matches(message, rule)) {
                matched.add(rule.getName());
                exclusiveMatch |= rule.isExclusive();
                log.debug("Message {} matches filter '{}' (exclusive={})",
                        message.getMessageIdHeader(), rule.getName(), rule.isExclusive());
            }
        }

        if (exclusiveMatch || !matched.isEmpty()) {
            return FilterDecision.allow(matched);
        }

        boolean hasExclusiveRules = enabled.stream().anyMatch(FilterRule::isExclusive);
        if (hasExclusiveRules) {
            log.debug("Message {} matches no exclusive filter", message.getMessageIdHeader());
            return FilterDecision.reject();
        }
        return FilterDecision.allow(List.of());
    }

    /**
     * Conjunction over the condition keys present in the rule. A rule without conditions matches everything.
     */
    public boolean matches(FeedMessage message, FilterRule rule) {
        Map<String, Object> conditions = rule.getConditions();
        if (conditions == null || conditions.isEmpty()) {
            return true;
        }

        if (conditions.containsKey(AUTHOR) && !matchValue(message.getAuthor(), conditions.get(AUTHOR), false)) {
            return false;
        }
        if (conditions.containsKey(AUTHOR_EMAIL)
                && !matchValue(message.getAuthorEmail(), conditions.get(AUTHOR_EMAIL), false)) {
            return false;
        }
        if (conditions.containsKey(SUBJECT_KEYWORDS)
                && !matchValue(message.getSubject(), conditions.get(SUBJECT_KEYWORDS), false)) {
            return false;
        }
        if (conditions.containsKey(SUBJECT_REGEX)
                && !matchValue(message.getSubject(), conditions.get(SUBJECT_REGEX), true)) {
            return false;
        }
        return true;
    }

    private boolean matchValue(String value, Object condition, boolean alwaysRegex) {
        String text = value == null ? "" : value;
        if (condition instanceof String) {
            return matchOne(text, (String) condition, alwaysRegex);
        }
        if (condition instanceof Collection) {
            for (Object option : (Collection<?>) condition) {
                if (option instanceof String && matchOne(text, (String) option, alwaysRegex)) {
                    return true;
                }
            }
            return false;
        }
        // Unknown condition shapes do not constrain the match
        return true;
    }

    private boolean matchOne(String text, String condition, boolean alwaysRegex) {
        boolean delimited = condition.length() >= 2 && condition.startsWith("/") && condition.endsWith("/");
        if (delimited || alwaysRegex) {
            String regex = delimited ? condition.substring(1, condition.length() - 1) : condition;
            try {
                return Pattern.compile(regex, Pattern.CASE_INSENSITIVE).matcher(text).find();
            } catch (PatternSyntaxException e) {
                log.warn("Ignoring invalid filter regex '{}': {}", regex, e.getDescription());
                return false;
            }
        }
        return text.toLowerCase(Locale.ROOT).contains(condition.toLowerCase(Locale.ROOT));
    }
}
