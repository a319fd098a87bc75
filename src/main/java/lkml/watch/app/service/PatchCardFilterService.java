package lkml.watch.app.service;

import lkml.watch.app.entity.FeedMessage;
import lkml.watch.app.entity.FilterConfig;
import lkml.watch.app.entity.FilterRule;
import lkml.watch.app.model.FilterDecision;
import lkml.watch.app.repository.FilterConfigRepository;
import lkml.watch.app.repository.FilterRuleRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Card filtering on top of the stored rule set, plus rule administration and the auto-watch switch.
 */
@Slf4j
@Service
public class PatchCardFilterService {
    private final FilterRuleRepository filterRuleRepository;
    private final FilterConfigRepository filterConfigRepository;
    private final FilterEngine filterEngine;

    public PatchCardFilterService(
            FilterRuleRepository filterRuleRepository,
            FilterConfigRepository filterConfigRepository,
            FilterEngine filterEngine) {
        this.filterRuleRepository = filterRuleRepository;
        this.filterConfigRepository = filterConfigRepository;
        this.filterEngine = filterEngine;
    }

    /**
     * Decide whether a card should be created for the message.
     * If the rules cannot be loaded, creation is allowed so that messages are not silently dropped.
     */
    public FilterDecision shouldCreatePatchCard(FeedMessage message) {
        try {
            List<FilterRule> rules = filterRuleRepository.findByEnabledTrueOrderByCreatedAtDesc();
            return filterEngine.evaluate(message, rules);
        } catch (RuntimeException e) {
            log.warn("Failed to check filter rules, allowing creation by default: {}", e.getMessage(), e);
            return FilterDecision.allow(List.of());
        }
    }

    /**
     * Auto-watch applies only when some filter matched and the global switch is on.
     */
    public boolean isAutoWatchEnabled(List<String> matchedFilters) {
        if (matchedFilters == null || matchedFilters.isEmpty()) {
            return false;
        }
        return isAutoWatchEnabled();
    }

    public boolean isAutoWatchEnabled() {
        try {
            return filterConfigRepository.findById(FilterConfig.AUTO_WATCH_ENABLED)
                    .map(config -> Boolean.parseBoolean(config.getConfigValue()))
                    .orElse(false);
        } catch (RuntimeException e) {
            log.warn("Failed to read auto-watch switch, treating as disabled: {}", e.getMessage());
            return false;
        }
    }

    public void setAutoWatchEnabled(boolean enabled) {
        FilterConfig config = filterConfigRepository.findById(FilterConfig.AUTO_WATCH_ENABLED)
                .orElseGet(() -> {
                    FilterConfig created = new FilterConfig();
                    created.setConfigKey(FilterConfig.AUTO_WATCH_ENABLED);
                    return created;
                });
        config.setConfigValue(Boolean.toString(enabled));
        filterConfigRepository.save(config);
        log.info("Auto-watch {}", enabled ? "enabled" : "disabled");
    }

    /**
     * Create a rule, or overwrite the rule with the same name.
     * Description and creator of an existing rule are kept when not given.
     */
    @Transactional
    public FilterRule createOrReplace(String name, Map<String, Object> conditions, String description,
                                      String createdBy, boolean enabled, boolean exclusive) {
        FilterRule rule = filterRuleRepository.findByName(name).orElseGet(FilterRule::new);
        boolean existing = rule.getId() != null;
        rule.setName(name);
        rule.setConditions(conditions);
        rule.setEnabled(enabled);
        rule.setExclusive(exclusive);
        if (description != null || !existing) {
            rule.setDescription(description);
        }
        if (createdBy != null || !existing) {
            rule.setCreatedBy(createdBy);
        }
        FilterRule saved = filterRuleRepository.save(rule);
        log.info("{} filter '{}' (exclusive={}, enabled={})", existing ? "Updated" : "Created", name, exclusive, enabled);
        return saved;
    }

    public List<FilterRule> list(boolean enabledOnly) {
        return enabledOnly
                ? filterRuleRepository.findByEnabledTrueOrderByCreatedAtDesc()
                : filterRuleRepository.findAllByOrderByCreatedAtDesc();
    }

    public Optional<FilterRule> find(String name) {
        return filterRuleRepository.findByName(name);
    }

    @Transactional
    public boolean delete(String name) {
        Optional<FilterRule> rule = filterRuleRepository.findByName(name);
        if (rule.isEmpty()) {
            return false;
        }
        filterRuleRepository.delete(rule.get());
        log.info("Deleted filter '{}'", name);
        return true;
    }

    /**
     * Enable or disable a rule; a null {@code enabled} flips the current state.
     */
    @Transactional
    public boolean toggle(String name, Boolean enabled) {
        Optional<FilterRule> found = filterRuleRepository.findByName(name);
        if (found.isEmpty()) {
            return false;
        }
        FilterRule rule = found.get();
        rule.setEnabled(enabled == null ? !rule.isEnabled() : enabled);
        filterRuleRepository.save(rule);
        return true;
    }
}
