package lkml.watch.app.service;

import lkml.watch.app.entity.FeedMessage;
import lkml.watch.app.entity.FilterConfig;
import lkml.watch.app.entity.FilterRule;
import lkml.watch.app.model.FilterDecision;
import lkml.watch.app.repository.FilterConfigRepository;
import lkml.watch.app.repository.FilterRuleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PatchCardFilterServiceTest {

    @Mock
    private FilterRuleRepository filterRuleRepository;

    @Mock
    private FilterConfigRepository filterConfigRepository;

    private PatchCardFilterService filterService;

    @BeforeEach
    void setUp() {
        filterService = new PatchCardFilterService(filterRuleRepository, filterConfigRepository, new FilterEngine());
    }

    private static FeedMessage message(String author) {
        FeedMessage message = new FeedMessage();
        message.setMessageIdHeader("m@x");
        message.setAuthor(author);
        message.setSubject("[PATCH] foo");
        return message;
    }

    private static FilterConfig autoWatch(String value) {
        FilterConfig config = new FilterConfig();
        config.setConfigKey(FilterConfig.AUTO_WATCH_ENABLED);
        config.setConfigValue(value);
        return config;
    }

    @Test
    void shouldCreatePatchCard_WhenRulesCannotBeLoaded_ShouldAllow() {
        // Given
        when(filterRuleRepository.findByEnabledTrueOrderByCreatedAtDesc())
                .thenThrow(new DataAccessResourceFailureException("db down"));

        // When
        FilterDecision decision = filterService.shouldCreatePatchCard(message("Jane"));

        // Then
        assertTrue(decision.isAllowed());
        assertFalse(decision.hasMatches());
    }

    @Test
    void shouldCreatePatchCard_ShouldEvaluateEnabledRules() {
        FilterRule rule = new FilterRule();
        rule.setName("jane");
        rule.setExclusive(true);
        rule.setConditions(Map.of(FilterEngine.AUTHOR, "jane"));
        when(filterRuleRepository.findByEnabledTrueOrderByCreatedAtDesc()).thenReturn(List.of(rule));

        assertEquals(List.of("jane"), filterService.shouldCreatePatchCard(message("Jane Doe")).getMatchedFilters());
        assertFalse(filterService.shouldCreatePatchCard(message("John")).isAllowed());
    }

    @Test
    void isAutoWatchEnabled_WithoutMatches_ShouldBeFalseWithoutLookup() {
        assertFalse(filterService.isAutoWatchEnabled(List.of()));
        verifyNoInteractions(filterConfigRepository);
    }

    @Test
    void isAutoWatchEnabled_WithMatchesAndSwitchOn_ShouldBeTrue() {
        when(filterConfigRepository.findById(FilterConfig.AUTO_WATCH_ENABLED)).thenReturn(Optional.of(autoWatch("true")));

        assertTrue(filterService.isAutoWatchEnabled(List.of("jane")));
    }

    @Test
    void isAutoWatchEnabled_WhenUnset_ShouldBeFalse() {
        when(filterConfigRepository.findById(FilterConfig.AUTO_WATCH_ENABLED)).thenReturn(Optional.empty());

        assertFalse(filterService.isAutoWatchEnabled());
    }

    @Test
    void setAutoWatchEnabled_ShouldCreateSwitchRow() {
        // Given
        when(filterConfigRepository.findById(FilterConfig.AUTO_WATCH_ENABLED)).thenReturn(Optional.empty());

        // When
        filterService.setAutoWatchEnabled(true);

        // Then
        ArgumentCaptor<FilterConfig> captor = ArgumentCaptor.forClass(FilterConfig.class);
        verify(filterConfigRepository).save(captor.capture());
        assertEquals(FilterConfig.AUTO_WATCH_ENABLED, captor.getValue().getConfigKey());
        assertEquals("true", captor.getValue().getConfigValue());
    }

    @Test
    void createOrReplace_WithExistingName_ShouldOverwriteButKeepDescription() {
        // Given
        FilterRule existing = new FilterRule();
        existing.setId("rule-1");
        existing.setName("jane");
        existing.setDescription("Jane's patches");
        existing.setCreatedBy("admin");
        when(filterRuleRepository.findByName("jane")).thenReturn(Optional.of(existing));
        when(filterRuleRepository.save(any(FilterRule.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        FilterRule saved = filterService.createOrReplace("jane", Map.of(FilterEngine.AUTHOR, "Jane"),
                null, null, true, true);

        // Then
        assertEquals("rule-1", saved.getId());
        assertTrue(saved.isExclusive());
        assertEquals("Jane's patches", saved.getDescription());
        assertEquals("admin", saved.getCreatedBy());
        assertEquals(Map.of(FilterEngine.AUTHOR, "Jane"), saved.getConditions());
    }

    @Test
    void toggle_WithoutExplicitState_ShouldFlip() {
        FilterRule rule = new FilterRule();
        rule.setName("jane");
        rule.setEnabled(true);
        when(filterRuleRepository.findByName("jane")).thenReturn(Optional.of(rule));

        assertTrue(filterService.toggle("jane", null));
        assertFalse(rule.isEnabled());
        verify(filterRuleRepository).save(rule);
    }

    @Test
    void delete_WithUnknownName_ShouldReturnFalse() {
        when(filterRuleRepository.findByName("nope")).thenReturn(Optional.empty());

        assertFalse(filterService.delete("nope"));
        verify(filterRuleRepository, never()).delete(any(FilterRule.class));
    }
}
