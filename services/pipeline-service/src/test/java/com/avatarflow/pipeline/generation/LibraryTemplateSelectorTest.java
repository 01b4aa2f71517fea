package com.avatarflow.pipeline.generation;

import com.avatarflow.pipeline.model.ContentTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class LibraryTemplateSelectorTest {

    private final UUID avatarId = UUID.randomUUID();
    private TemplateLibrary library;
    private LibraryTemplateSelector selector;

    @BeforeEach
    void setUp() {
        library = new TemplateLibrary();
        selector = new LibraryTemplateSelector(library);
    }

    @Test
    void should_PickFirstUnusedTemplate_When_SomeAlreadyUsed() {
        assertThat(selector.select(avatarId, ContentTier.BASIC, List.of()))
                .map(ContentTemplate::getId).contains("FIT-001");
        assertThat(selector.select(avatarId, ContentTier.BASIC, List.of("FIT-001", "FIT-002")))
                .map(ContentTemplate::getId).contains("FIT-003");
    }

    @Test
    void should_StayWithinTier_When_OtherTierTemplatesWereUsed() {
        assertThat(selector.select(avatarId, ContentTier.PREMIUM, List.of("FIT-001", "LIF-001")))
                .map(ContentTemplate::getId).contains("FAS-001");
    }

    @Test
    void should_RotateThroughTier_When_EveryTemplateHasBeenUsed() {
        List<String> used = library.byTier(ContentTier.BASIC).stream()
                .map(ContentTemplate::getId)
                .collect(Collectors.toCollection(ArrayList::new));

        ContentTemplate first = selector.select(avatarId, ContentTier.BASIC, used).orElseThrow();
        used.add(first.getId());
        ContentTemplate second = selector.select(avatarId, ContentTier.BASIC, used).orElseThrow();

        assertThat(first.getId()).isEqualTo("FIT-001");
        assertThat(second.getId()).isEqualTo("FIT-002");
    }

    @Test
    void should_ReturnEmpty_When_TierHasNoTemplates() {
        assertThat(selector.select(avatarId, ContentTier.CUSTOM, List.of())).isEmpty();
    }

    @Test
    void should_RenderPromptFromShotParts_When_TemplateIsUsed() {
        ContentTemplate template = library.findById("LIF-001").orElseThrow();

        assertThat(template.renderPrompt()).isEqualTo("woman in cozy sweater at a cafe table, "
                + "holding coffee cup, relaxed smile, warm indoor lighting, medium close-up, eye level");
        assertThat(template.params()).containsEntry("template_id", "LIF-001").containsEntry("category", "lifestyle");
    }
}
