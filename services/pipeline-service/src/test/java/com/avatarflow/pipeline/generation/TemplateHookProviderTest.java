package com.avatarflow.pipeline.generation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateHookProviderTest {

    private TemplateHookProvider hookProvider;

    @BeforeEach
    void setUp() {
        hookProvider = new TemplateHookProvider();
    }

    @Test
    void should_AppendTagsAsHashtags_When_TemplateHasTags() {
        String caption = hookProvider.hookFor("fitness", List.of("gym", "Strength Training")).orElseThrow();

        assertThat(caption).endsWith("#gym #strengthtraining");
    }

    @Test
    void should_GiveSameCaption_When_CalledTwiceWithSameTemplate() {
        List<String> tags = List.of("cafe", "coffee", "cozy");

        assertThat(hookProvider.hookFor("lifestyle", tags)).isEqualTo(hookProvider.hookFor("lifestyle", tags));
    }

    @Test
    void should_StayWithinLengthLimit_When_TagsAreMany() {
        List<String> tags = List.of("one", "two", "three", "four", "five", "six", "seven", "eight", "nine",
                "ten", "eleven", "twelve", "thirteen", "fourteen", "fifteen", "sixteen");

        assertThat(hookProvider.hookFor("urban", tags).orElseThrow())
                .hasSizeLessThanOrEqualTo(TemplateHookProvider.MAX_LENGTH);
    }

    @Test
    void should_FallBackToGenericOpener_When_CategoryIsCustom() {
        assertThat(hookProvider.hookFor("custom", List.of())).hasValueSatisfying(caption ->
                assertThat(caption).isNotBlank().doesNotContain("#"));
    }
}
