package com.avatarflow.pipeline.generation;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Builds captions from the template: a category opener followed by the template tags as
 * hashtags. Output stays within {@link #MAX_LENGTH} so it fits every supported platform.
 */
@Component
public class TemplateHookProvider implements HookProvider {

    static final int MAX_LENGTH = 100;

    private static final Map<String, List<String>> OPENERS = Map.of(
            "fitness", List.of(
                    "No excuses today. Who's training with me?",
                    "Small wins add up. What did you crush this week?",
                    "Consistency over everything."),
            "lifestyle", List.of(
                    "Slow mornings are underrated.",
                    "Tell me your favourite way to reset.",
                    "Little moments, big mood."),
            "urban", List.of(
                    "City days hit different.",
                    "Where should I explore next?"),
            "nature", List.of(
                    "Worth every step.",
                    "Fresh air, clear head. Where's your happy place?"));

    private static final List<String> FALLBACK = List.of(
            "New post, same energy.",
            "What do you think of this one?");

    @Override
    public Optional<String> hookFor(String category, List<String> tags) {
        List<String> safeTags = tags != null ? tags : List.of();
        List<String> openers = OPENERS.getOrDefault(category, FALLBACK);
        String opener = openers.get(Math.floorMod(safeTags.hashCode(), openers.size()));

        StringBuilder caption = new StringBuilder(opener);
        for (String hashtag : hashtags(safeTags)) {
            if (caption.length() + 1 + hashtag.length() > MAX_LENGTH) {
                break;
            }
            caption.append(' ').append(hashtag);
        }
        return Optional.of(caption.toString());
    }

    private static List<String> hashtags(List<String> tags) {
        return tags.stream()
                .filter(tag -> tag != null && !tag.isBlank())
                .map(tag -> "#" + tag.replaceAll("\\s+", "").toLowerCase())
                .distinct()
                .collect(Collectors.toList());
    }
}
