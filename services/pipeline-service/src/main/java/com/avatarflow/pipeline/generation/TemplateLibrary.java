package com.avatarflow.pipeline.generation;

import com.avatarflow.pipeline.model.ContentTier;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Built-in shot templates. BASIC templates are safe for every platform; PREMIUM ones are
 * restricted by the per-platform tier rules. CUSTOM units bring their own prompt.
 */
@Component
public class TemplateLibrary {

    private final List<ContentTemplate> templates = List.of(
            template("FIT-001", "fitness", ContentTier.BASIC,
                    "athletic woman in fitted sportswear, gym environment",
                    "mid-workout pose, lifting dumbbells, focused expression",
                    "bright gym lighting, high contrast",
                    "medium shot, slightly from below",
                    "gym", "strength", "workout"),
            template("FIT-002", "fitness", ContentTier.BASIC,
                    "woman in yoga pose, yoga studio setting",
                    "warrior pose, balanced stance, serene expression",
                    "soft natural window light",
                    "full body shot, side angle",
                    "yoga", "balance", "wellness"),
            template("FIT-003", "fitness", ContentTier.BASIC,
                    "runner in athletic wear, outdoor park setting",
                    "dynamic running pose, mid-stride, energetic",
                    "golden hour lighting, warm tones",
                    "action shot, panning background",
                    "running", "outdoor", "active"),
            template("LIF-001", "lifestyle", ContentTier.BASIC,
                    "woman in cozy sweater at a cafe table",
                    "holding coffee cup, relaxed smile",
                    "warm indoor lighting",
                    "medium close-up, eye level",
                    "cafe", "coffee", "cozy"),
            template("LIF-002", "lifestyle", ContentTier.BASIC,
                    "woman reading on a sunlit balcony",
                    "seated with book, candid moment",
                    "morning sunlight, soft shadows",
                    "wide shot, slightly above",
                    "reading", "morning", "home"),
            template("URB-001", "urban", ContentTier.BASIC,
                    "woman in streetwear on a city crosswalk",
                    "walking toward camera, confident stride",
                    "overcast daylight, even tones",
                    "full body, street level",
                    "street", "city", "style"),
            template("NAT-001", "nature", ContentTier.BASIC,
                    "hiker on a mountain trail overlook",
                    "standing with backpack, looking at horizon",
                    "clear afternoon light",
                    "wide landscape shot from behind",
                    "hiking", "mountains", "adventure"),
            template("BEA-001", "beach", ContentTier.BASIC,
                    "woman in summer dress walking on the beach",
                    "barefoot along the shoreline, hair in the wind",
                    "sunset backlight, golden tones",
                    "medium shot, side profile",
                    "beach", "summer", "sunset"),
            template("FAS-001", "fashion", ContentTier.PREMIUM,
                    "model in evening gown, studio backdrop",
                    "editorial pose, hand on hip",
                    "studio strobe with softbox",
                    "full body, three-quarter view",
                    "fashion", "editorial", "studio"),
            template("FAS-002", "fashion", ContentTier.PREMIUM,
                    "woman in tailored suit, luxury hotel lobby",
                    "leaning on marble column, poised expression",
                    "warm ambient lighting, rich shadows",
                    "medium shot, low angle",
                    "luxury", "tailoring", "hotel"),
            template("GLA-001", "glamour", ContentTier.PREMIUM,
                    "glamour portrait in satin robe, vanity mirror",
                    "over-the-shoulder glance, soft smile",
                    "hollywood vanity bulbs",
                    "close-up, mirror reflection",
                    "glamour", "portrait", "vanity"),
            template("FIT-004", "fitness", ContentTier.PREMIUM,
                    "fit woman in sports bra and leggings, home gym",
                    "post-workout mirror selfie",
                    "natural home lighting",
                    "selfie angle, upper body focus",
                    "fitness", "progress", "mirror")
    );

    public List<ContentTemplate> all() {
        return templates;
    }

    public List<ContentTemplate> byTier(ContentTier tier) {
        return Collections.unmodifiableList(templates.stream()
                .filter(t -> t.getTier() == tier)
                .collect(Collectors.toList()));
    }

    public Optional<ContentTemplate> findById(String templateId) {
        return templates.stream().filter(t -> t.getId().equals(templateId)).findFirst();
    }

    private static ContentTemplate template(String id, String category, ContentTier tier, String prompt,
                                            String pose, String lighting, String angle, String... tags) {
        return ContentTemplate.builder()
                .id(id)
                .category(category)
                .tier(tier)
                .promptTemplate(prompt)
                .poseDescription(pose)
                .lighting(lighting)
                .angle(angle)
                .tags(List.of(tags))
                .build();
    }
}
