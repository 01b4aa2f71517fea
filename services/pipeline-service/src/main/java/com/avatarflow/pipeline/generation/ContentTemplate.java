package com.avatarflow.pipeline.generation;

import com.avatarflow.pipeline.model.ContentTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A reusable shot description: subject, pose, lighting and camera angle.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentTemplate {
    private String id;
    private String category;
    private ContentTier tier;
    private String promptTemplate;
    private String poseDescription;
    private String lighting;
    private String angle;
    private List<String> tags;

    public String renderPrompt() {
        return String.join(", ", promptTemplate, poseDescription, lighting, angle);
    }

    public Map<String, String> params() {
        Map<String, String> params = new HashMap<>();
        params.put("template_id", id);
        params.put("category", category);
        params.put("lighting", lighting);
        params.put("angle", angle);
        return params;
    }
}
