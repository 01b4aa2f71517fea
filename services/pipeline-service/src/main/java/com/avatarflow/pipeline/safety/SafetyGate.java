package com.avatarflow.pipeline.safety;

import com.avatarflow.pipeline.model.ContentTier;

/**
 * Classifies generated media before it can be distributed.
 */
public interface SafetyGate {

    /**
     * Classify against the band of the artifact's tier. Throws
     * {@link com.avatarflow.pipeline.exception.TransientProviderException} when the classifier is
     * temporarily unable to answer; callers retry and finally hold the artifact as borderline.
     */
    SafetyClassification classify(String binaryLocator, String promptUsed, ContentTier tier);

    default SafetyClassification classify(String binaryLocator, String promptUsed) {
        return classify(binaryLocator, promptUsed, ContentTier.BASIC);
    }
}
