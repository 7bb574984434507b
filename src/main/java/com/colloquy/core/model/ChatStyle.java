package com.colloquy.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Style knobs of an agent. Missing knobs fall back to their defaults.
 */
public record ChatStyle(
    Friendliness friendliness,
    ResponseLength responseLength,
    Personality personality,
    Humor humor,
    ExpertiseLevel expertiseLevel
) implements Serializable {

    public ChatStyle {
        friendliness = friendliness != null ? friendliness : Friendliness.FRIENDLY;
        responseLength = responseLength != null ? responseLength : ResponseLength.MEDIUM;
        personality = personality != null ? personality : Personality.BALANCED;
        humor = humor != null ? humor : Humor.LIGHT;
        expertiseLevel = expertiseLevel != null ? expertiseLevel : ExpertiseLevel.EXPERT;
    }

    public static ChatStyle defaults() {
        return new ChatStyle(null, null, null, null, null);
    }

    /** One instruction sentence per knob, in a fixed order. */
    public List<String> instructions() {
        return List.of(
                friendliness.instruction(),
                responseLength.instruction(),
                personality.instruction(),
                humor.instruction(),
                expertiseLevel.instruction());
    }
}
