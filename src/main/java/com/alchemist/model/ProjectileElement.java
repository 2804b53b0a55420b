package com.alchemist.model;

import java.util.List;

/**
 * Element tag carried by a projectile. Drives its damage rule and feedback colour.
 */
public enum ProjectileElement {
    FIRE(DamageType.FIRE, FeedbackColor.FIRE),
    WATER(DamageType.WATER, FeedbackColor.WATER),
    VORTEX(DamageType.MAGICAL, FeedbackColor.DAMAGE),
    // Fired by ranged enemies at the player
    EMBER(DamageType.FIRE, FeedbackColor.FIRE);

    private final DamageType damageType;
    private final FeedbackColor feedbackColor;

    ProjectileElement(DamageType damageType, FeedbackColor feedbackColor) {
        this.damageType = damageType;
        this.feedbackColor = feedbackColor;
    }

    public DamageType getDamageType() { return damageType; }
    public FeedbackColor getFeedbackColor() { return feedbackColor; }

    public static ProjectileElement forElements(List<Element> elements) {
        if (elements.contains(Element.WATER)) return WATER;
        if (elements.contains(Element.FIRE) && elements.contains(Element.STONE)) return VORTEX;
        return FIRE;
    }
}
