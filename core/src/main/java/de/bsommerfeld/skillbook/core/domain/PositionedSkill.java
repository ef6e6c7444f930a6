package de.bsommerfeld.skillbook.core.domain;

import java.time.Instant;

/**
 * A skill as seen through one of its associations: the full skill row plus
 * the position it holds within the owner and when it was attached.
 */
public record PositionedSkill(Skill skill, int position, Instant associatedAt) {
}
