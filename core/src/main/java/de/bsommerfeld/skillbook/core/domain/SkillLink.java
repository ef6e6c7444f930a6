package de.bsommerfeld.skillbook.core.domain;

import java.time.Instant;

/**
 * Association row between a skill and its owner (prompt, fragment or plan),
 * carrying the skill's position within that owner.
 *
 * @param ownerId id of the prompt, fragment or plan
 */
public record SkillLink(long ownerId, long skillId, int position, Instant createdAt) {
}
