package de.bsommerfeld.skillbook.db.search;

import de.bsommerfeld.skillbook.core.domain.Prompt;
import de.bsommerfeld.skillbook.core.domain.SearchHit;
import de.bsommerfeld.skillbook.core.domain.Skill;

import java.util.List;

/** Matches from the skill and prompt indexes for one query, each ranked on its own. */
public record CatalogSearchResult(List<SearchHit<Skill>> skills, List<SearchHit<Prompt>> prompts) {

    public CatalogSearchResult {
        skills = List.copyOf(skills);
        prompts = List.copyOf(prompts);
    }

    public int total() {
        return skills.size() + prompts.size();
    }
}
