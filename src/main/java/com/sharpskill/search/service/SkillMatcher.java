package com.sharpskill.search.service;

import com.sharpskill.search.model.MatchResult;
import com.sharpskill.search.model.Query;
import com.sharpskill.search.model.SkillIndex;

import java.util.Map;

public interface SkillMatcher {

    /**
     * Raw scores keyed by document id. Documents with neither a matching
     * term nor a matching trigger phrase are absent rather than scored zero.
     */
    Map<String, MatchResult> score(SkillIndex index, Query query);
}
