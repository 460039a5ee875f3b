package com.oracle.lats.core;

import java.util.List;

/**
 * Long-term store of successful search outcomes.
 */
public interface ExperienceRepository {

    void save(AgentExperience experience);

    List<AgentExperience> findByProblemType(ProblemType problemType);
}
