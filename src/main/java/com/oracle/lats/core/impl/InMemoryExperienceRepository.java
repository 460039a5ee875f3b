package com.oracle.lats.core.impl;

import com.oracle.lats.core.AgentExperience;
import com.oracle.lats.core.ExperienceRepository;
import com.oracle.lats.core.ProblemType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

@Component
public class InMemoryExperienceRepository implements ExperienceRepository {

    private final List<AgentExperience> experiences = new CopyOnWriteArrayList<>();

    @Override
    public void save(AgentExperience experience) {
        experiences.add(experience);
    }

    @Override
    public List<AgentExperience> findByProblemType(ProblemType problemType) {
        return experiences.stream()
                .filter(e -> e.getProblemType() == problemType)
                .toList();
    }
}
