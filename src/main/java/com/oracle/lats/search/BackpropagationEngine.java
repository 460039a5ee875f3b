package com.oracle.lats.search;

import com.oracle.lats.search.model.ThoughtNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

@Slf4j
public class BackpropagationEngine {

    /**
     * Applies {@code reward} to every node from {@code node} up to the root, inclusive.
     */
    public void backpropagate(ThoughtNode node, double reward) {
        List<String> updates = log.isDebugEnabled() ? new ArrayList<>() : null;

        for (ThoughtNode current = node; current != null; current = current.getParent()) {
            double oldQ = current.getQValue();
            current.updateQValue(reward);
            if (updates != null) {
                updates.add(String.format("%s: %.2f -> %.2f", current.getId(), oldQ, current.getQValue()));
            }
        }

        if (updates != null) {
            log.debug("Backpropagation: {}", String.join(" <- ", updates));
        }
    }
}
