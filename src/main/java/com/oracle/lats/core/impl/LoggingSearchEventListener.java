package com.oracle.lats.core.impl;

import com.oracle.lats.core.SearchEventListener;
import com.oracle.lats.search.model.LatsEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class LoggingSearchEventListener implements SearchEventListener {

    @Override
    public void onEvent(LatsEvent event) {
        if (log.isDebugEnabled()) {
            log.debug("[{}] iteration={} node={} {}", event.getType(), event.getIteration(),
                    event.getNodeId(), event.getMetadata());
        }
    }
}
