package com.oracle.lats.core;

import com.oracle.lats.search.model.LatsEvent;

@FunctionalInterface
public interface SearchEventListener {

    void onEvent(LatsEvent event);
}
