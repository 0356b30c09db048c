package com.purchasingpower.fanout.orchestrator;

/**
 * Receives run events in emission order, on the thread driving the run.
 */
@FunctionalInterface
public interface SearchEventListener {

    SearchEventListener NO_OP = event -> { };

    void onEvent(SearchEvent event);
}
