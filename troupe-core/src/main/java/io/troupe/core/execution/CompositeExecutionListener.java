package io.troupe.core.execution;

import io.troupe.core.agent.AgentSpec;
import io.troupe.core.routing.CircuitTransition;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Fans events out to several listeners. A failing listener is logged and skipped; it never
 * disturbs execution or the other listeners.
 */
public final class CompositeExecutionListener implements ExecutionListener {

    private static final Logger logger =
            Logger.getLogger(CompositeExecutionListener.class.getName());

    private final List<ExecutionListener> listeners = new CopyOnWriteArrayList<>();

    public CompositeExecutionListener(ExecutionListener... listeners) {
        for (ExecutionListener listener : listeners) {
            add(listener);
        }
    }

    public void add(ExecutionListener listener) {
        if (listener != null && listener != NOOP) {
            listeners.add(listener);
        }
    }

    @Override
    public void onPlanStart(ExecutionPlan plan) {
        dispatch("onPlanStart", l -> l.onPlanStart(plan));
    }

    @Override
    public void onAgentStart(AgentSpec spec) {
        dispatch("onAgentStart", l -> l.onAgentStart(spec));
    }

    @Override
    public void onAttempt(AgentSpec spec, TierAttempt attempt) {
        dispatch("onAttempt", l -> l.onAttempt(spec, attempt));
    }

    @Override
    public void onCircuitTransition(CircuitTransition transition) {
        dispatch("onCircuitTransition", l -> l.onCircuitTransition(transition));
    }

    @Override
    public void onAgentComplete(AgentSpec spec, AgentResult result) {
        dispatch("onAgentComplete", l -> l.onAgentComplete(spec, result));
    }

    @Override
    public void onPlanComplete(ExecutionOutcome outcome) {
        dispatch("onPlanComplete", l -> l.onPlanComplete(outcome));
    }

    @Override
    public void onProgress(ProgressSnapshot snapshot) {
        dispatch("onProgress", l -> l.onProgress(snapshot));
    }

    private void dispatch(String event, Consumer<ExecutionListener> call) {
        for (ExecutionListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (RuntimeException e) {
                logger.warning(
                        "Listener "
                                + listener.getClass().getSimpleName()
                                + " failed on "
                                + event
                                + ": "
                                + e.getMessage());
            }
        }
    }
}
