package org.areaflow.engine.catalog;

import lombok.extern.slf4j.Slf4j;
import org.areaflow.engine.action.ActionExecutor;
import org.areaflow.engine.api.exception.UnknownActionException;
import org.areaflow.engine.api.exception.UnknownReactionException;
import org.areaflow.engine.reaction.ReactionExecutor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Name-keyed registry of every action and reaction executor in the context, fixed at startup.
 * Adding an action or reaction means adding one executor bean.
 */
@Component
@Slf4j
public class ActionReactionCatalog {

    private final Map<String, ActionExecutor> actions;
    private final Map<String, ReactionExecutor> reactions;

    public ActionReactionCatalog(List<ActionExecutor> actionExecutors, List<ReactionExecutor> reactionExecutors) {
        this.actions = index(actionExecutors, ActionExecutor::name, "action");
        this.reactions = index(reactionExecutors, ReactionExecutor::name, "reaction");
        log.info("Catalog initialized: actions={}, reactions={}", actions.keySet(), reactions.keySet());
    }

    public List<ActionDefinition> getActions() {
        return actions.values().stream().map(ActionExecutor::definition).toList();
    }

    public List<ReactionDefinition> getReactions() {
        return reactions.values().stream().map(ReactionExecutor::definition).toList();
    }

    public Optional<ActionExecutor> findAction(String actionName) {
        return Optional.ofNullable(actionName).map(actions::get);
    }

    public Optional<ReactionExecutor> findReaction(String reactionName) {
        return Optional.ofNullable(reactionName).map(reactions::get);
    }

    public ActionExecutor requireAction(String actionName) {
        return findAction(actionName).orElseThrow(() -> new UnknownActionException(actionName));
    }

    public ReactionExecutor requireReaction(String reactionName) {
        return findReaction(reactionName).orElseThrow(() -> new UnknownReactionException(reactionName));
    }

    private static <T> Map<String, T> index(Collection<T> executors, Function<T, String> nameOf, String kind) {
        Map<String, T> byName = new LinkedHashMap<>();
        for (T executor : executors) {
            T previous = byName.putIfAbsent(nameOf.apply(executor), executor);
            if (previous != null) {
                throw new IllegalStateException("Duplicate " + kind + " name: " + nameOf.apply(executor));
            }
        }
        return Collections.unmodifiableMap(byName);
    }
}
