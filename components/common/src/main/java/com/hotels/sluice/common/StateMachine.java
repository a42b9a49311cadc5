/*
  Copyright (C) 2013-2021 Expedia Inc.

  Licensed under the Apache License, Version 2.0 (the "License");
  you may not use this file except in compliance with the License.
  You may obtain a copy of the License at

  http://www.apache.org/licenses/LICENSE-2.0

  Unless required by applicable law or agreed to in writing, software
  distributed under the License is distributed on an "AS IS" BASIS,
  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
  See the License for the specific language governing permissions and
  limitations under the License.
 */
package com.hotels.sluice.common;

import org.slf4j.Logger;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;
import static org.slf4j.LoggerFactory.getLogger;

/**
 * A general-purpose state-machine.
 * <p>
 * Events are handled one at a time: {@link #handle(Object)} is synchronized, so the first of
 * two racing events decides the transition and the second sees the resulting state.
 *
 * @param <S> state type
 */
public final class StateMachine<S> {
    private static final Logger LOGGER = getLogger(StateMachine.class);

    private final Map<Key<S>, Function<Object, S>> transitions;
    private final BiFunction<S, Object, S> inappropriateEventHandler;
    private final StateChangeListener<S> stateChangeListener;

    private volatile S currentState;

    private StateMachine(Builder<S> builder) {
        this.currentState = requireNonNull(builder.initialState, "initial state");
        this.transitions = new HashMap<>(builder.transitions);
        this.inappropriateEventHandler = requireNonNull(builder.inappropriateEventHandler, "inappropriate event handler");
        this.stateChangeListener = builder.stateChangeListener;
    }

    public S currentState() {
        return currentState;
    }

    /**
     * Handles an event by performing the state transition and side-effects associated with the event's type.
     *
     * @param event an event
     * @return the state after the event
     */
    public synchronized S handle(Object event) {
        Function<Object, S> transition = transitions.get(new Key<>(currentState, event.getClass()));

        S oldState = currentState;
        currentState = transition == null ? inappropriateEventHandler.apply(oldState, event) : transition.apply(event);

        stateChangeListener.onStateChange(oldState, currentState, event);
        return currentState;
    }

    /**
     * Informed about every handled event.
     *
     * @param <S> state type
     */
    @FunctionalInterface
    public interface StateChangeListener<S> {
        void onStateChange(S oldState, S newState, Object event);
    }

    private static final class Key<S> {
        private final S state;
        private final Class<?> eventClass;

        private Key(S state, Class<?> eventClass) {
            this.state = state;
            this.eventClass = eventClass;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            Key<?> key = (Key<?>) o;
            return Objects.equals(state, key.state)
                    && Objects.equals(eventClass, key.eventClass);
        }

        @Override
        public int hashCode() {
            return Objects.hash(state, eventClass);
        }
    }

    /**
     * StateMachine builder.
     *
     * @param <S> state type
     */
    public static final class Builder<S> {
        private final Map<Key<S>, Function<Object, S>> transitions = new HashMap<>();
        private BiFunction<S, Object, S> inappropriateEventHandler;
        private S initialState;
        private StateChangeListener<S> stateChangeListener = (oldState, newState, event) -> {
        };

        public Builder<S> initialState(S initialState) {
            this.initialState = initialState;
            return this;
        }

        /**
         * Associates a state and event type with a function that returns a new state and possibly side-effects.
         *
         * @param state      state to transition from
         * @param eventClass event class
         * @param mapper     function that returns the new state
         * @param <E>        event type
         * @return this builder
         */
        @SuppressWarnings("unchecked")
        public <E> Builder<S> transition(S state, Class<E> eventClass, Function<E, S> mapper) {
            this.transitions.put(new Key<>(state, eventClass), event -> mapper.apply((E) event));
            return this;
        }

        /**
         * Determines how to handle an event that has no transition from the current state.
         *
         * @param mapper function that returns the new state
         * @param <E>    event type
         * @return this builder
         */
        @SuppressWarnings("unchecked")
        public <E> Builder<S> onInappropriateEvent(BiFunction<S, E, S> mapper) {
            this.inappropriateEventHandler = (state, event) -> mapper.apply(state, (E) event);
            return this;
        }

        public Builder<S> onStateChange(StateChangeListener<S> stateChangeListener) {
            this.stateChangeListener = requireNonNull(stateChangeListener);
            return this;
        }

        public Builder<S> debugTransitions(String messagePrefix) {
            return this.onStateChange((oldState, newState, event) ->
                    LOGGER.debug("{} {}: {} -> {}", messagePrefix, event, oldState, newState));
        }

        public StateMachine<S> build() {
            return new StateMachine<>(this);
        }
    }
}
