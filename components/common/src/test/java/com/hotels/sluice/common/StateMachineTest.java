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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;

import static com.hotels.sluice.common.StateMachineTest.State.EXPECTED_RESULT;
import static com.hotels.sluice.common.StateMachineTest.State.STARTED;
import static com.hotels.sluice.common.StateMachineTest.State.TEST_FAILED;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class StateMachineTest {
    private StateMachine.Builder<State> stateMachineBuilder;

    @BeforeEach
    public void setUp() {
        stateMachineBuilder = new StateMachine.Builder<State>()
                .initialState(STARTED)
                .onInappropriateEvent((state, event) -> TEST_FAILED);
    }

    enum State {
        STARTED,
        EXPECTED_RESULT,
        TEST_FAILED
    }

    @Test
    public void startsInInitialState() {
        StateMachine<State> stateMachine = stateMachineBuilder.build();

        assertThat(stateMachine.currentState(), is(STARTED));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void handlesInappropriateEvents() {
        BiFunction<State, Object, State> inappropriateEventHandler = mock(BiFunction.class);
        when(inappropriateEventHandler.apply(any(State.class), any(Object.class))).thenReturn(EXPECTED_RESULT);

        StateMachine<State> stateMachine = stateMachineBuilder
                .onInappropriateEvent(inappropriateEventHandler)
                .build();

        State newState = stateMachine.handle(new TestEvent());

        assertThat(newState, is(EXPECTED_RESULT));
        verify(inappropriateEventHandler).apply(eq(STARTED), any(TestEvent.class));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void performsStateTransitions() {
        Function<TestEvent, State> mapper = mock(Function.class);
        when(mapper.apply(any(TestEvent.class))).thenReturn(EXPECTED_RESULT);

        StateMachine<State> stateMachine = stateMachineBuilder
                .transition(STARTED, TestEvent.class, mapper)
                .build();

        stateMachine.handle(new TestEvent());

        assertThat(stateMachine.currentState(), is(EXPECTED_RESULT));
        verify(mapper).apply(any(TestEvent.class));
    }

    @Test
    public void firstOfTwoCompetingEventsWins() {
        StateMachine<State> stateMachine = stateMachineBuilder
                .transition(STARTED, TestEvent.class, event -> EXPECTED_RESULT)
                .transition(STARTED, OtherEvent.class, event -> TEST_FAILED)
                .onInappropriateEvent((state, event) -> state)
                .build();

        stateMachine.handle(new TestEvent());
        stateMachine.handle(new OtherEvent());

        assertThat(stateMachine.currentState(), is(EXPECTED_RESULT));
    }

    @Test
    public void informsListenerOfEveryEvent() {
        List<String> changes = new ArrayList<>();
        StateMachine<State> stateMachine = stateMachineBuilder
                .transition(STARTED, TestEvent.class, event -> EXPECTED_RESULT)
                .onStateChange((oldState, newState, event) -> changes.add(oldState + "->" + newState))
                .build();

        stateMachine.handle(new TestEvent());
        stateMachine.handle(new TestEvent());

        assertThat(changes, contains("STARTED->EXPECTED_RESULT", "EXPECTED_RESULT->TEST_FAILED"));
    }

    @Test
    public void requiresInappropriateEventHandler() {
        assertThrows(NullPointerException.class, () -> new StateMachine.Builder<State>()
                .initialState(STARTED)
                .build());
    }

    private static class TestEvent {
    }

    private static class OtherEvent {
    }
}
