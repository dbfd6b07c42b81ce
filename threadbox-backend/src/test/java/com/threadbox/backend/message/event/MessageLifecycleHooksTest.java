package com.threadbox.backend.message.event;

import com.threadbox.backend.message.Message;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class MessageLifecycleHooksTest {

    private final List<String> calls = new ArrayList<>();

    @Test
    void shouldCallListenersInRegistrationOrder() {
        MessageLifecycleHooks hooks = new MessageLifecycleHooks(List.of(recorder("audit"), recorder("fanout")));

        hooks.created(new MessageCreatedEvent(new Message()));
        hooks.deleting(new MessagesDeletingEvent(Set.of(UUID.randomUUID())));

        assertEquals(List.of("audit:created", "fanout:created", "audit:deleting", "fanout:deleting"), calls);
    }

    @Test
    void emptyIdSetsShouldNotBeDispatched() {
        MessageLifecycleHooks hooks = new MessageLifecycleHooks(List.of(recorder("audit")));

        hooks.read(new MessagesReadEvent(1L, List.of()));
        hooks.deleting(new MessagesDeletingEvent(Set.of()));

        assertTrue(calls.isEmpty());
    }

    @Test
    void failingListenerShouldStopDispatch() {
        MessageLifecycleListener failing = new MessageLifecycleListener() {
            @Override
            public void onCreated(MessageCreatedEvent event) {
                throw new IllegalStateException("boom");
            }
        };
        MessageLifecycleHooks hooks = new MessageLifecycleHooks(List.of(failing, recorder("fanout")));

        assertThrows(IllegalStateException.class, () -> hooks.created(new MessageCreatedEvent(new Message())));
        assertTrue(calls.isEmpty());
    }

    private MessageLifecycleListener recorder(String name) {
        return new MessageLifecycleListener() {
            @Override
            public void onCreated(MessageCreatedEvent event) {
                calls.add(name + ":created");
            }

            @Override
            public void onDeleting(MessagesDeletingEvent event) {
                calls.add(name + ":deleting");
            }
        };
    }
}
