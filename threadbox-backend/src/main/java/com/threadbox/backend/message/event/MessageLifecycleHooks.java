package com.threadbox.backend.message.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

import java.util.List;
import java.util.function.Consumer;

/**
 * Explicit registry of lifecycle listeners. Spring hands the listeners over
 * already sorted by {@code @Order}; the list is fixed once the context starts.
 * A listener that throws aborts the dispatch and the surrounding write.
 */
@Slf4j
@Component
public class MessageLifecycleHooks {

    private final List<MessageLifecycleListener> listeners;

    public MessageLifecycleHooks(List<MessageLifecycleListener> listeners) {
        this.listeners = List.copyOf(listeners);
        log.info("Registered {} message lifecycle listener(s): {}", this.listeners.size(),
                this.listeners.stream().map(l -> ClassUtils.getUserClass(l).getSimpleName()).toList());
    }

    public void created(MessageCreatedEvent event) {
        dispatch("created", l -> l.onCreated(event));
    }

    public void edited(MessageEditedEvent event) {
        dispatch("edited", l -> l.onEdited(event));
    }

    public void read(MessagesReadEvent event) {
        if (event.messageIds().isEmpty()) return;
        dispatch("read", l -> l.onRead(event));
    }

    public void deleting(MessagesDeletingEvent event) {
        if (event.messageIds().isEmpty()) return;
        dispatch("deleting", l -> l.onDeleting(event));
    }

    public List<MessageLifecycleListener> listeners() {
        return listeners;
    }

    private void dispatch(String phase, Consumer<MessageLifecycleListener> call) {
        for (MessageLifecycleListener listener : listeners) {
            log.debug("Dispatching '{}' to {}", phase, ClassUtils.getUserClass(listener).getSimpleName());
            call.accept(listener);
        }
    }
}
