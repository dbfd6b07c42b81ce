package com.threadbox.backend.message.event;

/**
 * Reacts to message lifecycle transitions. Implementations are Spring beans;
 * {@link MessageLifecycleHooks} calls them synchronously, in {@code @Order}
 * order, inside the transaction of the write that triggered them.
 */
public interface MessageLifecycleListener {

    default void onCreated(MessageCreatedEvent event) {
    }

    default void onEdited(MessageEditedEvent event) {
    }

    default void onRead(MessagesReadEvent event) {
    }

    default void onDeleting(MessagesDeletingEvent event) {
    }
}
