package com.threadbox.backend.message.event;

import com.threadbox.backend.message.MessageRepository;
import com.threadbox.backend.message.MessageService;
import com.threadbox.backend.notification.NotificationRepository;
import com.threadbox.backend.user.User;
import com.threadbox.backend.util.TestCleanupService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.core.annotation.Order;

import static org.junit.jupiter.api.Assertions.*;

/**
 * A listener that throws must take the triggering write down with it,
 * including what earlier listeners already wrote.
 */
@SpringBootTest(properties = "spring.datasource.url=jdbc:h2:mem:threadbox-rollback;MODE=PostgreSQL;DB_CLOSE_DELAY=-1;DATABASE_TO_LOWER=TRUE")
@Import(ListenerFailureRollbackTest.FailingListenerConfig.class)
class ListenerFailureRollbackTest {

    static final String POISON = "poison";

    @TestConfiguration
    static class FailingListenerConfig {
        @Bean
        @Order(30)
        MessageLifecycleListener failingListener() {
            return new MessageLifecycleListener() {
                @Override
                public void onCreated(MessageCreatedEvent event) {
                    if (POISON.equals(event.message().getContent())) {
                        throw new IllegalStateException("listener failed");
                    }
                }
            };
        }
    }

    @Autowired private MessageService messageService;
    @Autowired private MessageRepository messageRepository;
    @Autowired private NotificationRepository notificationRepository;
    @Autowired private MessageLifecycleHooks hooks;
    @Autowired private TestCleanupService cleanup;

    private User alice;
    private User bob;

    @BeforeEach
    void setUp() {
        cleanup.cleanAll();
        alice = cleanup.createUser("alice");
        bob = cleanup.createUser("bob");
    }

    @Test
    void failingListenerShouldRollBackMessageAndNotification() {
        assertEquals(3, hooks.listeners().size());

        assertThrows(IllegalStateException.class, () -> messageService.create(alice, bob.getId(), POISON, null));

        assertEquals(0, messageRepository.count());
        assertEquals(0, notificationRepository.count());
    }

    @Test
    void otherWritesShouldStillCommit() {
        messageService.create(alice, bob.getId(), "fine", null);

        assertEquals(1, messageRepository.count());
        assertEquals(1, notificationRepository.countByRecipient_Id(bob.getId()));
    }
}
