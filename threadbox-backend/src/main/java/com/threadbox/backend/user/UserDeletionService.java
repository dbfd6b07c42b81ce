package com.threadbox.backend.user;

import com.threadbox.backend.history.MessageHistoryRepository;
import com.threadbox.backend.message.MessageLink;
import com.threadbox.backend.message.MessageRepository;
import com.threadbox.backend.message.MessageService;
import com.threadbox.backend.notification.NotificationRepository;
import com.threadbox.backend.shared.error.NotFoundException;
import com.threadbox.backend.user.dto.UserDataSummary;
import com.threadbox.backend.user.dto.UserDeletionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Removes a user and everything that would otherwise point at them. Runs as a
 * single transaction so a failure leaves no half-deleted state behind.
 * <p>
 * Afterwards no message names the user as sender or receiver, no notification
 * targets them, and no edit history row names them as editor.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserDeletionService {

    private final UserRepository userRepository;
    private final MessageRepository messageRepository;
    private final MessageService messageService;
    private final MessageHistoryRepository historyRepository;
    private final NotificationRepository notificationRepository;

    @Transactional
    public UserDeletionResult deleteUser(Long userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("User not found: " + userId));
        log.info("User deletion initiated: {} (ID: {})", user.getUsername(), userId);

        // Messages in either role, with every reply below them.
        Set<UUID> involved = new LinkedHashSet<>();
        for (MessageLink link : messageRepository.findLinksByParticipant(userId)) {
            involved.add(link.getId());
        }
        int messagesDeleted = messageService.deleteSubtrees(involved);

        // Edits the user made on messages that survive (the other participant keeps them).
        int historiesDeleted = historyRepository.deleteByEditorId(userId);
        int notificationsDeleted = notificationRepository.deleteAllByRecipient_Id(userId);

        userRepository.delete(user);
        userRepository.flush();

        log.info("User successfully deleted: {} (ID: {}); {} message(s), {} edit history row(s), {} notification(s) removed",
                user.getUsername(), userId, messagesDeleted, historiesDeleted, notificationsDeleted);
        return new UserDeletionResult(userId, user.getUsername(), messagesDeleted, historiesDeleted, notificationsDeleted);
    }

    @Transactional(readOnly = true)
    public UserDataSummary dataSummary(Long userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("User not found: " + userId));
        return new UserDataSummary(
                userId,
                user.getUsername(),
                messageRepository.countBySender_Id(userId),
                messageRepository.countByReceiver_Id(userId),
                notificationRepository.countByRecipient_Id(userId),
                historyRepository.countByEditedBy_Id(userId),
                historyRepository.countOnMessagesReceivedBy(userId)
        );
    }
}
