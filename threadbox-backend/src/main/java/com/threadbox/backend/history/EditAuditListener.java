package com.threadbox.backend.history;

import com.threadbox.backend.message.event.MessageEditedEvent;
import com.threadbox.backend.message.event.MessageLifecycleListener;
import com.threadbox.backend.message.event.MessagesDeletingEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@Order(10)
@RequiredArgsConstructor
public class EditAuditListener implements MessageLifecycleListener {

    private final MessageHistoryService historyService;
    private final MessageHistoryRepository historyRepository;

    @Override
    public void onEdited(MessageEditedEvent event) {
        historyService.recordEdit(
                event.message(),
                event.oldContent(),
                event.newContent(),
                event.editor(),
                event.reason()
        );
    }

    @Override
    public void onDeleting(MessagesDeletingEvent event) {
        int removed = historyRepository.deleteByMessageIdIn(event.messageIds());
        if (removed > 0) {
            log.debug("Removed {} edit history row(s) of deleted messages", removed);
        }
    }
}
