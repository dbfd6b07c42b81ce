package com.threadbox.backend.message;

import com.threadbox.backend.history.MessageHistoryService;
import com.threadbox.backend.history.dto.MessageHistoryDto;
import com.threadbox.backend.message.dto.CreateMessageRequest;
import com.threadbox.backend.message.dto.EditMessageRequest;
import com.threadbox.backend.message.dto.MessageDto;
import com.threadbox.backend.user.CurrentUserService;
import com.threadbox.backend.user.User;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/messages")
@RequiredArgsConstructor
public class MessageController {

    private final MessageService messageService;
    private final MessageHistoryService historyService;
    private final CurrentUserService currentUserService;

    @PostMapping
    public ResponseEntity<MessageDto> send(
            @RequestHeader(value = CurrentUserService.USER_HEADER, required = false) Long userId,
            @Valid @RequestBody CreateMessageRequest request
    ) {
        User sender = currentUserService.getCurrentUserOrThrow(userId);
        Message saved = messageService.create(sender, request.receiverId(), request.content(), request.parentMessageId());
        return ResponseEntity.status(HttpStatus.CREATED).body(MessageMapper.toDto(saved));
    }

    @GetMapping("/{id}")
    public MessageDto get(
            @PathVariable UUID id,
            @RequestHeader(value = CurrentUserService.USER_HEADER, required = false) Long userId
    ) {
        User user = currentUserService.getCurrentUserOrThrow(userId);
        return messageService.get(id, user);
    }

    @PatchMapping("/{id}")
    public MessageDto edit(
            @PathVariable UUID id,
            @RequestHeader(value = CurrentUserService.USER_HEADER, required = false) Long userId,
            @Valid @RequestBody EditMessageRequest request
    ) {
        User editor = currentUserService.getCurrentUserOrThrow(userId);
        return MessageMapper.toDto(messageService.edit(id, editor, request.content(), request.reason()));
    }

    @DeleteMapping("/{id}")
    public Map<String, Integer> delete(
            @PathVariable UUID id,
            @RequestHeader(value = CurrentUserService.USER_HEADER, required = false) Long userId
    ) {
        User user = currentUserService.getCurrentUserOrThrow(userId);
        return Map.of("deleted", messageService.delete(id, user));
    }

    @PostMapping("/{id}/read")
    public MessageDto markRead(
            @PathVariable UUID id,
            @RequestHeader(value = CurrentUserService.USER_HEADER, required = false) Long userId
    ) {
        User user = currentUserService.getCurrentUserOrThrow(userId);
        return MessageMapper.toDto(messageService.markRead(id, user));
    }

    @PostMapping("/read-all")
    public Map<String, Integer> markAllRead(
            @RequestHeader(value = CurrentUserService.USER_HEADER, required = false) Long userId
    ) {
        User user = currentUserService.getCurrentUserOrThrow(userId);
        return Map.of("updated", messageService.markAllRead(user));
    }

    @GetMapping("/sent")
    public List<MessageDto> sent(
            @RequestHeader(value = CurrentUserService.USER_HEADER, required = false) Long userId
    ) {
        User user = currentUserService.getCurrentUserOrThrow(userId);
        return messageService.sentBy(user);
    }

    @GetMapping("/conversation/{partnerId}")
    public List<MessageDto> conversation(
            @PathVariable Long partnerId,
            @RequestHeader(value = CurrentUserService.USER_HEADER, required = false) Long userId
    ) {
        User user = currentUserService.getCurrentUserOrThrow(userId);
        return messageService.conversation(user, partnerId);
    }

    @GetMapping("/{id}/history")
    public List<MessageHistoryDto> history(
            @PathVariable UUID id,
            @RequestHeader(value = CurrentUserService.USER_HEADER, required = false) Long userId
    ) {
        User user = currentUserService.getCurrentUserOrThrow(userId);
        return historyService.historyFor(id, user);
    }
}
