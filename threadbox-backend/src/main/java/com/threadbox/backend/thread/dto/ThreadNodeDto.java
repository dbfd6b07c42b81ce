package com.threadbox.backend.thread.dto;

import com.threadbox.backend.user.dto.UserSummaryDto;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThreadNodeDto {
    private UUID id;
    private UUID parentMessageId;
    private UserSummaryDto sender;
    private UserSummaryDto receiver;
    private String content;
    private Instant sentAt;
    private boolean read;
    private boolean edited;
    private int editCount;
    private int depth;
    private int replyCount;     // all descendants, not just direct replies

    @Builder.Default
    private List<ThreadNodeDto> replies = new ArrayList<>();
}
