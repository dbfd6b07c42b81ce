package com.threadbox.backend.message;

import java.util.UUID;

/** Id-only view of a reply edge, used when walking a subtree without loading rows. */
public interface MessageLink {
    UUID getId();
    UUID getParentId();
}
