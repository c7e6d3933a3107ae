package com.whereq.forge.queue;

import lombok.Value;

/**
 * A received, claimed queue message
 */
@Value
public class QueueMessage {
    /**
     * Stable identifier of the underlying message
     */
    String messageId;

    /**
     * Token required to delete the message; valid until the visibility window elapses
     */
    String claimHandle;

    /**
     * Raw JSON body, see {@link QueueMessageBody}
     */
    String body;

    /**
     * How many times the message has been received, this receipt included
     */
    int receiveCount;
}
