package com.fixfinder.backend.notification;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Deep-link references carried by a notification; any of them may be null. */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NotificationData {

    @Column(name = "data_job_id")
    private Long jobId;

    @Column(name = "data_conversation_id")
    private Long conversationId;

    @Column(name = "data_professional_id")
    private Long professionalId;

    @Column(name = "data_message_id")
    private Long messageId;

    public static NotificationData forJob(Long jobId, Long conversationId) {
        return new NotificationData(jobId, conversationId, null, null);
    }

    public static NotificationData forMessage(Long conversationId, Long messageId) {
        return new NotificationData(null, conversationId, null, messageId);
    }
}
