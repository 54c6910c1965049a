package com.ai.flashcards.service;

import com.ai.flashcards.dto.JobProgressMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Pushes job progress to {@code /topic/jobs/{jobId}}. Delivery is
 * fire-and-forget: clients that miss a message read the job status instead.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobProgressPublisher {

    /** STOMP destination prefix for job progress messages. */
    static final String TOPIC_PREFIX = "/topic/jobs/";

    private final SimpMessagingTemplate messagingTemplate;

    public void progress(String jobId, int progress, String currentTask) {
        send(jobId, JobProgressMessage.progress(jobId, progress, currentTask));
    }

    public void completed(String jobId, int cardCount) {
        send(jobId, JobProgressMessage.completed(jobId, cardCount));
    }

    public void failed(String jobId, int progress, String error) {
        send(jobId, JobProgressMessage.failed(jobId, progress, error));
    }

    private void send(String jobId, JobProgressMessage message) {
        try {
            messagingTemplate.convertAndSend(TOPIC_PREFIX + jobId, message);
        } catch (MessagingException e) {
            log.warn("Could not push {} for job {}: {}", message.getType(), jobId, e.getMessage());
        }
    }
}
