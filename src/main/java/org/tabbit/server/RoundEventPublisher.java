package org.tabbit.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;
import org.tabbit.runner.RoundEvent;
import org.tabbit.runner.RoundEventListener;

/**
 * Broadcasts round events to {@code /topic/tournaments/{id}/rounds}.
 * A failed broadcast is logged; the round change it reports is already saved.
 */
@Component
public class RoundEventPublisher implements RoundEventListener {

    private static final Logger log = LoggerFactory.getLogger(RoundEventPublisher.class);

    private final SimpMessagingTemplate messagingTemplate;

    public RoundEventPublisher(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    static String topic(String tournamentId) {
        return "/topic/tournaments/" + tournamentId + "/rounds";
    }

    @Override
    public void onRoundChanged(RoundEvent event) {
        try {
            messagingTemplate.convertAndSend(topic(event.tournamentId()), event);
        } catch (MessagingException e) {
            log.warn("Failed to send round event for tournament {}: {}", event.tournamentId(), e.getMessage());
        }
    }
}
