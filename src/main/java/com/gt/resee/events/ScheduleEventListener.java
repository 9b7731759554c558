package com.gt.resee.events;

import com.gt.resee.schedule.ScheduleEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

// Entry point for content lifecycle and billing events. Publishers depend on the event types only, never on how
// schedules are stored.
@Component
public class ScheduleEventListener {

    private static final Logger log = LoggerFactory.getLogger(ScheduleEventListener.class);

    private final ScheduleEngine scheduleEngine;

    @Autowired
    public ScheduleEventListener(ScheduleEngine scheduleEngine) {
        this.scheduleEngine = scheduleEngine;
    }

    @EventListener
    public void onContentCreated(ContentCreatedEvent event) {
        log.debug("Content {} created for learner {}", event.contentId(), event.learnerId());

        scheduleEngine.createInitialSchedule(event.learnerId(), event.contentId());
    }

    @EventListener
    public void onContentRemoved(ContentRemovedEvent event) {
        log.debug("Content {} removed for learner {}", event.contentId(), event.learnerId());

        scheduleEngine.deactivateSchedule(event.learnerId(), event.contentId());
    }

    @EventListener
    public void onLearnerTierChanged(LearnerTierChangedEvent event) {
        log.debug("Tier of learner {} changed from {} to {}", event.learnerId(), event.oldTier(), event.newTier());

        scheduleEngine.reconcileOnTierChange(event.learnerId(), event.oldTier(), event.newTier());
    }
}
