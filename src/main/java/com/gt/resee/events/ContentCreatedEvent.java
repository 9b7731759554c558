package com.gt.resee.events;

public record ContentCreatedEvent(String learnerId, String contentId) { }
