package com.gt.resee.events;

public record ContentRemovedEvent(String learnerId, String contentId) { }
