package com.flamingo.ai.beoarchive.archive.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** The subset of a Microsoft Graph driveItem this service reads. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DriveItem(String id, String name, String webUrl) {}
