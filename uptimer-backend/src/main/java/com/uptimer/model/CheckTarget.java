package com.uptimer.model;

import lombok.Value;

import java.util.UUID;

@Value
public class CheckTarget {
    UUID websiteId;
    String url;
}
