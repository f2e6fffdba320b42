package com.trustgate.steering.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AbortResponse(@JsonProperty("aborted") int aborted) {}
