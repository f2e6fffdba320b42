package com.trustgate.steering.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RedirectRequest(@JsonProperty("reason") String reason) {}
