package com.trustgate.steering.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record BlessRequest(@JsonProperty("actor") String actor) {}
