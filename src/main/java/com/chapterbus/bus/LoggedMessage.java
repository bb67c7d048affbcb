package com.chapterbus.bus;

import com.chapterbus.contract.Message;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LoggedMessage(
    @JsonProperty("sequence_number") long sequenceNumber,
    @JsonProperty("message") Message message
) {
}
