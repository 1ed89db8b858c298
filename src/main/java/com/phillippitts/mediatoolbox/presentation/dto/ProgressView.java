package com.phillippitts.mediatoolbox.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.phillippitts.mediatoolbox.domain.ProgressEvent;

/**
 * Wire shape of a {@code progress} event.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressView(
        int percent,
        String time,
        String speed,
        String status,
        String size,
        String eta
) {

    static final String NO_SPEED = "N/A";

    public static ProgressView from(ProgressEvent event) {
        String speed = event.speedOrRate() == null ? NO_SPEED : event.speedOrRate();
        return new ProgressView(event.percent(), event.elapsedTime(), speed,
                event.statusText(), event.size(), event.eta());
    }
}
