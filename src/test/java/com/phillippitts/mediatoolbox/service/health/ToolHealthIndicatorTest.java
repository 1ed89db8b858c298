package com.phillippitts.mediatoolbox.service.health;

import com.phillippitts.mediatoolbox.domain.ToolKind;
import com.phillippitts.mediatoolbox.service.job.process.ToolLocator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ToolHealthIndicatorTest {

    private ToolLocator locator;
    private ToolHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        locator = mock(ToolLocator.class);
        indicator = new ToolHealthIndicator(locator);
        when(locator.resolve(ToolKind.TRANSCODER)).thenReturn("/opt/app/ffmpeg");
        when(locator.resolve(ToolKind.DOWNLOADER)).thenReturn("yt-dlp");
    }

    @Test
    void upWhenAllToolsAvailable() {
        when(locator.isAvailable(ToolKind.TRANSCODER)).thenReturn(true);
        when(locator.isAvailable(ToolKind.DOWNLOADER)).thenReturn(true);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("transcoder", "/opt/app/ffmpeg")
                .containsEntry("downloader", "yt-dlp")
                .containsEntry("status", "All tools available");
    }

    @Test
    void downWhenAToolIsMissing() {
        when(locator.isAvailable(ToolKind.TRANSCODER)).thenReturn(true);
        when(locator.isAvailable(ToolKind.DOWNLOADER)).thenReturn(false);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails())
                .containsEntry("downloader", "not found")
                .containsEntry("status", "One or more tools missing");
    }
}
